package me.willkroboth.vmcontrol.monitor;

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * Newline delimited transport underneath a {@link MonitorSession}.
 */
public interface MonitorChannel extends Closeable {
    /**
     * @param timeout How long to wait for a complete line
     * @return The next line without its terminator, or null once the peer has closed the stream
     * @throws SocketTimeoutException If no complete line arrived in time
     */
    String readLine(Duration timeout) throws IOException;

    /**
     * Writes {@code line} followed by a newline and flushes it.
     */
    void writeLine(String line) throws IOException;
}
