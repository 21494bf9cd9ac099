package me.willkroboth.vmcontrol.monitor;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Plays back a fixed list of monitor lines and records what was written. Once the script runs out the stream ends.
 */
public class ScriptedMonitorChannel implements MonitorChannel {
    private enum Failure {
        TIMEOUT,
        IO_ERROR
    }

    private final Deque<Object> script = new ArrayDeque<>();
    private final List<String> written = new ArrayList<>();
    private boolean closed = false;

    public static String greeting() {
        return "{\"QMP\": {\"version\": {\"qemu\": {\"micro\": 0, \"minor\": 2, \"major\": 8}, \"package\": \"Debian 1:8.2.2\"}, \"capabilities\": [\"oob\"]}}";
    }

    // A channel that has already sent the greeting and will accept qmp_capabilities
    public static ScriptedMonitorChannel negotiated() {
        return new ScriptedMonitorChannel()
            .line(greeting())
            .line("{\"return\": {}, \"id\": \"qmp_capabilities-0\"}");
    }

    public ScriptedMonitorChannel line(String line) {
        script.addLast(line);
        return this;
    }

    public ScriptedMonitorChannel timeout() {
        script.addLast(Failure.TIMEOUT);
        return this;
    }

    public ScriptedMonitorChannel ioError() {
        script.addLast(Failure.IO_ERROR);
        return this;
    }

    public List<String> written() {
        return written;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String readLine(Duration timeout) throws IOException {
        if (closed) throw new IOException("Channel closed");

        Object next = script.pollFirst();
        if (next == Failure.TIMEOUT) throw new SocketTimeoutException("Scripted timeout");
        if (next == Failure.IO_ERROR) throw new IOException("Scripted failure");
        return (String) next;
    }

    @Override
    public void writeLine(String line) throws IOException {
        if (closed) throw new IOException("Channel closed");
        written.add(line);
    }

    @Override
    public void close() {
        closed = true;
    }
}
