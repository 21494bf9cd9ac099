package me.willkroboth.vmcontrol.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link MonitorChannel} over a Unix domain socket. The socket is non-blocking so that reads can be bounded with a
 * {@link Selector}, which plain blocking {@link SocketChannel}s do not allow.
 */
public class UnixSocketMonitorChannel implements MonitorChannel {
    private static final Logger log = LoggerFactory.getLogger(UnixSocketMonitorChannel.class);

    private final MonitorEndpoint endpoint;
    private final SocketChannel channel;
    private final Selector selector;

    private final ByteBuffer readBuffer = ByteBuffer.allocate(8192);
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private boolean endOfStream = false;

    private UnixSocketMonitorChannel(MonitorEndpoint endpoint, SocketChannel channel, Selector selector) {
        this.endpoint = endpoint;
        this.channel = channel;
        this.selector = selector;
    }

    public static UnixSocketMonitorChannel open(MonitorEndpoint endpoint) throws IOException {
        log.info("Connecting to monitor socket {}", endpoint);
        SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            channel.connect(UnixDomainSocketAddress.of(endpoint.path()));
            channel.configureBlocking(false);

            Selector selector = Selector.open();
            channel.register(selector, SelectionKey.OP_READ);
            return new UnixSocketMonitorChannel(endpoint, channel, selector);
        } catch (IOException exception) {
            channel.close();
            throw exception;
        }
    }

    @Override
    public String readLine(Duration timeout) throws IOException {
        long deadline = System.nanoTime() + timeout.toNanos();

        while (true) {
            // A previous read may already hold a complete line
            String line = takeLine();
            if (line != null) return line;
            if (endOfStream) return null;

            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMillis <= 0) {
                throw new SocketTimeoutException("Timed out reading from " + endpoint);
            }

            selector.select(remainingMillis);
            selector.selectedKeys().clear();

            readBuffer.clear();
            int read;
            while ((read = channel.read(readBuffer)) > 0) {
                pending.write(readBuffer.array(), 0, read);
                readBuffer.clear();
            }
            if (read < 0) endOfStream = true;
        }
    }

    private String takeLine() {
        byte[] bytes = pending.toByteArray();
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] != '\n') continue;

            int end = i > 0 && bytes[i - 1] == '\r' ? i - 1 : i;
            String line = new String(bytes, 0, end, StandardCharsets.UTF_8);

            pending.reset();
            pending.write(bytes, i + 1, bytes.length - i - 1);
            return line;
        }
        return null;
    }

    @Override
    public void writeLine(String line) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap((line + "\n").getBytes(StandardCharsets.UTF_8));

        // Non-blocking writes may be partial, so wait for the socket to drain
        try (Selector writeSelector = Selector.open()) {
            SelectionKey key = channel.register(writeSelector, SelectionKey.OP_WRITE);
            while (buffer.hasRemaining()) {
                if (channel.write(buffer) == 0) {
                    writeSelector.select();
                    writeSelector.selectedKeys().clear();
                }
            }
            key.cancel();
        }
    }

    @Override
    public void close() throws IOException {
        log.debug("Closing monitor socket {}", endpoint);
        try {
            selector.close();
        } finally {
            channel.close();
        }
    }
}
