package me.willkroboth.vmcontrol.monitor;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.io.Closeable;
import java.util.List;

/**
 * One negotiated connection to one VM's monitor.
 * <p>
 * Sessions are not thread safe. Only one request may be outstanding at a time, which holds because a session is
 * only ever used by the actor that owns it.
 */
public interface MonitorSession extends Closeable {
    /**
     * Sends one command and waits for its response.
     *
     * @param command   The {@code execute} name
     * @param arguments The {@code arguments} object, or null to omit it
     * @return The {@code return} payload of the response
     * @throws CommandFailedException   If the response carried an {@code error}
     * @throws ProtocolParseException   If the response could not be understood
     * @throws DisconnectedException    If the connection is gone
     * @throws ProtocolTimeoutException If no response arrived in time
     */
    JsonElement execute(String command, JsonObject arguments) throws ProtocolException;

    /**
     * @return Asynchronous events that arrived while waiting for responses, oldest first. The returned events are
     * removed from the session.
     */
    List<MonitorEvent> drainEvents();

    @Override
    void close();
}
