package me.willkroboth.vmcontrol.monitor;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

// https://www.qemu.org/docs/master/interop/qmp-spec.html
public class QmpMonitorSession implements MonitorSession {
    private static final Logger log = LoggerFactory.getLogger(QmpMonitorSession.class);

    static final int MAX_RETAINED_EVENTS = 256;

    private final MonitorChannel channel;
    private final Duration timeout;
    private final QmpGreeting greeting;

    private final Deque<MonitorEvent> events = new ArrayDeque<>();
    private long nextId = 0;
    private boolean broken = false;

    private QmpMonitorSession(MonitorChannel channel, Duration timeout, QmpGreeting greeting) {
        this.channel = channel;
        this.timeout = timeout;
        this.greeting = greeting;
    }

    /**
     * Reads the server greeting and negotiates capabilities, leaving the session in command mode.
     * The channel is closed if the handshake fails.
     *
     * @param channel A freshly opened channel to the monitor
     * @param timeout Bound on every read, during the handshake and for later commands
     */
    public static QmpMonitorSession connect(MonitorChannel channel, Duration timeout) throws HandshakeFailedException {
        try {
            QmpGreeting greeting = readGreeting(channel, timeout);
            log.info("Connected to QEMU {} ({})", greeting.version(), greeting.packageName());

            QmpMonitorSession session = new QmpMonitorSession(channel, timeout, greeting);
            MonitorCommand.capabilities().run(session);
            log.info("QMP capabilities negotiated");
            return session;
        } catch (HandshakeFailedException exception) {
            closeQuietly(channel);
            throw exception;
        } catch (ProtocolException exception) {
            closeQuietly(channel);
            throw new HandshakeFailedException("Capability negotiation failed: " + exception.getMessage(), exception);
        }
    }

    private static QmpGreeting readGreeting(MonitorChannel channel, Duration timeout) throws HandshakeFailedException {
        String line;
        try {
            line = channel.readLine(timeout);
        } catch (IOException exception) {
            throw new HandshakeFailedException("Could not read QMP greeting", exception);
        }
        if (line == null) throw new HandshakeFailedException("Monitor closed before sending a greeting");

        try {
            JsonObject qmp = JsonParser.parseString(line).getAsJsonObject().getAsJsonObject("QMP");
            JsonObject version = qmp.getAsJsonObject("version");
            JsonObject qemu = version.getAsJsonObject("qemu");
            JsonArray capabilitiesJson = qmp.getAsJsonArray("capabilities");
            if (capabilitiesJson == null) throw new HandshakeFailedException("Greeting does not advertise capabilities: " + line);

            List<String> capabilities = new ArrayList<>();
            for (JsonElement capability : capabilitiesJson) {
                capabilities.add(capability.getAsString());
            }

            JsonElement packageName = version.get("package");
            return new QmpGreeting(
                qemu.get("major").getAsInt(),
                qemu.get("minor").getAsInt(),
                qemu.get("micro").getAsInt(),
                packageName == null ? "" : packageName.getAsString(),
                List.copyOf(capabilities)
            );
        } catch (RuntimeException exception) {
            // Missing members show up as NullPointerException, wrong shapes as IllegalStateException
            throw new HandshakeFailedException("Malformed QMP greeting: " + line, exception);
        }
    }

    public QmpGreeting greeting() {
        return greeting;
    }

    @Override
    public JsonElement execute(String command, JsonObject arguments) throws ProtocolException {
        if (broken) throw new DisconnectedException("Session is no longer usable, cannot run " + command);

        long sequence = nextId++;
        String id = command + "-" + sequence;
        JsonObject request = new JsonObject();
        request.addProperty("execute", command);
        if (arguments != null) request.add("arguments", arguments);
        request.addProperty("id", id);

        String prompt = request.toString();
        log.debug("Sending QMP command: {}", prompt);
        try {
            channel.writeLine(prompt);
        } catch (IOException exception) {
            broken = true;
            throw new DisconnectedException("Could not send " + command, exception);
        }

        JsonObject response;
        while (true) {
            response = readResponse(command);
            log.debug("Received {}", response);

            JsonElement responseId = response.get("id");
            if (responseId == null) break;
            String answered = responseId.isJsonPrimitive() ? responseId.getAsString() : responseId.toString();
            if (id.equals(answered)) break;

            // Left behind when an earlier command failed before its own response was read
            if (answersEarlierRequest(answered, sequence)) {
                log.debug("Discarding late response to {}", answered);
                continue;
            }
            throw new ProtocolParseException("Response id " + responseId + " does not match request id " + id);
        }

        JsonElement error = response.get("error");
        JsonElement result = response.get("return");
        if (error != null && result != null) {
            throw new ProtocolParseException("Response carries both return and error: " + response);
        }
        if (error != null) {
            if (!error.isJsonObject()) throw new ProtocolParseException("Malformed error object: " + response);
            JsonObject errorObject = error.getAsJsonObject();
            throw new CommandFailedException(command, stringMember(errorObject, "class"), stringMember(errorObject, "desc"));
        }
        if (result == null) {
            throw new ProtocolParseException("Response carries neither return nor error: " + response);
        }
        return result;
    }

    // Ids are <command>-<sequence>, and command names may themselves contain dashes
    private static boolean answersEarlierRequest(String answered, long sequence) {
        int dash = answered.lastIndexOf('-');
        if (dash < 0) return false;
        try {
            return Long.parseLong(answered.substring(dash + 1)) < sequence;
        } catch (NumberFormatException exception) {
            return false;
        }
    }

    private JsonObject readResponse(String command) throws ProtocolException {
        while (true) {
            String line;
            try {
                line = channel.readLine(timeout);
            } catch (SocketTimeoutException exception) {
                // The response may still arrive later and would be mistaken for the next command's
                broken = true;
                throw new ProtocolTimeoutException(command, timeout);
            } catch (IOException exception) {
                broken = true;
                throw new DisconnectedException("Lost monitor connection waiting for " + command, exception);
            }
            if (line == null) {
                broken = true;
                throw new DisconnectedException("Monitor closed the connection waiting for " + command);
            }
            if (line.isBlank()) continue;

            JsonObject message;
            try {
                JsonElement parsed = JsonParser.parseString(line);
                if (!parsed.isJsonObject()) throw new ProtocolParseException("Expected a JSON object but got: " + line);
                message = parsed.getAsJsonObject();
            } catch (JsonParseException exception) {
                throw new ProtocolParseException("Could not parse monitor message: " + line, exception);
            }

            if (message.has("event")) {
                setAside(message);
                continue;
            }
            return message;
        }
    }

    private void setAside(JsonObject message) throws ProtocolParseException {
        try {
            retain(message);
        } catch (RuntimeException exception) {
            // Wrong member types show up as IllegalStateException, UnsupportedOperationException or NumberFormatException
            throw new ProtocolParseException("Malformed monitor event: " + message, exception);
        }
    }

    private void retain(JsonObject message) {
        JsonObject data = message.has("data") && message.get("data").isJsonObject()
            ? message.getAsJsonObject("data")
            : new JsonObject();

        long seconds = 0;
        long microseconds = 0;
        JsonElement timestamp = message.get("timestamp");
        if (timestamp != null && timestamp.isJsonObject()) {
            JsonObject timestampObject = timestamp.getAsJsonObject();
            if (timestampObject.has("seconds")) seconds = timestampObject.get("seconds").getAsLong();
            if (timestampObject.has("microseconds")) microseconds = timestampObject.get("microseconds").getAsLong();
        }

        MonitorEvent event = new MonitorEvent(message.get("event").getAsString(), data, seconds, microseconds);
        log.debug("Set aside QMP event {}", event.event());

        if (events.size() == MAX_RETAINED_EVENTS) events.removeFirst();
        events.addLast(event);
    }

    private static String stringMember(JsonObject object, String member) {
        JsonElement element = object.get(member);
        if (element == null || element.isJsonNull()) return null;
        return element.isJsonPrimitive() ? element.getAsString() : element.toString();
    }

    @Override
    public List<MonitorEvent> drainEvents() {
        List<MonitorEvent> drained = new ArrayList<>(events);
        events.clear();
        return drained;
    }

    @Override
    public void close() {
        broken = true;
        closeQuietly(channel);
    }

    private static void closeQuietly(MonitorChannel channel) {
        try {
            channel.close();
        } catch (IOException exception) {
            log.warn("Could not close monitor channel cleanly", exception);
        }
    }
}
