package me.willkroboth.vmcontrol.vm.guestagent;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import me.willkroboth.vmcontrol.monitor.CommandFailedException;
import me.willkroboth.vmcontrol.monitor.ProtocolException;
import me.willkroboth.vmcontrol.monitor.ProtocolParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One guest agent command with its arguments, built up fluently, and a parser for its {@code return} value.
 */
public class AgentRequest<T> implements GuestAgentCommand<T> {
    private static final Logger log = LoggerFactory.getLogger(AgentRequest.class);

    public static final ResultParser<Void> NO_RESULT = result -> null;

    @FunctionalInterface
    public interface ResultParser<T> {
        T parse(JsonElement result);
    }

    private final String name;
    private final ResultParser<T> resultParser;
    private final JsonObject arguments = new JsonObject();

    public AgentRequest(String name, ResultParser<T> resultParser) {
        this.name = name;
        this.resultParser = resultParser;
    }

    public String name() {
        return name;
    }

    // https://www.qemu.org/docs/master/interop/qmp-spec.html#issuing-commands
    @Override
    public T run(GuestAgent agent, boolean verbose) throws ProtocolException {
        JsonObject request = new JsonObject();
        request.addProperty("execute", name);
        if (arguments.size() > 0) request.add("arguments", arguments);

        // Polling loops pass verbose = false so they only show up at debug level
        if (verbose) {
            log.info("Guest agent <- {}", request);
        } else {
            log.debug("Guest agent <- {}", request);
        }

        String response = agent.execute(request);
        log.debug("Guest agent -> {}", response);

        JsonElement result = unwrap(response);
        try {
            return resultParser.parse(result);
        } catch (RuntimeException exception) {
            throw new ProtocolParseException("Unexpected " + name + " result: " + result, exception);
        }
    }

    // Pulls the return value out of a response, or turns its error into an exception
    private JsonElement unwrap(String response) throws ProtocolException {
        JsonObject envelope;
        try {
            JsonElement parsed = JsonParser.parseString(response);
            if (!parsed.isJsonObject()) throw new ProtocolParseException("Guest agent answered " + name + " with " + response);
            envelope = parsed.getAsJsonObject();
        } catch (JsonParseException exception) {
            throw new ProtocolParseException("Guest agent answered " + name + " with invalid JSON: " + response, exception);
        }

        if (envelope.has("error") && envelope.get("error").isJsonObject()) {
            JsonObject error = envelope.getAsJsonObject("error");
            throw new CommandFailedException(name, text(error, "class"), text(error, "desc"));
        }
        if (!envelope.has("return")) {
            throw new ProtocolParseException("Guest agent answer to " + name + " has no return value: " + response);
        }
        return envelope.get("return");
    }

    private static String text(JsonObject object, String member) {
        JsonElement element = object.get(member);
        return element == null || element.isJsonNull() ? null : element.getAsString();
    }

    // Arguments
    /**
     * @throws IllegalArgumentException If {@code value} is null
     */
    public AgentRequest<T> require(String property, String value) {
        if (value == null) throw missing(property);
        arguments.addProperty(property, value);
        return this;
    }

    public AgentRequest<T> require(String property, Number value) {
        if (value == null) throw missing(property);
        arguments.addProperty(property, value);
        return this;
    }

    public AgentRequest<T> require(String property, CommandProperty value) {
        if (value == null) throw missing(property);
        value.addToArguments(arguments, property);
        return this;
    }

    private IllegalArgumentException missing(String property) {
        return new IllegalArgumentException(name + " needs a value for " + property);
    }

    public AgentRequest<T> optional(String property, String value) {
        if (value != null) arguments.addProperty(property, value);
        return this;
    }

    public AgentRequest<T> optional(String property, Number value) {
        if (value != null) arguments.addProperty(property, value);
        return this;
    }

    // Empty and missing arrays are both left out
    public AgentRequest<T> optional(String property, String[] values) {
        if (values == null || values.length == 0) return this;

        JsonArray array = new JsonArray();
        for (String value : values) {
            array.add(value);
        }
        arguments.add(property, array);
        return this;
    }

    // Flags default to false in the protocol, so only true is sent
    public AgentRequest<T> flag(String property, boolean value) {
        if (value) arguments.addProperty(property, true);
        return this;
    }
}
