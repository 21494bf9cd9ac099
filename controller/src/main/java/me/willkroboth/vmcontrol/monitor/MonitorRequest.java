package me.willkroboth.vmcontrol.monitor;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * A single QMP command with its arguments and a parser for what it returns.
 */
public class MonitorRequest<T> implements MonitorCommand<T> {
    public static final ResultParser<Void> NO_RESULT = result -> null;

    @FunctionalInterface
    public interface ResultParser<T> {
        T parse(JsonElement result);
    }

    private final String name;
    private final ResultParser<T> resultParser;
    private final JsonObject arguments = new JsonObject();

    public MonitorRequest(String name, ResultParser<T> resultParser) {
        this.name = name;
        this.resultParser = resultParser;
    }

    public String name() {
        return name;
    }

    @Override
    public T run(MonitorSession session) throws ProtocolException {
        JsonElement result = session.execute(name, arguments.size() > 0 ? arguments : null);
        try {
            return resultParser.parse(result);
        } catch (RuntimeException exception) {
            throw new ProtocolParseException("Unexpected " + name + " result: " + result, exception);
        }
    }

    public MonitorRequest<T> require(String property, JsonElement value) {
        arguments.add(property, value);
        return this;
    }

    public MonitorRequest<T> optional(String property, Number value) {
        if (value != null) arguments.addProperty(property, value);
        return this;
    }
}
