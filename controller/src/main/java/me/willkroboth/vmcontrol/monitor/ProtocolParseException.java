package me.willkroboth.vmcontrol.monitor;

public class ProtocolParseException extends ProtocolException {
    public ProtocolParseException(String message) {
        super(message);
    }

    public ProtocolParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
