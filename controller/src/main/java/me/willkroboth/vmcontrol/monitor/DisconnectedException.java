package me.willkroboth.vmcontrol.monitor;

public class DisconnectedException extends ProtocolException {
    public DisconnectedException(String message) {
        super(message);
    }

    public DisconnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
