package me.willkroboth.vmcontrol.monitor;

// The greeting banner was malformed or qmp_capabilities was rejected
public class HandshakeFailedException extends ProtocolException {
    public HandshakeFailedException(String message) {
        super(message);
    }

    public HandshakeFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
