package me.willkroboth.vmcontrol.monitor;

/**
 * Base type for every failure of a QMP or guest agent exchange.
 */
public abstract class ProtocolException extends Exception {
    protected ProtocolException(String message) {
        super(message);
    }

    protected ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
