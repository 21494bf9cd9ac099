package me.willkroboth.vmcontrol.orchestrator;

import me.willkroboth.vmcontrol.monitor.ProtocolException;

public class ProtocolFailureException extends OrchestratorException {
    private final ProtocolException protocolError;

    public ProtocolFailureException(String vmName, ProtocolException protocolError) {
        super(vmName, "Monitor of " + vmName + " failed: " + protocolError.getMessage(), protocolError);
        this.protocolError = protocolError;
    }

    public ProtocolException protocolError() {
        return protocolError;
    }
}
