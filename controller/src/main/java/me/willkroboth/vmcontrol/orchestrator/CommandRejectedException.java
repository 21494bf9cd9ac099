package me.willkroboth.vmcontrol.orchestrator;

// The actor's command queue was full or the actor has stopped accepting commands
public class CommandRejectedException extends OrchestratorException {
    public CommandRejectedException(String vmName, String reason) {
        super(vmName, "Command for " + vmName + " rejected: " + reason);
    }

    public CommandRejectedException(String vmName, String reason, Throwable cause) {
        super(vmName, "Command for " + vmName + " rejected: " + reason, cause);
    }
}
