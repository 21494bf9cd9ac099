package me.willkroboth.vmcontrol.orchestrator;

public class ActorNotFoundException extends OrchestratorException {
    public ActorNotFoundException(String vmName) {
        super(vmName, "No actor registered for " + vmName);
    }
}
