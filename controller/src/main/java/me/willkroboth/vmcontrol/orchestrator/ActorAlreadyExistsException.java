package me.willkroboth.vmcontrol.orchestrator;

public class ActorAlreadyExistsException extends OrchestratorException {
    public ActorAlreadyExistsException(String vmName) {
        super(vmName, "An actor is already registered for " + vmName);
    }
}
