package me.willkroboth.vmcontrol.orchestrator;

/**
 * Base type for requests the orchestrator refused or could not complete for one VM.
 */
public abstract class OrchestratorException extends Exception {
    private final String vmName;

    protected OrchestratorException(String vmName, String message) {
        super(message);
        this.vmName = vmName;
    }

    protected OrchestratorException(String vmName, String message, Throwable cause) {
        super(message, cause);
        this.vmName = vmName;
    }

    public String getVmName() {
        return vmName;
    }
}
