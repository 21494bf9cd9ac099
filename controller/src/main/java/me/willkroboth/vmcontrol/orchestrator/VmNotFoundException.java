package me.willkroboth.vmcontrol.orchestrator;

// The hypervisor does not know a domain with this name
public class VmNotFoundException extends OrchestratorException {
    public VmNotFoundException(String vmName) {
        super(vmName, "No domain named " + vmName);
    }
}
