package me.willkroboth.vmcontrol;

import me.willkroboth.vmcontrol.actor.VmCommand;
import me.willkroboth.vmcontrol.config.ControllerConfig;
import me.willkroboth.vmcontrol.keymapping.KeyCompiler;
import me.willkroboth.vmcontrol.orchestrator.Orchestrator;
import me.willkroboth.vmcontrol.orchestrator.OrchestratorException;
import me.willkroboth.vmcontrol.vm.DomainHandle;
import me.willkroboth.vmcontrol.vm.LibvirtHypervisorLink;

import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public class Main {
    // Usage: <test id> [config.json]
    //  The libvirt connection and timeouts come from the config file, see ControllerConfig#fromJson
    public static void main(String[] args) throws Exception {
        String testId = args.length > 0 ? args[0] : "hello-world";
        ControllerConfig config = loadConfig(args.length > 1 ? Path.of(args[1]) : null);

        // Connect to qemu, the orchestrator owns the connection from here on
        LibvirtHypervisorLink link = LibvirtHypervisorLink.connect(
            config.libvirtUri(), config.monitorSocketDirectory(), (int) config.guestAgentTimeout().toSeconds()
        );

        try (Orchestrator orchestrator = Orchestrator.open(link, config)) {
            // Start an actor for every running VM
            List<DomainHandle> domains = orchestrator.discover();
            for (DomainHandle domain : domains) {
                try {
                    orchestrator.spawn(domain.name());
                } catch (OrchestratorException exception) {
                    System.out.println("Skipping " + domain.name() + ": " + exception.getMessage());
                }
            }
            if (orchestrator.actorCount() == 0) {
                System.out.println("No VMs to test");
                return;
            }

            // Run the test everywhere
            Map<String, Boolean> results = orchestrator.runBatchTest(testId);
            int passed = 0;
            for (Map.Entry<String, Boolean> result : results.entrySet()) {
                System.out.println(result.getKey() + ": " + (result.getValue() ? "PASSED" : "FAILED"));
                if (result.getValue()) passed++;
            }
            System.out.println(passed + "/" + results.size() + " VMs passed " + testId);

            // Submit whatever was typed
            String enter = KeyCompiler.mapNamedKey("enter").orElseThrow();
            orchestrator.broadcast(VmCommand.sendKeys(enter));

            orchestrator.shutdownAll();
            orchestrator.waitAll();
        }
    }

    private static ControllerConfig loadConfig(Path path) throws Exception {
        if (path == null) return ControllerConfig.defaults();

        try (Reader reader = Files.newBufferedReader(path)) {
            return ControllerConfig.fromJson(reader);
        }
    }
}
