package me.willkroboth.vmcontrol.monitor;

import java.nio.file.Path;

// Location of a domain's QMP monitor socket, as resolved by the hypervisor
public record MonitorEndpoint(Path path) {
    public MonitorEndpoint {
        if (path == null) throw new IllegalArgumentException("Monitor endpoint path must be given");
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
