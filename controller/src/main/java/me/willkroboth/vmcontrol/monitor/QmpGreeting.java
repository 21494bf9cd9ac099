package me.willkroboth.vmcontrol.monitor;

import java.util.List;

// https://www.qemu.org/docs/master/interop/qmp-spec.html#server-greeting
public record QmpGreeting(int major, int minor, int micro, String packageName, List<String> capabilities) {
    public String version() {
        return major + "." + minor + "." + micro;
    }
}
