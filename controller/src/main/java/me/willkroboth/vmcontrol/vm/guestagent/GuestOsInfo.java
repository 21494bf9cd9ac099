package me.willkroboth.vmcontrol.vm.guestagent;

import java.util.Locale;

// https://qemu-project.gitlab.io/qemu/interop/qemu-ga-ref.html#object-QGA-qapi-schema.GuestOSInfo
//  Every field is optional in the protocol
public record GuestOsInfo(String id, String name, String prettyName, String version, String kernelRelease, String machine) {
    public boolean isWindows() {
        if ("mswindows".equals(id)) return true;
        return name != null && name.toLowerCase(Locale.ROOT).contains("windows");
    }

    public String describe() {
        if (prettyName != null) return prettyName;
        if (name != null) return version == null ? name : name + " " + version;
        return id == null ? "unknown" : id;
    }
}
