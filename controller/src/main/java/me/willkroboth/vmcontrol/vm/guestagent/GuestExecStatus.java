package me.willkroboth.vmcontrol.vm.guestagent;

// https://qemu-project.gitlab.io/qemu/interop/qemu-ga-ref.html#object-QGA-qapi-schema.GuestExecStatus
//  exitCode and signal are null while the process is running, and only one of them is set once it exits
public record GuestExecStatus(boolean exited, Integer exitCode, Integer signal, String outData, String errData) {
    public int exitCodeOr(int fallback) {
        if (exitCode != null) return exitCode;
        // Shells report death by signal N as 128 + N
        if (signal != null) return 128 + signal;
        return fallback;
    }
}
