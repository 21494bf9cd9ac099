package me.willkroboth.vmcontrol.monitor;

// https://qemu-project.gitlab.io/qemu/interop/qemu-qmp-ref.html#command-QMP-run-state.query-status
public record VmStatus(String status, boolean running) {
}
