package me.willkroboth.vmcontrol.vm;

/**
 * Descriptor of one libvirt domain.
 *
 * @param id The hypervisor id, or -1 while the domain is not running
 */
public record DomainHandle(String name, String uuid, int id, boolean active) {
}
