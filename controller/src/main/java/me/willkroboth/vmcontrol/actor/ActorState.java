package me.willkroboth.vmcontrol.actor;

// Only ever moves forward
public enum ActorState {
    STARTING,
    RUNNING,
    STOPPING,
    STOPPED
}
