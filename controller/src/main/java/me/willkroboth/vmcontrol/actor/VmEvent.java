package me.willkroboth.vmcontrol.actor;

import me.willkroboth.vmcontrol.monitor.VmStatus;

/**
 * Emitted by a {@link VmActor}. Apart from {@link Started}, {@link Stopped} and the agent notifications, every event
 * is the single outcome of one command.
 */
public interface VmEvent {
    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitStarted(Started event);

        R visitAgentConnected(AgentConnected event);

        R visitAgentDisconnected(AgentDisconnected event);

        R visitKeysSent(KeysSent event);

        R visitStatusReported(StatusReported event);

        R visitTestCaseCompleted(TestCaseCompleted event);

        R visitShellCommandCompleted(ShellCommandCompleted event);

        R visitFileReadCompleted(FileReadCompleted event);

        R visitFileWriteCompleted(FileWriteCompleted event);

        R visitGuestOsInfoReceived(GuestOsInfoReceived event);

        R visitError(Error event);

        R visitStopped(Stopped event);
    }

    record Started(String vmName) implements VmEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStarted(this);
        }
    }

    record AgentConnected() implements VmEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAgentConnected(this);
        }
    }

    record AgentDisconnected() implements VmEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAgentDisconnected(this);
        }
    }

    /**
     * @param count How many key requests were sent to the monitor
     */
    record KeysSent(int count) implements VmEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitKeysSent(this);
        }
    }

    record StatusReported(VmStatus status) implements VmEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStatusReported(this);
        }
    }

    record TestCaseCompleted(String testId, boolean passed) implements VmEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTestCaseCompleted(this);
        }
    }

    record ShellCommandCompleted(String command, int exitCode, String stdout, String stderr) implements VmEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitShellCommandCompleted(this);
        }
    }

    record FileReadCompleted(String path, String content) implements VmEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFileReadCompleted(this);
        }
    }

    record FileWriteCompleted(String path) implements VmEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFileWriteCompleted(this);
        }
    }

    record GuestOsInfoReceived(String osInfo) implements VmEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGuestOsInfoReceived(this);
        }
    }

    /**
     * @param command The command that failed
     */
    record Error(String message, VmCommand command) implements VmEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitError(this);
        }
    }

    // Always the last event of an actor
    record Stopped() implements VmEvent {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStopped(this);
        }
    }
}
