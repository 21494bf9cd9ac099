package me.willkroboth.vmcontrol.actor;

import java.time.Duration;
import java.util.List;

/**
 * Work sent to a {@link VmActor}. Commands are dispatched through {@link Visitor}, so adding a command forces every
 * visitor to handle it.
 */
public interface VmCommand {
    <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X;

    interface Visitor<R, X extends Exception> {
        R visitSendKeys(SendKeys command) throws X;

        R visitSendText(SendText command) throws X;

        R visitQueryStatus(QueryStatus command) throws X;

        R visitWaitForAgent(WaitForAgent command) throws X;

        R visitRunTestCase(RunTestCase command) throws X;

        R visitExecShellCommand(ExecShellCommand command) throws X;

        R visitReadGuestFile(ReadGuestFile command) throws X;

        R visitWriteGuestFile(WriteGuestFile command) throws X;

        R visitGetGuestOsInfo(GetGuestOsInfo command) throws X;

        R visitShutdown(Shutdown command) throws X;
    }

    // Press and release each key code in turn
    record SendKeys(List<String> codes) implements VmCommand {
        public SendKeys {
            codes = List.copyOf(codes);
        }

        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitSendKeys(this);
        }
    }

    record SendText(String text) implements VmCommand {
        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitSendText(this);
        }
    }

    record QueryStatus() implements VmCommand {
        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitQueryStatus(this);
        }
    }

    record WaitForAgent(Duration timeout) implements VmCommand {
        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitWaitForAgent(this);
        }
    }

    record RunTestCase(String testId) implements VmCommand {
        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitRunTestCase(this);
        }
    }

    // Guest agent commands
    record ExecShellCommand(String command) implements VmCommand {
        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitExecShellCommand(this);
        }
    }

    record ReadGuestFile(String path) implements VmCommand {
        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitReadGuestFile(this);
        }
    }

    record WriteGuestFile(String path, String content) implements VmCommand {
        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitWriteGuestFile(this);
        }
    }

    record GetGuestOsInfo() implements VmCommand {
        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitGetGuestOsInfo(this);
        }
    }

    record Shutdown() implements VmCommand {
        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitShutdown(this);
        }
    }

    // Factories
    static VmCommand sendKeys(String... codes) {
        return new SendKeys(List.of(codes));
    }

    static VmCommand sendText(String text) {
        return new SendText(text);
    }

    static VmCommand queryStatus() {
        return new QueryStatus();
    }

    static VmCommand waitForAgent(Duration timeout) {
        return new WaitForAgent(timeout);
    }

    static VmCommand runTestCase(String testId) {
        return new RunTestCase(testId);
    }

    static VmCommand shutdown() {
        return new Shutdown();
    }
}
