package me.willkroboth.vmcontrol.actor;

import me.willkroboth.vmcontrol.keymapping.KeyOp;
import me.willkroboth.vmcontrol.keymapping.UnsupportedCharacterException;
import me.willkroboth.vmcontrol.monitor.DisconnectedException;
import me.willkroboth.vmcontrol.monitor.MonitorCommand;
import me.willkroboth.vmcontrol.monitor.MonitorEvent;
import me.willkroboth.vmcontrol.monitor.MonitorSession;
import me.willkroboth.vmcontrol.monitor.ProtocolException;
import me.willkroboth.vmcontrol.monitor.VmStatus;
import me.willkroboth.vmcontrol.vm.guestagent.GuestAgentClient;
import me.willkroboth.vmcontrol.vm.guestagent.GuestExecStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Drives one VM. The actor owns the VM's monitor session and works through its command channel one command at a
 * time, answering every command with exactly one event.
 * <p>
 * The first event is always {@link VmEvent.Started} and the last is always {@link VmEvent.Stopped}. Failures of
 * individual commands are reported as {@link VmEvent.Error} and do not stop the actor. It stops after
 * {@link VmCommand.Shutdown}, when its command channel is closed, or when its thread is interrupted.
 */
public class VmActor implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(VmActor.class);

    private final String vmName;
    private final MonitorSession session;
    private final GuestAgentClient guestAgent;
    private final ActorServices services;

    private final Channel<VmCommand> commands;
    private final Channel<VmEvent> events;

    private volatile ActorState state = ActorState.STARTING;
    private boolean agentConnected = false;

    /**
     * @param guestAgent Client for the VM's guest agent, or null if it cannot be reached
     */
    public VmActor(String vmName, MonitorSession session, GuestAgentClient guestAgent, ActorServices services) {
        this.vmName = vmName;
        this.session = session;
        this.guestAgent = guestAgent;
        this.services = services;

        this.commands = Channel.bounded("commands-" + vmName, services.config().commandQueueCapacity());
        this.events = Channel.unbounded("events-" + vmName);
    }

    public String vmName() {
        return vmName;
    }

    public ActorState state() {
        return state;
    }

    public VmActorHandle handle() {
        return new VmActorHandle(vmName, commands, events);
    }

    @Override
    public void run() {
        log.info("Actor for {} started", vmName);
        emit(new VmEvent.Started(vmName));
        state = ActorState.RUNNING;

        Handler handler = new Handler();
        try {
            while (state == ActorState.RUNNING) {
                VmCommand command = commands.receive();
                if (command == null) {
                    log.info("Command channel of {} closed", vmName);
                    break;
                }

                VmEvent event = dispatch(handler, command);
                if (event != null) emit(event);
            }
        } catch (InterruptedException exception) {
            log.info("Actor for {} interrupted", vmName);
            Thread.currentThread().interrupt();
        } finally {
            state = ActorState.STOPPING;

            int discarded = commands.closeAndDiscard();
            if (discarded > 0) log.info("Discarded {} queued command(s) for {}", discarded, vmName);
            session.close();

            state = ActorState.STOPPED;
            emit(new VmEvent.Stopped());
            events.close();
            log.info("Actor for {} stopped", vmName);
        }
    }

    private VmEvent dispatch(Handler handler, VmCommand command) throws InterruptedException {
        log.debug("{} <- {}", vmName, command);
        try {
            return command.accept(handler);
        } catch (InterruptedException exception) {
            throw exception;
        } catch (Exception exception) {
            String message = exception.getMessage() == null ? exception.getClass().getSimpleName() : exception.getMessage();
            log.warn("{} failed on {}: {}", vmName, command, message);
            return new VmEvent.Error(message, command);
        }
    }

    private void emit(VmEvent event) {
        log.debug("{} -> {}", vmName, event);
        events.offer(event);
    }

    private void debounce() throws InterruptedException {
        Duration debounce = services.config().keyDebounce();
        if (!debounce.isZero()) Thread.sleep(debounce.toMillis());
    }

    private int typeText(String text) throws ProtocolException, UnsupportedCharacterException, InterruptedException {
        // Compile everything first so an untypeable character sends nothing
        List<KeyOp> operations = services.keyCompiler().compile(text);

        Deque<String> held = new ArrayDeque<>();
        try {
            for (int i = 0; i < operations.size(); i++) {
                if (i > 0) debounce();
                KeyOp operation = operations.get(i);
                // A failed press may still have reached the guest, so it counts as held until released
                if (operation.pressed()) held.push(operation.code());
                MonitorCommand.keyEvent(operation.code(), operation.pressed()).run(session);
                if (!operation.pressed()) held.removeFirstOccurrence(operation.code());
            }
        } catch (ProtocolException | InterruptedException | RuntimeException exception) {
            releaseAll(held);
            throw exception;
        }
        return operations.size();
    }

    // Most recently pressed first, so modifiers come up after the keys they wrap
    private void releaseAll(Deque<String> held) {
        for (String code : held) {
            try {
                MonitorCommand.keyEvent(code, false).run(session);
            } catch (ProtocolException exception) {
                log.warn("{} could not release {}: {}", vmName, code, exception.getMessage());
            }
        }
    }

    private GuestAgentClient requireGuestAgent() throws DisconnectedException {
        if (guestAgent == null) throw new DisconnectedException("No guest agent available for " + vmName);
        return guestAgent;
    }

    private class Handler implements VmCommand.Visitor<VmEvent, Exception> {
        @Override
        public VmEvent visitSendKeys(VmCommand.SendKeys command) throws Exception {
            Integer holdTime = services.config().holdTimeMillis();
            List<String> codes = command.codes();

            for (int i = 0; i < codes.size(); i++) {
                if (i > 0) debounce();
                MonitorCommand.sendKeys(List.of(codes.get(i)), holdTime).run(session);
            }
            return new VmEvent.KeysSent(codes.size());
        }

        @Override
        public VmEvent visitSendText(VmCommand.SendText command) throws Exception {
            return new VmEvent.KeysSent(typeText(command.text()));
        }

        @Override
        public VmEvent visitQueryStatus(VmCommand.QueryStatus command) throws Exception {
            VmStatus status = MonitorCommand.queryStatus().run(session);
            for (MonitorEvent event : session.drainEvents()) {
                log.debug("{} monitor event {}", vmName, event.event());
            }
            return new VmEvent.StatusReported(status);
        }

        @Override
        public VmEvent visitWaitForAgent(VmCommand.WaitForAgent command) throws Exception {
            if (services.agentSignal().awaitConnected(vmName, command.timeout())) {
                agentConnected = true;
                return new VmEvent.AgentConnected();
            }

            if (agentConnected) {
                agentConnected = false;
                emit(new VmEvent.AgentDisconnected());
            }
            throw new TimeoutException("Agent of " + vmName + " did not connect within " + command.timeout().toMillis() + "ms");
        }

        @Override
        public VmEvent visitRunTestCase(VmCommand.RunTestCase command) throws Exception {
            String input = services.testScript().inputFor(command.testId());
            log.info("Running test {} on {}", command.testId(), vmName);

            typeText(input);
            boolean passed = services.testEvaluator().evaluate(vmName, command.testId(), input);
            log.info("Test {} on {} {}", command.testId(), vmName, passed ? "passed" : "failed");
            return new VmEvent.TestCaseCompleted(command.testId(), passed);
        }

        @Override
        public VmEvent visitExecShellCommand(VmCommand.ExecShellCommand command) throws Exception {
            GuestExecStatus status = requireGuestAgent().executeShell(command.command());
            return new VmEvent.ShellCommandCompleted(command.command(), status.exitCodeOr(-1), status.outData(), status.errData());
        }

        @Override
        public VmEvent visitReadGuestFile(VmCommand.ReadGuestFile command) throws Exception {
            return new VmEvent.FileReadCompleted(command.path(), requireGuestAgent().readFile(command.path()));
        }

        @Override
        public VmEvent visitWriteGuestFile(VmCommand.WriteGuestFile command) throws Exception {
            requireGuestAgent().writeFile(command.path(), command.content());
            return new VmEvent.FileWriteCompleted(command.path());
        }

        @Override
        public VmEvent visitGetGuestOsInfo(VmCommand.GetGuestOsInfo command) throws Exception {
            return new VmEvent.GuestOsInfoReceived(requireGuestAgent().osInfo().describe());
        }

        @Override
        public VmEvent visitShutdown(VmCommand.Shutdown command) {
            log.info("Shutting down actor for {}", vmName);
            state = ActorState.STOPPING;
            // Stopped is emitted once the loop has exited
            return null;
        }
    }
}
