package me.willkroboth.vmcontrol.orchestrator;

import me.willkroboth.vmcontrol.actor.ActorServices;
import me.willkroboth.vmcontrol.actor.ChannelClosedException;
import me.willkroboth.vmcontrol.actor.GuestAgentPingSignal;
import me.willkroboth.vmcontrol.actor.VmActor;
import me.willkroboth.vmcontrol.actor.VmActorHandle;
import me.willkroboth.vmcontrol.actor.VmCommand;
import me.willkroboth.vmcontrol.actor.VmEvent;
import me.willkroboth.vmcontrol.config.ControllerConfig;
import me.willkroboth.vmcontrol.monitor.MonitorEndpoint;
import me.willkroboth.vmcontrol.monitor.MonitorSession;
import me.willkroboth.vmcontrol.monitor.ProtocolException;
import me.willkroboth.vmcontrol.vm.DomainHandle;
import me.willkroboth.vmcontrol.vm.HypervisorException;
import me.willkroboth.vmcontrol.vm.HypervisorLink;
import me.willkroboth.vmcontrol.vm.guestagent.GuestAgentClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps one {@link VmActor} per VM and fans commands out to them.
 * <p>
 * Registry changes ({@link #spawn}, {@link #remove}, {@link #waitAll}) are serialized. Sending is safe from any
 * thread.
 */
public class Orchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final HypervisorLink link;
    private final MonitorSessionFactory sessionFactory;
    private final ActorServices services;
    private final ExecutorService executor;

    private final Map<String, VmActorHandle> actors = new ConcurrentHashMap<>();
    // Spawn order, also holds actors that were removed but not yet joined
    private final List<ActorTask> tasks = new ArrayList<>();
    // Verdicts an actor still owes for tests that timed out; they are skipped when they finally arrive
    private final Map<OwedVerdict, Integer> owedVerdicts = new ConcurrentHashMap<>();

    private record ActorTask(String vmName, VmActorHandle handle, Future<?> future) {
    }

    public Orchestrator(HypervisorLink link, MonitorSessionFactory sessionFactory, ActorServices services) {
        this.link = link;
        this.sessionFactory = sessionFactory;
        this.services = services;

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "vm-actor-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public static Orchestrator create(HypervisorLink link, ActorServices services) {
        return new Orchestrator(link, MonitorSessionFactory.unixSocket(services.config().commandTimeout()), services);
    }

    /**
     * Builds the default services around {@code link}, which this orchestrator then owns. The link is closed here if
     * setup fails, and by {@link #close()} otherwise.
     */
    public static Orchestrator open(HypervisorLink link, ControllerConfig config) {
        try {
            ActorServices services = ActorServices.create(config, new GuestAgentPingSignal(link, config.execPollInterval()));
            return create(link, services);
        } catch (RuntimeException exception) {
            try {
                link.close();
            } catch (HypervisorException closeFailure) {
                exception.addSuppressed(closeFailure);
            }
            throw exception;
        }
    }

    // Discovery
    public List<DomainHandle> discover() throws HypervisorException {
        List<DomainHandle> domains = link.listActive();
        for (DomainHandle domain : domains) {
            log.info("Discovered {} (uuid {}, id {})", domain.name(), domain.uuid(), domain.id());
        }
        return domains;
    }

    // Lifecycle
    /**
     * Connects to the monitor of {@code vmName} and starts an actor for it. Nothing is registered if any step fails.
     *
     * @throws ActorAlreadyExistsException If an actor for {@code vmName} is already registered
     * @throws VmNotFoundException         If the hypervisor has no domain called {@code vmName}
     * @throws ProtocolFailureException    If the monitor session could not be opened
     * @throws HypervisorException         If the hypervisor could not be queried
     */
    public synchronized VmActorHandle spawn(String vmName) throws OrchestratorException, HypervisorException {
        if (actors.containsKey(vmName)) throw new ActorAlreadyExistsException(vmName);
        log.info("Spawning actor for {}", vmName);

        DomainHandle domain = link.lookup(vmName).orElseThrow(() -> new VmNotFoundException(vmName));
        MonitorEndpoint endpoint = link.monitorEndpoint(domain);
        log.info("Monitor of {} is at {}", vmName, endpoint.path());

        ControllerConfig config = services.config();
        GuestAgentClient guestAgent = link.guestAgent(domain)
            .map(agent -> new GuestAgentClient(agent, config.execPollInterval(), config.guestAgentTimeout()))
            .orElse(null);

        MonitorSession session;
        try {
            session = sessionFactory.open(endpoint);
        } catch (ProtocolException exception) {
            throw new ProtocolFailureException(vmName, exception);
        }

        VmActor actor = new VmActor(vmName, session, guestAgent, services);
        VmActorHandle handle = actor.handle();
        Future<?> future;
        try {
            future = executor.submit(() -> runNamed(actor));
        } catch (RuntimeException exception) {
            session.close();
            throw exception;
        }

        actors.put(vmName, handle);
        tasks.add(new ActorTask(vmName, handle, future));
        return handle;
    }

    private static void runNamed(VmActor actor) {
        Thread thread = Thread.currentThread();
        String poolName = thread.getName();
        thread.setName("vm-actor-" + actor.vmName());
        try {
            actor.run();
        } finally {
            thread.setName(poolName);
        }
    }

    /**
     * Deregisters the actor for {@code vmName} and closes its command channel. The actor finishes the commands it
     * already has and then stops. {@link #waitAll()} still joins it.
     *
     * @return The removed handle, whose events can still be read
     */
    public synchronized VmActorHandle remove(String vmName) throws ActorNotFoundException {
        VmActorHandle handle = actors.remove(vmName);
        if (handle == null) throw new ActorNotFoundException(vmName);

        log.info("Removing actor for {}", vmName);
        handle.closeCommands();
        forgetOwedVerdicts(handle);
        return handle;
    }

    // Commands
    /**
     * Queues {@code command} for one actor without waiting for it to be processed.
     *
     * @throws ActorNotFoundException    If no actor is registered for {@code vmName}
     * @throws CommandRejectedException If the actor's queue is full or it has stopped
     */
    public void send(String vmName, VmCommand command) throws OrchestratorException {
        VmActorHandle handle = actors.get(vmName);
        if (handle == null) throw new ActorNotFoundException(vmName);
        send(handle, command);
    }

    private static void send(VmActorHandle handle, VmCommand command) throws CommandRejectedException {
        try {
            if (!handle.send(command)) throw new CommandRejectedException(handle.vmName(), "command queue is full");
        } catch (ChannelClosedException exception) {
            throw new CommandRejectedException(handle.vmName(), "actor no longer accepts commands", exception);
        }
    }

    /**
     * Sends {@code command} to every registered actor. A failure for one actor does not stop the others.
     *
     * @throws OrchestratorException The first failure, once every actor was tried
     */
    public void broadcast(VmCommand command) throws OrchestratorException {
        OrchestratorException firstFailure = null;
        for (VmActorHandle handle : registeredHandles()) {
            log.debug("Sending {} to {}", command, handle.vmName());
            try {
                send(handle, command);
            } catch (OrchestratorException exception) {
                log.warn("Could not send {} to {}: {}", command, handle.vmName(), exception.getMessage());
                if (firstFailure == null) firstFailure = exception;
            }
        }
        if (firstFailure != null) throw firstFailure;
    }

    /**
     * Runs the test {@code testId} on every registered actor and collects the verdicts. An actor that could not be
     * sent the test, reports an error for it, stops, or does not answer within the batch timeout fails the test.
     *
     * @return A verdict for every actor that was registered when this was called, in spawn order
     */
    public Map<String, Boolean> runBatchTest(String testId) throws InterruptedException {
        log.info("Running batch test {}", testId);
        List<VmActorHandle> handles = registeredHandles();
        Map<String, Boolean> results = new LinkedHashMap<>();

        List<VmActorHandle> running = new ArrayList<>();
        VmCommand command = VmCommand.runTestCase(testId);
        for (VmActorHandle handle : handles) {
            try {
                send(handle, command);
                running.add(handle);
            } catch (CommandRejectedException exception) {
                log.warn("Could not start test {} on {}: {}", testId, handle.vmName(), exception.getMessage());
                results.put(handle.vmName(), false);
            }
        }

        long deadline = System.nanoTime() + services.config().batchTestTimeout().toNanos();
        TestVerdict verdict = new TestVerdict(testId);
        for (VmActorHandle handle : running) {
            results.put(handle.vmName(), awaitVerdict(handle, verdict, deadline));
        }

        // Keep the spawn order for the results
        Map<String, Boolean> ordered = new LinkedHashMap<>();
        for (VmActorHandle handle : handles) {
            ordered.put(handle.vmName(), results.get(handle.vmName()));
        }
        log.info("Batch test {} finished: {}", testId, ordered);
        return ordered;
    }

    private boolean awaitVerdict(VmActorHandle handle, TestVerdict verdict, long deadline) throws InterruptedException {
        OwedVerdict owed = new OwedVerdict(handle, verdict.testId);
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("{} did not finish test {} in time", handle.vmName(), verdict.testId);
                owedVerdicts.merge(owed, 1, Integer::sum);
                return false;
            }

            VmEvent event = handle.pollEvent(Duration.ofNanos(remaining));
            if (event == null) {
                if (handle.eventsExhausted()) return false;
                continue;
            }

            Outcome outcome = event.accept(verdict);
            if (outcome == null) continue;
            if (outcome == Outcome.STOPPED) return false;

            Integer owing = owedVerdicts.get(owed);
            if (owing != null) {
                if (owing == 1) {
                    owedVerdicts.remove(owed);
                } else {
                    owedVerdicts.put(owed, owing - 1);
                }
                log.debug("Skipping late verdict on {} for an earlier run of {}", handle.vmName(), verdict.testId);
                continue;
            }
            return outcome == Outcome.PASSED;
        }
    }

    private void forgetOwedVerdicts(VmActorHandle handle) {
        owedVerdicts.keySet().removeIf(owed -> owed.handle() == handle);
    }

    // Handles compare by identity, so a respawned VM starts with nothing owed
    private record OwedVerdict(VmActorHandle handle, String testId) {
    }

    private enum Outcome {
        PASSED, FAILED, STOPPED
    }

    // Answers null for events that do not decide the test
    private static final class TestVerdict implements VmEvent.Visitor<Outcome> {
        private final String testId;

        private TestVerdict(String testId) {
            this.testId = testId;
        }

        @Override
        public Outcome visitTestCaseCompleted(VmEvent.TestCaseCompleted event) {
            if (!event.testId().equals(testId)) return null;
            return event.passed() ? Outcome.PASSED : Outcome.FAILED;
        }

        @Override
        public Outcome visitError(VmEvent.Error event) {
            if (event.command() instanceof VmCommand.RunTestCase runTestCase && runTestCase.testId().equals(testId)) {
                log.warn("Test {} failed with an error: {}", testId, event.message());
                return Outcome.FAILED;
            }
            return null;
        }

        @Override
        public Outcome visitStopped(VmEvent.Stopped event) {
            return Outcome.STOPPED;
        }

        @Override
        public Outcome visitStarted(VmEvent.Started event) {
            return null;
        }

        @Override
        public Outcome visitAgentConnected(VmEvent.AgentConnected event) {
            return null;
        }

        @Override
        public Outcome visitAgentDisconnected(VmEvent.AgentDisconnected event) {
            return null;
        }

        @Override
        public Outcome visitKeysSent(VmEvent.KeysSent event) {
            return null;
        }

        @Override
        public Outcome visitStatusReported(VmEvent.StatusReported event) {
            return null;
        }

        @Override
        public Outcome visitShellCommandCompleted(VmEvent.ShellCommandCompleted event) {
            return null;
        }

        @Override
        public Outcome visitFileReadCompleted(VmEvent.FileReadCompleted event) {
            return null;
        }

        @Override
        public Outcome visitFileWriteCompleted(VmEvent.FileWriteCompleted event) {
            return null;
        }

        @Override
        public Outcome visitGuestOsInfoReceived(VmEvent.GuestOsInfoReceived event) {
            return null;
        }
    }

    /**
     * Asks every registered actor that still accepts commands to shut down. Use {@link #waitAll()} to wait for them.
     *
     * @throws OrchestratorException The first actor that could not be sent the request
     */
    public void shutdownAll() throws OrchestratorException {
        log.info("Shutting down {} actor(s)", actors.size());
        OrchestratorException firstFailure = null;
        for (VmActorHandle handle : registeredHandles()) {
            if (!handle.acceptsCommands()) continue;
            try {
                send(handle, VmCommand.shutdown());
            } catch (CommandRejectedException exception) {
                log.warn("Could not shut down {}: {}", handle.vmName(), exception.getMessage());
                if (firstFailure == null) firstFailure = exception;
            }
        }
        if (firstFailure != null) throw firstFailure;
    }

    /**
     * Waits for every actor to stop, in spawn order, and deregisters them.
     *
     * @throws ExecutionException The first actor whose thread failed, once every actor was joined
     */
    public void waitAll() throws InterruptedException, ExecutionException {
        List<ActorTask> joining;
        synchronized (this) {
            joining = new ArrayList<>(tasks);
        }
        log.info("Waiting for {} actor(s)", joining.size());

        ExecutionException firstFailure = null;
        for (ActorTask task : joining) {
            try {
                task.future().get();
            } catch (ExecutionException exception) {
                log.error("Actor for {} failed", task.vmName(), exception.getCause());
                if (firstFailure == null) firstFailure = exception;
            }

            synchronized (this) {
                tasks.remove(task);
                actors.remove(task.vmName(), task.handle());
            }
            forgetOwedVerdicts(task.handle());
        }

        log.info("All actors finished");
        if (firstFailure != null) throw firstFailure;
    }

    // Inspection
    public Optional<VmActorHandle> handle(String vmName) {
        return Optional.ofNullable(actors.get(vmName));
    }

    /**
     * @return Names of the registered actors in spawn order
     */
    public List<String> actorNames() {
        List<String> names = new ArrayList<>();
        for (VmActorHandle handle : registeredHandles()) {
            names.add(handle.vmName());
        }
        return names;
    }

    public int actorCount() {
        return actors.size();
    }

    private synchronized List<VmActorHandle> registeredHandles() {
        List<VmActorHandle> handles = new ArrayList<>();
        for (ActorTask task : tasks) {
            if (actors.get(task.vmName()) == task.handle()) handles.add(task.handle());
        }
        return handles;
    }

    /**
     * Closes every actor's command channel, stops the actor threads and closes the hypervisor link.
     */
    @Override
    public void close() throws HypervisorException {
        synchronized (this) {
            for (ActorTask task : tasks) {
                task.handle().closeCommands();
            }
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(services.config().commandTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Actors did not stop in time, interrupting them");
                executor.shutdownNow();
            }
        } catch (InterruptedException exception) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        link.close();
    }
}
