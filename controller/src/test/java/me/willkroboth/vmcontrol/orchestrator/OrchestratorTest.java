package me.willkroboth.vmcontrol.orchestrator;

import me.willkroboth.vmcontrol.actor.ActorServices;
import me.willkroboth.vmcontrol.actor.AgentSignal;
import me.willkroboth.vmcontrol.actor.TestEvaluator;
import me.willkroboth.vmcontrol.actor.TestScript;
import me.willkroboth.vmcontrol.actor.VmActorHandle;
import me.willkroboth.vmcontrol.actor.VmCommand;
import me.willkroboth.vmcontrol.actor.VmEvent;
import me.willkroboth.vmcontrol.config.ControllerConfig;
import me.willkroboth.vmcontrol.keymapping.KeyCompiler;
import me.willkroboth.vmcontrol.keymapping.KeyboardLayout;
import me.willkroboth.vmcontrol.monitor.HandshakeFailedException;
import me.willkroboth.vmcontrol.monitor.MonitorEndpoint;
import me.willkroboth.vmcontrol.monitor.RecordingMonitorSession;
import me.willkroboth.vmcontrol.vm.DomainHandle;
import me.willkroboth.vmcontrol.vm.FakeHypervisorLink;
import me.willkroboth.vmcontrol.vm.HypervisorException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class OrchestratorTest {
    private static final Duration WAIT = Duration.ofSeconds(5);

    private FakeHypervisorLink link;
    private final Map<String, RecordingMonitorSession> sessions = new ConcurrentHashMap<>();
    private final Set<String> failingHandshakes = ConcurrentHashMap.newKeySet();
    private final Set<String> failingMonitors = ConcurrentHashMap.newKeySet();

    private ControllerConfig config;
    private AgentSignal signal;
    private TestEvaluator evaluator;
    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        link = new FakeHypervisorLink()
            .addRunning("vm-a")
            .addRunning("vm-b")
            .addRunning("vm-c")
            .addStopped("vm-off");
        config = ControllerConfig.defaults()
            .withKeyDebounce(Duration.ZERO)
            .withBatchTestTimeout(Duration.ofSeconds(5))
            .withCommandTimeout(Duration.ofSeconds(1));
        signal = (vmName, timeout) -> true;
        evaluator = TestEvaluator.typedSuccessfully();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (orchestrator != null) orchestrator.close();
    }

    private Orchestrator orchestrator() {
        ActorServices services = new ActorServices(
            new KeyCompiler(KeyboardLayout.EN_US), signal, TestScript.constant("ok"), evaluator, config
        );
        orchestrator = new Orchestrator(link, this::openSession, services);
        return orchestrator;
    }

    private RecordingMonitorSession openSession(MonitorEndpoint endpoint) throws HandshakeFailedException {
        String fileName = endpoint.path().getFileName().toString();
        String vmName = fileName.substring(0, fileName.length() - ".sock".length());
        if (failingHandshakes.contains(vmName)) throw new HandshakeFailedException("Malformed QMP greeting");

        RecordingMonitorSession session = new RecordingMonitorSession()
            .respond("query-status", "{\"status\": \"running\", \"running\": true}");
        if (failingMonitors.contains(vmName)) session.failOnCall(0);
        sessions.put(vmName, session);
        return session;
    }

    // Reads events until one matches, failing the test if the actor goes quiet
    private static <T extends VmEvent> T awaitEvent(VmActorHandle handle, Class<T> type) throws InterruptedException {
        while (true) {
            VmEvent event = handle.pollEvent(WAIT);
            assertThat(event).as("event of type %s from %s", type.getSimpleName(), handle.vmName()).isNotNull();
            if (type.isInstance(event)) return type.cast(event);
        }
    }

    // Discovery and spawning
    @Test
    void discover_ListsRunningDomainsWithoutSpawning() throws Exception {
        List<DomainHandle> domains = orchestrator().discover();

        assertThat(domains).extracting(DomainHandle::name).containsExactly("vm-a", "vm-b", "vm-c");
        assertThat(orchestrator.actorCount()).isZero();
    }

    @Test
    void spawn_KnownVm_RegistersRunningActor() throws Exception {
        // When
        VmActorHandle handle = orchestrator().spawn("vm-a");

        // Then
        assertThat(orchestrator.actorNames()).containsExactly("vm-a");
        assertThat(orchestrator.handle("vm-a")).containsSame(handle);
        assertThat(awaitEvent(handle, VmEvent.Started.class).vmName()).isEqualTo("vm-a");
    }

    @Test
    void spawn_UnknownVm_LeavesRegistryUnchanged() throws Exception {
        orchestrator().spawn("vm-a");

        assertThatThrownBy(() -> orchestrator.spawn("vm-missing"))
            .isInstanceOfSatisfying(VmNotFoundException.class,
                exception -> assertThat(exception.getVmName()).isEqualTo("vm-missing"));
        assertThat(orchestrator.actorNames()).containsExactly("vm-a");
    }

    @Test
    void spawn_ExistingName_IsRejectedBeforeLookup() throws Exception {
        // Given
        orchestrator().spawn("vm-a");
        int lookups = link.lookups();

        // When & Then
        assertThatThrownBy(() -> orchestrator.spawn("vm-a")).isInstanceOf(ActorAlreadyExistsException.class);
        assertThat(link.lookups()).isEqualTo(lookups);
        assertThat(orchestrator.actorCount()).isEqualTo(1);
    }

    @Test
    void spawn_HandshakeFails_WrapsProtocolError() {
        failingHandshakes.add("vm-b");

        assertThatThrownBy(() -> orchestrator().spawn("vm-b"))
            .isInstanceOfSatisfying(ProtocolFailureException.class,
                exception -> assertThat(exception.protocolError()).isInstanceOf(HandshakeFailedException.class));
        assertThat(orchestrator.actorCount()).isZero();
    }

    @Test
    void spawn_StoppedVm_FailsWithoutRegistering() {
        assertThatThrownBy(() -> orchestrator().spawn("vm-off")).isInstanceOf(HypervisorException.class);
        assertThat(orchestrator.actorCount()).isZero();
    }

    @Test
    void spawn_ActorThread_IsNamedAfterVm() throws Exception {
        // Given
        List<String> threadNames = new ArrayList<>();
        evaluator = (vmName, testId, typedText) -> {
            synchronized (threadNames) {
                threadNames.add(Thread.currentThread().getName());
            }
            return true;
        };
        orchestrator().spawn("vm-a");

        // When
        orchestrator.runBatchTest("t");

        // Then
        assertThat(threadNames).containsExactly("vm-actor-vm-a");
    }

    // Sending
    @Test
    void send_UnknownActor_Fails() {
        assertThatThrownBy(() -> orchestrator().send("vm-a", VmCommand.queryStatus()))
            .isInstanceOf(ActorNotFoundException.class);
    }

    @Test
    void send_QueryStatus_ActorReportsStatus() throws Exception {
        VmActorHandle handle = orchestrator().spawn("vm-a");

        orchestrator.send("vm-a", VmCommand.queryStatus());

        assertThat(awaitEvent(handle, VmEvent.StatusReported.class).status().running()).isTrue();
    }

    @Test
    void send_QueueFull_IsRejected() throws Exception {
        // Given
        CountDownLatch waiting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        signal = (vmName, timeout) -> {
            waiting.countDown();
            return release.await(5, TimeUnit.SECONDS);
        };
        config = config.withCommandQueueCapacity(1);
        orchestrator().spawn("vm-a");

        // When
        orchestrator.send("vm-a", VmCommand.waitForAgent(Duration.ofSeconds(5)));
        assertThat(waiting.await(5, TimeUnit.SECONDS)).isTrue();
        orchestrator.send("vm-a", VmCommand.queryStatus());

        // Then
        assertThatThrownBy(() -> orchestrator.send("vm-a", VmCommand.queryStatus()))
            .isInstanceOf(CommandRejectedException.class)
            .hasMessageContaining("full");
        release.countDown();
    }

    @Test
    void broadcast_ReachesEveryActor() throws Exception {
        // Given
        orchestrator();
        List<VmActorHandle> handles = List.of(orchestrator.spawn("vm-a"), orchestrator.spawn("vm-b"), orchestrator.spawn("vm-c"));

        // When
        orchestrator.broadcast(VmCommand.queryStatus());

        // Then
        for (VmActorHandle handle : handles) {
            awaitEvent(handle, VmEvent.StatusReported.class);
        }
        assertThat(sessions.values()).allSatisfy(session -> assertThat(session.commandNames()).containsExactly("query-status"));
    }

    @Test
    void broadcast_StoppedActor_OthersStillReceiveCommand() throws Exception {
        // Given
        orchestrator();
        VmActorHandle a = orchestrator.spawn("vm-a");
        VmActorHandle b = orchestrator.spawn("vm-b");
        VmActorHandle c = orchestrator.spawn("vm-c");
        orchestrator.send("vm-b", VmCommand.shutdown());
        awaitEvent(b, VmEvent.Stopped.class);

        // When & Then
        assertThatThrownBy(() -> orchestrator.broadcast(VmCommand.queryStatus()))
            .isInstanceOfSatisfying(CommandRejectedException.class,
                exception -> assertThat(exception.getVmName()).isEqualTo("vm-b"));
        awaitEvent(a, VmEvent.StatusReported.class);
        awaitEvent(c, VmEvent.StatusReported.class);
    }

    // Batch tests
    @Test
    void runBatchTest_CollectsVerdictPerActor() throws Exception {
        // Given
        evaluator = (vmName, testId, typedText) -> !vmName.equals("vm-b");
        orchestrator();
        orchestrator.spawn("vm-a");
        orchestrator.spawn("vm-b");
        orchestrator.spawn("vm-c");

        // When
        Map<String, Boolean> results = orchestrator.runBatchTest("t-1");

        // Then
        assertThat(results).containsExactly(entry("vm-a", true), entry("vm-b", false), entry("vm-c", true));
        assertThat(sessions.get("vm-a").commandNames()).hasSize(4).containsOnly("input-send-event");
    }

    @Test
    void runBatchTest_ActorErrorsOrStopped_FailsThoseActors() throws Exception {
        // Given
        failingMonitors.add("vm-b");
        orchestrator();
        orchestrator.spawn("vm-a");
        orchestrator.spawn("vm-b");
        VmActorHandle c = orchestrator.spawn("vm-c");
        orchestrator.send("vm-c", VmCommand.shutdown());
        awaitEvent(c, VmEvent.Stopped.class);

        // When
        Map<String, Boolean> results = orchestrator.runBatchTest("t-2");

        // Then
        assertThat(results).containsExactly(entry("vm-a", true), entry("vm-b", false), entry("vm-c", false));
    }

    @Test
    void runBatchTest_EarlierEvents_AreSkipped() throws Exception {
        // Given
        orchestrator();
        orchestrator.spawn("vm-a");
        orchestrator.send("vm-a", VmCommand.queryStatus());
        orchestrator.send("vm-a", VmCommand.runTestCase("older"));

        // When
        Map<String, Boolean> results = orchestrator.runBatchTest("t-3");

        // Then
        assertThat(results).containsExactly(entry("vm-a", true));
    }

    @Test
    void runBatchTest_SlowActor_FailsAfterTimeout() throws Exception {
        // Given
        CountDownLatch release = new CountDownLatch(1);
        evaluator = (vmName, testId, typedText) -> {
            if (vmName.equals("vm-b")) release.await(5, TimeUnit.SECONDS);
            return true;
        };
        config = config.withBatchTestTimeout(Duration.ofMillis(300));
        orchestrator();
        orchestrator.spawn("vm-a");
        orchestrator.spawn("vm-b");

        // When
        Map<String, Boolean> results = orchestrator.runBatchTest("t-4");
        release.countDown();

        // Then
        assertThat(results).containsExactly(entry("vm-a", true), entry("vm-b", false));
    }

    @Test
    void runBatchTest_LateVerdictFromTimedOutRun_IsNotCountedAgain() throws Exception {
        // Given
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger evaluations = new AtomicInteger();
        evaluator = (vmName, testId, typedText) -> {
            if (evaluations.incrementAndGet() == 1) {
                release.await(5, TimeUnit.SECONDS);
                return false;
            }
            return true;
        };
        config = config.withBatchTestTimeout(Duration.ofMillis(300));
        orchestrator();
        orchestrator.spawn("vm-a");
        assertThat(orchestrator.runBatchTest("t-6")).containsExactly(entry("vm-a", false));

        // When
        release.countDown();
        Map<String, Boolean> results = orchestrator.runBatchTest("t-6");

        // Then
        assertThat(results).containsExactly(entry("vm-a", true));
        assertThat(evaluations).hasValue(2);
    }

    @Test
    void runBatchTest_NoActors_ReturnsEmpty() throws Exception {
        assertThat(orchestrator().runBatchTest("t-5")).isEmpty();
    }

    // Lifecycle
    @Test
    void shutdownAllAndWaitAll_StopEveryActorAndClearRegistry() throws Exception {
        // Given
        orchestrator();
        List<VmActorHandle> handles = List.of(orchestrator.spawn("vm-a"), orchestrator.spawn("vm-b"));

        // When
        orchestrator.shutdownAll();
        orchestrator.waitAll();

        // Then
        assertThat(orchestrator.actorCount()).isZero();
        assertThat(sessions.values()).allSatisfy(session -> assertThat(session.isClosed()).isTrue());
        for (VmActorHandle handle : handles) {
            awaitEvent(handle, VmEvent.Stopped.class);
            assertThat(handle.nextEvent()).isNull();
        }
    }

    @Test
    void remove_StopsActorThroughChannelClosure() throws Exception {
        // Given
        orchestrator();
        orchestrator.spawn("vm-a");
        orchestrator.spawn("vm-b");

        // When
        VmActorHandle removed = orchestrator.remove("vm-a");

        // Then
        awaitEvent(removed, VmEvent.Stopped.class);
        assertThat(orchestrator.actorNames()).containsExactly("vm-b");
        assertThatThrownBy(() -> orchestrator.send("vm-a", VmCommand.queryStatus())).isInstanceOf(ActorNotFoundException.class);
        assertThatThrownBy(() -> orchestrator.remove("vm-a")).isInstanceOf(ActorNotFoundException.class);

        orchestrator.shutdownAll();
        orchestrator.waitAll();
        assertThat(orchestrator.actorCount()).isZero();
    }

    @Test
    void remove_ThenSpawnAgain_StartsFreshActor() throws Exception {
        orchestrator();
        VmActorHandle first = orchestrator.spawn("vm-a");
        orchestrator.remove("vm-a");
        awaitEvent(first, VmEvent.Stopped.class);

        VmActorHandle second = orchestrator.spawn("vm-a");

        assertThat(second).isNotSameAs(first);
        assertThat(orchestrator.actorNames()).containsExactly("vm-a");
    }

    @Test
    void close_ClosesHypervisorLink() throws Exception {
        orchestrator().spawn("vm-a");

        orchestrator.close();
        orchestrator = null;

        assertThat(link.isClosed()).isTrue();
    }

    @Test
    void open_OwnsLinkUntilClosed() throws Exception {
        orchestrator = Orchestrator.open(link, config);

        assertThat(orchestrator.discover()).hasSize(3);
        assertThat(link.isClosed()).isFalse();

        orchestrator.close();
        orchestrator = null;
        assertThat(link.isClosed()).isTrue();
    }

    @Test
    void open_SetupFails_ClosesLink() {
        assertThatThrownBy(() -> Orchestrator.open(link, null)).isInstanceOf(NullPointerException.class);
        assertThat(link.isClosed()).isTrue();
    }
}
