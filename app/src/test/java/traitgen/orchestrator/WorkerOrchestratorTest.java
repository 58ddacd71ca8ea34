package traitgen.orchestrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import traitgen.core.ErrorCode;
import traitgen.core.GenerationRequest;
import traitgen.core.model.Artifact;
import traitgen.core.model.UniquenessConfig;
import traitgen.generation.DeviceProfile;
import traitgen.generation.GenerationListener;
import traitgen.generation.GenerationOptions;
import traitgen.generation.MemoryMonitor;
import traitgen.testing.TestCatalogs;
import traitgen.worker.WorkerChannel;
import traitgen.worker.WorkerCommand;
import traitgen.worker.WorkerEvent;
import traitgen.worker.WorkerFactory;

@Timeout(60)
final class WorkerOrchestratorTest {
  private static final DeviceProfile DEVICE = DeviceProfile.of(4, 4);
  private static final WorkerFactory REAL =
      WorkerFactory.inProcess(
          GenerationOptions.defaults().withSeed(11L), DEVICE, MemoryMonitor.fixed(0.5));

  @Test
  void completesARunAndReportsEveryArtifact() throws Exception {
    Collector listener = new Collector();
    try (WorkerOrchestrator orchestrator = orchestrator(singleWorker(), REAL)) {
      GenerationHandle handle =
          orchestrator.submit(
              TestCatalogs.request(
                  TestCatalogs.colorsAndShapes(), 4, TestCatalogs.uniqueOver("color", "shape")),
              listener);

      GenerationOutcome outcome = handle.outcome().get(30, TimeUnit.SECONDS);

      assertEquals(GenerationOutcome.Status.COMPLETED, outcome.status());
      assertEquals(4, outcome.generated());
      assertEquals(TaskComplexity.LOW, handle.complexity());
      assertEquals(List.of(0, 1, 2, 3), listener.indices());
    }
  }

  @Test
  void unresponsiveWorkerIsRestartedAndTheTaskCompletesTransparently() throws Exception {
    AtomicInteger created = new AtomicInteger();
    WorkerFactory factory =
        (index, events) ->
            created.getAndIncrement() == 0
                ? new SilentWorker(index, events, true)
                : REAL.create(index, events);
    OrchestratorConfig config = singleWorker().withHealth(100, 200);
    Collector listener = new Collector();

    try (WorkerOrchestrator orchestrator = orchestrator(config, factory)) {
      GenerationHandle handle =
          orchestrator.submit(
              TestCatalogs.request(
                  TestCatalogs.grid(2, 5), 20, TestCatalogs.uniqueOver("layer0", "layer1")),
              listener);

      GenerationOutcome outcome = handle.outcome().get(30, TimeUnit.SECONDS);

      assertEquals(GenerationOutcome.Status.COMPLETED, outcome.status(), outcome.message());
      assertEquals(20, outcome.generated());
      List<Integer> expected = new ArrayList<>();
      for (int i = 0; i < 20; i++) {
        expected.add(i);
      }
      assertEquals(expected, listener.indices());
      assertTrue(orchestrator.status().restarts() >= 1);
      assertTrue(created.get() >= 2);
    }
  }

  @Test
  void workerThatStallsMidRunIsReplacedAndTheRunStillReachesTheUniqueCeiling() throws Exception {
    AtomicInteger created = new AtomicInteger();
    WorkerFactory factory =
        (index, events) ->
            created.getAndIncrement() == 0
                ? new StallingWorker(index, events, 7)
                : REAL.create(index, events);
    OrchestratorConfig config = singleWorker().withHealth(100, 200);
    Collector listener = new Collector();

    try (WorkerOrchestrator orchestrator = orchestrator(config, factory)) {
      GenerationOutcome outcome =
          orchestrator
              .submit(
                  TestCatalogs.request(
                      TestCatalogs.grid(2, 5), 25, TestCatalogs.uniqueOver("layer0", "layer1")),
                  listener)
              .outcome()
              .get(30, TimeUnit.SECONDS);

      assertEquals(GenerationOutcome.Status.COMPLETED, outcome.status(), outcome.message());
      assertEquals(25, outcome.generated());
      List<Integer> expected = new ArrayList<>();
      for (int i = 0; i < 25; i++) {
        expected.add(i);
      }
      assertEquals(expected, listener.indices());
      Set<String> combinations = new HashSet<>();
      for (Artifact artifact : listener.artifacts) {
        String combination =
            artifact.assignment().traitFor("layer0").id()
                + "-"
                + artifact.assignment().traitFor("layer1").id();
        assertTrue(combinations.add(combination), "repeated combination " + combination);
      }
      assertTrue(orchestrator.status().restarts() >= 1);
    }
  }

  @Test
  void oneWorkerRunsManyQueuedTasksBackToBack() throws Exception {
    List<GenerationHandle> handles = new ArrayList<>();
    try (WorkerOrchestrator orchestrator = orchestrator(singleWorker(), REAL)) {
      for (int i = 0; i < 40; i++) {
        handles.add(orchestrator.submit(smallRequest(), new Collector()));
      }

      for (GenerationHandle handle : handles) {
        GenerationOutcome outcome = handle.outcome().get(30, TimeUnit.SECONDS);
        assertEquals(GenerationOutcome.Status.COMPLETED, outcome.status(), outcome.message());
        assertEquals(2, outcome.generated());
      }
      assertEquals(0, orchestrator.status().restarts());
      assertEquals(0, orchestrator.status().removed());
      assertEquals(1, orchestrator.status().workers());
    }
  }

  @Test
  void busyReplyRequeuesTheTaskWithoutChargingRestartsOrAttempts() throws Exception {
    OrchestratorConfig config =
        new OrchestratorConfig(1, 1, 3, 1, 5_000, 3_000, 5_000, 600_000, 2_000, 30_000, 1.5, 0.5);
    AtomicInteger refusals = new AtomicInteger();
    WorkerFactory factory = (index, events) -> new RefusingWorker(index, events, 2, refusals);

    try (WorkerOrchestrator orchestrator = orchestrator(config, factory)) {
      GenerationOutcome outcome =
          orchestrator.submit(smallRequest(), new Collector()).outcome().get(30, TimeUnit.SECONDS);

      assertEquals(GenerationOutcome.Status.COMPLETED, outcome.status(), outcome.message());
      assertEquals(2, refusals.get());
      assertEquals(0, orchestrator.status().restarts());
      assertEquals(1, orchestrator.status().healthy());
    }
  }

  @Test
  void terminalErrorWithoutTaskIdEndsTheTaskItsWorkerIsRunning() throws Exception {
    WorkerFactory factory =
        (index, events) ->
            new ScriptedWorker(
                index,
                events,
                command ->
                    command instanceof WorkerCommand.Start
                        ? new WorkerEvent.Error(
                            null, ErrorCode.RENDER_FAILED, true, "canvas lost", 0)
                        : null);

    try (WorkerOrchestrator orchestrator = orchestrator(singleWorker(), factory)) {
      GenerationOutcome outcome =
          orchestrator.submit(smallRequest(), new Collector()).outcome().get(30, TimeUnit.SECONDS);

      assertEquals(GenerationOutcome.Status.FAILED, outcome.status());
      assertEquals(ErrorCode.RENDER_FAILED, outcome.code());
      assertEquals("canvas lost", outcome.message());
      assertEquals(0, orchestrator.status().active());
    }
  }

  @Test
  void poolGrowsUnderLoadAndRetiresIdleWorkersAfterward() throws Exception {
    OrchestratorConfig config =
        new OrchestratorConfig(1, 3, 3, 4, 5_000, 3_000, 5_000, 600_000, 50, 100, 1.5, 0.5);
    List<GenerationHandle> running = new ArrayList<>();
    try (WorkerOrchestrator orchestrator = orchestrator(config, REAL)) {
      for (int i = 0; i < 6; i++) {
        running.add(orchestrator.submit(endless(), new Collector()));
      }

      assertTrue(
          awaitStatus(orchestrator, status -> status.workers() >= 2 && status.active() >= 2),
          () -> "pool did not grow: " + orchestrator.status());
      assertTrue(orchestrator.status().workers() <= 3);

      for (GenerationHandle handle : running) {
        handle.cancel();
      }
      for (GenerationHandle handle : running) {
        handle.outcome().get(30, TimeUnit.SECONDS);
      }

      assertTrue(
          awaitStatus(orchestrator, status -> status.workers() == 1),
          () -> "idle workers were not retired: " + orchestrator.status());
      assertEquals(0, orchestrator.status().restarts());
    }
  }

  @Test
  void workersThatNeverStartExhaustThePool() throws Exception {
    OrchestratorConfig config =
        new OrchestratorConfig(
            1, 1, 1, 4, 60_000, 100, 100, 600_000, 60_000, 30_000, 1.5, 0.5);
    WorkerFactory factory = (index, events) -> new SilentWorker(index, events, false);

    try (WorkerOrchestrator orchestrator = orchestrator(config, factory)) {
      GenerationOutcome outcome =
          orchestrator
              .submit(smallRequest(), new Collector())
              .outcome()
              .get(30, TimeUnit.SECONDS);

      assertEquals(GenerationOutcome.Status.FAILED, outcome.status());
      assertEquals(ErrorCode.POOL_EXHAUSTED, outcome.code());
      assertEquals(1, orchestrator.status().removed());
    }
  }

  @Test
  void cancellingARunningTaskEndsItAsCancelled() throws Exception {
    CountDownLatch firstArtifact = new CountDownLatch(1);
    Collector listener =
        new Collector() {
          @Override
          public void onArtifacts(List<Artifact> artifacts) {
            super.onArtifacts(artifacts);
            firstArtifact.countDown();
          }
        };
    try (WorkerOrchestrator orchestrator = orchestrator(singleWorker(), REAL)) {
      GenerationHandle handle = orchestrator.submit(endless(), listener);
      assertTrue(firstArtifact.await(30, TimeUnit.SECONDS));

      handle.cancel();
      GenerationOutcome outcome = handle.outcome().get(30, TimeUnit.SECONDS);

      assertEquals(GenerationOutcome.Status.CANCELLED, outcome.status());
      assertTrue(outcome.generated() > 0);
    }
  }

  @Test
  void cancellingAQueuedTaskNeverStartsIt() throws Exception {
    try (WorkerOrchestrator orchestrator = orchestrator(singleWorker(), REAL)) {
      GenerationHandle running = orchestrator.submit(endless(), new Collector());
      Collector queuedListener = new Collector();
      GenerationHandle queued = orchestrator.submit(smallRequest(), queuedListener);

      queued.cancel();
      GenerationOutcome outcome = queued.outcome().get(30, TimeUnit.SECONDS);
      running.cancel();
      running.outcome().get(30, TimeUnit.SECONDS);

      assertEquals(GenerationOutcome.Status.CANCELLED, outcome.status());
      assertEquals(0, outcome.generated());
      assertTrue(queuedListener.artifacts.isEmpty());
    }
  }

  @Test
  void generationErrorsReachTheCallerWithTheirCode() throws Exception {
    try (WorkerOrchestrator orchestrator = orchestrator(singleWorker(), REAL)) {
      GenerationOutcome infeasible =
          orchestrator
              .submit(
                  TestCatalogs.request(
                      TestCatalogs.colorsAndShapes(), 5, TestCatalogs.uniqueOver("color", "shape")),
                  new Collector())
              .outcome()
              .get(30, TimeUnit.SECONDS);
      GenerationOutcome next =
          orchestrator.submit(smallRequest(), new Collector()).outcome().get(30, TimeUnit.SECONDS);

      assertEquals(ErrorCode.INFEASIBLE, infeasible.code());
      assertEquals(GenerationOutcome.Status.COMPLETED, next.status());
      assertEquals(0, orchestrator.status().restarts());
    }
  }

  @Test
  void slowTasksTimeOutWithoutSpendingTheRestartBudget() throws Exception {
    OrchestratorConfig config = singleWorker().withTaskTimeout(300);
    try (WorkerOrchestrator orchestrator = orchestrator(config, REAL)) {
      GenerationOutcome outcome =
          orchestrator.submit(endless(), new Collector()).outcome().get(30, TimeUnit.SECONDS);

      assertEquals(GenerationOutcome.Status.FAILED, outcome.status());
      assertEquals(ErrorCode.TASK_TIMEOUT, outcome.code());
      assertEquals(0, orchestrator.status().restarts());

      GenerationOutcome after =
          orchestrator.submit(smallRequest(), new Collector()).outcome().get(30, TimeUnit.SECONDS);
      assertEquals(GenerationOutcome.Status.COMPLETED, after.status());
    }
  }

  @Test
  void throwingListenerCancelsItsRun() throws Exception {
    GenerationListener listener =
        artifacts -> {
          throw new IllegalStateException("disk full");
        };
    try (WorkerOrchestrator orchestrator = orchestrator(singleWorker(), REAL)) {
      GenerationOutcome outcome =
          orchestrator.submit(endless(), listener).outcome().get(30, TimeUnit.SECONDS);

      assertEquals(GenerationOutcome.Status.CANCELLED, outcome.status());
    }
  }

  @Test
  void closeFailsOutstandingAndLaterSubmissions() throws Exception {
    WorkerOrchestrator orchestrator = orchestrator(singleWorker(), REAL);
    GenerationHandle running = orchestrator.submit(endless(), new Collector());
    orchestrator.close();

    GenerationOutcome outcome = running.outcome().get(30, TimeUnit.SECONDS);
    assertEquals(ErrorCode.POOL_SHUTDOWN, outcome.code());

    GenerationOutcome late =
        orchestrator.submit(smallRequest(), new Collector()).outcome().get(5, TimeUnit.SECONDS);
    assertEquals(ErrorCode.POOL_SHUTDOWN, late.code());
  }

  private static WorkerOrchestrator orchestrator(OrchestratorConfig config, WorkerFactory factory) {
    return new WorkerOrchestrator(config, DEVICE, factory).start();
  }

  private static boolean awaitStatus(WorkerOrchestrator orchestrator, Predicate<PoolStatus> reached)
      throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(20);
    while (System.nanoTime() < deadline) {
      if (reached.test(orchestrator.status())) {
        return true;
      }
      Thread.sleep(20);
    }
    return false;
  }

  private static OrchestratorConfig singleWorker() {
    return OrchestratorConfig.defaults().withWorkers(1, 1);
  }

  private static GenerationRequest smallRequest() {
    return TestCatalogs.request(TestCatalogs.colorsAndShapes(), 2, UniquenessConfig.disabled());
  }

  private static GenerationRequest endless() {
    return TestCatalogs.request(TestCatalogs.grid(2, 20), 100_000, UniquenessConfig.disabled());
  }

  /** Listener invoked on the dispatcher thread; read from the test thread. */
  private static class Collector implements GenerationListener {
    final List<Artifact> artifacts = new CopyOnWriteArrayList<>();

    @Override
    public void onArtifacts(List<Artifact> delivered) {
      artifacts.addAll(delivered);
    }

    List<Integer> indices() {
      List<Integer> indices = new ArrayList<>();
      Set<Integer> seen = new HashSet<>();
      for (Artifact artifact : artifacts) {
        assertTrue(seen.add(artifact.index()), "index delivered twice: " + artifact.index());
        indices.add(artifact.index());
      }
      return indices;
    }
  }

  /** Real worker whose events stop reaching the pool after a number of artifact batches. */
  private static final class StallingWorker implements WorkerChannel {
    private final WorkerChannel delegate;

    StallingWorker(int index, Consumer<WorkerEvent> events, int batchesBeforeStall) {
      AtomicInteger forwarded = new AtomicInteger();
      this.delegate =
          REAL.create(
              index,
              event -> {
                if (forwarded.get() >= batchesBeforeStall) {
                  return;
                }
                if (event instanceof WorkerEvent.Artifacts) {
                  forwarded.incrementAndGet();
                }
                events.accept(event);
              });
    }

    @Override
    public int workerIndex() {
      return delegate.workerIndex();
    }

    @Override
    public void post(WorkerCommand command) {
      delegate.post(command);
    }

    @Override
    public void terminate() {
      delegate.terminate();
    }
  }

  /** Real worker that turns down its first few starts as if still busy. */
  private static final class RefusingWorker implements WorkerChannel {
    private final WorkerChannel delegate;
    private final Consumer<WorkerEvent> events;
    private final int refusalsWanted;
    private final AtomicInteger refusals;

    RefusingWorker(
        int index, Consumer<WorkerEvent> events, int refusalsWanted, AtomicInteger refusals) {
      this.delegate = REAL.create(index, events);
      this.events = events;
      this.refusalsWanted = refusalsWanted;
      this.refusals = refusals;
    }

    @Override
    public int workerIndex() {
      return delegate.workerIndex();
    }

    @Override
    public void post(WorkerCommand command) {
      if (command instanceof WorkerCommand.Start start && refusals.get() < refusalsWanted) {
        refusals.incrementAndGet();
        events.accept(
            new WorkerEvent.Error(start.taskId(), ErrorCode.WORKER_BUSY, true, "still busy", 0));
        return;
      }
      delegate.post(command);
    }

    @Override
    public void terminate() {
      delegate.terminate();
    }
  }

  /** Completes the handshake, then answers each command with a fixed reply, or not at all. */
  private static final class ScriptedWorker implements WorkerChannel {
    private final int index;
    private final Consumer<WorkerEvent> events;
    private final Function<WorkerCommand, WorkerEvent> replies;

    ScriptedWorker(
        int index, Consumer<WorkerEvent> events, Function<WorkerCommand, WorkerEvent> replies) {
      this.index = index;
      this.events = events;
      this.replies = replies;
    }

    @Override
    public int workerIndex() {
      return index;
    }

    @Override
    public void post(WorkerCommand command) {
      WorkerEvent reply =
          command instanceof WorkerCommand.Initialize
              ? new WorkerEvent.Ready()
              : replies.apply(command);
      if (reply != null) {
        events.accept(reply);
      }
    }

    @Override
    public void terminate() {}
  }

  /** Answers nothing, or only the readiness handshake, then goes quiet. */
  private static final class SilentWorker implements WorkerChannel {
    private final int index;
    private final Consumer<WorkerEvent> events;
    private final boolean becomesReady;

    SilentWorker(int index, Consumer<WorkerEvent> events, boolean becomesReady) {
      this.index = index;
      this.events = events;
      this.becomesReady = becomesReady;
    }

    @Override
    public int workerIndex() {
      return index;
    }

    @Override
    public void post(WorkerCommand command) {
      if (becomesReady && command instanceof WorkerCommand.Initialize) {
        events.accept(new WorkerEvent.Ready());
      }
    }

    @Override
    public void terminate() {}
  }
}
