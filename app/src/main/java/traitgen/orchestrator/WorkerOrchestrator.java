package traitgen.orchestrator;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import traitgen.core.ErrorCode;
import traitgen.core.GenerationRequest;
import traitgen.generation.DeviceProfile;
import traitgen.generation.GenerationListener;
import traitgen.worker.WorkerCommand;
import traitgen.worker.WorkerEvent;
import traitgen.worker.WorkerFactory;

/**
 * Owns a pool of isolated workers and runs each submitted generation on exactly one of them.
 *
 * <p>All pool and task state is mutated on one dispatcher thread: worker events, timers and caller
 * requests are posted onto it, so no field needs a lock. The orchestrator:
 *
 * <ul>
 *   <li>assigns queued tasks to the idle worker with the fewest tasks, then the lowest average
 *       duration, then the fewest errors, preferring healthy over degraded workers;
 *   <li>pings every worker periodically, restarting unresponsive ones up to a budget and removing
 *       them after it, and resumes their task on another worker without repeating delivered
 *       artifacts;
 *   <li>fails tasks that exceed the task timeout and frees their worker;
 *   <li>grows or shrinks the pool from queue pressure via {@link ScalingPolicy};
 *   <li>routes terminal events by task id, and only when an event lacks one, by worker;
 *   <li>puts a task a busy worker turned down back at the head of the queue, charging neither the
 *       worker's restart budget nor the task's attempts.
 * </ul>
 */
public final class WorkerOrchestrator implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(WorkerOrchestrator.class);
  private static final int DEGRADED_ERROR_STREAK = 3;
  static final long BUSY_BACKOFF_MS = 50;

  private final OrchestratorConfig config;
  private final DeviceProfile device;
  private final WorkerFactory factory;
  private final ExecutorService dispatcher;
  private final ScheduledExecutorService timers;
  private final AtomicLong taskSequence = new AtomicLong();
  private final AtomicBoolean timersScheduled = new AtomicBoolean();

  // dispatcher-confined state
  private final Map<Integer, WorkerSlot> slots = new LinkedHashMap<>();
  private final Map<String, GenerationTask> tasks = new LinkedHashMap<>();
  private final Deque<GenerationTask> queue = new ArrayDeque<>();
  private int nextWorkerIndex;
  private long nextPingId;
  private int removedWorkers;
  private int totalRestarts;
  private boolean started;
  private boolean shutdown;

  private volatile PoolStatus status = PoolStatus.empty();

  public WorkerOrchestrator(
      OrchestratorConfig config, DeviceProfile device, WorkerFactory factory) {
    this.config = OrchestratorConfig.normalize(config);
    this.device = device == null ? DeviceProfile.detect() : device;
    this.factory = Objects.requireNonNull(factory, "factory");
    this.dispatcher =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("traitgen-orchestrator")
                .setDaemon(true)
                .build());
    this.timers =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("traitgen-orchestrator-timer")
                .setDaemon(true)
                .build());
  }

  /** Creates the minimum pool and starts health checks and scaling. Idempotent. */
  public WorkerOrchestrator start() {
    if (!timersScheduled.compareAndSet(false, true)) {
      return this;
    }
    post(
        () -> {
          if (started || shutdown) {
            return;
          }
          started = true;
          for (int i = 0; i < config.minWorkers(); i++) {
            spawnWorker();
          }
          LOG.info(
              "Worker pool started with {} workers (max {})",
              config.minWorkers(),
              ScalingPolicy.maxWorkers(device, config));
        });
    timers.scheduleWithFixedDelay(
        () -> post(this::healthCheck),
        config.healthCheckIntervalMs(),
        config.healthCheckIntervalMs(),
        TimeUnit.MILLISECONDS);
    timers.scheduleWithFixedDelay(
        () -> post(this::rescale),
        config.scalingIntervalMs(),
        config.scalingIntervalMs(),
        TimeUnit.MILLISECONDS);
    return this;
  }

  public PoolStatus status() {
    return status;
  }

  /** Queues one run; artifacts, progress and previews reach {@code listener} on the dispatcher. */
  public GenerationHandle submit(GenerationRequest request, GenerationListener listener) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(listener, "listener");
    String taskId = "task-" + taskSequence.incrementAndGet();
    GenerationTask task = new GenerationTask(taskId, request, listener, now());
    boolean accepted =
        post(
            () -> {
              if (shutdown) {
                failTask(task, ErrorCode.POOL_SHUTDOWN, "Worker pool is shut down");
                return;
              }
              if (!started) {
                start();
              }
              if (liveWorkers() == 0 && removedWorkers > 0) {
                failTask(task, ErrorCode.POOL_EXHAUSTED, "No workers remain");
                return;
              }
              tasks.put(taskId, task);
              queue.addLast(task);
              LOG.debug("Queued {}", task);
              dispatch();
            });
    if (!accepted) {
      task.outcome.complete(
          GenerationOutcome.failed(
              ErrorCode.POOL_SHUTDOWN, "Worker pool is shut down", 0, request.count()));
    }
    return new Handle(task);
  }

  /** Fails outstanding tasks, terminates every worker and stops the pool threads. */
  @Override
  public void close() {
    post(
        () -> {
          if (shutdown) {
            return;
          }
          shutdown = true;
          for (GenerationTask task : new ArrayList<>(tasks.values())) {
            failTask(task, ErrorCode.POOL_SHUTDOWN, "Worker pool shut down");
          }
          queue.clear();
          for (WorkerSlot slot : slots.values()) {
            slot.channel.terminate();
          }
          slots.clear();
          publishStatus();
          LOG.info("Worker pool shut down");
        });
    timers.shutdownNow();
    dispatcher.shutdown();
    try {
      if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
        LOG.warn("Dispatcher did not stop within 5 s");
        dispatcher.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      dispatcher.shutdownNow();
    }
  }

  // ---------------------------------------------------------------------------------------------
  // worker lifecycle

  private void spawnWorker() {
    WorkerSlot slot = new WorkerSlot(nextWorkerIndex++);
    slots.put(slot.index, slot);
    connect(slot);
    LOG.info("Created worker {}", slot.index);
  }

  private void connect(WorkerSlot slot) {
    int epoch = ++slot.epoch;
    slot.health = WorkerHealth.INITIALIZING;
    slot.pendingPingId = -1;
    slot.createdAt = now();
    slot.idleSince = slot.createdAt;
    slot.channel = factory.create(slot.index, event -> post(() -> onEvent(slot, epoch, event)));
    slot.channel.post(new WorkerCommand.Initialize());
    later(() -> checkInitialized(slot, epoch), config.initTimeoutMs());
  }

  private void checkInitialized(WorkerSlot slot, int epoch) {
    if (slot.epoch == epoch && slot.health == WorkerHealth.INITIALIZING) {
      LOG.warn("{} did not become ready within {} ms", slot, config.initTimeoutMs());
      fail(slot, "initialization timeout");
    }
  }

  /** Restarts the worker within its budget or removes it; its task goes back to the queue. */
  private void fail(WorkerSlot slot, String reason) {
    if (shutdown || slot.health == WorkerHealth.REMOVED) {
      return;
    }
    slot.health = WorkerHealth.UNRESPONSIVE;
    slot.channel.terminate();
    GenerationTask task = slot.task;
    slot.task = null;

    if (slot.restarts < config.maxRestarts()) {
      slot.restarts++;
      totalRestarts++;
      LOG.warn(
          "Restarting worker {} ({}), attempt {}/{}",
          slot.index,
          reason,
          slot.restarts,
          config.maxRestarts());
      connect(slot);
    } else {
      slot.health = WorkerHealth.REMOVED;
      removedWorkers++;
      LOG.warn("Removed worker {} after {} restarts ({})", slot.index, slot.restarts, reason);
    }

    if (task != null) {
      reassign(task, reason);
    }
    if (liveWorkers() == 0) {
      exhaustPool();
      return;
    }
    dispatch();
  }

  private void reassign(GenerationTask task, String reason) {
    task.worker = null;
    if (task.done()) {
      return;
    }
    if (task.cancelRequested) {
      finish(task, GenerationOutcome.cancelled(task.delivered.size(), task.request.count()));
      return;
    }
    if (task.attempts >= config.maxTaskAttempts()) {
      failTask(
          task,
          ErrorCode.INTERNAL,
          "Task failed on " + task.attempts + " workers; last cause: " + reason);
      return;
    }
    LOG.info(
        "Reassigning {} after {} ({} artifacts already delivered)",
        task.taskId,
        reason,
        task.delivered.size());
    queue.addFirst(task);
  }

  private void exhaustPool() {
    LOG.error("No workers remain; failing {} outstanding tasks", tasks.size());
    for (GenerationTask task : new ArrayList<>(tasks.values())) {
      failTask(task, ErrorCode.POOL_EXHAUSTED, "All workers failed and were removed");
    }
    queue.clear();
    publishStatus();
  }

  // ---------------------------------------------------------------------------------------------
  // scheduling

  private void dispatch() {
    while (!queue.isEmpty() && !shutdown) {
      Optional<WorkerSlot> worker = pickWorker();
      if (worker.isEmpty()) {
        break;
      }
      assign(queue.pollFirst(), worker.get());
    }
    publishStatus();
  }

  private Optional<WorkerSlot> pickWorker() {
    return pickWorker(slots.values(), now());
  }

  /** Healthy idle workers first, degraded ones only when no healthy worker is free. */
  static Optional<WorkerSlot> pickWorker(Collection<WorkerSlot> candidates, long now) {
    Comparator<WorkerSlot> order =
        Comparator.comparingInt(WorkerSlot::activeTasks)
            .thenComparingLong(WorkerSlot::averageTaskMillis)
            .thenComparingInt(slot -> slot.errorCount)
            .thenComparingInt(slot -> slot.index);
    Optional<WorkerSlot> healthy =
        candidates.stream()
            .filter(slot -> slot.health == WorkerHealth.HEALTHY && slot.idleAt(now))
            .min(order);
    if (healthy.isPresent()) {
      return healthy;
    }
    return candidates.stream()
        .filter(slot -> slot.health == WorkerHealth.DEGRADED && slot.idleAt(now))
        .min(order);
  }

  private void assign(GenerationTask task, WorkerSlot slot) {
    task.worker = slot;
    task.attempts++;
    task.assignments++;
    task.startedAt = now();
    slot.task = task;
    int attempt = task.attempts;
    int assignment = task.assignments;
    LOG.debug(
        "Assigned {} to worker {} (attempt {}, queued {} ms)",
        task,
        slot.index,
        attempt,
        task.startedAt - task.submittedAt);
    slot.channel.post(
        new WorkerCommand.Start(task.taskId, task.request, List.copyOf(task.delivered)));
    if (task.cancelRequested) {
      slot.channel.post(new WorkerCommand.Cancel(task.taskId));
    }
    later(() -> checkTaskTimeout(task, assignment), config.taskTimeoutMs());
  }

  private void checkTaskTimeout(GenerationTask task, int assignment) {
    if (task.done() || task.assignments != assignment || task.worker == null) {
      return;
    }
    WorkerSlot slot = task.worker;
    LOG.warn(
        "{} exceeded the {} ms task timeout on worker {}",
        task,
        config.taskTimeoutMs(),
        slot.index);
    failTask(task, ErrorCode.TASK_TIMEOUT, "Task exceeded " + config.taskTimeoutMs() + " ms");
    // the worker may still be busy with the abandoned run; replace it without using its budget
    slot.task = null;
    slot.errorCount++;
    slot.channel.terminate();
    connect(slot);
    dispatch();
  }

  private void cancel(GenerationTask task) {
    if (task.done() || task.cancelRequested) {
      return;
    }
    task.cancelRequested = true;
    if (queue.remove(task)) {
      finish(task, GenerationOutcome.cancelled(task.delivered.size(), task.request.count()));
      publishStatus();
    } else if (task.worker != null) {
      task.worker.channel.post(new WorkerCommand.Cancel(task.taskId));
    }
  }

  // ---------------------------------------------------------------------------------------------
  // health and scaling

  private void healthCheck() {
    if (shutdown) {
      return;
    }
    long now = now();
    for (WorkerSlot slot : new ArrayList<>(slots.values())) {
      if (!slot.health.schedulable()) {
        continue;
      }
      if (slot.pendingPingId >= 0) {
        // previous ping still outstanding; its own timeout decides
        continue;
      }
      long id = nextPingId++;
      int epoch = slot.epoch;
      slot.pendingPingId = id;
      slot.pingSentAt = now;
      slot.channel.post(new WorkerCommand.Ping(id));
      later(() -> checkPing(slot, epoch, id), config.healthTimeoutMs());
    }
    for (GenerationTask task : tasks.values()) {
      if (task.worker != null && !task.overdueReported) {
        long estimate = task.complexity.estimatedMillis(task.request.count());
        if (now - task.startedAt > 2 * estimate) {
          task.overdueReported = true;
          LOG.warn(
              "{} has run {} ms, over twice its {} ms estimate",
              task,
              now - task.startedAt,
              estimate);
        }
      }
    }
  }

  private void checkPing(WorkerSlot slot, int epoch, long id) {
    if (slot.epoch != epoch || slot.pendingPingId != id || !slot.health.live()) {
      return;
    }
    LOG.warn("Worker {} missed health ping {} ({} ms)", slot.index, id, config.healthTimeoutMs());
    fail(slot, "health ping timeout");
  }

  private void onPong(WorkerSlot slot, WorkerEvent.Pong pong) {
    if (pong.id() != slot.pendingPingId) {
      return;
    }
    long latency = now() - slot.pingSentAt;
    slot.pendingPingId = -1;
    if (latency > config.healthTimeoutMs() / 2) {
      if (slot.health == WorkerHealth.HEALTHY) {
        LOG.warn("Worker {} degraded: ping answered after {} ms", slot.index, latency);
      }
      slot.health = WorkerHealth.DEGRADED;
    } else if (slot.consecutiveErrors < DEGRADED_ERROR_STREAK) {
      slot.health = WorkerHealth.HEALTHY;
    }
  }

  private void rescale() {
    if (shutdown || !started) {
      return;
    }
    int live = liveWorkers();
    if (live == 0 && removedWorkers > 0) {
      return;
    }
    double load = 0;
    for (GenerationTask task : tasks.values()) {
      load += task.complexity.scalingWeight();
    }
    int target = ScalingPolicy.target(live, load, device, config);
    if (target > live) {
      for (int i = live; i < target; i++) {
        spawnWorker();
      }
      LOG.info("Scaled pool up to {} workers (load {})", target, load);
    } else if (target < live) {
      retireIdle(live - target);
    }
    publishStatus();
  }

  private void retireIdle(int count) {
    long now = now();
    List<WorkerSlot> candidates = new ArrayList<>();
    for (WorkerSlot slot : slots.values()) {
      if (slot.health == WorkerHealth.HEALTHY
          && slot.task == null
          && now - slot.idleSince >= config.idleTimeoutMs()) {
        candidates.add(slot);
      }
    }
    candidates.sort(Comparator.comparingInt((WorkerSlot slot) -> slot.index).reversed());
    for (WorkerSlot slot : candidates.subList(0, Math.min(count, candidates.size()))) {
      slot.channel.terminate();
      slots.remove(slot.index);
      LOG.info("Retired idle worker {} after {} ms", slot.index, now - slot.createdAt);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // event routing

  private void onEvent(WorkerSlot slot, int epoch, WorkerEvent event) {
    if (slots.get(slot.index) != slot || slot.epoch != epoch || !slot.health.live()) {
      LOG.debug("Dropped stale {} from worker {} epoch {}", event, slot.index, epoch);
      return;
    }
    if (event instanceof WorkerEvent.Ready) {
      if (slot.health == WorkerHealth.INITIALIZING) {
        slot.health = WorkerHealth.HEALTHY;
        slot.idleSince = now();
        LOG.debug("Worker {} ready", slot.index);
      }
      dispatch();
      return;
    }
    if (event instanceof WorkerEvent.Pong pong) {
      onPong(slot, pong);
      return;
    }
    if (event.terminal()) {
      onTerminal(slot, event);
      return;
    }

    GenerationTask task = tasks.get(event.taskId());
    if (task == null || task.worker != slot || task.done()) {
      LOG.debug("Ignored {} for unknown or reassigned task", event);
      return;
    }
    if (event instanceof WorkerEvent.Artifacts artifacts) {
      artifacts.artifacts().forEach(artifact -> task.delivered.add(artifact.assignment()));
      notify(task, () -> task.listener.onArtifacts(artifacts.artifacts()));
    } else if (event instanceof WorkerEvent.ProgressEvent progress) {
      notify(task, () -> task.listener.onProgress(progress.progress()));
    } else if (event instanceof WorkerEvent.PreviewEvent preview) {
      notify(task, () -> task.listener.onPreview(preview.preview()));
    } else if (event instanceof WorkerEvent.ItemFailedEvent failed) {
      notify(task, () -> task.listener.onItemFailed(failed.failure()));
    }
  }

  private void onTerminal(WorkerSlot slot, WorkerEvent event) {
    GenerationTask task = event.taskId() != null ? tasks.get(event.taskId()) : slot.task;
    if (task == null) {
      if (event instanceof WorkerEvent.Error error) {
        LOG.warn("Worker {} reported {}: {}", slot.index, error.code(), error.message());
        recordError(slot);
      }
      return;
    }
    if (task.worker != slot) {
      LOG.debug("Ignored terminal {} from worker {} not running it", event, slot.index);
      return;
    }
    long duration = now() - task.startedAt;
    slot.task = null;
    slot.idleSince = now();
    task.worker = null;

    if (event instanceof WorkerEvent.Complete complete) {
      slot.completedTasks++;
      slot.totalTaskMillis += duration;
      slot.consecutiveErrors = 0;
      if (slot.health == WorkerHealth.DEGRADED && slot.pendingPingId < 0) {
        slot.health = WorkerHealth.HEALTHY;
      }
      finish(
          task,
          GenerationOutcome.completed(
              complete.generated(), complete.requested(), complete.stats()));
    } else if (event instanceof WorkerEvent.Cancelled cancelled) {
      finish(task, GenerationOutcome.cancelled(cancelled.generated(), cancelled.requested()));
    } else if (event instanceof WorkerEvent.Error error) {
      if (error.code() == ErrorCode.WORKER_BUSY) {
        // the worker still holds an earlier run; retry once it had time to release it
        LOG.debug("Worker {} turned down {}: {}", slot.index, task, error.message());
        task.attempts--;
        slot.busyUntil = now() + BUSY_BACKOFF_MS;
        reassign(task, "worker busy");
        later(this::dispatch, BUSY_BACKOFF_MS);
        publishStatus();
        return;
      }
      recordError(slot);
      if (error.code() == ErrorCode.INTERNAL) {
        // uncaught failure inside the worker: treat the worker as broken
        slot.task = task;
        task.worker = slot;
        fail(slot, error.message());
        return;
      }
      int generated = Math.max(error.generated(), task.delivered.size());
      finish(
          task,
          GenerationOutcome.failed(
              error.code(), error.message(), generated, task.request.count()));
    }
    dispatch();
  }

  private void recordError(WorkerSlot slot) {
    slot.errorCount++;
    slot.consecutiveErrors++;
    if (slot.consecutiveErrors >= DEGRADED_ERROR_STREAK && slot.health == WorkerHealth.HEALTHY) {
      LOG.warn(
          "Worker {} degraded after {} consecutive errors", slot.index, slot.consecutiveErrors);
      slot.health = WorkerHealth.DEGRADED;
    }
  }

  private void finish(GenerationTask task, GenerationOutcome outcome) {
    tasks.remove(task.taskId);
    if (task.outcome.complete(outcome)) {
      if (outcome.status() == GenerationOutcome.Status.FAILED) {
        LOG.warn("{} failed: {}", task, outcome.message());
      } else {
        LOG.info(
            "{} {}: {} of {}", task, outcome.status(), outcome.generated(), outcome.requested());
      }
    }
  }

  private void failTask(GenerationTask task, ErrorCode code, String message) {
    finish(
        task,
        GenerationOutcome.failed(code, message, task.delivered.size(), task.request.count()));
  }

  private void notify(GenerationTask task, Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      LOG.warn("Listener of {} threw; cancelling the run", task, e);
      cancel(task);
    }
  }

  // ---------------------------------------------------------------------------------------------
  // helpers

  private int liveWorkers() {
    int live = 0;
    for (WorkerSlot slot : slots.values()) {
      if (slot.health.live()) {
        live++;
      }
    }
    return live;
  }

  private void publishStatus() {
    int healthy = 0;
    int degraded = 0;
    int active = 0;
    for (WorkerSlot slot : slots.values()) {
      if (slot.health == WorkerHealth.HEALTHY) {
        healthy++;
      } else if (slot.health == WorkerHealth.DEGRADED) {
        degraded++;
      }
      active += slot.activeTasks();
    }
    status =
        new PoolStatus(
            liveWorkers(), healthy, degraded, removedWorkers, totalRestarts, queue.size(), active);
  }

  private boolean post(Runnable action) {
    try {
      dispatcher.execute(
          () -> {
            try {
              action.run();
            } catch (RuntimeException e) {
              LOG.error("Orchestrator action failed", e);
            }
          });
      return true;
    } catch (RejectedExecutionException e) {
      LOG.debug("Orchestrator stopped; dropped action");
      return false;
    }
  }

  /** Runs {@code action} on the dispatcher after {@code delayMs}. */
  private void later(Runnable action, long delayMs) {
    try {
      timers.schedule(() -> post(action), delayMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      LOG.debug("Timer stopped; dropped delayed action");
    }
  }

  private static long now() {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
  }

  private final class Handle implements GenerationHandle {
    private final GenerationTask task;

    Handle(GenerationTask task) {
      this.task = task;
    }

    @Override
    public String taskId() {
      return task.taskId;
    }

    @Override
    public TaskComplexity complexity() {
      return task.complexity;
    }

    @Override
    public CompletableFuture<GenerationOutcome> outcome() {
      return task.outcome;
    }

    @Override
    public void cancel() {
      post(() -> WorkerOrchestrator.this.cancel(task));
    }
  }
}
