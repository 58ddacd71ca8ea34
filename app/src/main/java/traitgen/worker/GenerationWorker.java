package traitgen.worker;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import traitgen.core.ErrorCode;
import traitgen.core.ExhaustionException;
import traitgen.core.GenerationException;
import traitgen.core.model.Artifact;
import traitgen.generation.CancellationToken;
import traitgen.generation.DeviceProfile;
import traitgen.generation.GenerationController;
import traitgen.generation.GenerationListener;
import traitgen.generation.GenerationOptions;
import traitgen.generation.ItemFailure;
import traitgen.generation.MemoryMonitor;
import traitgen.generation.Preview;
import traitgen.generation.Progress;
import traitgen.generation.RunResult;
import traitgen.generation.RunState;

/**
 * In-process worker. Shares nothing with the orchestrator but the messages: commands are handled on
 * a control thread, so pings and cancels are answered while a run occupies the run thread.
 */
public final class GenerationWorker implements WorkerChannel {
  private static final Logger LOG = LoggerFactory.getLogger(GenerationWorker.class);

  private final int index;
  private final GenerationOptions options;
  private final DeviceProfile device;
  private final MemoryMonitor memory;
  private final Consumer<WorkerEvent> events;
  private final ExecutorService control;
  private final ExecutorService runner;

  // confined to the control thread
  private String currentTaskId;
  private CancellationToken currentToken;
  private volatile boolean terminated;

  public GenerationWorker(
      int index,
      GenerationOptions options,
      DeviceProfile device,
      MemoryMonitor memory,
      Consumer<WorkerEvent> events) {
    this.index = index;
    this.options = GenerationOptions.normalize(options);
    this.device = device;
    this.memory = memory;
    this.events = events;
    this.control =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("traitgen-worker-" + index + "-control")
                .setDaemon(true)
                .build());
    this.runner =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("traitgen-worker-" + index + "-run")
                .setDaemon(true)
                .build());
  }

  @Override
  public int workerIndex() {
    return index;
  }

  @Override
  public void post(WorkerCommand command) {
    if (terminated) {
      return;
    }
    try {
      control.execute(() -> handle(command));
    } catch (RejectedExecutionException e) {
      LOG.debug("Worker {} dropped {} after termination", index, command);
    }
  }

  @Override
  public void terminate() {
    if (terminated) {
      return;
    }
    terminated = true;
    control.execute(
        () -> {
          if (currentToken != null) {
            currentToken.cancel();
          }
        });
    control.shutdown();
    runner.shutdownNow();
  }

  private void handle(WorkerCommand command) {
    if (command instanceof WorkerCommand.Initialize) {
      emit(new WorkerEvent.Ready());
    } else if (command instanceof WorkerCommand.Ping ping) {
      emit(new WorkerEvent.Pong(ping.id()));
    } else if (command instanceof WorkerCommand.Start start) {
      start(start);
    } else if (command instanceof WorkerCommand.Cancel cancel) {
      if (currentToken != null && cancel.taskId().equals(currentTaskId)) {
        currentToken.cancel();
      }
    } else {
      emit(
          new WorkerEvent.Error(
              null, ErrorCode.UNKNOWN_MESSAGE, false, "Unknown command: " + command, 0));
    }
  }

  private void start(WorkerCommand.Start start) {
    if (currentTaskId != null) {
      emit(
          new WorkerEvent.Error(
              start.taskId(),
              ErrorCode.WORKER_BUSY,
              true,
              "Worker " + index + " is busy with task " + currentTaskId,
              0));
      return;
    }
    CancellationToken token = new CancellationToken();
    currentTaskId = start.taskId();
    currentToken = token;
    runner.execute(
        () -> {
          WorkerEvent terminal = null;
          try {
            terminal = run(start, token);
          } finally {
            finish(start.taskId(), terminal);
          }
        });
  }

  /** Frees the worker on the control thread, then reports the task's terminal event. */
  private void finish(String taskId, WorkerEvent terminal) {
    try {
      control.execute(
          () -> {
            if (taskId.equals(currentTaskId)) {
              currentTaskId = null;
              currentToken = null;
            }
            if (terminal != null) {
              emit(terminal);
            }
          });
    } catch (RejectedExecutionException e) {
      LOG.debug("Worker {} terminated before finishing task {}", index, taskId);
    }
  }

  private WorkerEvent run(WorkerCommand.Start start, CancellationToken token) {
    String taskId = start.taskId();
    GenerationController controller =
        new GenerationController(
            start.request(), options, device, memory, token, new Relay(taskId));
    try {
      RunResult result = controller.run(start.resumeFrom());
      if (result.state() == RunState.CANCELLED) {
        return new WorkerEvent.Cancelled(taskId, result.generated(), result.requested());
      }
      return new WorkerEvent.Complete(
          taskId, result.generated(), result.requested(), result.stats());
    } catch (ExhaustionException e) {
      return new WorkerEvent.Error(taskId, e.code(), false, e.getMessage(), e.generated());
    } catch (GenerationException e) {
      return new WorkerEvent.Error(taskId, e.code(), e.code().recoverable(), e.getMessage(), 0);
    } catch (RuntimeException e) {
      LOG.error("Worker {} failed task {}", index, taskId, e);
      return new WorkerEvent.Error(
          taskId, ErrorCode.INTERNAL, true, "Unexpected worker failure: " + e, 0);
    }
  }

  private void emit(WorkerEvent event) {
    if (!terminated) {
      events.accept(event);
    }
  }

  /** Forwards controller output as events tagged with the task id. */
  private final class Relay implements GenerationListener {
    private final String taskId;

    Relay(String taskId) {
      this.taskId = taskId;
    }

    @Override
    public void onArtifacts(List<Artifact> artifacts) {
      emit(new WorkerEvent.Artifacts(taskId, artifacts));
    }

    @Override
    public void onProgress(Progress progress) {
      emit(new WorkerEvent.ProgressEvent(taskId, progress));
    }

    @Override
    public void onPreview(Preview preview) {
      emit(new WorkerEvent.PreviewEvent(taskId, preview));
    }

    @Override
    public void onItemFailed(ItemFailure failure) {
      emit(new WorkerEvent.ItemFailedEvent(taskId, failure));
    }
  }
}
