package traitgen.cli;

import com.google.common.base.Stopwatch;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import traitgen.core.ErrorCode;
import traitgen.core.GenerationRequest;
import traitgen.core.model.OutputSize;
import traitgen.generation.DeviceProfile;
import traitgen.generation.GenerationOptions;
import traitgen.generation.MemoryMonitor;
import traitgen.metadata.MetadataStandard;
import traitgen.orchestrator.GenerationHandle;
import traitgen.orchestrator.GenerationOutcome;
import traitgen.orchestrator.OrchestratorConfig;
import traitgen.orchestrator.WorkerOrchestrator;
import traitgen.worker.WorkerFactory;

/** Handles the {@code generate} command. */
final class GenerateCommand {
  private static final Logger LOG = LoggerFactory.getLogger(GenerateCommand.class);

  static final int EXIT_OK = 0;
  static final int EXIT_REJECTED = 2;
  static final int EXIT_FAILED = 3;
  static final int EXIT_CANCELLED = 4;

  int execute(String[] args) throws IOException {
    CliOptions options = parse(args);
    CatalogLoader.LoadedCatalog catalog = CatalogLoader.load(options.catalogFile());
    String name = options.projectName() != null ? options.projectName() : catalog.name();
    String description =
        options.projectDescription() != null ? options.projectDescription() : catalog.description();
    GenerationRequest request =
        new GenerationRequest(
            catalog.layers(),
            options.count(),
            new OutputSize(options.width(), options.height()),
            name == null ? "Collection" : name,
            description,
            catalog.uniqueness(),
            options.standard());

    GenerationOptions generation =
        GenerationOptions.defaults().withSeed(options.seed()).withOrdering(options.ordering());
    DeviceProfile device = DeviceProfile.detect();
    OrchestratorConfig config = OrchestratorConfig.defaults();
    if (options.workers() > 0) {
      config = config.withWorkers(1, options.workers());
    }

    Stopwatch timer = Stopwatch.createStarted();
    ArtifactExporter exporter = ArtifactExporter.open(options.outputDir());
    GenerationOutcome outcome;
    try (WorkerOrchestrator orchestrator =
        new WorkerOrchestrator(
            config,
            device,
            WorkerFactory.inProcess(generation, device, MemoryMonitor.runtime()))) {
      orchestrator.start();
      GenerationHandle handle = orchestrator.submit(request, exporter);
      Runtime.getRuntime().addShutdownHook(new Thread(handle::cancel, "traitgen-cancel"));
      outcome = await(handle, request.count());
      String report =
          new RunReportBuilder()
              .build(options, outcome, orchestrator.status(), timer.elapsed(TimeUnit.MILLISECONDS));
      if (outcome.succeeded()) {
        exporter.commit(report);
        LOG.info(
            "Wrote {} artifacts to {} in {} ms",
            exporter.written(),
            options.outputDir(),
            timer.elapsed(TimeUnit.MILLISECONDS));
      } else {
        exporter.discard();
      }
    }
    return exitCode(outcome);
  }

  static int exitCode(GenerationOutcome outcome) {
    return switch (outcome.status()) {
      case COMPLETED -> EXIT_OK;
      case CANCELLED -> {
        LOG.warn("Generation cancelled after {} artifacts", outcome.generated());
        yield EXIT_CANCELLED;
      }
      case FAILED -> {
        LOG.error("Generation failed: {}", outcome.message());
        ErrorCode code = outcome.code();
        yield code == ErrorCode.INFEASIBLE || code == ErrorCode.INVALID_CATALOG
            ? EXIT_REJECTED
            : EXIT_FAILED;
      }
    };
  }

  private GenerationOutcome await(GenerationHandle handle, int requested) {
    try {
      return handle.outcome().get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      handle.cancel();
      return GenerationOutcome.cancelled(0, requested);
    } catch (ExecutionException e) {
      throw new IllegalStateException("Generation outcome failed unexpectedly", e.getCause());
    }
  }

  CliOptions parse(String[] args) {
    String[] effectiveArgs = stripCommand(args);
    CliOptions.Builder builder = CliOptions.builder();
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < effectiveArgs.length; i++) {
      ParsedArg parsed = ParsedArg.parse(effectiveArgs[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + effectiveArgs[i]);
      }
      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= effectiveArgs.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = effectiveArgs[++i];
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  private Map<String, OptionSpec> optionSpecs() {
    SizeHolder size = new SizeHolder();
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--catalog", OptionSpec.withValue((b, raw) -> b.catalogFile(Path.of(raw))));
    specs.put("--out", OptionSpec.withValue((b, raw) -> b.outputDir(Path.of(raw))));
    specs.put(
        "--count",
        OptionSpec.withValue((b, raw) -> b.count(CliParsers.parseInt(raw, -1, "--count"))));
    specs.put(
        "--width",
        OptionSpec.withValue(
            (b, raw) -> {
              size.width = CliParsers.parseInt(raw, size.width, "--width");
              b.size(size.width, size.height);
            }));
    specs.put(
        "--height",
        OptionSpec.withValue(
            (b, raw) -> {
              size.height = CliParsers.parseInt(raw, size.height, "--height");
              b.size(size.width, size.height);
            }));
    specs.put(
        "--size",
        OptionSpec.withValue(
            (b, raw) -> {
              int[] parsed = CliParsers.parseSize(raw);
              size.width = parsed[0];
              size.height = parsed[1];
              b.size(size.width, size.height);
            }));
    specs.put("--name", OptionSpec.withValue((b, raw) -> b.projectName(raw)));
    specs.put("--description", OptionSpec.withValue((b, raw) -> b.projectDescription(raw)));
    specs.put(
        "--standard",
        OptionSpec.withValue((b, raw) -> b.standard(MetadataStandard.fromString(raw))));
    specs.put(
        "--workers",
        OptionSpec.withValue((b, raw) -> b.workers(CliParsers.parseInt(raw, 0, "--workers"))));
    specs.put("--seed", OptionSpec.withValue((b, raw) -> b.seed(CliParsers.parseSeed(raw))));
    specs.put(
        "--ordering", OptionSpec.withValue((b, raw) -> b.ordering(CliParsers.parseOrdering(raw))));
    return specs;
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if ("generate".equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  private static final class SizeHolder {
    int width = 512;
    int height = 512;
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(raw.substring(0, equalsIndex), value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
