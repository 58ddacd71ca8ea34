package traitgen.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.LinkedHashMap;
import java.util.Map;
import traitgen.generation.RunStats;
import traitgen.orchestrator.GenerationOutcome;
import traitgen.orchestrator.PoolStatus;

final class RunReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

  String build(CliOptions options, GenerationOutcome outcome, PoolStatus pool, long elapsedMs) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(options, elapsedMs));
    root.put("outcome", outcome(outcome));
    if (outcome.stats() != null) {
      root.put("stats", stats(outcome.stats()));
    }
    root.put("pool", pool(pool));
    return gson.toJson(root);
  }

  private Map<String, Object> meta(CliOptions options, long elapsedMs) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("catalog", options.catalogFile().toString());
    meta.put("requested", options.count());
    meta.put("width", options.width());
    meta.put("height", options.height());
    meta.put("standard", options.standard().name());
    meta.put("ordering", options.ordering().name());
    meta.put("seed", options.seed());
    meta.put("time_ms", elapsedMs);
    return meta;
  }

  private Map<String, Object> outcome(GenerationOutcome outcome) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("status", outcome.status().name());
    map.put("generated", outcome.generated());
    map.put("requested", outcome.requested());
    map.put("message", outcome.message());
    map.put("error_code", outcome.code() == null ? null : outcome.code().name());
    return map;
  }

  private Map<String, Object> stats(RunStats stats) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("failed_items", stats.failedItems());
    map.put("retries", stats.retries());
    map.put("backtracks", stats.backtracks());
    map.put("dead_end_hits", stats.deadEndHits());
    map.put("hashed_keys", stats.hashedKeys());
    map.put("decode_hit_rate", stats.decodeHitRate());
    map.put("run_ms", stats.elapsedMillis());
    return map;
  }

  private Map<String, Object> pool(PoolStatus pool) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("workers", pool.workers());
    map.put("healthy", pool.healthy());
    map.put("degraded", pool.degraded());
    map.put("removed", pool.removed());
    map.put("restarts", pool.restarts());
    return map;
  }
}
