package com.gentoro.kbgen.pipeline.progress;

import com.gentoro.kbgen.utility.JacksonUtility;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Progress sink that writes one JSON line per event to the application log:
 *
 * <pre>
 * [kbgen.progress] {"stageId":"focal-nodes","label":"Processing focal nodes","completed":3,
 *   "total":7,"percent":43,"message":"p3 succeeded","attrs":{...},"status":"running"}
 * </pre>
 *
 * Step events are throttled per stage by a {@link ProgressRateLimiter}; stage begin and end
 * events are always written.
 */
public class LoggingProgressSink implements ProgressSink {
  private final org.slf4j.Logger log;
  private final long minIntervalMs;
  private final long minDelta;

  private final Map<String, Long> totals = new ConcurrentHashMap<>();
  private final Map<String, Long> completions = new ConcurrentHashMap<>();
  private final Map<String, String> labels = new ConcurrentHashMap<>();
  private final Map<String, ProgressRateLimiter> limiters = new ConcurrentHashMap<>();

  public LoggingProgressSink(org.slf4j.Logger logger, long minIntervalMs, long minDelta) {
    this.log = Objects.requireNonNull(logger, "logger");
    this.minIntervalMs = minIntervalMs;
    this.minDelta = minDelta;
  }

  @Override
  public void beginStage(String id, String label, long totalWork) {
    totals.put(id, Math.max(0, totalWork));
    completions.put(id, 0L);
    labels.put(id, label);
    limiters.put(id, new ProgressRateLimiter(minIntervalMs, minDelta));
    emit(id, 0L, "begin", Map.of(), "running");
  }

  @Override
  public void step(String id, long completed, String message, Map<String, Object> attrs) {
    completions.merge(id, completed, Math::max);
    ProgressRateLimiter limiter =
        limiters.computeIfAbsent(id, k -> new ProgressRateLimiter(minIntervalMs, minDelta));
    if (limiter.tryAcquire(System.currentTimeMillis(), completed)) {
      emit(id, completed, message, attrs, "running");
    }
  }

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {
    long total = totals.getOrDefault(id, 0L);
    emit(id, Math.max(total, completions.getOrDefault(id, 0L)), "end", attrs, "ok");
  }

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {
    Map<String, Object> merged = new HashMap<>();
    if (attrs != null) merged.putAll(attrs);
    if (errorSummary != null) merged.put("error", errorSummary);
    emit(id, completions.getOrDefault(id, 0L), "error", merged, "error");
  }

  /** Build the payload map. */
  protected Map<String, Object> createPayload(
      String id, long completed, String message, Map<String, Object> attrs, String status) {
    long total = totals.getOrDefault(id, 0L);
    long safeCompleted = Math.max(0, total == 0 ? completed : Math.min(completed, total));
    int percent = total > 0 ? (int) Math.min(100, Math.round(safeCompleted * 100.0 / total)) : 0;
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("stageId", id);
    payload.put("label", labels.getOrDefault(id, id));
    payload.put("completed", safeCompleted);
    payload.put("total", total);
    payload.put("percent", percent);
    payload.put("message", message);
    payload.put("attrs", attrs == null ? Map.of() : attrs);
    payload.put("status", status);
    return payload;
  }

  void emit(String id, long completed, String message, Map<String, Object> attrs, String status) {
    log.info(
        "[kbgen.progress] {}",
        JacksonUtility.toCompactJson(createPayload(id, completed, message, attrs, status)));
  }
}
