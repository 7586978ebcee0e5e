package com.gentoro.kbgen.pipeline.progress;

import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.slf4j.Logger;

class LoggingProgressSinkTest {
  private static final String FORMAT = "[kbgen.progress] {}";

  @Test
  void writesStageLifecycleAsJsonLines() {
    Logger logger = Mockito.mock(Logger.class);
    LoggingProgressSink sink = new LoggingProgressSink(logger, 60_000, 10);

    sink.beginStage("focal-nodes", "Processing focal nodes", 4);
    sink.step("focal-nodes", 1, "p1 succeeded", Map.of("focalNodeId", "p1"));
    // throttled: neither the interval nor the delta is reached
    sink.step("focal-nodes", 2, "p2 succeeded", Map.of("focalNodeId", "p2"));
    sink.endStageOk("focal-nodes", Map.of());

    verify(logger).info(eq(FORMAT), contains("\"message\":\"begin\""));
    verify(logger).info(eq(FORMAT), contains("\"completed\":1,\"total\":4,\"percent\":25"));
    verify(logger, times(0)).info(eq(FORMAT), contains("p2 succeeded"));
    verify(logger).info(eq(FORMAT), contains("\"percent\":100"));
    verify(logger, times(3)).info(eq(FORMAT), contains("\"stageId\":\"focal-nodes\""));
  }

  @Test
  void errorsCarryTheSummary() {
    Logger logger = Mockito.mock(Logger.class);
    LoggingProgressSink sink = new LoggingProgressSink(logger, 0, 1);

    sink.beginStage("validate", "Validating graph", 1);
    sink.endStageError("validate", "2 violation(s)", Map.of());

    verify(logger).info(eq(FORMAT), contains("\"error\":\"2 violation(s)\""));
    verify(logger).info(eq(FORMAT), contains("\"status\":\"error\""));
  }
}
