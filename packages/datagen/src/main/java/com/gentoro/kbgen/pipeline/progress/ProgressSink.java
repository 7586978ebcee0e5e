package com.gentoro.kbgen.pipeline.progress;

import java.util.Map;

/**
 * Progress reporting for long-running dataset generation.
 *
 * <p>Decouples the scenario pipeline (producer of progress events) from where they end up.
 * Implementations must be thread-safe: focal node passes report concurrently.
 */
public interface ProgressSink {

  /**
   * Signal the beginning of a stage.
   *
   * @param id stable stage identifier (e.g., "build", "validate", "focal-nodes")
   * @param label human-readable label for presentation
   * @param totalWork total work units, 0 when unknown
   */
  void beginStage(String id, String label, long totalWork);

  /**
   * Report an incremental step within a stage.
   *
   * @param id stage identifier
   * @param completed completed work units so far
   * @param message short message describing the current step
   * @param attrs optional structured attributes (e.g., focal node id, outcome)
   */
  void step(String id, long completed, String message, Map<String, Object> attrs);

  void endStageOk(String id, Map<String, Object> attrs);

  void endStageError(String id, String errorSummary, Map<String, Object> attrs);
}
