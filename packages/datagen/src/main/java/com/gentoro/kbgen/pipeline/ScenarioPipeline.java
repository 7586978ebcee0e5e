package com.gentoro.kbgen.pipeline;

import com.gentoro.kbgen.build.GraphBuildDriver;
import com.gentoro.kbgen.clarify.ClarificationGenerator;
import com.gentoro.kbgen.clarify.ClarificationKind;
import com.gentoro.kbgen.clarify.ClarificationSample;
import com.gentoro.kbgen.exception.ExceptionUtil;
import com.gentoro.kbgen.exception.GenerationException;
import com.gentoro.kbgen.exception.MutationExhaustedException;
import com.gentoro.kbgen.exception.NoMutableFactException;
import com.gentoro.kbgen.exception.ValidationException;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.graph.Node;
import com.gentoro.kbgen.output.DatasetWriter;
import com.gentoro.kbgen.pipeline.progress.ProgressSink;
import com.gentoro.kbgen.query.QueryDerivation;
import com.gentoro.kbgen.query.QueryDeriver;
import com.gentoro.kbgen.query.QueryRecord;
import com.gentoro.kbgen.query.QuestionPhraser;
import com.gentoro.kbgen.render.DocumentSet;
import com.gentoro.kbgen.render.NeighborhoodRenderer;
import com.gentoro.kbgen.update.UpdateScenario;
import com.gentoro.kbgen.update.UpdateSimulator;
import com.gentoro.kbgen.validation.GraphValidator;
import com.gentoro.kbgen.validation.ValidationResult;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.apache.commons.configuration2.Configuration;

/**
 * Runs one scenario end to end: build (or accept) a graph, validate it, then render, question,
 * update and clarify every sampled focal node.
 *
 * <p>The validated graph is frozen before any focal node pass starts, so passes share it without
 * locking. Passes run on a fixed pool, each with its own {@link Random} derived from the scenario
 * seed and the focal node id. A pass that fails or exceeds the node timeout is recorded as failed;
 * other passes are not affected. A graph that cannot be built fails its scenario only.
 */
public class ScenarioPipeline {
  private static final org.slf4j.Logger log =
      com.gentoro.kbgen.logging.LoggingService.getLogger(ScenarioPipeline.class);

  static final String VALIDATE_STAGE = "validate";
  static final String FOCAL_STAGE = "focal-nodes";

  private final GraphBuildDriver builder;
  private final GraphValidator validator;
  private final NeighborhoodRenderer renderer;
  private final QueryDeriver deriver;
  private final QuestionPhraser phraser;
  private final UpdateSimulator simulator;
  private final ClarificationGenerator clarifier;
  private final DatasetWriter writer;
  private final ProgressSink progress;
  private final int parallelism;
  private final long nodeTimeoutMs;

  public ScenarioPipeline(
      GraphBuildDriver builder,
      GraphValidator validator,
      NeighborhoodRenderer renderer,
      QueryDeriver deriver,
      QuestionPhraser phraser,
      UpdateSimulator simulator,
      ClarificationGenerator clarifier,
      DatasetWriter writer,
      ProgressSink progress,
      int parallelism,
      long nodeTimeoutMs) {
    if (parallelism < 1) {
      throw new ValidationException("parallelism must be >= 1, got " + parallelism);
    }
    if (nodeTimeoutMs < 1) {
      throw new ValidationException("node timeout must be >= 1 ms, got " + nodeTimeoutMs);
    }
    this.builder = builder;
    this.validator = validator;
    this.renderer = renderer;
    this.deriver = deriver;
    this.phraser = phraser;
    this.simulator = simulator;
    this.clarifier = clarifier;
    this.writer = writer;
    this.progress = progress;
    this.parallelism = parallelism;
    this.nodeTimeoutMs = nodeTimeoutMs;
  }

  public static int parallelism(Configuration cfg) {
    return cfg.getInt("pipeline.parallelism", 4);
  }

  public static long nodeTimeoutMs(Configuration cfg) {
    return cfg.getLong("pipeline.node-timeout-ms", 600_000L);
  }

  /** Generate a fresh graph for {@code scenario} and run it. */
  public ScenarioSummary run(ScenarioConfig scenario) {
    if (builder == null) {
      throw new ValidationException("No graph builder configured; supply a graph instead");
    }
    log.info("Building graph for scenario {}", scenario.name());
    KnowledgeGraph graph;
    try {
      graph =
          builder.build(scenario.worldDescription(), scenario.numPeople(), scenario.numEntities());
    } catch (GenerationException | ValidationException e) {
      log.error("Graph for scenario {} could not be built", scenario.name(), e);
      ScenarioSummary summary =
          ScenarioSummary.ofBuildFailure(
              scenario.name(),
              instanceId(new Random(scenario.seed())),
              ExceptionUtil.summarize(e));
      log.warn("{}", summary.describe());
      return summary;
    }
    return run(scenario, graph);
  }

  /** Run {@code scenario} against an existing graph. The graph is frozen when it validates. */
  public ScenarioSummary run(ScenarioConfig scenario, KnowledgeGraph graph) {
    Random scenarioRandom = new Random(scenario.seed());
    String instanceId = instanceId(scenarioRandom);

    progress.beginStage(VALIDATE_STAGE, "Validating graph", 1);
    ValidationResult validation = validator.validate(graph);
    if (!validation.ok()) {
      validation
          .violations()
          .forEach(v -> log.error("{} {}: {}", v.invariant(), v.subject(), v.message()));
      progress.endStageError(
          VALIDATE_STAGE,
          validation.violations().size() + " violation(s)",
          Map.of("scenario", scenario.name()));
      ScenarioSummary summary =
          new ScenarioSummary(
              scenario.name(),
              instanceId,
              null,
              graph.nodeCount(),
              graph.edgeCount(),
              validation.violations(),
              List.of());
      log.warn("{}", summary.describe());
      return summary;
    }
    progress.endStageOk(VALIDATE_STAGE, Map.of("nodes", graph.nodeCount()));
    graph.freeze();

    Path instanceDir = writer.instanceDir(scenario.name(), instanceId);
    writer.writeGraph(instanceDir, graph);

    List<String> focalIds = sampleFocalNodes(graph, scenario, scenarioRandom);
    List<FocalNodeResult> results = runFocalNodes(scenario, graph, instanceDir, focalIds);

    ScenarioSummary summary =
        new ScenarioSummary(
            scenario.name(),
            instanceId,
            instanceDir,
            graph.nodeCount(),
            graph.edgeCount(),
            List.of(),
            results);
    log.info("{}", summary.describe());
    return summary;
  }

  /** Instance ids are drawn from the scenario seed, so a rerun writes to the same directory. */
  static String instanceId(Random scenarioRandom) {
    return new UUID(scenarioRandom.nextLong(), scenarioRandom.nextLong()).toString();
  }

  static List<String> sampleFocalNodes(
      KnowledgeGraph graph, ScenarioConfig scenario, Random random) {
    List<String> personIds = new ArrayList<>(graph.persons().stream().map(Node::getId).toList());
    if (personIds.size() < scenario.numFocalNodes()) {
      log.warn(
          "Scenario {} requested {} focal node(s) but the graph has {} person(s); using all",
          scenario.name(),
          scenario.numFocalNodes(),
          personIds.size());
    }
    Collections.shuffle(personIds, random);
    return List.copyOf(personIds.subList(0, Math.min(scenario.numFocalNodes(), personIds.size())));
  }

  private List<FocalNodeResult> runFocalNodes(
      ScenarioConfig scenario, KnowledgeGraph graph, Path instanceDir, List<String> focalIds) {
    progress.beginStage(FOCAL_STAGE, "Processing focal nodes", focalIds.size());
    ExecutorService executor =
        Executors.newFixedThreadPool(parallelism, daemonThreads("kbgen-node"));
    ScheduledExecutorService timer =
        Executors.newSingleThreadScheduledExecutor(daemonThreads("kbgen-node-timer"));
    AtomicInteger completed = new AtomicInteger();
    try {
      List<FutureTask<FocalNodeResult>> tasks = new ArrayList<>();
      for (String focalId : focalIds) {
        AtomicBoolean timedOut = new AtomicBoolean();
        FutureTask<FocalNodeResult> task =
            new FutureTask<>(
                () -> {
                  Random random = new Random(Objects.hash(scenario.seed(), focalId));
                  return processFocalNode(
                      scenario, graph, instanceDir, focalId, random, timedOut::get);
                });
        tasks.add(task);
        executor.execute(
            () -> {
              // the timeout starts when the pass does, not when it is queued
              ScheduledFuture<?> deadline =
                  timer.schedule(
                      () -> {
                        timedOut.set(true);
                        task.cancel(true);
                      },
                      nodeTimeoutMs,
                      TimeUnit.MILLISECONDS);
              try {
                task.run();
              } finally {
                deadline.cancel(false);
              }
            });
      }

      List<FocalNodeResult> results = new ArrayList<>();
      for (int i = 0; i < tasks.size(); i++) {
        FocalNodeResult result = await(focalIds.get(i), tasks.get(i));
        results.add(result);
        progress.step(
            FOCAL_STAGE,
            completed.incrementAndGet(),
            result.focalNodeId() + " " + result.status().name().toLowerCase(Locale.ROOT),
            Map.of("focalNodeId", result.focalNodeId(), "status", result.status().name()));
      }
      progress.endStageOk(FOCAL_STAGE, Map.of("scenario", scenario.name()));
      return results;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      progress.endStageError(FOCAL_STAGE, "interrupted", Map.of("scenario", scenario.name()));
      throw new GenerationException("Scenario " + scenario.name() + " was interrupted", e, false);
    } finally {
      executor.shutdownNow();
      timer.shutdownNow();
    }
  }

  private FocalNodeResult await(String focalId, FutureTask<FocalNodeResult> task)
      throws InterruptedException {
    try {
      return task.get();
    } catch (CancellationException e) {
      log.error("Focal node {} timed out after {} ms", focalId, nodeTimeoutMs);
      return FocalNodeResult.failed(focalId, "timed out after " + nodeTimeoutMs + " ms");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      log.error("Focal node {} failed", focalId, cause);
      return FocalNodeResult.failed(focalId, ExceptionUtil.summarize(cause));
    }
  }

  /**
   * One focal node pass. Question, update and clarification failures that only cost an artifact
   * are recorded as skip reasons; anything else fails the pass. Nothing is written once {@code
   * cancelled} reports true or the thread is interrupted, even if a component swallowed the
   * interrupt.
   */
  FocalNodeResult processFocalNode(
      ScenarioConfig scenario,
      KnowledgeGraph graph,
      Path instanceDir,
      String focalId,
      Random random,
      BooleanSupplier cancelled) {
    log.debug("Processing focal node {} of scenario {}", focalId, scenario.name());
    List<String> skipped = new ArrayList<>();
    DocumentSet documents = renderer.render(graph, focalId, scenario.radius());

    QueryDerivation derivation =
        deriver.derive(graph, focalId, scenario.questionsPerHop(), random);
    List<QueryRecord> questions = List.of();
    try {
      List<String> phrased = phraser.phrase(graph, derivation.facts());
      questions = QueryRecord.assemble(graph, derivation.facts(), phrased);
    } catch (GenerationException e) {
      log.warn("Questions for focal node {} skipped: {}", focalId, e.getMessage());
      skipped.add("questions: " + ExceptionUtil.summarize(e));
    }

    List<UpdateScenario> updates = new ArrayList<>();
    for (Map.Entry<Integer, Integer> entry : new TreeMap<>(scenario.updatesPerHop()).entrySet()) {
      int hop = entry.getKey();
      for (int i = 0; i < entry.getValue(); i++) {
        try {
          updates.add(simulator.simulate(graph, documents, focalId, hop, random));
        } catch (NoMutableFactException e) {
          log.warn("Focal node {} has nothing to update at hop {}", focalId, hop);
          skipped.add("updates at hop " + hop + ": " + ExceptionUtil.summarize(e));
          break;
        } catch (MutationExhaustedException | GenerationException e) {
          log.warn(
              "Update {}_hop/{} of focal node {} skipped: {}", hop, i, focalId, e.getMessage());
          skipped.add("update " + hop + "_hop/" + i + ": " + ExceptionUtil.summarize(e));
        }
      }
    }

    List<ClarificationSample> clarifications = new ArrayList<>();
    for (ClarificationKind kind : ClarificationKind.values()) {
      for (int i = 0; i < scenario.clarificationsPerKind(); i++) {
        try {
          Optional<ClarificationSample> sample =
              clarifier.generate(graph, documents, kind, random);
          if (sample.isEmpty()) {
            log.warn("Focal node {} offers nothing for a {} clarification", focalId, kind.label());
            break;
          }
          clarifications.add(sample.get());
        } catch (GenerationException e) {
          log.warn(
              "Clarification {} of focal node {} skipped: {}",
              kind.label(),
              focalId,
              e.getMessage());
          skipped.add("clarification " + kind.label() + ": " + ExceptionUtil.summarize(e));
        }
      }
    }

    if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Focal node " + focalId + " was cancelled");
    }
    Path dir =
        writer.writeMemory(
            instanceDir, documents, questions, derivation.shortfalls(), updates, clarifications);
    return FocalNodeResult.completed(
        focalId,
        documents.size(),
        questions.size(),
        updates.size(),
        clarifications.size(),
        skipped,
        dir);
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
