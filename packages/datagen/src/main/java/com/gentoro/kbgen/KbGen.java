package com.gentoro.kbgen;

import com.gentoro.kbgen.build.GraphBuildDriver;
import com.gentoro.kbgen.clarify.ClarificationGenerator;
import com.gentoro.kbgen.clarify.GeneratedClarificationGenerator;
import com.gentoro.kbgen.clarify.TemplateClarificationGenerator;
import com.gentoro.kbgen.diff.DocumentDiffer;
import com.gentoro.kbgen.diff.MarkdownDiffFormatter;
import com.gentoro.kbgen.exception.ConfigException;
import com.gentoro.kbgen.exception.StateException;
import com.gentoro.kbgen.generation.TextGenerationService;
import com.gentoro.kbgen.graph.GraphCodec;
import com.gentoro.kbgen.graph.KnowledgeGraph;
import com.gentoro.kbgen.logging.LoggingService;
import com.gentoro.kbgen.model.LlmClient;
import com.gentoro.kbgen.model.LlmClientFactory;
import com.gentoro.kbgen.output.DatasetWriter;
import com.gentoro.kbgen.pipeline.ScenarioCatalog;
import com.gentoro.kbgen.pipeline.ScenarioConfig;
import com.gentoro.kbgen.pipeline.ScenarioPipeline;
import com.gentoro.kbgen.pipeline.ScenarioSummary;
import com.gentoro.kbgen.pipeline.progress.LoggingProgressSink;
import com.gentoro.kbgen.pipeline.progress.ProgressSink;
import com.gentoro.kbgen.prompt.PromptRepository;
import com.gentoro.kbgen.prompt.PromptRepositoryFactory;
import com.gentoro.kbgen.query.GeneratedQuestionPhraser;
import com.gentoro.kbgen.query.QueryDeriver;
import com.gentoro.kbgen.query.QuestionPhraser;
import com.gentoro.kbgen.query.TemplateQuestionPhraser;
import com.gentoro.kbgen.render.NeighborhoodRenderer;
import com.gentoro.kbgen.update.DeterministicReplacementSource;
import com.gentoro.kbgen.update.GeneratedReplacementSource;
import com.gentoro.kbgen.update.ReplacementSource;
import com.gentoro.kbgen.update.UpdateSimulator;
import com.gentoro.kbgen.validation.GraphValidator;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: loads configuration, wires the generation components and runs the mode
 * selected on the command line.
 */
public class KbGen {
  private static final org.slf4j.Logger log = LoggingService.getLogger(KbGen.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private ScenarioCatalog catalog;
  private LlmClient llmClient;
  private PromptRepository promptRepository;
  private TextGenerationService generationService;

  public KbGen(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs));
  }

  public KbGen(StartupParameters startupParameters) {
    this.startupParameters = startupParameters;
  }

  public KbGen initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());
    startupParameters
        .getOptionalParameter("output-dir", String.class)
        .ifPresent(dir -> configuration().setProperty("output.base-dir", dir));
    this.catalog = ScenarioCatalog.fromConfiguration(configuration());
    return this;
  }

  /** Run the selected mode and return one summary per scenario processed. */
  public List<ScenarioSummary> run() {
    switch (startupParameters.mode()) {
      case "generate":
        return generate();
      case "render":
        return render();
      case "help":
        return List.of();
      default:
        throw new IllegalArgumentException("Invalid mode: " + startupParameters.mode());
    }
  }

  private List<ScenarioSummary> generate() {
    ScenarioPipeline pipeline = createPipeline(false);
    List<ScenarioSummary> summaries = new ArrayList<>();
    for (ScenarioConfig scenario : selectedScenarios()) {
      summaries.add(pipeline.run(scenario));
    }
    return summaries;
  }

  /** Offline mode: reads a stored graph and uses template questions and deterministic edits. */
  private List<ScenarioSummary> render() {
    Path graphFile = Paths.get(startupParameters.getParameter("graph-file", String.class));
    KnowledgeGraph graph = GraphCodec.read(graphFile);
    log.info(
        "Loaded graph from {} ({} nodes, {} edges)",
        graphFile,
        graph.nodeCount(),
        graph.edgeCount());
    List<ScenarioConfig> scenarios = selectedScenarios();
    return List.of(createPipeline(true).run(scenarios.get(0), graph));
  }

  List<ScenarioConfig> selectedScenarios() {
    if (catalog.isEmpty()) {
      throw new ConfigException("No scenarios configured");
    }
    return startupParameters
        .getOptionalParameter("scenario", String.class)
        .map(name -> List.of(catalog.get(name)))
        .orElseGet(catalog::all);
  }

  ScenarioPipeline createPipeline(boolean offline) {
    Configuration cfg = configuration();
    ProgressSink progress =
        new LoggingProgressSink(
            LoggingService.getLogger(ScenarioPipeline.class),
            cfg.getLong("pipeline.progress.min-interval-ms", 1000L),
            cfg.getLong("pipeline.progress.min-delta", 1L));

    QuestionPhraser phraser;
    ReplacementSource replacements;
    ClarificationGenerator clarifier;
    GraphBuildDriver builder = null;
    if (offline) {
      phraser = new TemplateQuestionPhraser();
      replacements = new DeterministicReplacementSource();
      clarifier = new TemplateClarificationGenerator();
    } else {
      TextGenerationService generation = generationService();
      phraser = new GeneratedQuestionPhraser(generation);
      replacements = new GeneratedReplacementSource(generation);
      clarifier = new GeneratedClarificationGenerator(generation);
      builder = new GraphBuildDriver(generation, progress);
    }

    NeighborhoodRenderer renderer = NeighborhoodRenderer.fromConfiguration(cfg);
    GraphValidator validator = new GraphValidator();
    DocumentDiffer differ = new DocumentDiffer();
    return new ScenarioPipeline(
        builder,
        validator,
        renderer,
        new QueryDeriver(),
        phraser,
        UpdateSimulator.fromConfiguration(cfg, renderer, validator, differ, replacements),
        clarifier,
        DatasetWriter.fromConfiguration(cfg, new MarkdownDiffFormatter(differ)),
        progress,
        ScenarioPipeline.parallelism(cfg),
        ScenarioPipeline.nodeTimeoutMs(cfg));
  }

  private synchronized TextGenerationService generationService() {
    if (generationService == null) {
      this.llmClient = LlmClientFactory.createProvider(configuration());
      this.promptRepository = PromptRepositoryFactory.create(configuration().subset("prompt"));
      this.generationService =
          TextGenerationService.fromConfiguration(llmClient, promptRepository, configuration());
    }
    return generationService;
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("KbGen not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public ScenarioCatalog catalog() {
    return catalog;
  }
}
