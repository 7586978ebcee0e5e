package com.gentoro.kbgen;

import com.gentoro.kbgen.pipeline.FocalNodeResult;
import com.gentoro.kbgen.pipeline.ScenarioSummary;
import java.util.List;

public class KbGenApp {

  private static final org.slf4j.Logger log =
      com.gentoro.kbgen.logging.LoggingService.getLogger(KbGenApp.class);

  static final String USAGE =
      """
      Usage: kbgen [--mode generate|render|help] [--config-file <location>]
                   [--scenario <name>] [--graph-file <graph.json>] [--output-dir <dir>]

        generate  build a graph per scenario with the configured LLM and write the dataset
        render    read --graph-file and write documents, template questions and
                  deterministic updates without calling an LLM
        help      print this message
      """;

  public static void main(String[] args) {
    int status;
    try {
      StartupParameters parameters = new StartupParameters(args);
      if ("help".equals(parameters.mode())) {
        System.out.print(USAGE);
        return;
      }
      List<ScenarioSummary> summaries = new KbGen(parameters).initialize().run();
      status = exitStatus(summaries);
    } catch (IllegalArgumentException e) {
      log.error("{}", e.getMessage());
      System.err.print(USAGE);
      status = 2;
    } catch (Exception e) {
      log.error("Dataset generation failed", e);
      status = 1;
    }
    if (status != 0) {
      System.exit(status);
    }
  }

  /** 0 when every scenario ran and no focal node failed, 1 otherwise. */
  static int exitStatus(List<ScenarioSummary> summaries) {
    for (ScenarioSummary s : summaries) {
      if (s.buildFailed()
          || s.rejected()
          || !s.withStatus(FocalNodeResult.Status.FAILED).isEmpty()) {
        return 1;
      }
    }
    return 0;
  }
}
