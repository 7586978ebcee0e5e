package com.gentoro.kbgen.model;

import com.gentoro.kbgen.exception.ExceptionUtil;
import com.gentoro.kbgen.exception.GenerationException;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/**
 * Base {@link LlmClient} with common plumbing: timing, trace logging and translation of provider
 * failures into {@link GenerationException}.
 *
 * <p>Subclasses implement {@link #runInference(List)} against a concrete provider API.
 */
public abstract class AbstractLlmClient implements LlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.kbgen.logging.LoggingService.getLogger(AbstractLlmClient.class);
  protected final Configuration configuration;

  protected AbstractLlmClient(Configuration configuration) {
    this.configuration = configuration;
  }

  @Override
  public String chat(List<Message> messages) {
    log.trace("chat() called with {} message(s)", messages.size());
    long start = System.currentTimeMillis();
    try {
      return runInference(messages);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          (ex) ->
              new GenerationException(
                  "There was a problem while running the inference with the chosen model.", ex));
    } finally {
      log.debug("Inference completed in {} ms", System.currentTimeMillis() - start);
    }
  }

  protected abstract String runInference(List<Message> messages) throws Exception;
}
