package com.flamingo.ai.mindmap.service.generation;

import com.flamingo.ai.mindmap.agent.MindmapWriterAgent;
import com.flamingo.ai.mindmap.exception.LlmServiceException;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link TextGenerationProvider} backed by the {@link MindmapWriterAgent}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentTextGenerationProvider implements TextGenerationProvider {

  private final MindmapWriterAgent mindmapWriterAgent;

  @Override
  public String generate(String prompt) {
    try {
      String response = mindmapWriterAgent.write(prompt);
      log.debug("Generation returned {} chars", response == null ? 0 : response.length());
      return response == null ? "" : response;
    } catch (LlmServiceException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new LlmServiceException(
          "Text generation failed: " + e.getMessage(), e, isRateLimited(e));
    }
  }

  private boolean isRateLimited(Throwable e) {
    String message = e.getMessage();
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    return lower.contains("429") || lower.contains("rate limit");
  }
}
