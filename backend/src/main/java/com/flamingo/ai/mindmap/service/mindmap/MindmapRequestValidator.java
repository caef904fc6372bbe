package com.flamingo.ai.mindmap.service.mindmap;

import com.flamingo.ai.mindmap.config.MindmapConfig;
import com.flamingo.ai.mindmap.domain.enums.Language;
import com.flamingo.ai.mindmap.exception.InvalidInputException;
import java.util.Arrays;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Checks a {@link MindmapCommand} and resolves its defaults. */
@Component
@RequiredArgsConstructor
public class MindmapRequestValidator {

  private final MindmapConfig mindmapConfig;

  /**
   * Validates the command.
   *
   * @param command the request
   * @return parameters with defaults applied
   * @throws InvalidInputException when the input cannot be processed
   */
  public MindmapParameters validate(MindmapCommand command) {
    if (command == null) {
      throw new InvalidInputException("Request is required");
    }
    boolean hasSegments = command.segments() != null && !command.segments().isEmpty();
    if (hasSegments) {
      int maxSegments = mindmapConfig.getIngestion().getMaxSegments();
      if (command.segments().size() > maxSegments) {
        throw new InvalidInputException(
            "Too many segments: " + command.segments().size() + " (max " + maxSegments + ")");
      }
    } else {
      validateDocument(command.document());
    }

    MindmapConfig.Clustering clustering = mindmapConfig.getClustering();
    int maxDepth = command.maxDepth() != null ? command.maxDepth() : clustering.getMaxDepth();
    if (maxDepth < 1 || maxDepth > clustering.getMaxDepthLimit()) {
      throw new InvalidInputException(
          "Depth must be between 1 and " + clustering.getMaxDepthLimit());
    }
    int minSize = command.minSize() != null ? command.minSize() : clustering.getMinSize();
    if (minSize < 1 || minSize > clustering.getMinSizeLimit()) {
      throw new InvalidInputException(
          "Min size must be between 1 and " + clustering.getMinSizeLimit());
    }

    return new MindmapParameters(resolveLanguage(command.language()), maxDepth, minSize);
  }

  private void validateDocument(String document) {
    if (document == null || document.isBlank()) {
      throw new InvalidInputException("Document cannot be empty");
    }
    int minLength = mindmapConfig.getIngestion().getMinDocumentLength();
    if (document.strip().length() < minLength) {
      throw new InvalidInputException("Document too short (min " + minLength + " characters)");
    }
  }

  private Language resolveLanguage(String requested) {
    if (requested == null || requested.isBlank()) {
      return Language.resolve(mindmapConfig.getDefaultLanguage())
          .orElseThrow(
              () ->
                  new IllegalStateException(
                      "Unsupported default language: " + mindmapConfig.getDefaultLanguage()));
    }
    return Language.resolve(requested)
        .orElseThrow(
            () ->
                new InvalidInputException(
                    "Invalid language '"
                        + requested
                        + "'. Supported: "
                        + Arrays.stream(Language.values())
                            .map(Language::getCode)
                            .collect(Collectors.joining(", "))));
  }
}
