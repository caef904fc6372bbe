package com.flamingo.ai.mindmap.service.mindmap;

import com.flamingo.ai.mindmap.config.MindmapConfig;
import com.flamingo.ai.mindmap.domain.model.TextSegment;
import com.flamingo.ai.mindmap.exception.InvalidInputException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns raw input into indexed segments: one segment per non-empty line of a document (or per
 * supplied segment), with control characters removed, Arabic diacritics and tatweel stripped and
 * whitespace collapsed. Segments shorter than {@code mindmap.ingestion.min-segment-length} are
 * dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SegmentPreprocessor {

  private static final Pattern LINE_BREAK = Pattern.compile("\\R");
  private static final Pattern CONTROL = Pattern.compile("\\p{Cc}");
  private static final Pattern ARABIC_MARKS =
      Pattern.compile("[\\u0617-\\u061A\\u064B-\\u0652\\u0640]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final MindmapConfig mindmapConfig;

  public List<TextSegment> fromDocument(String document) {
    if (document == null) {
      throw new InvalidInputException("Document cannot be empty");
    }
    return fromSegments(List.of(LINE_BREAK.split(document)));
  }

  public List<TextSegment> fromSegments(List<String> rawSegments) {
    int minLength = mindmapConfig.getIngestion().getMinSegmentLength();
    List<TextSegment> segments = new ArrayList<>();
    int dropped = 0;
    for (String raw : rawSegments) {
      if (raw == null) {
        dropped++;
        continue;
      }
      String cleaned = clean(raw);
      if (cleaned.length() < minLength) {
        dropped++;
        continue;
      }
      segments.add(new TextSegment(segments.size(), raw, cleaned));
    }
    if (segments.isEmpty()) {
      throw new InvalidInputException(
          "No segment of at least " + minLength + " characters found in the input");
    }
    int maxSegments = mindmapConfig.getIngestion().getMaxSegments();
    if (segments.size() > maxSegments) {
      throw new InvalidInputException(
          "Too many segments: " + segments.size() + " (max " + maxSegments + ")");
    }
    log.debug("Prepared {} segments ({} dropped)", segments.size(), dropped);
    return segments;
  }

  static String clean(String raw) {
    String text = CONTROL.matcher(raw).replaceAll(" ");
    text = ARABIC_MARKS.matcher(text).replaceAll("");
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }
}
