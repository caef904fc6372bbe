package com.flamingo.ai.mindmap.service.generation;

import java.util.Locale;

/** Reasons a generated text is rejected, in the order they are checked. */
public enum ValidationFailure {
  EMPTY,
  REASONING_MARKUP,
  MARKUP_TAGS,
  EXPLANATORY_PREAMBLE,
  WRONG_SCRIPT,
  MARKDOWN_NOISE,
  TOO_LONG;

  /** Tag value used in metrics. */
  public String metricTag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
