package com.flamingo.ai.mindmap.service.generation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Normalizes raw model output before validation: removes reasoning blocks, markup tags, boilerplate
 * prefixes, markdown emphasis and wrapping quotes, and collapses whitespace.
 */
@Component
public class ResponseCleaner {

  private static final Pattern REASONING_BLOCK =
      Pattern.compile(
          "<(think|thinking|reasoning|analysis)\\b[^>]*>.*?</\\1\\s*>",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  // An unclosed reasoning block runs to the end of the response
  private static final Pattern UNCLOSED_REASONING =
      Pattern.compile(
          "<(think|thinking|reasoning|analysis)\\b[^>]*>.*$",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  // Everything before a stray closing tag is reasoning whose opening tag was cut off
  private static final Pattern ORPHAN_REASONING_END =
      Pattern.compile(
          "^.*</(think|thinking|reasoning|analysis)\\s*>",
          Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
  private static final Pattern TAG = Pattern.compile("</?[A-Za-z][^<>]*>");
  private static final Pattern PREFIX =
      Pattern.compile(
          "^(output|topic|caption|title|answer|summary)\\s*:\\s*", Pattern.CASE_INSENSITIVE);
  private static final Pattern BOLD_STARS = Pattern.compile("\\*\\*(.+?)\\*\\*", Pattern.DOTALL);
  private static final Pattern BOLD_UNDERSCORES = Pattern.compile("__(.+?)__", Pattern.DOTALL);
  private static final Pattern ITALIC_STARS = Pattern.compile("\\*([^*\\s](?:[^*]*?[^*\\s])?)\\*");
  // Underscores inside words (snake_case) are kept
  private static final Pattern ITALIC_UNDERSCORES =
      Pattern.compile("(?<![\\p{L}\\p{N}_])_([^_\\s](?:[^_]*?[^_\\s])?)_(?![\\p{L}\\p{N}_])");
  private static final Pattern STRAY_STARS = Pattern.compile("\\*+");
  private static final Pattern STRAY_UNDERSCORES =
      Pattern.compile("(?<![\\p{L}\\p{N}])_+|_+(?![\\p{L}\\p{N}])");
  private static final Pattern HEADING = Pattern.compile("(?m)^\\s*#{1,6}\\s+");
  private static final Pattern INLINE_CODE = Pattern.compile("`([^`]*)`");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private static final String[][] QUOTE_PAIRS = {
    {"\"", "\""}, {"'", "'"}, {"“", "”"}, {"‘", "’"}, {"«", "»"}, {"「", "」"}, {"『", "』"}
  };

  /**
   * Cleans a raw response.
   *
   * @param raw model output, may be null
   * @return cleaned text, empty when nothing usable remains
   */
  public String clean(String raw) {
    if (raw == null) {
      return "";
    }
    String text = stripReasoning(raw);
    text = TAG.matcher(text).replaceAll(" ");
    text = replaceKeepingGroup(BOLD_STARS, text);
    text = replaceKeepingGroup(BOLD_UNDERSCORES, text);
    text = replaceKeepingGroup(ITALIC_STARS, text);
    text = replaceKeepingGroup(ITALIC_UNDERSCORES, text);
    text = STRAY_STARS.matcher(text).replaceAll("");
    text = STRAY_UNDERSCORES.matcher(text).replaceAll("");
    text = HEADING.matcher(text).replaceAll("");
    text = replaceKeepingGroup(INLINE_CODE, text);
    text = WHITESPACE.matcher(text).replaceAll(" ").trim();

    String previous;
    do {
      previous = text;
      text = stripWrappingQuotes(text);
      text = PREFIX.matcher(text).replaceFirst("").trim();
    } while (!text.equals(previous));
    return text;
  }

  /**
   * Removes reasoning blocks only, leaving the rest of the response untouched.
   *
   * @param raw model output, may be null
   * @return the response without reasoning, trimmed
   */
  public String stripReasoning(String raw) {
    if (raw == null) {
      return "";
    }
    String text = REASONING_BLOCK.matcher(raw).replaceAll(" ");
    text = UNCLOSED_REASONING.matcher(text).replaceAll(" ");
    return ORPHAN_REASONING_END.matcher(text).replaceAll(" ").trim();
  }

  private static String replaceKeepingGroup(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    return matcher.replaceAll(match -> Matcher.quoteReplacement(match.group(1)));
  }

  private static String stripWrappingQuotes(String text) {
    for (String[] pair : QUOTE_PAIRS) {
      if (text.length() >= pair[0].length() + pair[1].length()
          && text.startsWith(pair[0])
          && text.endsWith(pair[1])) {
        return text.substring(pair[0].length(), text.length() - pair[1].length()).trim();
      }
    }
    return text;
  }
}
