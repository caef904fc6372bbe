package com.flamingo.ai.mindmap.domain.enums;

import java.lang.Character.UnicodeScript;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Target languages for generated labels and descriptions.
 *
 * <p>Languages written in a non-Latin script carry the scripts a valid response must contain at
 * least one character of. Latin-script languages cannot be told apart by script and carry none.
 */
public enum Language {
  ENGLISH("en", "English", EnumSet.noneOf(UnicodeScript.class),
      "Key points related to %s.", "No overview available."),
  FRENCH("fr", "French", EnumSet.noneOf(UnicodeScript.class),
      "Points clés liés à %s.", "Aucun aperçu disponible."),
  SPANISH("es", "Spanish", EnumSet.noneOf(UnicodeScript.class),
      "Puntos clave relacionados con %s.", "No hay resumen disponible."),
  GERMAN("de", "German", EnumSet.noneOf(UnicodeScript.class),
      "Kernpunkte zu %s.", "Keine Übersicht verfügbar."),
  PORTUGUESE("pt", "Portuguese", EnumSet.noneOf(UnicodeScript.class),
      "Pontos principais relacionados a %s.", "Nenhuma visão geral disponível."),
  ARABIC("ar", "Arabic", EnumSet.of(UnicodeScript.ARABIC),
      "نقاط رئيسية تتعلق بـ %s.", "لا تتوفر نظرة عامة."),
  RUSSIAN("ru", "Russian", EnumSet.of(UnicodeScript.CYRILLIC),
      "Ключевые моменты по теме %s.", "Обзор недоступен."),
  CHINESE("zh", "Chinese", EnumSet.of(UnicodeScript.HAN),
      "与%s相关的要点。", "暂无概述。"),
  JAPANESE("ja", "Japanese",
      EnumSet.of(UnicodeScript.HIRAGANA, UnicodeScript.KATAKANA, UnicodeScript.HAN),
      "%sに関する要点。", "概要はありません。"),
  KOREAN("ko", "Korean", EnumSet.of(UnicodeScript.HANGUL),
      "%s 관련 핵심 내용.", "개요를 사용할 수 없습니다.");

  private final String code;
  private final String displayName;
  private final Set<UnicodeScript> scripts;
  private final String descriptionFallbackPattern;
  private final String noOverviewMessage;

  Language(
      String code,
      String displayName,
      Set<UnicodeScript> scripts,
      String descriptionFallbackPattern,
      String noOverviewMessage) {
    this.code = code;
    this.displayName = displayName;
    this.scripts = scripts;
    this.descriptionFallbackPattern = descriptionFallbackPattern;
    this.noOverviewMessage = noOverviewMessage;
  }

  public String getCode() {
    return code;
  }

  /** Name used inside prompts, e.g. "Arabic". */
  public String getDisplayName() {
    return displayName;
  }

  /** True when a response can be checked for the language by its script alone. */
  public boolean isScriptDistinguishable() {
    return !scripts.isEmpty();
  }

  /** Returns true when the text contains at least one character of this language's script. */
  public boolean containsOwnScript(String text) {
    if (text == null || scripts.isEmpty()) {
      return false;
    }
    return text.codePoints()
        .filter(Character::isLetter)
        .anyMatch(cp -> scripts.contains(UnicodeScript.of(cp)));
  }

  public String fallbackDescription(String label) {
    return String.format(descriptionFallbackPattern, label);
  }

  public String getNoOverviewMessage() {
    return noOverviewMessage;
  }

  /**
   * Resolves a language code or name ("ar", "Arabic", "zh-cn") case-insensitively.
   *
   * @param value code or display name
   * @return the language, or empty when unsupported
   */
  public static Optional<Language> resolve(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    int regionSeparator = normalized.indexOf('-');
    String primary = regionSeparator > 0 ? normalized.substring(0, regionSeparator) : normalized;
    for (Language language : values()) {
      if (language.code.equals(primary)
          || language.displayName.toLowerCase(Locale.ROOT).equals(normalized)) {
        return Optional.of(language);
      }
    }
    return Optional.empty();
  }
}
