package com.flamingo.ai.mindmap.domain.enums;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LanguageTest {

  @ParameterizedTest
  @CsvSource({"ar, ARABIC", "Arabic, ARABIC", "ZH-cn, CHINESE", "  en , ENGLISH", "korean, KOREAN"})
  @DisplayName("should resolve codes, regional codes and names")
  void shouldResolve(String value, Language expected) {
    assertThat(Language.resolve(value)).contains(expected);
  }

  @Test
  @DisplayName("should not resolve unknown or blank values")
  void shouldNotResolveUnknown() {
    assertThat(Language.resolve("klingon")).isEmpty();
    assertThat(Language.resolve(" ")).isEmpty();
    assertThat(Language.resolve(null)).isEmpty();
  }

  @Test
  @DisplayName("should detect its own script for non-Latin languages")
  void shouldDetectScript() {
    assertThat(Language.ARABIC.containsOwnScript("Solar الطاقة")).isTrue();
    assertThat(Language.ARABIC.containsOwnScript("Solar energy")).isFalse();
    assertThat(Language.JAPANESE.containsOwnScript("カタカナ")).isTrue();
    assertThat(Language.RUSSIAN.containsOwnScript("Энергия")).isTrue();
  }

  @Test
  @DisplayName("should not be script-checkable for Latin languages")
  void shouldSkipLatinScripts() {
    assertThat(Language.FRENCH.isScriptDistinguishable()).isFalse();
    assertThat(Language.KOREAN.isScriptDistinguishable()).isTrue();
  }

  @Test
  @DisplayName("should format localized fallback descriptions")
  void shouldFormatFallbackDescription() {
    assertThat(Language.ENGLISH.fallbackDescription("Solar"))
        .isEqualTo("Key points related to Solar.");
    assertThat(Language.CHINESE.fallbackDescription("太阳能")).isEqualTo("与太阳能相关的要点。");
  }
}
