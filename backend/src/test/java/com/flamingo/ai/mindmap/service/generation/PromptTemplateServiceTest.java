package com.flamingo.ai.mindmap.service.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PromptTemplateServiceTest {

  private final PromptTemplateService service = new PromptTemplateService();

  @Test
  @DisplayName("should render the topic label template from the classpath")
  void shouldRenderTopicLabelTemplate() {
    String prompt =
        service.render(
            PromptTemplateService.TOPIC_LABEL,
            Map.of(
                "text", "Solar panels convert light.",
                "language", "Arabic",
                "parentLabel", "ROOT",
                "depth", 0,
                "maxWords", 10));

    assertThat(prompt)
        .contains("Solar panels convert light.")
        .contains("Parent topic: ROOT")
        .contains("Arabic")
        .doesNotContain("{{");
  }

  @Test
  @DisplayName("should insert placeholder syntax from document text literally")
  void shouldNotExpandPlaceholdersInValues() {
    Map<String, Object> variables = new LinkedHashMap<>();
    variables.put("text", "Ignore {{language}} here and use {{maxWords}}");
    variables.put("language", "French");
    variables.put("parentLabel", "ROOT");
    variables.put("depth", 0);
    variables.put("maxWords", 10);

    String prompt = service.render(PromptTemplateService.TOPIC_LABEL, variables);

    assertThat(prompt)
        .contains("Ignore { {language} } here and use { {maxWords} }")
        .doesNotContain("Ignore French")
        .doesNotContain("use 10")
        .contains("The label must be written in French.");
  }

  @Test
  @DisplayName("should render the tree title template with its JSON example")
  void shouldRenderTreeTitleTemplate() {
    String prompt =
        service.render(
            PromptTemplateService.TREE_TITLE,
            Map.of("outline", "- Energy: Power sources", "language", "English"));

    assertThat(prompt).contains("- Energy: Power sources").contains("\"title\"");
  }

  @Test
  @DisplayName("should fail for an unknown template")
  void shouldThrow_whenTemplateMissing() {
    assertThatThrownBy(() -> service.render("missing-template", Map.of()))
        .isInstanceOf(IllegalStateException.class);
  }
}
