package com.flamingo.ai.mindmap.service.generation;

import dev.langchain4j.model.input.PromptTemplate;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

/**
 * Loads prompt templates from {@code classpath:prompts/<name>.txt} and renders them with {@code
 * {{variable}}} placeholders. Loaded templates are cached for the lifetime of the application.
 */
@Service
@Slf4j
public class PromptTemplateService {

  public static final String TOPIC_LABEL = "topic-label";
  public static final String NODE_DESCRIPTION = "node-description";
  public static final String TREE_TITLE = "tree-title";

  private final Map<String, PromptTemplate> cache = new ConcurrentHashMap<>();

  /**
   * Renders a template. Placeholder braces inside string values are broken up, so text taken
   * from a document is inserted literally and never expands into another variable.
   *
   * @param name template name without extension
   * @param variables values for every placeholder, none null
   * @return the rendered prompt
   */
  public String render(String name, Map<String, Object> variables) {
    Map<String, Object> literal = new LinkedHashMap<>();
    variables.forEach(
        (key, value) -> literal.put(key, value instanceof String text ? escapeBraces(text) : value));
    return cache.computeIfAbsent(name, this::load).apply(literal).text();
  }

  static String escapeBraces(String value) {
    return value.replace("{{", "{ {").replace("}}", "} }");
  }

  private PromptTemplate load(String name) {
    ClassPathResource resource = new ClassPathResource("prompts/" + name + ".txt");
    try (InputStream in = resource.getInputStream()) {
      String template = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      log.debug("Loaded prompt template '{}' ({} chars)", name, template.length());
      return PromptTemplate.from(template);
    } catch (IOException e) {
      throw new IllegalStateException("Prompt template not found: " + name, e);
    }
  }
}
