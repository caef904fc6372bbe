package com.flamingo.ai.mindmap.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;

/**
 * AI agent that writes the text content of a mindmap: topic labels, node descriptions and the tree
 * title. The task itself is carried by the rendered prompt.
 */
public interface MindmapWriterAgent {

  @SystemMessage(
      """
        You write the text of a hierarchical mindmap. Answer with the requested text only,
        in the format and language the request asks for. Do not explain your answer, do not
        show your reasoning and do not use markdown or HTML tags.
        """)
  String write(@UserMessage String prompt);
}
