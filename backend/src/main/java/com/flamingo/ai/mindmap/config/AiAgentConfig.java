package com.flamingo.ai.mindmap.config;

import com.flamingo.ai.mindmap.agent.MindmapWriterAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Agents are stateless: no chat memory is attached, so every call stands on its own and a retry
 * re-issues exactly the same conversation.
 */
@Configuration
public class AiAgentConfig {

  @Bean
  public MindmapWriterAgent mindmapWriterAgent(ChatModel chatModel) {
    return AiServices.builder(MindmapWriterAgent.class).chatModel(chatModel).build();
  }
}
