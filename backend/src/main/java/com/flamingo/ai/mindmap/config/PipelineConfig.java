package com.flamingo.ai.mindmap.config;

import com.flamingo.ai.mindmap.service.generation.CallPacer;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Infrastructure beans shared by the pipeline stages. */
@Configuration
public class PipelineConfig {

  /**
   * Enables the @Timed annotation on pipeline, enrichment and embedding entry points.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /**
   * Pacer that spaces successive text generation calls.
   *
   * @param mindmapConfig mindmap configuration
   * @return the pacer
   */
  @Bean
  public CallPacer callPacer(MindmapConfig mindmapConfig) {
    return new CallPacer(Duration.ofMillis(mindmapConfig.getGeneration().getInterCallDelayMs()));
  }
}
