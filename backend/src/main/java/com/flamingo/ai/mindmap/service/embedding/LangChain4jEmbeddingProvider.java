package com.flamingo.ai.mindmap.service.embedding;

import com.flamingo.ai.mindmap.config.MindmapConfig;
import com.flamingo.ai.mindmap.exception.InvalidInputException;
import com.flamingo.ai.mindmap.exception.ProviderUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link EmbeddingProvider} backed by a LangChain4j {@link EmbeddingModel}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class LangChain4jEmbeddingProvider implements EmbeddingProvider {

  private final EmbeddingModel embeddingModel;
  private final MindmapConfig mindmapConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Encodes texts in sequential batches of {@code mindmap.embedding.batch-size} and concatenates the
   * results in submission order.
   */
  @Override
  @Timed(value = "embedding.encode", description = "Time to embed all segments of a document")
  @Retry(name = "embedding")
  public List<float[]> encode(List<String> texts) {
    if (texts == null || texts.isEmpty()) {
      throw new InvalidInputException("No texts to embed");
    }
    int batchSize = Math.max(1, mindmapConfig.getEmbedding().getBatchSize());
    List<float[]> vectors = new ArrayList<>(texts.size());

    for (int start = 0; start < texts.size(); start += batchSize) {
      List<String> batch = texts.subList(start, Math.min(start + batchSize, texts.size()));
      List<Embedding> embeddings = embedBatch(batch, start);
      if (embeddings.size() != batch.size()) {
        throw new InvalidInputException(
            "Embedding backend returned "
                + embeddings.size()
                + " vectors for "
                + batch.size()
                + " texts");
      }
      for (Embedding embedding : embeddings) {
        vectors.add(embedding.vector());
      }
    }

    int dimension = vectors.get(0).length;
    for (int i = 1; i < vectors.size(); i++) {
      if (vectors.get(i).length != dimension) {
        throw new InvalidInputException(
            "Embedding " + i + " has dimension " + vectors.get(i).length + ", expected " + dimension);
      }
    }
    meterRegistry.counter("embedding.requests.success").increment();
    log.debug("Embedded {} texts with dimension {}", vectors.size(), dimension);
    return vectors;
  }

  private List<Embedding> embedBatch(List<String> batch, int offset) {
    List<dev.langchain4j.data.segment.TextSegment> segments = new ArrayList<>(batch.size());
    for (String text : batch) {
      segments.add(dev.langchain4j.data.segment.TextSegment.from(text));
    }
    try {
      Response<List<Embedding>> response = embeddingModel.embedAll(segments);
      return response.content();
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      log.warn("Embedding batch at offset {} failed: {}", offset, e.getMessage());
      throw new ProviderUnavailableException("Embedding backend failed: " + e.getMessage(), e);
    }
  }
}
