package com.flamingo.ai.mindmap.service.generation;

import com.flamingo.ai.mindmap.exception.LlmServiceException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Calls the {@link TextGenerationProvider} until it returns a response that passes the {@link
 * ResponseValidator}, re-issuing the identical prompt up to {@code maxRetries} more times.
 *
 * <p>Invalid content and provider failures are both retried. When every attempt fails the result is
 * {@link GenerationResult#exhausted}; no exception escapes and no empty text is returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ValidatedGenerationService {

  private final TextGenerationProvider textGenerationProvider;
  private final ResponseCleaner responseCleaner;
  private final ResponseValidator responseValidator;
  private final CallPacer callPacer;
  private final MeterRegistry meterRegistry;

  public GenerationResult generateValidated(GenerationRequest request) {
    RetryConfig config =
        RetryConfig.<Attempt>custom()
            .maxAttempts(request.maxRetries() + 1)
            .intervalFunction(attempt -> 0L)
            .retryOnResult(attempt -> !attempt.valid())
            .retryOnException(LlmServiceException.class::isInstance)
            .build();
    Retry retry = Retry.of("generation", config);

    AtomicInteger attempts = new AtomicInteger();
    AtomicReference<String> lastFailure = new AtomicReference<>();
    Supplier<Attempt> decorated =
        Retry.decorateSupplier(retry, () -> attemptOnce(request, attempts, lastFailure));

    Attempt outcome;
    try {
      outcome = decorated.get();
    } catch (LlmServiceException e) {
      log.warn(
          "Generation failed after {} attempts{}: {}",
          attempts.get(),
          e.isRateLimited() ? " (rate limited)" : "",
          e.getMessage());
      meterRegistry.counter("generation.exhausted").increment();
      return GenerationResult.exhausted(attempts.get(), lastFailure.get());
    }

    if (outcome.valid()) {
      return GenerationResult.success(outcome.text(), attempts.get());
    }
    log.warn(
        "No valid response after {} attempts, last failure: {}", attempts.get(), lastFailure.get());
    meterRegistry.counter("generation.exhausted").increment();
    return GenerationResult.exhausted(attempts.get(), lastFailure.get());
  }

  private Attempt attemptOnce(
      GenerationRequest request, AtomicInteger attempts, AtomicReference<String> lastFailure) {
    int attempt = attempts.incrementAndGet();
    meterRegistry.counter("generation.attempts").increment();
    callPacer.awaitTurn();

    String raw;
    try {
      raw = textGenerationProvider.generate(request.prompt());
    } catch (RuntimeException e) {
      lastFailure.set("provider error: " + e.getMessage());
      log.debug("Attempt {} failed with provider error: {}", attempt, e.getMessage());
      throw e instanceof LlmServiceException llmError
          ? llmError
          : new LlmServiceException("Text generation failed: " + e.getMessage(), e);
    }

    String cleaned = responseCleaner.clean(raw);
    Optional<ValidationFailure> failure =
        responseValidator.validate(cleaned, request.language(), request.maxWords());
    if (failure.isPresent()) {
      ValidationFailure reason = failure.get();
      lastFailure.set(reason.name());
      meterRegistry
          .counter("generation.validation.failures", "reason", reason.metricTag())
          .increment();
      log.debug("Attempt {} rejected ({}): '{}'", attempt, reason, abbreviate(cleaned));
      return new Attempt(cleaned, false);
    }
    return new Attempt(cleaned, true);
  }

  private static String abbreviate(String text) {
    return text.length() > 80 ? text.substring(0, 80) + "..." : text;
  }

  private record Attempt(String text, boolean valid) {}
}
