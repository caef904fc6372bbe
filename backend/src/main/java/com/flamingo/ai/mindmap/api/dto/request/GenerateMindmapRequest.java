package com.flamingo.ai.mindmap.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for generating a mindmap from a document or from pre-split segments. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerateMindmapRequest {

  @Size(max = 2_000_000, message = "Document must not exceed 2000000 characters")
  private String document;

  @Size(max = 2_000, message = "At most 2000 segments are accepted")
  private List<String> segments;

  /** Language code or name, e.g. "en" or "Arabic". Defaults to the configured language. */
  private String lang;

  @Min(value = 1, message = "maxDepth must be at least 1")
  @Max(value = 10, message = "maxDepth must be at most 10")
  private Integer maxDepth;

  @Min(value = 1, message = "minSize must be at least 1")
  @Max(value = 100, message = "minSize must be at most 100")
  private Integer minSize;
}
