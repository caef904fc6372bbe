package com.flamingo.ai.mindmap.api.dto.response;

import com.flamingo.ai.mindmap.service.mindmap.MindmapResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a generated mindmap. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MindmapResponse {

  private String title;
  private String summary;
  private String language;
  private MindmapNodeResponse mindmap;
  private MindmapMetadata metadata;

  /** Creates a MindmapResponse from a pipeline result. */
  public static MindmapResponse fromResult(MindmapResult result) {
    return MindmapResponse.builder()
        .title(result.rootSummary().title())
        .summary(result.rootSummary().summary())
        .language(result.language().getCode())
        .mindmap(MindmapNodeResponse.from(result.tree(), result.tree().getRoot()))
        .metadata(MindmapMetadata.fromResult(result))
        .build();
  }
}
