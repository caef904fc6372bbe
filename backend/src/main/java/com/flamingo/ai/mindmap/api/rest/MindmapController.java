package com.flamingo.ai.mindmap.api.rest;

import com.flamingo.ai.mindmap.api.dto.request.GenerateMindmapRequest;
import com.flamingo.ai.mindmap.api.dto.response.MindmapResponse;
import com.flamingo.ai.mindmap.service.mindmap.MindmapCommand;
import com.flamingo.ai.mindmap.service.mindmap.MindmapResult;
import com.flamingo.ai.mindmap.service.mindmap.MindmapService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for mindmap generation. */
@RestController
@RequestMapping("/api/mindmaps")
@RequiredArgsConstructor
public class MindmapController {

  private final MindmapService mindmapService;

  /** Generates a mindmap synchronously. */
  @PostMapping
  public ResponseEntity<MindmapResponse> generate(
      @Valid @RequestBody GenerateMindmapRequest request) {
    MindmapResult result =
        mindmapService.generate(
            new MindmapCommand(
                request.getDocument(),
                request.getSegments(),
                request.getLang(),
                request.getMaxDepth(),
                request.getMinSize()));
    return ResponseEntity.ok(MindmapResponse.fromResult(result));
  }
}
