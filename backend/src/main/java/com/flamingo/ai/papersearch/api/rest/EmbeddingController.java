package com.flamingo.ai.papersearch.api.rest;

import com.flamingo.ai.papersearch.api.dto.request.EmbeddingRequest;
import com.flamingo.ai.papersearch.api.dto.response.EmbeddingResponse;
import com.flamingo.ai.papersearch.service.embedding.EmbeddingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller exposing the embedding model used for chunks and queries. */
@RestController
@RequestMapping("/embed")
@RequiredArgsConstructor
public class EmbeddingController {

  private final EmbeddingService embeddingService;

  @PostMapping
  public ResponseEntity<EmbeddingResponse> embed(@Valid @RequestBody EmbeddingRequest request) {
    return ResponseEntity.ok(
        EmbeddingResponse.of(request.getText(), embeddingService.embedText(request.getText())));
  }
}
