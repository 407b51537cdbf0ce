package com.flamingo.ai.papersearch.api.rest;

import com.flamingo.ai.papersearch.api.dto.request.SearchRequest;
import com.flamingo.ai.papersearch.api.dto.response.SearchResponse;
import com.flamingo.ai.papersearch.service.search.SearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for semantic search over indexed chunks. */
@RestController
@RequestMapping("/search")
@RequiredArgsConstructor
public class SearchController {

  private final SearchService searchService;

  @PostMapping
  public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
    return ResponseEntity.ok(searchService.search(request.toCommand()));
  }
}
