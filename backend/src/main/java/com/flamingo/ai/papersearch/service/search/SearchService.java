package com.flamingo.ai.papersearch.service.search;

import com.flamingo.ai.papersearch.api.dto.response.SearchResponse;
import com.flamingo.ai.papersearch.api.dto.response.SearchResponse.ChunkResult;
import com.flamingo.ai.papersearch.config.RagConfig;
import com.flamingo.ai.papersearch.domain.entity.SearchQueryLog;
import com.flamingo.ai.papersearch.domain.enums.PaperSection;
import com.flamingo.ai.papersearch.domain.repository.SearchQueryLogRepository;
import com.flamingo.ai.papersearch.exception.SearchException;
import com.flamingo.ai.papersearch.service.embedding.EmbeddingService;
import com.flamingo.ai.papersearch.store.ChunkFilter;
import com.flamingo.ai.papersearch.store.ChunkStore;
import com.flamingo.ai.papersearch.store.ScoredChunk;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Semantic search over the chunk store.
 *
 * <p>The query is embedded with the same model as the chunks and ranked by cosine similarity. Each
 * request is appended to the search audit log; a failure to write the audit entry never fails the
 * search.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SearchService {

  private final EmbeddingService embeddingService;
  private final ChunkStore chunkStore;
  private final SearchQueryLogRepository searchQueryLogRepository;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Runs a search.
   *
   * @param command the query and its filters
   * @return the ranked hits
   * @throws SearchException if the query cannot be embedded or the store is unavailable
   */
  @Timed(value = "search.execute", description = "Time to run a semantic search")
  public SearchResponse search(SearchCommand command) {
    if (command.query() == null) {
      throw new IllegalArgumentException("Query must not be null");
    }
    long start = System.currentTimeMillis();
    int k = effectiveMaxResults(command.maxResults());
    ChunkFilter filter =
        new ChunkFilter(
            command.documentId(), normalizeSection(command.section()), command.chunkType());

    List<Float> queryVector;
    try {
      queryVector = embeddingService.embedQuery(command.query());
    } catch (RuntimeException e) {
      meterRegistry.counter("search.requests", "outcome", "failure").increment();
      throw new SearchException("Failed to embed query: " + e.getMessage(), e);
    }

    List<ScoredChunk> hits;
    try {
      hits = chunkStore.search(queryVector, k, filter);
    } catch (SearchException e) {
      meterRegistry.counter("search.requests", "outcome", "failure").increment();
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("search.requests", "outcome", "failure").increment();
      throw new SearchException("Chunk store search failed: " + e.getMessage(), e);
    }

    long elapsed = System.currentTimeMillis() - start;
    meterRegistry.counter("search.requests", "outcome", "success").increment();
    log.debug("Search returned {} of at most {} hits in {}ms", hits.size(), k, elapsed);

    audit(command.query(), queryVector, hits);

    return SearchResponse.builder()
        .query(command.query())
        .resultsCount(hits.size())
        .searchTimeMs(elapsed)
        .chunks(hits.stream().map(ChunkResult::fromScored).toList())
        .build();
  }

  int effectiveMaxResults(Integer requested) {
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    if (requested == null) {
      return retrieval.getDefaultMaxResults();
    }
    return Math.max(1, Math.min(requested, retrieval.getMaxResults()));
  }

  private static String normalizeSection(String section) {
    if (section == null || section.isBlank()) {
      return null;
    }
    return PaperSection.normalizeLabel(section);
  }

  private void audit(String query, List<Float> queryVector, List<ScoredChunk> hits) {
    try {
      searchQueryLogRepository.save(
          SearchQueryLog.builder()
              .query(query)
              .queryEmbedding(queryVector)
              .resultCount(hits.size())
              .topScore(hits.isEmpty() ? null : hits.get(0).score())
              .build());
    } catch (RuntimeException e) {
      log.warn("Failed to record search audit entry: {}", e.getMessage());
    }
  }
}
