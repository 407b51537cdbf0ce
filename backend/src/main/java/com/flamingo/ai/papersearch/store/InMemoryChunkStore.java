package com.flamingo.ai.papersearch.store;

import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * {@link ChunkStore} keeping an immutable chunk list per document.
 *
 * <p>Writers swap the whole list for a document in one map operation, so readers never lock and
 * never observe a partially written document. Search is an exact scan with a bounded heap.
 */
@Service
@ConditionalOnProperty(
    name = "rag.vector-store.type",
    havingValue = "memory",
    matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class InMemoryChunkStore implements ChunkStore {

  private static final Comparator<ChunkRecord> BY_ORDINAL =
      Comparator.comparingInt(ChunkRecord::getOrdinal);

  private final Map<UUID, List<ChunkRecord>> chunksByDocument = new ConcurrentHashMap<>();
  private final MeterRegistry meterRegistry;

  @Override
  public void store(ChunkRecord chunk) {
    chunksByDocument.compute(
        chunk.getDocumentId(),
        (id, existing) -> {
          List<ChunkRecord> updated = new ArrayList<>();
          if (existing != null) {
            for (ChunkRecord c : existing) {
              if (c.getOrdinal() != chunk.getOrdinal()) {
                updated.add(c);
              }
            }
          }
          updated.add(chunk);
          updated.sort(BY_ORDINAL);
          return List.copyOf(updated);
        });
    meterRegistry.counter("chunk_store.indexed").increment();
  }

  @Override
  public void replaceDocument(UUID documentId, List<ChunkRecord> chunks) {
    List<ChunkRecord> sorted = new ArrayList<>(chunks);
    sorted.sort(BY_ORDINAL);
    if (sorted.isEmpty()) {
      chunksByDocument.remove(documentId);
    } else {
      chunksByDocument.put(documentId, List.copyOf(sorted));
    }
    meterRegistry.counter("chunk_store.indexed").increment(sorted.size());
    log.debug("Replaced chunk set of document {} with {} chunks", documentId, sorted.size());
  }

  @Override
  public void deleteAll(UUID documentId) {
    List<ChunkRecord> removed = chunksByDocument.remove(documentId);
    if (removed != null) {
      meterRegistry.counter("chunk_store.deleted").increment(removed.size());
      log.debug("Deleted {} chunks of document {}", removed.size(), documentId);
    }
  }

  @Override
  @Timed(value = "chunk_store.search", description = "Time for in-memory vector search")
  public List<ScoredChunk> search(List<Float> queryVector, int k, ChunkFilter filter) {
    if (k <= 0) {
      return List.of();
    }
    ChunkFilter effective = filter != null ? filter : ChunkFilter.none();

    // Worst hit at the head so it can be evicted
    PriorityQueue<ScoredChunk> heap =
        new PriorityQueue<>(Math.min(k, 1024) + 1, ScoredChunk.RANKING.reversed());
    for (List<ChunkRecord> chunks : candidateLists(effective)) {
      for (ChunkRecord chunk : chunks) {
        if (!effective.matches(chunk)) {
          continue;
        }
        heap.offer(new ScoredChunk(chunk, VectorMath.cosine(queryVector, chunk.getEmbedding())));
        if (heap.size() > k) {
          heap.poll();
        }
      }
    }

    List<ScoredChunk> results = new ArrayList<>(heap);
    results.sort(ScoredChunk.RANKING);
    meterRegistry.counter("chunk_store.queries").increment();
    return results;
  }

  @Override
  public List<ChunkRecord> findByDocument(UUID documentId) {
    return chunksByDocument.getOrDefault(documentId, List.of());
  }

  @Override
  public long countByDocument(UUID documentId) {
    return findByDocument(documentId).size();
  }

  private List<List<ChunkRecord>> candidateLists(ChunkFilter filter) {
    if (filter.documentId() != null) {
      List<ChunkRecord> chunks = chunksByDocument.get(filter.documentId());
      return chunks == null ? List.of() : List.of(chunks);
    }
    return new ArrayList<>(chunksByDocument.values());
  }
}
