package com.flamingo.ai.papersearch.service.ingestion;

import com.flamingo.ai.papersearch.config.RagConfig;
import com.flamingo.ai.papersearch.domain.entity.Document;
import com.flamingo.ai.papersearch.domain.enums.DocumentStatus;
import com.flamingo.ai.papersearch.domain.enums.PaperSection;
import com.flamingo.ai.papersearch.domain.enums.StageStatus;
import com.flamingo.ai.papersearch.domain.repository.DocumentRepository;
import com.flamingo.ai.papersearch.exception.DocumentNotFoundException;
import com.flamingo.ai.papersearch.exception.DocumentProcessingException;
import com.flamingo.ai.papersearch.exception.IngestionInProgressException;
import com.flamingo.ai.papersearch.service.chunking.ChunkingRequest;
import com.flamingo.ai.papersearch.service.chunking.DocumentChunker;
import com.flamingo.ai.papersearch.service.chunking.RawChunk;
import com.flamingo.ai.papersearch.service.embedding.EmbeddingBatchResult;
import com.flamingo.ai.papersearch.service.embedding.EmbeddingService;
import com.flamingo.ai.papersearch.service.extraction.PdfStructureExtractor;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedPaper;
import com.flamingo.ai.papersearch.service.extraction.model.SectionText;
import com.flamingo.ai.papersearch.store.ChunkRecord;
import com.flamingo.ai.papersearch.store.ChunkStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Orchestrates document ingestion: extract, chunk, embed, and index.
 *
 * <p>Status moves {@code UPLOADED -> EXTRACTING -> CHUNKING -> EMBEDDING -> INDEXED}, with {@code
 * FAILED} reachable from every non-terminal state. The chunk set of a document is written with a
 * single {@link ChunkStore#replaceDocument} call once every embedding is ready, so searches never
 * see a partially ingested document.
 *
 * <p>Extracted text and metadata are written to the document together with the {@code INDEXED}
 * status, so a cancelled run leaves the last indexed state untouched.
 *
 * <p>Only one ingestion per document may run at a time, and a document being deleted cannot be
 * ingested. Errors never escape {@code process}: they are recorded on the document and reported
 * through the returned {@link IngestionOutcome}.
 */
@Service
@Slf4j
public class DocumentIngestionService {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final DocumentRepository documentRepository;
  private final PdfStructureExtractor pdfStructureExtractor;
  private final DocumentChunker documentChunker;
  private final EmbeddingService embeddingService;
  private final ChunkStore chunkStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final AsyncTaskExecutor extractionExecutor;

  private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

  public DocumentIngestionService(
      DocumentRepository documentRepository,
      PdfStructureExtractor pdfStructureExtractor,
      DocumentChunker documentChunker,
      EmbeddingService embeddingService,
      ChunkStore chunkStore,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("extractionExecutor") AsyncTaskExecutor extractionExecutor) {
    this.documentRepository = documentRepository;
    this.pdfStructureExtractor = pdfStructureExtractor;
    this.documentChunker = documentChunker;
    this.embeddingService = embeddingService;
    this.chunkStore = chunkStore;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.extractionExecutor = extractionExecutor;
  }

  /**
   * Ingests a PDF.
   *
   * @param documentId an existing document
   * @param pdf the raw PDF bytes
   * @return how the run ended
   * @throws IngestionInProgressException if the document is already being ingested
   * @throws DocumentNotFoundException if the document does not exist
   */
  @Timed(value = "document.process", description = "Time to ingest a PDF")
  public IngestionOutcome process(UUID documentId, byte[] pdf) {
    return runExclusive(
        documentId,
        () -> {
          updateStatus(documentId, DocumentStatus.EXTRACTING);
          ExtractedPaper paper = extract(documentId, pdf);
          if (paper.getFullText().isBlank()) {
            updateDocument(documentId, document -> document.applyExtraction(paper));
            throw new DocumentProcessingException(
                documentId, "No extractable text", "The document contains no extractable text");
          }
          return index(
              documentId,
              new ChunkingRequest(paper.getFullText(), paper.getSections(), paper.getPageMap()),
              document -> document.applyExtraction(paper));
        });
  }

  /**
   * Ingests text that the caller already extracted. No page numbers are available on this path.
   * Section labels are stored in canonical form, see {@link PaperSection#normalizeLabel}.
   *
   * @param documentId an existing document
   * @param content the text and optional sections
   * @return how the run ended
   * @throws IngestionInProgressException if the document is already being ingested
   * @throws DocumentNotFoundException if the document does not exist
   */
  @Timed(value = "document.process.content", description = "Time to ingest supplied text")
  public IngestionOutcome process(UUID documentId, ExtractedContent content) {
    return runExclusive(
        documentId,
        () -> {
          List<SectionText> sections =
              content.sections().stream()
                  .map(
                      s ->
                          new SectionText(
                              PaperSection.normalizeLabel(s.label()), s.text(), s.startOffset()))
                  .toList();
          return index(
              documentId,
              new ChunkingRequest(content.fullText(), sections, null),
              document -> {
                document.setFullText(content.fullText());
                document.setSections(new ArrayList<>(sections));
                document.setTextStatus(StageStatus.DONE);
              });
        });
  }

  /** Ingests a PDF on the document processing executor. */
  @Async("documentProcessingExecutor")
  public void processAsync(UUID documentId, byte[] pdf) {
    try {
      process(documentId, pdf);
    } catch (IngestionInProgressException | DocumentNotFoundException e) {
      log.warn("Skipped ingestion of document {}: {}", documentId, e.getMessage());
    }
  }

  /** Returns true while an ingestion of the document is running. */
  public boolean isInFlight(UUID documentId) {
    return inFlight.contains(documentId);
  }

  /**
   * Claims the document for exclusive work outside ingestion, such as deletion. Ingestion of the
   * document is rejected until {@link #release} is called.
   *
   * @return false if an ingestion or another claim already holds the document
   */
  public boolean tryAcquire(UUID documentId) {
    return inFlight.add(documentId);
  }

  /** Releases a claim taken with {@link #tryAcquire}. */
  public void release(UUID documentId) {
    inFlight.remove(documentId);
  }

  private IngestionOutcome runExclusive(UUID documentId, Supplier<IngestionOutcome> pipeline) {
    if (!tryAcquire(documentId)) {
      throw new IngestionInProgressException(documentId);
    }
    try {
      Document document =
          documentRepository
              .findById(documentId)
              .orElseThrow(() -> new DocumentNotFoundException(documentId));
      DocumentStatus previousStatus = document.getStatus();
      int previousChunkCount = document.getChunkCount() != null ? document.getChunkCount() : 0;

      try {
        IngestionOutcome outcome = pipeline.get();
        meterRegistry.counter("document.processing.success").increment();
        log.info(
            "Indexed document {} with {} chunks ({} failed to embed)",
            documentId,
            outcome.chunkCount(),
            outcome.failedChunkOrdinals().size());
        return outcome;
      } catch (CancellationException e) {
        // Clear the flag so the restore below can reach the database, then hand it back.
        boolean interrupted = Thread.interrupted();
        log.warn("Ingestion of document {} cancelled: {}", documentId, e.getMessage());
        meterRegistry.counter("document.processing.cancelled").increment();
        restore(documentId, previousStatus, previousChunkCount);
        if (interrupted) {
          Thread.currentThread().interrupt();
        }
        return IngestionOutcome.cancelled(documentId, previousStatus, previousChunkCount);
      } catch (RuntimeException e) {
        log.error("Failed to process document {}: {}", documentId, e.getMessage());
        meterRegistry.counter("document.processing.failure").increment();
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        try {
          updateDocument(documentId, d -> d.markFailed(reason));
        } catch (RuntimeException statusEx) {
          log.error("Failed to update document status after retries: {}", statusEx.getMessage());
        }
        return IngestionOutcome.failed(documentId, reason);
      }
    } finally {
      release(documentId);
    }
  }

  private ExtractedPaper extract(UUID documentId, byte[] pdf) {
    Duration timeout = ragConfig.getExtraction().getTimeout();
    Future<ExtractedPaper> future =
        extractionExecutor.submit(() -> pdfStructureExtractor.extract(documentId, pdf));
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      recordExtractionFailure(documentId);
      throw new DocumentProcessingException(
          documentId,
          "Extraction timed out after " + timeout.toSeconds() + "s",
          "Document took too long to process");
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while extracting document " + documentId);
    } catch (ExecutionException e) {
      recordExtractionFailure(documentId);
      Throwable cause = e.getCause();
      if (cause instanceof DocumentProcessingException dpe) {
        throw dpe;
      }
      throw new DocumentProcessingException(
          documentId, "Extraction failed: " + cause.getMessage(), cause);
    }
  }

  private void recordExtractionFailure(UUID documentId) {
    try {
      updateDocument(documentId, Document::markExtractionFailed);
    } catch (RuntimeException e) {
      log.error("Failed to record extraction failure of {}: {}", documentId, e.getMessage());
    }
  }

  /**
   * Chunks, embeds and stores the text, then marks the document indexed.
   *
   * @param artifacts writes the new text and metadata to the document; applied only once the chunk
   *     set has been replaced
   */
  private IngestionOutcome index(
      UUID documentId, ChunkingRequest request, Consumer<Document> artifacts) {
    checkCancelled(documentId);
    updateStatus(documentId, DocumentStatus.CHUNKING);
    List<RawChunk> chunks = documentChunker.chunk(request);
    if (chunks.isEmpty()) {
      throw new DocumentProcessingException(
          documentId, "No text to index", "The document contains no extractable text");
    }
    log.debug("Document {} split into {} chunks", documentId, chunks.size());

    checkCancelled(documentId);
    updateStatus(documentId, DocumentStatus.EMBEDDING);
    EmbeddingBatchResult embedded =
        embeddingService.embedChunks(chunks.stream().map(RawChunk::text).toList());
    if (embedded.allFailed()) {
      throw new DocumentProcessingException(
          documentId,
          "Embedding failed for all " + chunks.size() + " chunks",
          "Embedding service unavailable");
    }

    List<ChunkRecord> records = new ArrayList<>(chunks.size());
    List<Integer> failedOrdinals = new ArrayList<>();
    for (int i = 0; i < chunks.size(); i++) {
      RawChunk chunk = chunks.get(i);
      List<Float> vector = embedded.vectors().get(i);
      if (vector == null) {
        failedOrdinals.add(chunk.ordinal());
        continue;
      }
      records.add(
          ChunkRecord.builder()
              .documentId(documentId)
              .ordinal(chunk.ordinal())
              .text(chunk.text())
              .section(chunk.section())
              .pageNumber(chunk.pageNumber())
              .chunkType(chunk.chunkType())
              .embedding(vector)
              .build());
    }

    checkCancelled(documentId);
    chunkStore.replaceDocument(documentId, records);
    updateDocument(
        documentId,
        document -> {
          artifacts.accept(document);
          document.markIndexed(records.size(), failedOrdinals);
        });
    return IngestionOutcome.indexed(documentId, records.size(), failedOrdinals);
  }

  private static void checkCancelled(UUID documentId) {
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Ingestion of document " + documentId + " interrupted");
    }
  }

  private void updateStatus(UUID documentId, DocumentStatus status) {
    updateDocument(documentId, document -> document.setStatus(status));
  }

  private void restore(UUID documentId, DocumentStatus status, int chunkCount) {
    try {
      updateDocument(
          documentId,
          document -> {
            document.setStatus(status);
            document.setChunkCount(chunkCount);
          });
    } catch (RuntimeException e) {
      log.error("Failed to restore document {} after cancellation: {}", documentId, e.getMessage());
    }
  }

  /** Applies a change to the stored document, retrying on SQLite lock contention. */
  private void updateDocument(UUID documentId, Consumer<Document> change) {
    for (int attempt = 1; attempt <= MAX_RETRIES; attempt++) {
      try {
        Document document =
            documentRepository
                .findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        change.accept(document);
        documentRepository.saveAndFlush(document);
        return;
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to update document {} after {} retries", documentId, MAX_RETRIES);
          throw e;
        }
        log.warn(
            "SQLite lock contention on document {}, retry {}/{}", documentId, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new CancellationException("Interrupted while updating document " + documentId);
        }
      }
    }
  }
}
