package com.flamingo.ai.papersearch.service.document;

import com.flamingo.ai.papersearch.config.RagConfig;
import com.flamingo.ai.papersearch.domain.entity.Document;
import com.flamingo.ai.papersearch.domain.repository.DocumentRepository;
import com.flamingo.ai.papersearch.exception.DocumentNotFoundException;
import com.flamingo.ai.papersearch.exception.DocumentProcessingException;
import com.flamingo.ai.papersearch.exception.IngestionInProgressException;
import com.flamingo.ai.papersearch.service.extraction.FigureStorage;
import com.flamingo.ai.papersearch.service.ingestion.DocumentIngestionService;
import com.flamingo.ai.papersearch.service.ingestion.ExtractedContent;
import com.flamingo.ai.papersearch.service.ingestion.IngestionOutcome;
import com.flamingo.ai.papersearch.store.ChunkRecord;
import com.flamingo.ai.papersearch.store.ChunkStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Implementation of the DocumentService. */
@Service
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  private static final String PDF_MIME_TYPE = "application/pdf";
  private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);

  private final DocumentRepository documentRepository;
  private final ChunkStore chunkStore;
  private final FigureStorage figureStorage;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final DocumentIngestionService documentIngestionService;

  public DocumentServiceImpl(
      DocumentRepository documentRepository,
      ChunkStore chunkStore,
      FigureStorage figureStorage,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Lazy DocumentIngestionService documentIngestionService) {
    this.documentRepository = documentRepository;
    this.chunkStore = chunkStore;
    this.figureStorage = figureStorage;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.documentIngestionService = documentIngestionService;
  }

  @Override
  @Timed(value = "document.upload", description = "Time to upload a document")
  public Document uploadDocument(MultipartFile file) {
    log.info("Uploading document {}", file.getOriginalFilename());

    validateFile(file);
    final byte[] fileBytes;
    try {
      fileBytes = file.getBytes();
    } catch (IOException e) {
      throw new DocumentProcessingException(
          null, "Failed to read upload: " + e.getMessage(), "Failed to read file content");
    }
    if (!hasPdfHeader(fileBytes)) {
      throw new DocumentProcessingException(
          null, "Missing PDF header", "Only PDF files are supported");
    }

    Document saved =
        documentRepository.save(
            Document.builder()
                .id(UUID.randomUUID())
                .fileName(file.getOriginalFilename())
                .fileSize(file.getSize())
                .build());
    meterRegistry.counter("document.uploaded").increment();

    // The save above has committed, so the worker thread can load the row.
    final UUID documentId = saved.getId();
    documentIngestionService.processAsync(documentId, fileBytes);

    log.info("Document {} uploaded with ID: {}", file.getOriginalFilename(), documentId);
    return saved;
  }

  @Override
  public IngestionOutcome ingestContent(
      UUID documentId, String fileName, ExtractedContent content) {
    if (!documentRepository.existsById(documentId)) {
      documentRepository.save(
          Document.builder()
              .id(documentId)
              .fileName(
                  fileName != null && !fileName.isBlank() ? fileName : "content-" + documentId)
              .fileSize((long) content.fullText().length())
              .build());
      log.info("Created document {} for supplied content", documentId);
    }
    return documentIngestionService.process(documentId, content);
  }

  @Override
  @Timed(value = "document.get", description = "Time to get a document")
  public Document getDocument(UUID documentId) {
    return documentRepository
        .findById(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  @Override
  public List<Document> getDocuments() {
    return documentRepository.findAllByOrderByUploadedAtDesc();
  }

  @Override
  public List<ChunkRecord> getChunks(UUID documentId) {
    getDocument(documentId);
    return chunkStore.findByDocument(documentId);
  }

  @Override
  @Timed(value = "document.delete", description = "Time to delete a document")
  public void deleteDocument(UUID documentId) {
    Document document = getDocument(documentId);
    // No ingestion of this document can start until the claim is released
    if (!documentIngestionService.tryAcquire(documentId)) {
      throw new IngestionInProgressException(documentId);
    }
    try {
      chunkStore.deleteAll(documentId);
      figureStorage.deleteAll(documentId);
      documentRepository.delete(document);
    } finally {
      documentIngestionService.release(documentId);
    }
    meterRegistry.counter("document.deleted").increment();

    log.info("Deleted document: {}", documentId);
  }

  private void validateFile(MultipartFile file) {
    if (file.isEmpty()) {
      throw new DocumentProcessingException(null, "File is empty", "Please upload a valid file");
    }

    String contentType = file.getContentType();
    if (contentType != null
        && !PDF_MIME_TYPE.equals(contentType)
        && !"application/octet-stream".equals(contentType)) {
      throw new DocumentProcessingException(
          null, "Unsupported file type: " + contentType, "Only PDF files are supported");
    }
    long maxBytes = ragConfig.getUpload().getMaxFileSizeBytes();
    if (file.getSize() > maxBytes) {
      throw new DocumentProcessingException(
          null,
          "File too large: " + file.getSize(),
          "Maximum file size is " + maxBytes / (1024 * 1024) + "MB");
    }
  }

  private static boolean hasPdfHeader(byte[] bytes) {
    return bytes.length >= PDF_MAGIC.length
        && Arrays.equals(Arrays.copyOf(bytes, PDF_MAGIC.length), PDF_MAGIC);
  }
}
