package com.flamingo.ai.papersearch.service.document;

import com.flamingo.ai.papersearch.domain.entity.Document;
import com.flamingo.ai.papersearch.service.ingestion.ExtractedContent;
import com.flamingo.ai.papersearch.service.ingestion.IngestionOutcome;
import com.flamingo.ai.papersearch.store.ChunkRecord;
import java.util.List;
import java.util.UUID;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for paper document management. */
public interface DocumentService {

  /**
   * Stores an uploaded PDF and starts its ingestion in the background.
   *
   * @param file the uploaded file
   * @return the created document, status {@code UPLOADED}
   * @throws com.flamingo.ai.papersearch.exception.DocumentProcessingException if the file is not an
   *     acceptable PDF
   */
  Document uploadDocument(MultipartFile file);

  /**
   * Ingests caller-extracted text synchronously, creating the document when it does not exist.
   *
   * @param documentId the document ID
   * @param fileName name recorded for a newly created document, may be null
   * @param content the text and optional sections
   * @return how the ingestion ended
   */
  IngestionOutcome ingestContent(UUID documentId, String fileName, ExtractedContent content);

  /**
   * Gets a document by ID.
   *
   * @param documentId the document ID
   * @return the document
   * @throws com.flamingo.ai.papersearch.exception.DocumentNotFoundException if not found
   */
  Document getDocument(UUID documentId);

  /** Gets all documents, newest first. */
  List<Document> getDocuments();

  /** Gets the indexed chunks of a document in ordinal order. */
  List<ChunkRecord> getChunks(UUID documentId);

  /**
   * Deletes a document with its chunks and stored figure images.
   *
   * @param documentId the document ID
   * @throws com.flamingo.ai.papersearch.exception.IngestionInProgressException if the document is
   *     being ingested
   */
  void deleteDocument(UUID documentId);
}
