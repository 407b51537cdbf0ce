package com.flamingo.ai.papersearch.api.rest;

import com.flamingo.ai.papersearch.api.dto.request.ContentIngestionRequest;
import com.flamingo.ai.papersearch.api.dto.response.ChunkResponse;
import com.flamingo.ai.papersearch.api.dto.response.DocumentResponse;
import com.flamingo.ai.papersearch.domain.entity.Document;
import com.flamingo.ai.papersearch.service.document.DocumentService;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedFigure;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedReference;
import com.flamingo.ai.papersearch.service.extraction.model.ExtractedTable;
import com.flamingo.ai.papersearch.service.extraction.model.SectionText;
import com.flamingo.ai.papersearch.service.ingestion.IngestionOutcome;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for paper documents and their extracted artifacts. */
@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
@Slf4j
public class DocumentController {

  private final DocumentService documentService;

  /** Uploads a PDF; ingestion continues in the background. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentResponse> uploadDocument(@RequestParam("file") MultipartFile file) {
    Document document = documentService.uploadDocument(file);
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(DocumentResponse.fromEntity(document));
  }

  /** Ingests already extracted text synchronously. */
  @PostMapping(value = "/{documentId}/content", consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<IngestionOutcome> ingestContent(
      @PathVariable UUID documentId, @Valid @RequestBody ContentIngestionRequest request) {
    IngestionOutcome outcome =
        documentService.ingestContent(documentId, request.getFileName(), request.toContent());
    return ResponseEntity.ok(outcome);
  }

  /** Gets all documents, newest first. */
  @GetMapping
  public ResponseEntity<List<DocumentResponse>> getDocuments() {
    return ResponseEntity.ok(
        documentService.getDocuments().stream().map(DocumentResponse::fromEntity).toList());
  }

  /** Gets a document with its stage flags. */
  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID documentId) {
    return ResponseEntity.ok(DocumentResponse.fromEntity(documentService.getDocument(documentId)));
  }

  @GetMapping("/{documentId}/sections")
  public ResponseEntity<List<SectionText>> getSections(@PathVariable UUID documentId) {
    return ResponseEntity.ok(documentService.getDocument(documentId).getSections());
  }

  @GetMapping("/{documentId}/tables")
  public ResponseEntity<List<ExtractedTable>> getTables(@PathVariable UUID documentId) {
    return ResponseEntity.ok(documentService.getDocument(documentId).getTables());
  }

  @GetMapping("/{documentId}/figures")
  public ResponseEntity<List<ExtractedFigure>> getFigures(@PathVariable UUID documentId) {
    return ResponseEntity.ok(documentService.getDocument(documentId).getFigures());
  }

  /**
   * Serves a stored figure image.
   *
   * @param documentId the document
   * @param figureNumber 1-based position of the figure in the document's figure list
   * @return PNG bytes, or 404 when the figure or its file does not exist
   */
  @GetMapping("/{documentId}/figures/{figureNumber}/image")
  public ResponseEntity<byte[]> getFigureImage(
      @PathVariable UUID documentId, @PathVariable int figureNumber) {
    List<ExtractedFigure> figures = documentService.getDocument(documentId).getFigures();
    if (figureNumber < 1 || figureNumber > figures.size()) {
      return ResponseEntity.notFound().build();
    }
    String imagePath = figures.get(figureNumber - 1).imagePath();
    if (imagePath == null) {
      return ResponseEntity.notFound().build();
    }
    try {
      Path filePath = Path.of(imagePath);
      if (!Files.exists(filePath)) {
        log.warn("Figure file not found on disk: {}", filePath);
        return ResponseEntity.notFound().build();
      }
      return ResponseEntity.ok()
          .contentType(MediaType.IMAGE_PNG)
          .body(Files.readAllBytes(filePath));
    } catch (IOException e) {
      log.error(
          "Failed to read figure {} of document {}: {}", figureNumber, documentId, e.getMessage());
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }

  @GetMapping("/{documentId}/references")
  public ResponseEntity<List<ExtractedReference>> getReferences(@PathVariable UUID documentId) {
    return ResponseEntity.ok(documentService.getDocument(documentId).getReferences());
  }

  @GetMapping("/{documentId}/chunks")
  public ResponseEntity<List<ChunkResponse>> getChunks(@PathVariable UUID documentId) {
    return ResponseEntity.ok(
        documentService.getChunks(documentId).stream().map(ChunkResponse::fromRecord).toList());
  }

  /** Deletes a document with its chunks. */
  @DeleteMapping("/{documentId}")
  public ResponseEntity<Void> deleteDocument(@PathVariable UUID documentId) {
    documentService.deleteDocument(documentId);
    return ResponseEntity.noContent().build();
  }
}
