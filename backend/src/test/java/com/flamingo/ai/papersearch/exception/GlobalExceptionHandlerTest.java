package com.flamingo.ai.papersearch.exception;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

  private SimpleMeterRegistry meterRegistry;
  private GlobalExceptionHandler handler;
  private MockHttpServletRequest request;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    handler = new GlobalExceptionHandler(meterRegistry);
    request = new MockHttpServletRequest("GET", "/documents/123");
  }

  @Test
  @DisplayName("Should hide internal details of unexpected errors")
  void shouldReturnGenericMessage_whenUnexpectedError() {
    // When
    ResponseEntity<ApiError> response =
        handler.handleGeneric(new NullPointerException("secret internals"), request);

    // Then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.INTERNAL_ERROR);
    assertThat(response.getBody().getMessage()).doesNotContain("secret");
    assertThat(response.getBody().getErrorId()).hasSize(8);
    assertThat(response.getBody().getPath()).isEqualTo("/documents/123");
    assertThat(response.getBody().getTimestamp()).isNotNull();
  }

  @Test
  @DisplayName("Should map oversized uploads to 413")
  void shouldReturn413_whenUploadTooLarge() {
    // When
    ResponseEntity<ApiError> response =
        handler.handleUploadTooLarge(new MaxUploadSizeExceededException(10L), request);

    // Then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.VALIDATION_ERROR);
  }

  @Test
  @DisplayName("Should surface the user message of processing failures")
  void shouldReturnUserMessage_whenProcessingFails() {
    // When
    ResponseEntity<ApiError> response =
        handler.handleDocumentProcessing(
            new DocumentProcessingException(
                UUID.randomUUID(), "Too many pages: 900", "Document has too many pages"),
            request);

    // Then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody().getMessage()).isEqualTo("Document has too many pages");
    assertThat(
            meterRegistry.counter("api_errors_total", "error_type", "document_processing").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should map bad arguments to 400 with their message")
  void shouldReturn400_whenIllegalArgument() {
    // When
    ResponseEntity<ApiError> response =
        handler.handleBadRequest(new IllegalArgumentException("Query must not be null"), request);

    // Then
    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().getMessage()).isEqualTo("Query must not be null");
  }
}
