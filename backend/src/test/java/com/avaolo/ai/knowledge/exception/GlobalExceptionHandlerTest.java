package com.avaolo.ai.knowledge.exception;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
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
    request = new MockHttpServletRequest("POST", "/api/knowledge/documents/upload");
  }

  @Test
  @DisplayName("should answer an upload over the multipart limit with 422")
  void shouldRejectOversizedUploadAsUnprocessable() {
    ResponseEntity<ApiError> response =
        handler.handleUploadTooLarge(
            new MaxUploadSizeExceededException(50L * 1024 * 1024), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody()).isNotNull();
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.INDEXING_FAILED);
    assertThat(response.getBody().getMessage()).isEqualTo("Maximum file size is 50MB");
    assertThat(response.getBody().getPath()).isEqualTo("/api/knowledge/documents/upload");
    assertThat(
            meterRegistry.counter("api_errors_total", "error_type", "indexing_error").count())
        .isEqualTo(1.0);
  }
}
