package com.avaolo.ai.knowledge.api.dto.response;

/**
 * Response DTO for an indexed document.
 *
 * @param id the document id
 */
public record IndexDocumentResponse(String id) {}
