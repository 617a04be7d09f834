package com.avaolo.ai.knowledge.service.knowledge.model;

/**
 * Outcome of indexing a batch of documents.
 *
 * @param total documents submitted
 * @param success documents indexed
 * @param failed documents rejected
 */
public record IndexingStats(int total, int success, int failed) {}
