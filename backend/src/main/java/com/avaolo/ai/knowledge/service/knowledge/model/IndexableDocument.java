package com.avaolo.ai.knowledge.service.knowledge.model;

/**
 * A document waiting to be indexed.
 *
 * @param text the knowledge text
 * @param metadata its metadata, may be null
 */
public record IndexableDocument(String text, KnowledgeMetadata metadata) {}
