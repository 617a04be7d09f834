package com.avaolo.ai.knowledge.service.knowledge.model;

/**
 * One crop protection measure. Missing values are empty strings.
 *
 * @param chemical product or active substance
 * @param target pest, disease or weed it acts against
 * @param dosage application rate
 * @param timing when to apply
 * @param text full text of the source document
 */
public record ProtectionRecommendation(
    String chemical, String target, String dosage, String timing, String text) {}
