package com.avaolo.ai.knowledge.service.knowledge.model;

/**
 * Pre-harvest interval (karenca) of a chemical on a crop.
 *
 * @param chemical the chemical as asked for
 * @param crop the crop asked for, or the crop of the matching document, or empty
 * @param phiDays days between last application and harvest
 * @param source where the figure comes from
 * @param additionalInfo full text of the matching document
 */
public record PhiInfo(
    String chemical, String crop, int phiDays, String source, String additionalInfo) {}
