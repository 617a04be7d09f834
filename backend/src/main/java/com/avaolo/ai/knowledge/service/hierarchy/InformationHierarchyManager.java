package com.avaolo.ai.knowledge.service.hierarchy;

import com.avaolo.ai.knowledge.service.hierarchy.model.InformationItem;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationQuery;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationResult;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationSource;
import com.avaolo.ai.knowledge.service.hierarchy.model.LocalizationContext;
import java.util.Map;

/**
 * Answers questions from farmer-specific, country-specific and global sources, in that order of
 * priority, while keeping every source within the tiers it is allowed to supply.
 */
public interface InformationHierarchyManager {

  /** Registers or replaces a source without a provider; it is listed but never queried. */
  void registerSource(InformationSource source);

  /** Registers or replaces a source together with the provider that fetches its items. */
  void registerSource(InformationSource source, InformationProvider provider);

  /**
   * Queries every applicable tier and logs an audit entry.
   *
   * @param query the query
   * @return items per tier, each tier truncated to the query's limit
   */
  InformationResult queryInformation(InformationQuery query);

  /**
   * Checks that a source may supply an item of the item's tier.
   *
   * @return false for farmer items from sources without farmer access, or country items from
   *     sources without country access
   */
  boolean validatePrivacyCompliance(InformationItem item, InformationSource source);

  /** Capabilities per source id: {@code farmer_data}, {@code country_data}, ... */
  Map<String, Map<String, Object>> getSourceCapabilities();

  /**
   * Short stable hash of the caller's context, for cache keys and audit correlation.
   *
   * @return the first 16 hex characters of SHA-256 over {@code whatsapp:country:language}
   */
  String hashContext(LocalizationContext context);
}
