package com.avaolo.ai.knowledge.service.hierarchy;

import com.avaolo.ai.knowledge.domain.enums.InformationRelevance;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationItem;
import com.avaolo.ai.knowledge.service.hierarchy.model.InformationQuery;
import java.util.List;
import java.util.Set;

/** Fetches items from one information source for the tiers it serves. */
public interface InformationProvider {

  /** Id of the {@code InformationSource} this provider backs. */
  String sourceId();

  Set<InformationRelevance> supportedLevels();

  /**
   * Fetches items for one tier.
   *
   * @param query the query, including the farmer's context
   * @param level the tier being filled
   * @return items tagged with {@code level}, best first
   */
  List<InformationItem> fetch(InformationQuery query, InformationRelevance level);
}
