package com.avaolo.ai.knowledge.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index of {@link KnowledgeEntry} documents.
 *
 * <p>Filter criteria use the field names below. Every non-null criterion becomes a term filter;
 * {@link #GLOBAL_ONLY} restricts hits to entries without a country code.
 */
@Service
@Slf4j
public class KnowledgeIndexService extends AbstractElasticsearchIndexService<KnowledgeEntry> {

  public static final String FIELD_TEXT = "text";
  public static final String FIELD_SOURCE = "source";
  public static final String FIELD_DOCUMENT_TYPE = "documentType";
  public static final String FIELD_LANGUAGE = "language";
  public static final String FIELD_COUNTRY_CODE = "countryCode";
  public static final String FIELD_CROP = "crop";
  public static final String FIELD_CHEMICAL = "chemical";
  public static final String FIELD_PHI_DAYS = "phiDays";
  public static final String FIELD_PROTECTION_TYPE = "protectionType";
  public static final String FIELD_TARGET_PEST = "targetPest";
  public static final String FIELD_DOSAGE = "dosage";
  public static final String FIELD_APPLICATION_TIMING = "applicationTiming";
  public static final String FIELD_CHUNK_INDEX = "chunkIndex";
  public static final String FIELD_INDEXED_AT = "indexedAt";
  public static final String FIELD_EMBEDDING = "embedding";

  /** Criterion key, not a field: when {@code true} only entries without a country match. */
  public static final String GLOBAL_ONLY = "globalOnly";

  /** Delete criterion key: ids that survive a delete by source. */
  public static final String KEEP_IDS = "keepIds";

  private static final List<String> TERM_FILTER_FIELDS =
      List.of(
          FIELD_DOCUMENT_TYPE,
          FIELD_CROP,
          FIELD_CHEMICAL,
          FIELD_LANGUAGE,
          FIELD_COUNTRY_CODE,
          FIELD_PROTECTION_TYPE,
          FIELD_SOURCE);

  @Value("${app.elasticsearch.index-name:ava-olo-knowledge}")
  private String indexName;

  @Value("${app.elasticsearch.vector-dimensions:1536}")
  private int vectorDimensions;

  @Value("${knowledge.search.candidates-multiplier:2}")
  private int candidatesMultiplier;

  @Autowired
  public KnowledgeIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  public KnowledgeIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
    this.candidatesMultiplier = 2;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected int getVectorDimensions() {
    return vectorDimensions;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // filterable metadata must be keyword for exact term matching
    for (String field : TERM_FILTER_FIELDS) {
      properties.put(field, Property.of(p -> p.keyword(k -> k)));
    }
    properties.put(FIELD_TEXT, Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put(FIELD_PHI_DAYS, Property.of(p -> p.integer(i -> i)));
    properties.put(FIELD_CHUNK_INDEX, Property.of(p -> p.integer(i -> i)));
    properties.put(FIELD_INDEXED_AT, Property.of(p -> p.date(d -> d)));
    properties.put(
        FIELD_EMBEDDING,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(KnowledgeEntry entry) {
    Map<String, Object> document = new HashMap<>();
    document.put(FIELD_TEXT, entry.getText());
    document.put(FIELD_SOURCE, entry.getSource());
    document.put(FIELD_DOCUMENT_TYPE, entry.getDocumentType());
    document.put(FIELD_LANGUAGE, entry.getLanguage());
    document.put(FIELD_INDEXED_AT, entry.getIndexedAt());
    document.put(FIELD_EMBEDDING, entry.getEmbedding());
    putIfPresent(document, FIELD_COUNTRY_CODE, entry.getCountryCode());
    putIfPresent(document, FIELD_CROP, entry.getCrop());
    putIfPresent(document, FIELD_CHEMICAL, entry.getChemical());
    putIfPresent(document, FIELD_PHI_DAYS, entry.getPhiDays());
    putIfPresent(document, FIELD_PROTECTION_TYPE, entry.getProtectionType());
    putIfPresent(document, FIELD_TARGET_PEST, entry.getTargetPest());
    putIfPresent(document, FIELD_DOSAGE, entry.getDosage());
    putIfPresent(document, FIELD_APPLICATION_TIMING, entry.getApplicationTiming());
    putIfPresent(document, FIELD_CHUNK_INDEX, entry.getChunkIndex());
    return document;
  }

  private static void putIfPresent(Map<String, Object> document, String field, Object value) {
    if (value != null) {
      document.put(field, value);
    }
  }

  @Override
  protected KnowledgeEntry convertFromDocument(Map<String, Object> source) {
    return KnowledgeEntry.builder()
        .id(asString(source.get("id")))
        .text(asString(source.get(FIELD_TEXT)))
        .source(asString(source.get(FIELD_SOURCE)))
        .documentType(asString(source.get(FIELD_DOCUMENT_TYPE)))
        .language(asString(source.get(FIELD_LANGUAGE)))
        .countryCode(asString(source.get(FIELD_COUNTRY_CODE)))
        .crop(asString(source.get(FIELD_CROP)))
        .chemical(asString(source.get(FIELD_CHEMICAL)))
        .phiDays(asInteger(source.get(FIELD_PHI_DAYS)))
        .protectionType(asString(source.get(FIELD_PROTECTION_TYPE)))
        .targetPest(asString(source.get(FIELD_TARGET_PEST)))
        .dosage(asString(source.get(FIELD_DOSAGE)))
        .applicationTiming(asString(source.get(FIELD_APPLICATION_TIMING)))
        .chunkIndex(asInteger(source.get(FIELD_CHUNK_INDEX)))
        .indexedAt(asString(source.get(FIELD_INDEXED_AT)))
        .build();
  }

  private static String asString(Object value) {
    return value != null ? value.toString() : null;
  }

  private static Integer asInteger(Object value) {
    if (value instanceof Number n) {
      return n.intValue();
    }
    if (value instanceof String s && !s.isBlank()) {
      return Integer.valueOf(s.trim());
    }
    return null;
  }

  @Override
  protected String getDocumentId(KnowledgeEntry entry) {
    return entry.getId();
  }

  /**
   * Translates filter criteria into term filters. Unknown keys are ignored.
   *
   * @param criteria the filter criteria
   * @return filter queries, empty when nothing restricts the search
   */
  @VisibleForTesting
  List<Query> buildFilterQueries(Map<String, Object> criteria) {
    List<Query> filters = new ArrayList<>();
    for (String field : TERM_FILTER_FIELDS) {
      Object value = criteria.get(field);
      if (value != null) {
        String term = value.toString();
        filters.add(Query.of(q -> q.term(t -> t.field(field).value(term))));
      }
    }
    if (Boolean.TRUE.equals(criteria.get(GLOBAL_ONLY))) {
      filters.add(
          Query.of(q -> q.bool(b -> b.mustNot(mn -> mn.exists(e -> e.field(FIELD_COUNTRY_CODE))))));
    }
    return filters;
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    List<Query> filters = buildFilterQueries(filterCriteria);
    log.debug(
        "vectorSearch topK={} filters={} embedding size={}",
        topK,
        filterCriteria,
        queryEmbedding.size());

    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k -> {
                      k.field(FIELD_EMBEDDING)
                          .queryVector(queryEmbedding)
                          .k(topK)
                          .numCandidates(topK * candidatesMultiplier);
                      if (!filters.isEmpty()) {
                        k.filter(filters);
                      }
                      return k;
                    })
                .source(src -> src.filter(f -> f.excludes(FIELD_EMBEDDING)))
                .size(topK));
  }

  @Override
  protected SearchRequest buildKeywordSearchRequest(
      Map<String, Object> filterCriteria, String query, int topK) {
    List<Query> filters = buildFilterQueries(filterCriteria);
    log.debug("keywordSearch query='{}' topK={} filters={}", query, topK, filterCriteria);

    return SearchRequest.of(
        s ->
            s.index(indexName)
                .query(
                    q ->
                        q.bool(
                            b ->
                                b.filter(filters)
                                    .must(m -> m.match(mt -> mt.field(FIELD_TEXT).query(query)))))
                .source(src -> src.filter(f -> f.excludes(FIELD_EMBEDDING)))
                .size(topK));
  }

  @Override
  protected Query buildDeleteQuery(Map<String, Object> criteria) {
    Object source = criteria.get(FIELD_SOURCE);
    if (source == null) {
      throw new IllegalArgumentException("deleteBy requires a source in criteria");
    }
    Query bySource = Query.of(q -> q.term(t -> t.field(FIELD_SOURCE).value(source.toString())));
    if (!(criteria.get(KEEP_IDS) instanceof Collection<?> keep) || keep.isEmpty()) {
      return bySource;
    }
    List<String> keepIds = keep.stream().map(Object::toString).toList();
    return Query.of(
        q -> q.bool(b -> b.filter(bySource).mustNot(mn -> mn.ids(i -> i.values(keepIds)))));
  }

  @Override
  protected String getContentField() {
    return FIELD_TEXT;
  }

  @Override
  protected String getMetricPrefix() {
    return "knowledge_entry";
  }

  /**
   * Removes every entry that was indexed from one source.
   *
   * @param source the source name, e.g. the FIS file name
   */
  public void deleteBySource(String source) {
    Map<String, Object> criteria = new LinkedHashMap<>();
    criteria.put(FIELD_SOURCE, source);
    deleteBy(criteria);
  }

  /**
   * Removes the entries of one source that are not among the given ids. Used after re-indexing a
   * file so that chunks of its previous version disappear only once the new ones are stored.
   *
   * @param source the source name
   * @param keepIds ids of the entries just indexed
   */
  public void deleteStaleEntries(String source, Collection<String> keepIds) {
    Map<String, Object> criteria = new LinkedHashMap<>();
    criteria.put(FIELD_SOURCE, source);
    criteria.put(KEEP_IDS, List.copyOf(keepIds));
    deleteBy(criteria);
  }
}
