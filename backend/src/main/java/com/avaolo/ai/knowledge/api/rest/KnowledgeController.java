package com.avaolo.ai.knowledge.api.rest;

import com.avaolo.ai.knowledge.api.dto.request.BulkIndexRequest;
import com.avaolo.ai.knowledge.api.dto.request.IndexDocumentRequest;
import com.avaolo.ai.knowledge.api.dto.request.KnowledgeSearchRequest;
import com.avaolo.ai.knowledge.api.dto.response.IndexDocumentResponse;
import com.avaolo.ai.knowledge.service.knowledge.KnowledgeIndexingService;
import com.avaolo.ai.knowledge.service.knowledge.KnowledgeSearchService;
import com.avaolo.ai.knowledge.service.knowledge.model.IndexingStats;
import com.avaolo.ai.knowledge.service.knowledge.model.KnowledgeDocument;
import com.avaolo.ai.knowledge.service.knowledge.model.KnowledgeFilter;
import com.avaolo.ai.knowledge.service.knowledge.model.KnowledgeMetadata;
import com.avaolo.ai.knowledge.service.knowledge.model.PesticideLookupResult;
import com.avaolo.ai.knowledge.service.knowledge.model.ProtectionRecommendation;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for knowledge search and indexing. */
@RestController
@RequestMapping("/api/knowledge")
@RequiredArgsConstructor
public class KnowledgeController {

  private final KnowledgeSearchService knowledgeSearchService;
  private final KnowledgeIndexingService knowledgeIndexingService;

  /** Semantic search with optional metadata filters. */
  @PostMapping("/search")
  public ResponseEntity<List<KnowledgeDocument>> search(
      @Valid @RequestBody KnowledgeSearchRequest request) {
    List<KnowledgeDocument> documents =
        knowledgeSearchService.search(
            request.getQuery(), KnowledgeFilter.fromMap(request.getFilters()), request.getTopK());
    return ResponseEntity.ok(documents);
  }

  /** Pre-harvest interval of a chemical, optionally on a crop. */
  @GetMapping("/pesticides/{chemical}")
  public ResponseEntity<PesticideLookupResult> pesticideInfo(
      @PathVariable String chemical, @RequestParam(required = false) String crop) {
    return ResponseEntity.ok(knowledgeSearchService.searchPesticideInfo(chemical, crop));
  }

  /** Protection recommendations for a crop, grouped by protection type. */
  @GetMapping("/crop-protection/{crop}")
  public ResponseEntity<Map<String, List<ProtectionRecommendation>>> cropProtection(
      @PathVariable String crop, @RequestParam(required = false) String problem) {
    return ResponseEntity.ok(knowledgeSearchService.searchCropProtection(crop, problem));
  }

  @PostMapping("/documents")
  public ResponseEntity<IndexDocumentResponse> addDocument(
      @Valid @RequestBody IndexDocumentRequest request) {
    String id = knowledgeIndexingService.addDocument(request.toIndexableDocument());
    return ResponseEntity.status(HttpStatus.CREATED).body(new IndexDocumentResponse(id));
  }

  @PostMapping("/documents/bulk")
  public ResponseEntity<IndexingStats> bulkIndex(@Valid @RequestBody BulkIndexRequest request) {
    IndexingStats stats =
        knowledgeIndexingService.bulkIndex(
            request.getDocuments().stream()
                .map(IndexDocumentRequest::toIndexableDocument)
                .toList());
    return ResponseEntity.ok(stats);
  }

  /** Uploads an FIS document; every chunk shares the given metadata. */
  @PostMapping(value = "/documents/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<IndexingStats> uploadDocument(
      @RequestParam("file") MultipartFile file,
      @RequestParam(required = false) String documentType,
      @RequestParam(required = false) String language,
      @RequestParam(required = false) String countryCode,
      @RequestParam(required = false) String crop,
      @RequestParam(required = false) String chemical,
      @RequestParam(required = false) Integer phiDays,
      @RequestParam(required = false) String protectionType,
      @RequestParam(required = false) String targetPest,
      @RequestParam(required = false) String dosage,
      @RequestParam(required = false) String applicationTiming) {
    if (phiDays != null && phiDays < 0) {
      throw new IllegalArgumentException("phiDays must not be negative");
    }
    KnowledgeMetadata metadata =
        KnowledgeMetadata.builder()
            .documentType(documentType)
            .language(language)
            .countryCode(countryCode)
            .crop(crop)
            .chemical(chemical)
            .phiDays(phiDays)
            .protectionType(protectionType)
            .targetPest(targetPest)
            .dosage(dosage)
            .applicationTiming(applicationTiming)
            .build();
    IndexingStats stats = knowledgeIndexingService.indexFile(file, metadata);
    return ResponseEntity.status(HttpStatus.CREATED).body(stats);
  }

  @DeleteMapping("/documents")
  public ResponseEntity<Void> deleteBySource(@RequestParam String source) {
    knowledgeIndexingService.deleteBySource(source);
    return ResponseEntity.noContent().build();
  }
}
