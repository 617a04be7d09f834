package com.avaolo.ai.knowledge.service.knowledge;

import com.avaolo.ai.knowledge.config.KnowledgeConfig;
import com.avaolo.ai.knowledge.domain.enums.DocumentType;
import com.avaolo.ai.knowledge.domain.enums.ProtectionType;
import com.avaolo.ai.knowledge.elasticsearch.KnowledgeEntry;
import com.avaolo.ai.knowledge.elasticsearch.KnowledgeIndexService;
import com.avaolo.ai.knowledge.exception.DocumentIndexingException;
import com.avaolo.ai.knowledge.exception.EmbeddingServiceException;
import com.avaolo.ai.knowledge.service.embedding.EmbeddingService;
import com.avaolo.ai.knowledge.service.knowledge.model.IndexableDocument;
import com.avaolo.ai.knowledge.service.knowledge.model.IndexingStats;
import com.avaolo.ai.knowledge.service.knowledge.model.KnowledgeMetadata;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.Hashing;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/** Embeds knowledge documents and writes them to the knowledge index. */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeIndexingServiceImpl implements KnowledgeIndexingService {

  private static final Set<String> SUPPORTED_MIME_TYPES =
      Set.of(
          "application/pdf",
          "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
          "text/plain");

  private final KnowledgeIndexService knowledgeIndexService;
  private final EmbeddingService embeddingService;
  private final FisDocumentChunker fisDocumentChunker;
  private final KnowledgeConfig knowledgeConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "knowledge.index.document", description = "Time to index one document")
  public String addDocument(IndexableDocument document) {
    if (document == null || document.text() == null || document.text().isBlank()) {
      throw new IllegalArgumentException("Document text must not be blank");
    }
    KnowledgeEntry entry = toEntry(document.text(), document.metadata(), null);

    List<Float> embedding = embeddingService.embedPassage(entry.getText());
    if (embedding.isEmpty()) {
      throw new EmbeddingServiceException(
          "No embedding available for document from source " + entry.getSource());
    }
    entry.setEmbedding(embedding);
    knowledgeIndexService.indexDocuments(List.of(entry));

    meterRegistry.counter("knowledge.documents.added").increment();
    log.info("Added document {} to knowledge base", entry.getId());
    return entry.getId();
  }

  @Override
  public IndexingStats bulkIndex(List<IndexableDocument> documents) {
    int success = 0;
    int failed = 0;
    for (IndexableDocument document : documents) {
      try {
        addDocument(document);
        success++;
      } catch (RuntimeException e) {
        failed++;
        meterRegistry.counter("knowledge.documents.failed").increment();
        log.error("Failed to index document in bulk batch: {}", e.getMessage());
      }
    }
    IndexingStats stats = new IndexingStats(documents.size(), success, failed);
    log.info("Bulk indexing complete: {}", stats);
    return stats;
  }

  @Override
  @Timed(value = "knowledge.index.file", description = "Time to index an uploaded file")
  public IndexingStats indexFile(MultipartFile file, KnowledgeMetadata metadata) {
    validateFile(file);
    String fileName = file.getOriginalFilename();
    boolean namedFile = fileName != null && !fileName.isBlank();
    String source = namedFile ? fileName : (metadata != null ? metadata.getSource() : null);
    KnowledgeMetadata shared =
        (metadata != null ? metadata.toBuilder() : KnowledgeMetadata.builder())
            .source(source)
            .build();

    List<String> chunks;
    try (InputStream inputStream = file.getInputStream()) {
      chunks = fisDocumentChunker.extractChunks(inputStream, source);
    } catch (IOException e) {
      throw new DocumentIndexingException(source, "Failed to read upload", e);
    }

    List<List<Float>> embeddings = embeddingService.embedPassages(chunks);
    if (embeddings.size() != chunks.size()) {
      throw new EmbeddingServiceException(
          "Got " + embeddings.size() + " embeddings for " + chunks.size() + " chunks of " + source);
    }

    List<KnowledgeEntry> entries = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      KnowledgeEntry entry = toEntry(chunks.get(i), shared, i);
      entry.setEmbedding(embeddings.get(i));
      entries.add(entry);
    }

    String resolvedSource = entries.get(0).getSource();
    knowledgeIndexService.indexDocuments(entries);
    if (namedFile) {
      // previous version of the file goes only after the new chunks are stored
      knowledgeIndexService.deleteStaleEntries(
          resolvedSource, entries.stream().map(KnowledgeEntry::getId).toList());
    }

    meterRegistry.counter("knowledge.documents.added").increment(entries.size());
    log.info("Indexed file {} as {} chunks", resolvedSource, entries.size());
    return new IndexingStats(entries.size(), entries.size(), 0);
  }

  @Override
  public void deleteBySource(String source) {
    if (source == null || source.isBlank()) {
      throw new IllegalArgumentException("Source must not be blank");
    }
    knowledgeIndexService.deleteBySource(source);
  }

  /**
   * Derives the id of a document: its source plus the first 16 hex characters of the SHA-256 of
   * its text.
   */
  @VisibleForTesting
  static String documentId(String source, String text) {
    String hash = Hashing.sha256().hashString(text, StandardCharsets.UTF_8).toString();
    return source + "_" + hash.substring(0, 16);
  }

  private KnowledgeEntry toEntry(String text, KnowledgeMetadata metadata, Integer chunkIndex) {
    KnowledgeMetadata meta = metadata != null ? metadata : new KnowledgeMetadata();
    KnowledgeConfig.Defaults defaults = knowledgeConfig.getDefaults();

    String source = orDefault(meta.getSource(), defaults.getSource());
    String documentType =
        orDefault(meta.getDocumentType(), DocumentType.GENERAL.getValue()).toLowerCase(Locale.ROOT);

    return KnowledgeEntry.builder()
        .id(documentId(source, text))
        .text(text)
        .source(source)
        .documentType(documentType)
        .language(orDefault(meta.getLanguage(), defaults.getLanguage()))
        .countryCode(normalize(meta.getCountryCode(), true))
        .crop(normalize(meta.getCrop(), false))
        .chemical(normalize(meta.getChemical(), false))
        .phiDays(meta.getPhiDays())
        .protectionType(
            meta.getProtectionType() != null && !meta.getProtectionType().isBlank()
                ? ProtectionType.fromValue(meta.getProtectionType()).getValue()
                : null)
        .targetPest(meta.getTargetPest())
        .dosage(meta.getDosage())
        .applicationTiming(meta.getApplicationTiming())
        .chunkIndex(chunkIndex)
        .indexedAt(Instant.now().toString())
        .build();
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new DocumentIndexingException(null, "File is empty", "Please upload a valid file");
    }
    String contentType = file.getContentType();
    String mimeType = contentType != null ? contentType.split(";")[0].trim() : null;
    if (mimeType == null || !SUPPORTED_MIME_TYPES.contains(mimeType)) {
      throw new DocumentIndexingException(
          file.getOriginalFilename(),
          "Unsupported file type: " + contentType,
          "Supported formats: PDF, DOCX, TXT");
    }
    if (file.getSize() > knowledgeConfig.getUpload().getMaxFileSizeBytes()) {
      throw new DocumentIndexingException(
          file.getOriginalFilename(),
          "File too large: " + file.getSize(),
          "Maximum file size is 50MB");
    }
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static String normalize(String value, boolean upperCase) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String trimmed = value.trim();
    return upperCase ? trimmed.toUpperCase(Locale.ROOT) : trimmed.toLowerCase(Locale.ROOT);
  }
}
