package com.avaolo.ai.knowledge.service.knowledge;

import com.avaolo.ai.knowledge.service.knowledge.model.IndexableDocument;
import com.avaolo.ai.knowledge.service.knowledge.model.IndexingStats;
import com.avaolo.ai.knowledge.service.knowledge.model.KnowledgeMetadata;
import java.util.List;
import org.springframework.web.multipart.MultipartFile;

/** Adds and removes knowledge base content. */
public interface KnowledgeIndexingService {

  /**
   * Embeds and stores one document. Storing the same text from the same source again overwrites
   * the earlier entry.
   *
   * @param document the text and its metadata
   * @return the document id
   */
  String addDocument(IndexableDocument document);

  /**
   * Indexes documents one by one; a failing document is counted and does not stop the batch.
   *
   * @param documents the documents, in order
   * @return how many were indexed and how many failed
   */
  IndexingStats bulkIndex(List<IndexableDocument> documents);

  /**
   * Extracts, chunks and indexes an uploaded FIS file. Entries previously indexed from a file with
   * the same name are replaced.
   *
   * @param file PDF, DOCX or plain text file
   * @param metadata metadata shared by every chunk, may be null
   * @return chunk counts
   */
  IndexingStats indexFile(MultipartFile file, KnowledgeMetadata metadata);

  /**
   * Removes every entry indexed from a source.
   *
   * @param source the source name
   */
  void deleteBySource(String source);
}
