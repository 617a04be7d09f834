package com.avaolo.ai.knowledge.service.knowledge;

import com.avaolo.ai.knowledge.config.KnowledgeConfig;
import com.avaolo.ai.knowledge.exception.DocumentIndexingException;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.springframework.stereotype.Component;

/**
 * Turns an uploaded FIS document (PDF, DOCX, plain text) into overlapping text chunks.
 *
 * <p>Text is extracted with Apache Tika and packed paragraph by paragraph until the configured
 * token budget is reached (estimated at four characters per token). Each new chunk starts with the
 * last {@code overlap} words of the previous one. Paragraphs longer than {@link #MAX_CHARS} are
 * split hard.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FisDocumentChunker {

  static final int MAX_CHARS = 3500;
  private static final int CHARS_PER_TOKEN = 4;
  private static final Tika TIKA = new Tika();

  private final KnowledgeConfig knowledgeConfig;

  /**
   * Extracts and chunks a document.
   *
   * @param inputStream the document bytes
   * @param fileName name used in error reports
   * @return non-empty chunks in document order
   */
  public List<String> extractChunks(InputStream inputStream, String fileName) {
    String fullText;
    try {
      fullText = TIKA.parseToString(inputStream);
    } catch (IOException | TikaException e) {
      log.error("Text extraction failed for {}: {}", fileName, e.getMessage());
      throw new DocumentIndexingException(
          fileName,
          "Failed to extract text: " + e.getMessage(),
          "The file could not be read. Please upload a valid PDF, DOCX or text file.");
    }
    if (fullText == null || fullText.isBlank()) {
      throw new DocumentIndexingException(
          fileName, "No text extracted", "The file does not contain any readable text.");
    }
    List<String> chunks = chunk(fullText);
    log.debug(
        "Extracted {} chars from {} into {} chunks", fullText.length(), fileName, chunks.size());
    return chunks;
  }

  @VisibleForTesting
  List<String> chunk(String content) {
    int chunkSize = knowledgeConfig.getChunking().getSize();
    int overlap = knowledgeConfig.getChunking().getOverlap();

    List<String> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int currentTokens = 0;

    for (String rawParagraph : content.split("\\n\\s*\\n+")) {
      String paragraph = rawParagraph.trim();
      if (paragraph.isEmpty()) {
        continue;
      }
      if (paragraph.length() > MAX_CHARS) {
        flush(chunks, current);
        current = new StringBuilder();
        currentTokens = 0;
        chunks.addAll(splitByChars(paragraph));
        continue;
      }

      int paragraphTokens = paragraph.length() / CHARS_PER_TOKEN;
      boolean overBudget = currentTokens + paragraphTokens > chunkSize;
      boolean overChars = current.length() + paragraph.length() > MAX_CHARS;
      if ((overBudget || overChars) && current.length() > 0) {
        flush(chunks, current);
        String tail = overlapTail(current.toString(), overlap);
        current = new StringBuilder(tail);
        currentTokens = tail.length() / CHARS_PER_TOKEN;
      }

      current.append(paragraph).append("\n\n");
      currentTokens += paragraphTokens;
    }
    flush(chunks, current);
    return chunks;
  }

  private static void flush(List<String> chunks, StringBuilder current) {
    String text = current.toString().trim();
    if (!text.isEmpty()) {
      chunks.add(text);
    }
  }

  private static List<String> splitByChars(String text) {
    List<String> parts = new ArrayList<>();
    for (int i = 0; i < text.length(); i += MAX_CHARS) {
      parts.add(text.substring(i, Math.min(i + MAX_CHARS, text.length())));
    }
    return parts;
  }

  private static String overlapTail(String text, int overlapWords) {
    String[] words = text.trim().split("\\s+");
    int keep = Math.min(overlapWords, words.length);
    if (keep <= 0) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (int i = words.length - keep; i < words.length; i++) {
      sb.append(words[i]).append(' ');
    }
    return sb.toString();
  }
}
