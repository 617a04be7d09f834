package com.avaolo.ai.knowledge.api.rest;

import com.avaolo.ai.knowledge.domain.repository.FarmFieldRepository;
import com.avaolo.ai.knowledge.elasticsearch.KnowledgeIndexService;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks and system info. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final KnowledgeIndexService knowledgeIndexService;
  private final FarmFieldRepository farmFieldRepository;

  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", LocalDateTime.now());
    health.put("service", "ava-olo-knowledge");
    return ResponseEntity.ok(health);
  }

  /** Knowledge index size and farmer database size. */
  @GetMapping("/stats")
  public ResponseEntity<Map<String, Object>> stats() {
    Map<String, Object> stats = new HashMap<>();
    stats.put("indexName", knowledgeIndexService.getIndexName());
    stats.put("knowledgeEntries", knowledgeIndexService.count());
    stats.put("farmFields", farmFieldRepository.count());
    stats.put("farmers", farmFieldRepository.countFarmers());
    stats.put("timestamp", LocalDateTime.now());
    return ResponseEntity.ok(stats);
  }
}
