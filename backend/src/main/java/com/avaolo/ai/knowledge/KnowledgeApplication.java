package com.avaolo.ai.knowledge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the agricultural knowledge search service. */
@SpringBootApplication
public class KnowledgeApplication {

  public static void main(String[] args) {
    SpringApplication.run(KnowledgeApplication.class, args);
  }
}
