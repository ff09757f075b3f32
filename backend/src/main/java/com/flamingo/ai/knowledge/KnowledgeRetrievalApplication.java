package com.flamingo.ai.knowledge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the knowledge retrieval service. */
@SpringBootApplication
public class KnowledgeRetrievalApplication {

  public static void main(String[] args) {
    SpringApplication.run(KnowledgeRetrievalApplication.class, args);
  }
}
