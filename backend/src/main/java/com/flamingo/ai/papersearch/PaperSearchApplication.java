package com.flamingo.ai.papersearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the paper ingestion and search service. */
@SpringBootApplication
public class PaperSearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(PaperSearchApplication.class, args);
  }
}
