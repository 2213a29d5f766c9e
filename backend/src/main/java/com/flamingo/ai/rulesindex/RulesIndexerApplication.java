package com.flamingo.ai.rulesindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the rulebook indexing backend. */
@SpringBootApplication
public class RulesIndexerApplication {

  public static void main(String[] args) {
    SpringApplication.run(RulesIndexerApplication.class, args);
  }
}
