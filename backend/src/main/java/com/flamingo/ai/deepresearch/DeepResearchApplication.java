package com.flamingo.ai.deepresearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the deep research service. */
@SpringBootApplication
public class DeepResearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeepResearchApplication.class, args);
  }
}
