package com.flamingo.ai.rapiddocs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the document generation backend. */
@SpringBootApplication
public class RapidDocsApplication {

  public static void main(String[] args) {
    SpringApplication.run(RapidDocsApplication.class, args);
  }
}
