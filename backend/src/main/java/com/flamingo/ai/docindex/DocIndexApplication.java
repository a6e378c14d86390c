package com.flamingo.ai.docindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the document chunking and retrieval service. */
@SpringBootApplication
public class DocIndexApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocIndexApplication.class, args);
  }
}
