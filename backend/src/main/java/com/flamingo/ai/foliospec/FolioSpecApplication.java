package com.flamingo.ai.foliospec;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the folio-spec conversion service. */
@SpringBootApplication
public class FolioSpecApplication {

  public static void main(String[] args) {
    SpringApplication.run(FolioSpecApplication.class, args);
  }
}
