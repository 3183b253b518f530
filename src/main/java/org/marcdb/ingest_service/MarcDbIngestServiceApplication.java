package org.marcdb.ingest_service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarcDbIngestServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(MarcDbIngestServiceApplication.class, args);
  }
}
