package com.delta.archivescraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ArchiveScraperApplication {

  public static void main(String[] args) {
    SpringApplication.run(ArchiveScraperApplication.class, args);
  }
}
