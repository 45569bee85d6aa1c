package com.ospicorp.forecastengine.metrics.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Profile("extract")
public class DatasetExtractionRunner implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(DatasetExtractionRunner.class);

  private final DatasetExtractionJob job;

  public DatasetExtractionRunner(DatasetExtractionJob job) {
    this.job = job;
  }

  @Override
  public void run(String... args) throws Exception {
    ExtractionReport report = job.run();
    if (report.written()) {
      log.info("Data processed and saved to '{}' ({} rows fetched, {} series records)",
          report.output().get(), report.fetchedRows(), report.seriesRecords());
    } else {
      log.info("Extraction finished without output ({} rows fetched)", report.fetchedRows());
    }
  }
}
