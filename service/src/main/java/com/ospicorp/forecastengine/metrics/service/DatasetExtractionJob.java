package com.ospicorp.forecastengine.metrics.service;

import com.ospicorp.forecastengine.metrics.model.MetricsQuery;
import com.ospicorp.forecastengine.metrics.model.NormalizationResult;
import com.ospicorp.forecastengine.metrics.model.RawObservation;
import com.ospicorp.forecastengine.metrics.model.ResampledPoint;
import com.ospicorp.forecastengine.metrics.model.SeriesRecord;
import com.ospicorp.forecastengine.metrics.source.ExtractionException;
import com.ospicorp.forecastengine.metrics.source.MetricsSourceConnector;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offline path: fetch raw rows, normalize, resample, tag and persist the training file.
 * A source failure ends the run with an empty report and no file.
 */
public class DatasetExtractionJob {

  private static final Logger log = LoggerFactory.getLogger(DatasetExtractionJob.class);

  private final MetricsSourceConnector connector;
  private final MetricsQuery query;
  private final SampleNormalizer normalizer;
  private final Duration interval;
  private final SeriesTagger tagger;
  private final TrainingDatasetWriter writer;
  private final Path output;

  public DatasetExtractionJob(MetricsSourceConnector connector, MetricsQuery query,
      SampleNormalizer normalizer, Duration interval, SeriesTagger tagger,
      TrainingDatasetWriter writer, Path output) {
    this.connector = connector;
    this.query = query;
    this.normalizer = normalizer;
    this.interval = interval;
    this.tagger = tagger;
    this.writer = writer;
    this.output = output;
  }

  public ExtractionReport run() throws IOException {
    List<RawObservation> raw;
    try {
      raw = connector.fetch(query);
    } catch (ExtractionException ex) {
      log.error("Metrics extraction failed: {}", ex.getMessage(), ex);
      return ExtractionReport.empty();
    }
    if (raw.isEmpty()) {
      log.info("No data to process.");
      return ExtractionReport.empty();
    }

    NormalizationResult normalized = normalizer.normalize(raw);
    List<ResampledPoint> points = Resampler.resample(normalized.observations(), interval);
    List<SeriesRecord> records = tagger.tag(points);
    if (records.isEmpty()) {
      log.info("Resampling produced no data.");
      return new ExtractionReport(raw.size(), normalized.observations().size(), points.size(), 0,
          Optional.empty());
    }

    Path written = writer.write(records, output);
    return new ExtractionReport(raw.size(), normalized.observations().size(), points.size(),
        records.size(), Optional.of(written));
  }
}
