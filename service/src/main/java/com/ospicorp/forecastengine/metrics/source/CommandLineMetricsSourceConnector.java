package com.ospicorp.forecastengine.metrics.source;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.forecastengine.metrics.model.MetricsQuery;
import com.ospicorp.forecastengine.metrics.model.RawObservation;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a database command-line client (for example {@code sqlcmd ... -s , -W}) and reads its
 * comma-delimited stdout. The {@value #QUERY_PLACEHOLDER} token in any argument is replaced by
 * the query text. Separator and row-count lines are returned as-is and fail normalization later.
 */
public class CommandLineMetricsSourceConnector implements MetricsSourceConnector {

  public static final String QUERY_PLACEHOLDER = "{query}";

  private static final Logger log = LoggerFactory.getLogger(CommandLineMetricsSourceConnector.class);

  private final List<String> command;
  private final Duration timeout;
  private final CsvMapper mapper = new CsvMapper();

  public CommandLineMetricsSourceConnector(List<String> command, Duration timeout) {
    if (command == null || command.isEmpty()) {
      throw new IllegalArgumentException("command must be provided");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.command = List.copyOf(command);
    this.timeout = timeout;
    mapper.enable(CsvParser.Feature.TRIM_SPACES);
    mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    mapper.enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE);
    mapper.enable(CsvParser.Feature.ALLOW_TRAILING_COMMA);
  }

  @Override
  public List<RawObservation> fetch(MetricsQuery query) throws ExtractionException {
    List<String> resolved = command.stream()
        .map(arg -> arg.replace(QUERY_PLACEHOLDER, query.sql()))
        .toList();
    log.info("Running metrics client {}", resolved.get(0));
    String output = run(resolved);
    return parse(output);
  }

  private String run(List<String> resolved) throws ExtractionException {
    Process process;
    try {
      process = new ProcessBuilder(resolved)
          .redirectError(ProcessBuilder.Redirect.INHERIT)
          .start();
    } catch (IOException ex) {
      throw new ExtractionException("Unable to start metrics client " + resolved.get(0), ex);
    }

    CompletableFuture<String> stdout =
        CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new ExtractionException("Metrics client timed out after " + timeout);
      }
      int exit = process.exitValue();
      if (exit != 0) {
        throw new ExtractionException("Metrics client exited with status " + exit);
      }
      return stdout.get();
    } catch (InterruptedException ex) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new ExtractionException("Interrupted while waiting for metrics client", ex);
    } catch (ExecutionException ex) {
      throw new ExtractionException("Unable to read metrics client output", ex.getCause());
    }
  }

  List<RawObservation> parse(String output) throws ExtractionException {
    if (output == null || output.isBlank()) {
      return List.of();
    }
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    List<RawObservation> rows = new ArrayList<>();
    try (MappingIterator<Map<String, String>> it =
        mapper.readerForMapOf(String.class).with(schema).readValues(output)) {
      while (it.hasNextValue()) {
        rows.add(RawObservation.of(it.nextValue()));
      }
    } catch (IOException | RuntimeException ex) {
      throw new ExtractionException("Malformed metrics client output", ex);
    }
    log.info("Metrics client returned {} rows", rows.size());
    return rows;
  }

  private static String readFully(InputStream in) {
    try (in) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }
}
