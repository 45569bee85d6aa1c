package com.ospicorp.forecastengine.metrics.service;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.forecastengine.metrics.model.SeriesRecord;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the long-form series table as CSV. The header {@code Timestamp,Value,item_id} is the
 * contract with the training process and must not change.
 */
public class TrainingDatasetWriter {

  public static final String TIMESTAMP_COLUMN = "Timestamp";
  public static final String VALUE_COLUMN = "Value";
  public static final String ITEM_ID_COLUMN = "item_id";

  private static final Logger log = LoggerFactory.getLogger(TrainingDatasetWriter.class);

  private static final CsvSchema SCHEMA = CsvSchema.builder()
      .addColumn(TIMESTAMP_COLUMN)
      .addNumberColumn(VALUE_COLUMN)
      .addColumn(ITEM_ID_COLUMN)
      .setUseHeader(true)
      .build();

  private final CsvMapper mapper = new CsvMapper();

  public Path write(List<SeriesRecord> records, Path target) throws IOException {
    Path absolute = target.toAbsolutePath();
    Path directory = absolute.getParent();
    Files.createDirectories(directory);

    Path temp = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
    try {
      try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
          SequenceWriter writer = mapper.writer(SCHEMA).writeValues(out)) {
        for (SeriesRecord record : records) {
          writer.write(toRow(record));
        }
      }
      moveIntoPlace(temp, absolute);
    } finally {
      Files.deleteIfExists(temp);
    }
    log.info("Wrote {} series records to {}", records.size(), absolute);
    return absolute;
  }

  private static Map<String, Object> toRow(SeriesRecord record) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put(TIMESTAMP_COLUMN, TimestampParser.format(record.timestamp()));
    row.put(VALUE_COLUMN, record.value());
    row.put(ITEM_ID_COLUMN, record.itemId());
    return row;
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
