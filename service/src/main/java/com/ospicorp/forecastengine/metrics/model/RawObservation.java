package com.ospicorp.forecastengine.metrics.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One untyped row as returned by a metrics source. Column names are trimmed on the way in
 * because command-line clients pad their headers.
 */
public record RawObservation(Map<String, Object> fields) {

  public RawObservation {
    Map<String, Object> trimmed = new LinkedHashMap<>();
    if (fields != null) {
      fields.forEach((key, value) -> {
        if (key != null) {
          trimmed.put(key.trim(), value);
        }
      });
    }
    fields = Collections.unmodifiableMap(trimmed);
  }

  public static RawObservation of(Map<String, ?> fields) {
    return new RawObservation(new LinkedHashMap<>(fields));
  }

  // SQL identifiers are case-insensitive, and drivers disagree on the case they report.
  public Object get(String column) {
    if (fields.containsKey(column)) {
      return fields.get(column);
    }
    for (Map.Entry<String, Object> entry : fields.entrySet()) {
      if (entry.getKey().equalsIgnoreCase(column)) {
        return entry.getValue();
      }
    }
    return null;
  }
}
