package org.marcdb.ingest_service.tabular;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Where a tabular batch comes from: a file on disk or a table already parsed by the caller.
 * Exactly one of {@link #path()} and {@link #table()} is set.
 */
public record BatchSource(Path path, Table table) {

  public BatchSource {
    if ((path == null) == (table == null)) {
      throw new IllegalArgumentException("A batch source needs either a path or a table");
    }
  }

  public static BatchSource of(Path path) {
    return new BatchSource(Objects.requireNonNull(path, "path"), null);
  }

  public static BatchSource of(Table table) {
    return new BatchSource(null, Objects.requireNonNull(table, "table"));
  }

  public boolean isFile() {
    return path != null;
  }

  /** Short label for log lines and error messages. */
  public String describe() {
    return isFile() ? path.toString() : "in-memory table (" + table.size() + " rows)";
  }
}
