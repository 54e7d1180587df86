package io.scanner.runtime.client;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Output of a job: its tables, grouped into a collection if one was requested. */
public class RunResult {

  private final List<Table> tables;
  private final Collection collection;

  private RunResult(List<Table> tables, Collection collection) {
    this.tables = ImmutableList.copyOf(tables);
    this.collection = collection;
  }

  static RunResult ofTables(List<Table> tables) {
    return new RunResult(tables, null);
  }

  static RunResult ofCollection(List<Table> tables, Collection collection) {
    return new RunResult(tables, Preconditions.checkNotNull(collection));
  }

  public boolean isCollection() {
    return collection != null;
  }

  public List<Table> getTables() {
    return tables;
  }

  /** @throws IllegalStateException if the job did not write into a collection. */
  public Collection getCollection() {
    Preconditions.checkState(collection != null, "Job output is not a collection.");
    return collection;
  }
}
