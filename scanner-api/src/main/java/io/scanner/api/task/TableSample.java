package io.scanner.api.task;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.List;

/** Rows of one input table read by a task, chosen by a named sampling function. */
public class TableSample implements Serializable {

  private final String tableName;
  private final List<String> columnNames;
  private final String samplingFunction;
  private final byte[] samplingArgs;

  public TableSample(
      String tableName, List<String> columnNames, String samplingFunction, byte[] samplingArgs) {
    this.tableName = tableName;
    this.columnNames = ImmutableList.copyOf(columnNames);
    this.samplingFunction = samplingFunction;
    this.samplingArgs = samplingArgs;
  }

  public String getTableName() {
    return tableName;
  }

  public List<String> getColumnNames() {
    return columnNames;
  }

  public String getSamplingFunction() {
    return samplingFunction;
  }

  public byte[] getSamplingArgs() {
    return samplingArgs;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("tableName", tableName)
        .add("columnNames", columnNames)
        .add("samplingFunction", samplingFunction)
        .toString();
  }
}
