package io.scanner.api.task;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.List;

/** One unit of work of a job: the input samples and the table the results are written to. */
public class Task implements Serializable {

  private String outputTableName;
  private final List<TableSample> samples;

  public Task(String outputTableName, List<TableSample> samples) {
    Preconditions.checkArgument(
        outputTableName != null && !outputTableName.isEmpty(), "Output table name is empty.");
    this.outputTableName = outputTableName;
    this.samples = ImmutableList.copyOf(samples);
  }

  public String getOutputTableName() {
    return outputTableName;
  }

  public void setOutputTableName(String outputTableName) {
    this.outputTableName = outputTableName;
  }

  public List<TableSample> getSamples() {
    return samples;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("outputTableName", outputTableName)
        .add("samples", samples)
        .toString();
  }
}
