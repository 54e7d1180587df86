package io.scanner.runtime.client;

import com.google.common.base.Preconditions;
import io.scanner.api.stage.Stage;
import io.scanner.api.task.TableSample;
import io.scanner.api.task.Task;
import io.scanner.runtime.generated.Metadata;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/** Builds tasks that read rows of existing tables. */
public class Sampler {

  public static final String ALL = "All";
  public static final String STRIDED_RANGE = "StridedRange";
  public static final String GATHER = "Gather";

  public static final int DEFAULT_ITEM_SIZE = 1000;

  /** Output table name suffix of tasks created by {@link #all(Collection)}. */
  public static final String ALL_SUFFIX = "_all";

  /** One task per member table, reading all of its frames into {@code <table>_all}. */
  public List<Task> all(Collection collection) {
    return all(collection, DEFAULT_ITEM_SIZE, 0);
  }

  public List<Task> all(Collection collection, long itemSize, long warmupSize) {
    byte[] args =
        Metadata.AllSamplerArgs.newBuilder()
            .setSampleSize(itemSize)
            .setWarmupSize(warmupSize)
            .build()
            .toByteArray();
    return collection.getTableNames().stream()
        .map(tableName -> task(tableName, tableName + ALL_SUFFIX, ALL, args))
        .collect(Collectors.toList());
  }

  /** Every {@code stride}-th row of the table. */
  public Task strided(Table table, long stride, String outputTableName) {
    return range(table, 0, table.getNumRows(), stride, outputTableName);
  }

  /** Every {@code stride}-th row of {@code [start, end)}. */
  public Task range(Table table, long start, long end, long stride, String outputTableName) {
    Preconditions.checkArgument(stride > 0, "Stride must be positive, got %s.", stride);
    Preconditions.checkArgument(start <= end, "Range [%s, %s) is empty.", start, end);
    byte[] args =
        Metadata.StridedRangeSamplerArgs.newBuilder()
            .setStride(stride)
            .addWarmupStarts(start)
            .addStarts(start)
            .addEnds(end)
            .build()
            .toByteArray();
    return task(table.getName(), outputTableName, STRIDED_RANGE, args);
  }

  /** The given rows of the table. */
  public Task gather(Table table, List<Long> rows, String outputTableName) {
    byte[] args =
        Metadata.GatherSamplerArgs.newBuilder()
            .addSamples(Metadata.GatherSamplerArgs.Sample.newBuilder().addAllRows(rows))
            .build()
            .toByteArray();
    return task(table.getName(), outputTableName, GATHER, args);
  }

  private static Task task(
      String tableName, String outputTableName, String samplingFunction, byte[] args) {
    TableSample sample = new TableSample(tableName, Stage.FRAME_COLUMNS, samplingFunction, args);
    return new Task(outputTableName, Collections.singletonList(sample));
  }
}
