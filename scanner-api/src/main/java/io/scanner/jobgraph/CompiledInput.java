package io.scanner.jobgraph;

import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.List;

/** Input of a compiled stage: a position in the compiled order and the columns read from it. */
public class CompiledInput implements Serializable {

  private final int stageIndex;
  private final List<String> columns;

  public CompiledInput(int stageIndex, List<String> columns) {
    this.stageIndex = stageIndex;
    this.columns = ImmutableList.copyOf(columns);
  }

  public int getStageIndex() {
    return stageIndex;
  }

  public List<String> getColumns() {
    return columns;
  }

  @Override
  public String toString() {
    return "Input(" + stageIndex + ":" + columns + ")";
  }
}
