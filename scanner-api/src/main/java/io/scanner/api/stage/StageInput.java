package io.scanner.api.stage;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.List;

/** A reference from a stage to one of its parents, and the parent columns it consumes. */
public class StageInput implements Serializable {

  private final Stage parent;
  private final List<String> columns;

  public StageInput(Stage parent, List<String> columns) {
    this.parent = Preconditions.checkNotNull(parent, "Input stage must not be null.");
    this.columns = ImmutableList.copyOf(columns);
  }

  public Stage getParent() {
    return parent;
  }

  public List<String> getColumns() {
    return columns;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("parent", parent.getName())
        .add("columns", columns)
        .toString();
  }
}
