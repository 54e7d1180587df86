package io.scanner.jobgraph;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.scanner.api.stage.DeviceType;
import io.scanner.api.stage.Stage;
import java.util.ArrayList;
import java.util.List;

/** A stage copied into a {@link PipelineGraph}, addressed by its handle. */
public class StageNode {

  private final int handle;
  private final String name;
  private final List<Input> inputs = new ArrayList<>();
  private final DeviceType deviceType;
  private final byte[] args;
  private final int batch;
  private final int warmup;
  private final List<Integer> stencil;

  StageNode(int handle, Stage stage) {
    this(handle, stage.getName(), stage.getDeviceType(), stage.getArgs(), stage.getBatch(),
        stage.getWarmup(), stage.getStencil());
  }

  StageNode(
      int handle,
      String name,
      DeviceType deviceType,
      byte[] args,
      int batch,
      int warmup,
      List<Integer> stencil) {
    this.handle = handle;
    this.name = name;
    this.deviceType = deviceType;
    this.args = args;
    this.batch = batch;
    this.warmup = warmup;
    this.stencil = stencil;
  }

  public int getHandle() {
    return handle;
  }

  public String getName() {
    return name;
  }

  public boolean isInput() {
    return Stage.INPUT_TABLE.equals(name);
  }

  public boolean isOutput() {
    return Stage.OUTPUT_TABLE.equals(name);
  }

  public List<Input> getInputs() {
    return inputs;
  }

  void addInput(int parent, List<String> columns) {
    inputs.add(new Input(parent, columns));
  }

  CompiledStage toCompiledStage(List<CompiledInput> compiledInputs) {
    return new CompiledStage(name, compiledInputs, deviceType, args, batch, warmup, stencil);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("handle", handle)
        .add("name", name)
        .add("inputs", inputs)
        .toString();
  }

  /** Edge from a parent handle, with the parent columns it carries. */
  public static class Input {

    private final int parent;
    private final List<String> columns;

    Input(int parent, List<String> columns) {
      this.parent = parent;
      this.columns = ImmutableList.copyOf(columns);
    }

    public int getParent() {
      return parent;
    }

    public List<String> getColumns() {
      return columns;
    }

    @Override
    public String toString() {
      return parent + ":" + columns;
    }
  }
}
