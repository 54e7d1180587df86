package io.scanner.jobgraph;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.scanner.api.stage.DeviceType;
import java.io.Serializable;
import java.util.List;

/**
 * A stage as sent to the cluster. Parents are referenced by their position in the compiled
 * order, and every parent position is lower than the position of the stage itself.
 */
public class CompiledStage implements Serializable {

  private final String name;
  private final List<CompiledInput> inputs;
  private final DeviceType deviceType;
  private final byte[] args;
  private final int batch;
  private final int warmup;
  private final List<Integer> stencil;

  public CompiledStage(
      String name,
      List<CompiledInput> inputs,
      DeviceType deviceType,
      byte[] args,
      int batch,
      int warmup,
      List<Integer> stencil) {
    this.name = name;
    this.inputs = ImmutableList.copyOf(inputs);
    this.deviceType = deviceType;
    this.args = args;
    this.batch = batch;
    this.warmup = warmup;
    this.stencil = ImmutableList.copyOf(stencil);
  }

  public String getName() {
    return name;
  }

  public List<CompiledInput> getInputs() {
    return inputs;
  }

  public DeviceType getDeviceType() {
    return deviceType;
  }

  public byte[] getArgs() {
    return args;
  }

  public int getBatch() {
    return batch;
  }

  public int getWarmup() {
    return warmup;
  }

  public List<Integer> getStencil() {
    return stencil;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("inputs", inputs)
        .add("deviceType", deviceType)
        .toString();
  }
}
