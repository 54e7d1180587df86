package io.scanner.api.stage;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A named processing step of a pipeline.
 *
 * <p>Stages are compared by identity: two stages with the same name and inputs are still two
 * distinct steps of the pipeline. The sentinel names {@link #INPUT_TABLE} and {@link
 * #OUTPUT_TABLE} mark the start and the end of a pipeline.
 */
public class Stage implements Serializable {

  public static final String INPUT_TABLE = "InputTable";
  public static final String OUTPUT_TABLE = "OutputTable";

  /** Columns produced by the input sentinel. */
  public static final List<String> FRAME_COLUMNS = ImmutableList.of("frame", "frame_info");

  private final String name;
  private final List<StageInput> inputs;
  private DeviceType deviceType = DeviceType.CPU;
  private byte[] args = new byte[0];
  private int batch = 1;
  private int warmup = 0;
  private List<Integer> stencil = Collections.singletonList(0);

  public Stage(String name) {
    Preconditions.checkArgument(name != null && !name.isEmpty(), "Stage name is empty.");
    this.name = name;
    this.inputs = new ArrayList<>();
  }

  public static Stage of(String name) {
    return new Stage(name);
  }

  /** Creates the input sentinel stage. */
  public static Stage input() {
    return new Stage(INPUT_TABLE);
  }

  /** Creates the output sentinel stage reading the given inputs. */
  public static Stage output(StageInput... inputs) {
    return new Stage(OUTPUT_TABLE).withInputs(inputs);
  }

  public String getName() {
    return name;
  }

  public boolean isInput() {
    return INPUT_TABLE.equals(name);
  }

  public boolean isOutput() {
    return OUTPUT_TABLE.equals(name);
  }

  public List<StageInput> getInputs() {
    return Collections.unmodifiableList(inputs);
  }

  public Stage withInputs(StageInput... inputs) {
    return withInputs(Arrays.asList(inputs));
  }

  public Stage withInputs(List<StageInput> inputs) {
    this.inputs.clear();
    this.inputs.addAll(inputs);
    return this;
  }

  /** Reads the given columns of {@code parent}. */
  public Stage withInput(Stage parent, String... columns) {
    this.inputs.add(new StageInput(parent, Arrays.asList(columns)));
    return this;
  }

  public DeviceType getDeviceType() {
    return deviceType;
  }

  public Stage withDeviceType(DeviceType deviceType) {
    this.deviceType = Preconditions.checkNotNull(deviceType);
    return this;
  }

  public byte[] getArgs() {
    return args;
  }

  /** Opaque kernel arguments, usually a serialized protobuf message. */
  public Stage withArgs(byte[] args) {
    this.args = Preconditions.checkNotNull(args);
    return this;
  }

  public int getBatch() {
    return batch;
  }

  public Stage withBatch(int batch) {
    Preconditions.checkArgument(batch > 0, "Batch size must be positive, got %s.", batch);
    this.batch = batch;
    return this;
  }

  public int getWarmup() {
    return warmup;
  }

  public Stage withWarmup(int warmup) {
    Preconditions.checkArgument(warmup >= 0, "Warmup must not be negative, got %s.", warmup);
    this.warmup = warmup;
    return this;
  }

  public List<Integer> getStencil() {
    return stencil;
  }

  public Stage withStencil(List<Integer> stencil) {
    Preconditions.checkArgument(!stencil.isEmpty(), "Stencil must not be empty.");
    this.stencil = ImmutableList.copyOf(stencil);
    return this;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("inputs", inputs.size())
        .add("deviceType", deviceType)
        .toString();
  }
}
