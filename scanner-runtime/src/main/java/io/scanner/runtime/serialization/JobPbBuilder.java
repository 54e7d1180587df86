package io.scanner.runtime.serialization;

import com.google.protobuf.ByteString;
import io.scanner.api.cluster.JobRequest;
import io.scanner.api.stage.DeviceType;
import io.scanner.api.task.TableSample;
import io.scanner.api.task.Task;
import io.scanner.jobgraph.CompiledInput;
import io.scanner.jobgraph.CompiledStage;
import io.scanner.runtime.generated.Metadata;
import io.scanner.runtime.generated.Rpc;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts job requests and their parts to and from their protobuf wire form.
 *
 * <p>{@link #buildJobParameters} gives the message a {@link io.scanner.api.cluster.ClusterRpc}
 * transport sends to the master for {@code submitJob}. Task conversion is also used for the tasks
 * recorded in job descriptors.
 */
public class JobPbBuilder {

  public Rpc.JobParameters buildJobParameters(JobRequest request) {
    Rpc.TaskSet.Builder taskSet = Rpc.TaskSet.newBuilder();
    taskSet.addAllTasks(buildTasks(request.getTasks()));
    taskSet.addAllOps(
        request.getStages().stream().map(this::buildOp).collect(Collectors.toList()));
    return Rpc.JobParameters.newBuilder()
        .setJobName(request.getJobName())
        .setTaskSet(taskSet)
        .setKernelInstancesPerNode(request.getKernelInstancesPerNode())
        .setIoItemSize(request.getIoItemSize())
        .setWorkItemSize(request.getWorkItemSize())
        .build();
  }

  public List<Metadata.Task> buildTasks(List<Task> tasks) {
    return tasks.stream().map(this::buildTask).collect(Collectors.toList());
  }

  public Metadata.Task buildTask(Task task) {
    Metadata.Task.Builder builder =
        Metadata.Task.newBuilder().setOutputTableName(task.getOutputTableName());
    for (TableSample sample : task.getSamples()) {
      builder.addSamples(
          Metadata.TableSample.newBuilder()
              .setTableName(sample.getTableName())
              .addAllColumnNames(sample.getColumnNames())
              .setSamplingFunction(sample.getSamplingFunction())
              .setSamplingArgs(ByteString.copyFrom(sample.getSamplingArgs())));
    }
    return builder.build();
  }

  public Task parseTask(Metadata.Task taskPb) {
    List<TableSample> samples =
        taskPb.getSamplesList().stream()
            .map(
                samplePb ->
                    new TableSample(
                        samplePb.getTableName(),
                        samplePb.getColumnNamesList(),
                        samplePb.getSamplingFunction(),
                        samplePb.getSamplingArgs().toByteArray()))
            .collect(Collectors.toList());
    return new Task(taskPb.getOutputTableName(), samples);
  }

  public Metadata.Op buildOp(CompiledStage stage) {
    Metadata.Op.Builder builder =
        Metadata.Op.newBuilder()
            .setName(stage.getName())
            .setDeviceType(
                stage.getDeviceType() == DeviceType.GPU
                    ? Metadata.DeviceType.GPU
                    : Metadata.DeviceType.CPU)
            .setKernelArgs(ByteString.copyFrom(stage.getArgs()))
            .addAllStencil(stage.getStencil())
            .setBatch(stage.getBatch())
            .setWarmup(stage.getWarmup());
    for (CompiledInput input : stage.getInputs()) {
      builder.addInputs(
          Metadata.OpInput.newBuilder()
              .setOpIndex(input.getStageIndex())
              .addAllColumns(input.getColumns()));
    }
    return builder.build();
  }
}
