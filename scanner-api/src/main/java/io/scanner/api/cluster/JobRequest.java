package io.scanner.api.cluster;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.scanner.api.task.Task;
import io.scanner.jobgraph.CompiledStage;
import java.io.Serializable;
import java.util.List;

/** Everything the master needs to run a job. */
public class JobRequest implements Serializable {

  private final String jobName;
  private final List<Task> tasks;
  private final List<CompiledStage> stages;
  private final int kernelInstancesPerNode;
  private final int ioItemSize;
  private final int workItemSize;

  public JobRequest(
      String jobName,
      List<Task> tasks,
      List<CompiledStage> stages,
      int kernelInstancesPerNode,
      int ioItemSize,
      int workItemSize) {
    this.jobName = jobName;
    this.tasks = ImmutableList.copyOf(tasks);
    this.stages = ImmutableList.copyOf(stages);
    this.kernelInstancesPerNode = kernelInstancesPerNode;
    this.ioItemSize = ioItemSize;
    this.workItemSize = workItemSize;
  }

  public String getJobName() {
    return jobName;
  }

  public List<Task> getTasks() {
    return tasks;
  }

  public List<CompiledStage> getStages() {
    return stages;
  }

  public int getKernelInstancesPerNode() {
    return kernelInstancesPerNode;
  }

  public int getIoItemSize() {
    return ioItemSize;
  }

  public int getWorkItemSize() {
    return workItemSize;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("jobName", jobName)
        .add("tasks", tasks.size())
        .add("stages", stages.size())
        .add("kernelInstancesPerNode", kernelInstancesPerNode)
        .add("ioItemSize", ioItemSize)
        .add("workItemSize", workItemSize)
        .toString();
  }
}
