package io.scanner.runtime.client;

import com.google.common.base.MoreObjects;
import io.scanner.api.task.Task;
import io.scanner.runtime.generated.Metadata;
import io.scanner.runtime.serialization.JobPbBuilder;
import java.util.List;
import java.util.stream.Collectors;

/** A job recorded in the database. */
public class Job {

  private final Metadata.JobDescriptor descriptor;

  Job(Metadata.JobDescriptor descriptor) {
    this.descriptor = descriptor;
  }

  public int getId() {
    return descriptor.getId();
  }

  public String getName() {
    return descriptor.getName();
  }

  public int getIoItemSize() {
    return descriptor.getIoItemSize();
  }

  public int getWorkItemSize() {
    return descriptor.getWorkItemSize();
  }

  public List<Task> getTasks() {
    JobPbBuilder pbBuilder = new JobPbBuilder();
    return descriptor.getTasksList().stream()
        .map(pbBuilder::parseTask)
        .collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", getId())
        .add("name", getName())
        .toString();
  }
}
