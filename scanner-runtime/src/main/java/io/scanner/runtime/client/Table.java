package io.scanner.runtime.client;

import com.google.common.base.MoreObjects;
import io.scanner.api.exception.InternalErrorException;
import io.scanner.api.task.Task;
import io.scanner.runtime.generated.Metadata;
import io.scanner.runtime.metadata.MetadataStore;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A table of the database. Only the id and the name are known up front, the descriptor is read
 * on first use.
 */
public class Table {

  private final MetadataStore metadataStore;
  private final int id;
  private final String name;
  private Metadata.TableDescriptor descriptor;

  Table(MetadataStore metadataStore, int id, String name) {
    this.metadataStore = metadataStore;
    this.id = id;
    this.name = name;
  }

  Table(MetadataStore metadataStore, Metadata.TableDescriptor descriptor) {
    this(metadataStore, descriptor.getId(), descriptor.getName());
    this.descriptor = descriptor;
  }

  public int getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  private Metadata.TableDescriptor descriptor() {
    if (descriptor == null) {
      descriptor = metadataStore.loadTable(id);
    }
    return descriptor;
  }

  public List<String> getColumnNames() {
    return descriptor().getColumnsList().stream()
        .map(Metadata.Column::getName)
        .collect(Collectors.toList());
  }

  public long getNumRows() {
    List<Long> endRows = descriptor().getEndRowsList();
    return endRows.isEmpty() ? 0 : endRows.get(endRows.size() - 1);
  }

  /** Id of the job that produced this table, -1 for ingested tables. */
  public int getJobId() {
    return descriptor().getJobId();
  }

  /** Returns the producing job, or empty for ingested tables. */
  public Optional<Job> getJob() {
    if (getJobId() == -1) {
      return Optional.empty();
    }
    return Optional.of(new Job(metadataStore.loadJob(getJobId())));
  }

  /** Returns the task of the producing job that wrote this table. */
  public Optional<Task> getTask() {
    Optional<Job> job = getJob();
    if (!job.isPresent()) {
      return Optional.empty();
    }
    Optional<Task> task = job.get().getTasks().stream()
        .filter(t -> t.getOutputTableName().equals(name))
        .findFirst();
    if (!task.isPresent()) {
      throw new InternalErrorException(
          "Table " + name + " not found in job " + job.get().getId());
    }
    return task;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("name", name)
        .toString();
  }
}
