package io.scanner.runtime.client;

import com.google.common.base.MoreObjects;
import io.scanner.runtime.generated.Metadata;
import io.scanner.runtime.metadata.MetadataStore;
import java.util.List;
import java.util.stream.Collectors;

/** A named, ordered group of tables. */
public class Collection {

  private final MetadataStore metadataStore;
  private final String name;
  private final Metadata.CollectionDescriptor descriptor;

  Collection(MetadataStore metadataStore, String name, Metadata.CollectionDescriptor descriptor) {
    this.metadataStore = metadataStore;
    this.name = name;
    this.descriptor = descriptor;
  }

  public String getName() {
    return name;
  }

  public List<String> getTableNames() {
    return descriptor.getTablesList();
  }

  /** Id of the job that produced the tables, -1 for ingested collections. */
  public int getJobId() {
    return descriptor.getJobId();
  }

  public List<Table> getTables() {
    return getTableNames().stream()
        .map(tableName -> new Table(metadataStore, metadataStore.loadTable(tableName)))
        .collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("tables", getTableNames())
        .add("jobId", getJobId())
        .toString();
  }
}
