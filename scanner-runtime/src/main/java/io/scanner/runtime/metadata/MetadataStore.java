package io.scanner.runtime.metadata;

import com.google.common.base.Preconditions;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.Parser;
import io.scanner.api.exception.AlreadyExistsException;
import io.scanner.api.exception.InternalErrorException;
import io.scanner.api.exception.InvalidIdentifierException;
import io.scanner.api.exception.NotFoundException;
import io.scanner.api.storage.DescriptorStore;
import io.scanner.runtime.generated.Metadata;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-through cache of the database catalog and the collections index.
 *
 * <p>The cache is local to this process and assumes this process is the only writer. Every
 * operation that changes the catalog or the index drops the cached copies, and so must callers
 * after changing the database in any other way, e.g. after a job ran or videos were ingested.
 */
public class MetadataStore {

  private static final Logger LOG = LoggerFactory.getLogger(MetadataStore.class);

  private final DescriptorStore store;
  private Metadata.DatabaseDescriptor cachedCatalog;
  private Metadata.CollectionsDescriptor cachedCollections;

  public MetadataStore(DescriptorStore store) {
    this.store = Preconditions.checkNotNull(store);
  }

  /** Creates an empty catalog and collections index where the database has none. */
  public void initialize() {
    if (!store.exists(DescriptorPaths.DB_METADATA)) {
      LOG.info("No database found, creating an empty one.");
      save(DescriptorPaths.DB_METADATA, Metadata.DatabaseDescriptor.getDefaultInstance());
    }
    if (!store.exists(DescriptorPaths.COLLECTIONS)) {
      save(DescriptorPaths.COLLECTIONS, Metadata.CollectionsDescriptor.getDefaultInstance());
    }
    invalidate();
  }

  public Metadata.DatabaseDescriptor loadCatalog() {
    if (cachedCatalog == null) {
      cachedCatalog = load(Metadata.DatabaseDescriptor.parser(), DescriptorPaths.DB_METADATA);
    }
    return cachedCatalog;
  }

  public void saveCatalog(Metadata.DatabaseDescriptor catalog) {
    save(DescriptorPaths.DB_METADATA, catalog);
    invalidate();
  }

  /** Drops the cached catalog and index, the next access reads them from the store again. */
  public void invalidate() {
    cachedCatalog = null;
    cachedCollections = null;
  }

  // Collections

  public Metadata.CollectionsDescriptor loadCollections() {
    if (cachedCollections == null) {
      cachedCollections =
          load(Metadata.CollectionsDescriptor.parser(), DescriptorPaths.COLLECTIONS);
    }
    return cachedCollections;
  }

  public boolean hasCollection(String name) {
    return loadCollections().getNamesList().contains(name);
  }

  public long resolveCollectionId(String name) {
    Metadata.CollectionsDescriptor collections = loadCollections();
    int index = collections.getNamesList().indexOf(name);
    if (index < 0) {
      throw new NotFoundException("Collection with name " + name + " does not exist");
    }
    return collections.getIds(index);
  }

  public Metadata.CollectionDescriptor loadCollection(String name) {
    long id = resolveCollectionId(name);
    return load(Metadata.CollectionDescriptor.parser(), DescriptorPaths.collection(id));
  }

  /**
   * Appends a collection to the index and writes its descriptor.
   *
   * @param jobId Id of the job that produced the tables, or -1.
   * @return The id of the new collection.
   */
  public long newCollection(String name, List<String> tableNames, int jobId) {
    if (hasCollection(name)) {
      throw new AlreadyExistsException("Collection with name " + name + " already exists");
    }
    Metadata.CollectionsDescriptor collections = loadCollections();
    long id = nextCollectionId(collections);
    Metadata.CollectionsDescriptor updated =
        collections.toBuilder().addIds(id).addNames(name).setNextId(id + 1).build();
    save(DescriptorPaths.COLLECTIONS, updated);
    Metadata.CollectionDescriptor collection =
        Metadata.CollectionDescriptor.newBuilder()
            .addAllTables(tableNames)
            .setJobId(jobId)
            .build();
    save(DescriptorPaths.collection(id), collection);
    invalidate();
    LOG.info("Created collection {} with id {} and {} tables.", name, id, tableNames.size());
    return id;
  }

  public void deleteCollection(String name) {
    Metadata.CollectionsDescriptor collections = loadCollections();
    int index = collections.getNamesList().indexOf(name);
    if (index < 0) {
      throw new NotFoundException("Collection with name " + name + " does not exist");
    }
    long id = collections.getIds(index);
    Metadata.CollectionsDescriptor.Builder updated =
        Metadata.CollectionsDescriptor.newBuilder().setNextId(nextCollectionId(collections));
    for (int i = 0; i < collections.getIdsCount(); i++) {
      if (i != index) {
        updated.addIds(collections.getIds(i)).addNames(collections.getNames(i));
      }
    }
    save(DescriptorPaths.COLLECTIONS, updated.build());
    store.delete(DescriptorPaths.collection(id));
    invalidate();
    LOG.info("Deleted collection {} with id {}.", name, id);
  }

  private static long nextCollectionId(Metadata.CollectionsDescriptor collections) {
    long next = collections.getNextId();
    for (long id : collections.getIdsList()) {
      next = Math.max(next, id + 1);
    }
    return next;
  }

  // Tables

  public boolean hasTable(String name) {
    return loadCatalog().getTablesList().stream().anyMatch(t -> t.getName().equals(name));
  }

  /**
   * @throws NotFoundException if no table has this name.
   * @throws InternalErrorException if more than one table has this name.
   */
  public int resolveTableId(String name) {
    Integer tableId = null;
    for (Metadata.DatabaseDescriptor.Table table : loadCatalog().getTablesList()) {
      if (!table.getName().equals(name)) {
        continue;
      }
      if (tableId == null) {
        tableId = table.getId();
      } else if (tableId != table.getId()) {
        throw new InternalErrorException("Internal error: multiple tables with same name " + name);
      }
    }
    if (tableId == null) {
      throw new NotFoundException("Table with name " + name + " not found");
    }
    return tableId;
  }

  public Metadata.TableDescriptor loadTable(int id) {
    boolean known = loadCatalog().getTablesList().stream().anyMatch(t -> t.getId() == id);
    if (!known) {
      throw new NotFoundException("Table with id " + id + " not found");
    }
    return load(Metadata.TableDescriptor.parser(), DescriptorPaths.table(id));
  }

  public Metadata.TableDescriptor loadTable(String name) {
    return loadTable(resolveTableId(name));
  }

  /**
   * Loads a table by id or by name.
   *
   * @param identifier An {@link Integer} id or a {@link String} name.
   * @throws InvalidIdentifierException for any other identifier.
   */
  public Metadata.TableDescriptor loadTable(Object identifier) {
    if (identifier instanceof Integer) {
      return loadTable(((Integer) identifier).intValue());
    } else if (identifier instanceof String) {
      return loadTable((String) identifier);
    }
    throw new InvalidIdentifierException("Invalid table identifier " + identifier);
  }

  /** Removes the table from the catalog. The table's data is left in the store. */
  public void deleteTable(String name) {
    int id = resolveTableId(name);
    Metadata.DatabaseDescriptor catalog = loadCatalog();
    Metadata.DatabaseDescriptor.Builder updated = catalog.toBuilder().clearTables();
    for (Metadata.DatabaseDescriptor.Table table : catalog.getTablesList()) {
      if (table.getId() != id) {
        updated.addTables(table);
      }
    }
    saveCatalog(updated.build());
    LOG.info("Deleted table {} with id {}.", name, id);
  }

  // Jobs

  /**
   * Returns the id of the first job with this name. Job names are not unique, a name used by
   * several jobs resolves to the one listed first in the catalog.
   */
  public Optional<Integer> findJobId(String name) {
    return loadCatalog().getJobsList().stream()
        .filter(job -> job.getName().equals(name))
        .map(Metadata.DatabaseDescriptor.Job::getId)
        .findFirst();
  }

  public Metadata.JobDescriptor loadJob(int id) {
    boolean known = loadCatalog().getJobsList().stream().anyMatch(j -> j.getId() == id);
    if (!known) {
      throw new NotFoundException("Job with id " + id + " does not exist");
    }
    return load(Metadata.JobDescriptor.parser(), DescriptorPaths.job(id));
  }

  public Metadata.JobDescriptor loadJob(String name) {
    int id =
        findJobId(name)
            .orElseThrow(() -> new NotFoundException("Job name " + name + " does not exist"));
    return loadJob(id);
  }

  /**
   * Loads a job by id or by name.
   *
   * @param identifier An {@link Integer} id or a {@link String} name.
   * @throws InvalidIdentifierException for any other identifier.
   */
  public Metadata.JobDescriptor loadJob(Object identifier) {
    if (identifier instanceof Integer) {
      return loadJob(((Integer) identifier).intValue());
    } else if (identifier instanceof String) {
      return loadJob((String) identifier);
    }
    throw new InvalidIdentifierException("Invalid job identifier " + identifier);
  }

  private <T extends Message> T load(Parser<T> parser, String path) {
    byte[] bytes = store.read(path);
    try {
      return parser.parseFrom(bytes);
    } catch (InvalidProtocolBufferException e) {
      throw new InternalErrorException("Corrupted descriptor at " + path, e);
    }
  }

  private void save(String path, Message descriptor) {
    store.write(path, descriptor.toByteArray());
  }
}
