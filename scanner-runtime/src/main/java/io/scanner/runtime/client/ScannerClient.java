package io.scanner.runtime.client;

import com.google.common.base.Preconditions;
import com.google.protobuf.Message;
import io.scanner.api.cluster.ClusterConnector;
import io.scanner.api.cluster.ClusterLauncher;
import io.scanner.api.exception.AlreadyExistsException;
import io.scanner.api.runtime.ComputeRuntime;
import io.scanner.api.stage.Stage;
import io.scanner.api.storage.DescriptorStore;
import io.scanner.api.task.Task;
import io.scanner.jobgraph.GraphCompiler;
import io.scanner.runtime.config.RunOptions;
import io.scanner.runtime.config.ScannerConfig;
import io.scanner.runtime.metadata.MetadataStore;
import io.scanner.runtime.serialization.ProtobufRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.aeonbits.owner.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point to a scanner database and the cluster that runs jobs on it.
 *
 * <p>Close the client when done with it: a temporary master and worker started by {@link #run}
 * keep running until then.
 *
 * <pre>{@code
 * try (ScannerClient client = new ScannerClient(conf, store, runtime, connector, launcher)) {
 *   Collection videos = client.collection("videos");
 *   RunResult result = client.run(videos, Arrays.asList(Stage.of("Histogram")),
 *       RunOptions.builder().outputCollection("histograms").build());
 * }
 * }</pre>
 */
public class ScannerClient implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(ScannerClient.class);

  private final ScannerConfig config;
  private final ComputeRuntime runtime;
  private final MetadataStore metadataStore;
  private final Sampler sampler;
  private final ProtobufRegistry protobufs;
  private final JobSubmitter jobSubmitter;

  public ScannerClient(
      Map<String, String> conf,
      DescriptorStore store,
      ComputeRuntime runtime,
      ClusterConnector connector,
      ClusterLauncher launcher) {
    this.config = ConfigFactory.create(ScannerConfig.class, conf);
    this.runtime = Preconditions.checkNotNull(runtime);
    this.metadataStore = new MetadataStore(store);
    this.metadataStore.initialize();
    this.sampler = new Sampler();
    this.protobufs = new ProtobufRegistry();
    this.jobSubmitter =
        new JobSubmitter(
            config, metadataStore, new GraphCompiler(runtime), sampler, connector, launcher);
    LOG.info("Scanner client created with master address {}.", config.masterAddress());
  }

  public ScannerConfig getConfig() {
    return config;
  }

  public Sampler sampler() {
    return sampler;
  }

  /** Protobuf types of descriptors and kernel arguments, by name. */
  public ProtobufRegistry protobufs() {
    return protobufs;
  }

  /**
   * Loads a library of custom stages into the runtime and registers the protobuf types of their
   * arguments, so that they can be looked up in {@link #protobufs()} by name.
   *
   * @param path Path of the shared library.
   * @param argTypes Default instances of the argument messages of the library's stages.
   */
  public void loadStageLibrary(String path, Message... argTypes) {
    Preconditions.checkArgument(path != null && !path.isEmpty(), "Stage library path is empty.");
    runtime.loadStageLibrary(path);
    for (Message argType : argTypes) {
      protobufs.register(argType);
    }
    LOG.info("Loaded stage library {} with {} argument types.", path, argTypes.length);
  }

  // Jobs

  public RunResult run(List<Task> tasks, Stage terminal, RunOptions options) {
    return jobSubmitter.run(tasks, Collections.singletonList(terminal), options);
  }

  public RunResult run(List<Task> tasks, List<Stage> chain, RunOptions options) {
    return jobSubmitter.run(tasks, chain, options);
  }

  public RunResult run(Collection input, Stage terminal, RunOptions options) {
    return jobSubmitter.run(input, Collections.singletonList(terminal), options);
  }

  public RunResult run(Collection input, List<Stage> chain, RunOptions options) {
    return jobSubmitter.run(input, chain, options);
  }

  /**
   * Looks a job up by id or by name.
   *
   * @param identifier An {@link Integer} id or a {@link String} name.
   */
  public Job job(Object identifier) {
    return new Job(metadataStore.loadJob(identifier));
  }

  // Collections

  public boolean hasCollection(String name) {
    return metadataStore.hasCollection(name);
  }

  public Collection collection(String name) {
    return new Collection(metadataStore, name, metadataStore.loadCollection(name));
  }

  public Collection newCollection(String name, List<String> tableNames) {
    return newCollection(name, tableNames, false);
  }

  /**
   * Creates a collection of existing tables.
   *
   * @param force Replace a collection with the same name instead of failing.
   */
  public Collection newCollection(String name, List<String> tableNames, boolean force) {
    if (metadataStore.hasCollection(name)) {
      if (!force) {
        throw new AlreadyExistsException("Collection with name " + name + " already exists");
      }
      metadataStore.deleteCollection(name);
    }
    metadataStore.newCollection(name, tableNames, -1);
    return collection(name);
  }

  public void deleteCollection(String name) {
    metadataStore.deleteCollection(name);
  }

  // Tables

  public boolean hasTable(String name) {
    return metadataStore.hasTable(name);
  }

  /**
   * Looks a table up by id or by name.
   *
   * @param identifier An {@link Integer} id or a {@link String} name.
   */
  public Table table(Object identifier) {
    return new Table(metadataStore, metadataStore.loadTable(identifier));
  }

  public void deleteTable(String name) {
    metadataStore.deleteTable(name);
  }

  /**
   * Ingests videos into new tables, one per entry of {@code videos}.
   *
   * @param videos Video paths by table name, in ingestion order.
   * @return The table of the last entry.
   */
  public Table ingestVideos(Map<String, String> videos, boolean force) {
    Preconditions.checkArgument(!videos.isEmpty(), "No videos to ingest.");
    List<String> tableNames = new ArrayList<>(videos.keySet());
    List<String> paths = new ArrayList<>(videos.values());
    ensureWritable(tableNames, force);
    runtime.ingestVideos(tableNames, paths);
    metadataStore.invalidate();
    // TODO: return all ingested tables once callers no longer rely on the last one.
    return table(tableNames.get(tableNames.size() - 1));
  }

  /**
   * Ingests videos into the tables {@code <name>:000}, {@code <name>:001}, ... and groups them
   * into a new collection.
   */
  public Collection ingestVideoCollection(String name, List<String> paths, boolean force) {
    List<String> tableNames = new ArrayList<>(paths.size());
    for (int i = 0; i < paths.size(); i++) {
      tableNames.add(String.format("%s:%03d", name, i));
    }
    Collection collection = newCollection(name, tableNames, force);
    ensureWritable(tableNames, force);
    runtime.ingestVideos(tableNames, paths);
    metadataStore.invalidate();
    return collection;
  }

  private void ensureWritable(List<String> tableNames, boolean force) {
    for (String tableName : tableNames) {
      if (!metadataStore.hasTable(tableName)) {
        continue;
      }
      if (!force) {
        throw new AlreadyExistsException(
            "Attempted to ingest over existing table " + tableName);
      }
      metadataStore.deleteTable(tableName);
    }
  }

  /** Whether {@link #run} started a temporary master and worker that are still running. */
  public boolean hasLocalCluster() {
    return jobSubmitter.hasLocalCluster();
  }

  /** Stops the temporary master and worker, if {@link #run} started them. */
  @Override
  public void close() {
    jobSubmitter.close();
    LOG.info("Scanner client closed.");
  }
}
