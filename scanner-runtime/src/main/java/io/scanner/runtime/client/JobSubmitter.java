package io.scanner.runtime.client;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import io.scanner.api.cluster.ClusterConnector;
import io.scanner.api.cluster.ClusterLauncher;
import io.scanner.api.cluster.ClusterRpc;
import io.scanner.api.cluster.JobRequest;
import io.scanner.api.cluster.RpcCallException;
import io.scanner.api.cluster.RpcStatus;
import io.scanner.api.exception.AlreadyExistsException;
import io.scanner.api.exception.InternalErrorException;
import io.scanner.api.exception.RemoteCallException;
import io.scanner.api.stage.Stage;
import io.scanner.api.task.Task;
import io.scanner.jobgraph.CompiledStage;
import io.scanner.jobgraph.GraphCompiler;
import io.scanner.runtime.cluster.LocalCluster;
import io.scanner.runtime.config.RunOptions;
import io.scanner.runtime.config.ScannerConfig;
import io.scanner.runtime.metadata.MetadataStore;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.commons.lang3.RandomStringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a pipeline into a job, submits it to the master and resolves the tables it produced.
 *
 * <p>If no master is reachable, a temporary master and worker are started on this node. They are
 * owned by the submitter and stop when it is closed.
 *
 * <p>Tables deleted because of {@link RunOptions#force()} stay deleted if the job then fails.
 */
public class JobSubmitter implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(JobSubmitter.class);

  private static final int JOB_NAME_LENGTH = 12;
  private static final String JOB_NAME_CHARS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";

  private final ScannerConfig config;
  private final MetadataStore metadataStore;
  private final GraphCompiler compiler;
  private final Sampler sampler;
  private final ClusterConnector connector;
  private final ClusterLauncher launcher;

  private LocalCluster localCluster;

  public JobSubmitter(
      ScannerConfig config,
      MetadataStore metadataStore,
      GraphCompiler compiler,
      Sampler sampler,
      ClusterConnector connector,
      ClusterLauncher launcher) {
    this.config = config;
    this.metadataStore = metadataStore;
    this.compiler = compiler;
    this.sampler = sampler;
    this.connector = connector;
    this.launcher = launcher;
  }

  /** Runs the pipeline over all frames of all tables of {@code input}. */
  public RunResult run(Collection input, List<Stage> pipeline, RunOptions options) {
    return run(sampler.all(input), pipeline, options);
  }

  /**
   * Runs the pipeline over the given tasks.
   *
   * <p>With an output collection, the output table names of {@code tasks} are rewritten in place
   * before the output tables are checked, so they stay rewritten if the run is then rejected.
   * Tables deleted because of {@link RunOptions#force()} are not restored either.
   *
   * @param tasks Tasks to run. Their output table names are rewritten if the options name an
   *     output collection.
   * @param pipeline Either a single terminal stage or a chain of stages.
   */
  public RunResult run(List<Task> tasks, List<Stage> pipeline, RunOptions options) {
    Preconditions.checkArgument(!tasks.isEmpty(), "Job has no tasks.");
    String outputCollection = options.outputCollection();
    boolean force = options.force();

    if (!Strings.isNullOrEmpty(outputCollection)) {
      if (metadataStore.hasCollection(outputCollection) && !force) {
        throw new AlreadyExistsException(
            "Collection with name " + outputCollection + " already exists");
      }
      for (Task task : tasks) {
        String tableName = task.getOutputTableName();
        String suffix = tableName.substring(tableName.lastIndexOf(':') + 1);
        task.setOutputTableName(outputCollection + ":" + suffix);
      }
    }

    for (Task task : tasks) {
      String tableName = task.getOutputTableName();
      if (metadataStore.hasTable(tableName)) {
        if (!force) {
          throw new AlreadyExistsException("Job would overwrite existing table " + tableName);
        }
        LOG.warn("Deleting existing table {} before running the job.", tableName);
        metadataStore.deleteTable(tableName);
      }
    }

    List<CompiledStage> stages = compiler.compile(pipeline);
    String jobName = options.jobName();
    if (Strings.isNullOrEmpty(jobName)) {
      jobName = RandomStringUtils.random(JOB_NAME_LENGTH, JOB_NAME_CHARS);
    }
    JobRequest request =
        new JobRequest(
            jobName,
            tasks,
            stages,
            config.kernelInstancesPerNode(),
            options.ioItemSize(),
            options.workItemSize());
    LOG.debug("Job stages\n{}", GraphCompiler.generateDigraph(jobName, stages));

    ClusterRpc master = connectToMaster();
    submit(master, request);

    metadataStore.invalidate();
    int jobId =
        metadataStore
            .findJobId(jobName)
            .orElseThrow(
                () -> new InternalErrorException("Internal error, job id not found after run"));

    List<String> tableNames =
        tasks.stream().map(Task::getOutputTableName).collect(Collectors.toList());
    List<Table> tables =
        tableNames.stream()
            .map(name -> new Table(metadataStore, metadataStore.loadTable(name)))
            .collect(Collectors.toList());
    if (Strings.isNullOrEmpty(outputCollection)) {
      return RunResult.ofTables(tables);
    }
    if (metadataStore.hasCollection(outputCollection)) {
      metadataStore.deleteCollection(outputCollection);
    }
    metadataStore.newCollection(outputCollection, tableNames, jobId);
    Collection collection =
        new Collection(
            metadataStore, outputCollection, metadataStore.loadCollection(outputCollection));
    return RunResult.ofCollection(tables, collection);
  }

  /**
   * Connects to the master and pings it. If the master is unavailable, starts a temporary local
   * master and worker and returns a new connection to them without pinging again.
   */
  private ClusterRpc connectToMaster() {
    String masterAddress = config.masterAddress();
    ClusterRpc master = connector.connect(masterAddress);
    try {
      master.ping();
    } catch (RpcCallException e) {
      RpcStatus status = e.getStatus();
      if (status == RpcStatus.UNAVAILABLE) {
        LOG.info("Master not started, creating temporary master/worker...");
        startLocalCluster(masterAddress);
        // The old channel does not reach the new master right away.
        master = connector.connect(masterAddress);
      } else if (status != RpcStatus.OK) {
        throw new RemoteCallException("Master ping errored with status: " + status, e);
      }
    }
    return master;
  }

  private void startLocalCluster(String masterAddress) {
    if (localCluster != null) {
      LOG.warn("Temporary cluster is not reachable anymore, restarting it.");
      localCluster.close();
      localCluster = null;
    }
    localCluster = LocalCluster.start(launcher, masterAddress);
  }

  private void submit(ClusterRpc master, JobRequest request) {
    LOG.info("Submitting job {}: {}.", request.getJobName(), request);
    try {
      master.submitJob(request);
    } catch (RuntimeException e) {
      LOG.error("Failed to submit job: {}.", request.getJobName(), e);
      throw new RemoteCallException("Job failed with error: " + e.getMessage(), e);
    }
    LOG.info("Finish running job: {}.", request.getJobName());
  }

  /** Whether a temporary master and worker are running on behalf of this submitter. */
  public boolean hasLocalCluster() {
    return localCluster != null && !localCluster.isClosed();
  }

  /** Stops the temporary master and worker, if any were started. */
  @Override
  public void close() {
    if (localCluster != null) {
      localCluster.close();
      localCluster = null;
    }
  }
}
