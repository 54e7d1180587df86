package io.scanner.runtime.cluster;

import com.google.common.base.Preconditions;
import io.scanner.api.cluster.ClusterLauncher;
import io.scanner.api.cluster.ClusterProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A temporary master and worker started on this node. Both processes stop when the cluster is
 * closed.
 */
public class LocalCluster implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(LocalCluster.class);

  private final ClusterProcess master;
  private final ClusterProcess worker;
  private boolean closed = false;

  private LocalCluster(ClusterProcess master, ClusterProcess worker) {
    this.master = master;
    this.worker = worker;
  }

  /** Starts a master, then a worker connected to it. */
  public static LocalCluster start(ClusterLauncher launcher, String masterAddress) {
    Preconditions.checkNotNull(launcher);
    ClusterProcess master = launcher.startMaster();
    ClusterProcess worker;
    try {
      worker = launcher.startWorker(masterAddress);
    } catch (RuntimeException e) {
      master.close();
      throw e;
    }
    LOG.info("Temporary master {} and worker {} started.", master.getName(), worker.getName());
    return new LocalCluster(master, worker);
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    try {
      worker.close();
    } finally {
      master.close();
    }
    LOG.info("Temporary master {} and worker {} stopped.", master.getName(), worker.getName());
  }
}
