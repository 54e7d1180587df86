package io.scanner.api.cluster;

/** Starts master and worker processes on the local node. */
public interface ClusterLauncher {

  ClusterProcess startMaster();

  ClusterProcess startWorker(String masterAddress);
}
