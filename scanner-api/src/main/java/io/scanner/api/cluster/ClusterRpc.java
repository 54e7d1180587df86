package io.scanner.api.cluster;

/**
 * Client side of the master's control plane service. Calls block the caller until they return;
 * timeouts and cancellation are the implementation's concern.
 */
public interface ClusterRpc {

  /**
   * Checks that the master is serving.
   *
   * @throws RpcCallException with {@link RpcStatus#UNAVAILABLE} if no master is listening.
   */
  void ping();

  /**
   * Runs a job. Returns once the job and its output tables are recorded in the database.
   *
   * @throws RpcCallException if the master rejects or fails the job.
   */
  void submitJob(JobRequest request);
}
