package io.scanner.api.cluster;

/** Opens connections to a master. */
public interface ClusterConnector {

  /**
   * Creates a fresh connection. Opening a connection does not contact the master, so it
   * succeeds whether or not one is listening.
   */
  ClusterRpc connect(String masterAddress);
}
