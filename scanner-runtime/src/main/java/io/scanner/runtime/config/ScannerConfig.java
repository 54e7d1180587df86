package io.scanner.runtime.config;

/**
 * Client config.
 */
public interface ScannerConfig extends Config {

  String MASTER_ADDRESS = "scanner.master_address";
  String KERNEL_INSTANCES_PER_NODE = "scanner.kernel_instances_per_node";

  /**
   * Address of the master, also used when a temporary local master has to be started.
   */
  @DefaultValue(value = "localhost:5001")
  @Key(value = MASTER_ADDRESS)
  String masterAddress();

  /**
   * Number of kernel instances each node runs for a job.
   */
  @DefaultValue(value = "1")
  @Key(value = KERNEL_INSTANCES_PER_NODE)
  int kernelInstancesPerNode();
}
