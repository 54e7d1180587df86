package io.scanner.api.cluster;

/** A running master or worker. Closing it stops the process. */
public interface ClusterProcess extends AutoCloseable {

  String getName();

  @Override
  void close();
}
