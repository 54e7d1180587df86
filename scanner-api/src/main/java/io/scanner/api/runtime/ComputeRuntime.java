package io.scanner.api.runtime;

import java.util.List;

/**
 * The native engine that executes stages. The client only asks it about registered stages, loads
 * custom stage libraries into it and hands it videos to ingest.
 */
public interface ComputeRuntime {

  /**
   * Returns the output columns of a registered stage kind.
   *
   * @param stageName The stage kind, e.g. "Histogram".
   * @return Ordered output column names.
   * @throws io.scanner.api.exception.NotFoundException if no stage with this name is registered.
   */
  List<String> getOutputColumns(String stageName);

  /**
   * Loads a shared library of custom stages. Its stages are registered from then on.
   *
   * @param path Path of the library on this node.
   */
  void loadStageLibrary(String path);

  /**
   * Decodes the given video files into new tables of the database.
   *
   * @param tableNames Names of the tables to create, parallel to {@code paths}.
   * @param paths Video file paths.
   */
  void ingestVideos(List<String> tableNames, List<String> paths);
}
