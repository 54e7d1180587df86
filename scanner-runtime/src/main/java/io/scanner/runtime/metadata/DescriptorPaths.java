package io.scanner.runtime.metadata;

/** Locations of descriptors inside a database. */
public final class DescriptorPaths {

  public static final String DB_METADATA = "db_metadata.bin";
  public static final String COLLECTIONS = "pydb/descriptor.bin";

  private DescriptorPaths() {}

  public static String collection(long collectionId) {
    return String.format("pydb/collection_%d.bin", collectionId);
  }

  public static String table(int tableId) {
    return String.format("tables/%d/descriptor.bin", tableId);
  }

  public static String job(int jobId) {
    return String.format("jobs/%d/descriptor.bin", jobId);
  }
}
