package io.scanner.api.storage;

/**
 * Durable storage of serialized descriptors. Paths are relative to the database root, e.g.
 * {@code db_metadata.bin} or {@code tables/3/descriptor.bin}.
 */
public interface DescriptorStore {

  /** @throws io.scanner.api.exception.NotFoundException if nothing is stored at the path. */
  byte[] read(String path);

  void write(String path, byte[] bytes);

  boolean exists(String path);

  void delete(String path);
}
