package io.scanner.runtime.serialization;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import io.scanner.api.exception.InvalidIdentifierException;
import io.scanner.api.exception.NotFoundException;
import io.scanner.runtime.generated.Metadata;
import io.scanner.runtime.generated.Rpc;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Protobuf message types known to the client, by simple name.
 *
 * <p>Kernel argument types of custom stages are added with {@link #register(Message)}, e.g.
 * {@code registry.register(BlurArgs.getDefaultInstance())}, and then looked up by name.
 */
public class ProtobufRegistry {

  private static final Logger LOG = LoggerFactory.getLogger(ProtobufRegistry.class);

  private final Map<String, Message> types = new TreeMap<>();

  public ProtobufRegistry() {
    register(Metadata.DatabaseDescriptor.getDefaultInstance());
    register(Metadata.TableDescriptor.getDefaultInstance());
    register(Metadata.JobDescriptor.getDefaultInstance());
    register(Metadata.CollectionDescriptor.getDefaultInstance());
    register(Metadata.CollectionsDescriptor.getDefaultInstance());
    register(Metadata.Column.getDefaultInstance());
    register(Metadata.Task.getDefaultInstance());
    register(Metadata.TableSample.getDefaultInstance());
    register(Metadata.Op.getDefaultInstance());
    register(Metadata.AllSamplerArgs.getDefaultInstance());
    register(Metadata.StridedRangeSamplerArgs.getDefaultInstance());
    register(Metadata.GatherSamplerArgs.getDefaultInstance());
    register(Rpc.JobParameters.getDefaultInstance());
  }

  /**
   * Makes a message type available by its simple name.
   *
   * @throws InvalidIdentifierException if another type with the same name is registered.
   */
  public synchronized void register(Message defaultInstance) {
    Preconditions.checkNotNull(defaultInstance);
    String name = defaultInstance.getDescriptorForType().getName();
    Message existing = types.get(name);
    if (existing != null
        && !existing.getDescriptorForType().getFullName()
            .equals(defaultInstance.getDescriptorForType().getFullName())) {
      throw new InvalidIdentifierException(
          "Protobuf name " + name + " is already taken by "
              + existing.getDescriptorForType().getFullName());
    }
    types.put(name, defaultInstance);
    LOG.debug("Registered protobuf type {}.", name);
  }

  public synchronized boolean contains(String name) {
    return types.containsKey(name);
  }

  /** Snapshot of the registered names, in order. */
  public synchronized Set<String> names() {
    return ImmutableSet.copyOf(types.keySet());
  }

  /** @throws NotFoundException if no type with this name is registered. */
  public synchronized Message.Builder newBuilder(String name) {
    return lookup(name).newBuilderForType();
  }

  /** @throws NotFoundException if no type with this name is registered. */
  public synchronized Message parse(String name, byte[] bytes)
      throws InvalidProtocolBufferException {
    return lookup(name).getParserForType().parseFrom(bytes);
  }

  private Message lookup(String name) {
    Message type = types.get(name);
    if (type == null) {
      throw new NotFoundException("No protobuf with name " + name);
    }
    return type;
  }
}
