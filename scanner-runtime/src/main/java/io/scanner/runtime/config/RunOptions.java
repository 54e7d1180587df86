package io.scanner.runtime.config;

import java.util.HashMap;
import java.util.Map;
import org.aeonbits.owner.ConfigFactory;

/** Options of a single job run. */
public interface RunOptions extends Config {

  String FORCE = "scanner.run.force";
  String JOB_NAME = "scanner.run.job_name";
  String OUTPUT_COLLECTION = "scanner.run.output_collection";
  String IO_ITEM_SIZE = "scanner.run.io_item_size";
  String WORK_ITEM_SIZE = "scanner.run.work_item_size";

  /**
   * Whether existing output tables and collections are overwritten.
   */
  @DefaultValue(value = "false")
  @Key(value = FORCE)
  boolean force();

  /**
   * Job name. Returns null if not set, a random name is used then.
   */
  @Key(value = JOB_NAME)
  String jobName();

  /**
   * Name of the collection the output tables are grouped into. Returns null if not set.
   */
  @Key(value = OUTPUT_COLLECTION)
  String outputCollection();

  /**
   * Number of rows per IO item.
   */
  @DefaultValue(value = "1000")
  @Key(value = IO_ITEM_SIZE)
  int ioItemSize();

  /**
   * Number of rows per work item.
   */
  @DefaultValue(value = "250")
  @Key(value = WORK_ITEM_SIZE)
  int workItemSize();

  static RunOptions defaults() {
    return ConfigFactory.create(RunOptions.class);
  }

  static RunOptions of(Map<String, String> conf) {
    return ConfigFactory.create(RunOptions.class, conf);
  }

  static Builder builder() {
    return new Builder();
  }

  class Builder {

    private final Map<String, String> conf = new HashMap<>();

    public Builder force(boolean force) {
      conf.put(FORCE, String.valueOf(force));
      return this;
    }

    public Builder jobName(String jobName) {
      conf.put(JOB_NAME, jobName);
      return this;
    }

    public Builder outputCollection(String outputCollection) {
      conf.put(OUTPUT_COLLECTION, outputCollection);
      return this;
    }

    public Builder ioItemSize(int ioItemSize) {
      conf.put(IO_ITEM_SIZE, String.valueOf(ioItemSize));
      return this;
    }

    public Builder workItemSize(int workItemSize) {
      conf.put(WORK_ITEM_SIZE, String.valueOf(workItemSize));
      return this;
    }

    public RunOptions build() {
      return RunOptions.of(conf);
    }
  }
}
