package io.scanner.runtime.config;

import io.scanner.runtime.BaseUnitTest;
import java.util.HashMap;
import java.util.Map;
import org.aeonbits.owner.ConfigFactory;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ConfigTest extends BaseUnitTest {

  @Test
  public void testBaseFunc() {
    // conf using
    ScannerConfig config = ConfigFactory.create(ScannerConfig.class);
    Assert.assertEquals(config.masterAddress(), "localhost:5001");
    Assert.assertEquals(config.kernelInstancesPerNode(), 1);

    // override conf
    Map<String, String> customConf = new HashMap<>();
    customConf.put(ScannerConfig.MASTER_ADDRESS, "10.0.0.1:5001");
    ScannerConfig config2 = ConfigFactory.create(ScannerConfig.class, customConf);
    Assert.assertEquals(config2.masterAddress(), "10.0.0.1:5001");
  }

  @Test
  public void testRunOptionDefaults() {
    RunOptions options = RunOptions.defaults();
    Assert.assertFalse(options.force());
    Assert.assertNull(options.jobName());
    Assert.assertNull(options.outputCollection());
    Assert.assertEquals(options.ioItemSize(), 1000);
    Assert.assertEquals(options.workItemSize(), 250);
  }

  @Test
  public void testRunOptionsBuilder() {
    RunOptions options =
        RunOptions.builder()
            .force(true)
            .jobName("histogram")
            .outputCollection("hist")
            .ioItemSize(100)
            .workItemSize(10)
            .build();
    Assert.assertTrue(options.force());
    Assert.assertEquals(options.jobName(), "histogram");
    Assert.assertEquals(options.outputCollection(), "hist");
    Assert.assertEquals(options.ioItemSize(), 100);
    Assert.assertEquals(options.workItemSize(), 10);
  }

  @Test
  public void testRunOptionsFromMap() {
    Map<String, String> conf = new HashMap<>();
    conf.put(RunOptions.FORCE, "true");
    conf.put("custom_key", "custom_value");
    RunOptions options = RunOptions.of(conf);
    Assert.assertTrue(options.force());
    Assert.assertEquals(options.workItemSize(), 250);
  }
}
