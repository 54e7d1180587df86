package io.scanner.runtime.cluster;

import com.google.common.collect.ImmutableList;
import io.scanner.api.cluster.ClusterLauncher;
import io.scanner.api.cluster.ClusterProcess;
import io.scanner.runtime.BaseUnitTest;
import java.util.ArrayList;
import java.util.List;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class LocalClusterTest extends BaseUnitTest {

  private List<String> events;

  @BeforeMethod
  public void setUp() {
    events = new ArrayList<>();
  }

  private ClusterProcess process(String name) {
    events.add("start " + name);
    return new ClusterProcess() {
      @Override
      public String getName() {
        return name;
      }

      @Override
      public void close() {
        events.add("stop " + name);
      }
    };
  }

  private ClusterLauncher launcher(boolean workerFails) {
    return new ClusterLauncher() {
      @Override
      public ClusterProcess startMaster() {
        return process("master");
      }

      @Override
      public ClusterProcess startWorker(String masterAddress) {
        if (workerFails) {
          throw new IllegalStateException("Worker could not reach " + masterAddress);
        }
        return process("worker");
      }
    };
  }

  @Test
  public void testWorkerStopsBeforeMaster() {
    LocalCluster cluster = LocalCluster.start(launcher(false), "localhost:5001");
    Assert.assertFalse(cluster.isClosed());

    cluster.close();

    Assert.assertTrue(cluster.isClosed());
    Assert.assertEquals(
        events, ImmutableList.of("start master", "start worker", "stop worker", "stop master"));
  }

  @Test
  public void testCloseTwice() {
    try (LocalCluster cluster = LocalCluster.start(launcher(false), "localhost:5001")) {
      cluster.close();
    }
    Assert.assertEquals(events.size(), 4);
  }

  @Test
  public void testMasterStopsWhenWorkerFails() {
    Assert.assertThrows(
        IllegalStateException.class, () -> LocalCluster.start(launcher(true), "localhost:5001"));
    Assert.assertEquals(events, ImmutableList.of("start master", "stop master"));
  }
}
