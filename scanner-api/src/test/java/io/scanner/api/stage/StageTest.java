package io.scanner.api.stage;

import com.google.common.collect.ImmutableList;
import org.testng.Assert;
import org.testng.annotations.Test;

public class StageTest {

  @Test
  public void testSentinels() {
    Assert.assertTrue(Stage.input().isInput());
    Stage blur = Stage.of("Blur");
    Stage output = Stage.output(new StageInput(blur, ImmutableList.of("blurred")));
    Assert.assertTrue(output.isOutput());
    Assert.assertSame(output.getInputs().get(0).getParent(), blur);
  }

  @Test
  public void testIdentity() {
    Assert.assertNotEquals(Stage.of("Blur"), Stage.of("Blur"));
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testInvalidBatch() {
    Stage.of("Blur").withBatch(0);
  }

  @Test(expectedExceptions = UnsupportedOperationException.class)
  public void testInputsAreReadOnly() {
    Stage.of("Blur").getInputs().add(new StageInput(Stage.input(), Stage.FRAME_COLUMNS));
  }
}
