package io.scanner.jobgraph;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.scanner.api.exception.InvalidPipelineException;
import io.scanner.api.exception.NotFoundException;
import io.scanner.api.stage.Stage;
import io.scanner.api.stage.StageInput;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class GraphCompilerTest {

  private static final Logger LOG = LoggerFactory.getLogger(GraphCompilerTest.class);

  private GraphCompiler compiler;

  @BeforeMethod
  public void setUp() {
    FakeComputeRuntime runtime =
        new FakeComputeRuntime()
            .register("Blur", "blurred")
            .register("Histogram", "histogram")
            .register("Resize", "frame", "frame_info")
            .register("Merge", "merged");
    compiler = new GraphCompiler(runtime);
  }

  @Test
  public void testChainGetsInputAndOutputStages() {
    List<CompiledStage> stages =
        compiler.compile(Lists.newArrayList(Stage.of("Blur"), Stage.of("Histogram")));

    Assert.assertEquals(names(stages), ImmutableList.of(
        Stage.INPUT_TABLE, "Blur", "Histogram", Stage.OUTPUT_TABLE));
    assertSingleInput(stages.get(1), 0, Stage.FRAME_COLUMNS);
    assertSingleInput(stages.get(2), 1, ImmutableList.of("blurred"));
    assertSingleInput(stages.get(3), 2, ImmutableList.of("histogram"));
    Assert.assertTrue(stages.get(0).getInputs().isEmpty());
  }

  @Test
  public void testChainUsesOutputColumnsOfEachPredecessor() {
    List<CompiledStage> stages =
        compiler.compile(
            Lists.newArrayList(Stage.of("Resize"), Stage.of("Blur"), Stage.of("Histogram")));

    Assert.assertEquals(stages.size(), 5);
    assertSingleInput(stages.get(2), 1, ImmutableList.of("frame", "frame_info"));
    assertSingleInput(stages.get(3), 2, ImmutableList.of("blurred"));
    assertSingleInput(stages.get(4), 3, ImmutableList.of("histogram"));
  }

  @Test
  public void testChainStartingWithInputStage() {
    List<CompiledStage> stages =
        compiler.compile(Lists.newArrayList(Stage.input(), Stage.of("Blur")));

    Assert.assertEquals(names(stages), ImmutableList.of(
        Stage.INPUT_TABLE, "Blur", Stage.OUTPUT_TABLE));
    assertSingleInput(stages.get(1), 0, Stage.FRAME_COLUMNS);
  }

  @Test
  public void testExplicitWiringWinsInChain() {
    Stage resize = Stage.of("Resize");
    Stage blur = Stage.of("Blur");
    Stage histogram = Stage.of("Histogram").withInput(resize, "frame");

    List<CompiledStage> stages = compiler.compile(Lists.newArrayList(resize, blur, histogram));
    assertTopological(stages);

    CompiledStage compiledHistogram = byName(stages, "Histogram");
    Assert.assertEquals(compiledHistogram.getInputs().size(), 1);
    CompiledInput input = compiledHistogram.getInputs().get(0);
    Assert.assertEquals(stages.get(input.getStageIndex()).getName(), "Resize");
    Assert.assertEquals(input.getColumns(), ImmutableList.of("frame"));
  }

  @Test
  public void testDiamondSharesOneInputStage() {
    Stage blur = Stage.of("Blur");
    Stage histogram = Stage.of("Histogram");
    Stage merge = Stage.of("Merge")
        .withInput(blur, "blurred")
        .withInput(histogram, "histogram");

    List<CompiledStage> stages = compiler.compile(merge);
    LOG.info(GraphCompiler.generateDigraph("diamond", stages));

    Assert.assertEquals(stages.size(), 5);
    assertTopological(stages);
    Assert.assertEquals(stages.get(0).getName(), Stage.INPUT_TABLE);
    Assert.assertEquals(
        stages.stream().filter(s -> s.getName().equals(Stage.INPUT_TABLE)).count(), 1);
    assertSingleInput(byName(stages, "Blur"), 0, Stage.FRAME_COLUMNS);
    assertSingleInput(byName(stages, "Histogram"), 0, Stage.FRAME_COLUMNS);
    Assert.assertEquals(byName(stages, "Merge").getInputs().size(), 2);
    Assert.assertEquals(stages.get(4).getName(), Stage.OUTPUT_TABLE);
    assertSingleInput(stages.get(4), 3, ImmutableList.of("merged"));
  }

  @Test
  public void testExplicitInputAndOutputStagesAreKept() {
    Stage input = Stage.input();
    Stage blur = Stage.of("Blur").withInput(input, "frame");
    Stage output = Stage.output(new StageInput(blur, ImmutableList.of("blurred")));

    List<CompiledStage> stages = compiler.compile(output);

    Assert.assertEquals(names(stages), ImmutableList.of(
        Stage.INPUT_TABLE, "Blur", Stage.OUTPUT_TABLE));
    assertSingleInput(stages.get(1), 0, ImmutableList.of("frame"));
    assertSingleInput(stages.get(2), 1, ImmutableList.of("blurred"));
  }

  @Test
  public void testDagWithSharedParentIsTopological() {
    Stage input = Stage.input();
    Stage resize = Stage.of("Resize").withInput(input, "frame", "frame_info");
    Stage blur = Stage.of("Blur").withInput(resize, "frame");
    Stage histogram = Stage.of("Histogram").withInput(resize, "frame");
    Stage merge = Stage.of("Merge")
        .withInput(blur, "blurred")
        .withInput(histogram, "histogram")
        .withInput(input, "frame_info");

    List<CompiledStage> stages = compiler.compile(merge);

    Assert.assertEquals(stages.size(), 6);
    assertTopological(stages);
    Assert.assertEquals(stages.get(0).getName(), Stage.INPUT_TABLE);
    Assert.assertEquals(stages.get(5).getName(), Stage.OUTPUT_TABLE);
  }

  @Test
  public void testCompilationLeavesStagesUntouched() {
    Stage blur = Stage.of("Blur");
    Stage histogram = Stage.of("Histogram");
    List<Stage> chain = Lists.newArrayList(blur, histogram);

    List<CompiledStage> first = compiler.compile(chain);
    List<CompiledStage> second = compiler.compile(chain);

    Assert.assertTrue(blur.getInputs().isEmpty());
    Assert.assertTrue(histogram.getInputs().isEmpty());
    Assert.assertEquals(names(first), names(second));
    for (int i = 0; i < first.size(); i++) {
      Assert.assertEquals(
          first.get(i).getInputs().toString(), second.get(i).getInputs().toString());
    }
  }

  @Test
  public void testStageAttributesAreCarried() {
    Stage blur = Stage.of("Blur")
        .withBatch(8)
        .withWarmup(2)
        .withStencil(ImmutableList.of(-1, 0, 1))
        .withArgs(new byte[] {1, 2});

    CompiledStage compiled = byName(compiler.compile(blur), "Blur");

    Assert.assertEquals(compiled.getBatch(), 8);
    Assert.assertEquals(compiled.getWarmup(), 2);
    Assert.assertEquals(compiled.getStencil(), ImmutableList.of(-1, 0, 1));
    Assert.assertEquals(compiled.getArgs(), new byte[] {1, 2});
  }

  @Test(expectedExceptions = NotFoundException.class)
  public void testUnknownStagePropagatesRuntimeFailure() {
    compiler.compile(Lists.newArrayList(Stage.of("Unknown"), Stage.of("Blur")));
  }

  @Test(expectedExceptions = InvalidPipelineException.class)
  public void testCycleIsRejected() {
    Stage input = Stage.input();
    Stage blur = Stage.of("Blur");
    Stage histogram = Stage.of("Histogram").withInput(blur, "blurred");
    blur.withInput(input, "frame").withInput(histogram, "histogram");

    compiler.compile(histogram);
  }

  @Test(expectedExceptions = InvalidPipelineException.class)
  public void testCycleWithoutInputIsRejected() {
    Stage blur = Stage.of("Blur");
    Stage histogram = Stage.of("Histogram").withInput(blur, "blurred");
    blur.withInput(histogram, "histogram");

    compiler.compile(histogram);
  }

  @Test
  public void testInputStageWithInputsIsRejected() {
    Stage input = Stage.input().withInput(Stage.of("Blur"), "blurred");
    Stage looped = Stage.of("Blur");
    looped.withInput(looped, "blurred");
    Stage merge = Stage.of("Merge")
        .withInput(input, "frame")
        .withInput(looped, "blurred");

    try {
      compiler.compile(merge);
      Assert.fail("A pipeline whose input stage has inputs should not compile.");
    } catch (InvalidPipelineException e) {
      Assert.assertTrue(e.getMessage().contains(Stage.INPUT_TABLE), e.getMessage());
    }
  }

  @Test(expectedExceptions = InvalidPipelineException.class)
  public void testInputStageAfterChainStageIsRejected() {
    compiler.compile(Lists.newArrayList(Stage.of("Blur"), Stage.input()));
  }

  @Test
  public void testSelfLoopIsRejected() {
    Stage looped = Stage.of("Blur");
    looped.withInput(looped, "blurred");
    Stage merge = Stage.of("Merge")
        .withInput(Stage.input(), "frame")
        .withInput(looped, "blurred");

    try {
      compiler.compile(merge);
      Assert.fail("A self-looped stage should not compile.");
    } catch (InvalidPipelineException e) {
      Assert.assertTrue(e.getMessage().contains("Blur"), e.getMessage());
    }
  }

  @Test(expectedExceptions = InvalidPipelineException.class)
  public void testTwoInputStagesAreRejected() {
    Stage merge = Stage.of("Merge")
        .withInput(Stage.input(), "frame")
        .withInput(Stage.input(), "frame");

    compiler.compile(merge);
  }

  @Test
  public void testDigraph() {
    List<CompiledStage> stages = compiler.compile(Lists.newArrayList(Stage.of("Blur")));
    String digraph = GraphCompiler.generateDigraph("job", stages);

    Assert.assertTrue(digraph.contains("\"0-InputTable\" -> \"1-Blur\""));
    Assert.assertTrue(digraph.contains("\"1-Blur\" -> \"2-OutputTable\""));
  }

  private static void assertTopological(List<CompiledStage> stages) {
    for (int i = 0; i < stages.size(); i++) {
      for (CompiledInput input : stages.get(i).getInputs()) {
        Assert.assertTrue(input.getStageIndex() < i,
            "Stage " + i + " reads from later stage " + input.getStageIndex());
      }
    }
  }

  private static void assertSingleInput(
      CompiledStage stage, int parentIndex, List<String> columns) {
    Assert.assertEquals(stage.getInputs().size(), 1, stage.toString());
    Assert.assertEquals(stage.getInputs().get(0).getStageIndex(), parentIndex);
    Assert.assertEquals(stage.getInputs().get(0).getColumns(), columns);
  }

  private static CompiledStage byName(List<CompiledStage> stages, String name) {
    return stages.stream().filter(s -> s.getName().equals(name)).findFirst().get();
  }

  private static List<String> names(List<CompiledStage> stages) {
    return stages.stream().map(CompiledStage::getName).collect(Collectors.toList());
  }
}
