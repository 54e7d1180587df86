package io.scanner.jobgraph;

import com.google.common.base.Preconditions;
import io.scanner.api.exception.InvalidPipelineException;
import io.scanner.api.runtime.ComputeRuntime;
import io.scanner.api.stage.Stage;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a pipeline into a topologically ordered list of {@link CompiledStage}s.
 *
 * <p>A pipeline is either the terminal stage of a DAG, reachable backward through the stage
 * inputs, or a list of stages forming a chain. Stages of a chain that declare no inputs read all
 * output columns of their predecessor. The compiler then appends an output sentinel if the
 * terminal stage is not one, wires every stage without inputs to the single input sentinel of
 * the pipeline, and orders the stages so that parents always come before their children.
 *
 * <p>Compilation works on a {@link PipelineGraph} copy; the caller's stages are left untouched,
 * so compiling the same pipeline twice gives the same result.
 */
public class GraphCompiler {

  private static final Logger LOG = LoggerFactory.getLogger(GraphCompiler.class);

  private final ComputeRuntime runtime;

  public GraphCompiler(ComputeRuntime runtime) {
    this.runtime = Preconditions.checkNotNull(runtime);
  }

  public List<CompiledStage> compile(Stage terminal) {
    return compile(Collections.singletonList(terminal));
  }

  public List<CompiledStage> compile(List<Stage> chain) {
    Preconditions.checkArgument(!chain.isEmpty(), "Pipeline has no stages.");
    PipelineGraph graph = new PipelineGraph();
    int[] chainHandles = new int[chain.size()];
    for (int i = 0; i < chain.size(); i++) {
      chainHandles[i] = graph.importStage(chain.get(i));
    }
    for (int i = 0; i < chainHandles.length - 1; i++) {
      StageNode next = graph.node(chainHandles[i + 1]);
      if (!next.getInputs().isEmpty()) {
        continue;
      }
      int previous = chainHandles[i];
      graph.addEdge(previous, next.getHandle(), outputColumnsOf(graph.node(previous)));
    }

    int terminal = chainHandles[chainHandles.length - 1];
    if (!graph.node(terminal).isOutput()) {
      int output = graph.addSentinel(Stage.OUTPUT_TABLE);
      graph.addEdge(terminal, output, outputColumnsOf(graph.node(terminal)));
      terminal = output;
    }
    return toposort(graph, terminal);
  }

  private List<String> outputColumnsOf(StageNode node) {
    if (node.isInput()) {
      return Stage.FRAME_COLUMNS;
    }
    return runtime.getOutputColumns(node.getName());
  }

  private List<CompiledStage> toposort(PipelineGraph graph, int terminal) {
    List<Integer> discovered = discover(graph, terminal);
    int start = resolveStart(graph, discovered);
    if (!discovered.contains(start)) {
      discovered.add(start);
    }

    List<List<Integer>> children = new ArrayList<>(graph.size());
    for (int i = 0; i < graph.size(); i++) {
      children.add(new ArrayList<>());
    }
    int[] inEdgesLeft = new int[graph.size()];
    for (int handle : discovered) {
      for (StageNode.Input input : graph.node(handle).getInputs()) {
        children.get(input.getParent()).add(handle);
        inEdgesLeft[handle]++;
      }
    }

    List<Integer> order = new ArrayList<>(discovered.size());
    int[] positions = new int[graph.size()];
    boolean[] placed = new boolean[graph.size()];
    Deque<Integer> ready = new ArrayDeque<>();
    ready.push(start);
    while (!ready.isEmpty()) {
      int handle = ready.pop();
      if (placed[handle]) {
        continue;
      }
      placed[handle] = true;
      positions[handle] = order.size();
      order.add(handle);
      for (int child : children.get(handle)) {
        inEdgesLeft[child]--;
        if (inEdgesLeft[child] == 0) {
          ready.push(child);
        }
      }
    }

    if (discovered.stream().anyMatch(handle -> !placed[handle])) {
      List<String> stalled =
          discovered.stream()
              .filter(handle -> !placed[handle])
              .map(handle -> handle + "-" + graph.node(handle).getName())
              .collect(Collectors.toList());
      throw new InvalidPipelineException(
          "Pipeline contains a cycle, could not order stages " + stalled + ".");
    }

    List<CompiledStage> compiled = new ArrayList<>(order.size());
    for (int handle : order) {
      StageNode node = graph.node(handle);
      List<CompiledInput> inputs = new ArrayList<>(node.getInputs().size());
      for (StageNode.Input input : node.getInputs()) {
        inputs.add(new CompiledInput(positions[input.getParent()], input.getColumns()));
      }
      compiled.add(node.toCompiledStage(inputs));
    }
    LOG.debug("Compiled pipeline into {} stages: {}.", compiled.size(), compiled);
    return compiled;
  }

  /** Walks backward from the terminal node and returns every node it reaches, each once. */
  private List<Integer> discover(PipelineGraph graph, int terminal) {
    boolean[] explored = new boolean[graph.size()];
    List<Integer> discovered = new ArrayList<>();
    Deque<Integer> stack = new ArrayDeque<>();
    stack.push(terminal);
    while (!stack.isEmpty()) {
      int handle = stack.pop();
      if (explored[handle]) {
        continue;
      }
      explored[handle] = true;
      discovered.add(handle);
      for (StageNode.Input input : graph.node(handle).getInputs()) {
        if (!explored[input.getParent()]) {
          stack.push(input.getParent());
        }
      }
    }
    return discovered;
  }

  /**
   * Picks the input sentinel the pipeline starts from and wires every other stage without inputs
   * to it. An explicit input stage is used if the pipeline has one, otherwise one is added.
   */
  private int resolveStart(PipelineGraph graph, List<Integer> discovered) {
    List<Integer> inputs =
        discovered.stream().filter(h -> graph.node(h).isInput()).collect(Collectors.toList());
    if (inputs.size() > 1) {
      throw new InvalidPipelineException(
          "Pipeline has " + inputs.size() + " distinct " + Stage.INPUT_TABLE + " stages.");
    }
    int start = inputs.isEmpty() ? -1 : inputs.get(0);
    if (start >= 0 && !graph.node(start).getInputs().isEmpty()) {
      throw new InvalidPipelineException(
          Stage.INPUT_TABLE + " stage must not have inputs, it has "
              + graph.node(start).getInputs().size() + ".");
    }
    for (int handle : new ArrayList<>(discovered)) {
      StageNode node = graph.node(handle);
      if (node.isInput() || !node.getInputs().isEmpty()) {
        continue;
      }
      if (start < 0) {
        start = graph.addSentinel(Stage.INPUT_TABLE);
        LOG.debug("Added input stage {} to the pipeline.", start);
      }
      graph.addEdge(start, handle, Stage.FRAME_COLUMNS);
    }
    if (start < 0) {
      throw new InvalidPipelineException(
          "Pipeline has no stage to start from, every stage has an input.");
    }
    return start;
  }

  /**
   * Renders compiled stages as a digraph for log printing.
   *
   * @param name Graph name, usually the job name.
   */
  public static String generateDigraph(String name, List<CompiledStage> stages) {
    StringBuilder digraph = new StringBuilder();
    digraph.append("digraph ").append(name).append(" {");
    for (int i = 0; i < stages.size(); i++) {
      for (CompiledInput input : stages.get(i).getInputs()) {
        int parent = input.getStageIndex();
        digraph.append(System.lineSeparator());
        digraph.append(
            String.format(
                "  \"%d-%s\" -> \"%d-%s\"",
                parent, stages.get(parent).getName(), i, stages.get(i).getName()));
      }
    }
    digraph.append(System.lineSeparator()).append("}");
    return digraph.toString();
  }
}
