package io.scanner.jobgraph;

import io.scanner.api.stage.DeviceType;
import io.scanner.api.stage.Stage;
import io.scanner.api.stage.StageInput;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arena of pipeline nodes used during one compilation. User stages are copied in once, keyed by
 * identity, and every edge added afterwards only touches the arena, never the user's stages.
 */
public class PipelineGraph {

  private final List<StageNode> nodes = new ArrayList<>();
  private final Map<Stage, Integer> handles = new IdentityHashMap<>();

  /**
   * Copies {@code root} and every stage reachable through its inputs into the arena.
   *
   * @return The handle of {@code root}.
   */
  public int importStage(Stage root) {
    Integer existing = handles.get(root);
    if (existing != null) {
      return existing;
    }
    List<Stage> imported = new ArrayList<>();
    Deque<Stage> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Stage stage = stack.pop();
      if (handles.containsKey(stage)) {
        continue;
      }
      StageNode node = new StageNode(nodes.size(), stage);
      nodes.add(node);
      handles.put(stage, node.getHandle());
      imported.add(stage);
      for (StageInput input : stage.getInputs()) {
        if (!handles.containsKey(input.getParent())) {
          stack.push(input.getParent());
        }
      }
    }
    // All parents have handles now.
    for (Stage stage : imported) {
      StageNode node = nodes.get(handles.get(stage));
      for (StageInput input : stage.getInputs()) {
        node.addInput(handles.get(input.getParent()), input.getColumns());
      }
    }
    return handles.get(root);
  }

  /** Adds a sentinel node that has no counterpart among the user's stages. */
  public int addSentinel(String name) {
    StageNode node =
        new StageNode(
            nodes.size(), name, DeviceType.CPU, new byte[0], 1, 0, Collections.singletonList(0));
    nodes.add(node);
    return node.getHandle();
  }

  public void addEdge(int parent, int child, List<String> columns) {
    node(child).addInput(parent, columns);
  }

  public StageNode node(int handle) {
    return nodes.get(handle);
  }

  public int size() {
    return nodes.size();
  }
}
