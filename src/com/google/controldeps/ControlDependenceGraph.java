/*
 * Copyright 2024 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.controldeps;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.controldeps.ControlDependenceNode.EdgeType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The control dependence graph of a single function, as described in Ferrante, Ottenstein and
 * Warren, "The Program Dependence Graph and Its Use in Optimization".
 *
 * <p>The graph owns every node created for the function. It is built by {@link
 * ControlDependenceAnalysis} and is only queried afterwards.
 *
 * @param <B> The basic block type.
 */
public final class ControlDependenceGraph<B> {

  private final List<ControlDependenceNode<B>> nodes = new ArrayList<>();

  private final Map<B, ControlDependenceNode<B>> nodesByBlock = new LinkedHashMap<>();

  /** The function entry. A region that no other node points to at first. */
  private final ControlDependenceNode<B> root;

  ControlDependenceGraph() {
    root = createRegion();
  }

  ControlDependenceNode<B> createBlockNode(B block) {
    checkNotNull(block);
    checkArgument(!nodesByBlock.containsKey(block), "Duplicate basic block %s", block);
    ControlDependenceNode<B> node = new ControlDependenceNode<>(nodes.size(), block);
    nodes.add(node);
    nodesByBlock.put(block, node);
    return node;
  }

  ControlDependenceNode<B> createRegion() {
    ControlDependenceNode<B> region = new ControlDependenceNode<>(nodes.size(), null);
    nodes.add(region);
    return region;
  }

  public ControlDependenceNode<B> getRoot() {
    return root;
  }

  /** Returns the node of {@code block}, or null if the block is not part of this graph. */
  public @Nullable ControlDependenceNode<B> getNode(B block) {
    return nodesByBlock.get(block);
  }

  /** All nodes owned by this graph in creation order, including unreachable ones. */
  public List<ControlDependenceNode<B>> getNodes() {
    return Collections.unmodifiableList(nodes);
  }

  public int getNodeCount() {
    return nodes.size();
  }

  /**
   * Whether {@code a} decides on its own whether {@code b} executes: walking up from {@code b}
   * through nodes that have exactly one parent reaches the node of {@code a}.
   */
  public boolean controls(B a, B b) {
    ControlDependenceNode<B> target = requireNode(a);
    ControlDependenceNode<B> n = requireNode(b);
    Set<ControlDependenceNode<B>> seen = new HashSet<>();
    while (n.getNumParents() == 1) {
      n = n.getParents().iterator().next();
      if (!seen.add(n)) {
        return false;
      }
      if (n == target) {
        return true;
      }
    }
    return false;
  }

  /**
   * Whether the outcome of {@code a} has any bearing on whether {@code b} executes: the node of
   * {@code a} is reachable from {@code b} through parent links, over any number of branching
   * paths.
   */
  public boolean influences(B a, B b) {
    ControlDependenceNode<B> target = requireNode(a);
    ControlDependenceNode<B> n = requireNode(b);
    Set<ControlDependenceNode<B>> seen = new HashSet<>();
    Deque<ControlDependenceNode<B>> worklist = new ArrayDeque<>(n.getParents());
    seen.addAll(worklist);
    while (!worklist.isEmpty()) {
      n = worklist.removeFirst();
      if (n == target) {
        return true;
      }
      for (ControlDependenceNode<B> parent : n.getParents()) {
        if (seen.add(parent)) {
          worklist.addLast(parent);
        }
      }
    }
    return false;
  }

  /** Returns the region enclosing {@code block}. See {@link ControlDependenceNode#enclosingRegion}. */
  public ControlDependenceNode<B> enclosingRegion(B block) {
    return requireNode(block).enclosingRegion();
  }

  /** Nodes reachable from the root, in depth-first preorder. */
  public ImmutableList<ControlDependenceNode<B>> getReachableNodes() {
    Set<ControlDependenceNode<B>> visited = new LinkedHashSet<>();
    Deque<ControlDependenceNode<B>> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      ControlDependenceNode<B> n = stack.pop();
      if (!visited.add(n)) {
        continue;
      }
      ImmutableList<ControlDependenceNode<B>> children = n.getChildren().asList();
      for (int i = children.size() - 1; i >= 0; i--) {
        if (!visited.contains(children.get(i))) {
          stack.push(children.get(i));
        }
      }
    }
    return ImmutableList.copyOf(visited);
  }

  /**
   * The edges reachable from the root. Sources come in depth-first preorder, and the edges of one
   * source are listed true first, then false, then other.
   */
  public ImmutableList<Edge<B>> getEdges() {
    ImmutableList.Builder<Edge<B>> edges = ImmutableList.builder();
    for (ControlDependenceNode<B> source : getReachableNodes()) {
      for (EdgeType type : EdgeType.values()) {
        for (ControlDependenceNode<B> destination : source.getChildren(type)) {
          edges.add(new Edge<>(source, type, destination));
        }
      }
    }
    return edges.build();
  }

  private ControlDependenceNode<B> requireNode(B block) {
    ControlDependenceNode<B> node = nodesByBlock.get(block);
    checkArgument(node != null, "Basic block %s not in control dependence graph", block);
    return node;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("CDG:\n");
    for (Edge<B> e : getEdges()) {
      sb.append(e).append('\n');
    }
    return sb.toString();
  }

  /** A control dependence edge, as seen by a traversal from the root. */
  public static final class Edge<B> {
    private final ControlDependenceNode<B> source;
    private final EdgeType type;
    private final ControlDependenceNode<B> destination;

    Edge(ControlDependenceNode<B> source, EdgeType type, ControlDependenceNode<B> destination) {
      this.source = source;
      this.type = type;
      this.destination = destination;
    }

    public ControlDependenceNode<B> getSource() {
      return source;
    }

    public EdgeType getType() {
      return type;
    }

    public ControlDependenceNode<B> getDestination() {
      return destination;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Edge)) {
        return false;
      }
      Edge<?> that = (Edge<?>) other;
      return source == that.source && type == that.type && destination == that.destination;
    }

    @Override
    public int hashCode() {
      return Objects.hash(source, type, destination);
    }

    @Override
    public String toString() {
      return source + " -" + type + "-> " + destination;
    }
  }
}
