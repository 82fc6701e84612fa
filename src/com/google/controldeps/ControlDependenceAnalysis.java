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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.controldeps.ControlDependenceNode.EdgeType;
import com.google.controldeps.DependenceSignature.Dependence;
import com.google.controldeps.PostDominatorTree.TreeNode;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes the {@link ControlDependenceGraph} of a function from its control flow graph and its
 * post-dominator tree.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * ControlDependenceGraph<Block> cdg = ControlDependenceAnalysis.<Block>builder()
 *                                         .setControlFlow(cfg)
 *                                         .setPostDominatorTree(pdt)
 *                                         .computeCdg();
 * }</pre>
 *
 * <p>Construction runs in two steps. {@link #computeDependencies} adds an edge from a branching
 * block to every block whose execution depends on the branch, following Ferrante et al.: for a
 * flow edge A -> B where B does not post-dominate A, every block on the post-dominator tree path
 * from B up to, but excluding, the nearest common post-dominator of A and B depends on A. {@link
 * #insertRegions} then groups the nodes that depend on the same set of branches under shared
 * region nodes, and splits the fan-out so that each block has at most one true and at most one
 * false child.
 *
 * @param <B> The basic block type.
 */
public final class ControlDependenceAnalysis<B> {

  private static final Logger logger = Logger.getLogger(ControlDependenceAnalysis.class.getName());

  private final ControlFlowView<B> cfg;
  private final PostDominatorTree<B> pdt;
  private final DependenceTracer<B> tracer;

  private ControlDependenceGraph<B> cdg;

  @VisibleForTesting
  ControlDependenceAnalysis(
      ControlFlowView<B> cfg, PostDominatorTree<B> pdt, DependenceTracer<B> tracer) {
    this.cfg = cfg;
    this.pdt = pdt;
    this.tracer = tracer;
  }

  /**
   * Configures a {@link ControlDependenceAnalysis} instance then computes the {@link
   * ControlDependenceGraph}.
   */
  public static final class Builder<B> {
    private ControlFlowView<B> cfg;
    private PostDominatorTree<B> pdt;
    private DependenceTracer<B> tracer = DependenceTracer.none();
    private boolean insertRegions = true;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder<B> setControlFlow(ControlFlowView<B> cfg) {
      this.cfg = cfg;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<B> setPostDominatorTree(PostDominatorTree<B> pdt) {
      this.pdt = pdt;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<B> setTracer(DependenceTracer<B> tracer) {
      this.tracer = checkNotNull(tracer);
      return this;
    }

    /** Whether to canonicalize the graph. Without regions the raw dependences are returned. */
    @CanIgnoreReturnValue
    public Builder<B> setInsertRegions(boolean insertRegions) {
      this.insertRegions = insertRegions;
      return this;
    }

    public ControlDependenceGraph<B> computeCdg() {
      checkNotNull(cfg, "Need to call setControlFlow()");
      checkNotNull(pdt, "Need to call setPostDominatorTree()");
      ControlDependenceAnalysis<B> cda = new ControlDependenceAnalysis<>(cfg, pdt, tracer);
      return insertRegions ? cda.graphForFunction() : cda.computeDependencies();
    }
  }

  public static <B> Builder<B> builder() {
    return new Builder<>();
  }

  /**
   * Classifies the control flow edge {@code from -> to} by the terminator of {@code from}.
   *
   * @throws IllegalArgumentException if {@code to} is not a successor of {@code from}.
   */
  public static <B> EdgeType classify(ControlFlowView<B> cfg, B from, B to) {
    checkArgument(
        Iterables.contains(cfg.getSuccessors(from), to),
        "Asking for edge type between unconnected basic blocks %s and %s",
        from,
        to);
    Terminator<B> terminator = cfg.getTerminator(from);
    if (!terminator.isConditional()) {
      return EdgeType.OTHER;
    }
    if (terminator.getTrueTarget().equals(to)) {
      return EdgeType.TRUE;
    }
    checkArgument(
        terminator.getFalseTarget().equals(to),
        "%s is a successor of %s but not a target of its branch",
        to,
        from);
    return EdgeType.FALSE;
  }

  /** Builds the graph and canonicalizes it. */
  ControlDependenceGraph<B> graphForFunction() {
    computeDependencies();
    insertRegions();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(
          "Computed control dependence graph with "
              + cdg.getNodeCount()
              + " nodes for "
              + Iterables.size(cfg.getBlocks())
              + " blocks");
    }
    return cdg;
  }

  /**
   * Creates a node per block and connects each block to the branches it depends on. The result
   * may have several true or false children per node, and self-dependent loop headers.
   */
  @CanIgnoreReturnValue
  ControlDependenceGraph<B> computeDependencies() {
    cdg = new ControlDependenceGraph<>();
    for (B block : cfg.getBlocks()) {
      cdg.createBlockNode(block);
    }

    for (B a : cfg.getBlocks()) {
      ControlDependenceNode<B> aNode = cdg.getNode(a);
      if (pdt.getNode(a) == null) {
        // Blocks that never reach the exit have no post-dominators to bound the walk.
        continue;
      }
      for (B b : cfg.getSuccessors(a)) {
        TreeNode<B> bTreeNode = pdt.getNode(b);
        if (bTreeNode == null || (!a.equals(b) && pdt.dominates(b, a))) {
          continue;
        }
        TreeNode<B> lca = pdt.findNearestCommonDominator(a, b);
        EdgeType type = classify(cfg, a, b);
        tracer.edgeClassified(a, b, type);

        if (a.equals(lca.getBlock())) {
          addDependence(aNode, type, aNode);
        }
        for (TreeNode<B> cur = bTreeNode; cur != null && cur != lca; cur = cur.getIDom()) {
          B dependent = cur.getBlock();
          checkState(dependent != null, "Walked past the exit from %s to %s", b, lca.getBlock());
          addDependence(aNode, type, nodeFor(dependent));
        }
      }
    }

    // The blocks that always run once the function is entered depend on the entry.
    ControlDependenceNode<B> root = cdg.getRoot();
    for (TreeNode<B> cur = pdt.getNode(cfg.getEntry()); cur != null; cur = cur.getIDom()) {
      if (cur.getBlock() != null) {
        addDependence(root, EdgeType.OTHER, nodeFor(cur.getBlock()));
      }
    }
    return cdg;
  }

  /**
   * Groups the nodes with the same dependences under a shared region, then makes sure that no
   * block has more than one true child or more than one false child. Running this again on a
   * graph it has already processed leaves the graph unchanged.
   */
  void insertRegions() {
    checkState(cdg != null, "Need to compute dependencies first");
    Map<DependenceSignature<B>, ControlDependenceNode<B>> regions = new HashMap<>();

    for (TreeNode<B> treeNode : pdt.postOrder()) {
      B block = treeNode.getBlock();
      if (block == null) {
        continue;
      }
      ControlDependenceNode<B> node = nodeFor(block);
      DependenceSignature<B> signature = DependenceSignature.of(node);
      // Nodes that hang off a single region, the root included, are already grouped.
      if (signature.isEmpty() || signature.getEnclosingRegion() != null) {
        continue;
      }

      ControlDependenceNode<B> region = regions.get(signature);
      if (region == null) {
        region = cdg.createRegion();
        for (Dependence<B> dependence : signature.getDependences()) {
          dependence.getParent().addChild(dependence.getType(), region);
        }
        regions.put(signature, region);
        tracer.regionCreated(region, signature);
      }

      node.detachFromParents();
      region.addChild(EdgeType.OTHER, node);
      tracer.regionMerged(region, node);
    }

    for (ControlDependenceNode<B> node : ImmutableList.copyOf(cdg.getNodes())) {
      if (node.isRegion()) {
        continue;
      }
      splitFanOut(node, EdgeType.TRUE);
      splitFanOut(node, EdgeType.FALSE);
    }
  }

  /** Moves the {@code type} children of {@code node} under a new region if there are several. */
  private void splitFanOut(ControlDependenceNode<B> node, EdgeType type) {
    ImmutableList<ControlDependenceNode<B>> children = ImmutableList.copyOf(node.getChildren(type));
    if (children.size() <= 1) {
      return;
    }
    ControlDependenceNode<B> region = cdg.createRegion();
    for (ControlDependenceNode<B> child : children) {
      node.removeChild(type, child);
      region.addChild(EdgeType.OTHER, child);
    }
    node.addChild(type, region);
    tracer.fanOutSplit(node, type, region);
  }

  private void addDependence(
      ControlDependenceNode<B> parent, EdgeType type, ControlDependenceNode<B> child) {
    parent.addChild(type, child);
    tracer.dependenceAdded(parent, type, child);
  }

  private ControlDependenceNode<B> nodeFor(B block) {
    ControlDependenceNode<B> node = cdg.getNode(block);
    checkState(node != null, "Post-dominator tree block %s is not in the function", block);
    return node;
  }
}
