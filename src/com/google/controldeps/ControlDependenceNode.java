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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A node of a {@link ControlDependenceGraph}.
 *
 * <p>A node either stands for a basic block, or it is a region: a synthetic node with no block
 * that groups the nodes sharing the same control dependences. Children are kept in three sets,
 * one per {@link EdgeType}. A node is in the parent set of each of its children for as long as
 * it holds that child under at least one edge type.
 *
 * <p>Nodes may be their own parent and child; a loop header that decides whether it runs again
 * is control dependent on itself.
 *
 * @param <B> The basic block type.
 */
public final class ControlDependenceNode<B> {

  /** How a control dependence edge leaves its source node. */
  public static enum EdgeType {
    /** The child runs if the branch of the parent is taken. */
    TRUE,
    /** The child runs if the branch of the parent is not taken. */
    FALSE,
    /** Non-branching dependence, e.g. on a switch, or membership in a region. */
    OTHER;
  }

  private final int id;
  private final @Nullable B block;

  private final Set<ControlDependenceNode<B>> trueChildren = new LinkedHashSet<>();
  private final Set<ControlDependenceNode<B>> falseChildren = new LinkedHashSet<>();
  private final Set<ControlDependenceNode<B>> otherChildren = new LinkedHashSet<>();
  private final Set<ControlDependenceNode<B>> parents = new LinkedHashSet<>();

  /**
   * Nodes are only created by the graph that owns them.
   *
   * @param id Identifier, unique within the owning graph.
   * @param block The basic block, or null for a region.
   */
  ControlDependenceNode(int id, @Nullable B block) {
    this.id = id;
    this.block = block;
  }

  public int getId() {
    return id;
  }

  /** The basic block of this node, or null if this is a region. */
  public @Nullable B getBlock() {
    return block;
  }

  public boolean isRegion() {
    return block == null;
  }

  public Set<ControlDependenceNode<B>> getTrueChildren() {
    return Collections.unmodifiableSet(trueChildren);
  }

  public Set<ControlDependenceNode<B>> getFalseChildren() {
    return Collections.unmodifiableSet(falseChildren);
  }

  public Set<ControlDependenceNode<B>> getOtherChildren() {
    return Collections.unmodifiableSet(otherChildren);
  }

  public Set<ControlDependenceNode<B>> getChildren(EdgeType type) {
    return Collections.unmodifiableSet(childrenOf(type));
  }

  /** All children regardless of edge type: true children first, then false, then other. */
  public ImmutableSet<ControlDependenceNode<B>> getChildren() {
    return ImmutableSet.<ControlDependenceNode<B>>builder()
        .addAll(trueChildren)
        .addAll(falseChildren)
        .addAll(otherChildren)
        .build();
  }

  public Set<ControlDependenceNode<B>> getParents() {
    return Collections.unmodifiableSet(parents);
  }

  public int getNumParents() {
    return parents.size();
  }

  public int getNumChildren() {
    return getChildren().size();
  }

  /**
   * Returns the only child reached when the branch is taken, or null if there is none.
   *
   * @throws IllegalStateException if there is more than one, which can only happen before regions
   *     are inserted.
   */
  public @Nullable ControlDependenceNode<B> getTrue() {
    checkState(trueChildren.size() <= 1, "%s has %s true children", this, trueChildren.size());
    return Iterables.getOnlyElement(trueChildren, null);
  }

  /**
   * Returns the only child reached when the branch is not taken, or null if there is none.
   *
   * @throws IllegalStateException if there is more than one, which can only happen before regions
   *     are inserted.
   */
  public @Nullable ControlDependenceNode<B> getFalse() {
    checkState(falseChildren.size() <= 1, "%s has %s false children", this, falseChildren.size());
    return Iterables.getOnlyElement(falseChildren, null);
  }

  /** Whether this node has exactly one true child and exactly one false child. */
  public boolean isBinary() {
    return trueChildren.size() == 1 && falseChildren.size() == 1;
  }

  public boolean hasChild(ControlDependenceNode<B> child) {
    return trueChildren.contains(child)
        || falseChildren.contains(child)
        || otherChildren.contains(child);
  }

  /** Every edge type under which {@code child} hangs off this node. */
  public ImmutableList<EdgeType> getEdgeTypes(ControlDependenceNode<B> child) {
    ImmutableList.Builder<EdgeType> types = ImmutableList.builder();
    for (EdgeType type : EdgeType.values()) {
      if (childrenOf(type).contains(child)) {
        types.add(type);
      }
    }
    return types.build();
  }

  /**
   * Returns the region this node belongs to: the node itself if it is a region, otherwise its
   * only parent.
   *
   * @throws IllegalStateException if a block node does not have exactly one parent or if that
   *     parent is not a region.
   */
  public ControlDependenceNode<B> enclosingRegion() {
    if (isRegion()) {
      return this;
    }
    checkState(parents.size() == 1, "%s has %s parents, expected one region", this, parents.size());
    ControlDependenceNode<B> region = parents.iterator().next();
    checkState(region.isRegion(), "Parent %s of %s is not a region", region, this);
    return region;
  }

  /**
   * Adds {@code child} under {@code type} and records this node as its parent.
   *
   * @return whether the edge is new.
   */
  @CanIgnoreReturnValue
  boolean addChild(EdgeType type, ControlDependenceNode<B> child) {
    checkNotNull(child);
    boolean added = childrenOf(type).add(child);
    child.parents.add(this);
    return added;
  }

  /**
   * Removes the {@code type} edge to {@code child}. The parent link goes away once no edge of any
   * type is left between the two nodes.
   *
   * @return whether there was such an edge.
   */
  @CanIgnoreReturnValue
  boolean removeChild(EdgeType type, ControlDependenceNode<B> child) {
    boolean removed = childrenOf(type).remove(child);
    if (!hasChild(child)) {
      child.parents.remove(this);
    }
    return removed;
  }

  /** Removes every edge from every parent to this node. */
  void detachFromParents() {
    for (ControlDependenceNode<B> parent : ImmutableList.copyOf(parents)) {
      for (EdgeType type : EdgeType.values()) {
        parent.removeChild(type, this);
      }
    }
  }

  private Set<ControlDependenceNode<B>> childrenOf(EdgeType type) {
    switch (type) {
      case TRUE:
        return trueChildren;
      case FALSE:
        return falseChildren;
      case OTHER:
        return otherChildren;
    }
    throw new AssertionError("Unknown edge type " + type);
  }

  @Override
  public String toString() {
    return isRegion() ? "REGION#" + id : String.valueOf(block);
  }
}
