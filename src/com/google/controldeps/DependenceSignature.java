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

import com.google.common.collect.ImmutableSet;
import com.google.controldeps.ControlDependenceNode.EdgeType;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The set of (edge type, parent) pairs through which a node is reached. Nodes with equal
 * signatures execute under exactly the same conditions and are grouped under one region.
 *
 * @param <B> The basic block type.
 */
public final class DependenceSignature<B> {

  /** One incoming control dependence edge. */
  public static final class Dependence<B> {
    private final EdgeType type;
    private final ControlDependenceNode<B> parent;

    Dependence(EdgeType type, ControlDependenceNode<B> parent) {
      this.type = checkNotNull(type);
      this.parent = checkNotNull(parent);
    }

    public EdgeType getType() {
      return type;
    }

    public ControlDependenceNode<B> getParent() {
      return parent;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof Dependence)) {
        return false;
      }
      Dependence<?> that = (Dependence<?>) other;
      return type == that.type && parent == that.parent;
    }

    @Override
    public int hashCode() {
      return Objects.hash(type, parent);
    }

    @Override
    public String toString() {
      return type + "<-" + parent;
    }
  }

  private final ImmutableSet<Dependence<B>> dependences;

  private DependenceSignature(ImmutableSet<Dependence<B>> dependences) {
    this.dependences = dependences;
  }

  /** The signature of {@code node} in the current state of the graph. */
  static <B> DependenceSignature<B> of(ControlDependenceNode<B> node) {
    ImmutableSet.Builder<Dependence<B>> dependences = ImmutableSet.builder();
    for (ControlDependenceNode<B> parent : node.getParents()) {
      for (EdgeType type : parent.getEdgeTypes(node)) {
        dependences.add(new Dependence<>(type, parent));
      }
    }
    return new DependenceSignature<>(dependences.build());
  }

  public ImmutableSet<Dependence<B>> getDependences() {
    return dependences;
  }

  public boolean isEmpty() {
    return dependences.isEmpty();
  }

  /**
   * If this signature is a single other edge from a region, returns that region. Nodes with such
   * a signature are already grouped.
   */
  @Nullable ControlDependenceNode<B> getEnclosingRegion() {
    if (dependences.size() != 1) {
      return null;
    }
    Dependence<B> only = dependences.iterator().next();
    return only.type == EdgeType.OTHER && only.parent.isRegion() ? only.parent : null;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof DependenceSignature
        && dependences.equals(((DependenceSignature<?>) other).dependences);
  }

  @Override
  public int hashCode() {
    return dependences.hashCode();
  }

  @Override
  public String toString() {
    return dependences.toString();
  }
}
