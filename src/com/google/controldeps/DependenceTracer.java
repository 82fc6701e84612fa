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

import com.google.controldeps.ControlDependenceNode.EdgeType;

/**
 * Receives the steps taken while a {@link ControlDependenceGraph} is built. Implementations must
 * not change the graph.
 *
 * @param <B> The basic block type.
 */
public interface DependenceTracer<B> {

  /** The control flow edge {@code from -> to} was classified as {@code type}. */
  default void edgeClassified(B from, B to, EdgeType type) {}

  /** {@code child} became control dependent on {@code parent}. */
  default void dependenceAdded(
      ControlDependenceNode<B> parent, EdgeType type, ControlDependenceNode<B> child) {}

  /** A region was created for the nodes with the given signature. */
  default void regionCreated(
      ControlDependenceNode<B> region, DependenceSignature<B> signature) {}

  /** {@code node} was moved under {@code region}. */
  default void regionMerged(ControlDependenceNode<B> region, ControlDependenceNode<B> node) {}

  /** The {@code type} children of {@code node} were moved under the new {@code region}. */
  default void fanOutSplit(
      ControlDependenceNode<B> node, EdgeType type, ControlDependenceNode<B> region) {}

  /** A tracer that ignores everything. */
  static <B> DependenceTracer<B> none() {
    return new DependenceTracer<B>() {};
  }
}
