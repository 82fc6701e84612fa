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

import org.jspecify.annotations.Nullable;

/**
 * The post-dominator tree of a function.
 *
 * <p>The parent of a block in this tree is its immediate post-dominator. The tree may be topped
 * by a virtual exit node that carries no block, which joins the real exits of a function with
 * several of them.
 *
 * @param <B> The basic block type.
 */
public interface PostDominatorTree<B> {

  /** A node of the post-dominator tree. */
  interface TreeNode<B> {
    /** The block of this node, or null for the virtual exit. */
    @Nullable B getBlock();

    /** The immediate post-dominator, or null at the top of the tree. */
    @Nullable TreeNode<B> getIDom();
  }

  /** The top of the tree. */
  TreeNode<B> getRoot();

  /** The tree node of {@code block}, or null if the block is not part of the tree. */
  @Nullable TreeNode<B> getNode(B block);

  /** Whether every path from {@code b} to the function exit passes through {@code a}. */
  boolean dominates(B a, B b);

  /** The deepest tree node that post-dominates both {@code a} and {@code b}. */
  TreeNode<B> findNearestCommonDominator(B a, B b);

  /** All tree nodes, each one after all of its children. The virtual exit comes last. */
  Iterable<TreeNode<B>> postOrder();
}
