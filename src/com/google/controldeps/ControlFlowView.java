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

/**
 * Read-only view of the control flow graph of a single function, at basic block granularity.
 *
 * <p>Blocks are compared with {@code equals}. Every block returned by {@link #getSuccessors} must
 * also be returned by {@link #getBlocks}.
 *
 * @param <B> The basic block type.
 */
public interface ControlFlowView<B> {

  /** The block where execution of the function starts. */
  B getEntry();

  /** All blocks of the function, entry included. */
  Iterable<B> getBlocks();

  /** The blocks that {@code block} can transfer control to directly. */
  Iterable<B> getSuccessors(B block);

  /** How the last instruction of {@code block} transfers control. */
  Terminator<B> getTerminator(B block);
}
