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

import com.google.common.annotations.VisibleForTesting;
import com.google.controldeps.ControlDependenceNode.EdgeType;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Writes construction steps to a {@link Logger} at {@link Level#FINEST}. */
public final class LoggingDependenceTracer<B> implements DependenceTracer<B> {

  private static final Logger defaultLogger =
      Logger.getLogger(LoggingDependenceTracer.class.getName());

  private final Logger logger;

  public LoggingDependenceTracer() {
    this(defaultLogger);
  }

  @VisibleForTesting
  LoggingDependenceTracer(Logger logger) {
    this.logger = logger;
  }

  @Override
  public void edgeClassified(B from, B to, EdgeType type) {
    logger.log(Level.FINEST, "Edge {0} -> {1} is {2}", new Object[] {from, to, type});
  }

  @Override
  public void dependenceAdded(
      ControlDependenceNode<B> parent, EdgeType type, ControlDependenceNode<B> child) {
    logger.log(Level.FINEST, "{0} depends on {1} ({2})", new Object[] {child, parent, type});
  }

  @Override
  public void regionCreated(ControlDependenceNode<B> region, DependenceSignature<B> signature) {
    logger.log(Level.FINEST, "Created {0} for {1}", new Object[] {region, signature});
  }

  @Override
  public void regionMerged(ControlDependenceNode<B> region, ControlDependenceNode<B> node) {
    logger.log(Level.FINEST, "Moved {0} into {1}", new Object[] {node, region});
  }

  @Override
  public void fanOutSplit(
      ControlDependenceNode<B> node, EdgeType type, ControlDependenceNode<B> region) {
    logger.log(
        Level.FINEST, "Grouped {0} children of {1} under {2}", new Object[] {type, node, region});
  }
}
