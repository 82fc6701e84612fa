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

import java.io.Serializable;

/** Options for building the control dependence graphs of a compilation unit. */
public class ControlDependenceOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Number of threads used to build the graphs of different functions. */
  private int numThreads = 1;

  /** Whether graphs are canonicalized with region nodes. */
  private boolean insertRegions = true;

  /** Whether each construction step is logged. */
  private boolean traceConstruction = false;

  public ControlDependenceOptions() {}

  public int getNumThreads() {
    return numThreads;
  }

  public void setNumThreads(int numThreads) {
    checkArgument(numThreads > 0, "Need at least one thread, got %s", numThreads);
    this.numThreads = numThreads;
  }

  public boolean shouldInsertRegions() {
    return insertRegions;
  }

  public void setInsertRegions(boolean insertRegions) {
    this.insertRegions = insertRegions;
  }

  public boolean shouldTraceConstruction() {
    return traceConstruction;
  }

  public void setTraceConstruction(boolean traceConstruction) {
    this.traceConstruction = traceConstruction;
  }
}
