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
import static com.google.common.base.Throwables.throwIfUnchecked;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The control dependence graphs of the functions of a compilation unit, one per function.
 *
 * <p>Graphs are built on demand by {@link #getGraph}, or ahead of time by {@link #computeAll}.
 * The graphs of different functions share nothing, so {@link #computeAll} builds them on several
 * threads when {@link ControlDependenceOptions#getNumThreads} allows it.
 *
 * @param <F> The function type.
 * @param <B> The basic block type.
 */
public final class ControlDependenceGraphs<F, B> {

  private static final Logger logger = Logger.getLogger(ControlDependenceGraphs.class.getName());

  /** Supplies the inputs of the analysis for each function. */
  public interface FunctionSource<F, B> {
    ControlFlowView<B> getControlFlow(F function);

    PostDominatorTree<B> getPostDominatorTree(F function);

    /** Whether {@code function} is only declared here and has no body to analyze. */
    boolean isDeclaration(F function);
  }

  private final FunctionSource<F, B> source;
  private final ControlDependenceOptions options;
  private final ConcurrentMap<F, ControlDependenceGraph<B>> graphs = new ConcurrentHashMap<>();

  public ControlDependenceGraphs(FunctionSource<F, B> source, ControlDependenceOptions options) {
    this.source = checkNotNull(source);
    this.options = checkNotNull(options);
  }

  /**
   * Returns the graph of {@code function}, building it first if needed.
   *
   * @throws IllegalArgumentException if the function is a declaration.
   */
  public ControlDependenceGraph<B> getGraph(F function) {
    checkArgument(!source.isDeclaration(function), "%s has no body", function);
    return graphs.computeIfAbsent(function, this::build);
  }

  /** Returns the graph of {@code function} if it was already built. */
  public @Nullable ControlDependenceGraph<B> getGraphIfPresent(F function) {
    return graphs.get(function);
  }

  /** The graphs built so far. */
  public ImmutableMap<F, ControlDependenceGraph<B>> getGraphs() {
    return ImmutableMap.copyOf(graphs);
  }

  /**
   * Builds the graphs of every function that has a body and was not built yet. A graph that
   * {@link #getGraph} publishes in the meantime is kept.
   */
  public void computeAll(Iterable<F> functions) {
    List<F> pending = new ArrayList<>();
    for (F function : functions) {
      if (!source.isDeclaration(function) && !graphs.containsKey(function)) {
        pending.add(function);
      }
    }
    logger.fine("Building " + pending.size() + " control dependence graphs");

    if (options.getNumThreads() == 1 || pending.size() <= 1) {
      for (F function : pending) {
        graphs.putIfAbsent(function, build(function));
      }
      return;
    }

    List<ControlDependenceGraph<B>> results = buildInParallel(pending);
    for (int i = 0; i < pending.size(); i++) {
      graphs.putIfAbsent(pending.get(i), results.get(i));
    }
  }

  private List<ControlDependenceGraph<B>> buildInParallel(List<F> functions) {
    ThreadFactory threadFactory =
        new ThreadFactory() {
          @Override
          public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "ControlDependenceGraphs");
            t.setDaemon(true); // Do not prevent the JVM from exiting.
            return t;
          }
        };
    int numThreads = Math.min(options.getNumThreads(), functions.size());
    ThreadPoolExecutor poolExecutor =
        new ThreadPoolExecutor(
            numThreads,
            numThreads,
            Integer.MAX_VALUE,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<Runnable>(),
            threadFactory);
    ListeningExecutorService executorService = MoreExecutors.listeningDecorator(poolExecutor);
    List<ListenableFuture<ControlDependenceGraph<B>>> futureList =
        new ArrayList<>(functions.size());
    for (final F function : functions) {
      futureList.add(executorService.submit(() -> build(function)));
    }

    poolExecutor.shutdown();
    try {
      return ImmutableList.copyOf(Futures.allAsList(futureList).get());
    } catch (ExecutionException e) {
      throwIfUnchecked(e.getCause());
      throw new RuntimeException(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException(e);
    }
  }

  private ControlDependenceGraph<B> build(F function) {
    DependenceTracer<B> tracer =
        options.shouldTraceConstruction()
            ? new LoggingDependenceTracer<B>()
            : DependenceTracer.<B>none();
    return ControlDependenceAnalysis.<B>builder()
        .setControlFlow(source.getControlFlow(function))
        .setPostDominatorTree(source.getPostDominatorTree(function))
        .setTracer(tracer)
        .setInsertRegions(options.shouldInsertRegions())
        .computeCdg();
  }
}
