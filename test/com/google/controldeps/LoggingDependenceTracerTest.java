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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link LoggingDependenceTracer}. */
@RunWith(JUnit4.class)
public final class LoggingDependenceTracerTest {

  private final Logger logger = Logger.getLogger(LoggingDependenceTracerTest.class.getName());
  private final List<String> messages = new ArrayList<>();

  private final Handler handler =
      new Handler() {
        private final SimpleFormatter formatter = new SimpleFormatter();

        @Override
        public void publish(LogRecord record) {
          messages.add(formatter.formatMessage(record));
        }

        @Override
        public void flush() {}

        @Override
        public void close() {}
      };

  @Before
  public void setUp() {
    logger.setUseParentHandlers(false);
    logger.setLevel(Level.FINEST);
    handler.setLevel(Level.FINEST);
    logger.addHandler(handler);
  }

  @After
  public void tearDown() {
    logger.removeHandler(handler);
  }

  @Test
  public void testLogsConstructionSteps() {
    FakeFunction f =
        new FakeFunction("straightLineThen")
            .jump("entry", "cond")
            .branch("cond", "A", "merge")
            .jump("A", "B")
            .jump("B", "merge")
            .exit("merge");
    ControlDependenceAnalysis.<String>builder()
        .setControlFlow(f)
        .setPostDominatorTree(SimplePostDominatorTree.compute(f))
        .setTracer(new LoggingDependenceTracer<String>(logger))
        .computeCdg();

    assertThat(messages)
        .containsAtLeast(
            "Edge cond -> A is TRUE",
            "A depends on cond (TRUE)",
            "B depends on cond (TRUE)",
            "Created REGION#6 for [TRUE<-cond]",
            "Moved A into REGION#6",
            "Moved B into REGION#6")
        .inOrder();
  }

  @Test
  public void testSilentAboveFinest() {
    logger.setLevel(Level.FINE);
    FakeFunction f = new FakeFunction("f").branch("entry", "a", "b").exit("a").exit("b");
    ControlDependenceAnalysis.<String>builder()
        .setControlFlow(f)
        .setPostDominatorTree(SimplePostDominatorTree.compute(f))
        .setTracer(new LoggingDependenceTracer<String>(logger))
        .computeCdg();

    assertThat(messages).isEmpty();
  }
}
