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
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link ControlDependenceOptions} and {@link Terminator}. */
@RunWith(JUnit4.class)
public final class ControlDependenceOptionsTest {

  @Test
  public void testDefaults() {
    ControlDependenceOptions options = new ControlDependenceOptions();
    assertThat(options.getNumThreads()).isEqualTo(1);
    assertThat(options.shouldInsertRegions()).isTrue();
    assertThat(options.shouldTraceConstruction()).isFalse();
  }

  @Test
  public void testRejectsNonPositiveThreadCount() {
    ControlDependenceOptions options = new ControlDependenceOptions();
    assertThrows(IllegalArgumentException.class, () -> options.setNumThreads(0));
    assertThrows(IllegalArgumentException.class, () -> options.setNumThreads(-2));
    options.setNumThreads(8);
    assertThat(options.getNumThreads()).isEqualTo(8);
  }

  @Test
  public void testConditionalTerminator() {
    Terminator<String> t = Terminator.conditional("then", "else");
    assertThat(t.isConditional()).isTrue();
    assertThat(t.getTrueTarget()).isEqualTo("then");
    assertThat(t.getFalseTarget()).isEqualTo("else");
    assertThat(t).isEqualTo(Terminator.conditional("then", "else"));
    assertThat(t.toString()).isEqualTo("Conditional{true=then, false=else}");
  }

  @Test
  public void testOtherTerminator() {
    Terminator<String> t = Terminator.other();
    assertThat(t.isConditional()).isFalse();
    assertThat(t).isSameInstanceAs(Terminator.<Integer>other());
    assertThrows(IllegalStateException.class, () -> t.getTrueTarget());
    assertThrows(NullPointerException.class, () -> Terminator.conditional("then", null));
  }
}
