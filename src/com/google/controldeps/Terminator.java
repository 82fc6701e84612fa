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

import com.google.common.base.MoreObjects;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Classification of the instruction that ends a basic block.
 *
 * <p>A terminator is either a conditional branch with a true target and a false target, or
 * anything else (unconditional jumps, switches, returns, throws). The classification is decided
 * once per block by the {@link ControlFlowView} and never re-derived at the use site.
 *
 * @param <B> The basic block type.
 */
public final class Terminator<B> {

  @SuppressWarnings("rawtypes")
  private static final Terminator OTHER = new Terminator<>(null, null);

  private final @Nullable B trueTarget;
  private final @Nullable B falseTarget;

  private Terminator(@Nullable B trueTarget, @Nullable B falseTarget) {
    this.trueTarget = trueTarget;
    this.falseTarget = falseTarget;
  }

  /** A conditional branch that goes to {@code trueTarget} or to {@code falseTarget}. */
  public static <B> Terminator<B> conditional(B trueTarget, B falseTarget) {
    return new Terminator<>(checkNotNull(trueTarget), checkNotNull(falseTarget));
  }

  /** Any terminator that is not a two-way conditional branch. */
  @SuppressWarnings("unchecked")
  public static <B> Terminator<B> other() {
    return (Terminator<B>) OTHER;
  }

  public boolean isConditional() {
    return trueTarget != null;
  }

  public B getTrueTarget() {
    checkState(isConditional(), "Not a conditional branch");
    return trueTarget;
  }

  public B getFalseTarget() {
    checkState(isConditional(), "Not a conditional branch");
    return falseTarget;
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Terminator)) {
      return false;
    }
    Terminator<?> that = (Terminator<?>) other;
    return Objects.equals(trueTarget, that.trueTarget)
        && Objects.equals(falseTarget, that.falseTarget);
  }

  @Override
  public int hashCode() {
    return Objects.hash(trueTarget, falseTarget);
  }

  @Override
  public String toString() {
    if (!isConditional()) {
      return "Other";
    }
    return MoreObjects.toStringHelper("Conditional")
        .add("true", trueTarget)
        .add("false", falseTarget)
        .toString();
  }
}
