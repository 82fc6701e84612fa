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

import com.google.controldeps.ControlDependenceNode.EdgeType;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests {@link ControlDependenceNode}. */
@RunWith(JUnit4.class)
public final class ControlDependenceNodeTest {

  private ControlDependenceGraph<String> graph;
  private ControlDependenceNode<String> a;
  private ControlDependenceNode<String> b;
  private ControlDependenceNode<String> c;

  @Before
  public void setUp() {
    graph = new ControlDependenceGraph<>();
    a = graph.createBlockNode("a");
    b = graph.createBlockNode("b");
    c = graph.createBlockNode("c");
  }

  @Test
  public void testRegionHasNoBlock() {
    ControlDependenceNode<String> region = graph.createRegion();
    assertThat(region.isRegion()).isTrue();
    assertThat(region.getBlock()).isNull();
    assertThat(region.toString()).isEqualTo("REGION#" + region.getId());
    assertThat(a.isRegion()).isFalse();
    assertThat(a.toString()).isEqualTo("a");
  }

  @Test
  public void testAddChildLinksParent() {
    a.addChild(EdgeType.TRUE, b);
    assertThat(a.getTrueChildren()).containsExactly(b);
    assertThat(b.getParents()).containsExactly(a);
    assertThat(a.getEdgeTypes(b)).containsExactly(EdgeType.TRUE);
  }

  @Test
  public void testChildrenAreDeduplicated() {
    assertThat(a.addChild(EdgeType.OTHER, b)).isTrue();
    assertThat(a.addChild(EdgeType.OTHER, b)).isFalse();
    assertThat(a.getOtherChildren()).hasSize(1);
    assertThat(a.getNumChildren()).isEqualTo(1);
  }

  @Test
  public void testParentLinkSurvivesUntilLastEdgeIsRemoved() {
    a.addChild(EdgeType.TRUE, b);
    a.addChild(EdgeType.OTHER, b);
    assertThat(a.getEdgeTypes(b)).containsExactly(EdgeType.TRUE, EdgeType.OTHER).inOrder();
    assertThat(a.getChildren()).containsExactly(b);

    assertThat(a.removeChild(EdgeType.TRUE, b)).isTrue();
    assertThat(b.getParents()).containsExactly(a);

    assertThat(a.removeChild(EdgeType.FALSE, b)).isFalse();
    assertThat(b.getParents()).containsExactly(a);

    assertThat(a.removeChild(EdgeType.OTHER, b)).isTrue();
    assertThat(b.getParents()).isEmpty();
    assertThat(a.hasChild(b)).isFalse();
  }

  @Test
  public void testSelfEdge() {
    a.addChild(EdgeType.FALSE, a);
    assertThat(a.getFalseChildren()).containsExactly(a);
    assertThat(a.getParents()).containsExactly(a);
    a.detachFromParents();
    assertThat(a.getFalseChildren()).isEmpty();
    assertThat(a.getParents()).isEmpty();
  }

  @Test
  public void testDetachFromParents() {
    a.addChild(EdgeType.TRUE, c);
    b.addChild(EdgeType.FALSE, c);
    b.addChild(EdgeType.OTHER, c);
    c.detachFromParents();
    assertThat(c.getParents()).isEmpty();
    assertThat(a.hasChild(c)).isFalse();
    assertThat(b.hasChild(c)).isFalse();
  }

  @Test
  public void testBinaryAccessors() {
    assertThat(a.getTrue()).isNull();
    assertThat(a.getFalse()).isNull();
    assertThat(a.isBinary()).isFalse();

    a.addChild(EdgeType.TRUE, b);
    a.addChild(EdgeType.FALSE, c);
    assertThat(a.getTrue()).isSameInstanceAs(b);
    assertThat(a.getFalse()).isSameInstanceAs(c);
    assertThat(a.isBinary()).isTrue();

    a.addChild(EdgeType.TRUE, c);
    assertThat(a.isBinary()).isFalse();
    assertThrows(IllegalStateException.class, () -> a.getTrue());
  }

  @Test
  public void testEnclosingRegion() {
    ControlDependenceNode<String> region = graph.createRegion();
    region.addChild(EdgeType.OTHER, a);
    assertThat(a.enclosingRegion()).isSameInstanceAs(region);
    assertThat(region.enclosingRegion()).isSameInstanceAs(region);
  }

  @Test
  public void testEnclosingRegionRequiresSingleParent() {
    assertThrows(IllegalStateException.class, () -> a.enclosingRegion());

    ControlDependenceNode<String> region = graph.createRegion();
    region.addChild(EdgeType.OTHER, a);
    b.addChild(EdgeType.TRUE, a);
    assertThrows(IllegalStateException.class, () -> a.enclosingRegion());
  }

  @Test
  public void testEnclosingRegionRequiresRegionParent() {
    b.addChild(EdgeType.TRUE, a);
    assertThrows(IllegalStateException.class, () -> a.enclosingRegion());
  }

  @Test
  public void testChildViewsAreReadOnly() {
    assertThrows(UnsupportedOperationException.class, () -> a.getTrueChildren().add(b));
    assertThrows(UnsupportedOperationException.class, () -> a.getParents().add(b));
  }
}
