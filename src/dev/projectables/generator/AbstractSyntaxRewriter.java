/*
 * Copyright 2025 The Projectables Authors.
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

package dev.projectables.generator;

import com.google.common.collect.ImmutableList;
import dev.projectables.syntax.Node;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import org.jspecify.annotations.Nullable;

/**
 * Base class for rewriters that map a syntax tree to a new one.
 *
 * <p>{@link #visit} dispatches to {@link #transform}, whose default rebuilds the node from its
 * rewritten children. Subclasses override {@link #transform} with a switch over the node's token
 * and fall back to {@link #visitChildren} for the kinds they leave alone. Nodes that do not
 * change come back as the same instance.
 */
abstract class AbstractSyntaxRewriter {

  /** The nodes being visited, innermost first. */
  private final Deque<Node> ancestors = new ArrayDeque<>();

  /** Returns the rewritten form of {@code n}. */
  final Node visit(Node n) {
    ancestors.push(n);
    try {
      return transform(n);
    } finally {
      ancestors.pop();
    }
  }

  /** Rewrites the node on top of the visit stack. */
  protected Node transform(Node n) {
    return visitChildren(n);
  }

  protected final Node visitChildren(Node n) {
    if (!n.hasChildren()) {
      return n;
    }
    ImmutableList.Builder<Node> children = ImmutableList.builderWithExpectedSize(n.getChildCount());
    for (Node child : n.children()) {
      children.add(visit(child));
    }
    return n.withChildren(children.build());
  }

  /**
   * Returns the node that led the traversal to the node being rewritten, or null at the root.
   * This is the syntactic parent unless a subclass visited a deeper descendant directly.
   */
  protected final @Nullable Node getParent() {
    return getAncestor(1);
  }

  protected final @Nullable Node getGrandparent() {
    return getAncestor(2);
  }

  private @Nullable Node getAncestor(int level) {
    Iterator<Node> it = ancestors.iterator();
    for (int i = 0; i < level; i++) {
      if (!it.hasNext()) {
        return null;
      }
      it.next();
    }
    return it.hasNext() ? it.next() : null;
  }
}
