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

package dev.projectables.semantics;

import dev.projectables.syntax.Node;
import org.jspecify.annotations.Nullable;

/**
 * Answers what a node of an original, un-rewritten syntax tree means.
 *
 * <p>Lookups are keyed by node identity. Nodes synthesized while rewriting are unknown to the
 * model; callers must only ask about nodes of the tree the model was built for. Every method
 * returns null when the answer is not known.
 */
public interface SemanticModel {

  /**
   * The symbol a name, member access, invocation or type syntax refers to. For an invocation of
   * an extension method, the symbol is an extension method only when the call is written with
   * instance syntax; called on its declaring type, it is an ordinary static method.
   */
  @Nullable Symbol getSymbol(Node n);

  /** The natural type of an expression, or the type denoted by type syntax. */
  @Nullable TypeSymbol getType(Node n);

  /** The type of an expression after the implicit conversion applied by its context. */
  @Nullable TypeSymbol getConvertedType(Node n);

  /** The member reference or invocation a node stands for. */
  @Nullable Operation getOperation(Node n);
}
