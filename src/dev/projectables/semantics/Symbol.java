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

import org.jspecify.annotations.Nullable;

/** A named entity that a piece of syntax can resolve to. */
public interface Symbol {

  SymbolKind getKind();

  String getName();

  /** The type declaring this symbol, or null for namespaces, top-level types and locals. */
  @Nullable TypeSymbol getContainingType();
}
