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

import static com.google.common.base.Preconditions.checkArgument;

import org.jspecify.annotations.Nullable;

/**
 * A lambda parameter, a pattern variable or another variable local to the expression body.
 *
 * @param kind Either {@link SymbolKind#LOCAL} or {@link SymbolKind#PARAMETER}
 * @param type The declared type, or null when it is inferred and unknown
 */
public record LocalSymbol(SymbolKind kind, String name, @Nullable TypeSymbol type)
    implements Symbol {
  public LocalSymbol {
    checkArgument(kind == SymbolKind.LOCAL || kind == SymbolKind.PARAMETER, kind);
  }

  public static LocalSymbol parameter(String name, @Nullable TypeSymbol type) {
    return new LocalSymbol(SymbolKind.PARAMETER, name, type);
  }

  public static LocalSymbol local(String name, @Nullable TypeSymbol type) {
    return new LocalSymbol(SymbolKind.LOCAL, name, type);
  }

  @Override
  public SymbolKind getKind() {
    return kind;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public @Nullable TypeSymbol getContainingType() {
    return null;
  }
}
