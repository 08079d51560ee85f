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

/** The declaration kind of a {@link TypeSymbol}. */
public enum TypeKind {
  CLASS,
  STRUCT,
  INTERFACE,
  ENUM,
  DELEGATE,
  ARRAY;

  /** Whether values of this kind are value types, for which {@code T?} is a distinct type. */
  public boolean isValueType() {
    return this == STRUCT || this == ENUM;
  }
}
