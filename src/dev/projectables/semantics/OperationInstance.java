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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The receiver of a member reference or invocation.
 *
 * @param type The type of the receiver
 * @param isImplicit Whether the receiver was left out of the syntax, as in a bare {@code Total}
 *     inside a member of the declaring type
 */
public record OperationInstance(TypeSymbol type, boolean isImplicit) {
  public OperationInstance {
    checkNotNull(type, "type");
  }

  public static OperationInstance implicit(TypeSymbol type) {
    return new OperationInstance(type, true);
  }

  public static OperationInstance explicit(TypeSymbol type) {
    return new OperationInstance(type, false);
  }
}
