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

/** A read of a property or field, or a reference to a method group. */
public record MemberReferenceOperation(MemberSymbol member, @Nullable OperationInstance instance)
    implements Operation {
  public MemberReferenceOperation {
    checkArgument(
        (instance == null) == member.isStatic(),
        "Static members have no instance and instance members need one: %s",
        member);
  }

  @Override
  public @Nullable OperationInstance getInstance() {
    return instance;
  }

  @Override
  public MemberSymbol getMember() {
    return member;
  }
}
