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

package dev.projectables.syntax;

import static com.google.common.base.Preconditions.checkArgument;

import org.jspecify.annotations.Nullable;

/**
 * The region of the original source text a node was parsed from.
 *
 * @param sourceName Name of the source, or null if unknown
 * @param lineno One-indexed line number of the first character
 * @param charno Zero-indexed column of the first character
 * @param length Number of characters covered, trivia excluded
 */
public record SourcePosition(@Nullable String sourceName, int lineno, int charno, int length) {
  public SourcePosition {
    checkArgument(lineno >= 1, "Bad line number %s", lineno);
    checkArgument(charno >= 0, "Bad column %s", charno);
    checkArgument(length >= 0, "Bad length %s", length);
  }

  @Override
  public String toString() {
    return (sourceName == null ? "(unknown source)" : sourceName) + ":" + lineno + ":" + charno;
  }
}
