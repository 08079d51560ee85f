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

/** How null-conditional accesses ({@code a?.b}, {@code a?[i]}) are handled when rewriting. */
public enum NullConditionalRewriteSupport {
  /** Null-conditional accesses are not supported; each one is reported as an error. */
  NONE,

  /**
   * The null check is dropped and the access is kept as a plain one. Suited to query providers
   * that already propagate nulls through member accesses, such as SQL translation.
   */
  IGNORE,

  /** Each access becomes an explicit {@code target != null ? (access) : (T)null} conditional. */
  REWRITE;
}
