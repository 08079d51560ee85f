/*
 * Copyright 2009 The Closure Compiler Authors.
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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

/** Options for rewriting expression bodies. */
public class GeneratorOptions {

  private NullConditionalRewriteSupport nullConditionalRewriteSupport =
      NullConditionalRewriteSupport.NONE;

  /** Name of the synthesized parameter that stands in for {@code this} and {@code base}. */
  private String thisParameterName = "@this";

  public NullConditionalRewriteSupport getNullConditionalRewriteSupport() {
    return nullConditionalRewriteSupport;
  }

  @CanIgnoreReturnValue
  public GeneratorOptions setNullConditionalRewriteSupport(
      NullConditionalRewriteSupport nullConditionalRewriteSupport) {
    this.nullConditionalRewriteSupport = checkNotNull(nullConditionalRewriteSupport);
    return this;
  }

  public String getThisParameterName() {
    return thisParameterName;
  }

  @CanIgnoreReturnValue
  public GeneratorOptions setThisParameterName(String thisParameterName) {
    this.thisParameterName = checkNotNull(thisParameterName);
    return this;
  }

  @Override
  public String toString() {
    return "GeneratorOptions{nullConditionalRewriteSupport="
        + nullConditionalRewriteSupport
        + ", thisParameterName="
        + thisParameterName
        + "}";
  }
}
