/*
 * Copyright 2018 The Closure Compiler Authors.
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

import com.google.common.base.Splitter;
import dev.projectables.semantics.TypeSymbol;
import dev.projectables.syntax.IR;
import dev.projectables.syntax.Node;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Creates syntax for the types and names the rewriter introduces.
 *
 * <p>Type syntax is always fully qualified, so that rewritten expressions keep their meaning
 * once lifted out of the using directives and enclosing namespaces of their source.
 */
final class AstFactory {

  private static final String GLOBAL_ALIAS = "global";
  private static final Splitter DOT_SPLITTER = Splitter.on('.');

  private AstFactory() {}

  /**
   * Creates the syntax for {@link TypeSymbol#toDisplayString()}: {@code
   * global::Ns.Outer.Name<Args>}, a predefined keyword, {@code T?} or {@code T[]}.
   */
  static Node createTypeName(TypeSymbol type) {
    if (type.getKeyword() != null) {
      return IR.predefinedType(type.getKeyword());
    }
    TypeSymbol underlying = type.getNullableUnderlyingType();
    if (underlying != null) {
      return IR.nullableType(createTypeName(underlying));
    }
    TypeSymbol elementType = type.getElementType();
    if (elementType != null) {
      return IR.arrayType(createTypeName(elementType));
    }

    Node simpleName = createSimpleName(type);
    Node qualifier = createQualifier(type);
    return qualifier == null
        ? IR.aliasQualifiedName(GLOBAL_ALIAS, simpleName)
        : IR.qualifiedName(qualifier, simpleName);
  }

  private static @Nullable Node createQualifier(TypeSymbol type) {
    TypeSymbol containingType = type.getContainingType();
    if (containingType != null) {
      return createTypeName(containingType);
    }
    if (type.getNamespace().isEmpty()) {
      return null;
    }
    List<String> segments = DOT_SPLITTER.splitToList(type.getNamespace());
    Node result = IR.aliasQualifiedName(GLOBAL_ALIAS, IR.name(segments.get(0)));
    for (String segment : segments.subList(1, segments.size())) {
      result = IR.qualifiedName(result, IR.name(segment));
    }
    return result;
  }

  private static Node createSimpleName(TypeSymbol type) {
    if (type.getTypeArguments().isEmpty()) {
      return IR.name(type.getName());
    }
    Node[] typeArgs =
        type.getTypeArguments().stream().map(AstFactory::createTypeName).toArray(Node[]::new);
    return IR.genericName(type.getName(), typeArgs);
  }

  /** Creates {@code target != null}. */
  static Node createNotNullCheck(Node target) {
    return IR.ne(target, IR.nullNode());
  }

  /** Creates {@code (T)null}, typing a null literal so both branches of a conditional agree. */
  static Node createTypedNull(TypeSymbol type) {
    return IR.cast(createTypeName(type), IR.nullNode());
  }
}
