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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A named type: a class, struct, interface, enum, delegate or array type.
 *
 * <p>Type symbols compare by their fully-qualified display form, so two symbols built
 * independently for the same type are equal.
 */
public final class TypeSymbol implements Symbol {

  public static final TypeSymbol OBJECT = predefined("object", "Object", TypeKind.CLASS);
  public static final TypeSymbol STRING = predefined("string", "String", TypeKind.CLASS);
  public static final TypeSymbol BOOL = predefined("bool", "Boolean", TypeKind.STRUCT);
  public static final TypeSymbol CHAR = predefined("char", "Char", TypeKind.STRUCT);
  public static final TypeSymbol INT = predefined("int", "Int32", TypeKind.STRUCT);
  public static final TypeSymbol LONG = predefined("long", "Int64", TypeKind.STRUCT);
  public static final TypeSymbol DOUBLE = predefined("double", "Double", TypeKind.STRUCT);
  public static final TypeSymbol DECIMAL = predefined("decimal", "Decimal", TypeKind.STRUCT);

  private static final Joiner COMMA_JOINER = Joiner.on(", ");

  private final String name;
  private final String namespace;
  private final @Nullable TypeSymbol containingType;
  private final ImmutableList<TypeSymbol> typeArguments;
  private final TypeKind typeKind;
  private final @Nullable String keyword;
  private final @Nullable TypeSymbol nullableUnderlyingType;
  private final @Nullable TypeSymbol elementType;

  private TypeSymbol(
      String name,
      String namespace,
      @Nullable TypeSymbol containingType,
      ImmutableList<TypeSymbol> typeArguments,
      TypeKind typeKind,
      @Nullable String keyword,
      @Nullable TypeSymbol nullableUnderlyingType,
      @Nullable TypeSymbol elementType) {
    this.name = checkNotNull(name);
    this.namespace = checkNotNull(namespace);
    this.containingType = containingType;
    this.typeArguments = typeArguments;
    this.typeKind = checkNotNull(typeKind);
    this.keyword = keyword;
    this.nullableUnderlyingType = nullableUnderlyingType;
    this.elementType = elementType;
  }

  /**
   * @param namespace The dotted namespace, or the empty string for the global namespace
   */
  public static TypeSymbol of(String namespace, String name, TypeKind typeKind) {
    checkArgument(typeKind != TypeKind.ARRAY, "Use TypeSymbol.arrayOf for array types");
    return new TypeSymbol(name, namespace, null, ImmutableList.of(), typeKind, null, null, null);
  }

  public static TypeSymbol classType(String namespace, String name) {
    return of(namespace, name, TypeKind.CLASS);
  }

  public static TypeSymbol structType(String namespace, String name) {
    return of(namespace, name, TypeKind.STRUCT);
  }

  public static TypeSymbol nested(TypeSymbol containingType, String name, TypeKind typeKind) {
    return new TypeSymbol(
        name, containingType.namespace, containingType, ImmutableList.of(), typeKind, null, null,
        null);
  }

  /** {@code Nullable<T>}, written {@code T?}, for a value type {@code T}. */
  public static TypeSymbol nullableOf(TypeSymbol valueType) {
    checkArgument(valueType.isValueType(), "%s is not a value type", valueType);
    checkArgument(!valueType.isNullableValueType(), "%s is already nullable", valueType);
    return new TypeSymbol(
        "Nullable",
        "System",
        null,
        ImmutableList.of(valueType),
        TypeKind.STRUCT,
        null,
        valueType,
        null);
  }

  public static TypeSymbol arrayOf(TypeSymbol elementType) {
    return new TypeSymbol(
        "Array", "System", null, ImmutableList.of(), TypeKind.ARRAY, null, null, elementType);
  }

  private static TypeSymbol predefined(String keyword, String metadataName, TypeKind typeKind) {
    return new TypeSymbol(
        metadataName, "System", null, ImmutableList.of(), typeKind, keyword, null, null);
  }

  /** Returns the constructed generic type with the given type arguments. */
  public TypeSymbol withTypeArguments(TypeSymbol... arguments) {
    checkState(keyword == null && nullableUnderlyingType == null && elementType == null, this);
    return new TypeSymbol(
        name,
        namespace,
        containingType,
        ImmutableList.copyOf(arguments),
        typeKind,
        null,
        null,
        null);
  }

  @Override
  public SymbolKind getKind() {
    return SymbolKind.NAMED_TYPE;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public @Nullable TypeSymbol getContainingType() {
    return containingType;
  }

  public String getNamespace() {
    return namespace;
  }

  public ImmutableList<TypeSymbol> getTypeArguments() {
    return typeArguments;
  }

  public TypeKind getTypeKind() {
    return typeKind;
  }

  public boolean isValueType() {
    return typeKind.isValueType();
  }

  /** The language keyword for predefined types such as {@code int}, or null. */
  public @Nullable String getKeyword() {
    return keyword;
  }

  public boolean isNullableValueType() {
    return nullableUnderlyingType != null;
  }

  public @Nullable TypeSymbol getNullableUnderlyingType() {
    return nullableUnderlyingType;
  }

  public boolean isArray() {
    return typeKind == TypeKind.ARRAY;
  }

  public @Nullable TypeSymbol getElementType() {
    return elementType;
  }

  /**
   * Returns the fully-qualified form used in generated code: {@code global::Ns.Outer.Name<Args>}
   * for declared types, the keyword for predefined types, {@code T?} for nullable value types and
   * {@code T[]} for arrays.
   */
  public String toDisplayString() {
    if (keyword != null) {
      return keyword;
    }
    if (nullableUnderlyingType != null) {
      return nullableUnderlyingType.toDisplayString() + "?";
    }
    if (elementType != null) {
      return elementType.toDisplayString() + "[]";
    }
    return "global::" + qualifiedName();
  }

  private String qualifiedName() {
    StringBuilder sb = new StringBuilder();
    if (containingType != null) {
      sb.append(containingType.qualifiedName()).append('.');
    } else if (!namespace.isEmpty()) {
      sb.append(namespace).append('.');
    }
    sb.append(name);
    if (!typeArguments.isEmpty()) {
      sb.append('<');
      COMMA_JOINER.appendTo(
          sb, typeArguments.stream().map(TypeSymbol::toDisplayString).iterator());
      sb.append('>');
    }
    return sb.toString();
  }

  @Override
  public boolean equals(@Nullable Object o) {
    return o instanceof TypeSymbol && ((TypeSymbol) o).toDisplayString().equals(toDisplayString());
  }

  @Override
  public int hashCode() {
    return Objects.hash(toDisplayString());
  }

  @Override
  public String toString() {
    return toDisplayString();
  }
}
