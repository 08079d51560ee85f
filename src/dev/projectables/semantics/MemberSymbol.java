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

import org.jspecify.annotations.Nullable;

/**
 * A method, property or field declared by a type.
 *
 * @param kind One of {@link SymbolKind#METHOD}, {@link SymbolKind#PROPERTY} or {@link
 *     SymbolKind#FIELD}
 * @param containingType The declaring type
 * @param isStatic Whether the member is static
 * @param isExtensionMethod Whether the member is a static method callable with instance syntax on
 *     the type of its first parameter
 * @param type The property/field type or method return type, or null when unknown
 */
public record MemberSymbol(
    SymbolKind kind,
    String name,
    TypeSymbol containingType,
    boolean isStatic,
    boolean isExtensionMethod,
    @Nullable TypeSymbol type)
    implements Symbol {
  public MemberSymbol {
    checkArgument(kind.isMember(), "%s is not a member kind", kind);
    checkNotNull(containingType, "containingType");
    checkArgument(
        !isExtensionMethod || (kind == SymbolKind.METHOD && isStatic),
        "Extension method %s must be a static method",
        name);
  }

  public static MemberSymbol property(TypeSymbol containingType, String name, TypeSymbol type) {
    return new MemberSymbol(SymbolKind.PROPERTY, name, containingType, false, false, type);
  }

  public static MemberSymbol staticProperty(
      TypeSymbol containingType, String name, TypeSymbol type) {
    return new MemberSymbol(SymbolKind.PROPERTY, name, containingType, true, false, type);
  }

  public static MemberSymbol field(TypeSymbol containingType, String name, TypeSymbol type) {
    return new MemberSymbol(SymbolKind.FIELD, name, containingType, false, false, type);
  }

  public static MemberSymbol staticField(TypeSymbol containingType, String name, TypeSymbol type) {
    return new MemberSymbol(SymbolKind.FIELD, name, containingType, true, false, type);
  }

  public static MemberSymbol method(
      TypeSymbol containingType, String name, @Nullable TypeSymbol returnType) {
    return new MemberSymbol(SymbolKind.METHOD, name, containingType, false, false, returnType);
  }

  public static MemberSymbol staticMethod(
      TypeSymbol containingType, String name, @Nullable TypeSymbol returnType) {
    return new MemberSymbol(SymbolKind.METHOD, name, containingType, true, false, returnType);
  }

  public static MemberSymbol extensionMethod(
      TypeSymbol containingType, String name, @Nullable TypeSymbol returnType) {
    return new MemberSymbol(SymbolKind.METHOD, name, containingType, true, true, returnType);
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
  public TypeSymbol getContainingType() {
    return containingType;
  }

  @Override
  public String toString() {
    return containingType.toDisplayString() + "." + name;
  }
}
