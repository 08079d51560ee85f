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

package dev.projectables.testing;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import dev.projectables.generator.CodePrinter;
import dev.projectables.semantics.InvocationOperation;
import dev.projectables.semantics.LocalSymbol;
import dev.projectables.semantics.MemberReferenceOperation;
import dev.projectables.semantics.MemberSymbol;
import dev.projectables.semantics.NamespaceSymbol;
import dev.projectables.semantics.Operation;
import dev.projectables.semantics.OperationInstance;
import dev.projectables.semantics.SemanticModel;
import dev.projectables.semantics.Symbol;
import dev.projectables.semantics.SymbolKind;
import dev.projectables.semantics.TypeSymbol;
import dev.projectables.syntax.Node;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A semantic model for one parsed expression, resolving names against registered symbols.
 *
 * <p>Bare names resolve, in order, to lambda parameters and pattern variables in scope, to the
 * members visible from the body of a member of the target type, to types, and to namespaces.
 * Type syntax resolves by its source text. Names after a dot resolve only to nested types and
 * registered extension methods. Nodes outside the tree the model was built for resolve to
 * nothing.
 */
public final class FakeSemanticModel implements SemanticModel {

  private static final ImmutableMap<String, TypeSymbol> PREDEFINED_TYPES =
      ImmutableMap.<String, TypeSymbol>builder()
          .put("object", TypeSymbol.OBJECT)
          .put("string", TypeSymbol.STRING)
          .put("bool", TypeSymbol.BOOL)
          .put("char", TypeSymbol.CHAR)
          .put("int", TypeSymbol.INT)
          .put("long", TypeSymbol.LONG)
          .put("double", TypeSymbol.DOUBLE)
          .put("decimal", TypeSymbol.DECIMAL)
          .buildOrThrow();

  private final TypeSymbol targetType;
  private final ImmutableMap<String, MemberSymbol> members;
  private final ImmutableMap<String, MemberSymbol> extensionMethods;
  private final ImmutableMap<String, TypeSymbol> types;
  private final ImmutableMap<String, NamespaceSymbol> namespaces;
  private final ImmutableMap<String, TypeSymbol> convertedTypes;
  private final Node root;
  private final Map<Node, Node> parents = new IdentityHashMap<>();

  private FakeSemanticModel(Builder builder, Node root) {
    this.targetType = builder.targetType;
    this.members = ImmutableMap.copyOf(builder.members);
    this.extensionMethods = ImmutableMap.copyOf(builder.extensionMethods);
    this.types = ImmutableMap.copyOf(builder.types);
    this.namespaces = ImmutableMap.copyOf(builder.namespaces);
    this.convertedTypes = ImmutableMap.copyOf(builder.convertedTypes);
    this.root = root;
    recordParents(root);
  }

  public static Builder builder(TypeSymbol targetType) {
    return new Builder(targetType);
  }

  private void recordParents(Node n) {
    for (Node child : n.children()) {
      parents.put(child, n);
      recordParents(child);
    }
  }

  private boolean isKnown(Node n) {
    return n == root || parents.containsKey(n);
  }

  private @Nullable Node getParent(Node n) {
    return parents.get(n);
  }

  @Override
  public @Nullable Symbol getSymbol(Node n) {
    if (!isKnown(n)) {
      return null;
    }
    switch (n.getToken()) {
      case NAME:
        return resolveName(n);
      case QUALIFIED_NAME:
      case ALIAS_QUALIFIED_NAME:
        return types.get(sourceOf(n));
      case CALL:
        {
          Node callee = n.getFirstChild();
          if (callee.isGetProp()) {
            return resolveExtensionMethod(callee);
          }
          return callee.isName() ? resolveName(callee) : null;
        }
      default:
        return null;
    }
  }

  /**
   * Resolves {@code receiver.Method} to a registered extension method. Called on its declaring
   * type, the method is an ordinary static method.
   */
  private @Nullable Symbol resolveExtensionMethod(Node callee) {
    MemberSymbol method = extensionMethods.get(callee.getLastChild().getString());
    if (method == null) {
      return null;
    }
    String receiver = sourceOf(callee.getFirstChild());
    if (receiver.equals(method.containingType().toDisplayString())
        || receiver.equals(method.containingType().getName())) {
      return MemberSymbol.staticMethod(method.containingType(), method.name(), method.type());
    }
    return method;
  }

  private @Nullable Symbol resolveName(Node n) {
    String name = n.getString();
    Node parent = getParent(n);
    if (parent != null && (parent.isGetProp() || parent.isMemberBinding())
        && parent.getLastChild() == n) {
      // After a dot, only types are known: nested ones, or ones reached through a namespace.
      TypeSymbol type = types.get(name);
      boolean reachable =
          type != null
              && (type.getContainingType() != null || isNamespace(parent.getFirstChild()));
      return reachable ? type : null;
    }
    if (parent != null && (parent.isQualifiedName() || isTypePosition(n, parent))) {
      TypeSymbol type = types.get(name);
      return type != null ? type : PREDEFINED_TYPES.get(name);
    }
    Symbol local = resolveLocal(n, name);
    if (local != null) {
      return local;
    }
    MemberSymbol member = members.get(name);
    if (member != null) {
      return member;
    }
    TypeSymbol type = types.get(name);
    if (type != null) {
      return type;
    }
    type = PREDEFINED_TYPES.get(name);
    if (type != null) {
      return type;
    }
    return namespaces.get(name);
  }

  /** Whether {@code n} is written where only type syntax is allowed. */
  private static boolean isTypePosition(Node n, Node parent) {
    switch (parent.getToken()) {
      case CAST:
      case NEW:
      case DECLARATION_PATTERN:
        return parent.getFirstChild() == n;
      case TYPEOF:
      case DEFAULT:
      case PARAM:
      case NULLABLE_TYPE:
      case ARRAY_TYPE:
      case GENERIC_NAME:
        return true;
      default:
        return false;
    }
  }

  private boolean isNamespace(Node n) {
    if (n.isName()) {
      return namespaces.containsKey(n.getString());
    }
    return n.isGetProp() && isNamespace(n.getFirstChild());
  }

  /** Finds a lambda parameter or pattern variable named {@code name} in scope at {@code n}. */
  private @Nullable Symbol resolveLocal(Node n, String name) {
    if (name.startsWith("@")) {
      return LocalSymbol.parameter(name, targetType);
    }
    for (Node ancestor = getParent(n); ancestor != null; ancestor = getParent(ancestor)) {
      if (ancestor.isLambda()) {
        for (Node param : ancestor.getFirstChild().children()) {
          if (param.getString().equals(name)) {
            return LocalSymbol.parameter(name, null);
          }
        }
      } else if (ancestor.isSwitchArm()) {
        Node pattern = ancestor.getFirstChild();
        if (pattern.isDeclarationPattern()
            && pattern.getLastChild().isName()
            && pattern.getLastChild().getString().equals(name)) {
          return LocalSymbol.local(name, getType(pattern.getFirstChild()));
        }
      }
    }
    return null;
  }

  @Override
  public @Nullable TypeSymbol getType(Node n) {
    if (!isKnown(n)) {
      return null;
    }
    switch (n.getToken()) {
      case PREDEFINED_TYPE:
        return PREDEFINED_TYPES.get(n.getString());
      case NAME:
        {
          Symbol symbol = resolveName(n);
          if (symbol instanceof TypeSymbol) {
            return (TypeSymbol) symbol;
          }
          if (symbol instanceof MemberSymbol) {
            return ((MemberSymbol) symbol).type();
          }
          return null;
        }
      case QUALIFIED_NAME:
      case ALIAS_QUALIFIED_NAME:
        return types.get(sourceOf(n));
      case NULLABLE_TYPE:
        {
          TypeSymbol elementType = getType(n.getOnlyChild());
          if (elementType == null) {
            return null;
          }
          return elementType.isValueType() ? TypeSymbol.nullableOf(elementType) : elementType;
        }
      case ARRAY_TYPE:
        {
          TypeSymbol elementType = getType(n.getOnlyChild());
          return elementType == null ? null : TypeSymbol.arrayOf(elementType);
        }
      default:
        return null;
    }
  }

  @Override
  public @Nullable TypeSymbol getConvertedType(Node n) {
    return isKnown(n) ? convertedTypes.get(sourceOf(n)) : null;
  }

  @Override
  public @Nullable Operation getOperation(Node n) {
    if (!isKnown(n)) {
      return null;
    }
    if (n.isCall()) {
      Node callee = n.getFirstChild();
      Symbol symbol = callee.isName() ? resolveName(callee) : null;
      if (symbol instanceof MemberSymbol && symbol.getKind() == SymbolKind.METHOD) {
        MemberSymbol method = (MemberSymbol) symbol;
        return new InvocationOperation(method, implicitInstanceFor(method));
      }
      return null;
    }
    if (!n.isName()) {
      return null;
    }
    Symbol symbol = resolveName(n);
    if (!(symbol instanceof MemberSymbol) || symbol.getKind() == SymbolKind.METHOD) {
      return null;
    }
    MemberSymbol member = (MemberSymbol) symbol;
    return new MemberReferenceOperation(member, implicitInstanceFor(member));
  }

  /** Members referenced by a bare name are accessed off {@code this}, of the target type. */
  private @Nullable OperationInstance implicitInstanceFor(MemberSymbol member) {
    return member.isStatic() ? null : OperationInstance.implicit(targetType);
  }

  private static String sourceOf(Node n) {
    return CodePrinter.toSource(n).trim();
  }

  /** Registers the symbols a {@link FakeSemanticModel} knows about. */
  public static final class Builder {
    private final TypeSymbol targetType;
    private final Map<String, MemberSymbol> members = new HashMap<>();
    private final Map<String, MemberSymbol> extensionMethods = new HashMap<>();
    private final Map<String, TypeSymbol> types = new HashMap<>();
    private final Map<String, NamespaceSymbol> namespaces = new HashMap<>();
    private final Map<String, TypeSymbol> convertedTypes = new HashMap<>();

    private Builder(TypeSymbol targetType) {
      this.targetType = checkNotNull(targetType);
      addType(targetType.getName(), targetType);
    }

    /** Makes a member accessible by its bare name. */
    @CanIgnoreReturnValue
    public Builder addMember(MemberSymbol member) {
      if (member.isExtensionMethod()) {
        extensionMethods.put(member.name(), member);
      } else {
        members.put(member.name(), member);
      }
      return this;
    }

    /** Resolves type syntax written as {@code sourceText} to {@code type}. */
    @CanIgnoreReturnValue
    public Builder addType(String sourceText, TypeSymbol type) {
      types.put(sourceText, type);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addNamespace(String name) {
      namespaces.put(name, new NamespaceSymbol(name));
      return this;
    }

    /** Gives the expression written as {@code sourceText} a converted type. */
    @CanIgnoreReturnValue
    public Builder setConvertedType(String sourceText, TypeSymbol type) {
      convertedTypes.put(sourceText, type);
      return this;
    }

    /** Returns a model for the tree rooted at {@code root}. */
    public FakeSemanticModel build(Node root) {
      return new FakeSemanticModel(this, root);
    }
  }
}
