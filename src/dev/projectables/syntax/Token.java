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

/** The kinds of nodes that make up an expression body. */
public enum Token {
  // Simple names and literals
  NAME,
  GENERIC_NAME, // Name<TypeArgs>
  NUMBER,
  STRINGLIT,
  CHARLIT,
  TRUE,
  FALSE,
  NULL,
  THIS,
  BASE,

  // Accesses and calls
  GETPROP, // target.name
  GETELEM, // target[args]
  CALL, // target(args)
  ARG_LIST,
  NEW, // new Type(args) { initializer }
  OBJECT_INITIALIZER,
  ASSIGN, // Member = value, inside object initializers

  // Binary operators
  EQ,
  NE,
  LT,
  LE,
  GT,
  GE,
  ADD,
  SUB,
  MUL,
  DIV,
  MOD,
  AND, // &&
  OR, // ||
  COALESCE, // ??
  BITAND,
  BITOR,
  BITXOR,

  // Unary operators
  NOT,
  NEG,
  POS,
  BITNOT,

  HOOK, // conditional (?:)
  CAST, // (Type)expr
  TYPEOF, // typeof(Type)
  DEFAULT, // default(Type)
  PAREN,
  LAMBDA,
  PARAM_LIST,
  PARAM,

  // Null-conditional access: target?.b and target?[i]
  CONDITIONAL_ACCESS,
  MEMBER_BINDING, // .b, right-hand side of a conditional access
  ELEMENT_BINDING, // [i], right-hand side of a conditional access

  SWITCH_EXPR,
  SWITCH_ARM,

  INTERPOLATED_STRING, // $"..."
  STRING_PART,
  INTERPOLATION, // {expr,alignment:format}

  // Type syntax
  PREDEFINED_TYPE, // int, string, ...
  QUALIFIED_NAME, // Left.Right
  ALIAS_QUALIFIED_NAME, // global::Name
  NULLABLE_TYPE, // T?
  ARRAY_TYPE, // T[]

  // Patterns
  DISCARD_PATTERN, // _
  CONSTANT_PATTERN,
  DECLARATION_PATTERN, // Type name
  RELATIONAL_PATTERN, // < 5
  POSITIONAL_PATTERN, // (a, b)

  EMPTY;
}
