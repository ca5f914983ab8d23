/*
 * Copyright 2025 The Diagarg Authors
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

package org.diagarg.syntax;

import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;

/**
 * The kinds of syntax that an attribute can be applied to. Messages about a misplaced attribute
 * use {@link #label} to say what it was applied to.
 */
public enum AttributeTarget implements IntoArgument {
  EXTERN_CRATE,
  USE,
  STATIC,
  CONST,
  FN,
  CLOSURE,
  MOD,
  FOREIGN_MOD,
  GLOBAL_ASM,
  TY_ALIAS,
  OPAQUE_TY,
  ENUM,
  VARIANT,
  STRUCT,
  FIELD,
  UNION,
  TRAIT,
  TRAIT_ALIAS,
  IMPL,
  EXPRESSION,
  STATEMENT,
  ARM,
  ASSOC_CONST,
  /** A method in an inherent impl. */
  INHERENT_METHOD,
  /** A trait method without a default body. */
  REQUIRED_TRAIT_METHOD,
  PROVIDED_TRAIT_METHOD,
  ASSOC_TY,
  FOREIGN_FN,
  FOREIGN_STATIC,
  FOREIGN_TY,
  TYPE_PARAM,
  LIFETIME_PARAM,
  CONST_PARAM,
  MACRO_DEF,
  PARAM,
  PAT_FIELD,
  EXPR_FIELD;

  public String label() {
    return switch (this) {
      case EXTERN_CRATE -> "extern crate";
      case USE -> "use";
      case STATIC -> "static item";
      case CONST -> "constant item";
      case FN -> "function";
      case CLOSURE -> "closure";
      case MOD -> "module";
      case FOREIGN_MOD -> "foreign module";
      case GLOBAL_ASM -> "global asm";
      case TY_ALIAS -> "type alias";
      case OPAQUE_TY -> "opaque type";
      case ENUM -> "enum";
      case VARIANT -> "enum variant";
      case STRUCT -> "struct";
      case FIELD, EXPR_FIELD -> "struct field";
      case UNION -> "union";
      case TRAIT -> "trait";
      case TRAIT_ALIAS -> "trait alias";
      case IMPL -> "implementation block";
      case EXPRESSION -> "expression";
      case STATEMENT -> "statement";
      case ARM -> "match arm";
      case ASSOC_CONST -> "associated const";
      case INHERENT_METHOD -> "inherent method";
      case REQUIRED_TRAIT_METHOD -> "required trait method";
      case PROVIDED_TRAIT_METHOD -> "provided trait method";
      case ASSOC_TY -> "associated type";
      case FOREIGN_FN -> "foreign function";
      case FOREIGN_STATIC -> "foreign static item";
      case FOREIGN_TY -> "foreign type";
      case TYPE_PARAM -> "type parameter";
      case LIFETIME_PARAM -> "lifetime parameter";
      case CONST_PARAM -> "const parameter";
      case MACRO_DEF -> "macro def";
      case PARAM -> "function param";
      case PAT_FIELD -> "pattern field";
    };
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(label());
  }

  @Override
  public String toString() {
    return label();
  }
}
