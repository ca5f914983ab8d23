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

/** The kinds of definition that a path can resolve to. */
public enum DefKind implements IntoArgument {
  MOD,
  STRUCT,
  UNION,
  ENUM,
  VARIANT,
  TRAIT,
  TY_ALIAS,
  FOREIGN_TY,
  TRAIT_ALIAS,
  ASSOC_TY,
  TY_PARAM,
  FN,
  CONST,
  CONST_PARAM,
  STATIC,
  /** The constructor of a tuple struct. */
  TUPLE_STRUCT_CTOR,
  UNIT_STRUCT_CTOR,
  TUPLE_VARIANT_CTOR,
  UNIT_VARIANT_CTOR,
  ASSOC_FN,
  ASSOC_CONST,
  /** A function-like macro, e.g. {@code vec!}. */
  BANG_MACRO,
  ATTR_MACRO,
  DERIVE_MACRO,
  EXTERN_CRATE,
  USE,
  FOREIGN_MOD,
  ANON_CONST,
  INLINE_CONST,
  OPAQUE_TY,
  FIELD,
  LIFETIME_PARAM,
  GLOBAL_ASM,
  IMPL,
  CLOSURE;

  /** Returns a short description, e.g. "tuple struct", suitable for use in a message. */
  public String descr() {
    return switch (this) {
      case MOD -> "module";
      case STRUCT -> "struct";
      case UNION -> "union";
      case ENUM -> "enum";
      case VARIANT -> "variant";
      case TRAIT -> "trait";
      case TY_ALIAS -> "type alias";
      case FOREIGN_TY -> "foreign type";
      case TRAIT_ALIAS -> "trait alias";
      case ASSOC_TY -> "associated type";
      case TY_PARAM -> "type parameter";
      case FN -> "function";
      case CONST -> "constant";
      case CONST_PARAM -> "const parameter";
      case STATIC -> "static";
      case TUPLE_STRUCT_CTOR -> "tuple struct";
      case UNIT_STRUCT_CTOR -> "unit struct";
      case TUPLE_VARIANT_CTOR -> "tuple variant";
      case UNIT_VARIANT_CTOR -> "unit variant";
      case ASSOC_FN -> "associated function";
      case ASSOC_CONST -> "associated constant";
      case BANG_MACRO -> "macro";
      case ATTR_MACRO -> "attribute macro";
      case DERIVE_MACRO -> "derive macro";
      case EXTERN_CRATE -> "extern crate";
      case USE -> "import";
      case FOREIGN_MOD -> "foreign module";
      case ANON_CONST -> "constant expression";
      case INLINE_CONST -> "inline constant";
      case OPAQUE_TY -> "opaque type";
      case FIELD -> "field";
      case LIFETIME_PARAM -> "lifetime parameter";
      case GLOBAL_ASM -> "global assembly block";
      case IMPL -> "implementation";
      case CLOSURE -> "closure";
    };
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(descr());
  }
}
