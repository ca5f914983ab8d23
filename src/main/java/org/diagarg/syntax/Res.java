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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;
import org.jspecify.annotations.Nullable;

/**
 * What a name resolved to: a definition (with its {@link DefKind}) or one of the things that aren't
 * definitions, such as a local variable or a primitive type. As a diagnostic argument a Res becomes
 * its description, e.g. "local variable" or "tuple struct".
 */
public final class Res implements IntoArgument {

  public enum Kind {
    DEF,
    PRIM_TY,
    SELF_TY_PARAM,
    SELF_TY_ALIAS,
    SELF_CTOR,
    LOCAL,
    TOOL_MOD,
    BUILTIN_ATTR,
    TOOL_ATTR,
    DERIVE_HELPER_ATTR,
    /** Resolution failed; an error has already been reported. */
    ERR
  }

  public static final Res PRIM_TY = new Res(Kind.PRIM_TY, null);
  public static final Res SELF_TY_PARAM = new Res(Kind.SELF_TY_PARAM, null);
  public static final Res SELF_TY_ALIAS = new Res(Kind.SELF_TY_ALIAS, null);
  public static final Res SELF_CTOR = new Res(Kind.SELF_CTOR, null);
  public static final Res LOCAL = new Res(Kind.LOCAL, null);
  public static final Res TOOL_MOD = new Res(Kind.TOOL_MOD, null);
  public static final Res BUILTIN_ATTR = new Res(Kind.BUILTIN_ATTR, null);
  public static final Res TOOL_ATTR = new Res(Kind.TOOL_ATTR, null);
  public static final Res DERIVE_HELPER_ATTR = new Res(Kind.DERIVE_HELPER_ATTR, null);
  public static final Res ERR = new Res(Kind.ERR, null);

  public final Kind kind;

  /** Non-null iff kind is DEF. */
  public final @Nullable DefKind defKind;

  private Res(Kind kind, @Nullable DefKind defKind) {
    this.kind = kind;
    this.defKind = defKind;
  }

  public static Res def(DefKind defKind) {
    return new Res(Kind.DEF, checkNotNull(defKind));
  }

  public String descr() {
    return switch (kind) {
      case DEF -> checkNotNull(defKind).descr();
      case PRIM_TY -> "builtin type";
      case SELF_TY_PARAM, SELF_TY_ALIAS -> "self type";
      case SELF_CTOR -> "self constructor";
      case LOCAL -> "local variable";
      case TOOL_MOD -> "tool module";
      case BUILTIN_ATTR -> "built-in attribute";
      case TOOL_ATTR -> "tool attribute";
      case DERIVE_HELPER_ATTR -> "derive helper attribute";
      case ERR -> "unresolved item";
    };
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(descr());
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Res other && kind == other.kind && defKind == other.defKind;
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, defKind);
  }

  @Override
  public String toString() {
    return (kind == Kind.DEF) ? "Def(" + defKind + ")" : kind.toString();
  }
}
