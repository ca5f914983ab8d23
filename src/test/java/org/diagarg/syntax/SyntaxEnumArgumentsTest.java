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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class SyntaxEnumArgumentsTest {

  @Test
  public void editionArguments(@TestParameter Edition edition) {
    assertThat(edition.intoArgument()).isEqualTo(ArgumentValue.str(edition.label()));
    assertThat(edition.atLeast(Edition.DEFAULT)).isTrue();
  }

  @Test
  public void editions() {
    assertThat(Edition.EDITION_2021.intoArgument()).isEqualTo(ArgumentValue.str("2021"));
    assertThat(Edition.DEFAULT).isEqualTo(Edition.EDITION_2015);
    assertThat(Edition.EDITION_2018.atLeast(Edition.EDITION_2021)).isFalse();
  }

  @Test
  public void everyEnumConvertsToANonEmptyString(
      @TestParameter ParamKindOrd paramKind,
      @TestParameter ConstContext constContext,
      @TestParameter ClosureKind closureKind,
      @TestParameter FloatTy floatTy) {
    assertThat(((ArgumentValue.Str) paramKind.intoArgument()).value()).isNotEmpty();
    assertThat(((ArgumentValue.Str) constContext.intoArgument()).value()).isNotEmpty();
    assertThat(((ArgumentValue.Str) closureKind.intoArgument()).value()).isNotEmpty();
    assertThat(((ArgumentValue.Str) floatTy.intoArgument()).value()).isNotEmpty();
  }

  @Test
  public void labels() {
    assertThat(ParamKindOrd.LIFETIME.intoArgument()).isEqualTo(ArgumentValue.str("lifetime"));
    assertThat(ParamKindOrd.TYPE_OR_CONST.intoArgument())
        .isEqualTo(ArgumentValue.str("type and const"));
    assertThat(ConstContext.CONST_FN.intoArgument()).isEqualTo(ArgumentValue.str("const_fn"));
    assertThat(ConstContext.CONST_FN.keywordName()).isEqualTo("const fn");
    assertThat(ConstContext.STATIC.intoArgument()).isEqualTo(ArgumentValue.str("static"));
    assertThat(ClosureKind.FN_MUT.intoArgument()).isEqualTo(ArgumentValue.str("FnMut"));
    assertThat(FloatTy.F32.intoArgument()).isEqualTo(ArgumentValue.str("f32"));
    assertThat(FloatTy.F64.bitWidth()).isEqualTo(64);
  }

  @Test
  public void closureKindsExtendWeakerKinds() {
    assertThat(ClosureKind.FN.extendsKind(ClosureKind.FN_ONCE)).isTrue();
    assertThat(ClosureKind.FN_MUT.extendsKind(ClosureKind.FN_MUT)).isTrue();
    assertThat(ClosureKind.FN_ONCE.extendsKind(ClosureKind.FN)).isFalse();
  }

  private static <E extends Enum<E> & IntoArgument> void assertDistinctArguments(
      Class<E> enumClass) {
    E[] values = enumClass.getEnumConstants();
    ImmutableSet.Builder<ArgumentValue> args = ImmutableSet.builder();
    for (E value : values) {
      args.add(value.intoArgument());
    }
    assertThat(args.build()).hasSize(values.length);
  }

  @Test
  public void labelsAreDistinct() {
    assertDistinctArguments(Edition.class);
    assertDistinctArguments(ParamKindOrd.class);
    assertDistinctArguments(ConstContext.class);
    assertDistinctArguments(ClosureKind.class);
    assertDistinctArguments(FloatTy.class);
    assertDistinctArguments(DefKind.class);
  }

  @Test
  public void resolutionsBecomeDescriptions(@TestParameter DefKind defKind) {
    assertThat(Res.def(defKind).intoArgument()).isEqualTo(ArgumentValue.str(defKind.descr()));
    assertThat(defKind.descr()).isNotEmpty();
  }

  @Test
  public void resolutions() {
    assertThat(Res.def(DefKind.TUPLE_STRUCT_CTOR).intoArgument())
        .isEqualTo(ArgumentValue.str("tuple struct"));
    assertThat(Res.def(DefKind.USE).intoArgument()).isEqualTo(ArgumentValue.str("import"));
    assertThat(Res.LOCAL.intoArgument()).isEqualTo(ArgumentValue.str("local variable"));
    assertThat(Res.PRIM_TY.intoArgument()).isEqualTo(ArgumentValue.str("builtin type"));
    assertThat(Res.SELF_TY_ALIAS.intoArgument()).isEqualTo(ArgumentValue.str("self type"));
    assertThat(Res.BUILTIN_ATTR.intoArgument())
        .isEqualTo(ArgumentValue.str("built-in attribute"));
    assertThat(Res.ERR.intoArgument()).isEqualTo(ArgumentValue.str("unresolved item"));
    assertThat(Res.def(DefKind.FN)).isEqualTo(Res.def(DefKind.FN));
    assertThat(Res.def(DefKind.FN)).isNotEqualTo(Res.def(DefKind.CONST));
  }

  @Test
  public void attributeTargets(@TestParameter AttributeTarget target) {
    assertThat(target.label()).isNotEmpty();
    assertThat(target.intoArgument()).isEqualTo(ArgumentValue.str(target.label()));
  }

  @Test
  public void attributeTargetLabels() {
    assertThat(AttributeTarget.ARM.intoArgument()).isEqualTo(ArgumentValue.str("match arm"));
    assertThat(AttributeTarget.IMPL.intoArgument())
        .isEqualTo(ArgumentValue.str("implementation block"));
    assertThat(AttributeTarget.PROVIDED_TRAIT_METHOD.intoArgument())
        .isEqualTo(ArgumentValue.str("provided trait method"));
    assertThat(AttributeTarget.LIFETIME_PARAM.intoArgument())
        .isEqualTo(ArgumentValue.str("lifetime parameter"));
  }
}
