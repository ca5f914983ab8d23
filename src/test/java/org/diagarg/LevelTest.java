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

package org.diagarg;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.diagarg.arg.ArgumentValue;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class LevelTest {

  @Test
  public void everyLevelHasALabel(@TestParameter Level level) {
    assertThat(level.label()).isNotEmpty();
    assertThat(level.intoArgument()).isEqualTo(ArgumentValue.str(level.label()));
    assertThat(level.toString()).isEqualTo(level.label());
  }

  @Test
  public void labels() {
    assertThat(Level.BUG.label()).isEqualTo("error: internal compiler error");
    assertThat(Level.DELAYED_BUG.label()).isEqualTo("error: internal compiler error");
    assertThat(Level.FATAL.label()).isEqualTo("error");
    assertThat(Level.ERROR.label()).isEqualTo("error");
    assertThat(Level.ONCE_NOTE.label()).isEqualTo("note");
    assertThat(Level.ONCE_HELP.label()).isEqualTo("help");
    assertThat(Level.FAILURE_NOTE.label()).isEqualTo("failure-note");
  }

  @Test
  public void lintLevelsBecomeFlags(@TestParameter LintLevel lintLevel) {
    assertThat(lintLevel.intoArgument()).isEqualTo(ArgumentValue.str(lintLevel.cmdFlag()));
    assertThat(lintLevel.cmdFlag()).startsWith("-");
  }

  @Test
  public void lintLevels() {
    assertThat(LintLevel.FORCE_WARN.cmdFlag()).isEqualTo("--force-warn");
    assertThat(LintLevel.DENY.intoArgument()).isEqualTo(ArgumentValue.str("-D"));
    assertThat(LintLevel.FORBID.intoArgument()).isEqualTo(ArgumentValue.str("-F"));
    assertThat(LintLevel.EXPECT.intoArgument()).isEqualTo(ArgumentValue.str("--expect"));
  }

  @Test
  public void lintFlagsAreDistinct() {
    ImmutableSet.Builder<String> flags = ImmutableSet.builder();
    for (LintLevel lintLevel : LintLevel.values()) {
      flags.add(lintLevel.cmdFlag());
    }
    assertThat(flags.build()).hasSize(LintLevel.values().length);
  }
}
