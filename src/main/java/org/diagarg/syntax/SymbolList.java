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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.diagarg.arg.Args;
import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;

/**
 * A list of symbols to be displayed as e.g. "{@code `a`, `b` and `c`}". The order of the symbols
 * is preserved.
 */
public final class SymbolList implements IntoArgument {
  private final ImmutableList<Symbol> symbols;

  private SymbolList(ImmutableList<Symbol> symbols) {
    this.symbols = symbols;
  }

  public static SymbolList of(List<Symbol> symbols) {
    return new SymbolList(ImmutableList.copyOf(symbols));
  }

  public static SymbolList of(String... names) {
    ImmutableList.Builder<Symbol> builder = ImmutableList.builderWithExpectedSize(names.length);
    for (String name : names) {
      builder.add(Symbol.intern(name));
    }
    return new SymbolList(builder.build());
  }

  public ImmutableList<Symbol> symbols() {
    return symbols;
  }

  @Override
  public ArgumentValue intoArgument() {
    return Args.backtickedList(symbols);
  }

  @Override
  public String toString() {
    return symbols.toString();
  }
}
