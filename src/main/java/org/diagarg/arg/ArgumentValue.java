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

package org.diagarg.arg;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import org.diagarg.util.StringUtil;

/**
 * The value bound to a named slot in a diagnostic template. There are exactly three shapes, each
 * a nested subclass: {@link Num}, {@link Str}, and {@link StrListSepByAnd}; the private
 * constructor ensures that there are no others.
 *
 * <p>ArgumentValues are immutable and compare by value.
 */
public abstract class ArgumentValue {

  /** Identifies which of the three shapes an ArgumentValue has. */
  public enum Kind {
    NUMBER,
    STR,
    STR_LIST_SEP_BY_AND
  }

  private ArgumentValue() {}

  public abstract Kind kind();

  /** Returns a Str with the given contents. */
  public static Str str(String s) {
    return new Str(s);
  }

  /** Returns a StrListSepByAnd with the given elements, in the given order. */
  public static StrListSepByAnd strList(List<String> elements) {
    return new StrListSepByAnd(ImmutableList.copyOf(elements));
  }

  /**
   * A signed 128-bit integer. Every Java integer type, whether interpreted as signed or unsigned,
   * fits without loss; those are the only ways to construct one.
   */
  public static final class Num extends ArgumentValue {
    private static final BigInteger TWO_TO_64 = BigInteger.ONE.shiftLeft(64);

    private final BigInteger value;

    private Num(BigInteger value) {
      this.value = value;
    }

    public static Num of(long value) {
      return new Num(BigInteger.valueOf(value));
    }

    /** Returns a Num for {@code value} interpreted as an unsigned 64-bit integer. */
    public static Num ofUnsigned(long value) {
      BigInteger result = BigInteger.valueOf(value);
      return new Num((value < 0) ? result.add(TWO_TO_64) : result);
    }

    public BigInteger value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.NUMBER;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Num other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public String toString() {
      return "Num(" + value + ")";
    }
  }

  /** A string argument. */
  public static final class Str extends ArgumentValue {
    private final String value;

    private Str(String value) {
      this.value = checkNotNull(value);
    }

    public String value() {
      return value;
    }

    @Override
    public Kind kind() {
      return Kind.STR;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Str other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public String toString() {
      return "Str(" + StringUtil.quoteString(value) + ")";
    }
  }

  /**
   * An ordered list of strings that the renderer will join "a, b and c"-style. Order is
   * significant; it matches the order in which the elements were provided.
   */
  public static final class StrListSepByAnd extends ArgumentValue {
    private final ImmutableList<String> elements;

    private StrListSepByAnd(ImmutableList<String> elements) {
      this.elements = elements;
    }

    public ImmutableList<String> elements() {
      return elements;
    }

    @Override
    public Kind kind() {
      return Kind.STR_LIST_SEP_BY_AND;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof StrListSepByAnd other && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
      return elements.hashCode();
    }

    @Override
    public String toString() {
      return "StrListSepByAnd(" + elements + ")";
    }
  }
}
