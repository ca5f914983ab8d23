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

package org.diagarg.target;

import org.diagarg.arg.ArgumentValue.Num;
import org.jspecify.annotations.Nullable;

/** Describes why a number of bytes isn't a valid alignment. */
public final class AlignFromBytesError {

  /** The largest supported alignment is 2^MAX_POW2 bytes. */
  public static final int MAX_POW2 = 29;

  /** The ways an alignment can be invalid. */
  public enum Kind {
    NOT_POWER_OF_TWO,
    TOO_LARGE
  }

  public final Kind kind;

  /** The rejected alignment, as an unsigned 64-bit number of bytes. */
  private final long align;

  private AlignFromBytesError(Kind kind, long align) {
    this.kind = kind;
    this.align = align;
  }

  public static AlignFromBytesError notPowerOfTwo(long align) {
    return new AlignFromBytesError(Kind.NOT_POWER_OF_TWO, align);
  }

  public static AlignFromBytesError tooLarge(long align) {
    return new AlignFromBytesError(Kind.TOO_LARGE, align);
  }

  /**
   * Checks that {@code bytes} (an unsigned 64-bit value) is a valid alignment, i.e. a power of two
   * no larger than 2^{@value #MAX_POW2}; zero is treated as 1. Returns null if it is valid,
   * otherwise an AlignFromBytesError describing the problem.
   */
  public static @Nullable AlignFromBytesError check(long bytes) {
    if (bytes == 0) {
      return null;
    } else if (Long.bitCount(bytes) != 1) {
      return notPowerOfTwo(bytes);
    } else if (Long.numberOfTrailingZeros(bytes) > MAX_POW2) {
      return tooLarge(bytes);
    }
    return null;
  }

  /** The identifier that message templates use to select a description of this error. */
  public String diagIdent() {
    return switch (kind) {
      case NOT_POWER_OF_TWO -> "not_power_of_two";
      case TOO_LARGE -> "too_large";
    };
  }

  public Num align() {
    return Num.ofUnsigned(align);
  }

  @Override
  public String toString() {
    String value = Long.toUnsignedString(align);
    return switch (kind) {
      case NOT_POWER_OF_TWO -> "`" + value + "` is not a power of 2";
      case TOO_LARGE -> "`" + value + "` is too large";
    };
  }
}
