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

import static com.google.common.base.Preconditions.checkNotNull;

import org.diagarg.Diag;
import org.diagarg.Level;
import org.diagarg.Templates;
import org.diagarg.arg.Args;

/**
 * An error found while parsing the data layout string of a target specification (e.g. {@code
 * "e-m:e-p270:32:32-i64:64-n8:16:32:64-S128"}) or while checking it against the rest of the
 * target.
 *
 * <p>Each cause is a nested subclass; the private constructor ensures that there are no others.
 * {@link #intoDiagnostic} describes each with its own template and arguments, and relies on {@link
 * Visitor} (which has a method for each subclass) to make sure that none is forgotten.
 */
public abstract class TargetDataLayoutError implements Diag.IntoDiagnostic {

  private TargetDataLayoutError() {}

  public abstract <T> T accept(Visitor<T> visitor);

  @Override
  public Diag.Builder intoDiagnostic(Diag.Context dcx, Level level) {
    return accept(new Describer(dcx, level));
  }

  /** Has one method for each subclass of TargetDataLayoutError. */
  public interface Visitor<T> {
    T visitInvalidAddressSpace(InvalidAddressSpace error);

    T visitInvalidBits(InvalidBits error);

    T visitMissingAlignment(MissingAlignment error);

    T visitInvalidAlignment(InvalidAlignment error);

    T visitInconsistentTargetArchitecture(InconsistentTargetArchitecture error);

    T visitInconsistentTargetPointerWidth(InconsistentTargetPointerWidth error);

    T visitInvalidBitsSize(InvalidBitsSize error);
  }

  /** An address space (the number after e.g. {@code P} or {@code A}) didn't parse. */
  public static final class InvalidAddressSpace extends TargetDataLayoutError {
    public final String addrSpace;
    public final String cause;
    public final NumberFormatException err;

    public InvalidAddressSpace(String addrSpace, String cause, NumberFormatException err) {
      this.addrSpace = checkNotNull(addrSpace);
      this.cause = checkNotNull(cause);
      this.err = checkNotNull(err);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitInvalidAddressSpace(this);
    }
  }

  /** A size or alignment in bits didn't parse. */
  public static final class InvalidBits extends TargetDataLayoutError {
    /** What the bits describe, e.g. "alignment" or "size". */
    public final String kind;

    public final String bit;
    public final String cause;
    public final NumberFormatException err;

    public InvalidBits(String kind, String bit, String cause, NumberFormatException err) {
      this.kind = checkNotNull(kind);
      this.bit = checkNotNull(bit);
      this.cause = checkNotNull(cause);
      this.err = checkNotNull(err);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitInvalidBits(this);
    }
  }

  /** A layout spec that requires an alignment didn't have one. */
  public static final class MissingAlignment extends TargetDataLayoutError {
    public final String cause;

    public MissingAlignment(String cause) {
      this.cause = checkNotNull(cause);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMissingAlignment(this);
    }
  }

  /** An alignment parsed but wasn't a usable value. */
  public static final class InvalidAlignment extends TargetDataLayoutError {
    public final String cause;
    public final AlignFromBytesError err;

    public InvalidAlignment(String cause, AlignFromBytesError err) {
      this.cause = checkNotNull(cause);
      this.err = checkNotNull(err);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitInvalidAlignment(this);
    }
  }

  /** The data layout's endianness doesn't match the target's. */
  public static final class InconsistentTargetArchitecture extends TargetDataLayoutError {
    public final String dl;
    public final String target;

    public InconsistentTargetArchitecture(String dl, String target) {
      this.dl = checkNotNull(dl);
      this.target = checkNotNull(target);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitInconsistentTargetArchitecture(this);
    }
  }

  /** The data layout's pointer size doesn't match the target's pointer width. */
  public static final class InconsistentTargetPointerWidth extends TargetDataLayoutError {
    /** In bits, unsigned. */
    public final long pointerSize;

    /** In bits, unsigned. */
    public final int target;

    public InconsistentTargetPointerWidth(long pointerSize, int target) {
      this.pointerSize = pointerSize;
      this.target = target;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitInconsistentTargetPointerWidth(this);
    }
  }

  /** The target's {@code target-c-int-width} didn't parse. */
  public static final class InvalidBitsSize extends TargetDataLayoutError {
    public final String err;

    public InvalidBitsSize(String err) {
      this.err = checkNotNull(err);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitInvalidBitsSize(this);
    }
  }

  /**
   * Chooses the template for each kind of error and binds its arguments. Parse errors are bound
   * by their message; the InvalidAlignment error is bound as two separate arguments (which kind of
   * problem, and the rejected value) so that templates can phrase each case differently.
   */
  private static final class Describer implements Visitor<Diag.Builder> {
    private final Diag.Context dcx;
    private final Level level;

    Describer(Diag.Context dcx, Level level) {
      this.dcx = dcx;
      this.level = level;
    }

    @Override
    public Diag.Builder visitInvalidAddressSpace(InvalidAddressSpace error) {
      return dcx.create(level, Templates.TARGET_INVALID_ADDRESS_SPACE)
          .arg("addr_space", error.addrSpace)
          .arg("cause", error.cause)
          .arg("err", Args.of(error.err));
    }

    @Override
    public Diag.Builder visitInvalidBits(InvalidBits error) {
      return dcx.create(level, Templates.TARGET_INVALID_BITS)
          .arg("kind", error.kind)
          .arg("bit", error.bit)
          .arg("cause", error.cause)
          .arg("err", Args.of(error.err));
    }

    @Override
    public Diag.Builder visitMissingAlignment(MissingAlignment error) {
      return dcx.create(level, Templates.TARGET_MISSING_ALIGNMENT).arg("cause", error.cause);
    }

    @Override
    public Diag.Builder visitInvalidAlignment(InvalidAlignment error) {
      return dcx.create(level, Templates.TARGET_INVALID_ALIGNMENT)
          .arg("cause", error.cause)
          .arg("err_kind", error.err.diagIdent())
          .arg("align", error.err.align());
    }

    @Override
    public Diag.Builder visitInconsistentTargetArchitecture(
        InconsistentTargetArchitecture error) {
      return dcx.create(level, Templates.TARGET_INCONSISTENT_ARCHITECTURE)
          .arg("dl", error.dl)
          .arg("target", error.target);
    }

    @Override
    public Diag.Builder visitInconsistentTargetPointerWidth(
        InconsistentTargetPointerWidth error) {
      return dcx.create(level, Templates.TARGET_INCONSISTENT_POINTER_WIDTH)
          .arg("pointer_size", Args.ofUnsigned(error.pointerSize))
          .arg("target", Args.ofUnsigned(error.target));
    }

    @Override
    public Diag.Builder visitInvalidBitsSize(InvalidBitsSize error) {
      return dcx.create(level, Templates.TARGET_INVALID_BITS_SIZE).arg("err", error.err);
    }
  }
}
