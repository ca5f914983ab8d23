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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.diagarg.arg.Args;
import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.DiagnosticArgument;
import org.diagarg.arg.IntoArgument;

/**
 * The Diag class is just a namespace for the interfaces that connect this library to the rest of
 * the compiler's error reporting.
 *
 * <p>{@link Context} and {@link Builder} are implemented by the emission layer, which is also
 * responsible for resolving TemplateKeys to text, rendering, and deciding what to do about errors.
 * {@link IntoDiagnostic} and {@link Subdiagnostic} are implemented here, by the structured values
 * that know how to describe themselves.
 */
public class Diag {

  // Just a namespace for the contained interfaces.
  private Diag() {}

  /** The starting point for creating a diagnostic. */
  public interface Context {
    /** Returns a new Builder for a diagnostic at the given level, using the given template. */
    Builder create(Level level, TemplateKey message);
  }

  /**
   * A diagnostic under construction. A Builder is owned by the code building it, and is not safe
   * for concurrent use.
   *
   * <p>Arguments are bound by name; binding a name a second time replaces the earlier value.
   * Labels, notes, and suggestions are kept in the order they are added.
   */
  public interface Builder {
    Level level();

    TemplateKey message();

    /** Binds a named argument for use by this diagnostic's templates. */
    @CanIgnoreReturnValue
    Builder arg(String name, ArgumentValue value);

    @CanIgnoreReturnValue
    default Builder arg(DiagnosticArgument arg) {
      return arg(arg.name, arg.value);
    }

    @CanIgnoreReturnValue
    default Builder arg(String name, IntoArgument value) {
      return arg(name, value.intoArgument());
    }

    @CanIgnoreReturnValue
    default Builder arg(String name, long value) {
      return arg(name, Args.of(value));
    }

    @CanIgnoreReturnValue
    default Builder arg(String name, boolean value) {
      return arg(name, Args.of(value));
    }

    /** Without this overload, chars would be widened to long and bound as numbers. */
    @CanIgnoreReturnValue
    default Builder arg(String name, char value) {
      return arg(name, Args.of(value));
    }

    @CanIgnoreReturnValue
    default Builder arg(String name, String value) {
      return arg(name, Args.of(value));
    }

    /** Adds a label with fixed text to the given span. */
    @CanIgnoreReturnValue
    Builder spanLabel(Span span, String label);

    /** Adds a label, whose text is given by a template, to the given span. */
    @CanIgnoreReturnValue
    Builder spanLabel(Span span, TemplateKey label);

    /** Adds the same fixed label to each of the given spans, in order. */
    @CanIgnoreReturnValue
    default Builder spanLabels(Iterable<Span> spans, String label) {
      for (Span span : spans) {
        spanLabel(span, label);
      }
      return this;
    }

    /** Adds a note, pointing at the given span, whose text is given by a template. */
    @CanIgnoreReturnValue
    Builder spanNote(Span span, TemplateKey note);

    /**
     * Adds a suggestion to replace the text covered by {@code span} with {@code code}.
     *
     * @param message a template describing the suggestion
     * @param code the replacement text, with any placeholders already filled in
     */
    @CanIgnoreReturnValue
    Builder spanSuggestion(
        Span span,
        TemplateKey message,
        String code,
        Applicability applicability,
        SuggestionStyle style);

    /** Merges the given subdiagnostic into this diagnostic. */
    @CanIgnoreReturnValue
    default Builder subdiagnostic(Subdiagnostic subdiagnostic) {
      subdiagnostic.addTo(this);
      return this;
    }
  }

  /** Implemented by structured values that can describe themselves as a complete diagnostic. */
  public interface IntoDiagnostic {
    /**
     * Returns a new diagnostic at the given level describing this value. Implementations choose the
     * template and bind all of the arguments it uses; they never fail.
     */
    Builder intoDiagnostic(Context dcx, Level level);
  }

  /**
   * Implemented by secondary annotations (labels, notes, and suggestions) that can be attached to
   * a diagnostic under construction.
   *
   * <p>Each subdiagnostic is created just before it is added, and should be added only once.
   */
  public interface Subdiagnostic {
    /**
     * Binds this subdiagnostic's fields as arguments of {@code diag} and attaches its span
     * annotation(s). Never fails.
     */
    void addTo(Builder diag);
  }

  /** Indicates how confident we are that a suggestion is what the user intended. */
  public enum Applicability {
    /** The suggestion is definitely what the user intended, and may be applied automatically. */
    MACHINE_APPLICABLE,
    /** The suggestion may be what the user intended, but that is uncertain. */
    MAYBE_INCORRECT,
    /** The suggestion contains placeholders like {@code (...)} that the user must fill in. */
    HAS_PLACEHOLDERS,
    /** The applicability of the suggestion is unknown. */
    UNSPECIFIED
  }

  /** Determines how a suggestion is displayed. */
  public enum SuggestionStyle {
    /** Show the suggested code separately, but not inline with the message. */
    HIDE_CODE_INLINE("short"),
    /** Don't show the suggested code at all, only the message. */
    HIDE_CODE_ALWAYS("hidden"),
    /** Don't display the suggestion to people; it is only for tools. */
    COMPLETELY_HIDDEN("tool-only"),
    /** Show the suggested code inline if it's short enough, otherwise separately. */
    SHOW_CODE("normal"),
    /** Always show the suggested code separately, even if it is short. */
    SHOW_ALWAYS("verbose");

    /** The name used to request this style when declaring a suggestion. */
    public final String attrName;

    SuggestionStyle(String attrName) {
      this.attrName = attrName;
    }
  }
}
