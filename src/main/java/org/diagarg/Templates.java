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

/** The TemplateKeys for all diagnostics and subdiagnostics created by this library. */
public final class Templates {

  // Constants only
  private Templates() {}

  public static final TemplateKey TARGET_INVALID_ADDRESS_SPACE =
      TemplateKey.of("errors_target_invalid_address_space");
  public static final TemplateKey TARGET_INVALID_BITS =
      TemplateKey.of("errors_target_invalid_bits");
  public static final TemplateKey TARGET_MISSING_ALIGNMENT =
      TemplateKey.of("errors_target_missing_alignment");
  public static final TemplateKey TARGET_INVALID_ALIGNMENT =
      TemplateKey.of("errors_target_invalid_alignment");
  public static final TemplateKey TARGET_INCONSISTENT_ARCHITECTURE =
      TemplateKey.of("errors_target_inconsistent_architecture");
  public static final TemplateKey TARGET_INCONSISTENT_POINTER_WIDTH =
      TemplateKey.of("errors_target_inconsistent_pointer_width");
  public static final TemplateKey TARGET_INVALID_BITS_SIZE =
      TemplateKey.of("errors_target_invalid_bits_size");

  public static final TemplateKey EXPECTED_LIFETIME_PARAMETER =
      TemplateKey.of("errors_expected_lifetime_parameter");
  public static final TemplateKey DELAYED_AT_WITH_NEWLINE =
      TemplateKey.of("errors_delayed_at_with_newline");
  public static final TemplateKey DELAYED_AT_WITHOUT_NEWLINE =
      TemplateKey.of("errors_delayed_at_without_newline");
  public static final TemplateKey INVALID_FLUSHED_DELAYED_DIAGNOSTIC_LEVEL =
      TemplateKey.of("errors_invalid_flushed_delayed_diagnostic_level");
  public static final TemplateKey INDICATE_ANONYMOUS_LIFETIME =
      TemplateKey.of("errors_indicate_anonymous_lifetime");
}
