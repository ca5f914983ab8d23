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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CharMatcher;
import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

/**
 * An opaque identifier for a message template, resolved to localized text by the emission layer.
 * This library only selects TemplateKeys; it never looks inside them.
 *
 * <p>TemplateKeys are interned, so they can be compared with {@code ==}.
 */
public final class TemplateKey {
  private static final Interner<TemplateKey> INTERNER = Interners.newStrongInterner();

  private static final CharMatcher SLUG_CHARS =
      CharMatcher.inRange('a', 'z').or(CharMatcher.inRange('0', '9')).or(CharMatcher.is('_'));

  public final String slug;

  private TemplateKey(String slug) {
    this.slug = slug;
  }

  /** Returns the TemplateKey with the given slug, which must be lower_snake_case. */
  public static TemplateKey of(String slug) {
    checkArgument(!slug.isEmpty() && SLUG_CHARS.matchesAllOf(slug), "Bad template slug: %s", slug);
    return INTERNER.intern(new TemplateKey(slug));
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TemplateKey other && slug.equals(other.slug);
  }

  @Override
  public int hashCode() {
    return slug.hashCode();
  }

  @Override
  public String toString() {
    return slug;
  }
}
