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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;

/**
 * A path such as {@code std::collections::HashMap<K, V>}: a sequence of segments separated by
 * {@code ::}, each of which may have generic arguments, optionally preceded by {@code ::}.
 */
public final class Path implements IntoArgument {
  private static final Splitter PATH_SEP = Splitter.on("::");

  /** One element of a Path. */
  public static final class Segment {
    public final Ident ident;

    /** The generic arguments to this segment; usually empty. */
    public final ImmutableList<Path> args;

    public Segment(Ident ident, List<Path> args) {
      this.ident = ident;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public String toString() {
      return PrettyPrinter.pathSegmentToString(this);
    }
  }

  /** True if this path began with {@code ::}. */
  public final boolean global;

  public final ImmutableList<Segment> segments;

  public Path(boolean global, List<Segment> segments) {
    checkArgument(!segments.isEmpty(), "Path with no segments");
    this.global = global;
    this.segments = ImmutableList.copyOf(segments);
  }

  /**
   * Parses a path with no generic arguments, e.g. {@code "::std::mem::swap"}. Segments are taken
   * literally, so e.g. {@code "r#match"} is not recognized as a raw identifier.
   */
  public static Path parse(String text) {
    boolean global = text.startsWith("::");
    if (global) {
      text = text.substring(2);
    }
    ImmutableList.Builder<Segment> segments = ImmutableList.builder();
    for (String name : PATH_SEP.split(text)) {
      checkArgument(!name.isEmpty(), "Empty path segment in %s", text);
      segments.add(new Segment(Ident.of(name), ImmutableList.of()));
    }
    return new Path(global, segments.build());
  }

  /** Returns a new Path whose last segment has the given generic arguments. */
  public Path withArgs(Path... args) {
    int last = segments.size() - 1;
    ImmutableList.Builder<Segment> builder = ImmutableList.builder();
    builder.addAll(segments.subList(0, last));
    builder.add(new Segment(segments.get(last).ident, ImmutableList.copyOf(args)));
    return new Path(global, builder.build());
  }

  /** Returns true if this path is the single (non-global) identifier {@code name}. */
  public boolean isIdent(String name) {
    return !global
        && segments.size() == 1
        && segments.get(0).args.isEmpty()
        && segments.get(0).ident.name.name.equals(name);
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(PrettyPrinter.pathToString(this));
  }

  @Override
  public String toString() {
    return PrettyPrinter.pathToString(this);
  }
}
