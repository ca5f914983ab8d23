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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.nio.file.Path;
import org.diagarg.arg.ArgumentValue;
import org.diagarg.arg.IntoArgument;
import org.jspecify.annotations.Nullable;

/**
 * Identifies the compilation target: either a built-in target named by its triple (e.g. {@code
 * x86_64-unknown-linux-gnu}), or a custom target described by a JSON file.
 */
public final class TargetTriple implements IntoArgument {
  private final String triple;
  private final @Nullable Path jsonPath;

  private TargetTriple(String triple, @Nullable Path jsonPath) {
    this.triple = triple;
    this.jsonPath = jsonPath;
  }

  public static TargetTriple of(String triple) {
    checkArgument(!triple.isEmpty(), "Empty target triple");
    return new TargetTriple(triple, null);
  }

  /** A custom target; its triple is the name of the file without the {@code .json} extension. */
  public static TargetTriple ofJson(Path jsonPath) {
    String fileName = String.valueOf(checkNotNull(jsonPath.getFileName()));
    String triple =
        fileName.endsWith(".json") ? fileName.substring(0, fileName.length() - 5) : fileName;
    return new TargetTriple(triple, jsonPath);
  }

  public String triple() {
    return triple;
  }

  @Override
  public ArgumentValue intoArgument() {
    return ArgumentValue.str(toString());
  }

  /** Built-in targets are shown by triple, custom targets by the path to their file. */
  @Override
  public String toString() {
    return (jsonPath == null) ? triple : jsonPath.toString();
  }
}
