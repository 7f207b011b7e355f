/*
 * Copyright 2026 The Solir Authors.
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

package com.solir.plugin;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.solir.ir.Node;
import com.solir.ir.SourceFile;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Line comments that silence plugins in a source file:
 *
 * <ul>
 *   <li>{@code // solir-disable-line a, b} on the line of a finding,
 *   <li>{@code // solir-disable-next-line a} on the line before it,
 *   <li>{@code // solir-disable a} and {@code // solir-enable a} around a region.
 * </ul>
 *
 * Without plugin names a comment applies to every plugin.
 */
final class SuppressionComments {
  private static final Pattern COMMENT =
      Pattern.compile(
          "^\\s*solir-(disable-next-line|disable-line|disable|enable)(?:\\s+|$)"
              + "([a-zA-Z0-9_-]*(?:\\s*,\\s*[a-zA-Z0-9_-]+)*)");

  private static final Splitter NAME_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  // Keyed by one-based line. An empty set stands for every plugin.
  private final Map<Integer, ImmutableSet<String>> disableLine = new TreeMap<>();
  private final Map<Integer, ImmutableSet<String>> disableNextLine = new TreeMap<>();
  private final TreeMap<Integer, ImmutableSet<String>> disable = new TreeMap<>();
  private final TreeMap<Integer, ImmutableSet<String>> enable = new TreeMap<>();

  private SuppressionComments() {}

  static SuppressionComments parse(SourceFile file) {
    SuppressionComments comments = new SuppressionComments();
    int lineno = 0;
    for (String line : Splitter.on('\n').split(file.getCode())) {
      lineno++;
      String comment = lineComment(line);
      if (comment == null) {
        continue;
      }
      Matcher m = COMMENT.matcher(comment);
      if (!m.find()) {
        continue;
      }
      ImmutableSet<String> names = ImmutableSet.copyOf(NAME_SPLITTER.split(m.group(2)));
      switch (m.group(1)) {
        case "disable-line":
          comments.disableLine.put(lineno, names);
          break;
        case "disable-next-line":
          comments.disableNextLine.put(lineno, names);
          break;
        case "disable":
          comments.disable.put(lineno, names);
          break;
        default:
          comments.enable.put(lineno, names);
      }
    }
    return comments;
  }

  /** Returns the text after {@code //} outside of string literals, or null. */
  private static @Nullable String lineComment(String line) {
    char quote = 0;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (quote != 0) {
        if (c == '\\') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
      } else if (c == '"' || c == '\'') {
        quote = c;
      } else if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
        return line.substring(i + 2);
      }
    }
    return null;
  }

  private static boolean applies(@Nullable ImmutableSet<String> names, String plugin) {
    return names != null && (names.isEmpty() || names.contains(plugin));
  }

  /** Whether findings of {@code plugin} at {@code node} are silenced. */
  boolean isSuppressed(String plugin, Node node) {
    SourceFile file = node.getSourceFile();
    if (file == null || node.getSpan() == null) {
      return false;
    }
    int start = node.getLineno();
    int end =
        node.getToken().isDeclaration()
            ? start
            : file.getLineOfOffset(Math.max(node.getSpan().offset(), node.getSpan().end() - 1));
    for (int line = start; line <= end; line++) {
      if (applies(disableLine.get(line), plugin)
          || applies(disableNextLine.get(line - 1), plugin)) {
        return true;
      }
    }

    Integer disabledAt = null;
    for (Map.Entry<Integer, ImmutableSet<String>> entry : disable.headMap(start).entrySet()) {
      if (applies(entry.getValue(), plugin)) {
        disabledAt = entry.getKey();
      }
    }
    if (disabledAt == null) {
      return false;
    }
    for (Map.Entry<Integer, ImmutableSet<String>> entry :
        enable.subMap(disabledAt, false, start, false).entrySet()) {
      if (applies(entry.getValue(), plugin)) {
        return false;
      }
    }
    return true;
  }
}
