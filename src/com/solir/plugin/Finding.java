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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.solir.ir.Node;
import org.jspecify.annotations.Nullable;

/**
 * One result reported by a plugin, anchored at a node. Findings may carry sub-findings pointing at
 * related locations, such as the other side of a dangerous call.
 *
 * @param node where the finding is reported
 * @param message what was found
 * @param impact how bad it is if the finding is real
 * @param confidence how likely the finding is real
 * @param subfindings related locations
 * @param uri documentation of the finding, if any
 */
public record Finding(
    Node node,
    String message,
    Impact impact,
    Confidence confidence,
    ImmutableList<Finding> subfindings,
    @Nullable String uri) {

  /** Severity of a finding. */
  public enum Impact {
    HIGH,
    MEDIUM,
    LOW,
    WARNING,
    INFO
  }

  /** Certainty of a finding. */
  public enum Confidence {
    HIGH,
    MEDIUM,
    LOW
  }

  public Finding {
    checkNotNull(node);
    checkNotNull(message);
    checkNotNull(impact);
    checkNotNull(confidence);
    checkNotNull(subfindings);
  }

  public static Finding of(Node node, String message, Impact impact, Confidence confidence) {
    return new Finding(node, message, impact, confidence, ImmutableList.of(), null);
  }

  /** An informational finding, as printers report. */
  public static Finding info(Node node, String message) {
    return of(node, message, Impact.INFO, Confidence.HIGH);
  }

  public Finding withSubfindings(Finding... related) {
    return new Finding(
        node,
        message,
        impact,
        confidence,
        ImmutableList.<Finding>builder().addAll(subfindings).add(related).build(),
        uri);
  }

  public Finding withUri(String uri) {
    return new Finding(node, message, impact, confidence, subfindings, checkNotNull(uri));
  }
}
