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

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders plugin providers. When two providers supply a plugin of the same name, the one ordered
 * first wins.
 *
 * <p>Providers are ordered by {@link PluginSource} first. Among packages, those named in the
 * explicit package order come first, in that order, and the rest follow by id.
 */
public final class PluginPrecedence implements Comparator<PluginProvider> {
  private static final PluginPrecedence DEFAULT = new PluginPrecedence(ImmutableList.of());

  private final ImmutableList<String> packageOrder;

  private PluginPrecedence(ImmutableList<String> packageOrder) {
    this.packageOrder = packageOrder;
  }

  public static PluginPrecedence defaults() {
    return DEFAULT;
  }

  /** Precedence with the given package ids ranked first, highest precedence first. */
  public static PluginPrecedence withPackageOrder(List<String> packageIds) {
    return new PluginPrecedence(ImmutableList.copyOf(checkNotNull(packageIds)));
  }

  public ImmutableList<String> getPackageOrder() {
    return packageOrder;
  }

  @Override
  public int compare(PluginProvider a, PluginProvider b) {
    return ComparisonChain.start()
        .compare(a.getSource(), b.getSource())
        .compare(packageRank(a), packageRank(b))
        .compare(a.getId(), b.getId())
        .result();
  }

  private int packageRank(PluginProvider provider) {
    if (provider.getSource() != PluginSource.PACKAGE) {
      return 0;
    }
    int index = packageOrder.indexOf(provider.getId());
    return index >= 0 ? index : packageOrder.size();
  }
}
