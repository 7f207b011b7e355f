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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.hash.HashCode;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import com.solir.compiler.CompilerOptions;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * The plugins available to the engine, drawn from several providers.
 *
 * <p>When providers supply plugins of the same name, the provider ordered first by the {@link
 * PluginPrecedence} wins and the others are shadowed. Plugin instances live as long as the
 * registry, except that {@link #refresh} replaces the instances of providers whose fingerprint
 * changed and {@link #reinstantiate} replaces the instances of the providers asked for. Readers
 * always see either the old or the new set of plugins, never a mix.
 */
public final class PluginRegistry {
  private static final Logger logger = Logger.getLogger(PluginRegistry.class.getName());

  /** The resolved view, swapped as a whole. */
  private static final class Resolution {
    static final Resolution EMPTY = new Resolution(ImmutableMap.of(), ImmutableMap.of());

    final ImmutableMap<String, Plugin> byName;
    final ImmutableMap<String, String> providerByName;

    Resolution(ImmutableMap<String, Plugin> byName, ImmutableMap<String, String> providerByName) {
      this.byName = byName;
      this.providerByName = providerByName;
    }
  }

  private final ImmutableList<PluginProvider> providers;

  private final Object lock = new Object();

  @GuardedBy("lock")
  private final Map<String, HashCode> fingerprints = new HashMap<>();

  @GuardedBy("lock")
  private final Map<String, ImmutableList<Plugin>> loaded = new HashMap<>();

  private final AtomicReference<Resolution> resolution = new AtomicReference<>(Resolution.EMPTY);

  private PluginRegistry(List<PluginProvider> providers, PluginPrecedence precedence) {
    Set<String> ids = new HashSet<>();
    for (PluginProvider provider : providers) {
      checkArgument(ids.add(provider.getId()), "Duplicate plugin provider %s", provider.getId());
    }
    this.providers = ImmutableList.sortedCopyOf(checkNotNull(precedence), providers);
  }

  /** Creates a registry and loads every provider once. */
  public static PluginRegistry create(List<PluginProvider> providers, PluginPrecedence precedence) {
    PluginRegistry registry = new PluginRegistry(providers, precedence);
    registry.refresh();
    return registry;
  }

  /** The providers, highest precedence first. */
  public ImmutableList<PluginProvider> getProviders() {
    return providers;
  }

  /**
   * Reloads the providers whose fingerprint changed since they were last loaded, then swaps in the
   * new resolution. A provider that fails to load keeps its previous plugins and is retried on the
   * next refresh.
   *
   * @return the ids of the providers that were reloaded
   */
  @CanIgnoreReturnValue
  public ImmutableSet<String> refresh() {
    synchronized (lock) {
      return reload(ImmutableSet.of());
    }
  }

  /**
   * Creates new instances of the given plugins, by reloading every provider that supplied one of
   * them whether or not its fingerprint changed. Instances the registry does not know are ignored.
   *
   * @return the ids of the providers that were reloaded
   */
  @CanIgnoreReturnValue
  public ImmutableSet<String> reinstantiate(Collection<Plugin> plugins) {
    synchronized (lock) {
      Set<Plugin> stale = Sets.newIdentityHashSet();
      stale.addAll(plugins);
      ImmutableSet.Builder<String> owners = ImmutableSet.builder();
      for (Map.Entry<String, ImmutableList<Plugin>> entry : loaded.entrySet()) {
        for (Plugin plugin : entry.getValue()) {
          if (stale.contains(plugin)) {
            owners.add(entry.getKey());
            break;
          }
        }
      }
      return reload(owners.build());
    }
  }

  @GuardedBy("lock")
  private ImmutableSet<String> reload(ImmutableSet<String> forced) {
    ImmutableSet.Builder<String> reloaded = ImmutableSet.builder();
    for (PluginProvider provider : providers) {
      String id = provider.getId();
      try {
        HashCode fingerprint = provider.fingerprint();
        if (!forced.contains(id) && fingerprint.equals(fingerprints.get(id))) {
          continue;
        }
        ImmutableList<Plugin> plugins = provider.load();
        loaded.put(id, plugins);
        fingerprints.put(id, fingerprint);
        reloaded.add(id);
        logger.fine("Loaded " + plugins.size() + " plugins from " + provider);
      } catch (PluginLoadException | RuntimeException e) {
        logger.log(Level.SEVERE, "Cannot load plugins from " + provider, e);
      }
    }
    resolution.set(resolve());
    return reloaded.build();
  }

  @GuardedBy("lock")
  private Resolution resolve() {
    Map<String, Plugin> byName = new LinkedHashMap<>();
    Map<String, String> providerByName = new HashMap<>();
    for (PluginProvider provider : providers) {
      for (Plugin plugin : loaded.getOrDefault(provider.getId(), ImmutableList.of())) {
        String name;
        try {
          name = plugin.name();
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Cannot name plugin " + plugin.getClass().getName(), e);
          continue;
        }
        if (byName.containsKey(name)) {
          logger.fine(
              "Plugin " + name + " of " + provider + " is shadowed by "
                  + providerByName.get(name));
          continue;
        }
        byName.put(name, plugin);
        providerByName.put(name, provider.getId());
      }
    }
    return new Resolution(ImmutableMap.copyOf(byName), ImmutableMap.copyOf(providerByName));
  }

  /** All winning plugins, in precedence order of their providers. */
  public ImmutableList<Plugin> getPlugins() {
    return resolution.get().byName.values().asList();
  }

  public ImmutableSet<String> getPluginNames() {
    return resolution.get().byName.keySet();
  }

  public @Nullable Plugin getPlugin(String name) {
    return resolution.get().byName.get(name);
  }

  /** The id of the provider whose plugin won the given name. */
  public @Nullable String getProviderId(String name) {
    return resolution.get().providerByName.get(name);
  }

  /**
   * Returns the winning plugins with the given names, in the order given.
   *
   * @throws IllegalArgumentException if a name is unknown
   */
  public ImmutableList<Plugin> select(List<String> names) {
    Resolution current = resolution.get();
    ImmutableList.Builder<Plugin> selected = ImmutableList.builder();
    for (String name : names) {
      Plugin plugin = current.byName.get(name);
      checkArgument(plugin != null, "Unknown plugin %s", name);
      selected.add(plugin);
    }
    return selected.build();
  }

  /** An engine over the current plugins. Later refreshes do not affect it. */
  public PluginEngine newEngine(CompilerOptions options) {
    return new PluginEngine(getPlugins(), options);
  }
}
