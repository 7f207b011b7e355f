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
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Exposes the plugins a class loader declares through {@link ServiceLoader}. Packages on the class
 * path do not change while the process runs, so the fingerprint is fixed.
 */
public final class ServiceLoaderPluginProvider implements PluginProvider {
  private final String id;
  private final ClassLoader classLoader;

  public ServiceLoaderPluginProvider(String id, ClassLoader classLoader) {
    this.id = checkNotNull(id);
    this.classLoader = checkNotNull(classLoader);
  }

  /** A provider for the plugins on the class path of this library. */
  public static ServiceLoaderPluginProvider forClassPath(String id) {
    return new ServiceLoaderPluginProvider(id, Plugin.class.getClassLoader());
  }

  @Override
  public String getId() {
    return id;
  }

  @Override
  public PluginSource getSource() {
    return PluginSource.PACKAGE;
  }

  @Override
  public HashCode fingerprint() {
    return Hashing.sha256().hashString(id, StandardCharsets.UTF_8);
  }

  @Override
  public ImmutableList<Plugin> load() throws PluginLoadException {
    try {
      return ImmutableList.copyOf(ServiceLoader.load(Plugin.class, classLoader));
    } catch (ServiceConfigurationError e) {
      throw new PluginLoadException("Cannot load packaged plugins of " + id, e);
    }
  }

  @Override
  public String toString() {
    return id + " (" + PluginSource.PACKAGE + ")";
  }
}
