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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;

/**
 * Loads plugins from a directory of classes and jars.
 *
 * <p>Plugins are declared the {@link java.util.ServiceLoader} way, in {@code
 * META-INF/services/com.solir.plugin.Plugin} files inside the directory or its top-level jars.
 * Only declarations found there count; declarations elsewhere on the class path are ignored. Each
 * {@link #load} uses a new class loader, so edited classes are picked up.
 */
public final class DirectoryPluginProvider implements PluginProvider {
  private static final Logger logger = Logger.getLogger(DirectoryPluginProvider.class.getName());

  static final String SERVICE_FILE = "META-INF/services/" + Plugin.class.getName();

  private final String id;
  private final PluginSource source;
  private final Path directory;

  private @Nullable URLClassLoader loader;

  public DirectoryPluginProvider(String id, PluginSource source, Path directory) {
    this.id = checkNotNull(id);
    this.source = checkNotNull(source);
    this.directory = checkNotNull(directory);
  }

  @Override
  public String getId() {
    return id;
  }

  @Override
  public PluginSource getSource() {
    return source;
  }

  public Path getDirectory() {
    return directory;
  }

  @Override
  public HashCode fingerprint() throws PluginLoadException {
    Hasher hasher = Hashing.sha256().newHasher();
    if (!Files.isDirectory(directory)) {
      return hasher.hash();
    }
    try (Stream<Path> files = Files.walk(directory)) {
      for (Path file : files.filter(Files::isRegularFile).sorted().collect(Collectors.toList())) {
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        hasher
            .putString(directory.relativize(file).toString(), StandardCharsets.UTF_8)
            .putLong(attributes.size())
            .putLong(attributes.lastModifiedTime().toMillis());
      }
    } catch (IOException e) {
      throw new PluginLoadException("Cannot scan plugin directory " + directory, e);
    }
    return hasher.hash();
  }

  @Override
  public synchronized ImmutableList<Plugin> load() throws PluginLoadException {
    if (!Files.isDirectory(directory)) {
      return ImmutableList.of();
    }
    URLClassLoader fresh = new URLClassLoader(classPath(), Plugin.class.getClassLoader());
    ImmutableList<Plugin> plugins;
    try {
      plugins = instantiate(fresh, declaredClassNames(fresh));
    } catch (PluginLoadException | RuntimeException e) {
      closeQuietly(fresh);
      throw e;
    }
    if (loader != null) {
      closeQuietly(loader);
    }
    loader = fresh;
    return plugins;
  }

  private URL[] classPath() throws PluginLoadException {
    List<URL> urls = new ArrayList<>();
    try {
      urls.add(directory.toUri().toURL());
      try (Stream<Path> entries = Files.list(directory)) {
        for (Path jar :
            entries
                .filter(p -> p.getFileName().toString().endsWith(".jar"))
                .sorted()
                .collect(Collectors.toList())) {
          urls.add(jar.toUri().toURL());
        }
      }
    } catch (IOException e) {
      throw new PluginLoadException("Cannot list plugin directory " + directory, e);
    }
    return urls.toArray(new URL[0]);
  }

  private static Set<String> declaredClassNames(URLClassLoader loader)
      throws PluginLoadException {
    Set<String> names = new LinkedHashSet<>();
    try {
      Enumeration<URL> declarations = loader.findResources(SERVICE_FILE);
      while (declarations.hasMoreElements()) {
        URL declaration = declarations.nextElement();
        try (BufferedReader reader =
            new BufferedReader(
                new InputStreamReader(declaration.openStream(), StandardCharsets.UTF_8))) {
          String line;
          while ((line = reader.readLine()) != null) {
            String name = Splitter.on('#').splitToList(line).get(0).trim();
            if (!name.isEmpty()) {
              names.add(name);
            }
          }
        }
      }
    } catch (IOException e) {
      throw new PluginLoadException("Cannot read plugin declarations in " + loader, e);
    }
    return names;
  }

  private static ImmutableList<Plugin> instantiate(ClassLoader loader, Set<String> classNames)
      throws PluginLoadException {
    ImmutableList.Builder<Plugin> plugins = ImmutableList.builder();
    for (String className : classNames) {
      try {
        Class<? extends Plugin> type =
            Class.forName(className, true, loader).asSubclass(Plugin.class);
        plugins.add(type.getDeclaredConstructor().newInstance());
      } catch (ReflectiveOperationException | ClassCastException | LinkageError e) {
        throw new PluginLoadException("Cannot instantiate plugin class " + className, e);
      }
    }
    return plugins.build();
  }

  private static void closeQuietly(URLClassLoader loader) {
    try {
      loader.close();
    } catch (IOException e) {
      logger.log(Level.WARNING, "Cannot close plugin class loader", e);
    }
  }

  @Override
  public String toString() {
    return id + " (" + source + ", " + directory + ")";
  }
}
