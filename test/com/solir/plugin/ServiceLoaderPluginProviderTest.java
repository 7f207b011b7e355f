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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ServiceLoaderPluginProviderTest {
  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void testLoadsPluginsDeclaredToTheClassLoader() throws Exception {
    Path directory = folder.newFolder("package").toPath();
    DirectoryPluginProviderTest.declare(directory, SamplePlugins.Calls.class.getName());

    try (URLClassLoader loader =
        new URLClassLoader(
            new URL[] {directory.toUri().toURL()}, getClass().getClassLoader())) {
      ServiceLoaderPluginProvider provider = new ServiceLoaderPluginProvider("pkg", loader);
      assertThat(provider.getSource()).isEqualTo(PluginSource.PACKAGE);
      assertThat(provider.fingerprint()).isEqualTo(provider.fingerprint());

      ImmutableList<Plugin> plugins = provider.load();
      assertThat(plugins).hasSize(1);
      assertThat(plugins.get(0)).isInstanceOf(SamplePlugins.Calls.class);
      assertThat(provider.load().get(0)).isNotSameInstanceAs(plugins.get(0));
    }
  }

  @Test
  public void testProjectDirectoryShadowsPackage() throws Exception {
    Path packaged = folder.newFolder("package").toPath();
    DirectoryPluginProviderTest.declare(packaged, SamplePlugins.Calls.class.getName());
    Path local = folder.newFolder("local").toPath();
    DirectoryPluginProviderTest.declare(local, SamplePlugins.Calls.class.getName());

    try (URLClassLoader loader =
        new URLClassLoader(new URL[] {packaged.toUri().toURL()}, getClass().getClassLoader())) {
      PluginRegistry registry =
          PluginRegistry.create(
              ImmutableList.of(
                  new ServiceLoaderPluginProvider("pkg", loader),
                  new DirectoryPluginProvider("project", PluginSource.PROJECT_LOCAL, local)),
              PluginPrecedence.defaults());
      assertThat(registry.getProviderId("calls")).isEqualTo("project");
    }
  }
}
