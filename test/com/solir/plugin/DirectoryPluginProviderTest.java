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
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DirectoryPluginProviderTest {
  @Rule public final TemporaryFolder folder = new TemporaryFolder();

  private Path directory;
  private DirectoryPluginProvider provider;

  @Before
  public void setUp() throws IOException {
    directory = folder.newFolder("plugins").toPath();
    provider = new DirectoryPluginProvider("user", PluginSource.USER_GLOBAL, directory);
  }

  static void declare(Path directory, String... classNames) throws IOException {
    Path services = directory.resolve(DirectoryPluginProvider.SERVICE_FILE);
    Files.createDirectories(services.getParent());
    Files.write(services, ImmutableList.copyOf(classNames), UTF_8);
  }

  @Test
  public void testLoadsDeclaredPlugins() throws Exception {
    declare(
        directory,
        "# plugins of this user",
        SamplePlugins.Calls.class.getName(),
        SamplePlugins.Reverts.class.getName() + "  # control flow");

    ImmutableList<Plugin> plugins = provider.load();
    assertThat(plugins).hasSize(2);
    assertThat(plugins.get(0).name()).isEqualTo("calls");
    assertThat(plugins.get(1).name()).isEqualTo("reverts");
  }

  @Test
  public void testEachLoadCreatesNewInstances() throws Exception {
    declare(directory, SamplePlugins.Calls.class.getName());

    Plugin first = provider.load().get(0);
    Plugin second = provider.load().get(0);
    assertThat(second).isNotSameInstanceAs(first);
  }

  @Test
  public void testFingerprintFollowsFiles() throws Exception {
    declare(directory, SamplePlugins.Calls.class.getName());
    HashCode before = provider.fingerprint();
    assertThat(provider.fingerprint()).isEqualTo(before);

    Files.write(directory.resolve("notes.txt"), ImmutableList.of("x"), UTF_8);
    assertThat(provider.fingerprint()).isNotEqualTo(before);
  }

  @Test
  public void testMissingDirectoryHasNoPlugins() throws Exception {
    DirectoryPluginProvider missing =
        new DirectoryPluginProvider(
            "gone", PluginSource.PROJECT_LOCAL, directory.resolve("does-not-exist"));

    assertThat(missing.load()).isEmpty();
    assertThat(missing.fingerprint()).isEqualTo(missing.fingerprint());
  }

  @Test
  public void testUnknownClassFails() throws Exception {
    declare(directory, "com.solir.plugin.NoSuchPlugin");

    PluginLoadException e = assertThrows(PluginLoadException.class, provider::load);
    assertThat(e).hasMessageThat().contains("com.solir.plugin.NoSuchPlugin");
  }

  @Test
  public void testClassThatIsNotAPluginFails() throws Exception {
    declare(directory, String.class.getName());

    assertThrows(PluginLoadException.class, provider::load);
  }

  @Test
  public void testRegistryPicksUpChangedDirectory() throws Exception {
    declare(directory, SamplePlugins.Calls.class.getName());
    PluginRegistry registry =
        PluginRegistry.create(ImmutableList.of(provider), PluginPrecedence.defaults());
    assertThat(registry.getPluginNames()).containsExactly("calls");

    declare(directory, SamplePlugins.Calls.class.getName(), SamplePlugins.Throwing.class.getName());
    assertThat(registry.refresh()).containsExactly("user");
    assertThat(registry.getPluginNames()).containsExactly("calls", "throwing").inOrder();
  }
}
