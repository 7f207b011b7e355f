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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.solir.compiler.CompilerOptions;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class PluginRegistryTest {

  /** A provider whose plugins and fingerprint the test controls. */
  private static final class FakeProvider implements PluginProvider {
    private final String id;
    private final PluginSource source;
    private final List<String> names = new ArrayList<>();
    private int version;
    private boolean broken;
    private int loads;

    FakeProvider(String id, PluginSource source, String... names) {
      this.id = id;
      this.source = source;
      this.names.addAll(ImmutableList.copyOf(names));
    }

    void change(String... newNames) {
      names.clear();
      names.addAll(ImmutableList.copyOf(newNames));
      version++;
    }

    @Override
    public String getId() {
      return id;
    }

    @Override
    public PluginSource getSource() {
      return source;
    }

    @Override
    public HashCode fingerprint() {
      return Hashing.sha256().hashInt(version);
    }

    @Override
    public ImmutableList<Plugin> load() throws PluginLoadException {
      loads++;
      if (broken) {
        throw new PluginLoadException("broken " + id);
      }
      ImmutableList.Builder<Plugin> plugins = ImmutableList.builder();
      for (String name : names) {
        plugins.add(new SamplePlugins.Named(name));
      }
      return plugins.build();
    }

    @Override
    public String toString() {
      return id;
    }
  }

  @Test
  public void testProjectLocalShadowsUserAndPackagePlugins() {
    FakeProvider pkg = new FakeProvider("pkg", PluginSource.PACKAGE, "a", "b", "c");
    FakeProvider user = new FakeProvider("user", PluginSource.USER_GLOBAL, "b", "c");
    FakeProvider local = new FakeProvider("local", PluginSource.PROJECT_LOCAL, "c");
    PluginRegistry registry =
        PluginRegistry.create(ImmutableList.of(pkg, user, local), PluginPrecedence.defaults());

    assertThat(registry.getProviders()).containsExactly(local, user, pkg).inOrder();
    assertThat(registry.getPluginNames()).containsExactly("c", "b", "a").inOrder();
    assertThat(registry.getProviderId("a")).isEqualTo("pkg");
    assertThat(registry.getProviderId("b")).isEqualTo("user");
    assertThat(registry.getProviderId("c")).isEqualTo("local");
    assertThat(registry.getPlugin("d")).isNull();
  }

  @Test
  public void testPackageOrder() {
    FakeProvider first = new FakeProvider("first", PluginSource.PACKAGE, "p");
    FakeProvider second = new FakeProvider("second", PluginSource.PACKAGE, "p");
    FakeProvider unlisted = new FakeProvider("another", PluginSource.PACKAGE, "p", "q");

    PluginRegistry byId =
        PluginRegistry.create(
            ImmutableList.of(first, second, unlisted), PluginPrecedence.defaults());
    assertThat(byId.getProviderId("p")).isEqualTo("another");

    PluginRegistry ordered =
        PluginRegistry.create(
            ImmutableList.of(first, second, unlisted),
            PluginPrecedence.withPackageOrder(ImmutableList.of("second", "first")));
    assertThat(ordered.getProviders()).containsExactly(second, first, unlisted).inOrder();
    assertThat(ordered.getProviderId("p")).isEqualTo("second");
    assertThat(ordered.getProviderId("q")).isEqualTo("another");
  }

  @Test
  public void testDuplicateProviderIdIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            PluginRegistry.create(
                ImmutableList.of(
                    new FakeProvider("x", PluginSource.PACKAGE),
                    new FakeProvider("x", PluginSource.USER_GLOBAL)),
                PluginPrecedence.defaults()));
  }

  @Test
  public void testRefreshReloadsOnlyChangedProviders() {
    FakeProvider pkg = new FakeProvider("pkg", PluginSource.PACKAGE, "a");
    FakeProvider user = new FakeProvider("user", PluginSource.USER_GLOBAL, "b");
    PluginRegistry registry =
        PluginRegistry.create(ImmutableList.of(pkg, user), PluginPrecedence.defaults());
    Plugin a = registry.getPlugin("a");
    Plugin b = registry.getPlugin("b");

    assertThat(registry.refresh()).isEmpty();
    assertThat(registry.getPlugin("a")).isSameInstanceAs(a);

    user.change("b", "a");
    assertThat(registry.refresh()).containsExactly("user");
    assertThat(pkg.loads).isEqualTo(1);
    assertThat(user.loads).isEqualTo(2);
    assertThat(registry.getPlugin("b")).isNotSameInstanceAs(b);
    assertThat(registry.getProviderId("a")).isEqualTo("user");
  }

  @Test
  public void testFailedReloadKeepsPreviousPlugins() {
    FakeProvider user = new FakeProvider("user", PluginSource.USER_GLOBAL, "b");
    PluginRegistry registry =
        PluginRegistry.create(ImmutableList.of(user), PluginPrecedence.defaults());
    Plugin b = registry.getPlugin("b");

    user.change("c");
    user.broken = true;
    assertThat(registry.refresh()).isEmpty();
    assertThat(registry.getPluginNames()).containsExactly("b");
    assertThat(registry.getPlugin("b")).isSameInstanceAs(b);

    user.broken = false;
    assertThat(registry.refresh()).containsExactly("user");
    assertThat(registry.getPluginNames()).containsExactly("c");
  }

  @Test
  public void testReinstantiateReloadsOnlyTheOwningProvider() {
    FakeProvider pkg = new FakeProvider("pkg", PluginSource.PACKAGE, "a");
    FakeProvider user = new FakeProvider("user", PluginSource.USER_GLOBAL, "b");
    PluginRegistry registry =
        PluginRegistry.create(ImmutableList.of(pkg, user), PluginPrecedence.defaults());
    Plugin a = registry.getPlugin("a");
    Plugin b = registry.getPlugin("b");

    assertThat(registry.reinstantiate(ImmutableList.of(b, new SamplePlugins.Named("b"))))
        .containsExactly("user");
    assertThat(user.loads).isEqualTo(2);
    assertThat(pkg.loads).isEqualTo(1);
    assertThat(registry.getPlugin("b")).isNotSameInstanceAs(b);
    assertThat(registry.getPlugin("a")).isSameInstanceAs(a);

    assertThat(registry.reinstantiate(ImmutableList.of(b))).isEmpty();
  }

  @Test
  public void testSelect() {
    PluginRegistry registry =
        PluginRegistry.create(
            ImmutableList.of(new FakeProvider("pkg", PluginSource.PACKAGE, "a", "b")),
            PluginPrecedence.defaults());

    assertThat(registry.select(ImmutableList.of("b", "a")))
        .containsExactly(registry.getPlugin("b"), registry.getPlugin("a"))
        .inOrder();
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> registry.select(ImmutableList.of("missing")));
    assertThat(e).hasMessageThat().contains("missing");
  }

  @Test
  public void testEngineKeepsPluginsOfItsCreation() {
    FakeProvider pkg = new FakeProvider("pkg", PluginSource.PACKAGE, "a");
    PluginRegistry registry =
        PluginRegistry.create(ImmutableList.of(pkg), PluginPrecedence.defaults());
    PluginEngine engine = registry.newEngine(new CompilerOptions());

    pkg.change("z");
    registry.refresh();
    assertThat(engine.getPlugins()).hasSize(1);
    assertThat(engine.getPlugins().get(0).name()).isEqualTo("a");
    assertThat(registry.getPluginNames()).containsExactly("z");
  }
}
