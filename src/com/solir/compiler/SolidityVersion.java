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

package com.solir.compiler;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ComparisonChain;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A Solidity compiler release, as embedded in the AST documents it emits. Only the numeric part
 * takes part in comparisons; build metadata such as {@code +commit.7dd6d404} is ignored.
 */
public final class SolidityVersion implements Comparable<SolidityVersion> {

  public static final SolidityVersion V0_5_0 = of(0, 5, 0);
  public static final SolidityVersion V0_6_0 = of(0, 6, 0);
  public static final SolidityVersion V0_6_3 = of(0, 6, 3);
  public static final SolidityVersion V0_6_5 = of(0, 6, 5);
  public static final SolidityVersion V0_8_0 = of(0, 8, 0);

  private static final Pattern VERSION = Pattern.compile("^v?(\\d+)\\.(\\d+)\\.(\\d+)(.*)$");

  private final int major;
  private final int minor;
  private final int patch;

  private SolidityVersion(int major, int minor, int patch) {
    this.major = major;
    this.minor = minor;
    this.patch = patch;
  }

  public static SolidityVersion of(int major, int minor, int patch) {
    return new SolidityVersion(major, minor, patch);
  }

  /** Parses strings such as {@code 0.8.19}, {@code 0.7.6+commit.7338295f} or {@code v0.4.26}. */
  public static SolidityVersion parse(String version) {
    Matcher m = VERSION.matcher(version.trim());
    checkArgument(m.matches(), "Invalid compiler version %s", version);
    return of(
        Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
  }

  public boolean isAtLeast(SolidityVersion other) {
    return compareTo(other) >= 0;
  }

  public boolean isBefore(SolidityVersion other) {
    return compareTo(other) < 0;
  }

  public int getMajor() {
    return major;
  }

  public int getMinor() {
    return minor;
  }

  public int getPatch() {
    return patch;
  }

  @Override
  public int compareTo(SolidityVersion o) {
    return ComparisonChain.start()
        .compare(major, o.major)
        .compare(minor, o.minor)
        .compare(patch, o.patch)
        .result();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SolidityVersion && compareTo((SolidityVersion) o) == 0;
  }

  @Override
  public int hashCode() {
    return (major * 31 + minor) * 31 + patch;
  }

  @Override
  public String toString() {
    return major + "." + minor + "." + patch;
  }
}
