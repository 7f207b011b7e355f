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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * The output of one invocation of the external compiler: every AST document it produced, tagged
 * with the compiler version. Node ids are only meaningful inside one run.
 */
public final class CompilationRun {
  private final String runId;
  private final SolidityVersion version;
  private final ImmutableMap<String, AstDocument> documents;

  private CompilationRun(
      String runId, SolidityVersion version, ImmutableMap<String, AstDocument> documents) {
    this.runId = runId;
    this.version = version;
    this.documents = documents;
  }

  public static CompilationRun create(
      String runId, String compilerVersion, Iterable<AstDocument> documents) {
    requireNonNull(runId, "runId");
    ImmutableMap.Builder<String, AstDocument> builder = ImmutableMap.builder();
    for (AstDocument doc : documents) {
      builder.put(doc.getPath(), doc);
    }
    ImmutableMap<String, AstDocument> docs = builder.buildOrThrow();
    checkArgument(!docs.isEmpty(), "Compilation run %s has no documents", runId);
    return new CompilationRun(runId, SolidityVersion.parse(compilerVersion), docs);
  }

  public String getRunId() {
    return runId;
  }

  public SolidityVersion getVersion() {
    return version;
  }

  public ImmutableList<AstDocument> getDocuments() {
    return documents.values().asList();
  }

  public @Nullable AstDocument getDocument(String path) {
    return documents.get(path);
  }

  @Override
  public String toString() {
    return "CompilationRun(" + runId + ", " + version + ", " + documents.keySet() + ")";
  }
}
