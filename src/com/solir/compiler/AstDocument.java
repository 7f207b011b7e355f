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

import static java.util.Objects.requireNonNull;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.solir.ir.SourceFile;

/**
 * The AST the compiler emitted for one source file in one compilation run, together with the text
 * it describes.
 */
public final class AstDocument {
  private final SourceFile sourceFile;
  private final JsonObject ast;

  public AstDocument(SourceFile sourceFile, JsonObject ast) {
    this.sourceFile = requireNonNull(sourceFile);
    this.ast = requireNonNull(ast);
  }

  /** Parses the JSON text of a {@code SourceUnit} AST. */
  public static AstDocument parse(String path, String source, String astJson) {
    return new AstDocument(
        new SourceFile(path, source), JsonParser.parseString(astJson).getAsJsonObject());
  }

  public String getPath() {
    return sourceFile.getPath();
  }

  public SourceFile getSourceFile() {
    return sourceFile;
  }

  public JsonObject getAst() {
    return ast;
  }

  @Override
  public String toString() {
    return "AstDocument(" + getPath() + ")";
  }
}
