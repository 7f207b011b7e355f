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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonWriter;
import com.solir.ir.Node;
import com.solir.ir.Node.Prop;
import com.solir.ir.SourceFile;
import com.solir.ir.SourceSpan;
import com.solir.ir.Token;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A self-contained JSON copy of part of a build, for running plugins away from the build that
 * produced it.
 *
 * <p>A snapshot holds the walked files plus the files declaring what the walked files refer to.
 * Links are stored as indices into the pre-order numbering of the copied nodes. References whose
 * targets fall outside the copied files are stored as unresolved.
 */
public final class ForestSnapshot {
  private static final ImmutableSet<Prop> STRING_PROPS =
      Sets.immutableEnumSet(
          Prop.RUN_ID,
          Prop.LICENSE,
          Prop.IMPORT_PATH,
          Prop.ABSOLUTE_PATH,
          Prop.UNIT_ALIAS,
          Prop.CANONICAL_NAME,
          Prop.CONTRACT_KIND,
          Prop.FUNCTION_KIND,
          Prop.VISIBILITY,
          Prop.STATE_MUTABILITY,
          Prop.MUTABILITY,
          Prop.STORAGE_LOCATION,
          Prop.MODIFIER_INVOCATION_KIND,
          Prop.OPERATOR,
          Prop.CALL_KIND,
          Prop.LITERAL_KIND,
          Prop.HEX_VALUE,
          Prop.SUBDENOMINATION,
          Prop.TYPE_STRING,
          Prop.OPERATIONS);

  private static final ImmutableSet<Prop> INT_PROPS =
      Sets.immutableEnumSet(
          Prop.ABSTRACT,
          Prop.ANONYMOUS,
          Prop.CONSTANT,
          Prop.GLOBAL,
          Prop.INDEXED,
          Prop.INLINE_ARRAY,
          Prop.PREFIX,
          Prop.STATE_VARIABLE,
          Prop.TRY_CALL,
          Prop.VIRTUAL,
          Prop.YUL_PARAMETER_COUNT);

  private static final ImmutableSet<Prop> STRING_LIST_PROPS =
      Sets.immutableEnumSet(Prop.SYMBOL_ALIASES, Prop.ARGUMENT_NAMES, Prop.OPTION_NAMES);

  private final String json;
  private final ImmutableSet<String> walkedPaths;

  private ForestSnapshot(String json, ImmutableSet<String> walkedPaths) {
    this.json = json;
    this.walkedPaths = walkedPaths;
  }

  /** Copies the files at {@code walkedPaths} and the files their references point into. */
  public static ForestSnapshot capture(ProjectBuild build, Set<String> walkedPaths) {
    Set<String> walked = new LinkedHashSet<>();
    Set<String> included = new LinkedHashSet<>();
    for (String path : build.getSourceUnits().keySet()) {
      if (walkedPaths.contains(path)) {
        walked.add(path);
        included.add(path);
      }
    }
    for (Reference reference : build.getReferences().getAll()) {
      if (!walked.contains(reference.getNode().getSourceFileName())) {
        continue;
      }
      addFileOf(reference.getTarget(), included);
      for (Node segment : reference.getPathTargets()) {
        addFileOf(segment, included);
      }
    }
    Map<String, Node> units = new LinkedHashMap<>();
    for (String path : build.getSourceUnits().keySet()) {
      if (included.contains(path)) {
        units.put(path, build.getSourceUnit(path));
      }
    }

    StringWriter out = new StringWriter();
    try (JsonWriter writer = new JsonWriter(out)) {
      new Writer(build, units, walked, writer).write();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return new ForestSnapshot(out.toString(), ImmutableSet.copyOf(walked));
  }

  private static void addFileOf(@Nullable Node target, Set<String> included) {
    if (target != null && target.getSourceFileName() != null) {
      included.add(target.getSourceFileName());
    }
  }

  /** Reads a snapshot written by {@link #toJson}. */
  public static ForestSnapshot fromJson(String json) {
    JsonObject root = JsonParser.parseString(json).getAsJsonObject();
    ImmutableSet.Builder<String> walked = ImmutableSet.builder();
    for (JsonElement path : root.getAsJsonArray("walked")) {
      walked.add(path.getAsString());
    }
    return new ForestSnapshot(json, walked.build());
  }

  public String toJson() {
    return json;
  }

  /** The files a plugin run over this snapshot walks. */
  public ImmutableSet<String> getWalkedPaths() {
    return walkedPaths;
  }

  /**
   * Rebuilds a build from this snapshot with fresh nodes. Control flow graphs are recomputed for
   * every copied function and modifier.
   */
  public ProjectBuild restore() {
    return new Reader(JsonParser.parseString(json).getAsJsonObject()).read();
  }

  private static final class Writer {
    private final ProjectBuild build;
    private final Map<String, Node> units;
    private final Set<String> walked;
    private final JsonWriter writer;
    private final Map<Node, Integer> indices = new LinkedHashMap<>();

    Writer(ProjectBuild build, Map<String, Node> units, Set<String> walked, JsonWriter writer) {
      this.build = build;
      this.units = units;
      this.walked = walked;
      this.writer = writer;
    }

    void write() throws IOException {
      for (Node unit : units.values()) {
        NodeUtil.visitPreOrder(unit, n -> indices.put(n, indices.size()));
      }
      writer.beginObject();
      writer.name("serial").value(build.getSerial());
      writer.name("walked").beginArray();
      for (String path : walked) {
        writer.value(path);
      }
      writer.endArray();
      writer.name("files").beginArray();
      for (Map.Entry<String, Node> entry : units.entrySet()) {
        SourceFile file = entry.getValue().getSourceFile();
        writer.beginObject();
        writer.name("path").value(entry.getKey());
        writer.name("source").value(file != null ? file.getCode() : "");
        writer.name("tree");
        writeNode(entry.getValue());
        writer.endObject();
      }
      writer.endArray();
      writeReferences();
      writeOverriders();
      writeLinearizations();
      writer.endObject();
    }

    private void writeNode(Node n) throws IOException {
      writer.beginObject();
      writer.name("kind").value(n.getToken().name());
      if (n.getString() != null) {
        writer.name("string").value(n.getString());
      }
      if (n.hasAstId()) {
        writer.name("id").value(n.getAstId());
      }
      SourceSpan span = n.getSpan();
      if (span != null) {
        writer.name("span").beginArray().value(span.offset()).value(span.length()).endArray();
      }
      writeProps(n);
      if (n.hasChildren()) {
        writer.name("children").beginArray();
        for (Node child : n.children()) {
          writeNode(child);
        }
        writer.endArray();
      }
      writer.endObject();
    }

    @SuppressWarnings("unchecked")
    private void writeProps(Node n) throws IOException {
      boolean open = false;
      for (Prop prop : Prop.values()) {
        if (STRING_PROPS.contains(prop) && n.getStringProp(prop) != null) {
          open = beginProps(open);
          writer.name(prop.name()).value(n.getStringProp(prop));
        } else if (INT_PROPS.contains(prop) && n.getIntProp(prop) != 0) {
          open = beginProps(open);
          writer.name(prop.name()).value(n.getIntProp(prop));
        } else if (STRING_LIST_PROPS.contains(prop) && n.getProp(prop) != null) {
          open = beginProps(open);
          writer.name(prop.name()).beginArray();
          for (String value : (List<String>) n.getProp(prop)) {
            writer.value(value);
          }
          writer.endArray();
        }
      }
      if (open) {
        writer.endObject();
      }
    }

    private boolean beginProps(boolean open) throws IOException {
      if (!open) {
        writer.name("props").beginObject();
      }
      return true;
    }

    private boolean isCopied(@Nullable Node n) {
      return n == null || indices.containsKey(n);
    }

    private void writeReferences() throws IOException {
      writer.name("references").beginArray();
      for (Reference reference : build.getReferences().getAll()) {
        Integer node = indices.get(reference.getNode());
        if (node == null) {
          continue;
        }
        boolean complete = isCopied(reference.getTarget());
        for (Node segment : reference.getPathTargets()) {
          complete &= isCopied(segment);
        }
        writer.beginObject();
        writer.name("node").value(node);
        if (!complete) {
          writer.name("kind").value(Reference.Kind.UNRESOLVED.name());
          writer.name("reason").value(UnresolvedReason.TARGET_UNAVAILABLE.name());
          writer.endObject();
          continue;
        }
        writer.name("kind").value(reference.getKind().name());
        if (reference.getTarget() != null) {
          writer.name("target").value(indices.get(reference.getTarget()));
        }
        if (reference.getSymbol() != null) {
          writer.name("symbol").value(reference.getSymbol().name());
        }
        if (reference.getReason() != null) {
          writer.name("reason").value(reference.getReason().name());
        }
        if (!reference.getPathTargets().isEmpty()) {
          writer.name("path").beginArray();
          for (Node segment : reference.getPathTargets()) {
            writer.value(indices.get(segment));
          }
          writer.endArray();
        }
        if (reference.isVirtual()) {
          writer.name("virtual").value(true);
        }
        writer.endObject();
      }
      writer.endArray();
    }

    private void writeOverriders() throws IOException {
      writer.name("overriders").beginArray();
      for (Node declaration : indices.keySet()) {
        if (!NodeUtil.isExecutable(declaration)) {
          continue;
        }
        List<Integer> copied = new ArrayList<>();
        for (Node overrider : build.getOverriders(declaration)) {
          if (indices.containsKey(overrider)) {
            copied.add(indices.get(overrider));
          }
        }
        if (copied.isEmpty()) {
          continue;
        }
        writer.beginObject();
        writer.name("declaration").value(indices.get(declaration));
        writer.name("overriders").beginArray();
        for (int index : copied) {
          writer.value(index);
        }
        writer.endArray();
        writer.endObject();
      }
      writer.endArray();
    }

    private void writeLinearizations() throws IOException {
      writer.name("linearizations").beginArray();
      for (Node contract : indices.keySet()) {
        List<Node> order =
            contract.isContractDefinition() ? build.getLinearization(contract) : null;
        if (order == null) {
          continue;
        }
        writer.beginArray();
        for (Node base : order) {
          if (indices.containsKey(base)) {
            writer.value(indices.get(base));
          }
        }
        writer.endArray();
      }
      writer.endArray();
    }
  }

  private static final class Reader {
    private final JsonObject root;
    private final List<Node> nodes = new ArrayList<>();

    Reader(JsonObject root) {
      this.root = root;
    }

    ProjectBuild read() {
      Map<String, Node> units = new LinkedHashMap<>();
      for (JsonElement element : root.getAsJsonArray("files")) {
        JsonObject file = element.getAsJsonObject();
        String path = file.get("path").getAsString();
        Node unit = readNode(file.getAsJsonObject("tree"), path);
        checkArgument(unit.isSourceUnit(), "Snapshot tree of %s is not a source unit", path);
        unit.putProp(Prop.SOURCE_FILE, new SourceFile(path, file.get("source").getAsString()));
        units.put(path, unit);
      }
      ImmutableMap<String, Node> sourceUnits = ImmutableMap.copyOf(units);

      DeclarationIndex declarations = new DeclarationIndex();
      for (Node unit : sourceUnits.values()) {
        declarations.addCanonicalTree(unit);
      }
      ReferenceMap references = new ReferenceMap();
      for (JsonElement element : root.getAsJsonArray("references")) {
        references.put(readReference(element.getAsJsonObject()));
      }
      for (JsonElement element : root.getAsJsonArray("overriders")) {
        JsonObject entry = element.getAsJsonObject();
        references.putOverriders(
            node(entry.get("declaration")), nodeList(entry.getAsJsonArray("overriders")));
      }
      Map<Node, ImmutableList<Node>> linearizations = new LinkedHashMap<>();
      for (JsonElement element : root.getAsJsonArray("linearizations")) {
        ImmutableList<Node> order = nodeList(element.getAsJsonArray());
        if (!order.isEmpty()) {
          linearizations.put(order.get(0), order);
        }
      }
      Map<Node, ControlFlowGraph> cfgs = new LinkedHashMap<>();
      for (Node unit : sourceUnits.values()) {
        for (Node executable : Compiler.executablesOf(unit)) {
          cfgs.put(
              executable, Compiler.computeCfg(executable, references, declaration -> false));
        }
      }
      return new ProjectBuild(
          root.get("serial").getAsLong(),
          sourceUnits,
          declarations,
          references,
          linearizations,
          cfgs,
          Compiler.buildImportGraph(sourceUnits),
          sourceUnits.keySet(),
          new SortingErrorManager());
    }

    private Node readNode(JsonObject o, String path) {
      Token token = Token.valueOf(o.get("kind").getAsString());
      Node n = token == Token.EMPTY ? Node.newEmpty() : new Node(token);
      nodes.add(n);
      if (o.has("string")) {
        n.setString(o.get("string").getAsString());
      }
      if (o.has("id")) {
        n.setAstId(o.get("id").getAsLong());
      }
      if (o.has("span")) {
        JsonArray span = o.getAsJsonArray("span");
        n.setSpan(new SourceSpan(path, span.get(0).getAsInt(), span.get(1).getAsInt()));
      }
      if (o.has("props")) {
        for (Map.Entry<String, JsonElement> entry : o.getAsJsonObject("props").entrySet()) {
          Prop prop = Prop.valueOf(entry.getKey());
          if (STRING_PROPS.contains(prop)) {
            n.putProp(prop, entry.getValue().getAsString());
          } else if (INT_PROPS.contains(prop)) {
            n.putIntProp(prop, entry.getValue().getAsInt());
          } else if (STRING_LIST_PROPS.contains(prop)) {
            ImmutableList.Builder<String> values = ImmutableList.builder();
            for (JsonElement value : entry.getValue().getAsJsonArray()) {
              values.add(value.getAsString());
            }
            n.putProp(prop, values.build());
          }
        }
      }
      if (o.has("children")) {
        for (JsonElement child : o.getAsJsonArray("children")) {
          n.addChildToBack(readNode(child.getAsJsonObject(), path));
        }
      }
      return n;
    }

    private Reference readReference(JsonObject o) {
      Node node = node(o.get("node"));
      Reference reference;
      switch (Reference.Kind.valueOf(o.get("kind").getAsString())) {
        case DECLARATION:
          reference = Reference.toDeclaration(node, node(o.get("target")));
          break;
        case GLOBAL:
          reference = Reference.toGlobal(node, GlobalSymbol.valueOf(o.get("symbol").getAsString()));
          break;
        case YUL_LOCAL:
          reference = Reference.toYulLocal(node, node(o.get("target")));
          break;
        case YUL_BUILTIN:
          reference = Reference.toYulBuiltin(node);
          break;
        default:
          reference =
              Reference.unresolved(node, UnresolvedReason.valueOf(o.get("reason").getAsString()));
      }
      if (o.has("path")) {
        reference = reference.withPathTargets(nodeList(o.getAsJsonArray("path")));
      }
      if (o.has("virtual") && o.get("virtual").getAsBoolean()) {
        reference = reference.asVirtual();
      }
      return reference;
    }

    private Node node(JsonElement index) {
      return nodes.get(index.getAsInt());
    }

    private ImmutableList<Node> nodeList(JsonArray indices) {
      ImmutableList.Builder<Node> result = ImmutableList.builder();
      for (JsonElement index : indices) {
        result.add(node(index));
      }
      return result.build();
    }
  }
}
