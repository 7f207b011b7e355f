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

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/**
 * Symbols built into the language. References to them resolve to a symbol rather than to a
 * declaration node.
 *
 * <p>Ids from -1 to -99 are the ones the compiler itself emits as {@code referencedDeclaration}
 * of an identifier. Member symbols such as {@code msg.sender} are never numbered by the compiler;
 * they get ids from -100 downwards, grouped by their owner.
 */
public enum GlobalSymbol {
  ABI(-1, null, "abi"),
  ADDMOD(-2, null, "addmod"),
  ASSERT(-3, null, "assert"),
  BLOCK(-4, null, "block"),
  BLOCKHASH(-5, null, "blockhash"),
  ECRECOVER(-6, null, "ecrecover"),
  GASLEFT(-7, null, "gasleft"),
  KECCAK256(-8, null, "keccak256"),
  MSG(-15, null, "msg"),
  MULMOD(-16, null, "mulmod"),
  NOW(-17, null, "now"),
  REQUIRE(-18, null, "require"),
  REVERT(-19, null, "revert"),
  RIPEMD160(-20, null, "ripemd160"),
  SELFDESTRUCT(-21, null, "selfdestruct"),
  SHA256(-22, null, "sha256"),
  SHA3(-23, null, "sha3"),
  SUICIDE(-24, null, "suicide"),
  SUPER(-25, null, "super"),
  TX(-26, null, "tx"),
  TYPE(-27, null, "type"),
  THIS(-28, null, "this"),

  BLOCK_BASEFEE(-100, "block", "basefee"),
  BLOCK_CHAINID(-101, "block", "chainid"),
  BLOCK_COINBASE(-102, "block", "coinbase"),
  BLOCK_DIFFICULTY(-103, "block", "difficulty"),
  BLOCK_GASLIMIT(-104, "block", "gaslimit"),
  BLOCK_NUMBER(-105, "block", "number"),
  BLOCK_TIMESTAMP(-106, "block", "timestamp"),
  BLOCK_PREVRANDAO(-107, "block", "prevrandao"),

  MSG_DATA(-200, "msg", "data"),
  MSG_SENDER(-201, "msg", "sender"),
  MSG_SIG(-202, "msg", "sig"),
  MSG_VALUE(-203, "msg", "value"),

  TX_GASPRICE(-300, "tx", "gasprice"),
  TX_ORIGIN(-301, "tx", "origin"),

  ABI_DECODE(-400, "abi", "decode"),
  ABI_ENCODE(-401, "abi", "encode"),
  ABI_ENCODE_PACKED(-402, "abi", "encodePacked"),
  ABI_ENCODE_WITH_SELECTOR(-403, "abi", "encodeWithSelector"),
  ABI_ENCODE_WITH_SIGNATURE(-404, "abi", "encodeWithSignature"),
  ABI_ENCODE_CALL(-405, "abi", "encodeCall"),

  BYTES_CONCAT(-500, "bytes", "concat"),
  BYTES_LENGTH(-501, "bytes", "length"),
  BYTES_PUSH(-502, "bytes", "push"),

  STRING_CONCAT(-600, "string", "concat"),

  ADDRESS_BALANCE(-700, "address", "balance"),
  ADDRESS_CODE(-701, "address", "code"),
  ADDRESS_CODEHASH(-702, "address", "codehash"),
  ADDRESS_TRANSFER(-703, "address", "transfer"),
  ADDRESS_SEND(-704, "address", "send"),
  ADDRESS_CALL(-705, "address", "call"),
  ADDRESS_DELEGATECALL(-706, "address", "delegatecall"),
  ADDRESS_STATICCALL(-707, "address", "staticcall"),

  TYPE_NAME(-800, "type", "name"),
  TYPE_CREATION_CODE(-801, "type", "creationCode"),
  TYPE_RUNTIME_CODE(-802, "type", "runtimeCode"),
  TYPE_INTERFACE_ID(-803, "type", "interfaceId"),
  TYPE_MIN(-804, "type", "min"),
  TYPE_MAX(-805, "type", "max"),

  ARRAY_LENGTH(-900, "array", "length"),
  ARRAY_PUSH(-901, "array", "push"),
  ARRAY_POP(-902, "array", "pop"),

  FUNCTION_SELECTOR(-1000, "function", "selector"),
  FUNCTION_VALUE(-1001, "function", "value"),
  FUNCTION_GAS(-1002, "function", "gas"),
  FUNCTION_ADDRESS(-1003, "function", "address"),

  USER_DEFINED_VALUE_TYPE_WRAP(-1100, "udvt", "wrap"),
  USER_DEFINED_VALUE_TYPE_UNWRAP(-1101, "udvt", "unwrap");

  private static final ImmutableMap<Long, GlobalSymbol> BY_ID;
  private static final ImmutableMap<String, GlobalSymbol> BY_QUALIFIED_NAME;

  static {
    ImmutableMap.Builder<Long, GlobalSymbol> byId = ImmutableMap.builder();
    ImmutableMap.Builder<String, GlobalSymbol> byName = ImmutableMap.builder();
    for (GlobalSymbol symbol : values()) {
      byId.put(symbol.id, symbol);
      byName.put(symbol.getQualifiedName(), symbol);
    }
    BY_ID = byId.buildOrThrow();
    BY_QUALIFIED_NAME = byName.buildOrThrow();
  }

  private final long id;
  private final @Nullable String owner;
  private final String name;

  GlobalSymbol(long id, @Nullable String owner, String name) {
    this.id = id;
    this.owner = owner;
    this.name = name;
  }

  public long getId() {
    return id;
  }

  /** The simple name, e.g. {@code sender} for {@code msg.sender}. */
  public String getName() {
    return name;
  }

  /**
   * The owner of a member symbol. Either a global namespace such as {@code msg}, or the kind of
   * value the member is accessed on such as {@code address} or {@code array}. Null for top-level
   * symbols.
   */
  public @Nullable String getOwner() {
    return owner;
  }

  public String getQualifiedName() {
    return owner == null ? name : owner + "." + name;
  }

  public boolean isTopLevel() {
    return owner == null;
  }

  /** Whether this symbol is a namespace whose members are themselves symbols. */
  public boolean isNamespace() {
    switch (this) {
      case ABI:
      case BLOCK:
      case MSG:
      case TX:
        return true;
      default:
        return false;
    }
  }

  /** Returns the symbol for a compiler-emitted negative id, or null. */
  public static @Nullable GlobalSymbol fromId(long id) {
    return BY_ID.get(id);
  }

  /** Returns the top-level symbol with the given name, or null. */
  public static @Nullable GlobalSymbol forName(String name) {
    GlobalSymbol symbol = BY_QUALIFIED_NAME.get(name);
    return symbol != null && symbol.isTopLevel() ? symbol : null;
  }

  /** Returns the member symbol {@code owner.member}, or null. */
  public static @Nullable GlobalSymbol forMember(String owner, String member) {
    return BY_QUALIFIED_NAME.get(owner + "." + member);
  }

  /**
   * Returns the member symbol for accessing {@code member} on a value of the given type, or null.
   * The type is given in the compiler's type string notation, such as {@code address payable} or
   * {@code uint256[] storage ref}.
   */
  public static @Nullable GlobalSymbol forMemberOfType(@Nullable String typeString, String member) {
    if (typeString == null) {
      return null;
    }
    String owner;
    if (typeString.startsWith("type(")) {
      owner = "type";
    } else if (typeString.startsWith("function")) {
      owner = "function";
    } else if (typeString.matches("^[^(]*\\[[0-9]*\\].*")) {
      owner = "array";
    } else if (typeString.startsWith("address") || typeString.startsWith("contract ")) {
      owner = "address";
    } else if (typeString.startsWith("bytes")) {
      owner = "bytes";
    } else if (typeString.startsWith("string")) {
      owner = "string";
    } else {
      return null;
    }
    return forMember(owner, member);
  }
}
