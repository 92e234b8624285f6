/*
 * Copyright 2026 The Guardflow Authors.
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

package com.google.guardflow.cfg;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.guardflow.ir.IR;
import com.google.guardflow.ir.Operation;
import com.google.guardflow.ir.SyntaxNode;
import com.google.guardflow.ir.Token;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Reads a control flow graph from its JSON description.
 *
 * <p>The description has an optional {@code "syntax"} array declaring syntax nodes (parents
 * before children) and a {@code "blocks"} array whose indices are the block ordinals:
 *
 * <pre>
 * {
 *   "syntax": [
 *     {"id": "s1", "kind": "statement", "text": "WindowsApi();"}
 *   ],
 *   "blocks": [
 *     {"kind": "entry", "fallThrough": 1},
 *     {"branchValue": OP, "conditionKind": "whenFalse", "conditional": 3, "fallThrough": 2},
 *     {"operations": [OP], "fallThrough": 3},
 *     {"kind": "exit"}
 *   ]
 * }
 * </pre>
 *
 * where an operation {@code OP} is {@code {"token": "CALL", "string": ..., "syntax": "s1",
 * "children": [OP, ...]}}.
 */
public final class ControlFlowGraphParser {

  private final Map<String, SyntaxNode> syntaxById = new HashMap<>();

  private ControlFlowGraphParser() {}

  public static ControlFlowGraph parse(String contents) throws ControlFlowGraphParseException {
    JsonObject root;
    try {
      root = new Gson().fromJson(contents, JsonObject.class);
    } catch (JsonParseException ex) {
      throw new ControlFlowGraphParseException("JSON parse exception: " + ex.getMessage(), ex);
    }
    if (root == null || !root.has("blocks")) {
      throw new ControlFlowGraphParseException("Invalid graph: missing 'blocks'");
    }

    try {
      ControlFlowGraphParser parser = new ControlFlowGraphParser();
      if (root.has("syntax")) {
        for (JsonElement each : root.get("syntax").getAsJsonArray()) {
          parser.declareSyntax(each.getAsJsonObject());
        }
      }
      return parser.buildGraph(root.get("blocks").getAsJsonArray());
    } catch (IllegalStateException
        | IllegalArgumentException
        | UnsupportedOperationException
        | ClassCastException ex) {
      throw new ControlFlowGraphParseException("Invalid graph: " + ex.getMessage(), ex);
    }
  }

  private void declareSyntax(JsonObject json) throws ControlFlowGraphParseException {
    String id = getString(json, "id");
    if (syntaxById.containsKey(id)) {
      throw new ControlFlowGraphParseException("Duplicate syntax id '" + id + "'");
    }
    SyntaxNode parent = null;
    if (json.has("parent")) {
      parent = lookupSyntax(json.get("parent").getAsString());
    }
    SyntaxNode.Kind kind =
        json.has("kind")
            ? SyntaxNode.Kind.valueOf(toConstantName(json.get("kind").getAsString()))
            : SyntaxNode.Kind.STATEMENT;
    String text = json.has("text") ? json.get("text").getAsString() : id;
    syntaxById.put(id, SyntaxNode.create(kind, id, text, parent));
  }

  private ControlFlowGraph buildGraph(JsonArray blocksJson) throws ControlFlowGraphParseException {
    if (blocksJson.size() == 0) {
      throw new ControlFlowGraphParseException("Invalid graph: no blocks");
    }

    ControlFlowGraph.Builder builder = ControlFlowGraph.builder();
    List<BasicBlock> blocks = new ArrayList<>();
    for (int i = 0; i < blocksJson.size(); i++) {
      JsonObject json = blocksJson.get(i).getAsJsonObject();
      BasicBlock.Kind kind =
          json.has("kind")
              ? BasicBlock.Kind.valueOf(toConstantName(json.get("kind").getAsString()))
              : BasicBlock.Kind.BLOCK;
      if ((i == 0) != (kind == BasicBlock.Kind.ENTRY)) {
        throw new ControlFlowGraphParseException(
            "Invalid graph: block " + i + " is " + kind + "; exactly the first block is ENTRY");
      }
      switch (kind) {
        case ENTRY:
          blocks.add(builder.addEntryBlock());
          break;
        case EXIT:
          blocks.add(builder.addExitBlock());
          break;
        case BLOCK:
          blocks.add(builder.addBlock(parseOperations(json.get("operations"))));
          break;
      }
    }

    for (int i = 0; i < blocksJson.size(); i++) {
      JsonObject json = blocksJson.get(i).getAsJsonObject();
      BasicBlock block = blocks.get(i);
      if (json.has("conditional")) {
        ConditionKind conditionKind =
            ConditionKind.valueOf(toConstantName(getString(json, "conditionKind")));
        if (!json.has("branchValue")) {
          throw new ControlFlowGraphParseException(
              "Invalid graph: conditional block " + i + " has no branchValue");
        }
        builder.setConditional(
            block,
            getBlock(blocks, json, "conditional"),
            conditionKind,
            parseOperation(json.get("branchValue").getAsJsonObject()));
      } else if (json.has("branchValue")) {
        builder.setBranchValue(block, parseOperation(json.get("branchValue").getAsJsonObject()));
      }
      if (json.has("fallThrough")) {
        builder.setFallThrough(block, getBlock(blocks, json, "fallThrough"));
      }
    }
    return builder.build();
  }

  private ImmutableList<Operation> parseOperations(@Nullable JsonElement element)
      throws ControlFlowGraphParseException {
    if (element == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<Operation> operations = ImmutableList.builder();
    for (JsonElement each : element.getAsJsonArray()) {
      operations.add(parseOperation(each.getAsJsonObject()));
    }
    return operations.build();
  }

  private Operation parseOperation(JsonObject json) throws ControlFlowGraphParseException {
    Token token = Token.valueOf(getString(json, "token"));
    String string = json.has("string") ? json.get("string").getAsString() : null;
    Operation op = IR.operation(token, string, parseOperations(json.get("children")));
    if (json.has("syntax")) {
      op.setSyntax(lookupSyntax(json.get("syntax").getAsString()));
    }
    return op;
  }

  private SyntaxNode lookupSyntax(String id) throws ControlFlowGraphParseException {
    SyntaxNode syntax = syntaxById.get(id);
    if (syntax == null) {
      throw new ControlFlowGraphParseException("Undeclared syntax id '" + id + "'");
    }
    return syntax;
  }

  private static BasicBlock getBlock(List<BasicBlock> blocks, JsonObject json, String key)
      throws ControlFlowGraphParseException {
    double value = json.get(key).getAsDouble();
    int index = (int) value;
    if (index != value) {
      throw new ControlFlowGraphParseException(
          "Invalid graph: '" + key + "' is not a block ordinal: " + json.get(key));
    }
    if (index < 0 || index >= blocks.size()) {
      throw new ControlFlowGraphParseException(
          "Invalid graph: '" + key + "' refers to missing block " + index);
    }
    return blocks.get(index);
  }

  private static String getString(JsonObject json, String key)
      throws ControlFlowGraphParseException {
    if (!json.has(key)) {
      throw new ControlFlowGraphParseException("Invalid graph: missing '" + key + "' in " + json);
    }
    return json.get(key).getAsString();
  }

  /** Converts "whenFalse" or "entry" to the matching enum constant name. */
  private static String toConstantName(String name) {
    return CaseFormat.LOWER_CAMEL.to(CaseFormat.UPPER_UNDERSCORE, name);
  }
}
