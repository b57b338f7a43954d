/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.minic.ast;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.minic.ast.AstKind.Arity;
import exm.minic.common.exceptions.MiniCRuntimeError;

/**
 * A node in the MiniC abstract syntax tree.
 *
 * Every node has a kind and the source line of the token that defined it.
 * Leaves of kind LEAF_LITERAL_UINT, LEAF_VAR_ID and LEAF_TYPE carry a
 * payload.  A node owns its children exclusively: once a node is attached
 * to a parent, or the root is handed to a consumer with {@link #freeze()},
 * it can't be modified or attached anywhere else.
 *
 * Breaking any of these rules is a bug in the code building the tree, and
 * is reported with {@link MiniCRuntimeError}.
 */
public class AstNode {

  /** Largest value an integer literal can hold */
  public static final long MAX_UINT = 0xFFFFFFFFL;

  private final AstKind kind;
  private final int line;
  private final List<AstNode> children;

  /** Value of LEAF_LITERAL_UINT, 0 otherwise */
  private final long intValue;
  /** Identifier of LEAF_VAR_ID or function name of FUNC_DEF */
  private final String name;
  /** Type of LEAF_TYPE */
  private final BasicType type;

  private boolean frozen = false;

  private AstNode(AstKind kind, int line, long intValue, String name,
                  BasicType type) {
    this.kind = kind;
    this.line = line;
    this.intValue = intValue;
    this.name = name;
    this.type = type;
    this.children = new ArrayList<AstNode>(
                  kind.arity().isFixed() ? kind.arity().childCount() : 4);
  }

  /**
   * Leaf for an unsigned 32-bit integer literal
   */
  public static AstNode newLiteral(long value, int line) {
    if (value < 0 || value > MAX_UINT) {
      throw new MiniCRuntimeError("Integer literal value " + value
                    + " out of unsigned 32-bit range at line " + line);
    }
    return new AstNode(AstKind.LEAF_LITERAL_UINT, line, value, null, null);
  }

  /**
   * Leaf for a reference to a variable or function by name
   */
  public static AstNode newVarId(String name, int line) {
    if (name == null || name.isEmpty()) {
      throw new MiniCRuntimeError("Identifier leaf without name at line "
                                  + line);
    }
    return new AstNode(AstKind.LEAF_VAR_ID, line, 0, name, null);
  }

  public static AstNode newType(BasicType type, int line) {
    if (type == null) {
      throw new MiniCRuntimeError("Type leaf without type at line " + line);
    }
    return new AstNode(AstKind.LEAF_TYPE, line, 0, null, type);
  }

  /**
   * Leaf without payload, e.g. break or continue
   */
  public static AstNode newLeaf(AstKind kind, int line) {
    if (kind.arity() != Arity.LEAF || kind.isPayloadLeaf()) {
      throw new MiniCRuntimeError("Cannot create " + kind
                                  + " as a leaf without payload");
    }
    return new AstNode(kind, line, 0, null, null);
  }

  /**
   * Container node, with any number of initial children.  More children
   * can be appended with {@link #insertSonNode(AstNode)} while the
   * container is being assembled.
   */
  public static AstNode newContainer(AstKind kind, int line,
                                     AstNode ...children) {
    if (!kind.isContainer()) {
      throw new MiniCRuntimeError(kind + " is not a container kind");
    }
    AstNode node = new AstNode(kind, line, 0, null, null);
    for (AstNode child: children) {
      node.attach(child);
    }
    return node;
  }

  public static AstNode newUnary(AstKind kind, int line, AstNode operand) {
    if (kind.arity() != Arity.UNARY) {
      throw new MiniCRuntimeError(kind + " does not take one child");
    }
    return newFixed(kind, line, operand);
  }

  public static AstNode newBinary(AstKind kind, int line, AstNode left,
                                  AstNode right) {
    if (kind.arity() != Arity.BINARY) {
      throw new MiniCRuntimeError(kind + " does not take two children");
    }
    return newFixed(kind, line, left, right);
  }

  /**
   * Node with a fixed number of children.  The number of children passed
   * in must match the kind's arity.  Function definitions are built with
   * {@link #newFuncDef} instead.
   */
  public static AstNode newFixed(AstKind kind, int line,
                                 AstNode ...children) {
    Arity arity = kind.arity();
    if (!arity.isFixed() || kind.isPayloadLeaf()) {
      throw new MiniCRuntimeError(kind + " does not have fixed arity");
    }
    if (kind == AstKind.FUNC_DEF) {
      throw new MiniCRuntimeError("FUNC_DEF needs a name: use newFuncDef");
    }
    if (children.length != arity.childCount()) {
      throw new MiniCRuntimeError(kind + " needs " + arity.childCount()
            + " children but got " + children.length + " at line " + line);
    }
    AstNode node = new AstNode(kind, line, 0, null, null);
    for (AstNode child: children) {
      node.attach(child);
    }
    return node;
  }

  /**
   * Function definition.  The name is kept on the node rather than as a
   * child.
   */
  public static AstNode newFuncDef(AstNode returnType, String name, int line,
                                   AstNode formalParams, AstNode body) {
    checkKind(returnType, AstKind.LEAF_TYPE);
    checkKind(formalParams, AstKind.FUNC_FORMAL_PARAMS);
    checkKind(body, AstKind.BLOCK);
    if (name == null || name.isEmpty()) {
      throw new MiniCRuntimeError("Function definition without name at line "
                                  + line);
    }
    AstNode node = new AstNode(AstKind.FUNC_DEF, line, 0, name, null);
    node.attach(returnType);
    node.attach(formalParams);
    node.attach(body);
    return node;
  }

  private static void checkKind(AstNode node, AstKind expected) {
    if (node == null || node.kind != expected) {
      throw new MiniCRuntimeError("Expected " + expected + " node but got "
                  + (node == null ? "null" : node.kind));
    }
  }

  /**
   * Append a child to a container that is still being assembled.
   * @param child
   */
  public void insertSonNode(AstNode child) {
    if (!kind.isContainer()) {
      throw new MiniCRuntimeError("Cannot insert child into " + kind
                                  + " node at line " + line);
    }
    attach(child);
  }

  private void attach(AstNode child) {
    if (frozen) {
      throw new MiniCRuntimeError("Cannot modify " + kind + " node at line "
                  + line + ": it was already handed out");
    }
    if (child == null) {
      throw new MiniCRuntimeError("Null child for " + kind + " node at line "
                                  + line);
    }
    if (child.frozen) {
      throw new MiniCRuntimeError(child.kind + " node at line " + child.line
                                  + " already has an owner");
    }
    child.frozen = true;
    children.add(child);
  }

  /**
   * Mark this node as complete.  Called on the root before it's handed
   * to a consumer.
   */
  public void freeze() {
    this.frozen = true;
  }

  public boolean isFrozen() {
    return frozen;
  }

  public AstKind kind() {
    return kind;
  }

  public int line() {
    return line;
  }

  public int childCount() {
    return children.size();
  }

  public AstNode child(int i) {
    return children.get(i);
  }

  public List<AstNode> children() {
    return Collections.unmodifiableList(children);
  }

  public long intValue() {
    if (kind != AstKind.LEAF_LITERAL_UINT) {
      throw new MiniCRuntimeError(kind + " has no integer value");
    }
    return intValue;
  }

  /**
   * @return identifier of a LEAF_VAR_ID or name of a FUNC_DEF
   */
  public String name() {
    if (kind != AstKind.LEAF_VAR_ID && kind != AstKind.FUNC_DEF) {
      throw new MiniCRuntimeError(kind + " has no name");
    }
    return name;
  }

  public BasicType type() {
    if (kind != AstKind.LEAF_TYPE) {
      throw new MiniCRuntimeError(kind + " has no type");
    }
    return type;
  }

  /**
   * Compare kinds, payloads, lines and children of two trees.
   * Uses an explicit stack so deep trees don't exhaust the call stack.
   */
  public boolean sameStructure(AstNode other) {
    ArrayList<AstNode> stack1 = new ArrayList<AstNode>();
    ArrayList<AstNode> stack2 = new ArrayList<AstNode>();
    stack1.add(this);
    stack2.add(other);

    while (!stack1.isEmpty()) {
      AstNode a = stack1.remove(stack1.size() - 1);
      AstNode b = stack2.remove(stack2.size() - 1);
      if (b == null || !a.sameLabel(b) ||
          a.children.size() != b.children.size()) {
        return false;
      }
      stack1.addAll(a.children);
      stack2.addAll(b.children);
    }
    return true;
  }

  private boolean sameLabel(AstNode other) {
    if (kind != other.kind || line != other.line ||
        intValue != other.intValue || type != other.type) {
      return false;
    }
    return name == null ? other.name == null : name.equals(other.name);
  }

  /**
   * @return kind, payload and line, e.g. "LEAF_VAR_ID a @3"
   */
  public String label() {
    StringBuilder sb = new StringBuilder(kind.name());
    switch (kind) {
      case LEAF_LITERAL_UINT:
        sb.append(' ').append(intValue);
        break;
      case LEAF_VAR_ID:
      case FUNC_DEF:
        sb.append(' ').append(name);
        break;
      case LEAF_TYPE:
        sb.append(' ').append(type.typeName());
        break;
      default:
        if (kind.isOperator()) {
          sb.append(" '").append(kind.opSymbol()).append('\'');
        }
        break;
    }
    sb.append(" @").append(line);
    return sb.toString();
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    indent(writer, indent);
    writer.println(label());
    for (AstNode child: children) {
      child.printTree(writer, indent + 2);
    }
  }

  private static void indent(PrintWriter writer, int indent) {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
  }

  @Override
  public String toString() {
    return label();
  }
}
