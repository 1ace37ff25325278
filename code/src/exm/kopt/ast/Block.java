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
package exm.kopt.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import exm.kopt.common.exceptions.KOptRuntimeError;

/**
 * Sequence of statements, optionally opening a new C scope
 */
public class Block extends Node {

  private final List<Node> children;
  private final boolean openScope;

  public Block() {
    this(new ArrayList<Node>(), false);
  }

  public Block(List<? extends Node> children) {
    this(children, false);
  }

  public Block(List<? extends Node> children, boolean openScope) {
    this.children = new ArrayList<Node>(children);
    this.openScope = openScope;
  }

  public List<Node> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public int size() {
    return children.size();
  }

  public Node get(int i) {
    return children.get(i);
  }

  public boolean isOpenScope() {
    return openScope;
  }

  public void add(Node child) {
    children.add(child);
  }

  /**
   * Insert nodes at offset, shifting existing children after it
   */
  public void insert(int offset, List<? extends Node> nodes) {
    children.addAll(offset, nodes);
  }

  /**
   * @return position of exactly this node, or -1 if not a child
   */
  public int indexOf(Node child) {
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) == child) {
        return i;
      }
    }
    return -1;
  }

  public void remove(Node child) {
    int pos = indexOf(child);
    if (pos < 0) {
      throw new KOptRuntimeError("Not a child of block: " + child);
    }
    children.remove(pos);
  }

  @Override
  public NodeType type() {
    return NodeType.BLOCK;
  }

  @Override
  public Block copy() {
    List<Node> copied = new ArrayList<Node>(children.size());
    for (Node child: children) {
      copied.add(child.copy());
    }
    return new Block(copied, openScope);
  }

  /**
   * Render children only, one after another at current indentation
   */
  public void appendChildren(StringBuilder sb) {
    for (Node child: children) {
      child.setIndentation(indentation);
      child.appendTo(sb);
    }
  }

  @Override
  public void appendTo(StringBuilder sb) {
    if (openScope) {
      indent(sb);
      sb.append("{\n");
      increaseIndent();
      appendChildren(sb);
      decreaseIndent();
      indent(sb);
      sb.append("}\n");
    } else {
      appendChildren(sb);
    }
  }
}
