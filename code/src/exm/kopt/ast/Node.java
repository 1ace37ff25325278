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

import org.apache.commons.lang3.StringUtils;

/**
 * The Node class hierarchy represents the kernel constructs the loop
 * optimizer works on: blocks, loops, declarations, assignments and
 * arithmetic expressions over (possibly array) symbols.
 *
 * The set of node types is closed, see {@link NodeType}.  Code should
 * switch on {@link #type()} rather than test classes.
 *
 * Nodes use identity equality: the optimizer keeps maps from the exact
 * expression node to what should replace it.
 */
public abstract class Node
{
  int indentation = 0;
  static int indentWidth = 2;

  public abstract NodeType type();

  /**
   * @return a deep copy of this subtree
   */
  public abstract Node copy();

  /**
   * Render the node as C code.  Statements are rendered on their own
   * line(s) at the current indentation, expressions inline.
   * @param sb
   */
  public abstract void appendTo(StringBuilder sb);

  public void indent(StringBuilder sb)
  {
    sb.append(StringUtils.repeat(' ', indentation));
  }

  public void setIndentation(int i)
  {
    indentation = i;
  }

  public void increaseIndent()
  {
    indentation += indentWidth;
  }

  public void decreaseIndent()
  {
    indentation -= indentWidth;
  }

  @Override
  public String toString()
  {
    StringBuilder sb = new StringBuilder(256);
    appendTo(sb);
    return sb.toString();
  }
}
