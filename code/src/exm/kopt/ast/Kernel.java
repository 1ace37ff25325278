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

/**
 * A local assembly kernel: a function whose parameters are the element
 * tensor and the coefficient arrays, and whose body holds one or more
 * loop nests.
 */
public class Kernel {

  private final String name;
  private final List<Decl> params;
  private final Block body;

  public Kernel(String name, List<Decl> params, Block body) {
    this.name = name;
    this.params = new ArrayList<Decl>(params);
    this.body = body;
  }

  public String getName() {
    return name;
  }

  public List<Decl> getParams() {
    return Collections.unmodifiableList(params);
  }

  public Block getBody() {
    return body;
  }

  public void appendTo(StringBuilder sb) {
    sb.append("void ");
    sb.append(name);
    sb.append('(');
    boolean first = true;
    for (Decl p: params) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      p.appendInline(sb);
    }
    sb.append(") {\n");
    body.setIndentation(Node.indentWidth);
    body.appendChildren(sb);
    sb.append("}\n");
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(2048);
    appendTo(sb);
    return sb.toString();
  }
}
