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
package exm.kopt.opt;

import exm.kopt.ast.Statement;

/**
 * A non-fatal problem found while reading the directives attached to a
 * kernel's statements.  The directive is ignored; the diagnostic is
 * surfaced so the code generation layer can report it.
 */
public class Diagnostic {

  public static enum Kind {
    /** Directive namespace is not the one we handle */
    UNKNOWN_NAMESPACE,
    /** Right namespace, but no such optimization */
    UNKNOWN_OPTIMIZATION,
    /** Known optimization with wrong number of arguments */
    BAD_ARGUMENTS,
  }

  private final Kind kind;
  private final String message;
  private final Statement statement;

  public Diagnostic(Kind kind, String message, Statement statement) {
    this.kind = kind;
    this.message = message;
    this.statement = statement;
  }

  public Kind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  /**
   * @return the directive text that caused the diagnostic
   */
  public String getDirective() {
    return statement.getDirective();
  }

  public Statement getStatement() {
    return statement;
  }

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
