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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.kopt.ast.Block;
import exm.kopt.ast.Statement;
import exm.kopt.common.Logging;

/**
 * Parse optimization directives attached to statements.  These have the
 * form
 * <pre>
 *   #pragma &lt;namespace&gt; &lt;optName&gt;(&lt;arg1&gt;,&lt;arg2&gt;,...)
 * </pre>
 * Only {@code outerproduct(var1,var2)} is understood at present.
 * Unknown namespaces and names produce a {@link Diagnostic}; text
 * that doesn't have that shape at all is ignored.
 */
public class DirectiveParser {

  public static final String OUTER_PRODUCT = "outerproduct";

  private final Logger logger;
  private final String namespace;

  public DirectiveParser(Logger logger, String namespace) {
    this.logger = logger;
    this.namespace = namespace;
  }

  /**
   * @param stmt statement with a directive
   * @param parent block holding the statement
   * @param diagnostics add any problems found here
   * @return the outer product requested, or null if none
   */
  public OuterProduct parse(Statement stmt, Block parent,
                            List<Diagnostic> diagnostics) {
    String text = stmt.getDirective();
    if (text == null) {
      return null;
    }
    String[] opts = text.trim().split(" ", 3);
    if (opts.length < 3) {
      logger.trace("Ignoring short directive: " + text);
      return null;
    }
    if (!opts[1].equals(namespace)) {
      report(diagnostics, new Diagnostic(Diagnostic.Kind.UNKNOWN_NAMESPACE,
          "Unrecognised directive namespace " + opts[1] + " - skipping it",
          stmt));
      return null;
    }

    int delim = opts[2].indexOf('(');
    int close = opts[2].lastIndexOf(')');
    if (delim < 0 || close < delim) {
      logger.trace("Ignoring malformed directive: " + text);
      return null;
    }
    String optName = opts[2].substring(0, delim).replace(" ", "");
    String optPar = opts[2].substring(delim + 1, close).replace(" ", "");

    if (!optName.equals(OUTER_PRODUCT)) {
      report(diagnostics, new Diagnostic(Diagnostic.Kind.UNKNOWN_OPTIMIZATION,
          "Unrecognised optimisation " + optName + " - skipping it", stmt));
      return null;
    }

    List<String> args = new ArrayList<String>();
    for (String arg: StringUtils.split(optPar, ',')) {
      args.add(arg);
    }
    if (args.size() != 2) {
      report(diagnostics, new Diagnostic(Diagnostic.Kind.BAD_ARGUMENTS,
          OUTER_PRODUCT + " expects two iteration variables, got " + args,
          stmt));
      return null;
    }
    OuterProduct op = new OuterProduct(stmt, args, parent);
    logger.debug("Found " + op + " on " + stmt.getTarget());
    return op;
  }

  private void report(List<Diagnostic> diagnostics, Diagnostic d) {
    diagnostics.add(d);
    Logging.uniqueWarn(d.getMessage());
  }
}
