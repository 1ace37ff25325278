package exm.kopt.opt;

import static exm.kopt.opt.NestFixtures.a;
import static exm.kopt.opt.NestFixtures.input;
import static exm.kopt.opt.NestFixtures.loop;
import static exm.kopt.opt.NestFixtures.mul;
import static exm.kopt.opt.NestFixtures.output;
import static exm.kopt.opt.NestFixtures.par;
import static exm.kopt.opt.NestFixtures.preHeader;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.After;
import org.junit.Test;

import exm.kopt.ast.Assign;
import exm.kopt.ast.Block;
import exm.kopt.ast.Decl;
import exm.kopt.ast.For;
import exm.kopt.ast.Incr;
import exm.kopt.ast.Kernel;
import exm.kopt.ast.KernelInterpreter;
import exm.kopt.ast.Node;
import exm.kopt.ast.NodeType;
import exm.kopt.common.Logging;
import exm.kopt.common.Settings;
import exm.kopt.common.exceptions.InvalidPermutationException;
import exm.kopt.common.exceptions.UserException;

public class KernelOptimizerTest {

  private static final Logger logger = Logging.getKOptLogger();

  private For nest;
  private Incr s1, s2;

  @After
  public void resetSettings() {
    Settings.reset();
  }

  /**
   * Two statements with an invariant product of i-indexed coefficients
   */
  private Kernel assembly() {
    s1 = new Incr(a("A", "i", "j"),
        mul(mul(a("B", "i"), a("C", "i")), a("D", "j")));
    s2 = new Incr(a("E", "i", "j"),
        mul(mul(a("F", "i"), a("G", "i")), a("D", "j")));
    nest = loop("i", "3", loop("j", "4", s1, s2));
    return new Kernel("assemble",
        Arrays.asList(new Decl("float", a("A", "3", "4")),
                      new Decl("double", a("E", "3", "4"))),
        preHeader(nest));
  }

  private static void checkEquivalent(Block orig, Block opt) {
    KernelInterpreter before = new KernelInterpreter();
    KernelInterpreter after = new KernelInterpreter();
    for (KernelInterpreter interp: Arrays.asList(before, after)) {
      input(interp, "B", 3);
      input(interp, "C", 3);
      input(interp, "D", 4);
      input(interp, "F", 3);
      input(interp, "G", 3);
      output(interp, "A", 3, 4);
      output(interp, "E", 3, 4);
    }
    before.run(orig);
    after.run(opt);
    assertArrayEquals(before.getArray("A"), after.getArray("A"), 1e-12);
    assertArrayEquals(before.getArray("E"), after.getArray("E"), 1e-12);
  }

  @Test
  public void testDefaultPipeline() throws Exception {
    Kernel k = assembly();
    Block orig = k.getBody().copy();
    KernelOptimizer.optimize(logger, k);

    assertEquals(
        "void assemble(float A[3][4], double E[3][4]) {\n" +
        "  float LI_i_0[3];\n" +
        "  double LI_i_1[3];\n" +
        "  for (int i = 0; i < 3; i += 1) {\n" +
        "    LI_i_0[i] = B[i] * C[i];\n" +
        "    LI_i_1[i] = F[i] * G[i];\n" +
        "  }\n" +
        "  for (int i = 0; i < 3; i += 1) {\n" +
        "    for (int j = 0; j < 4; j += 1) {\n" +
        "      A[i][j] += LI_i_0[i] * D[j];\n" +
        "      E[i][j] += LI_i_1[i] * D[j];\n" +
        "    }\n" +
        "  }\n" +
        "}\n",
        k.toString());
    assertTrue(k.getBody().get(3) == nest);
    checkEquivalent(orig, k.getBody());
  }

  @Test
  public void testFusionDisabled() throws Exception {
    Settings.set(Settings.OPT_FUSE_HOISTED, "false");
    Kernel k = assembly();
    KernelOptimizer.optimize(logger, k);

    Block body = k.getBody();
    assertEquals(5, body.size());
    assertEquals(NodeType.DECL, body.get(0).type());
    assertEquals(NodeType.FOR, body.get(1).type());
    assertEquals(NodeType.DECL, body.get(2).type());
    assertEquals(NodeType.FOR, body.get(3).type());
    assertTrue(body.get(4) == nest);
  }

  @Test
  public void testLicmDisabled() throws Exception {
    Settings.set(Settings.OPT_LICM, "false");
    Kernel k = assembly();
    String before = k.toString();
    KernelOptimizer.optimize(logger, k);
    assertEquals(before, k.toString());
  }

  @Test
  public void testInterchangeThenLicm() throws Exception {
    Settings.set(Settings.OPT_INTERCHANGE_PERM, "1,0");
    Kernel k = assembly();
    Block orig = k.getBody().copy();
    KernelOptimizer.optimize(logger, k);

    Block body = k.getBody();
    assertTrue(body.get(body.size() - 1) == nest);
    assertEquals("j", nest.itVar());
    assertEquals("i", ((For)nest.getBody().get(0)).itVar());
    // Invariant loops still hoisted and fused in front of the nest
    assertEquals(4, body.size());
    checkEquivalent(orig, body);
  }

  @Test
  public void testInterchangeDisabled() throws Exception {
    Settings.set(Settings.OPT_INTERCHANGE_PERM, "1,0");
    Settings.set(Settings.OPT_INTERCHANGE, "false");
    Settings.set(Settings.OPT_LICM, "false");
    Kernel k = assembly();
    KernelOptimizer.optimize(logger, k);
    assertEquals("i", nest.itVar());
  }

  @Test(expected=InvalidPermutationException.class)
  public void testBadPermutation() throws Exception {
    Settings.set(Settings.OPT_INTERCHANGE_PERM, "0,0");
    KernelOptimizer.optimize(logger, assembly());
  }

  @Test(expected=UserException.class)
  public void testMalformedPermutation() throws Exception {
    Settings.set(Settings.OPT_INTERCHANGE_PERM, "1,x");
    KernelOptimizer.optimize(logger, assembly());
  }

  @Test
  public void testPermutationForOtherDepthSkipped() throws Exception {
    Settings.set(Settings.OPT_INTERCHANGE_PERM, "2,1,0");
    Kernel k = assembly();
    KernelOptimizer.optimize(logger, k);
    assertEquals("i", nest.itVar());
    assertEquals(4, k.getBody().size());
  }

  @Test
  public void testImperfectNestSkipped() throws Exception {
    Settings.set(Settings.OPT_INTERCHANGE_PERM, "1,0");
    Assign init = new Assign(a("X", "i"), a("B", "i"));
    For inner = loop("j", "4", new Incr(a("A", "i", "j"),
        mul(mul(a("B", "i"), a("C", "i")), a("D", "j"))));
    For outer = loop("i", "3", init, inner);
    Kernel k = new Kernel("imperfect", Arrays.<Decl>asList(),
                          preHeader(outer));
    String before = k.toString();
    KernelOptimizer.optimize(logger, k);
    assertEquals(before, k.toString());
  }

  @Test
  public void testEachNestOptimized() throws Exception {
    Kernel k = assembly();
    For second = loop("p", "2", loop("q", "5", new Incr(a("H", "p", "q"),
        mul(mul(a("K", "p"), a("L", "p")), a("M", "q")))));
    k.getBody().add(second);
    KernelOptimizer.optimize(logger, k);

    Block body = k.getBody();
    // decls + fused loop + nest, then decl + loop + second nest
    assertEquals(7, body.size());
    assertTrue(body.get(3) == nest);
    assertTrue(body.get(6) == second);
    Decl temp = (Decl)body.get(4);
    assertEquals("LI_p_0", temp.getName());
    assertEquals("double", temp.getType());
  }

  @Test
  public void testSiblingNestsGetDistinctTemporaries() throws Exception {
    For first = loop("i", "3", loop("j", "4", new Incr(a("X", "i", "j"),
        mul(par(mul(a("P", "i"), a("Q", "i"))), a("D", "j")))));
    For second = loop("i", "3", loop("j", "4", new Incr(a("Y", "i", "j"),
        mul(par(mul(a("P", "i"), a("Q", "i"))), a("D", "j")))));
    Kernel k = new Kernel("siblings", Arrays.<Decl>asList(),
                          preHeader(first, second));
    Block orig = k.getBody().copy();
    KernelOptimizer.optimize(logger, k);

    Block body = k.getBody();
    List<String> decls = new ArrayList<String>();
    for (Node n: body.getChildren()) {
      if (n.type() == NodeType.DECL) {
        decls.add(((Decl)n).getName());
      }
    }
    assertEquals(Arrays.asList("LI_i_0", "LI_i_1"), decls);
    assertEquals(6, body.size());
    assertTrue(body.get(2) == first);
    assertTrue(body.get(5) == second);
    assertEquals("Y[i][j] += LI_i_1[i] * D[j];",
        ((For)second.getBody().get(0)).getBody().get(0).toString().trim());

    KernelInterpreter before = new KernelInterpreter();
    KernelInterpreter after = new KernelInterpreter();
    for (KernelInterpreter interp: Arrays.asList(before, after)) {
      input(interp, "P", 3);
      input(interp, "Q", 3);
      input(interp, "D", 4);
      output(interp, "X", 3, 4);
      output(interp, "Y", 3, 4);
    }
    before.run(orig);
    after.run(body);
    assertArrayEquals(before.getArray("X"), after.getArray("X"), 1e-12);
    assertArrayEquals(before.getArray("Y"), after.getArray("Y"), 1e-12);
  }
}
