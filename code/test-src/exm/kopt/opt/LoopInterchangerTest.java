package exm.kopt.opt;

import static exm.kopt.opt.NestFixtures.a;
import static exm.kopt.opt.NestFixtures.input;
import static exm.kopt.opt.NestFixtures.loop;
import static exm.kopt.opt.NestFixtures.mul;
import static exm.kopt.opt.NestFixtures.output;
import static exm.kopt.opt.NestFixtures.preHeader;
import static exm.kopt.opt.NestFixtures.s;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.kopt.ast.Assign;
import exm.kopt.ast.Block;
import exm.kopt.ast.For;
import exm.kopt.ast.Incr;
import exm.kopt.ast.KernelInterpreter;
import exm.kopt.common.Logging;
import exm.kopt.common.exceptions.ImperfectNestException;
import exm.kopt.common.exceptions.InvalidPermutationException;

public class LoopInterchangerTest {

  private static final Logger logger = Logging.getKOptLogger();

  private Assign stmt;
  private For i, j, k;
  private Block pre;

  private LoopOptimizer threeDeep() throws Exception {
    stmt = new Assign(a("A", "i", "j", "k"),
                      mul(a("B", "i", "j"), a("C", "k")));
    k = loop("k", "4", stmt);
    j = loop("j", "3", k);
    i = loop("i", "2", j);
    i.setDirective("#pragma pyop2 itspace");
    pre = preHeader(i);
    return new LoopOptimizer(logger, i, pre);
  }

  @Test
  public void testIdentity() throws Exception {
    LoopOptimizer opt = threeDeep();
    String before = pre.toString();
    opt.interchange(0, 1, 2);
    assertEquals(before, pre.toString());
    assertEquals(Arrays.asList(i, j, k), opt.getLoops());
  }

  @Test
  public void testSwapOuterPair() throws Exception {
    Assign s2 = new Assign(a("A", "i", "j"), mul(a("B", "i"), s("2.0")));
    For inner = loop("j", "4", s2);
    For outer = loop("i", "3", inner);
    Block b = preHeader(outer);
    LoopOptimizer opt = new LoopOptimizer(logger, outer, b);

    opt.interchange(1, 0);

    assertEquals(
        "for (int j = 0; j < 4; j += 1) {\n" +
        "  for (int i = 0; i < 3; i += 1) {\n" +
        "    A[i][j] = B[i] * 2.0;\n" +
        "  }\n" +
        "}\n",
        b.toString());
    // Same nodes in tree order
    assertEquals(Arrays.asList(outer, inner), opt.getLoops());
    assertTrue(outer.getBody().get(0) == inner);
    assertTrue(inner.getBody().get(0) == s2);
  }

  @Test
  public void testRotateHeadersMove() throws Exception {
    LoopOptimizer opt = threeDeep();
    Block orig = pre.copy();
    opt.interchange(2, 0, 1);

    List<For> loops = opt.getLoops();
    assertEquals("k", loops.get(0).itVar());
    assertEquals("4", loops.get(0).bound());
    assertEquals("i", loops.get(1).itVar());
    assertEquals("j", loops.get(2).itVar());
    // Directive travels with header
    assertEquals(null, loops.get(0).getDirective());
    assertEquals("#pragma pyop2 itspace", loops.get(1).getDirective());
    assertTrue(loops.get(0) == i);
    assertTrue(loops.get(2).getBody().get(0) == stmt);

    KernelInterpreter before = new KernelInterpreter();
    KernelInterpreter after = new KernelInterpreter();
    for (KernelInterpreter interp: Arrays.asList(before, after)) {
      input(interp, "B", 2, 3);
      input(interp, "C", 4);
      output(interp, "A", 2, 3, 4);
    }
    before.run(orig);
    after.run(pre);
    assertArrayEquals(before.getArray("A"), after.getArray("A"), 1e-12);
  }

  @Test
  public void testRepeatedIndexRejected() throws Exception {
    For inner = loop("j", "4", new Assign(a("A", "i", "j"), s("1.0")));
    For outer = loop("i", "3", inner);
    Block b = preHeader(outer);
    LoopOptimizer opt = new LoopOptimizer(logger, outer, b);
    String before = b.toString();
    try {
      opt.interchange(0, 0);
      fail("Expected permutation to be rejected");
    } catch (InvalidPermutationException e) {
      assertEquals(2, e.getLoopCount());
      assertTrue(Arrays.equals(new int[] {0, 0}, e.getPermutation()));
    }
    assertEquals(before, b.toString());
    assertEquals(Arrays.asList(outer, inner), opt.getLoops());
  }

  @Test(expected=InvalidPermutationException.class)
  public void testWrongLength() throws Exception {
    threeDeep().interchange(1, 0);
  }

  @Test
  public void testOutOfRange() throws Exception {
    LoopOptimizer opt = threeDeep();
    String before = pre.toString();
    try {
      opt.interchange(0, 1, 3);
      fail("Expected permutation to be rejected");
    } catch (InvalidPermutationException e) {
      // expected
    }
    assertEquals(before, pre.toString());
  }

  @Test
  public void testAfterHoistIntoNest() throws Exception {
    Incr s2 = new Incr(a("A", "j", "k"),
        mul(mul(a("B", "i", "j"), a("C", "i", "j")), a("D", "k")));
    For outer = loop("i", "2", loop("j", "3", loop("k", "4", s2)));
    Block b = preHeader(outer);
    LoopOptimizer opt = new LoopOptimizer(logger, outer, b);
    opt.licm();
    String before = b.toString();
    try {
      opt.interchange(1, 0, 2);
      fail("Expected imperfect nest to be rejected");
    } catch (ImperfectNestException e) {
      assertTrue(e.getOffending() == outer);
    }
    assertEquals(before, b.toString());
  }

  @Test
  public void testTwice() throws Exception {
    LoopOptimizer opt = threeDeep();
    String before = pre.toString();
    opt.interchange(1, 2, 0);
    opt.interchange(2, 0, 1);
    assertEquals(before, pre.toString());
  }
}
