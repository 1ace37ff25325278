package exm.kopt.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import exm.kopt.ast.BinExpr.Operator;

public class NodeTest {

  private static For simpleNest() {
    Assign stmt = new Assign(Symbol.array("A", "i", "j"),
        BinExpr.mult(Symbol.array("B", "i"), new Par(
            BinExpr.plus(Symbol.array("C", "j"), new Symbol("2.0")))));
    For inner = For.range("j", "0", "4",
                          new Block(ImmutableList.<Node>of(stmt)));
    return For.range("i", "0", "3",
                     new Block(ImmutableList.<Node>of(inner)));
  }

  @Test
  public void testRenderNest() {
    assertEquals(
        "for (int i = 0; i < 3; i += 1) {\n" +
        "  for (int j = 0; j < 4; j += 1) {\n" +
        "    A[i][j] = B[i] * (C[j] + 2.0);\n" +
        "  }\n" +
        "}\n",
        simpleNest().toString());
  }

  @Test
  public void testRenderKernel() {
    Block body = new Block();
    body.add(new Decl("double", new Symbol("t"), new Symbol("0.0")));
    body.add(new Incr(new Symbol("t"), Symbol.array("w", "0"),
                      "#pragma pyop2 outerproduct(j,k)"));
    Kernel k = new Kernel("mass", Arrays.asList(
        new Decl("double", Symbol.array("w", "3"))), body);
    assertEquals(
        "void mass(double w[3]) {\n" +
        "  double t = 0.0;\n" +
        "  #pragma pyop2 outerproduct(j,k)\n" +
        "  t += w[0];\n" +
        "}\n",
        k.toString());
  }

  @Test
  public void testLoopDepsFromRank() {
    assertEquals(LoopDeps.of("i", "j"),
                 Symbol.array("A", "i", "3", "j").getLoopDeps());
    assertTrue(Symbol.array("A", "0", "1").getLoopDeps().isEmpty());
    assertTrue(new Symbol("x").getLoopDeps().isEmpty());

    Symbol explicit = new Symbol("i", ImmutableList.<String>of(),
                                 LoopDeps.of("i"));
    assertEquals(LoopDeps.of("i"), explicit.getLoopDeps());
  }

  @Test
  public void testLoopDepsFromIndexExpressions() {
    assertEquals(LoopDeps.of("i"), Symbol.array("B", "i+1").getLoopDeps());
    assertEquals(LoopDeps.of("i", "k"),
                 Symbol.array("B", "2*i", "k - 1").getLoopDeps());
    assertEquals(LoopDeps.of("i", "n", "j"),
                 Symbol.array("B", "i*n + j").getLoopDeps());
    assertEquals(LoopDeps.of("i"), Symbol.array("B", "i + i").getLoopDeps());
    assertTrue(Symbol.array("B", "1e5", "0x10").getLoopDeps().isEmpty());
  }

  @Test
  public void testLoopDepsSetEquality() {
    assertEquals(LoopDeps.of("i", "j"), LoopDeps.of("j", "i"));
    assertEquals(LoopDeps.of("i", "j").hashCode(),
                 LoopDeps.of("j", "i").hashCode());
    assertEquals("j", LoopDeps.of("i", "j").last());
    assertEquals("i", LoopDeps.of("j", "i").last());
    assertFalse(LoopDeps.of("i").equals(LoopDeps.of("i", "j")));
  }

  @Test
  public void testCopyIsDeep() {
    For orig = simpleNest();
    For copy = orig.copy();
    assertEquals(orig.toString(), copy.toString());

    For innerCopy = (For)copy.getBody().get(0);
    Assign stmtCopy = (Assign)innerCopy.getBody().get(0);
    stmtCopy.setValue(new Symbol("0.0"));
    For innerOrig = (For)orig.getBody().get(0);
    assertNotSame(innerOrig, innerCopy);
    assertEquals("B[i] * (C[j] + 2.0)",
        ((Assign)innerOrig.getBody().get(0)).getValue().toString());
  }

  @Test
  public void testLoopHeader() {
    For loop = For.range("k", "0", "6", new Block());
    assertEquals("k", loop.itVar());
    assertEquals("0", loop.start());
    assertEquals("6", loop.bound());
    assertEquals("1", loop.step());
    assertEquals("6", loop.size());

    For incl = new For(new Decl("int", new Symbol("k"), new Symbol("0")),
        new BinExpr(new Symbol("k"), new Symbol("5"), Operator.LTE),
        new Incr(new Symbol("k"), new Symbol("1")), new Block());
    assertEquals("6", incl.size());

    For sym = new For(new Decl("int", new Symbol("k"), new Symbol("0")),
        new BinExpr(new Symbol("k"), new Symbol("n"), Operator.LTE),
        new Incr(new Symbol("k"), new Symbol("1")), new Block());
    assertEquals("(n + 1)", sym.size());
  }

  @Test
  public void testSameHeader() {
    For a = For.range("i", "0", "3", new Block());
    For b = For.range("i", "0", "3",
        new Block(ImmutableList.<Node>of(new Decl("double", new Symbol("x")))));
    For c = For.range("i", "0", "4", new Block());
    assertTrue(a.sameHeader(b));
    assertFalse(a.sameHeader(c));
  }

  @Test
  public void testSetHeaderKeepsBody() {
    For a = For.range("i", "0", "3", new Block());
    Block bodyA = a.getBody();
    For b = For.range("j", "1", "7", new Block());
    b.setDirective("#pragma pyop2 itspace");
    a.setHeader(b.copyHeader());
    assertEquals("j", a.itVar());
    assertEquals("7", a.bound());
    assertEquals("#pragma pyop2 itspace", a.getDirective());
    assertTrue(bodyA == a.getBody());
    assertNotSame(b.getInit(), a.getInit());
  }

  @Test
  public void testBlockIdentityOps() {
    Symbol x1 = new Symbol("x");
    Symbol x2 = new Symbol("x");
    Block b = new Block(ImmutableList.<Node>of(x1, x2));
    assertEquals(1, b.indexOf(x2));
    b.remove(x2);
    assertEquals(1, b.size());
    assertTrue(b.get(0) == x1);
    b.insert(0, ImmutableList.<Node>of(x2));
    assertEquals(0, b.indexOf(x2));
    assertEquals(-1, b.indexOf(new Symbol("x")));
  }
}
