package exm.minic.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import exm.minic.ast.AstKind;
import exm.minic.ast.AstNode;
import exm.minic.ast.BasicType;
import exm.minic.common.Logging;
import exm.minic.common.exceptions.MiniCRuntimeError;

@RunWith(Parameterized.class)
public class CSTWalkerTest {

  @Parameters(name = "{0}")
  public static List<Object[]> frontEnds() {
    List<Object[]> params = new ArrayList<Object[]>();
    for (FrontEndKind kind: FrontEndKind.values()) {
      params.add(new Object[] {kind});
    }
    return params;
  }

  private final FrontEndKind frontEnd;

  public CSTWalkerTest(FrontEndKind frontEnd) {
    this.frontEnd = frontEnd;
  }

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/CSTWalkerTest.minic.log", true);
  }

  private AstNode body(String statements) throws Exception {
    return Translate.body(frontEnd, statements);
  }

  @Test
  public void testEmptyProgram() throws Exception {
    AstNode unit = Translate.program(frontEnd, "// nothing here\n");
    assertEquals(AstKind.COMPILE_UNIT, unit.kind());
    assertEquals(0, unit.childCount());
    assertEquals(1, unit.line());
    assertTrue(unit.isFrozen());
  }

  @Test
  public void testDeclarationSharesType() throws Exception {
    AstNode unit = Translate.program(frontEnd, "int a, b, c;");
    assertEquals(1, unit.childCount());
    AstNode decl = unit.child(0);
    assertEquals(AstKind.DECL_STMT, decl.kind());
    assertEquals(3, decl.childCount());

    String[] names = {"a", "b", "c"};
    for (int i = 0; i < names.length; i++) {
      AstNode var = decl.child(i);
      assertEquals(AstKind.VAR_DECL, var.kind());
      assertEquals(2, var.childCount());
      assertEquals(AstKind.LEAF_TYPE, var.child(0).kind());
      assertEquals(BasicType.INT, var.child(0).type());
      assertEquals(names[i], var.child(1).name());
    }
    // Each name has its own type leaf
    assertNotSame(decl.child(0).child(0), decl.child(1).child(0));
  }

  @Test
  public void testTopLevelSourceOrder() throws Exception {
    AstNode unit = Translate.program(frontEnd,
        "int x;\nint f() { return x; }\nint y, z;\nint main() { return f(); }");
    assertEquals(4, unit.childCount());
    assertEquals(AstKind.DECL_STMT, unit.child(0).kind());
    assertEquals(AstKind.FUNC_DEF, unit.child(1).kind());
    assertEquals("f", unit.child(1).name());
    assertEquals(AstKind.DECL_STMT, unit.child(2).kind());
    assertEquals(AstKind.FUNC_DEF, unit.child(3).kind());
    assertEquals("main", unit.child(3).name());
  }

  @Test
  public void testFunctionDefinition() throws Exception {
    AstNode unit = Translate.program(frontEnd, "\nint foo() {\n}\n");
    AstNode fn = unit.child(0);
    assertEquals(AstKind.FUNC_DEF, fn.kind());
    assertEquals("foo", fn.name());
    assertEquals(2, fn.line());
    assertEquals(3, fn.childCount());
    assertEquals(BasicType.INT, fn.child(0).type());
    assertEquals(AstKind.FUNC_FORMAL_PARAMS, fn.child(1).kind());
    assertEquals(0, fn.child(1).childCount());
    assertEquals(AstKind.BLOCK, fn.child(2).kind());
    assertEquals(0, fn.child(2).childCount());
  }

  @Test
  public void testIf() throws Exception {
    AstNode ifNode = body("if (x) { }").child(0);
    assertEquals(AstKind.IF, ifNode.kind());
    assertEquals(2, ifNode.childCount());
    assertEquals("x", ifNode.child(0).name());
    assertEquals(AstKind.BLOCK, ifNode.child(1).kind());
  }

  @Test
  public void testIfElse() throws Exception {
    AstNode ifNode = body("if (x) {} else {}").child(0);
    assertEquals(AstKind.IF_ELSE, ifNode.kind());
    assertEquals(3, ifNode.childCount());
    assertEquals(AstKind.BLOCK, ifNode.child(1).kind());
    assertEquals(AstKind.BLOCK, ifNode.child(2).kind());
  }

  @Test
  public void testDanglingElse() throws Exception {
    AstNode outer = body("if (a) if (b) x = 1; else x = 2;").child(0);
    assertEquals(AstKind.IF, outer.kind());
    AstNode inner = outer.child(1);
    assertEquals(AstKind.IF_ELSE, inner.kind());
  }

  @Test
  public void testEmptyStatementDropped() throws Exception {
    AstNode with = body("x = 1; ; y = 2; ;");
    AstNode without = body("x = 1; y = 2;");
    assertEquals(without.childCount(), with.childCount());
    assertEquals(2, with.childCount());
    assertEquals(AstKind.ASSIGN, with.child(0).kind());
    assertEquals(AstKind.ASSIGN, with.child(1).kind());
  }

  @Test
  public void testEmptyBodyBecomesBlock() throws Exception {
    AstNode ifNode = body("if (x) ; else ;").child(0);
    assertEquals(AstKind.IF_ELSE, ifNode.kind());
    assertEquals(AstKind.BLOCK, ifNode.child(1).kind());
    assertEquals(0, ifNode.child(1).childCount());
    assertEquals(AstKind.BLOCK, ifNode.child(2).kind());

    AstNode loop = body("while (x) ;").child(0);
    assertEquals(AstKind.WHILE, loop.kind());
    assertEquals(AstKind.BLOCK, loop.child(1).kind());
    assertEquals(0, loop.child(1).childCount());
  }

  @Test
  public void testAssignAndExprStatement() throws Exception {
    AstNode block = body("x = y + 1;\nf(x);");
    AstNode assign = block.child(0);
    assertEquals(AstKind.ASSIGN, assign.kind());
    assertEquals(AstKind.LEAF_VAR_ID, assign.child(0).kind());
    assertEquals("x", assign.child(0).name());
    assertEquals(AstKind.ADD, assign.child(1).kind());

    // No wrapper node for an expression statement
    assertEquals(AstKind.FUNC_CALL, block.child(1).kind());
  }

  @Test
  public void testLoops() throws Exception {
    AstNode loop = body("while (i < 10) { i = i + 1; break; continue; }")
                          .child(0);
    assertEquals(AstKind.WHILE, loop.kind());
    assertEquals(2, loop.childCount());
    assertEquals(AstKind.LT, loop.child(0).kind());
    AstNode loopBody = loop.child(1);
    assertEquals(3, loopBody.childCount());
    assertEquals(AstKind.BREAK, loopBody.child(1).kind());
    assertEquals(0, loopBody.child(1).childCount());
    assertEquals(AstKind.CONTINUE, loopBody.child(2).kind());
  }

  @Test
  public void testReturn() throws Exception {
    AstNode ret = body("return 0;").child(0);
    assertEquals(AstKind.RETURN, ret.kind());
    assertEquals(1, ret.childCount());
    assertEquals(0, ret.child(0).intValue());
  }

  @Test
  public void testNestedBlocksAndDeclarations() throws Exception {
    AstNode block = body("int a; { int b; b = 1; {} } a = 2;");
    assertEquals(3, block.childCount());
    assertEquals(AstKind.DECL_STMT, block.child(0).kind());
    AstNode inner = block.child(1);
    assertEquals(AstKind.BLOCK, inner.kind());
    assertEquals(3, inner.childCount());
    assertEquals(AstKind.DECL_STMT, inner.child(0).kind());
    assertEquals(AstKind.BLOCK, inner.child(2).kind());
    assertEquals(0, inner.child(2).childCount());
  }

  @Test
  public void testLines() throws Exception {
    AstNode block = body("int a,\n  b;\nif (a)\n  a = 1;\nwhile (b) {\n"
                         + "  break;\n}\nreturn\n a;");
    // Body opens on line 1
    assertEquals(1, block.line());

    AstNode decl = block.child(0);
    assertEquals(2, decl.line());
    assertEquals(2, decl.child(0).line());
    assertEquals(3, decl.child(1).line());
    // Type leaf is on the line of the shared type
    assertEquals(2, decl.child(1).child(0).line());
    assertEquals(3, decl.child(1).child(1).line());

    AstNode ifNode = block.child(1);
    assertEquals(4, ifNode.line());
    assertEquals(5, ifNode.child(1).line());

    AstNode loop = block.child(2);
    assertEquals(6, loop.line());
    assertEquals(6, loop.child(1).line());
    assertEquals(7, loop.child(1).child(0).line());

    AstNode ret = block.child(3);
    assertEquals(9, ret.line());
    assertEquals(10, ret.child(0).line());
  }

  @Test
  public void testIdempotent() throws Exception {
    String program = "int g;\nint main() {\n  int i;\n  while (i < 3) {\n"
        + "    if (i == 1) continue; else g = g + f(i, -i);\n"
        + "    i = i + 1;\n  }\n  return !g;\n}\n";
    AstNode first = Translate.program(frontEnd, program);
    AstNode second = Translate.program(frontEnd, program);
    assertNotSame(first, second);
    assertTrue(first.sameStructure(second));
    assertEquals(first.printTree(), second.printTree());
  }

  @Test
  public void testDifferentProgramsDiffer() throws Exception {
    assertFalse(body("x = 1;").sameStructure(body("x = 2;")));
    assertFalse(body("x = 1;").sameStructure(body("\nx = 1;")));
  }

  @Test
  public void testRootMustBeCompileUnit() throws Exception {
    exception.expect(MiniCRuntimeError.class);
    exception.expectMessage("compile unit");
    new CSTWalker().walk(Translate.INPUT, frontEnd.create()
                    .parse(Translate.INPUT, "int x;").child(0));
  }
}
