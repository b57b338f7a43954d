package exm.minic.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.minic.common.exceptions.MiniCRuntimeError;

public class AstNodeTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static AstNode var(String name) {
    return AstNode.newVarId(name, 1);
  }

  @Test
  public void testLeaves() {
    AstNode lit = AstNode.newLiteral(AstNode.MAX_UINT, 3);
    assertEquals(AstKind.LEAF_LITERAL_UINT, lit.kind());
    assertEquals(0xFFFFFFFFL, lit.intValue());
    assertEquals(3, lit.line());
    assertEquals(0, lit.childCount());

    AstNode id = AstNode.newVarId("abc", 4);
    assertEquals("abc", id.name());

    AstNode type = AstNode.newType(BasicType.INT, 5);
    assertEquals(BasicType.INT, type.type());
    assertEquals("int", type.type().typeName());

    assertEquals(AstKind.BREAK, AstNode.newLeaf(AstKind.BREAK, 6).kind());
  }

  @Test
  public void testContainerKeepsInsertOrder() {
    AstNode block = AstNode.newContainer(AstKind.BLOCK, 1, var("a"));
    block.insertSonNode(var("b"));
    block.insertSonNode(var("c"));
    assertEquals(3, block.childCount());
    assertEquals("a", block.child(0).name());
    assertEquals("b", block.child(1).name());
    assertEquals("c", block.child(2).name());
  }

  @Test
  public void testEmptyContainer() {
    AstNode params = AstNode.newContainer(AstKind.FUNC_REAL_PARAMS, 1);
    assertEquals(0, params.childCount());
    assertTrue(params.children().isEmpty());
  }

  @Test
  public void testBinary() {
    AstNode add = AstNode.newBinary(AstKind.ADD, 2, var("a"), var("b"));
    assertEquals(2, add.childCount());
    assertEquals("+", add.kind().opSymbol());
    assertEquals("ADD '+' @2", add.label());
  }

  @Test
  public void testBinaryWrongKind() {
    exception.expect(MiniCRuntimeError.class);
    AstNode.newBinary(AstKind.NEG, 1, var("a"), var("b"));
  }

  @Test
  public void testFixedWrongCount() {
    exception.expect(MiniCRuntimeError.class);
    exception.expectMessage("needs 3 children");
    AstNode.newFixed(AstKind.IF_ELSE, 1, var("a"), var("b"));
  }

  @Test
  public void testInsertIntoNonContainer() {
    AstNode add = AstNode.newBinary(AstKind.ADD, 2, var("a"), var("b"));
    exception.expect(MiniCRuntimeError.class);
    add.insertSonNode(var("c"));
  }

  @Test
  public void testSingleOwner() {
    AstNode shared = var("x");
    AstNode.newUnary(AstKind.NEG, 1, shared);
    exception.expect(MiniCRuntimeError.class);
    exception.expectMessage("already has an owner");
    AstNode.newUnary(AstKind.NOT, 1, shared);
  }

  @Test
  public void testFrozenRoot() {
    AstNode unit = AstNode.newContainer(AstKind.COMPILE_UNIT, 1);
    unit.freeze();
    assertTrue(unit.isFrozen());
    exception.expect(MiniCRuntimeError.class);
    unit.insertSonNode(var("x"));
  }

  @Test
  public void testNullChild() {
    exception.expect(MiniCRuntimeError.class);
    AstNode.newContainer(AstKind.BLOCK, 1).insertSonNode(null);
  }

  @Test
  public void testLiteralRange() {
    exception.expect(MiniCRuntimeError.class);
    AstNode.newLiteral(AstNode.MAX_UINT + 1, 1);
  }

  @Test
  public void testPayloadAccessors() {
    exception.expect(MiniCRuntimeError.class);
    var("a").intValue();
  }

  @Test
  public void testFuncDef() {
    AstNode fn = AstNode.newFuncDef(AstNode.newType(BasicType.INT, 1),
        "main", 1, AstNode.newContainer(AstKind.FUNC_FORMAL_PARAMS, 1),
        AstNode.newContainer(AstKind.BLOCK, 1));
    assertEquals("main", fn.name());
    assertEquals(3, fn.childCount());
    assertEquals(AstKind.BLOCK, fn.child(2).kind());
  }

  @Test
  public void testFuncDefNeedsBlock() {
    exception.expect(MiniCRuntimeError.class);
    AstNode.newFuncDef(AstNode.newType(BasicType.INT, 1), "main", 1,
        AstNode.newContainer(AstKind.FUNC_FORMAL_PARAMS, 1),
        AstNode.newContainer(AstKind.DECL_STMT, 1));
  }

  @Test
  public void testFuncDefOnlyFromNewFuncDef() {
    exception.expect(MiniCRuntimeError.class);
    exception.expectMessage("newFuncDef");
    AstNode.newFixed(AstKind.FUNC_DEF, 1, AstNode.newType(BasicType.INT, 1),
        AstNode.newContainer(AstKind.FUNC_FORMAL_PARAMS, 1),
        AstNode.newContainer(AstKind.BLOCK, 1));
  }

  @Test
  public void testSameStructure() {
    AstNode a = AstNode.newBinary(AstKind.SUB, 1, var("x"),
                                  AstNode.newLiteral(1, 1));
    AstNode b = AstNode.newBinary(AstKind.SUB, 1, var("x"),
                                  AstNode.newLiteral(1, 1));
    AstNode c = AstNode.newBinary(AstKind.SUB, 1, var("x"),
                                  AstNode.newLiteral(2, 1));
    AstNode d = AstNode.newBinary(AstKind.SUB, 1,
                                  AstNode.newLiteral(1, 1), var("x"));
    assertTrue(a.sameStructure(b));
    assertFalse(a.sameStructure(c));
    assertFalse(a.sameStructure(d));
  }

  @Test
  public void testSameStructureDeepTree() {
    // Deep enough to overflow a recursive comparison
    AstNode a = var("x");
    AstNode b = var("x");
    for (int i = 0; i < 100000; i++) {
      a = AstNode.newUnary(AstKind.NEG, 1, a);
      b = AstNode.newUnary(AstKind.NEG, 1, b);
    }
    assertTrue(a.sameStructure(b));
  }

  @Test
  public void testPrintTree() {
    AstNode ret = AstNode.newUnary(AstKind.RETURN, 2,
        AstNode.newBinary(AstKind.ADD, 2, var("a"), AstNode.newLiteral(7, 2)));
    String expected = "RETURN @2\n"
                    + "  ADD '+' @2\n"
                    + "    LEAF_VAR_ID a @1\n"
                    + "    LEAF_LITERAL_UINT 7 @2\n";
    assertEquals(expected, ret.printTree().replace("\r\n", "\n"));
  }
}
