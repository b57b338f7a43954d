package exm.minic.antlr;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.minic.common.exceptions.InvalidSyntaxException;
import exm.minic.common.exceptions.LexicalException;
import exm.minic.common.exceptions.UserException;
import exm.minic.frontend.cst.ParseNode;
import exm.minic.frontend.cst.Rule;
import exm.minic.frontend.cst.TokenKind;

public class AntlrFrontEndTest {

  @org.junit.Rule
  public ExpectedException exception = ExpectedException.none();

  private static ParseNode parse(String source) throws UserException {
    return new AntlrFrontEnd().parse("test.c", source);
  }

  @Test
  public void testTreeShape() throws UserException {
    ParseNode unit = parse("int a, b;\nint main() {\n  return -a * f(b, 1);\n}");
    assertEquals(Rule.COMPILE_UNIT, unit.rule());
    assertEquals(2, unit.childCount());

    ParseNode decl = unit.child(0);
    assertEquals(Rule.VAR_DECL, decl.rule());
    assertEquals(TokenKind.INT, decl.child(0).tokenKind());
    assertEquals("a", decl.child(1).text());
    assertEquals("b", decl.child(2).text());

    ParseNode fn = unit.child(1);
    assertEquals(Rule.FUNC_DEF, fn.rule());
    assertEquals(2, fn.line());
    assertEquals("main", fn.terminal(TokenKind.ID).text());

    ParseNode ret = fn.child(Rule.BLOCK).child(0);
    assertEquals(Rule.RETURN_STMT, ret.rule());
    assertEquals(3, ret.line());

    ParseNode mul = ret.child(0).child(0).child(0).child(0).child(0).child(0);
    assertEquals(Rule.MUL_EXP, mul.rule());
    assertEquals(2, mul.nonTerminals().size());
    assertEquals(TokenKind.MUL, mul.terminals().get(0).tokenKind());

    ParseNode neg = mul.nonTerminals().get(0);
    assertEquals(Rule.UNARY_OP_EXP, neg.rule());
    assertEquals(TokenKind.SUB, neg.terminals().get(0).tokenKind());

    ParseNode call = mul.nonTerminals().get(1);
    assertEquals(Rule.CALL_EXP, call.rule());
    assertEquals("f", call.terminal(TokenKind.ID).text());
    assertEquals(2, call.child(Rule.ARG_LIST).childCount());
  }

  @Test
  public void testEmptyArgsAndStatements() throws UserException {
    ParseNode block = parse("int main() { f(); ; break; }")
                            .child(0).child(Rule.BLOCK);
    assertEquals(3, block.childCount());
    ParseNode call = block.child(0).child(0).child(0).child(0).child(0)
                          .child(0).child(0).child(0);
    assertEquals(Rule.CALL_EXP, call.rule());
    assertNull(call.optChild(Rule.ARG_LIST));
    assertEquals(Rule.EXPR_STMT, block.child(1).rule());
    assertEquals(0, block.child(1).childCount());
    assertEquals(Rule.BREAK_STMT, block.child(2).rule());
  }

  @Test
  public void testParenthesesDropped() throws UserException {
    ParseNode ret = parse("int main() { return (x); }")
                          .child(0).child(Rule.BLOCK).child(0);
    // MUL_EXP holds the inner expression directly
    ParseNode mul = ret.child(0).child(0).child(0).child(0).child(0).child(0);
    assertEquals(Rule.LOGIC_OR_EXP, mul.child(0).rule());
  }

  @Test
  public void testLexicalError() throws UserException {
    exception.expect(LexicalException.class);
    exception.expectMessage("test.c:2:");
    parse("int a;\nint b # c;");
  }

  @Test
  public void testSingleAmpersand() throws UserException {
    exception.expect(LexicalException.class);
    parse("int main() { return a & b; }");
  }

  @Test
  public void testSyntaxError() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    exception.expectMessage("test.c:3:");
    parse("int main() {\n  x = 1;\n  y = ;\n}");
  }

  @Test
  public void testParametersRejected() throws UserException {
    exception.expect(InvalidSyntaxException.class);
    parse("int f(int x) { return x; }");
  }

  @Test
  public void testErrorLines() throws UserException {
    try {
      parse("int main() {\n  x = 1;\n  y = ;\n}");
      fail("Expected syntax error");
    } catch (InvalidSyntaxException e) {
      assertEquals(3, e.getLine());
    }
    try {
      parse("int a;\nint b # c;");
      fail("Expected lexical error");
    } catch (LexicalException e) {
      assertEquals(2, e.getLine());
    }
  }
}
