package exm.minic.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import exm.minic.ast.AstKind;
import exm.minic.ast.AstNode;
import exm.minic.common.Logging;

@RunWith(Parameterized.class)
public class ExprWalkerTest {

  @Parameters(name = "{0}")
  public static List<Object[]> frontEnds() {
    List<Object[]> params = new ArrayList<Object[]>();
    for (FrontEndKind kind: FrontEndKind.values()) {
      params.add(new Object[] {kind});
    }
    return params;
  }

  private final FrontEndKind frontEnd;

  public ExprWalkerTest(FrontEndKind frontEnd) {
    this.frontEnd = frontEnd;
  }

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ExprWalkerTest.minic.log", true);
  }

  private AstNode expr(String expr) throws Exception {
    return Translate.expr(frontEnd, expr);
  }

  @Test
  public void testSingleOperandNoNodes() throws Exception {
    AstNode tree = expr("a");
    assertEquals(AstKind.LEAF_VAR_ID, tree.kind());
    assertEquals("a", tree.name());
    assertEquals(0, tree.childCount());
  }

  @Test
  public void testChainLeftFold() throws Exception {
    String[] ops = {"+", "-", "*", "/", "%", "<", ">", "<=", ">=", "==",
                    "!=", "&&", "||"};
    for (String op: ops) {
      for (int n = 1; n <= 4; n++) {
        StringBuilder sb = new StringBuilder("x0");
        for (int i = 1; i <= n; i++) {
          sb.append(' ').append(op).append(" x").append(i);
        }
        AstNode tree = expr(sb.toString());
        assertEquals(sb + ": operator nodes", n, countOperators(tree));

        // Walk down left spine: each right child is the next operand
        AstNode node = tree;
        for (int i = n; i >= 1; i--) {
          assertEquals(op, node.kind().opSymbol());
          assertEquals("x" + i, node.child(1).name());
          node = node.child(0);
        }
        assertEquals(sb + ": leftmost leaf", "x0", node.name());
      }
    }
  }

  @Test
  public void testMixedSameLevelLeftAssoc() throws Exception {
    // (a - b) + c, not a - (b + c)
    AstNode tree = expr("a - b + c");
    assertEquals(AstKind.ADD, tree.kind());
    assertEquals(AstKind.SUB, tree.child(0).kind());
    assertEquals("c", tree.child(1).name());
  }

  @Test
  public void testPrecedence() throws Exception {
    AstNode tree = expr("a || b && c == d < e + f * g");
    assertEquals(AstKind.LOGIC_OR, tree.kind());
    AstNode and = tree.child(1);
    assertEquals(AstKind.LOGIC_AND, and.kind());
    AstNode eq = and.child(1);
    assertEquals(AstKind.EQ, eq.kind());
    AstNode lt = eq.child(1);
    assertEquals(AstKind.LT, lt.kind());
    AstNode add = lt.child(1);
    assertEquals(AstKind.ADD, add.kind());
    AstNode mul = add.child(1);
    assertEquals(AstKind.MUL, mul.kind());
    assertEquals("f", mul.child(0).name());
    assertEquals("g", mul.child(1).name());
  }

  @Test
  public void testParenthesesOverridePrecedence() throws Exception {
    AstNode tree = expr("(a + b) * c");
    assertEquals(AstKind.MUL, tree.kind());
    assertEquals(AstKind.ADD, tree.child(0).kind());

    // Redundant parentheses add no nodes
    assertTrue(expr("((a))").sameStructure(expr("a")));
  }

  @Test
  public void testUnary() throws Exception {
    AstNode neg = expr("-5");
    assertEquals(AstKind.NEG, neg.kind());
    assertEquals(1, neg.childCount());
    assertEquals(AstKind.LEAF_LITERAL_UINT, neg.child(0).kind());
    assertEquals(5, neg.child(0).intValue());
    assertTrue(neg.sameStructure(expr("- (5)")));

    AstNode not = expr("!-x");
    assertEquals(AstKind.NOT, not.kind());
    assertEquals(AstKind.NEG, not.child(0).kind());
    assertEquals("x", not.child(0).child(0).name());

    // Unary binds tighter than binary
    AstNode sub = expr("-a * b");
    assertEquals(AstKind.MUL, sub.kind());
    assertEquals(AstKind.NEG, sub.child(0).kind());
  }

  @Test
  public void testLiterals() throws Exception {
    assertEquals(0, expr("0").intValue());
    assertEquals(7, expr("007").intValue());
    assertEquals(31, expr("0x1F").intValue());
    assertEquals(123, expr("123").intValue());
    assertEquals(AstNode.MAX_UINT, expr("4294967295").intValue());
  }

  @Test
  public void testCallNoArgs() throws Exception {
    AstNode call = expr("f()");
    assertEquals(AstKind.FUNC_CALL, call.kind());
    assertEquals(2, call.childCount());
    assertEquals(AstKind.LEAF_VAR_ID, call.child(0).kind());
    assertEquals("f", call.child(0).name());
    assertEquals(AstKind.FUNC_REAL_PARAMS, call.child(1).kind());
    assertEquals(0, call.child(1).childCount());
  }

  @Test
  public void testCallArgs() throws Exception {
    AstNode call = expr("f(1, x+1)");
    assertEquals(AstKind.FUNC_CALL, call.kind());
    AstNode args = call.child(1);
    assertEquals(2, args.childCount());
    assertEquals(1, args.child(0).intValue());
    AstNode second = args.child(1);
    assertEquals(AstKind.ADD, second.kind());
    assertEquals("x", second.child(0).name());
    assertEquals(1, second.child(1).intValue());
  }

  @Test
  public void testCallInExpression() throws Exception {
    AstNode tree = expr("-g(h(1)) + 2");
    assertEquals(AstKind.ADD, tree.kind());
    AstNode neg = tree.child(0);
    assertEquals(AstKind.NEG, neg.kind());
    AstNode g = neg.child(0);
    assertEquals(AstKind.FUNC_CALL, g.kind());
    AstNode h = g.child(1).child(0);
    assertEquals(AstKind.FUNC_CALL, h.kind());
    assertEquals("h", h.child(0).name());
  }

  @Test
  public void testOperatorLines() throws Exception {
    AstNode tree = expr("a\n+\nb\n*\nc");
    // "int main() {" is line 1, so the expression starts on line 2
    assertEquals(3, tree.line());
    assertEquals(2, tree.child(0).line());
    assertEquals(5, tree.child(1).line());
  }

  private static int countOperators(AstNode tree) {
    int count = tree.kind().isOperator() ? 1 : 0;
    for (AstNode child: tree.children()) {
      count += countOperators(child);
    }
    return count;
  }
}
