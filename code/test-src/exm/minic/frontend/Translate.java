package exm.minic.frontend;

import static org.junit.Assert.assertEquals;

import exm.minic.ast.AstKind;
import exm.minic.ast.AstNode;
import exm.minic.common.exceptions.UserException;

/**
 * Shortcuts for translating small programs in tests
 */
public class Translate {
  public static final String INPUT = "test.c";

  public static AstNode program(FrontEndKind frontEnd, String source)
      throws UserException {
    return new CSTWalker().walk(INPUT, frontEnd.create().parse(INPUT, source));
  }

  /**
   * @return body of main() { ... } wrapped around the statements
   */
  public static AstNode body(FrontEndKind frontEnd, String statements)
      throws UserException {
    AstNode unit = program(frontEnd, "int main() {\n" + statements + "\n}\n");
    assertEquals(1, unit.childCount());
    AstNode fn = unit.child(0);
    assertEquals(AstKind.FUNC_DEF, fn.kind());
    return fn.child(2);
  }

  /**
   * @return tree for the expression, from "return expr;"
   */
  public static AstNode expr(FrontEndKind frontEnd, String expr)
      throws UserException {
    AstNode body = body(frontEnd, "return " + expr + ";");
    assertEquals(1, body.childCount());
    AstNode ret = body.child(0);
    assertEquals(AstKind.RETURN, ret.kind());
    return ret.child(0);
  }
}
