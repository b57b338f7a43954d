package exm.minic.frontend;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exm.minic.frontend.cst.ParseNode;
import exm.minic.parser.HandWrittenFrontEnd;

public class ContextTest {

  @Test
  public void testSyncFilePos() throws Exception {
    ParseNode unit = new HandWrittenFrontEnd().parse("test.c",
                                  "int a;\n\nint main() {\n  return a;\n}");
    Context context = new Context("test.c");
    assertEquals(0, context.getLine());

    context.syncFilePos(unit.child(1));
    assertEquals(3, context.getLine());
    assertEquals("test.c:3: ", context.getLocation());

    context.syncFilePos(unit.child(0));
    assertEquals(1, context.getLine());
    assertEquals("test.c:1", context.toString());
  }

  @Test
  public void testLevels() {
    Context context = new Context("test.c");
    assertEquals(Context.ROOT_LEVEL, context.getLevel());
    context.enter();
    context.enter();
    assertEquals(2, context.getLevel());
    context.exit();
    assertEquals(1, context.getLevel());
  }
}
