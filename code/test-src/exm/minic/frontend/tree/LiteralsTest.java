package exm.minic.frontend.tree;

import static org.junit.Assert.assertEquals;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.minic.common.exceptions.MiniCRuntimeError;

public class LiteralsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testRadix() {
    assertEquals(0L, Literals.parseIntLiteral("0"));
    assertEquals(7L, Literals.parseIntLiteral("007"));
    assertEquals(31L, Literals.parseIntLiteral("0x1F"));
    assertEquals(31L, Literals.parseIntLiteral("0X1f"));
    assertEquals(123L, Literals.parseIntLiteral("123"));
    assertEquals(8L, Literals.parseIntLiteral("010"));
    assertEquals(0L, Literals.parseIntLiteral("00"));
  }

  @Test
  public void testUnsignedRange() {
    assertEquals(0xFFFFFFFFL, Literals.parseIntLiteral("4294967295"));
    assertEquals(0xFFFFFFFFL, Literals.parseIntLiteral("0xFFFFFFFF"));
    assertEquals(0x80000000L, Literals.parseIntLiteral("020000000000"));
  }

  @Test
  public void testOverflowWraps() {
    assertEquals(0L, Literals.parseIntLiteral("4294967296"));
    assertEquals(1L, Literals.parseIntLiteral("0x100000001"));
    assertEquals(5L, Literals.parseIntLiteral("0x10000000000000005"));
  }

  @Test
  public void testMalformed() {
    exception.expect(MiniCRuntimeError.class);
    Literals.parseIntLiteral("09");
  }
}
