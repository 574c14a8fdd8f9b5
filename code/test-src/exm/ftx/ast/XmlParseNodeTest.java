package exm.ftx.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.ftx.common.exceptions.FTXRuntimeError;
import exm.ftx.common.exceptions.UserException;

public class XmlParseNodeTest {

  private static SourcePosition position(String attrs) throws UserException {
    return XmlParseNode.parse("<node " + attrs + "/>").getPosition();
  }

  @Test
  public void testLineAndColumnAttributes() throws UserException {
    SourcePosition pos = position("line_begin=\"2\" col_begin=\"4\" " +
                                  "line_end=\"3\" col_end=\"9\"");
    assertEquals(2, pos.lineBegin);
    assertEquals(4, pos.colBegin);
    assertEquals(3, pos.lineEnd);
    assertEquals(9, pos.colEnd);
    assertTrue(pos.hasColumns());
  }

  @Test
  public void testLineNumberOnly() throws UserException {
    SourcePosition pos = position("lineno=\"7\"");
    assertEquals(7, pos.lineBegin);
    assertEquals(7, pos.lineEnd);
    assertFalse(pos.hasColumns());
  }

  @Test
  public void testNoPosition() throws UserException {
    assertNull(position("name=\"x\""));
  }

  @Test(expected=FTXRuntimeError.class)
  public void testNonNumericLine() throws UserException {
    position("lineno=\"seven\"");
  }

  @Test(expected=FTXRuntimeError.class)
  public void testNonNumericColumn() throws UserException {
    position("line_begin=\"1\" col_begin=\"x\" line_end=\"1\"");
  }

  @Test(expected=FTXRuntimeError.class)
  public void testZeroLine() throws UserException {
    position("lineno=\"0\"");
  }

  @Test(expected=FTXRuntimeError.class)
  public void testReversedLines() throws UserException {
    position("line_begin=\"4\" line_end=\"2\"");
  }
}
