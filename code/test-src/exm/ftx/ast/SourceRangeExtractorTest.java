package exm.ftx.ast;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exm.ftx.common.exceptions.FTXRuntimeError;

public class SourceRangeExtractorTest {

  private static final String SOURCE =
      "program p\n" +
      "  x = 1 + 2\n" +
      "end program p\n";

  @Test
  public void testColumnRange() {
    SourceRangeExtractor ex = new SourceRangeExtractor("p.f90", SOURCE);
    SourceSpan span = ex.extract(new SourcePosition(2, 2, 2, 11), false);
    assertEquals("x = 1 + 2", span.getText());
    assertEquals(2, span.getStartLine());
    assertEquals(2, span.getEndLine());
    assertEquals("p.f90", span.getFile());
  }

  @Test
  public void testFullLines() {
    SourceRangeExtractor ex = new SourceRangeExtractor("p.f90", SOURCE);
    SourceSpan span = ex.extract(new SourcePosition(2, 2, 2, 11), true);
    assertEquals("  x = 1 + 2\n", span.getText());
  }

  @Test
  public void testLinesOnly() {
    SourceSpan span = SourceRangeExtractor.extract(
                          SourcePosition.lines(1, 2), SOURCE, false);
    assertEquals("program p\n  x = 1 + 2\n", span.getText());
    assertEquals(2, span.lineCount());
  }

  @Test
  public void testMultiLineColumns() {
    SourceRangeExtractor ex = new SourceRangeExtractor(null, SOURCE);
    SourceSpan span = ex.extract(new SourcePosition(1, 8, 2, 3), false);
    assertEquals("p\n  x", span.getText());
  }

  @Test(expected=FTXRuntimeError.class)
  public void testPastEnd() {
    new SourceRangeExtractor(null, SOURCE).extract(
                          SourcePosition.lines(5, 5), false);
  }

  @Test
  public void testFromOffsets() {
    SourcePosition pos = SourcePosition.fromOffsets("ab\ncd\n", 3, 4);
    assertEquals(2, pos.lineBegin);
    assertEquals(0, pos.colBegin);
    assertEquals(2, pos.lineEnd);
    assertEquals(2, pos.colEnd);
  }
}
