package exm.ftx.common.util;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

public class StringUtilTest {

  @Test
  public void testQuote() {
    assertEquals("'abc'", StringUtil.fortranQuote("abc"));
    assertEquals("'it''s'", StringUtil.fortranQuote("it's"));
    assertEquals("''", StringUtil.fortranQuote(""));
  }

  @Test
  public void testUnquote() {
    assertEquals("it's", StringUtil.fortranUnquote("'it''s'"));
    assertEquals("say \"hi\"", StringUtil.fortranUnquote("\"say \"\"hi\"\"\""));
    // Not quoted, or mismatched quotes
    assertEquals("abc", StringUtil.fortranUnquote("abc"));
    assertEquals("'abc\"", StringUtil.fortranUnquote("'abc\""));
  }

  @Test
  public void testConcat() {
    assertEquals("a, b, c", StringUtil.concat(", ", Arrays.asList("a", "b", "c")));
    assertEquals("", StringUtil.concat(", ", Arrays.<String>asList()));
  }

  @Test
  public void testTrimNewlines() {
    assertEquals("  a\nb", StringUtil.trimNewlines("\n  a\nb\n\n"));
    assertEquals("", StringUtil.trimNewlines("\n\n"));
  }
}
