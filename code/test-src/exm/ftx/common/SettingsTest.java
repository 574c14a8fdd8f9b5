package exm.ftx.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.After;
import org.junit.Test;

import exm.ftx.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @After
  public void resetSettings() {
    Settings.reset();
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertFalse(Settings.getBoolean(Settings.STRICT_CALLS));
    assertTrue(Settings.getList(Settings.EXTRA_INTRINSICS).isEmpty());
    assertEquals(2, Settings.getInt(Settings.CODEGEN_INDENT));
    assertTrue(Settings.getKeys().contains(Settings.LOG_TRACE));
  }

  @Test
  public void testOverride() throws InvalidOptionException {
    Settings.set(Settings.STRICT_CALLS, "TRUE");
    assertTrue(Settings.getBoolean(Settings.STRICT_CALLS));
    Settings.set(Settings.CODEGEN_INDENT, "4");
    assertEquals(4, Settings.CODEGEN_INDENT_WIDTH);

    Settings.reset();
    assertFalse(Settings.getBoolean(Settings.STRICT_CALLS));
    assertEquals(2, Settings.CODEGEN_INDENT_WIDTH);
  }

  @Test
  public void testList() throws InvalidOptionException {
    Settings.set(Settings.EXTRA_INTRINSICS, " foo , bar_2,,");
    assertEquals(Arrays.asList("foo", "bar_2"),
                 Settings.getList(Settings.EXTRA_INTRINSICS));
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.STRICT_CALLS, "maybe");
  }

  @Test(expected=InvalidOptionException.class)
  public void testNegativeIndent() throws InvalidOptionException {
    Settings.set(Settings.CODEGEN_INDENT, "-1");
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadIntrinsicName() throws InvalidOptionException {
    Settings.set(Settings.EXTRA_INTRINSICS, "a-b");
  }

  @Test
  public void testSystemProperty() throws InvalidOptionException {
    System.setProperty(Settings.STRICT_CALLS, "true");
    try {
      Settings.initFTXProperties();
      assertTrue(Settings.getBoolean(Settings.STRICT_CALLS));
    } finally {
      System.clearProperty(Settings.STRICT_CALLS);
    }
  }
}
