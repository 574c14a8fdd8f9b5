package exm.ftx.expr;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.After;
import org.junit.Test;

import exm.ftx.common.Settings;
import exm.ftx.common.exceptions.InvalidOptionException;
import exm.ftx.ir.expr.ArrayRef;
import exm.ftx.ir.expr.Cast;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.InlineCall;
import exm.ftx.ir.expr.IntLiteral;
import exm.ftx.ir.expr.LiteralList;
import exm.ftx.ir.expr.Operation;
import exm.ftx.ir.expr.RangeIndex;
import exm.ftx.ir.expr.ScalarRef;

public class DimensionMapperTest {

  private static final IntLiteral ONE = new IntLiteral(1);

  private static final List<Expression> SHAPE_10_20 =
      Arrays.<Expression>asList(new IntLiteral(10), new IntLiteral(20));

  @After
  public void resetSettings() {
    Settings.reset();
  }

  private static ArrayRef array(String name, List<Expression> shape,
                                Expression... dims) {
    return new ArrayRef(name, dims.length == 0 ? null : Arrays.asList(dims),
                        shape, null, null, null, null);
  }

  private static List<Expression> shape(Expression... extents) {
    return Arrays.asList(extents);
  }

  @Test
  public void testScalars() {
    assertEquals(shape(ONE), DimensionMapper.shapeOf(new IntLiteral(3)));
    assertEquals(shape(ONE), DimensionMapper.shapeOf(new ScalarRef("x")));
    assertTrue(DimensionMapper.isScalar(shape(ONE)));
    assertTrue(DimensionMapper.isScalar(Collections.<Expression>emptyList()));
    assertFalse(DimensionMapper.isScalar(shape(new IntLiteral(3))));
    assertFalse(DimensionMapper.isScalar(null));
  }

  @Test
  public void testWholeArray() {
    assertEquals(SHAPE_10_20,
        DimensionMapper.shapeOf(array("a", SHAPE_10_20)));
    assertNull(DimensionMapper.shapeOf(array("a", null)));
  }

  @Test
  public void testSection() {
    // a(:,5) of a(10,20)
    assertEquals(shape(new IntLiteral(10)), DimensionMapper.shapeOf(
        array("a", SHAPE_10_20, RangeIndex.full(), new IntLiteral(5))));
    // a(3,5)
    assertTrue(DimensionMapper.shapeOf(array("a", SHAPE_10_20,
        new IntLiteral(3), new IntLiteral(5))).isEmpty());
    // a(i,:)
    assertEquals(shape(new IntLiteral(20)), DimensionMapper.shapeOf(
        array("a", SHAPE_10_20, new ScalarRef("i"), RangeIndex.full())));
  }

  @Test
  public void testStridedBareSection() {
    // a(::2,5) of a(10,20)
    RangeIndex everyOther = new RangeIndex(null, null, new IntLiteral(2),
                                           null);
    assertEquals(shape(new IntLiteral(5)), DimensionMapper.shapeOf(
        array("a", SHAPE_10_20, everyOther, new IntLiteral(5))));
    // a(3,::4) of a(10,20)
    RangeIndex everyFourth = new RangeIndex(null, null, new IntLiteral(4),
                                            null);
    assertEquals(shape(new IntLiteral(5)), DimensionMapper.shapeOf(
        array("a", SHAPE_10_20, new IntLiteral(3), everyFourth)));
  }

  @Test
  public void testUnknownShape() {
    RangeIndex full = RangeIndex.full();
    assertEquals(shape(full),
        DimensionMapper.shapeOf(array("a", null, full)));
  }

  @Test
  public void testRangeExtent() {
    RangeIndex r = new RangeIndex(new IntLiteral(2), new IntLiteral(10),
                                  new IntLiteral(2), null);
    assertEquals(new IntLiteral(5), DimensionMapper.extent(r));
    assertEquals(shape(new IntLiteral(5)),
                 DimensionMapper.shapeOf(array("a", null, r)));

    assertEquals(new IntLiteral(10), DimensionMapper.extent(
        new RangeIndex(ONE, new IntLiteral(10))));
    assertEquals(new IntLiteral(0), DimensionMapper.extent(
        new RangeIndex(new IntLiteral(10), ONE)));
    assertEquals(new IntLiteral(4), DimensionMapper.extent(
        new RangeIndex(new IntLiteral(10), ONE, new IntLiteral(-3), null)));
  }

  @Test
  public void testSymbolicExtent() {
    ScalarRef n = new ScalarRef("n");
    ScalarRef k = new ScalarRef("k");
    ScalarRef s = new ScalarRef("s");
    assertEquals(n, DimensionMapper.extent(new RangeIndex(ONE, n)));
    assertEquals(n, DimensionMapper.extent(new RangeIndex(null, n)));
    assertEquals("n - k + 1", ExprStringifier.stringify(
        DimensionMapper.extent(new RangeIndex(k, n))));
    assertEquals("(n - k + s)/s", ExprStringifier.stringify(
        DimensionMapper.extent(new RangeIndex(k, n, s, null))));
    // No upper bound: extent unknown
    RangeIndex open = new RangeIndex(k, null);
    assertEquals(open, DimensionMapper.extent(open));
  }

  @Test
  public void testElemental() {
    ArrayRef a = array("a", SHAPE_10_20);
    assertEquals(SHAPE_10_20, DimensionMapper.shapeOf(
        Operation.binary("+", new IntLiteral(1), a)));
    assertEquals(SHAPE_10_20, DimensionMapper.shapeOf(
        new InlineCall("sqrt", Arrays.<Expression>asList(a))));
    assertEquals(SHAPE_10_20, DimensionMapper.shapeOf(
        new Cast("REAL", a, null, null)));
    // Unknown operand shape makes the result unknown
    assertNull(DimensionMapper.shapeOf(
        Operation.binary("*", new ScalarRef("x"), array("b", null))));
  }

  @Test
  public void testCalls() throws InvalidOptionException {
    InlineCall f = new InlineCall("f", Arrays.<Expression>asList(
                                          array("a", SHAPE_10_20)));
    assertEquals(shape(ONE), DimensionMapper.shapeOf(f));
    Settings.set(Settings.EXTRA_INTRINSICS, "f");
    assertEquals(SHAPE_10_20, DimensionMapper.shapeOf(f));
  }

  @Test
  public void testLiteralList() {
    assertEquals(shape(new IntLiteral(2)), DimensionMapper.shapeOf(
        new LiteralList(Arrays.<Expression>asList(ONE, ONE), null)));
  }
}
