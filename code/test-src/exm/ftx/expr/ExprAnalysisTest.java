package exm.ftx.expr;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import com.google.common.base.Function;

import exm.ftx.ir.expr.ArrayRef;
import exm.ftx.ir.expr.Cast;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.FloatLiteral;
import exm.ftx.ir.expr.IntLiteral;
import exm.ftx.ir.expr.Operation;
import exm.ftx.ir.expr.ScalarRef;

public class ExprAnalysisTest {

  /**
   * x(i) * 2.0_JPRB + REAL(b%c, kind=JPIM)
   */
  private static Expression sample() {
    ArrayRef x = new ArrayRef("x",
        Arrays.<Expression>asList(new ScalarRef("i")));
    ScalarRef bc = new ScalarRef("c", new ScalarRef("b"), null, null, null);
    return Operation.binary("+",
        Operation.binary("*", x, new FloatLiteral("2.0", "JPRB", null)),
        new Cast("REAL", bc, "JPIM", null));
  }

  @Test
  public void testFoldLeaves() {
    Function<Expression, Integer> one = new Function<Expression, Integer>() {
      @Override
      public Integer apply(Expression input) {
        return 1;
      }
    };
    Function<List<Integer>, Integer> sum =
                              new Function<List<Integer>, Integer>() {
      @Override
      public Integer apply(List<Integer> input) {
        int total = 0;
        for (Integer i: input) {
          total += i;
        }
        return total;
      }
    };
    // x(i), 2.0_JPRB and b%c
    assertEquals(3, (int)ExprFold.fold(sample(), one, sum));
  }

  @Test
  public void testReferencesVariable() {
    Expression e = sample();
    assertTrue(ExprAnalysis.referencesVariable(e, "x"));
    assertTrue(ExprAnalysis.referencesVariable(e, "I"));
    assertTrue(ExprAnalysis.referencesVariable(e, "b"));
    assertTrue(ExprAnalysis.referencesVariable(e, "c"));
    assertFalse(ExprAnalysis.referencesVariable(e, "y"));
    assertFalse(ExprAnalysis.referencesVariable(new IntLiteral(1), "x"));
  }

  @Test
  public void testKindParameters() {
    assertEquals(Arrays.asList("JPRB", "JPIM"),
        Arrays.asList(ExprAnalysis.kindParameters(sample()).toArray()));
    assertTrue(ExprAnalysis.kindParameters(new ScalarRef("x")).isEmpty());
  }

  @Test
  public void testCountNodes() {
    assertEquals(1, ExprAnalysis.countNodes(new ScalarRef("x")));
    // +, *, x(i), i, 2.0, REAL, b%c
    assertEquals(7, ExprAnalysis.countNodes(sample()));
  }
}
