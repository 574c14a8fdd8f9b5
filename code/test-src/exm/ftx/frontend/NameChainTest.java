package exm.ftx.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.After;
import org.junit.Test;

import exm.ftx.common.Settings;
import exm.ftx.common.exceptions.AmbiguousReferenceException;
import exm.ftx.common.exceptions.UnsupportedConstructException;
import exm.ftx.ir.expr.ArrayRef;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.Expression.ExprKind;
import exm.ftx.ir.expr.InlineCall;
import exm.ftx.ir.expr.IntLiteral;
import exm.ftx.ir.expr.ScalarRef;
import exm.ftx.ir.expr.VariableRef;

public class NameChainTest {

  @After
  public void tearDown() {
    Settings.reset();
  }

  private static Fragment name(String n) {
    return Fragment.name(n, null);
  }

  private static Fragment tuple(Expression... args) {
    return Fragment.indices(Arrays.asList(args), null);
  }

  private static Expression build(Fragment... parts) throws Exception {
    return NameChain.build(Arrays.asList(parts), null, "name");
  }

  @Test
  public void testSimpleName() throws Exception {
    Expression e = build(name("x"));
    assertEquals(ExprKind.SCALAR, e.kind());
    assertEquals("x", ((ScalarRef)e).getName());
  }

  @Test
  public void testQualifiedChain() throws Exception {
    // a%b(i)%c
    Expression e = build(name("a"), tuple(new ScalarRef("i")), name("b"),
                         name("c"));
    VariableRef c = (VariableRef)e;
    assertEquals("c", c.getName());
    assertEquals("a%b%c", c.getQualifiedName());
    VariableRef b = c.getParent();
    assertEquals(ExprKind.ARRAY, b.kind());
    assertEquals(Arrays.<Expression>asList(new ScalarRef("i")),
                 ((ArrayRef)b).getDimensions());
    VariableRef a = b.getParent();
    assertEquals("a", a.getName());
    assertNull(a.getParent());
    assertEquals(a, c.getRoot());
    assertEquals("a%b(i)%c", e.stringify());
  }

  @Test
  public void testArrayElement() throws Exception {
    Expression e = build(tuple(new IntLiteral(3), new ScalarRef("j")),
                         name("arr"));
    assertEquals(ExprKind.ARRAY, e.kind());
    assertEquals("arr(3,j)", e.stringify());
  }

  @Test
  public void testElementalIntrinsic() throws Exception {
    Expression e = build(tuple(new ScalarRef("x")), name("SQRT"));
    assertEquals(ExprKind.INLINE_CALL, e.kind());
    InlineCall call = (InlineCall)e;
    assertEquals("SQRT", call.getName());
    assertFalse(call.isProvisional());
    assertEquals(1, call.getArgs().size());
  }

  @Test
  public void testEmptyTupleIsProvisionalCall() throws Exception {
    Expression e = build(tuple(), name("get_count"));
    assertEquals(ExprKind.INLINE_CALL, e.kind());
    assertTrue(((InlineCall)e).isProvisional());
    assertEquals("get_count()", e.stringify());
  }

  @Test(expected=AmbiguousReferenceException.class)
  public void testEmptyTupleStrict() throws Exception {
    Settings.set(Settings.STRICT_CALLS, "true");
    build(tuple(), name("get_count"));
  }

  @Test
  public void testKeywordArgumentsMakeCall() throws Exception {
    Map<String, Expression> kwargs = new TreeMap<String, Expression>();
    kwargs.put("dim", new IntLiteral(1));
    Fragment args = Fragment.indices(
        Arrays.<Expression>asList(new ScalarRef("a")), kwargs, null);
    Expression e = build(args, name("total"));
    assertEquals(ExprKind.INLINE_CALL, e.kind());
    InlineCall call = (InlineCall)e;
    assertFalse(call.isProvisional());
    assertEquals(new IntLiteral(1), call.getKwargs().get("dim"));
  }

  @Test
  public void testComponentNamedLikeIntrinsic() throws Exception {
    // limits%max(2) indexes a component, it does not call MAX
    Expression e = build(name("limits"), tuple(new IntLiteral(2)),
                         name("max"));
    assertEquals(ExprKind.ARRAY, e.kind());
    ArrayRef max = (ArrayRef)e;
    assertEquals("max", max.getName());
    assertEquals("limits", max.getParent().getName());
    assertEquals(Arrays.<Expression>asList(new IntLiteral(2)),
                 max.getDimensions());
    assertEquals("limits%max(2)", e.stringify());
  }

  @Test
  public void testComponentWithEmptyParentheses() throws Exception {
    Settings.set(Settings.STRICT_CALLS, "true");
    Expression e = build(name("obj"), tuple(), name("f"));
    assertEquals(ExprKind.ARRAY, e.kind());
    assertTrue(((ArrayRef)e).getDimensions().isEmpty());
    assertEquals("obj%f()", e.stringify());
  }

  @Test(expected=UnsupportedConstructException.class)
  public void testComponentWithKeywordArguments() throws Exception {
    Map<String, Expression> kwargs = new TreeMap<String, Expression>();
    kwargs.put("dim", new IntLiteral(1));
    build(name("obj"), Fragment.indices(
        Collections.<Expression>emptyList(), kwargs, null), name("f"));
  }

  @Test(expected=UnsupportedConstructException.class)
  public void testTupleWithoutName() throws Exception {
    build(name("a"), tuple(new IntLiteral(1)));
  }

  @Test(expected=UnsupportedConstructException.class)
  public void testNoParts() throws Exception {
    List<Fragment> none = Collections.emptyList();
    NameChain.build(none, null, "name");
  }
}
