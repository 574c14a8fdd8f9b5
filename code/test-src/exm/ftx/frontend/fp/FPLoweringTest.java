package exm.ftx.frontend.fp;

import static exm.ftx.frontend.fp.FPTree.node;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import exm.ftx.common.exceptions.MalformedDeclarationException;
import exm.ftx.common.exceptions.UnsupportedConstructException;
import exm.ftx.ir.Conditionals.Conditional;
import exm.ftx.ir.Conditionals.MaskedStatement;
import exm.ftx.ir.Conditionals.MultiConditional;
import exm.ftx.ir.Declarations.Declaration;
import exm.ftx.ir.Declarations.Import;
import exm.ftx.ir.Declarations.TypeDef;
import exm.ftx.ir.Loops.Loop;
import exm.ftx.ir.Loops.WhileLoop;
import exm.ftx.ir.Statement;
import exm.ftx.ir.Statement.StatementKind;
import exm.ftx.ir.Statements.Assignment;
import exm.ftx.ir.Statements.Call;
import exm.ftx.ir.Statements.Pragma;
import exm.ftx.ir.Statements.Scope;
import exm.ftx.ir.expr.Cast;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.Expression.ExprKind;
import exm.ftx.ir.expr.InlineCall;
import exm.ftx.ir.expr.ScalarRef;
import exm.ftx.ir.expr.VariableRef;

public class FPLoweringTest {

  private static FPTree leaf(FPRule rule) {
    return new FPTree(rule, null);
  }

  private static FPTree name(String n) {
    return node(FPRule.NAME, n);
  }

  private static FPTree intLit(int v) {
    return node(FPRule.INT_LITERAL_CONSTANT, Integer.toString(v));
  }

  private static FPTree none() {
    return leaf(FPRule.NONE);
  }

  private static FPTree assign(FPTree target, FPTree value) {
    return node(FPRule.ASSIGNMENT_STMT, target, value);
  }

  private static FPTree indexed(String n, FPTree... subscripts) {
    return node(FPRule.PART_REF, n,
                node(FPRule.SECTION_SUBSCRIPT_LIST, subscripts));
  }

  private static FPTree gt(FPTree lhs, FPTree rhs) {
    return node(FPRule.LEVEL_4_EXPR, ">", lhs, rhs);
  }

  private static List<Statement> lower(String raw, FPTree... stmts)
                                               throws Exception {
    FPTree program = node(FPRule.PROGRAM,
        node(FPRule.SUBROUTINE_SUBPROGRAM,
             node(FPRule.SUBROUTINE_STMT, "s"),
             node(FPRule.EXECUTION_PART, stmts),
             leaf(FPRule.END_SUBROUTINE_STMT)));
    List<Statement> top = new FPLowering("s.f90", raw).lowerProgram(program);
    assertEquals(1, top.size());
    assertEquals(StatementKind.SECTION, top.get(0).kind());
    return ((Scope)top.get(0)).getBody();
  }

  private static List<Statement> lower(FPTree... stmts) throws Exception {
    return lower("", stmts);
  }

  private static Expression expr(FPTree e) throws Exception {
    return ((Assignment)lower(assign(name("tmp"), e)).get(0)).getExpr();
  }

  @Test
  public void testCountedLoop() throws Exception {
    String raw = "DO i=1, n\n  a(i) = 0\nEND DO\n";
    FPTree loop = node(FPRule.BLOCK_NONLABEL_DO_CONSTRUCT,
        node(FPRule.NONLABEL_DO_STMT, node(FPRule.LOOP_CONTROL,
             name("i"), intLit(1), name("n"), none())),
        assign(indexed("a", name("i")), intLit(0)),
        leaf(FPRule.END_DO_STMT)).at(0, raw.length() - 1);
    Loop l = (Loop)lower(raw, loop).get(0);
    assertEquals("i", l.getVariable().getName());
    assertNull(l.getBounds().getStep());
    assertEquals(1, l.getBody().size());
    assertEquals(raw, l.getSource().getText());
    assertEquals(3, l.getSource().getEndLine());
    assertEquals("DO i=1, n\n  a(i) = 0\nEND DO\n", l.stringify());
  }

  @Test
  public void testLoopWithStep() throws Exception {
    FPTree loop = node(FPRule.BLOCK_NONLABEL_DO_CONSTRUCT,
        node(FPRule.NONLABEL_DO_STMT, node(FPRule.LOOP_CONTROL,
             name("k"), name("n"), intLit(1),
             node(FPRule.LEVEL_2_UNARY_EXPR, "-", intLit(1)))),
        leaf(FPRule.END_DO_STMT));
    Loop l = (Loop)lower(loop).get(0);
    assertEquals("-1", l.getBounds().getStep().stringify());
    assertTrue(l.getBody().isEmpty());
  }

  @Test
  public void testWhileAndUnboundedLoops() throws Exception {
    FPTree whileLoop = node(FPRule.BLOCK_NONLABEL_DO_CONSTRUCT,
        node(FPRule.NONLABEL_DO_STMT, node(FPRule.LOOP_CONTROL, "WHILE",
             gt(name("x"), intLit(0)))),
        assign(name("x"), name("y")),
        leaf(FPRule.END_DO_STMT));
    FPTree unbounded = node(FPRule.BLOCK_NONLABEL_DO_CONSTRUCT,
        leaf(FPRule.NONLABEL_DO_STMT),
        node(FPRule.EXIT_STMT, "EXIT"),
        leaf(FPRule.END_DO_STMT));
    List<Statement> body = lower(whileLoop, unbounded);
    assertEquals("x > 0",
                 ((WhileLoop)body.get(0)).getCondition().stringify());
    WhileLoop w = (WhileLoop)body.get(1);
    assertNull(w.getCondition());
    assertEquals("DO\n  EXIT\nEND DO\n", w.stringify());
  }

  @Test
  public void testIfConstruct() throws Exception {
    FPTree ifs = node(FPRule.IF_CONSTRUCT,
        node(FPRule.IF_THEN_STMT, gt(name("x"), intLit(0))),
        assign(name("y"), intLit(1)),
        node(FPRule.ELSE_IF_STMT, node(FPRule.LEVEL_4_EXPR, "<",
                                       name("x"), intLit(0))),
        assign(name("y"), intLit(2)),
        leaf(FPRule.ELSE_STMT),
        assign(name("y"), intLit(0)),
        leaf(FPRule.END_IF_STMT));
    Conditional c = (Conditional)lower(ifs).get(0);
    assertFalse(c.isInline());
    assertEquals(2, c.getConditions().size());
    assertEquals("IF (x > 0) THEN\n  y = 1\nELSE IF (x < 0) THEN\n" +
                 "  y = 2\nELSE\n  y = 0\nEND IF\n", c.stringify());
  }

  @Test
  public void testIfStatement() throws Exception {
    Conditional c = (Conditional)lower(node(FPRule.IF_STMT,
        gt(name("x"), intLit(0)), assign(name("y"), intLit(1)))).get(0);
    assertTrue(c.isInline());
    assertEquals("IF (x > 0) y = 1\n", c.stringify());
  }

  @Test
  public void testCaseConstruct() throws Exception {
    FPTree select = node(FPRule.CASE_CONSTRUCT,
        node(FPRule.SELECT_CASE_STMT, name("k")),
        node(FPRule.CASE_STMT, intLit(1), intLit(2)),
        assign(name("y"), intLit(1)),
        leaf(FPRule.CASE_STMT),
        assign(name("y"), intLit(0)),
        leaf(FPRule.END_SELECT_STMT));
    MultiConditional m = (MultiConditional)lower(select).get(0);
    assertEquals(1, m.getValues().size());
    assertEquals(2, m.getValues().get(0).size());
    assertEquals(1, m.getElseBody().size());
    assertEquals("SELECT CASE (k)\n  CASE (1, 2)\n    y = 1\n" +
                 "  CASE DEFAULT\n    y = 0\nEND SELECT\n", m.stringify());
  }

  @Test
  public void testWhereConstructAndStatement() throws Exception {
    FPTree where = node(FPRule.WHERE_CONSTRUCT,
        node(FPRule.WHERE_CONSTRUCT_STMT, gt(name("a"), intLit(0))),
        assign(name("b"), name("a")),
        leaf(FPRule.ELSEWHERE_STMT),
        assign(name("b"), intLit(0)),
        leaf(FPRule.END_WHERE_STMT));
    FPTree whereStmt = node(FPRule.WHERE_STMT, gt(name("a"), intLit(0)),
                            assign(name("c"), name("a")));
    List<Statement> body = lower(where, whereStmt);
    MaskedStatement m = (MaskedStatement)body.get(0);
    assertEquals("a > 0", m.getCondition().stringify());
    assertEquals(1, m.getBody().size());
    assertEquals(1, m.getDefault().size());
    MaskedStatement single = (MaskedStatement)body.get(1);
    assertEquals(1, single.getBody().size());
    assertTrue(single.getDefault().isEmpty());
  }

  @Test
  public void testCallStatement() throws Exception {
    Call c = (Call)lower(node(FPRule.CALL_STMT, name("solve"),
        node(FPRule.ACTUAL_ARG_SPEC_LIST, name("a"),
             node(FPRule.ACTUAL_ARG_SPEC, "flag", name("f"))))).get(0);
    assertEquals("solve", c.getName());
    assertEquals(1, c.getArgs().size());
    assertEquals(new ScalarRef("f"), c.getKwargs().get("flag"));
    assertEquals("CALL solve(a, flag=f)\n", c.stringify());
  }

  @Test(expected=UnsupportedConstructException.class)
  public void testCallWithoutName() throws Exception {
    lower(node(FPRule.CALL_STMT, intLit(1)));
  }

  @Test
  public void testTypeDeclaration() throws Exception {
    FPTree decl = node(FPRule.TYPE_DECLARATION_STMT,
        node(FPRule.INTRINSIC_TYPE_SPEC, "REAL",
             node(FPRule.KIND_SELECTOR, name("JPRB"))),
        node(FPRule.ATTR_SPEC_LIST,
             node(FPRule.INTENT_ATTR_SPEC, "IN"),
             node(FPRule.ATTR_SPEC, "ALLOCATABLE")),
        node(FPRule.ENTITY_DECL_LIST,
             node(FPRule.ENTITY_DECL, "a",
                  leaf(FPRule.DEFERRED_SHAPE_SPEC)),
             node(FPRule.ENTITY_DECL, "b", node(FPRule.EXPLICIT_SHAPE_SPEC,
                                                intLit(1), name("n"))),
             node(FPRule.ENTITY_DECL, "c",
                  node(FPRule.INITIALIZATION, intLit(0)))));
    Declaration d = (Declaration)lower(decl).get(0);
    assertEquals("JPRB", d.getType().getKind());
    assertEquals("in", d.getType().getIntent());
    assertTrue(d.getType().isAllocatable());
    assertEquals(3, d.getVariables().size());
    assertEquals(ExprKind.SCALAR, d.getVariables().get(2).kind());
    assertEquals("REAL(KIND=JPRB), INTENT(IN), ALLOCATABLE :: " +
                 "a(:), b(n), c = 0\n", d.stringify());
  }

  @Test
  public void testSharedDimensionAndBounds() throws Exception {
    FPTree decl = node(FPRule.TYPE_DECLARATION_STMT,
        node(FPRule.INTRINSIC_TYPE_SPEC, "INTEGER"),
        node(FPRule.ATTR_SPEC_LIST, node(FPRule.DIMENSION_ATTR_SPEC,
             node(FPRule.EXPLICIT_SHAPE_SPEC, intLit(0), name("m")))),
        node(FPRule.ENTITY_DECL_LIST, node(FPRule.ENTITY_DECL, "x")));
    Declaration d = (Declaration)lower(decl).get(0);
    assertEquals("INTEGER :: x(0:m)\n", d.stringify());
  }

  @Test(expected=MalformedDeclarationException.class)
  public void testUnknownAttribute() throws Exception {
    lower(node(FPRule.TYPE_DECLARATION_STMT,
        node(FPRule.INTRINSIC_TYPE_SPEC, "REAL"),
        node(FPRule.ATTR_SPEC_LIST, node(FPRule.ATTR_SPEC, "VOLATILE")),
        node(FPRule.ENTITY_DECL_LIST, node(FPRule.ENTITY_DECL, "x"))));
  }

  @Test
  public void testDerivedType() throws Exception {
    FPTree def = node(FPRule.DERIVED_TYPE_DEF,
        node(FPRule.DERIVED_TYPE_STMT, "point"),
        node(FPRule.COMPONENT_PART,
             node(FPRule.DATA_COMPONENT_DEF_STMT,
                  node(FPRule.INTRINSIC_TYPE_SPEC, "REAL"),
                  node(FPRule.ENTITY_DECL_LIST,
                       node(FPRule.ENTITY_DECL, "x"))),
             node(FPRule.COMMENT, "! y follows"),
             node(FPRule.DATA_COMPONENT_DEF_STMT,
                  node(FPRule.DECLARATION_TYPE_SPEC, "other"),
                  node(FPRule.ENTITY_DECL_LIST,
                       node(FPRule.ENTITY_DECL, "y")))),
        leaf(FPRule.END_TYPE_STMT));
    TypeDef t = (TypeDef)lower(def).get(0);
    assertEquals("point", t.getName());
    assertEquals(3, t.getBody().size());
    List<Declaration> decls = t.getDeclarations();
    assertEquals(2, decls.size());
    assertTrue(decls.get(1).getType().isDerived());
    assertEquals("TYPE(other) :: y\n", decls.get(1).stringify());
  }

  @Test
  public void testUseAndComments() throws Exception {
    List<Statement> body = lower(
        node(FPRule.USE_STMT, "parkind1", node(FPRule.ONLY_LIST,
             name("jprb"), name("jpim"))),
        node(FPRule.COMMENT, "!$omp parallel do"),
        node(FPRule.COMMENT, "! plain"));
    Import use = (Import)body.get(0);
    assertEquals("USE parkind1, ONLY: jprb, jpim\n", use.stringify());
    Pragma p = (Pragma)body.get(1);
    assertEquals("omp", p.getKeyword());
    assertEquals("parallel do", p.getContent());
    assertEquals(StatementKind.COMMENT, body.get(2).kind());
  }

  @Test
  public void testDataReference() throws Exception {
    Expression e = expr(node(FPRule.DATA_REF, name("a"),
                             indexed("b", name("i")), name("c")));
    VariableRef c = (VariableRef)e;
    assertEquals("a%b%c", c.getQualifiedName());
    assertEquals("a%b(i)%c", c.stringify());
  }

  @Test
  public void testSubscriptTriplets() throws Exception {
    Expression e = expr(indexed("arr",
        node(FPRule.SUBSCRIPT_TRIPLET, none(), none(), none()),
        node(FPRule.SUBSCRIPT_TRIPLET, intLit(1), name("n"), intLit(2))));
    assertEquals(ExprKind.ARRAY, e.kind());
    assertEquals("arr(:,1:n:2)", e.stringify());
  }

  @Test
  public void testIntrinsicReferences() throws Exception {
    Expression cast = expr(node(FPRule.INTRINSIC_FUNCTION_REFERENCE, "real",
        node(FPRule.ACTUAL_ARG_SPEC_LIST, name("n"),
             node(FPRule.ACTUAL_ARG_SPEC, "kind", name("JPRB")))));
    assertEquals(ExprKind.CAST, cast.kind());
    assertEquals("JPRB", ((Cast)cast).getKindParam());
    assertEquals("REAL(n, kind=JPRB)", cast.stringify());

    Expression max = expr(node(FPRule.INTRINSIC_FUNCTION_REFERENCE, "MAX",
                               name("a"), name("b")));
    assertEquals(ExprKind.INLINE_CALL, max.kind());
    assertFalse(((InlineCall)max).isProvisional());
    assertEquals("MAX(a, b)", max.stringify());
  }

  @Test
  public void testEmptySubscriptsAreProvisionalCall() throws Exception {
    Expression e = expr(indexed("f"));
    assertEquals(ExprKind.INLINE_CALL, e.kind());
    assertTrue(((InlineCall)e).isProvisional());
  }

  @Test
  public void testParenthesisAndOperators() throws Exception {
    Expression e = expr(node(FPRule.ADD_OPERAND, "*",
        node(FPRule.PARENTHESIS, node(FPRule.LEVEL_2_EXPR, "+",
                                      name("a"), name("b"))),
        name("c")));
    assertEquals("(a + b)*c", e.stringify());
    assertEquals("x", expr(node(FPRule.PARENTHESIS, name("x"))).stringify());
  }

  @Test
  public void testLiterals() throws Exception {
    assertEquals("1.5_JPRB",
        expr(node(FPRule.REAL_LITERAL_CONSTANT, "1.5_JPRB")).stringify());
    assertEquals(".TRUE.",
        expr(node(FPRule.LOGICAL_LITERAL_CONSTANT, ".true.")).stringify());
    assertEquals("[1,2]", expr(node(FPRule.ARRAY_CONSTRUCTOR,
        node(FPRule.AC_VALUE_LIST, intLit(1), intLit(2)))).stringify());
  }

  @Test
  public void testMemoryStatements() throws Exception {
    List<Statement> body = lower(
        node(FPRule.ALLOCATE_STMT, indexed("a", name("n"))),
        node(FPRule.DEALLOCATE_STMT, name("a")),
        node(FPRule.NULLIFY_STMT, name("p")));
    assertEquals("ALLOCATE(a(n))\n", body.get(0).stringify());
    assertEquals("DEALLOCATE(a)\n", body.get(1).stringify());
    assertEquals("NULLIFY(p)\n", body.get(2).stringify());
  }

  @Test
  public void testPassthroughUsesSourceText() throws Exception {
    String raw = "x = 1\n  RETURN\n";
    List<Statement> body = lower(raw,
        node(FPRule.RETURN_STMT, "return").at(8, 13),
        node(FPRule.CYCLE_STMT, "CYCLE"));
    assertEquals(StatementKind.INTRINSIC, body.get(0).kind());
    assertEquals("RETURN\n", body.get(0).stringify());
    assertEquals(2, body.get(0).getSource().getStartLine());
    assertEquals("CYCLE\n", body.get(1).stringify());
  }

  @Test(expected=UnsupportedConstructException.class)
  public void testUnknownRuleWithTwoChildren() throws Exception {
    lower(node(FPRule.UNKNOWN, assign(name("x"), intLit(1)),
               assign(name("y"), intLit(2))));
  }

  @Test
  public void testUnknownRuleWithOneChild() throws Exception {
    List<Statement> body = lower(node(FPRule.UNKNOWN, none(),
                                      assign(name("x"), intLit(1))));
    assertEquals(1, body.size());
  }

  @Test(expected=UnsupportedConstructException.class)
  public void testAssignmentArity() throws Exception {
    lower(node(FPRule.ASSIGNMENT_STMT, name("x")));
  }
}
