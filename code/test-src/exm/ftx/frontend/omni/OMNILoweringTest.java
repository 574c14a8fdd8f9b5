package exm.ftx.frontend.omni;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import exm.ftx.ast.XmlParseNode;
import exm.ftx.common.exceptions.MalformedDeclarationException;
import exm.ftx.common.exceptions.UnsupportedConstructException;
import exm.ftx.frontend.Fragment;
import exm.ftx.ir.Conditionals.Conditional;
import exm.ftx.ir.Conditionals.MaskedStatement;
import exm.ftx.ir.Conditionals.MultiConditional;
import exm.ftx.ir.DataType.TypeAttr;
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
import exm.ftx.ir.expr.ArrayRef;
import exm.ftx.ir.expr.Cast;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.Expression.ExprKind;
import exm.ftx.ir.expr.LogicLiteral;
import exm.ftx.ir.expr.ScalarRef;
import exm.ftx.ir.expr.StringConcat;
import exm.ftx.ir.expr.VariableRef;

public class OMNILoweringTest {

  private static final String RAW =
      "SUBROUTINE s(a, n)\n" +
      "  USE parkind1, ONLY: jprb, ip => jpim\n" +
      "  DO i=1, n\n" +
      "    a(i,:) = 0.0_JPRB\n" +
      "  END DO\n" +
      "  IF (n > 1) THEN\n" +
      "    CALL foo(a, flag=.TRUE.)\n" +
      "  END IF\n" +
      "  IF (n > 2) n = 2\n" +
      "  EXIT\n" +
      "END SUBROUTINE s\n";

  private static final String TYPE_TABLE =
      "<typeTable>" +
      "<FbasicType type=\"R1\" ref=\"Freal\"><kind><Var>JPRB</Var></kind>" +
      "</FbasicType>" +
      "<FbasicType type=\"A1\" ref=\"R1\" intent=\"in\">" +
      "<indexRange><lowerBound><FintConstant type=\"Fint\">1</FintConstant>" +
      "</lowerBound><upperBound><Var type=\"Fint\">n</Var></upperBound>" +
      "</indexRange><indexRange is_assumed_shape=\"true\"/></FbasicType>" +
      "<FbasicType type=\"P1\" ref=\"Fint\" is_pointer=\"true\"/>" +
      "<FbasicType type=\"A2\" ref=\"Freal\"><indexRange><lowerBound>" +
      "<FintConstant type=\"Fint\">1</FintConstant></lowerBound>" +
      "<upperBound><FintConstant type=\"Fint\">10</FintConstant>" +
      "</upperBound></indexRange></FbasicType>" +
      "<FstructType type=\"S1\"><symbols>" +
      "<id type=\"Freal\"><name>x</name></id>" +
      "<id type=\"A2\"><name>v</name></id></symbols></FstructType>" +
      "<FbasicType type=\"T1\" ref=\"S1\"/>" +
      "</typeTable>";

  private static List<Statement> program(String declarations, String body)
                                                     throws Exception {
    String xml = "<XcodeProgram>" + TYPE_TABLE + "<globalSymbols/>" +
        "<globalDeclarations><FfunctionDefinition lineno=\"1\">" +
        "<name>s</name><symbols/><declarations>" + declarations +
        "</declarations><body>" + body + "</body></FfunctionDefinition>" +
        "</globalDeclarations></XcodeProgram>";
    List<Statement> top = new OMNILowering("s.F90", RAW).lowerProgram(
                                                XmlParseNode.parse(xml));
    assertEquals(1, top.size());
    assertEquals(StatementKind.SECTION, top.get(0).kind());
    return ((Scope)top.get(0)).getBody();
  }

  private static List<Statement> body(String body) throws Exception {
    return program("", body);
  }

  private static Expression expr(String xml) throws Exception {
    List<Statement> stmts = body("<FassignStatement>" +
        "<Var type=\"Fint\">tmp</Var>" + xml + "</FassignStatement>");
    return ((Assignment)stmts.get(0)).getExpr();
  }

  private static String var(String type, String name) {
    return "<Var type=\"" + type + "\">" + name + "</Var>";
  }

  private static String intConst(int v) {
    return "<FintConstant type=\"Fint\">" + v + "</FintConstant>";
  }

  private static String assign(String target, String value) {
    return "<FassignStatement>" + target + value + "</FassignStatement>";
  }

  @Test
  public void testTypeTable() throws Exception {
    TypeTable t = TypeTable.build(XmlParseNode.parse(
        "<XcodeProgram>" + TYPE_TABLE + "<globalDeclarations>" +
        "<FstructDecl><name type=\"S1\">point</name></FstructDecl>" +
        "</globalDeclarations></XcodeProgram>"));
    assertEquals("REAL", t.typeName("A1"));
    assertEquals("JPRB", t.kind("A1"));
    assertEquals("in", t.intent("A1"));
    assertEquals(2, t.indexRanges("A1").size());
    assertTrue(t.attributes("P1").contains(TypeAttr.POINTER));
    assertEquals("INTEGER", t.typeName("Fint"));
    assertTrue(t.isStruct("T1"));
    assertEquals("point", t.typeName("T1"));
    assertNull(t.typeName("Zmissing"));
    assertTrue(t.indexRanges("Fint").isEmpty());
  }

  @Test
  public void testDeclarations() throws Exception {
    List<Statement> decls = program(
        "<FuseOnlyDecl name=\"parkind1\"><renamable use_name=\"jprb\"/>" +
        "<renamable use_name=\"jpim\" local_name=\"ip\"/></FuseOnlyDecl>" +
        "<varDecl><name type=\"A1\">a</name></varDecl>" +
        "<varDecl><name type=\"Fint\">n</name><value>" + intConst(3) +
        "</value></varDecl>", "");
    assertEquals(3, decls.size());

    Import use = (Import)decls.get(0);
    assertEquals("parkind1", use.getModule());
    assertEquals(Arrays.asList("jprb", "ip => jpim"), use.getSymbols());

    Declaration a = (Declaration)decls.get(1);
    assertEquals("REAL", a.getType().getName());
    assertEquals("JPRB", a.getType().getKind());
    assertEquals("in", a.getType().getIntent());
    ArrayRef aRef = (ArrayRef)a.getVariables().get(0);
    // 1:n collapses to n, assumed shape stays a range
    assertEquals(2, aRef.getShape().size());
    assertEquals(new ScalarRef("n"), aRef.getShape().get(0));
    assertEquals("REAL(KIND=JPRB), INTENT(IN) :: a(n,:)\n", a.stringify());

    Declaration n = (Declaration)decls.get(2);
    assertEquals("INTEGER :: n = 3\n", n.stringify());
  }

  @Test
  public void testDerivedType() throws Exception {
    List<Statement> decls = program(
        "<FstructDecl><name type=\"S1\">point</name></FstructDecl>", "");
    TypeDef t = (TypeDef)decls.get(0);
    assertEquals("point", t.getName());
    List<Declaration> components = t.getDeclarations();
    assertEquals(2, components.size());
    assertEquals("x", components.get(0).getVariables().get(0).getName());
    ArrayRef v = (ArrayRef)components.get(1).getVariables().get(0);
    assertEquals("v(10)", v.stringify());
  }

  @Test(expected=MalformedDeclarationException.class)
  public void testUnresolvableType() throws Exception {
    program("<varDecl><name type=\"Zmissing\">q</name></varDecl>", "");
  }

  @Test
  public void testDoLoop() throws Exception {
    String loop = "<FdoStatement>" + var("Fint", "i") +
        "<indexRange><lowerBound>" + intConst(1) + "</lowerBound>" +
        "<upperBound>" + var("Fint", "n") + "</upperBound></indexRange>" +
        "<body>" + assign("<FarrayRef type=\"Freal\"><varRef>" +
        var("A1", "a") + "</varRef><arrayIndex>" + var("Fint", "i") +
        "</arrayIndex><indexRange/></FarrayRef>",
        "<FrealConstant type=\"Freal\" kind=\"JPRB\">0.0</FrealConstant>") +
        "</body></FdoStatement>";
    Loop l = (Loop)body(loop).get(0);
    assertEquals("i", l.getVariable().getName());
    assertEquals("DO i=1, n", l.stringify().split("\n")[0]);
    Assignment a = (Assignment)l.getBody().get(0);
    ArrayRef target = (ArrayRef)a.getTarget();
    assertEquals("a(i,:)", target.stringify());
    // Indexed references keep the declared shape of the array
    assertEquals(2, target.getShape().size());
  }

  @Test
  public void testUnboundedAndWhileLoops() throws Exception {
    List<Statement> stmts = body(
        "<FdoStatement><body>" + assign(var("Fint", "k"), intConst(1)) +
        "</body></FdoStatement>" +
        "<FdoWhileStatement><condition><logGTExpr>" + var("Fint", "k") +
        intConst(0) + "</logGTExpr></condition><body>" +
        assign(var("Fint", "k"), intConst(0)) +
        "</body></FdoWhileStatement>");
    assertNull(((WhileLoop)stmts.get(0)).getCondition());
    assertEquals("k > 0",
                 ((WhileLoop)stmts.get(1)).getCondition().stringify());
  }

  @Test
  public void testBlockAndInlineIf() throws Exception {
    String cond1 = "<condition><logGTExpr>" + var("Fint", "n") +
                   intConst(1) + "</logGTExpr></condition>";
    String cond2 = "<condition><logGTExpr>" + var("Fint", "n") +
                   intConst(2) + "</logGTExpr></condition>";
    List<Statement> stmts = body(
        "<FifStatement lineno=\"6\">" + cond1 + "<then><body>" +
        "<exprStatement><functionCall><name>foo</name><arguments>" +
        var("A1", "a") + "<namedValue name=\"flag\"><FlogicalConstant>" +
        ".TRUE.</FlogicalConstant></namedValue></arguments></functionCall>" +
        "</exprStatement></body></then></FifStatement>" +
        "<FifStatement lineno=\"9\">" + cond2 + "<then><body>" +
        assign(var("Fint", "n"), intConst(2)) +
        "</body></then></FifStatement>");
    Conditional block = (Conditional)stmts.get(0);
    assertFalse(block.isInline());
    Call call = (Call)block.getConditionBodies().get(0).get(0);
    assertEquals("foo", call.getName());
    assertEquals(ExprKind.ARRAY, call.getArgs().get(0).kind());
    assertEquals(new LogicLiteral(true), call.getKwargs().get("flag"));

    Conditional inline = (Conditional)stmts.get(1);
    assertTrue(inline.isInline());
    assertEquals("IF (n > 2) n = 2\n", inline.stringify());
  }

  @Test
  public void testIfElse() throws Exception {
    Conditional c = (Conditional)body("<FifStatement><condition>" +
        var("Flogical", "ok") + "</condition><then><body>" +
        assign(var("Fint", "k"), intConst(1)) + "</body></then><else><body>" +
        assign(var("Fint", "k"), intConst(2)) + "</body></else>" +
        "</FifStatement>").get(0);
    assertFalse(c.isInline());
    assertEquals(1, c.getElseBody().size());
  }

  @Test
  public void testSelectCase() throws Exception {
    MultiConditional m = (MultiConditional)body(
        "<FselectCaseStatement><value>" + var("Fint", "n") + "</value>" +
        "<FcaseLabel><value>" + intConst(1) + "</value><value>" +
        intConst(2) + "</value><body>" +
        assign(var("Fint", "k"), intConst(1)) + "</body></FcaseLabel>" +
        "<FcaseLabel><body>" + assign(var("Fint", "k"), intConst(0)) +
        "</body></FcaseLabel></FselectCaseStatement>").get(0);
    assertEquals("n", m.getSelector().stringify());
    assertEquals(1, m.getValues().size());
    assertEquals(2, m.getValues().get(0).size());
    assertEquals(1, m.getElseBody().size());
  }

  @Test
  public void testWhere() throws Exception {
    MaskedStatement w = (MaskedStatement)body(
        "<FwhereStatement><condition><logGTExpr>" + var("A1", "a") +
        "<FrealConstant type=\"Freal\">0.0</FrealConstant></logGTExpr>" +
        "</condition><then><body>" + assign(var("A1", "a"), intConst(1)) +
        "</body></then><else><body>" + assign(var("A1", "a"), intConst(0)) +
        "</body></else></FwhereStatement>").get(0);
    assertEquals(1, w.getBody().size());
    assertEquals(1, w.getDefault().size());
  }

  @Test
  public void testMemoryStatements() throws Exception {
    List<Statement> stmts = body(
        "<FallocateStatement><alloc>" + var("A1", "a") + "<arrayIndex>" +
        var("Fint", "n") + "</arrayIndex></alloc></FallocateStatement>" +
        "<FnullifyStatement><alloc>" + var("P1", "p") +
        "</alloc></FnullifyStatement>");
    assertEquals("ALLOCATE(a(n))\n", stmts.get(0).stringify());
    assertEquals("NULLIFY(p)\n", stmts.get(1).stringify());
  }

  @Test
  public void testPragmaCommentAndPassthrough() throws Exception {
    List<Statement> stmts = body(
        "<FpragmaStatement>!$acc parallel loop</FpragmaStatement>" +
        "<FcommentLine>! note</FcommentLine>" +
        "<FexitStatement lineno=\"10\"/>" +
        "<FcycleStatement/>");
    Pragma p = (Pragma)stmts.get(0);
    assertEquals("acc", p.getKeyword());
    assertEquals("parallel loop", p.getContent());
    assertEquals(StatementKind.COMMENT, stmts.get(1).kind());
    assertEquals("EXIT\n", stmts.get(2).stringify());
    assertEquals(10, stmts.get(2).getSource().getStartLine());
    assertEquals("CYCLE\n", stmts.get(3).stringify());
  }

  @Test
  public void testDataStatement() throws Exception {
    List<Statement> decls = program("<FdataDecl><varList>" +
        var("Fint", "k") + "</varList><valueList>" + intConst(1) +
        intConst(2) + "</valueList></FdataDecl>", "");
    assertEquals("DATA k/1, 2/\n", decls.get(0).stringify());
  }

  @Test
  public void testCast() throws Exception {
    Expression e = expr("<functionCall><name>real</name><arguments>" +
        var("Fint", "n") + var("Fint", "JPRB") +
        "</arguments></functionCall>");
    assertEquals(ExprKind.CAST, e.kind());
    Cast c = (Cast)e;
    assertEquals("REAL", c.getFunction());
    assertEquals("JPRB", c.getKindParam());
    assertEquals(new ScalarRef("n"), c.getArgument());
  }

  @Test
  public void testFunctionCall() throws Exception {
    Expression e = expr("<functionCall><name>my_func</name><arguments>" +
        var("Fint", "n") + "</arguments></functionCall>");
    assertEquals(ExprKind.INLINE_CALL, e.kind());
    assertEquals("my_func(n)", e.stringify());
  }

  @Test
  public void testMemberReference() throws Exception {
    Expression e = expr("<FmemberRef member=\"x\" type=\"Freal\"><varRef>" +
        var("T1", "p") + "</varRef></FmemberRef>");
    VariableRef x = (VariableRef)e;
    assertEquals("p", x.getParent().getName());
    assertEquals("p%x", x.stringify());
  }

  @Test
  public void testConcatIsFlattened() throws Exception {
    Expression e = expr("<FconcatExpr><FcharacterConstant>ab" +
        "</FcharacterConstant><FconcatExpr><FcharacterConstant>c" +
        "</FcharacterConstant>" + var("Fcharacter", "s") +
        "</FconcatExpr></FconcatExpr>");
    assertEquals(3, ((StringConcat)e).getParts().size());
  }

  @Test
  public void testOperators() throws Exception {
    assertEquals("-x", expr("<unaryMinusExpr>" + var("Freal", "x") +
                            "</unaryMinusExpr>").stringify());
    assertEquals("a*b + c", expr("<plusExpr><mulExpr>" +
        var("Freal", "a") + var("Freal", "b") + "</mulExpr>" +
        var("Freal", "c") + "</plusExpr>").stringify());
  }

  @Test
  public void testOperatorKeepsLine() throws Exception {
    Expression gt = expr("<logGTExpr lineno=\"9\">" + var("Fint", "n") +
        "<FintConstant type=\"Fint\">2</FintConstant></logGTExpr>");
    assertEquals(ExprKind.OPERATION, gt.kind());
    assertEquals(9, gt.getSource().getStartLine());
    assertEquals("  IF (n > 2) n = 2\n", gt.getSource().getText());

    Expression neg = expr("<unaryMinusExpr lineno=\"4\">" +
        var("Freal", "x") + "</unaryMinusExpr>");
    assertEquals(4, neg.getSource().getStartLine());
  }

  @Test(expected=UnsupportedConstructException.class)
  public void testBinaryOperatorArity() throws Exception {
    expr("<plusExpr>" + var("Freal", "a") + "</plusExpr>");
  }

  @Test
  public void testFragmentWithoutProgram() throws Exception {
    OMNILowering lowering = new OMNILowering(null, "");
    List<Fragment> result = lowering.lower(XmlParseNode.parse(
        assign(var("Fint", "k"), intConst(1))));
    assertEquals(1, result.size());
    assertEquals("k = 1\n", result.get(0).getStatement().stringify());
  }
}
