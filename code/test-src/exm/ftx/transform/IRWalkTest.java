package exm.ftx.transform;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;
import org.junit.Test;

import exm.ftx.common.Logging;
import exm.ftx.ir.Conditionals.Conditional;
import exm.ftx.ir.Loops.Loop;
import exm.ftx.ir.Loops.WhileLoop;
import exm.ftx.ir.Statement;
import exm.ftx.ir.Statement.StatementKind;
import exm.ftx.ir.Statements.Assignment;
import exm.ftx.ir.Statements.Call;
import exm.ftx.ir.expr.ArrayRef;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.Expression.ExprKind;
import exm.ftx.ir.expr.IntLiteral;
import exm.ftx.ir.expr.Operation;
import exm.ftx.ir.expr.RangeIndex;
import exm.ftx.ir.expr.ScalarRef;
import exm.ftx.ir.expr.VariableRef;
import exm.ftx.expr.ExprRetriever;
import exm.ftx.transform.IRWalk.IRWalker;

public class IRWalkTest {

  private static final Logger logger = Logging.getFTXLogger();

  private static ScalarRef var(String name) {
    return new ScalarRef(name);
  }

  private static Statement assign(String target, Expression value) {
    return new Assignment(var(target), value, false, null);
  }

  private static Loop loop(String v, List<Statement> body) {
    return new Loop(var(v), new RangeIndex(new IntLiteral(1), var("n")),
                    body, null);
  }

  /**
   * DO i=1, n
   *   x = i
   *   IF (x > 0) CALL foo()
   * END DO
   * y = 0
   * DO
   *   DO j=1, n
   *     z = j
   *   END DO
   * END DO
   */
  private static List<Statement> program() {
    Statement call = new Call("foo", Collections.<Expression>emptyList(),
        Collections.<String, Expression>emptyMap(), null);
    List<List<Statement>> bodies = new ArrayList<List<Statement>>();
    bodies.add(Arrays.asList(call));
    Statement cond = new Conditional(Arrays.<Expression>asList(
        Operation.binary(">", var("x"), new IntLiteral(0))), bodies,
        Collections.<Statement>emptyList(), true, null);
    Statement outer = loop("i", Arrays.asList(assign("x", var("i")), cond));
    Statement inner = loop("j", Arrays.asList(assign("z", var("j"))));
    Statement unbounded = new WhileLoop(null, Arrays.asList(inner), null);
    return Arrays.asList(outer, assign("y", new IntLiteral(0)), unbounded);
  }

  private static class KindRecorder extends IRWalker {
    final List<StatementKind> kinds = new ArrayList<StatementKind>();
    int assignments = 0;

    @Override
    protected void visit(Assignment assign) {
      assignments++;
      visitOther(assign);
    }

    @Override
    protected void visitOther(Statement stmt) {
      kinds.add(stmt.kind());
    }
  }

  @Test
  public void testRecursivePreOrder() {
    KindRecorder r = new KindRecorder();
    IRWalk.walk(logger, program(), r);
    assertEquals(Arrays.asList(StatementKind.LOOP, StatementKind.ASSIGNMENT,
        StatementKind.CONDITIONAL, StatementKind.CALL,
        StatementKind.ASSIGNMENT, StatementKind.WHILE_LOOP,
        StatementKind.LOOP, StatementKind.ASSIGNMENT), r.kinds);
    assertEquals(3, r.assignments);
  }

  @Test
  public void testTopLevelOnly() {
    KindRecorder r = new KindRecorder();
    IRWalk.walk(logger, program(), r, false);
    assertEquals(Arrays.asList(StatementKind.LOOP, StatementKind.ASSIGNMENT,
                               StatementKind.WHILE_LOOP), r.kinds);
  }

  @Test
  public void testLoopBodies() {
    KindRecorder r = new KindRecorder();
    IRWalk.walkLoopBodies(logger, program(), r);
    // Later top-level loops first, then each loop's direct children
    assertEquals(Arrays.asList(StatementKind.LOOP, StatementKind.ASSIGNMENT,
        StatementKind.ASSIGNMENT, StatementKind.CONDITIONAL), r.kinds);
  }

  @Test
  public void testFindNodes() {
    List<Statement> loops = FindNodes.find(program(), StatementKind.LOOP,
                                           StatementKind.WHILE_LOOP);
    assertEquals(3, loops.size());
    assertEquals("i", ((Loop)loops.get(0)).getVariable().getName());
    assertEquals(StatementKind.WHILE_LOOP, loops.get(1).kind());
    assertEquals("j", ((Loop)loops.get(2)).getVariable().getName());

    assertEquals(1, FindNodes.find(program(), StatementKind.CALL).size());
    assertEquals(0, FindNodes.find(program(), StatementKind.PRAGMA).size());
  }

  @Test
  public void testFindVariables() {
    ArrayRef ai = new ArrayRef("a", Arrays.<Expression>asList(var("i")));
    Statement body = new Assignment(ai,
        Operation.binary("+", var("b"), var("c")), false, null);
    List<Statement> prog = Arrays.<Statement>asList(
                              loop("i", Arrays.asList(body)));
    List<VariableRef> vars = FindExpressions.variables(prog);
    List<String> names = new ArrayList<String>();
    for (VariableRef v: vars) {
      names.add(v.stringify());
    }
    // Loop header first, then the assignment in source order
    assertEquals(Arrays.asList("i", "n", "i", "a(i)", "b", "c"), names);

    List<Expression> arrays = FindExpressions.find(prog,
                                  ExprRetriever.ofKind(ExprKind.ARRAY));
    assertEquals(Arrays.<Expression>asList(ai), arrays);
  }
}
