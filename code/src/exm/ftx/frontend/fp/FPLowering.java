/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.ftx.frontend.fp;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import exm.ftx.ast.SourcePosition;
import exm.ftx.ast.SourceSpan;
import exm.ftx.common.exceptions.MalformedDeclarationException;
import exm.ftx.common.exceptions.UserException;
import exm.ftx.common.lang.Intrinsics;
import exm.ftx.expr.ExprStringifier;
import exm.ftx.frontend.Fragment;
import exm.ftx.frontend.Fragment.Marker;
import exm.ftx.frontend.Literals;
import exm.ftx.frontend.Lowering;
import exm.ftx.ir.Conditionals.Conditional;
import exm.ftx.ir.Conditionals.MaskedStatement;
import exm.ftx.ir.Conditionals.MultiConditional;
import exm.ftx.ir.DataType;
import exm.ftx.ir.DataType.TypeAttr;
import exm.ftx.ir.Declarations.Declaration;
import exm.ftx.ir.Declarations.Import;
import exm.ftx.ir.Declarations.TypeDef;
import exm.ftx.ir.Loops.Loop;
import exm.ftx.ir.Loops.WhileLoop;
import exm.ftx.ir.Statement;
import exm.ftx.ir.Statements.Assignment;
import exm.ftx.ir.Statements.Call;
import exm.ftx.ir.Statements.MemoryStatement;
import exm.ftx.ir.Statements.Pragma;
import exm.ftx.ir.Statements.Scope;
import exm.ftx.ir.Statements.Verbatim;
import exm.ftx.ir.expr.ArrayRef;
import exm.ftx.ir.expr.Cast;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.InlineCall;
import exm.ftx.ir.expr.IntLiteral;
import exm.ftx.ir.expr.LiteralList;
import exm.ftx.ir.expr.Operation;
import exm.ftx.ir.expr.RangeIndex;
import exm.ftx.ir.expr.ScalarRef;
import exm.ftx.ir.expr.VariableRef;

/**
 * Lowering of fparser-style rule trees.
 *
 * Constructs arrive as flat child lists, delimited by their statements:
 * an IF construct is its IF THEN statement, the body, any ELSE IF and
 * ELSE statements each followed by their bodies, and the END IF.
 */
public class FPLowering extends Lowering<FPTree> {

  private static final Pattern PRAGMA =
      Pattern.compile("!\\$(\\w+)\\s+(.*)", Pattern.CASE_INSENSITIVE);

  public FPLowering(String file, String rawSource) {
    super(file, rawSource);
  }

  @Override
  protected List<FPTree> childrenOf(FPTree node) {
    return node.children();
  }

  @Override
  protected SourceSpan span(FPTree node, boolean fullLines) {
    if (!node.hasOffsets() || rawSource == null) {
      return null;
    }
    return span(SourcePosition.fromOffsets(rawSource,
                node.getStartOffset(), node.getStopOffset()), fullLines);
  }

  @Override
  protected List<Fragment> dispatch(FPTree node, SourceSpan source)
                                            throws UserException {
    FPRule rule = node.getRule();
    if (rule.isTransparent()) {
      return lowerChildren(node);
    }
    if (rule.isOperator()) {
      return single(Fragment.node(operation(node, source)));
    }
    if (rule.isPassthrough()) {
      return passthrough(node, source);
    }
    switch (rule) {
      case NONE:
      case PROGRAM_STMT:
      case MODULE_STMT:
      case SUBROUTINE_STMT:
      case FUNCTION_STMT:
      case CONTAINS_STMT:
      case END_PROGRAM_STMT:
      case END_MODULE_STMT:
      case END_SUBROUTINE_STMT:
      case END_FUNCTION_STMT:
        return none();
      case MAIN_PROGRAM:
      case MODULE:
      case SUBROUTINE_SUBPROGRAM:
      case FUNCTION_SUBPROGRAM:
        return single(Fragment.node(Scope.section(
                  statements(lowerChildren(node), node, source), source)));
      case BLOCK_NONLABEL_DO_CONSTRUCT:
        return doConstruct(node);
      case IF_CONSTRUCT:
        return ifConstruct(node, source);
      case IF_STMT:
        return ifStatement(node, source);
      case CASE_CONSTRUCT:
        return caseConstruct(node, source);
      case WHERE_CONSTRUCT:
        return maskedStatements(lowerChildren(node), node, source);
      case WHERE_CONSTRUCT_STMT:
        return single(Fragment.node(onlyChild(node, source)));
      case ELSEWHERE_STMT:
        return single(Fragment.marker(Marker.ELSEWHERE));
      case END_WHERE_STMT:
        return single(Fragment.marker(Marker.ENDWHERE));
      case WHERE_STMT:
        return whereStatement(node, source);
      case ASSIGNMENT_STMT:
        return assignment(node, source, false);
      case POINTER_ASSIGNMENT_STMT:
        return assignment(node, source, true);
      case CALL_STMT:
        return call(node, source);
      case ACTUAL_ARG_SPEC_LIST:
        return lowerChildren(node);
      case ACTUAL_ARG_SPEC:
        return single(Fragment.keyword(text(node, source),
                                       onlyChild(node, source)));
      case ALLOCATE_STMT:
        return single(Fragment.node(MemoryStatement.allocation(
            expressions(lowerChildren(node), node, source), source)));
      case DEALLOCATE_STMT:
        return single(Fragment.node(MemoryStatement.deallocation(
            expressions(lowerChildren(node), node, source), source)));
      case NULLIFY_STMT:
        return single(Fragment.node(MemoryStatement.nullify(
            expressions(lowerChildren(node), node, source), source)));
      case COMMENT:
        return comment(node, source);
      case TYPE_DECLARATION_STMT:
      case DATA_COMPONENT_DEF_STMT:
        return single(Fragment.node(declaration(node, source)));
      case DERIVED_TYPE_DEF:
        return derivedType(node, source);
      case USE_STMT:
        return use(node, source);
      case NAME:
        return single(Fragment.node(nameChain(
            single(Fragment.name(text(node, source), source)), node, source)));
      case PART_REF:
      case DATA_REF:
        return single(Fragment.node(nameChain(nameParts(node, source),
                                              node, source)));
      case SECTION_SUBSCRIPT_LIST:
        return lowerChildren(node);
      case SUBSCRIPT_TRIPLET:
        return single(Fragment.node(triplet(node, source)));
      case INT_LITERAL_CONSTANT:
        return literal(node, "int", source);
      case REAL_LITERAL_CONSTANT:
        return literal(node, "real", source);
      case LOGICAL_LITERAL_CONSTANT:
        return literal(node, "logical", source);
      case CHAR_LITERAL_CONSTANT:
        return literal(node, "character", source);
      case INTRINSIC_FUNCTION_REFERENCE:
        return single(Fragment.node(intrinsicCall(node, source)));
      case ARRAY_CONSTRUCTOR:
        return single(Fragment.node(new LiteralList(
            expressions(lowerChildren(node), node, source), source)));
      case PARENTHESIS:
        return single(Fragment.node(parenthesis(node, source)));
      case UNKNOWN:
        return lowerUnknown(node, source);
      default:
        throw unsupported(node, source, "no lowering rule for rule " +
                          rule.tag());
    }
  }

  private String text(FPTree node, SourceSpan source)
                                  throws UserException {
    if (node.getText() == null) {
      throw unsupported(node, source, "missing text");
    }
    return node.getText();
  }

  private Expression onlyChild(FPTree node, SourceSpan source)
                                         throws UserException {
    if (node.childCount() != 1) {
      throw unsupported(node, source, "expected one operand, found " +
                        node.childCount());
    }
    return expression(node.child(0));
  }

  /**
   * @return expression of an optional positional child, or null if the
   *        child is a {@link FPRule#NONE} placeholder
   */
  private Expression optionalChild(FPTree node, int i)
                                   throws UserException {
    if (i >= node.childCount() || node.child(i).getRule() == FPRule.NONE) {
      return null;
    }
    return expression(node.child(i));
  }

  private List<Fragment> passthrough(FPTree node, SourceSpan source)
                                            throws UserException {
    String text = source != null ? source.getText() : text(node, source);
    return single(Fragment.node(Verbatim.intrinsic(text, source)));
  }

  /**
   * Body statements of a construct between two child positions
   */
  private List<Statement> block(FPTree node, int from, int to)
                                throws UserException {
    List<Fragment> frags = new ArrayList<Fragment>();
    for (FPTree c: node.children().subList(from, to)) {
      frags.addAll(lower(c));
    }
    return statements(frags, node, span(node, false));
  }

  private int indexOf(FPTree node, FPRule rule, int from) {
    for (int i = from; i < node.childCount(); i++) {
      if (node.child(i).getRule() == rule) {
        return i;
      }
    }
    return -1;
  }

  private int endOf(FPTree node, FPRule end) {
    int i = indexOf(node, end, 0);
    return i < 0 ? node.childCount() : i;
  }

  private List<Fragment> doConstruct(FPTree node) throws UserException {
    // Whole lines, so that loops can be replaced textually
    SourceSpan source = span(node, true);
    int header = indexOf(node, FPRule.NONLABEL_DO_STMT, 0);
    if (header < 0) {
      throw unsupported(node, source, "do construct without DO statement");
    }
    List<Statement> body = block(node, header + 1,
                                 endOf(node, FPRule.END_DO_STMT));
    FPTree doStmt = node.child(header);
    int control = indexOf(doStmt, FPRule.LOOP_CONTROL, 0);
    if (control < 0) {
      return single(Fragment.node(new WhileLoop(null, body, source)));
    }
    FPTree loopControl = doStmt.child(control);
    if ("WHILE".equalsIgnoreCase(loopControl.getText())) {
      return single(Fragment.node(new WhileLoop(
                    onlyChild(loopControl, source), body, source)));
    }
    if (loopControl.childCount() < 3) {
      throw unsupported(loopControl, source, "loop control with " +
                        loopControl.childCount() + " parts");
    }
    FPTree var = loopControl.child(0);
    RangeIndex bounds = new RangeIndex(expression(loopControl.child(1)),
        expression(loopControl.child(2)), optionalChild(loopControl, 3),
        null);
    return single(Fragment.node(new Loop(new ScalarRef(text(var, source),
           null, null, null, span(var, false)), bounds, body, source)));
  }

  private List<Fragment> ifConstruct(FPTree node, SourceSpan source)
                                            throws UserException {
    List<Expression> conditions = new ArrayList<Expression>();
    List<List<Statement>> bodies = new ArrayList<List<Statement>>();
    List<Statement> elseBody = new ArrayList<Statement>();
    int end = endOf(node, FPRule.END_IF_STMT);
    int pos = indexOf(node, FPRule.IF_THEN_STMT, 0);
    if (pos < 0) {
      throw unsupported(node, source, "if construct without IF statement");
    }
    while (pos >= 0 && pos < end) {
      FPTree clause = node.child(pos);
      int next = pos + 1;
      while (next < end && node.child(next).getRule() != FPRule.ELSE_IF_STMT
             && node.child(next).getRule() != FPRule.ELSE_STMT) {
        next++;
      }
      List<Statement> body = block(node, pos + 1, next);
      if (clause.getRule() == FPRule.ELSE_STMT) {
        elseBody = body;
      } else {
        conditions.add(onlyChild(clause, source));
        bodies.add(body);
      }
      pos = next < end ? next : -1;
    }
    return single(Fragment.node(new Conditional(conditions, bodies,
                                        elseBody, false, source)));
  }

  private List<Fragment> ifStatement(FPTree node, SourceSpan source)
                                            throws UserException {
    if (node.childCount() != 2) {
      throw unsupported(node, source, "IF statement with " +
                        node.childCount() + " parts");
    }
    List<Expression> conditions = new ArrayList<Expression>();
    conditions.add(expression(node.child(0)));
    List<List<Statement>> bodies = new ArrayList<List<Statement>>();
    bodies.add(block(node, 1, 2));
    return single(Fragment.node(new Conditional(conditions, bodies,
                          new ArrayList<Statement>(), true, source)));
  }

  private List<Fragment> caseConstruct(FPTree node, SourceSpan source)
                                              throws UserException {
    int header = indexOf(node, FPRule.SELECT_CASE_STMT, 0);
    if (header < 0) {
      throw unsupported(node, source, "case construct without SELECT CASE");
    }
    Expression selector = onlyChild(node.child(header), source);
    List<List<Expression>> values = new ArrayList<List<Expression>>();
    List<List<Statement>> bodies = new ArrayList<List<Statement>>();
    List<Statement> elseBody = new ArrayList<Statement>();
    int end = endOf(node, FPRule.END_SELECT_STMT);
    int pos = indexOf(node, FPRule.CASE_STMT, header + 1);
    while (pos >= 0 && pos < end) {
      int next = indexOf(node, FPRule.CASE_STMT, pos + 1);
      int bodyEnd = next < 0 || next > end ? end : next;
      List<Statement> body = block(node, pos + 1, bodyEnd);
      FPTree caseStmt = node.child(pos);
      if (caseStmt.childCount() == 0) {
        // CASE DEFAULT
        elseBody = body;
      } else {
        values.add(expressions(lowerChildren(caseStmt), caseStmt, source));
        bodies.add(body);
      }
      pos = next;
    }
    return single(Fragment.node(new MultiConditional(selector, values,
                                         bodies, elseBody, source)));
  }

  private List<Fragment> whereStatement(FPTree node, SourceSpan source)
                                              throws UserException {
    if (node.childCount() != 2) {
      throw unsupported(node, source, "WHERE statement with " +
                        node.childCount() + " parts");
    }
    return single(Fragment.node(new MaskedStatement(
        expression(node.child(0)), block(node, 1, 2),
        new ArrayList<Statement>(), source)));
  }

  private List<Fragment> assignment(FPTree node, SourceSpan source,
                         boolean pointer) throws UserException {
    if (node.childCount() != 2) {
      throw unsupported(node, source, "assignment with " +
                        node.childCount() + " operands");
    }
    return single(Fragment.node(new Assignment(expression(node.child(0)),
                  expression(node.child(1)), pointer, source)));
  }

  private List<Fragment> call(FPTree node, SourceSpan source)
                                     throws UserException {
    if (node.childCount() == 0 || node.child(0).getRule() != FPRule.NAME) {
      throw unsupported(node, source, "CALL without routine name");
    }
    List<Expression> args = new ArrayList<Expression>();
    Map<String, Expression> kwargs = new LinkedHashMap<String, Expression>();
    List<Fragment> frags = new ArrayList<Fragment>();
    for (FPTree c: node.children(1)) {
      frags.addAll(lower(c));
    }
    splitArguments(frags, args, kwargs);
    return single(Fragment.node(new Call(text(node.child(0), source), args,
                                         kwargs, source)));
  }

  private List<Fragment> comment(FPTree node, SourceSpan source)
                                         throws UserException {
    String text = text(node, source);
    Matcher m = PRAGMA.matcher(text);
    if (m.find()) {
      return single(Fragment.node(new Pragma(m.group(1), m.group(2).trim(),
                                             source)));
    }
    return single(Fragment.node(Verbatim.comment(text, source)));
  }

  private Declaration declaration(FPTree node, SourceSpan source)
                                          throws UserException {
    FPTree typeSpec = null;
    Set<TypeAttr> attrs = EnumSet.noneOf(TypeAttr.class);
    String intent = null;
    List<Expression> sharedDims = null;
    List<FPTree> entities = new ArrayList<FPTree>();
    for (FPTree c: node.children()) {
      switch (c.getRule()) {
        case INTRINSIC_TYPE_SPEC:
        case DECLARATION_TYPE_SPEC:
          typeSpec = c;
          break;
        case ATTR_SPEC_LIST:
          for (FPTree a: c.children()) {
            if (a.getRule() == FPRule.INTENT_ATTR_SPEC) {
              intent = text(a, source).toLowerCase();
            } else if (a.getRule() == FPRule.DIMENSION_ATTR_SPEC) {
              sharedDims = shapeSpecs(a, source);
            } else {
              TypeAttr attr = TypeAttr.fromKeyword(text(a, source));
              if (attr == null) {
                throw new MalformedDeclarationException(source,
                            "unknown attribute " + a.getText());
              }
              attrs.add(attr);
            }
          }
          break;
        case ENTITY_DECL_LIST:
          entities.addAll(c.children());
          break;
        default:
          throw unsupported(c, source, "unexpected " + c.getTag() +
                            " in declaration");
      }
    }
    if (typeSpec == null) {
      throw new MalformedDeclarationException(source,
                                          "declaration without a type");
    }
    String kind = null;
    if (typeSpec.childCount() > 0 &&
        typeSpec.child(0).getRule() == FPRule.KIND_SELECTOR) {
      kind = ExprStringifier.stringify(
                        onlyChild(typeSpec.child(0), source));
    }
    boolean derived = typeSpec.getRule() == FPRule.DECLARATION_TYPE_SPEC;
    DataType type = new DataType(text(typeSpec, source), kind, intent,
                                 derived, attrs, source);

    List<VariableRef> vars = new ArrayList<VariableRef>();
    for (FPTree e: entities) {
      SourceSpan eSource = span(e, false);
      List<Expression> dims = shapeSpecs(e, eSource);
      if (dims == null) {
        dims = sharedDims;
      }
      Expression initial = null;
      int init = indexOf(e, FPRule.INITIALIZATION, 0);
      if (init >= 0) {
        initial = onlyChild(e.child(init), eSource);
      }
      String name = text(e, eSource);
      VariableRef var = dims == null ?
          new ScalarRef(name, null, initial, null, eSource) :
          new ArrayRef(name, dims, dims, null, initial, null, eSource);
      var.setType(type);
      vars.add(var);
    }
    return new Declaration(type, vars, null, source);
  }

  /**
   * Array spec among the children of a node; a dimension from 1 is its
   * upper bound
   * @return the dimensions, or null if there are none
   */
  private List<Expression> shapeSpecs(FPTree node, SourceSpan source)
                                           throws UserException {
    List<Expression> dims = new ArrayList<Expression>();
    for (FPTree s: node.children()) {
      switch (s.getRule()) {
        case EXPLICIT_SHAPE_SPEC: {
          if (s.childCount() == 1) {
            dims.add(expression(s.child(0)));
          } else if (s.childCount() == 2) {
            Expression lower = optionalChild(s, 0);
            Expression upper = expression(s.child(1));
            if (lower == null || isOne(lower)) {
              dims.add(upper);
            } else {
              dims.add(new RangeIndex(lower, upper, null, span(s, false)));
            }
          } else {
            throw new MalformedDeclarationException(source,
                "shape spec with " + s.childCount() + " bounds");
          }
          break;
        }
        case ASSUMED_SHAPE_SPEC:
        case DEFERRED_SHAPE_SPEC:
          dims.add(new RangeIndex(optionalChild(s, 0), null, null,
                                  span(s, false)));
          break;
        default:
          break;
      }
    }
    return dims.isEmpty() ? null : dims;
  }

  private static boolean isOne(Expression e) {
    return e instanceof IntLiteral && ((IntLiteral)e).getValue() == 1;
  }

  private List<Fragment> derivedType(FPTree node, SourceSpan source)
                                            throws UserException {
    int header = indexOf(node, FPRule.DERIVED_TYPE_STMT, 0);
    if (header < 0) {
      throw new MalformedDeclarationException(source,
                                      "derived type without a name");
    }
    String name = text(node.child(header), source);
    List<Statement> body = block(node, header + 1,
                                 endOf(node, FPRule.END_TYPE_STMT));
    return single(Fragment.node(new TypeDef(name, body, source)));
  }

  private List<Fragment> use(FPTree node, SourceSpan source)
                                    throws UserException {
    List<String> symbols = new ArrayList<String>();
    int only = indexOf(node, FPRule.ONLY_LIST, 0);
    if (only >= 0) {
      for (FPTree n: node.child(only).children()) {
        symbols.add(text(n, source));
      }
    }
    return single(Fragment.node(new Import(text(node, source), symbols,
                                           false, source)));
  }

  /**
   * Name and subscript fragments of a data reference, outermost first.
   * A part reference contributes its subscripts ahead of its name.
   */
  private List<Fragment> nameParts(FPTree node, SourceSpan source)
                                          throws UserException {
    List<Fragment> parts = new ArrayList<Fragment>();
    if (node.getRule() == FPRule.DATA_REF) {
      for (FPTree c: node.children()) {
        parts.addAll(nameParts(c, span(c, false)));
      }
      return parts;
    }
    if (node.getRule() != FPRule.PART_REF && node.getRule() != FPRule.NAME) {
      throw unsupported(node, source, "unexpected " + node.getTag() +
                        " in data reference");
    }
    int subscripts = indexOf(node, FPRule.SECTION_SUBSCRIPT_LIST, 0);
    if (subscripts >= 0) {
      List<Expression> args = new ArrayList<Expression>();
      Map<String, Expression> kwargs = new LinkedHashMap<String, Expression>();
      splitArguments(lower(node.child(subscripts)), args, kwargs);
      parts.add(Fragment.indices(args, kwargs, source));
    }
    parts.add(Fragment.name(text(node, source), source));
    return parts;
  }

  private Expression triplet(FPTree node, SourceSpan source)
                                    throws UserException {
    if (node.childCount() > 3) {
      throw unsupported(node, source, "subscript triplet with " +
                        node.childCount() + " parts");
    }
    return new RangeIndex(optionalChild(node, 0), optionalChild(node, 1),
                          optionalChild(node, 2), source);
  }

  private List<Fragment> literal(FPTree node, String type,
                   SourceSpan source) throws UserException {
    return single(Fragment.node(Literals.create(text(node, source), type,
                                        null, source, node.getTag())));
  }

  /**
   * Reference to an intrinsic procedure the parser recognised by name
   */
  private Expression intrinsicCall(FPTree node, SourceSpan source)
                                           throws UserException {
    String name = text(node, source);
    List<Expression> args = new ArrayList<Expression>();
    Map<String, Expression> kwargs = new LinkedHashMap<String, Expression>();
    splitArguments(lowerChildren(node), args, kwargs);
    if (Intrinsics.lookupCast(name) != null && args.size() >= 1 &&
        args.size() <= 2) {
      Expression kind = kwargs.remove("kind");
      if (kind == null && args.size() == 2) {
        kind = args.get(1);
      }
      if (kwargs.isEmpty()) {
        return new Cast(name.toUpperCase(), args.get(0), kind == null ?
                    null : ExprStringifier.stringify(kind), source);
      }
      if (kind != null) {
        kwargs.put("kind", kind);
      }
    }
    return new InlineCall(name, args, kwargs, false, source);
  }

  private Expression parenthesis(FPTree node, SourceSpan source)
                                         throws UserException {
    Expression inner = onlyChild(node, source);
    if (inner instanceof Operation) {
      return ((Operation)inner).parenthesize();
    }
    return inner;
  }

  private Expression operation(FPTree node, SourceSpan source)
                                       throws UserException {
    String op = text(node, source);
    if (node.childCount() == 1) {
      return Operation.unary(op, expression(node.child(0)));
    } else if (node.childCount() == 2) {
      return Operation.binary(op, expression(node.child(0)),
                              expression(node.child(1)));
    }
    throw unsupported(node, source, "operator " + op + " with " +
                      node.childCount() + " operands");
  }
}
