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
package exm.ftx.frontend.omni;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import exm.ftx.ast.SourceSpan;
import exm.ftx.ast.XmlParseNode;
import exm.ftx.common.exceptions.MalformedDeclarationException;
import exm.ftx.common.exceptions.UserException;
import exm.ftx.common.lang.Intrinsics;
import exm.ftx.expr.ExprStringifier;
import exm.ftx.frontend.Fragment;
import exm.ftx.frontend.Literals;
import exm.ftx.frontend.Lowering;
import exm.ftx.ir.Conditionals.Conditional;
import exm.ftx.ir.Conditionals.MaskedStatement;
import exm.ftx.ir.Conditionals.MultiConditional;
import exm.ftx.ir.DataType;
import exm.ftx.ir.Declarations.DataDeclaration;
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
import exm.ftx.ir.expr.Expression.ExprKind;
import exm.ftx.ir.expr.InlineCall;
import exm.ftx.ir.expr.IntLiteral;
import exm.ftx.ir.expr.LiteralList;
import exm.ftx.ir.expr.Operation;
import exm.ftx.ir.expr.RangeIndex;
import exm.ftx.ir.expr.ScalarRef;
import exm.ftx.ir.expr.StringConcat;
import exm.ftx.ir.expr.VariableRef;

/**
 * Lowering of XcodeML produced by the OMNI compiler front end.
 *
 * XcodeML is typed: variable references carry a type identifier that is
 * resolved through the program's type table, and function calls are
 * marked as such.  Positions are whole lines.
 */
public class OMNILowering extends Lowering<XmlParseNode> {

  private static final Pattern BLOCK_IF =
      Pattern.compile("\\)\\s*THEN\\b", Pattern.CASE_INSENSITIVE);

  private TypeTable types = null;

  public OMNILowering(String file, String rawSource) {
    super(file, rawSource);
  }

  /**
   * Use the given type table instead of the one found in the lowered tree
   */
  public void setTypeTable(TypeTable types) {
    this.types = types;
  }

  @Override
  public List<Statement> lowerProgram(XmlParseNode root)
                                      throws UserException {
    if (types == null) {
      types = TypeTable.build(root);
    }
    return super.lowerProgram(root);
  }

  private TypeTable types() {
    if (types == null) {
      // Lowering a fragment without its program
      types = new TypeTable();
    }
    return types;
  }

  @Override
  protected List<XmlParseNode> childrenOf(XmlParseNode node) {
    return node.children();
  }

  @Override
  protected List<Fragment> dispatch(XmlParseNode node, SourceSpan source)
                                                  throws UserException {
    OMNITag tag = OMNITag.fromTag(node.getTag());
    if (tag.isTransparent()) {
      return lowerChildren(node);
    }
    if (tag.isOperator()) {
      return single(Fragment.node(operation(tag, node, source)));
    }
    switch (tag) {
      case TYPE_TABLE:
      case GLOBAL_SYMBOLS:
      case SYMBOLS:
        return none();
      case FUNCTION_DEFINITION:
      case MODULE_DEFINITION:
        return programUnit(node, source);
      case DO_STATEMENT:
        return doLoop(node, source);
      case DO_WHILE_STATEMENT:
        return single(Fragment.node(new WhileLoop(
            expression(requireChild(node, "condition", source)),
            body(node.find("body")), source)));
      case IF_STATEMENT:
        return conditional(node, source);
      case SELECT_CASE_STATEMENT:
        return selectCase(node, source);
      case WHERE_STATEMENT:
        return single(Fragment.node(new MaskedStatement(
            expression(requireChild(node, "condition", source)),
            body(node.find("then/body")), body(node.find("else/body")),
            source)));
      case ASSIGN_STATEMENT:
        return assignment(node, source, false);
      case POINTER_ASSIGN_STATEMENT:
        return assignment(node, source, true);
      case EXPR_STATEMENT:
      case CALL_STATEMENT:
        return call(node, source);
      case ALLOCATE_STATEMENT:
        return single(Fragment.node(MemoryStatement.allocation(
                                          allocList(node), source)));
      case DEALLOCATE_STATEMENT:
        return single(Fragment.node(MemoryStatement.deallocation(
                                          allocList(node), source)));
      case NULLIFY_STATEMENT:
        return single(Fragment.node(MemoryStatement.nullify(
                                          allocList(node), source)));
      case PRAGMA_STATEMENT:
        return pragma(node, source);
      case COMMENT_LINE:
        return single(Fragment.node(Verbatim.comment(node.getText(),
                                                     source)));
      case CYCLE_STATEMENT:
        return passthrough(source, "CYCLE");
      case EXIT_STATEMENT:
        return passthrough(source, "EXIT");
      case RETURN_STATEMENT:
        return passthrough(source, "RETURN");
      case CONTINUE_STATEMENT:
        return passthrough(source, "CONTINUE");
      case VAR_DECL:
        return varDecl(node, source);
      case STRUCT_DECL:
        return structDecl(node, source);
      case USE_DECL:
      case USE_ONLY_DECL:
        return use(node, source);
      case DATA_DECL:
        return dataDecl(node, source);
      case VAR:
        return single(Fragment.node(var(node, source)));
      case ARRAY_REF:
        return single(Fragment.node(arrayRef(node, source)));
      case MEMBER_REF:
        return single(Fragment.node(memberRef(node, source)));
      case INT_CONSTANT:
        return single(Fragment.node(Literals.create(node.getText(),
            "int", node.getAttribute("kind"), source, node.getTag())));
      case REAL_CONSTANT:
        return single(Fragment.node(Literals.create(node.getText(),
            "real", node.getAttribute("kind"), source, node.getTag())));
      case CHARACTER_CONSTANT:
        return single(Fragment.node(Literals.create(
            "'" + node.getText().replace("'", "''") + "'", "character",
            null, source, node.getTag())));
      case LOGICAL_CONSTANT:
        return single(Fragment.node(Literals.create(node.getText(),
            "logical", null, source, node.getTag())));
      case FUNCTION_CALL:
        return single(Fragment.node(functionCall(node, source)));
      case ARRAY_CONSTRUCTOR:
        return single(Fragment.node(new LiteralList(
            expressions(lowerChildren(node), node, source), source)));
      case CONCAT_EXPR:
        return single(Fragment.node(concat(node, source)));
      case INDEX_RANGE:
        return single(Fragment.node(indexRange(node, source)));
      case UNKNOWN:
        return lowerUnknown(node, source);
      default:
        throw unsupported(node, source, "no lowering rule for tag " + tag);
    }
  }

  private XmlParseNode requireChild(XmlParseNode node, String path,
                             SourceSpan source) throws UserException {
    XmlParseNode child = node.find(path);
    if (child == null) {
      throw unsupported(node, source, "missing " + path);
    }
    return child;
  }

  private List<Fragment> passthrough(SourceSpan source, String keyword) {
    String text = source == null ? keyword : source.getText();
    return single(Fragment.node(Verbatim.intrinsic(text, source)));
  }

  private List<Fragment> programUnit(XmlParseNode node, SourceSpan source)
                                                     throws UserException {
    List<Fragment> body = new ArrayList<Fragment>();
    for (XmlParseNode child: node.children()) {
      if (child.getTag().equals("declarations") ||
          child.getTag().equals("body")) {
        body.addAll(lower(child));
      }
    }
    return single(Fragment.node(Scope.section(
                            statements(body, node, source), source)));
  }

  private List<Fragment> doLoop(XmlParseNode node, SourceSpan source)
                                              throws UserException {
    List<Statement> body = body(node.find("body"));
    XmlParseNode var = node.find("Var");
    if (var == null) {
      return single(Fragment.node(new WhileLoop(null, body, source)));
    }
    Expression bounds = indexRange(requireChild(node, "indexRange", source),
                                   source);
    return single(Fragment.node(new Loop(new ScalarRef(var.getText(), null,
        null, null, span(var, false)), (RangeIndex)bounds, body, source)));
  }

  private List<Fragment> conditional(XmlParseNode node, SourceSpan source)
                                                     throws UserException {
    List<Expression> conditions = new ArrayList<Expression>();
    conditions.add(expression(requireChild(node, "condition", source)));
    List<List<Statement>> bodies = new ArrayList<List<Statement>>();
    bodies.add(body(node.find("then/body")));
    List<Statement> elseBody = body(node.find("else/body"));
    boolean inline = source != null && node.find("else") == null &&
                     !BLOCK_IF.matcher(source.getText()).find();
    return single(Fragment.node(new Conditional(conditions, bodies,
                                        elseBody, inline, source)));
  }

  private List<Fragment> selectCase(XmlParseNode node, SourceSpan source)
                                                   throws UserException {
    Expression selector = expression(requireChild(node, "value", source));
    List<List<Expression>> values = new ArrayList<List<Expression>>();
    List<List<Statement>> bodies = new ArrayList<List<Statement>>();
    List<Statement> elseBody = new ArrayList<Statement>();
    for (XmlParseNode label: node.findAll("FcaseLabel")) {
      List<Expression> vals = new ArrayList<Expression>();
      for (XmlParseNode c: label.children()) {
        if (!c.getTag().equals("body")) {
          vals.add(expression(c));
        }
      }
      List<Statement> body = body(label.find("body"));
      if (vals.isEmpty()) {
        // CASE DEFAULT
        elseBody = body;
      } else {
        values.add(vals);
        bodies.add(body);
      }
    }
    return single(Fragment.node(new MultiConditional(selector, values,
                                         bodies, elseBody, source)));
  }

  private List<Fragment> assignment(XmlParseNode node, SourceSpan source,
                          boolean pointer) throws UserException {
    if (node.childCount() != 2) {
      throw unsupported(node, source, "assignment with " +
                        node.childCount() + " operands");
    }
    return single(Fragment.node(new Assignment(expression(node.child(0)),
                  expression(node.child(1)), pointer, source)));
  }

  private List<Fragment> call(XmlParseNode node, SourceSpan source)
                                            throws UserException {
    XmlParseNode fn = node.getTag().equals(OMNITag.FUNCTION_CALL.tag()) ?
                        node : requireChild(node, "functionCall", source);
    String name = requireChild(fn, "name", source).getText();
    List<Expression> args = new ArrayList<Expression>();
    Map<String, Expression> kwargs = new LinkedHashMap<String, Expression>();
    arguments(fn, args, kwargs, source);
    return single(Fragment.node(new Call(name, args, kwargs, source)));
  }

  private void arguments(XmlParseNode fn, List<Expression> args,
      Map<String, Expression> kwargs, SourceSpan source)
                                          throws UserException {
    XmlParseNode arguments = fn.find("arguments");
    if (arguments == null) {
      return;
    }
    for (XmlParseNode a: arguments.children()) {
      if (a.getTag().equals("namedValue")) {
        XmlParseNode value = a.childCount() == 1 ? a.child(0) : null;
        if (a.getAttribute("name") == null || value == null) {
          throw unsupported(a, source, "malformed keyword argument");
        }
        kwargs.put(a.getAttribute("name"), expression(value));
      } else {
        args.add(expression(a));
      }
    }
  }

  private List<Expression> allocList(XmlParseNode node)
                                     throws UserException {
    SourceSpan source = span(node, false);
    List<Expression> vars = new ArrayList<Expression>();
    for (XmlParseNode alloc: node.findAll("alloc")) {
      if (alloc.childCount() == 0) {
        throw unsupported(alloc, source, "empty allocation");
      }
      Expression base = expression(alloc.child(0));
      if (alloc.childCount() == 1) {
        vars.add(base);
        continue;
      }
      if (!(base instanceof VariableRef)) {
        throw unsupported(alloc, source, "cannot allocate " + base);
      }
      VariableRef ref = (VariableRef)base;
      List<Expression> dims = new ArrayList<Expression>();
      for (XmlParseNode d: alloc.children().subList(1, alloc.childCount())) {
        dims.add(expression(d));
      }
      vars.add(new ArrayRef(ref.getName(), dims, null, ref.getParent(),
                            null, null, source));
    }
    return vars;
  }

  private List<Fragment> pragma(XmlParseNode node, SourceSpan source)
                                            throws UserException {
    String text = node.getText();
    if (text.startsWith("!$")) {
      text = text.substring(2);
    } else if (text.startsWith("$")) {
      text = text.substring(1);
    }
    String[] parts = text.trim().split("\\s+", 2);
    if (parts[0].isEmpty()) {
      throw unsupported(node, source, "empty pragma");
    }
    return single(Fragment.node(new Pragma(parts[0],
                  parts.length > 1 ? parts[1] : "", source)));
  }

  /**
   * Declared type of a type identifier
   */
  private DataType dataType(XmlParseNode node, String typeId,
                    SourceSpan source) throws UserException {
    String name = types().typeName(typeId);
    if (name == null) {
      throw new MalformedDeclarationException(source,
          "cannot resolve type " + typeId + " of " + node.getText());
    }
    return new DataType(name, types().kind(typeId), types().intent(typeId),
        types().isStruct(typeId), types().attributes(typeId), source);
  }

  /**
   * Declared shape of a type identifier, or null for scalars
   */
  private List<Expression> shape(String typeId, SourceSpan source)
                                            throws UserException {
    if (typeId == null) {
      return null;
    }
    List<XmlParseNode> ranges = types().indexRanges(typeId);
    if (ranges.isEmpty()) {
      return null;
    }
    List<Expression> result = new ArrayList<Expression>(ranges.size());
    for (XmlParseNode r: ranges) {
      result.add(collapse(indexRange(r, source)));
    }
    return result;
  }

  /**
   * A dimension from 1 with unit step is its upper bound
   */
  private static Expression collapse(Expression dim) {
    if (dim instanceof RangeIndex) {
      RangeIndex r = (RangeIndex)dim;
      if (r.getUpper() != null && r.getStep() == null &&
          (r.getLower() == null || isOne(r.getLower()))) {
        return r.getUpper();
      }
    }
    return dim;
  }

  private static boolean isOne(Expression e) {
    return e.kind() == ExprKind.INT_LITERAL &&
           ((IntLiteral)e).getValue() == 1;
  }

  private List<Fragment> varDecl(XmlParseNode node, SourceSpan source)
                                             throws UserException {
    XmlParseNode name = node.find("name");
    if (name == null) {
      throw new MalformedDeclarationException(source,
                                  "variable declaration without name");
    }
    String typeId = name.getAttribute("type");
    DataType type = dataType(name, typeId, source);
    XmlParseNode value = node.find("value");
    Expression initial = value == null ? null : expression(value);
    List<Expression> shape = shape(typeId, source);
    VariableRef var;
    if (shape == null) {
      var = new ScalarRef(name.getText(), null, initial, null, source);
    } else {
      var = new ArrayRef(name.getText(), shape, shape, null, initial, null,
                         source);
    }
    var.setType(type);
    List<VariableRef> vars = new ArrayList<VariableRef>();
    vars.add(var);
    return single(Fragment.node(new Declaration(type, vars, null, source)));
  }

  private List<Fragment> structDecl(XmlParseNode node, SourceSpan source)
                                                throws UserException {
    XmlParseNode name = requireChild(node, "name", source);
    XmlParseNode struct = types().getStruct(name.getAttribute("type"));
    if (struct == null) {
      throw new MalformedDeclarationException(source,
          "no struct type for derived type " + name.getText());
    }
    List<Statement> components = new ArrayList<Statement>();
    for (XmlParseNode id: struct.findAll("symbols/id")) {
      XmlParseNode compName = requireChild(id, "name", source);
      String typeId = id.getAttribute("type");
      DataType type = dataType(compName, typeId, source);
      List<Expression> shape = shape(typeId, source);
      VariableRef var = shape == null ?
          new ScalarRef(compName.getText(), null, null, null, source) :
          new ArrayRef(compName.getText(), shape, shape, null, null, null,
                       source);
      var.setType(type);
      List<VariableRef> vars = new ArrayList<VariableRef>();
      vars.add(var);
      components.add(new Declaration(type, vars, null, source));
    }
    return single(Fragment.node(new TypeDef(name.getText(), components,
                                            source)));
  }

  private List<Fragment> use(XmlParseNode node, SourceSpan source)
                                       throws UserException {
    String module = node.getAttribute("name");
    if (module == null) {
      throw unsupported(node, source, "USE without module name");
    }
    List<String> symbols = new ArrayList<String>();
    for (XmlParseNode r: node.findAll("renamable")) {
      String use = r.getAttribute("use_name");
      String local = r.getAttribute("local_name");
      symbols.add(local == null ? use : local + " => " + use);
    }
    return single(Fragment.node(new Import(module, symbols, false, source)));
  }

  private List<Fragment> dataDecl(XmlParseNode node, SourceSpan source)
                                             throws UserException {
    List<Fragment> result = new ArrayList<Fragment>();
    List<XmlParseNode> varLists = node.findAll("varList");
    List<XmlParseNode> valueLists = node.findAll("valueList");
    if (varLists.size() != valueLists.size()) {
      throw unsupported(node, source, "unpaired DATA groups");
    }
    for (int i = 0; i < varLists.size(); i++) {
      XmlParseNode vars = varLists.get(i);
      if (vars.childCount() != 1) {
        throw unsupported(node, source,
            "DATA group with " + vars.childCount() + " variables");
      }
      List<Expression> values = new ArrayList<Expression>();
      for (XmlParseNode v: valueLists.get(i).children()) {
        values.add(expression(v));
      }
      result.add(Fragment.node(new DataDeclaration(
                        expression(vars.child(0)), values, source)));
    }
    return result;
  }

  /**
   * Whole-variable reference; arrays carry their declared shape
   */
  private Expression var(XmlParseNode node, SourceSpan source)
                                   throws UserException {
    List<Expression> shape = shape(node.getAttribute("type"), source);
    if (shape == null) {
      return new ScalarRef(node.getText(), null, null, null, source);
    }
    return new ArrayRef(node.getText(), null, shape, null, null, null, source);
  }

  private VariableRef varRef(XmlParseNode node, SourceSpan source)
                                        throws UserException {
    XmlParseNode ref = requireChild(node, "varRef", source);
    if (ref.childCount() != 1) {
      throw unsupported(node, source, "malformed variable reference");
    }
    Expression base = expression(ref.child(0));
    if (!(base instanceof VariableRef)) {
      throw unsupported(node, source, "not a variable: " + base);
    }
    return (VariableRef)base;
  }

  private Expression arrayRef(XmlParseNode node, SourceSpan source)
                                        throws UserException {
    VariableRef base = varRef(node, source);
    List<Expression> dims = new ArrayList<Expression>();
    for (XmlParseNode c: node.children()) {
      if (!c.getTag().equals("varRef")) {
        dims.add(expression(c));
      }
    }
    List<Expression> shape = base instanceof ArrayRef ?
                             ((ArrayRef)base).getShape() : null;
    return new ArrayRef(base.getName(), dims, shape, base.getParent(),
                        null, null, source);
  }

  private Expression memberRef(XmlParseNode node, SourceSpan source)
                                         throws UserException {
    VariableRef parent = varRef(node, source);
    String member = node.getAttribute("member");
    if (member == null) {
      throw unsupported(node, source, "member reference without member");
    }
    List<Expression> shape = shape(node.getAttribute("type"), source);
    if (shape == null) {
      return new ScalarRef(member, parent, null, null, source);
    }
    return new ArrayRef(member, null, shape, parent, null, null, source);
  }

  private Expression functionCall(XmlParseNode node, SourceSpan source)
                                              throws UserException {
    String name = requireChild(node, "name", source).getText();
    List<Expression> args = new ArrayList<Expression>();
    Map<String, Expression> kwargs = new LinkedHashMap<String, Expression>();
    arguments(node, args, kwargs, source);
    if (Intrinsics.lookupCast(name) != null && !args.isEmpty() &&
        args.size() <= 2) {
      Expression kind = kwargs.get("kind");
      if (kind == null && args.size() == 2) {
        kind = args.get(1);
      }
      if (kwargs.size() == (kwargs.containsKey("kind") ? 1 : 0)) {
        return new Cast(name.toUpperCase(), args.get(0),
            kind == null ? null : ExprStringifier.stringify(kind),
            source);
      }
    }
    return new InlineCall(name, args, kwargs, false, source);
  }

  private Expression concat(XmlParseNode node, SourceSpan source)
                                        throws UserException {
    List<Expression> parts = new ArrayList<Expression>();
    for (XmlParseNode c: node.children()) {
      Expression e = expression(c);
      if (e instanceof StringConcat) {
        parts.addAll(((StringConcat)e).getParts());
      } else {
        parts.add(e);
      }
    }
    return new StringConcat(parts, source);
  }

  private Expression indexRange(XmlParseNode node, SourceSpan source)
                                            throws UserException {
    if ("true".equals(node.getAttribute("is_assumed_shape")) ||
        "true".equals(node.getAttribute("is_assumed_size"))) {
      XmlParseNode lower = node.find("lowerBound");
      return new RangeIndex(optionalExpression(lower), null, null, source);
    }
    return new RangeIndex(optionalExpression(node.find("lowerBound")),
                          optionalExpression(node.find("upperBound")),
                          optionalExpression(node.find("step")), source);
  }

  private Expression operation(OMNITag tag, XmlParseNode node,
                     SourceSpan source) throws UserException {
    if (tag.isUnaryOperator()) {
      if (node.childCount() != 1) {
        throw unsupported(node, source, "unary operator with " +
                          node.childCount() + " operands");
      }
      return Operation.unary(tag.operator(), expression(node.child(0)),
                             source);
    }
    if (node.childCount() != 2) {
      throw unsupported(node, source, "binary operator with " +
                        node.childCount() + " operands");
    }
    return Operation.binary(tag.operator(), expression(node.child(0)),
                            expression(node.child(1)), source);
  }
}
