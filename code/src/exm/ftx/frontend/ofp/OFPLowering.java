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
package exm.ftx.frontend.ofp;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import exm.ftx.ast.SourceSpan;
import exm.ftx.ast.XmlParseNode;
import exm.ftx.common.exceptions.MalformedDeclarationException;
import exm.ftx.common.exceptions.UserException;
import exm.ftx.frontend.Fragment;
import exm.ftx.frontend.Fragment.Marker;
import exm.ftx.frontend.Literals;
import exm.ftx.frontend.Lowering;
import exm.ftx.ir.Conditionals.Conditional;
import exm.ftx.ir.Conditionals.MultiConditional;
import exm.ftx.ir.DataType;
import exm.ftx.ir.DataType.TypeAttr;
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
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.Expression.ExprKind;
import exm.ftx.ir.expr.IntLiteral;
import exm.ftx.ir.expr.LiteralList;
import exm.ftx.ir.expr.Operation;
import exm.ftx.ir.expr.RangeIndex;
import exm.ftx.ir.expr.ScalarRef;
import exm.ftx.ir.expr.VariableRef;

/**
 * Lowering of the XML parse trees produced by the Open Fortran Parser.
 */
public class OFPLowering extends Lowering<XmlParseNode> {

  private static final Pattern PRAGMA =
      Pattern.compile("!\\$(\\w+)\\s+(.*)", Pattern.CASE_INSENSITIVE);

  private static final Pattern INCLUDE =
      Pattern.compile("#include\\s['\"](.*)['\"]");

  public OFPLowering(String file, String rawSource) {
    super(file, rawSource);
  }

  @Override
  protected List<XmlParseNode> childrenOf(XmlParseNode node) {
    return node.children();
  }

  @Override
  protected List<Fragment> dispatch(XmlParseNode node, SourceSpan source)
                                                  throws UserException {
    OFPTag tag = OFPTag.fromTag(node.getTag());
    if (tag.isTransparent()) {
      return lowerChildren(node);
    }
    switch (tag) {
      case PROGRAM:
      case MODULE:
      case SUBROUTINE:
      case FUNCTION:
        return programUnit(node, source);
      case LOOP:
        return loop(node);
      case IF:
        return conditional(node, source);
      case SELECT:
        return select(node, source);
      case COMMENT:
        return comment(node, source);
      case STATEMENT:
        return statement(node, source);
      case ELSEWHERE_STMT:
        return single(Fragment.marker(Marker.ELSEWHERE));
      case END_WHERE_STMT:
        return single(Fragment.marker(Marker.ENDWHERE));
      case CYCLE:
      case EXIT:
      case OPEN:
      case CLOSE:
      case READ:
      case WRITE:
      case FORMAT:
        return passthrough(node, source);
      case ASSIGNMENT:
        return assignment(node, source, false);
      case POINTER_ASSIGNMENT:
        return assignment(node, source, true);
      case SPECIFICATION:
        return single(Fragment.node(Scope.section(
                  statements(lowerChildren(node), node, source), source)));
      case DECLARATION:
        return declaration(node, source);
      case ASSOCIATE:
        return associate(node, source);
      case ALLOCATE:
        return memory(node, source, true);
      case DEALLOCATE:
        return memory(node, source, false);
      case USE:
        return use(node, source);
      case DIRECTIVE:
        return directive(node, source);
      case CALL:
        return call(node, source);
      case ARGUMENT:
        return argument(node, source);
      case NAME:
        return name(node, source);
      case VARIABLE:
        return variable(node, source);
      case PART_REF:
        return single(Fragment.name(requireAttr(node, "id", source), source));
      case LITERAL:
        return literal(node, source);
      case SUBSCRIPTS:
        return subscripts(node, source);
      case SUBSCRIPT:
      case DIMENSION:
        return subscript(node, source);
      case RANGE:
        return range(node, source);
      case ARRAY_CONSTRUCTOR_VALUES:
        return arrayConstructor(node, source);
      case OPERATION:
        return operation(node, source);
      case UNKNOWN:
        return lowerUnknown(node, source);
      default:
        throw unsupported(node, source, "no lowering rule for tag " + tag);
    }
  }

  private String requireAttr(XmlParseNode node, String key,
                   SourceSpan source) throws UserException {
    String val = node.getAttribute(key);
    if (val == null) {
      throw unsupported(node, source, "missing attribute " + key);
    }
    return val;
  }

  private String sourceText(XmlParseNode node, SourceSpan source)
                                             throws UserException {
    if (source == null) {
      throw unsupported(node, source, "no source position to copy text from");
    }
    return source.getText();
  }

  private List<Fragment> passthrough(XmlParseNode node, SourceSpan source)
                                                   throws UserException {
    return single(Fragment.node(Verbatim.intrinsic(sourceText(node, source),
                                                   source)));
  }

  /**
   * Routine or module: its specification and executable parts, without
   * the header and end statements
   */
  private List<Fragment> programUnit(XmlParseNode node, SourceSpan source)
                                                     throws UserException {
    List<Fragment> body = new ArrayList<Fragment>();
    for (XmlParseNode child: node.children()) {
      if (!child.getTag().equals(OFPTag.HEADER.tag())) {
        body.addAll(lower(child));
      }
    }
    return single(Fragment.node(Scope.section(
                            statements(body, node, source), source)));
  }

  private List<Fragment> loop(XmlParseNode node) throws UserException {
    // Whole lines, so that loops can be replaced textually
    SourceSpan source = span(node, true);
    List<Statement> body = body(node.find("body"));
    XmlParseNode var = node.find("header/index-variable");
    if (var == null) {
      XmlParseNode header = node.find("header");
      Expression condition = null;
      if (header != null) {
        List<Fragment> h = lower(header);
        if (h.size() > 1) {
          throw unsupported(node, source, "loop header " + h);
        }
        condition = h.isEmpty() ? null : expressions(h, node, source).get(0);
      }
      return single(Fragment.node(new WhileLoop(condition, body, source)));
    }
    String name = requireAttr(var, "name", source);
    Expression lower = expression(requireChild(var, "lower-bound", source));
    Expression upper = expression(requireChild(var, "upper-bound", source));
    Expression step = optionalExpression(var.find("step"));
    RangeIndex bounds = new RangeIndex(lower, upper, step, null);
    return single(Fragment.node(new Loop(new ScalarRef(name, null, null,
                           null, span(var, false)), bounds, body, source)));
  }

  private XmlParseNode requireChild(XmlParseNode node, String path,
                             SourceSpan source) throws UserException {
    XmlParseNode child = node.find(path);
    if (child == null) {
      throw unsupported(node, source, "missing " + path);
    }
    return child;
  }

  private List<Fragment> conditional(XmlParseNode node, SourceSpan source)
                                                     throws UserException {
    List<Expression> conditions = new ArrayList<Expression>();
    for (XmlParseNode h: node.findAll("header")) {
      conditions.add(expression(h));
    }
    List<List<Statement>> bodies = new ArrayList<List<Statement>>();
    for (XmlParseNode b: node.findAll("body")) {
      bodies.add(body(b));
    }
    int ncond = conditions.size();
    if (bodies.size() < ncond || bodies.size() > ncond + 1) {
      throw unsupported(node, source, ncond + " conditions with " +
                        bodies.size() + " bodies");
    }
    List<Statement> elseBody = bodies.size() > ncond ? bodies.get(ncond) :
                                                 new ArrayList<Statement>();
    boolean inline = node.find("if-then-stmt") == null;
    return single(Fragment.node(new Conditional(conditions,
            bodies.subList(0, ncond), elseBody, inline, source)));
  }

  private List<Fragment> select(XmlParseNode node, SourceSpan source)
                                                 throws UserException {
    Expression selector = expression(requireChild(node, "header", source));
    List<List<Expression>> values = new ArrayList<List<Expression>>();
    List<List<Statement>> bodies = new ArrayList<List<Statement>>();
    List<Statement> elseBody = new ArrayList<Statement>();
    for (XmlParseNode c: node.findAll("body/case")) {
      XmlParseNode header = c.find("header");
      List<Fragment> vals = header == null ? none() : lower(header);
      List<Statement> body = body(c.find("body"));
      if (vals.isEmpty()) {
        // CASE DEFAULT
        elseBody = body;
      } else {
        values.add(expressions(vals, c, source));
        bodies.add(body);
      }
    }
    return single(Fragment.node(new MultiConditional(selector, values,
                                         bodies, elseBody, source)));
  }

  private List<Fragment> comment(XmlParseNode node, SourceSpan source) {
    String text = node.getAttribute("text");
    String raw = source != null ? source.getText() : text;
    if (raw != null) {
      Matcher m = PRAGMA.matcher(raw);
      if (m.find()) {
        return single(Fragment.node(new Pragma(m.group(1),
                                    m.group(2).trim(), source)));
      }
    }
    return single(Fragment.node(Verbatim.comment(text == null ? raw : text,
                                                 source)));
  }

  private List<Fragment> statement(XmlParseNode node, SourceSpan source)
                                                   throws UserException {
    if (node.find("name/nullify-stmt") != null) {
      List<Expression> vars = new ArrayList<Expression>();
      for (XmlParseNode n: node.findAll("name")) {
        vars.add(expression(n));
      }
      return single(Fragment.node(MemoryStatement.nullify(vars, source)));
    } else if (node.find("cycle") != null) {
      return lower(node.find("cycle"));
    } else if (node.find("where-construct-stmt") != null) {
      return maskedStatements(lowerChildren(node), node, source);
    }
    return lowerChildren(node);
  }

  private List<Fragment> assignment(XmlParseNode node, SourceSpan source,
                          boolean pointer) throws UserException {
    Expression target = expression(requireChild(node, "target", source));
    Expression value = expression(requireChild(node, "value", source));
    return single(Fragment.node(new Assignment(target, value, pointer,
                                               source)));
  }

  private List<Fragment> declaration(XmlParseNode node, SourceSpan source)
                                                     throws UserException {
    if (node.getAttributes().isEmpty()) {
      return none();
    } else if (node.find("save-stmt") != null ||
               node.find("implicit-stmt") != null ||
               node.find("access-spec") != null) {
      return passthrough(node, source);
    }
    String type = node.getAttribute("type");
    if (type == null) {
      throw new MalformedDeclarationException(source,
                                      "declaration without a type");
    }
    if (type.equals("variable")) {
      if (node.find("end-type-stmt") != null) {
        return single(Fragment.node(derivedType(node, source)));
      }
      return single(Fragment.node(variableDeclaration(node, source)));
    } else if (type.equals("implicit") || type.equals("intrinsic")) {
      return passthrough(node, source);
    } else if (type.equals("data")) {
      return dataDeclaration(node, source);
    }
    throw unsupported(node, source, "declaration of type " + type);
  }

  private DataType typeOf(XmlParseNode type, String intent,
          Set<TypeAttr> attrs, SourceSpan source) throws UserException {
    String typeName = type.getAttribute("name");
    if (typeName == null) {
      throw new MalformedDeclarationException(source,
                                        "type specification without name");
    }
    String kind = null;
    if (type.find("kind") != null) {
      XmlParseNode kindName = type.find("kind/name");
      if (kindName == null || kindName.getAttribute("id") == null) {
        throw new MalformedDeclarationException(source,
                              "unresolvable kind of type " + typeName);
      }
      kind = kindName.getAttribute("id");
    }
    boolean derived = "derived".equals(type.getAttribute("type"));
    return new DataType(typeName, kind, intent, derived, attrs, source);
  }

  private TypeDef derivedType(XmlParseNode node, SourceSpan source)
                                           throws UserException {
    String name = node.find("end-type-stmt").getAttribute("id");
    if (name == null) {
      throw new MalformedDeclarationException(source,
                                      "derived type without a name");
    }
    List<XmlParseNode> elements = node.children();
    List<XmlParseNode> types = node.findAll("type");
    List<XmlParseNode> components = node.findAll("components");
    if (types.size() != components.size()) {
      throw new MalformedDeclarationException(source, "derived type " +
          name + " has " + types.size() + " type specs for " +
          components.size() + " component lists");
    }
    List<Statement> body = new ArrayList<Statement>();
    int pair = 0;
    for (XmlParseNode e: elements) {
      if (e.getTag().equals(OFPTag.COMMENT.tag())) {
        body.addAll(statements(lower(e), e, source));
      } else if (e.getTag().equals("components")) {
        XmlParseNode t = types.get(pair++);
        body.add(componentDeclaration(node, t, e));
      }
    }
    return new TypeDef(name, body, source);
  }

  /**
   * Declaration of the components following one type spec in a derived
   * type.  Attributes are the elements between type and components.
   */
  private Declaration componentDeclaration(XmlParseNode typeDef,
          XmlParseNode type, XmlParseNode components) throws UserException {
    SourceSpan tSource = span(type, false);
    Set<TypeAttr> attrs = EnumSet.noneOf(TypeAttr.class);
    int begin = typeDef.indexOf(type) + 1;
    int end = typeDef.indexOf(components);
    if (end > begin) {
      XmlParseNode attrNode = typeDef.child(begin);
      for (XmlParseNode a: attrNode.findAll("attribute/component-attr-spec")) {
        String keyword = a.getAttribute("attrKeyword");
        if (keyword == null) {
          continue;
        }
        TypeAttr attr = TypeAttr.fromKeyword(keyword);
        if (attr != null) {
          attrs.add(attr);
        }
      }
    }
    DataType dataType = typeOf(type, null, attrs, tSource);

    List<VariableRef> vars = new ArrayList<VariableRef>();
    for (XmlParseNode v: components.findAll("component")) {
      if (v.getAttributes().isEmpty()) {
        continue;
      }
      SourceSpan vSource = span(v, false);
      List<Expression> dims;
      XmlParseNode deferred = v.find("deferred-shape-spec-list");
      if (deferred != null) {
        int count = parseCount(deferred, vSource);
        dims = new ArrayList<Expression>(count);
        for (int i = 0; i < count; i++) {
          dims.add(RangeIndex.full());
        }
      } else {
        dims = expressions(lowerChildren(v), v, vSource);
      }
      String vname = v.getAttribute("name");
      if (vname == null) {
        throw new MalformedDeclarationException(vSource,
                                        "component without a name");
      }
      VariableRef var = dims.isEmpty() ?
          new ScalarRef(vname, null, null, null, vSource) :
          new ArrayRef(vname, dims, dims, null, null, null, vSource);
      var.setType(dataType);
      vars.add(var);
    }
    return new Declaration(dataType, vars, null, tSource);
  }

  private int parseCount(XmlParseNode node, SourceSpan source)
                                      throws UserException {
    String count = node.getAttribute("count");
    try {
      return Integer.parseInt(count);
    } catch (NumberFormatException e) {
      throw new MalformedDeclarationException(source,
                                 "invalid rank of deferred shape: " + count);
    }
  }

  private Declaration variableDeclaration(XmlParseNode node,
                      SourceSpan source) throws UserException {
    XmlParseNode type = node.find("type");
    if (type == null) {
      throw new MalformedDeclarationException(source,
                                  "declaration without a type");
    }
    XmlParseNode intentNode = node.find("intent");
    String intent = intentNode == null ? null :
                                         intentNode.getAttribute("type");
    Set<TypeAttr> attrs = EnumSet.noneOf(TypeAttr.class);
    for (TypeAttr a: TypeAttr.values()) {
      if (node.find("attribute-" + a.name().toLowerCase()) != null) {
        attrs.add(a);
      }
    }
    DataType dataType = typeOf(type, intent, attrs, source);

    List<Expression> shared = null;
    XmlParseNode dimsNode = node.find("dimensions");
    if (dimsNode != null) {
      shared = expressions(lowerChildren(dimsNode), dimsNode, source);
    }

    List<VariableRef> vars = new ArrayList<VariableRef>();
    for (XmlParseNode v: node.findAll("variables/variable")) {
      List<Fragment> frags = lower(v);
      if (frags.isEmpty()) {
        continue;
      }
      VariableRef var = (VariableRef)expressions(frags, v, source).get(0);
      var = collapseDimensions(var, shared);
      // Single back-propagation of the shared type
      var.setType(dataType);
      vars.add(var);
    }
    return new Declaration(dataType, vars, shared, source);
  }

  /**
   * Rewrite trivial ranges <code>1:n</code> in declared dimensions to
   * <code>n</code>; variables without own dimensions take the shape
   * of a shared DIMENSION attribute.
   */
  private static VariableRef collapseDimensions(VariableRef var,
                                                List<Expression> shared) {
    if (var.kind() != ExprKind.ARRAY) {
      if (shared == null) {
        return var;
      }
      return new ArrayRef(var.getName(), null, shared, null,
                          var.getInitial(), null, var.getSource());
    }
    ArrayRef arr = (ArrayRef)var;
    List<Expression> dims = new ArrayList<Expression>();
    for (Expression d: arr.getDimensions()) {
      dims.add(collapseRange(d));
    }
    return new ArrayRef(arr.getName(), dims, dims, null, arr.getInitial(),
                        null, arr.getSource());
  }

  private static Expression collapseRange(Expression d) {
    if (d.kind() != ExprKind.RANGE_INDEX) {
      return d;
    }
    RangeIndex r = (RangeIndex)d;
    if (r.getStep() == null && r.getUpper() != null &&
        (r.getLower() == null || r.getLower().equals(new IntLiteral(1)))) {
      return r.getUpper();
    }
    return d;
  }

  private List<Fragment> dataDeclaration(XmlParseNode node,
                      SourceSpan source) throws UserException {
    List<XmlParseNode> variables = node.findAll("variables");
    List<XmlParseNode> values = node.findAll("values");
    List<Fragment> result = new ArrayList<Fragment>();
    for (int i = 0; i < Math.min(variables.size(), values.size()); i++) {
      List<Expression> vars = expressions(lower(variables.get(i)),
                                          variables.get(i), source);
      if (vars.size() != 1) {
        throw unsupported(node, source, "DATA group with " + vars.size()
                          + " variables");
      }
      XmlParseNode lit = values.get(i).find("literal");
      if (lit == null) {
        throw new MalformedDeclarationException(source,
                                          "DATA statement without values");
      }
      // Value lists are nested literal elements
      List<Expression> vals = new ArrayList<Expression>();
      while (lit != null) {
        vals.add(literalValue(lit, span(lit, false)));
        lit = lit.find("literal");
      }
      result.add(Fragment.node(new DataDeclaration(vars.get(0), vals,
                                                   source)));
    }
    return result;
  }

  private List<Fragment> associate(XmlParseNode node, SourceSpan source)
                                                  throws UserException {
    Map<String, Expression> associations =
                            new LinkedHashMap<String, Expression>();
    for (XmlParseNode a:
           node.findAll("header/keyword-arguments/keyword-argument")) {
      Expression expr = expression(requireChild(a, "name", source));
      String assocName = requireAttr(requireChild(a, "association", source),
                                     "associate-name", source);
      associations.put(assocName, expr);
    }
    List<Statement> body = body(node.find("body"));
    return single(Fragment.node(new Scope(body, associations, source)));
  }

  private List<Fragment> memory(XmlParseNode node, SourceSpan source,
                         boolean allocate) throws UserException {
    List<Expression> vars = new ArrayList<Expression>();
    for (XmlParseNode v: node.findAll("expressions/expression/name")) {
      vars.add(expression(v));
    }
    if (allocate) {
      return single(Fragment.node(MemoryStatement.allocation(vars, source)));
    }
    return single(Fragment.node(MemoryStatement.deallocation(vars, source)));
  }

  private List<Fragment> use(XmlParseNode node, SourceSpan source)
                                              throws UserException {
    List<String> symbols = new ArrayList<String>();
    for (XmlParseNode n: node.findAll("only/name")) {
      symbols.add(requireAttr(n, "id", source));
    }
    return single(Fragment.node(new Import(requireAttr(node, "name", source),
                                           symbols, false, source)));
  }

  private List<Fragment> directive(XmlParseNode node, SourceSpan source)
                                                   throws UserException {
    String text = requireAttr(node, "text", source);
    if (text.contains("#include")) {
      Matcher m = INCLUDE.matcher(text);
      if (!m.find()) {
        throw unsupported(node, source, "malformed include: " + text);
      }
      return single(Fragment.node(new Import(m.group(1),
                          new ArrayList<String>(), true, source)));
    }
    return passthrough(node, source);
  }

  private List<Fragment> call(XmlParseNode node, SourceSpan source)
                                               throws UserException {
    XmlParseNode name = requireChild(node, "name", source);
    List<Expression> args = new ArrayList<Expression>();
    for (XmlParseNode s: name.findAll("subscripts/subscript")) {
      args.add(expression(s));
    }
    List<Fragment> keywords = new ArrayList<Fragment>();
    for (XmlParseNode a: name.findAll("subscripts/argument")) {
      keywords.addAll(lower(a));
    }
    Map<String, Expression> kwargs = new LinkedHashMap<String, Expression>();
    splitArguments(keywords, args, kwargs);
    return single(Fragment.node(new Call(requireAttr(name, "id", source),
                                         args, kwargs, source)));
  }

  private List<Fragment> argument(XmlParseNode node, SourceSpan source)
                                                  throws UserException {
    String key = requireAttr(node, "name", source);
    List<Expression> value = expressions(lowerChildren(node), node, source);
    if (value.size() != 1) {
      throw unsupported(node, source, "keyword argument " + key + " with "
                        + value.size() + " values");
    }
    return single(Fragment.keyword(key, value.get(0)));
  }

  private List<Fragment> name(XmlParseNode node, SourceSpan source)
                                              throws UserException {
    List<Fragment> parts = lowerChildren(node);
    if (parts.isEmpty() && node.getAttribute("id") != null) {
      parts = single(Fragment.name(node.getAttribute("id"), source));
    }
    return single(Fragment.node(nameChain(parts, node, source)));
  }

  private List<Fragment> variable(XmlParseNode node, SourceSpan source)
                                                  throws UserException {
    String name = node.getAttribute("id");
    if (name == null) {
      name = node.getAttribute("name");
    }
    if (name == null) {
      return none();
    }
    List<Expression> dims = null;
    XmlParseNode dimsNode = node.find("dimensions");
    if (dimsNode != null) {
      dims = expressions(lowerChildren(dimsNode), dimsNode, source);
    }
    Expression initial = optionalExpression(node.find("initial-value"));
    VariableRef var;
    if (dims == null) {
      var = new ScalarRef(name, null, initial, null, source);
    } else {
      var = new ArrayRef(name, dims, dims, null, initial, null, source);
    }
    return single(Fragment.node(var));
  }

  private List<Fragment> literal(XmlParseNode node, SourceSpan source)
                                                 throws UserException {
    return single(Fragment.node(literalValue(node, source)));
  }

  private Expression literalValue(XmlParseNode node, SourceSpan source)
                                                   throws UserException {
    XmlParseNode kindParam = node.find("kind-param");
    String kind = kindParam == null ? null : kindParam.getAttribute("kind");
    return Literals.create(node.getAttribute("value"),
                node.getAttribute("type"), kind, source, node.getTag());
  }

  private List<Fragment> subscripts(XmlParseNode node, SourceSpan source)
                                                   throws UserException {
    List<Fragment> frags = new ArrayList<Fragment>();
    for (XmlParseNode c: node.children()) {
      String tag = c.getTag();
      if (tag.equals("subscript") || tag.equals("name") ||
          tag.equals("argument")) {
        frags.addAll(lower(c));
      }
    }
    List<Expression> args = new ArrayList<Expression>();
    Map<String, Expression> kwargs = new LinkedHashMap<String, Expression>();
    splitArguments(frags, args, kwargs);
    return single(Fragment.indices(args, kwargs, source));
  }

  private List<Fragment> subscript(XmlParseNode node, SourceSpan source)
                                                  throws UserException {
    if (node.find("range") != null) {
      return lower(node.find("range"));
    }
    String[] operands = {"name", "literal", "operation",
                         "array-constructor-values"};
    for (String tag: operands) {
      XmlParseNode operand = node.find(tag);
      if (operand != null) {
        return single(Fragment.node(expression(operand)));
      }
    }
    // Bare colon
    return single(Fragment.node(new RangeIndex(null, null, null, source)));
  }

  private List<Fragment> range(XmlParseNode node, SourceSpan source)
                                              throws UserException {
    Expression lower = optionalExpression(node.find("lower-bound"));
    Expression upper = optionalExpression(node.find("upper-bound"));
    Expression step = optionalExpression(node.find("step"));
    return single(Fragment.node(new RangeIndex(lower, upper, step,
                                               source)));
  }

  private List<Fragment> arrayConstructor(XmlParseNode node,
                     SourceSpan source) throws UserException {
    List<Expression> values = new ArrayList<Expression>();
    for (XmlParseNode v: node.findAll("value")) {
      values.addAll(expressions(lower(v), v, source));
    }
    return single(Fragment.node(new LiteralList(values, source)));
  }

  private List<Fragment> operation(XmlParseNode node, SourceSpan source)
                                                  throws UserException {
    List<String> ops = new ArrayList<String>();
    for (XmlParseNode op: node.findAll("operator")) {
      String o = op.getAttribute("operator");
      if (o != null && o.length() > 0) {
        ops.add(o);
      }
    }
    List<Expression> operands = new ArrayList<Expression>();
    for (XmlParseNode c: node.findAll("operand")) {
      operands.addAll(expressions(lower(c), c, source));
    }
    boolean parens = node.find("parenthesized_expr") != null;
    String unary = null;
    if (!operands.isEmpty() && ops.size() == operands.size()) {
      // Leading operator without left operand
      unary = ops.remove(0);
    }
    if (operands.isEmpty() || ops.size() != operands.size() - 1) {
      throw unsupported(node, source, ops.size() + " operators for " +
                        operands.size() + " operands");
    }
    return single(Fragment.node(new Operation(unary, ops, operands, parens,
                                              source)));
  }
}
