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
package exm.ftx.expr;

import exm.ftx.common.exceptions.FTXRuntimeError;
import exm.ftx.ir.expr.ArrayRef;
import exm.ftx.ir.expr.Cast;
import exm.ftx.ir.expr.Expression;
import exm.ftx.ir.expr.FloatLiteral;
import exm.ftx.ir.expr.InlineCall;
import exm.ftx.ir.expr.IntLiteral;
import exm.ftx.ir.expr.LiteralList;
import exm.ftx.ir.expr.LogicLiteral;
import exm.ftx.ir.expr.Operation;
import exm.ftx.ir.expr.RangeIndex;
import exm.ftx.ir.expr.ScalarRef;
import exm.ftx.ir.expr.StringConcat;
import exm.ftx.ir.expr.StringLiteral;
import exm.ftx.ir.expr.VariableRef;

/**
 * Dispatch on expression kind.  Each kind has its own method, which by
 * default delegates to the method of its family:
 * <ul>
 *  <li>scalar and array references to {@link #mapVariable}</li>
 *  <li>the four literal kinds to {@link #mapLiteral}</li>
 *  <li>everything else, and both families, to {@link #mapDefault}</li>
 * </ul>
 * so a mapper only overrides the granularity it needs.
 *
 * @param <T> result of mapping one expression
 */
public abstract class ExprMapper<T> {

  public T map(Expression e) {
    switch (e.kind()) {
      case SCALAR:
        return mapScalar((ScalarRef)e);
      case ARRAY:
        return mapArray((ArrayRef)e);
      case INT_LITERAL:
        return mapIntLiteral((IntLiteral)e);
      case FLOAT_LITERAL:
        return mapFloatLiteral((FloatLiteral)e);
      case LOGIC_LITERAL:
        return mapLogicLiteral((LogicLiteral)e);
      case STRING_LITERAL:
        return mapStringLiteral((StringLiteral)e);
      case RANGE_INDEX:
        return mapRangeIndex((RangeIndex)e);
      case OPERATION:
        return mapOperation((Operation)e);
      case INLINE_CALL:
        return mapInlineCall((InlineCall)e);
      case CAST:
        return mapCast((Cast)e);
      case LITERAL_LIST:
        return mapLiteralList((LiteralList)e);
      case STRING_CONCAT:
        return mapStringConcat((StringConcat)e);
      default:
        throw new FTXRuntimeError("Unknown expression kind " + e.kind());
    }
  }

  protected T mapScalar(ScalarRef e) {
    return mapVariable(e);
  }

  protected T mapArray(ArrayRef e) {
    return mapVariable(e);
  }

  protected T mapVariable(VariableRef e) {
    return mapDefault(e);
  }

  protected T mapIntLiteral(IntLiteral e) {
    return mapLiteral(e);
  }

  protected T mapFloatLiteral(FloatLiteral e) {
    return mapLiteral(e);
  }

  protected T mapLogicLiteral(LogicLiteral e) {
    return mapLiteral(e);
  }

  protected T mapStringLiteral(StringLiteral e) {
    return mapLiteral(e);
  }

  protected T mapLiteral(Expression e) {
    return mapDefault(e);
  }

  protected T mapRangeIndex(RangeIndex e) {
    return mapDefault(e);
  }

  protected T mapOperation(Operation e) {
    return mapDefault(e);
  }

  protected T mapInlineCall(InlineCall e) {
    return mapDefault(e);
  }

  protected T mapCast(Cast e) {
    return mapDefault(e);
  }

  protected T mapLiteralList(LiteralList e) {
    return mapDefault(e);
  }

  protected T mapStringConcat(StringConcat e) {
    return mapDefault(e);
  }

  /**
   * Fallback for every kind not handled more specifically
   */
  protected T mapDefault(Expression e) {
    throw new FTXRuntimeError(getClass().getSimpleName() +
                  " has no mapping for " + e.kind());
  }
}
