package com.github.hdlfsm.expression;

import com.github.hdlfsm.FsmException;
import com.github.hdlfsm.FsmException.Code;

/**
 * Lowers an expression to the relational text used in hdl conditions, eg. x&amp;(y|!z) becomes
 * {@code x='1' and (y='1' or z='0')}.
 *
 * A subexpression gets parentheses only when its operator binds looser than what the enclosing
 * operator demands, see {@link Expression.Kind#getPrecedence()}. A negated single signal is written
 * as a comparison against '0' rather than with the negation keyword.
 */
public final class RelationalLowering {

  private RelationalLowering() {}

  public static String lower(final Expression expression) throws FsmException {
    return lower(expression, 0);
  }

  private static String lower(final Expression expression, final int contextPrecedence)
      throws FsmException {
    switch (expression.getKind()) {
      case LITERAL:
        return ((Literal) expression).getValue() ? "true" : "false";
      case VARIABLE:
        return ((Variable) expression).getName() + "='1'";
      case NOT:
        final Expression operand = ((Not) expression).getOperand();
        if (operand.getKind() == Expression.Kind.VARIABLE) {
          return ((Variable) operand).getName() + "='0'";
        }
        // the explicit parentheses already group the operand
        return "not (" + lower(operand, 0) + ")";
      case AND:
      case OR:
        final int precedence = expression.getKind().getPrecedence();
        final String separator = expression.getKind() == Expression.Kind.AND ? " and " : " or ";
        final StringBuilder builder = new StringBuilder();
        for (final Expression child : ((Junction) expression).getOperands()) {
          if (builder.length() > 0) {
            builder.append(separator);
          }
          builder.append(lower(child, precedence));
        }
        if (precedence < contextPrecedence) {
          return "(" + builder + ")";
        }
        return builder.toString();
      default:
        throw new FsmException(Code.CONDITION_CONVERSION,
            "Couldn't convert expression " + expression + ", unrecognized kind "
                + expression.getKind());
    }
  }
}
