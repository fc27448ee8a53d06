package com.github.hdlfsm;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.hdlfsm.FsmException.Code;
import com.github.hdlfsm.expression.Expression;
import com.github.hdlfsm.expression.ExpressionParser;
import com.github.hdlfsm.expression.RelationalLowering;
import com.github.hdlfsm.expression.Simplifier;
import com.github.hdlfsm.expression.Symbol;

/**
 * The boolean condition guarding a transition. A condition owns exactly one immutable
 * {@link Expression}; changing a transition's guard means replacing its condition.
 *
 * Two conditions are equal iff their expressions are structurally equal.
 */
public final class Condition {
  private static final Logger logger = LogManager.getLogger(Condition.class.getSimpleName());

  private final Expression expression;
  // lazily lowered, expression never changes
  private String vhdl;

  /**
   * Parse the condition from text such as {@code x & !y}. Malformed text fails with
   * {@link Code#CONDITION_EXPRESSION}, the underlying syntax error is kept as the cause.
   */
  public Condition(final String text) throws FsmException {
    try {
      this.expression = ExpressionParser.parse(text);
    } catch (FsmException syntaxError) {
      logger.debug("Rejected condition \"" + text + "\": " + syntaxError.getMessage());
      throw new FsmException(Code.CONDITION_EXPRESSION, "Condition \"" + text + "\" is invalid. "
          + ExpressionParser.SYNTAX_LEGEND, syntaxError);
    }
  }

  public Condition(final Expression expression) {
    this.expression = Objects.requireNonNull(expression, "expression");
  }

  public Expression getExpression() {
    return expression;
  }

  public Set<Symbol> getInputs() {
    return expression.symbols();
  }

  /**
   * Substitute the bound inputs and simplify. The result is a literal only when the bindings settle
   * the condition.
   */
  public Expression evaluate(final Map<String, ?> bindings) throws FsmException {
    return Simplifier.substitute(expression, bindings);
  }

  /**
   * The condition lowered to hdl relational text, eg. {@code x='1' and y='0'}.
   */
  public String getVhdl() throws FsmException {
    if (vhdl == null) {
      vhdl = RelationalLowering.lower(expression);
    }
    return vhdl;
  }

  @Override
  public int hashCode() {
    return expression.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Condition)) {
      return false;
    }
    return expression.equals(((Condition) obj).expression);
  }

  @Override
  public String toString() {
    return "Condition('" + expression + "')";
  }
}
