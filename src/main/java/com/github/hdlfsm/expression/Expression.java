package com.github.hdlfsm.expression;

import java.util.Arrays;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

import com.github.hdlfsm.FsmException;

/**
 * An immutable boolean expression tree. The set of node shapes is closed: {@link Literal},
 * {@link Variable}, {@link Not}, {@link And} and {@link Or}. Consumers switch over {@link Kind}
 * rather than probing with instanceof chains.
 *
 * Trees are never mutated after construction. Substitution, simplification and normal form
 * conversion all hand back new trees, see {@link Simplifier} and {@link NormalForms}.
 */
public abstract class Expression {

  /**
   * Node kinds along with the binding strength used when printing and lowering. Lower precedence
   * binds looser.
   */
  public static enum Kind {
    LITERAL(0), VARIABLE(0), NOT(3), AND(2), OR(1);

    private final int precedence;

    private Kind(final int precedence) {
      this.precedence = precedence;
    }

    public int getPrecedence() {
      return precedence;
    }

    boolean isAtom() {
      return this == LITERAL || this == VARIABLE;
    }
  }

  // only the five node shapes of this package may extend
  Expression() {}

  public abstract Kind getKind();

  /**
   * Report the free variables of this expression in name order.
   */
  public Set<Symbol> symbols() {
    final Set<Symbol> symbols = new TreeSet<>();
    collectSymbols(symbols);
    return Collections.unmodifiableSet(symbols);
  }

  abstract void collectSymbols(final Set<Symbol> symbols);

  /**
   * Renders this node in the canonical surface syntax, wrapped in parentheses when it binds looser
   * than what the enclosing operator demands.
   */
  String render(final int contextPrecedence) {
    final String text = toString();
    if (!getKind().isAtom() && getKind().getPrecedence() < contextPrecedence) {
      return "(" + text + ")";
    }
    return text;
  }

  public static Literal literal(final boolean value) {
    return Literal.of(value);
  }

  public static Variable variable(final String name) throws FsmException {
    return new Variable(Symbol.of(name));
  }

  public static Not not(final Expression operand) {
    return new Not(operand);
  }

  public static And and(final Expression... operands) {
    return new And(Arrays.asList(operands));
  }

  public static Or or(final Expression... operands) {
    return new Or(Arrays.asList(operands));
  }
}
