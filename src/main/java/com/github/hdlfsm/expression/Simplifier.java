package com.github.hdlfsm.expression;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.github.hdlfsm.BitValues;
import com.github.hdlfsm.FsmException;

/**
 * Substitution and bottom-up simplification of expression trees.
 *
 * Simplification applies, in one pass from the leaves up: flattening of nested AND/OR of the same
 * kind, identity and annihilator laws for constants, double negation elimination, removal of
 * duplicate operands and detection of complementary operands (x &amp; !x, x | !x).
 */
public final class Simplifier {

  private Simplifier() {}

  /**
   * Replace every variable named in bindings by the matching literal, then simplify. Binding values
   * follow {@link BitValues#coerce(Object)}. Variables without a binding stay symbolic, so the
   * result is not necessarily a literal.
   */
  public static Expression substitute(final Expression expression, final Map<String, ?> bindings)
      throws FsmException {
    final Map<String, Literal> literals = new HashMap<>();
    if (bindings != null) {
      for (final Map.Entry<String, ?> binding : bindings.entrySet()) {
        literals.put(binding.getKey(), Literal.of(BitValues.coerceToBoolean(binding.getValue())));
      }
    }
    return simplify(replace(expression, literals));
  }

  public static Expression simplify(final Expression expression) {
    switch (expression.getKind()) {
      case LITERAL:
      case VARIABLE:
        return expression;
      case NOT:
        return simplifyNot((Not) expression);
      case AND:
      case OR:
        return simplifyJunction((Junction) expression);
      default:
        throw new IllegalStateException("Unknown expression kind " + expression.getKind());
    }
  }

  private static Expression replace(final Expression expression,
      final Map<String, Literal> literals) {
    switch (expression.getKind()) {
      case LITERAL:
        return expression;
      case VARIABLE:
        final Literal literal = literals.get(((Variable) expression).getName());
        return literal != null ? literal : expression;
      case NOT:
        return new Not(replace(((Not) expression).getOperand(), literals));
      case AND:
      case OR:
        final List<Expression> operands = new ArrayList<>();
        for (final Expression operand : ((Junction) expression).getOperands()) {
          operands.add(replace(operand, literals));
        }
        return junction(expression.getKind(), operands);
      default:
        throw new IllegalStateException("Unknown expression kind " + expression.getKind());
    }
  }

  private static Expression simplifyNot(final Not not) {
    final Expression operand = simplify(not.getOperand());
    switch (operand.getKind()) {
      case LITERAL:
        return ((Literal) operand).negate();
      case NOT:
        return ((Not) operand).getOperand();
      default:
        return new Not(operand);
    }
  }

  private static Expression simplifyJunction(final Junction junction) {
    final Expression.Kind kind = junction.getKind();
    // identity: true for AND, false for OR. annihilator is its negation.
    final Literal identity = Literal.of(kind == Expression.Kind.AND);
    final Literal annihilator = identity.negate();

    final Set<Expression> operands = new LinkedHashSet<>();
    for (final Expression operand : junction.getOperands()) {
      final Expression simplified = simplify(operand);
      if (simplified.getKind() == kind) {
        operands.addAll(((Junction) simplified).getOperands());
      } else {
        operands.add(simplified);
      }
    }

    final List<Expression> kept = new ArrayList<>(operands.size());
    for (final Expression operand : operands) {
      if (operand.equals(annihilator)) {
        return annihilator;
      }
      if (operand.equals(identity)) {
        continue;
      }
      if (operands.contains(complement(operand))) {
        return annihilator;
      }
      kept.add(operand);
    }

    if (kept.isEmpty()) {
      return identity;
    }
    if (kept.size() == 1) {
      return kept.get(0);
    }
    return junction(kind, kept);
  }

  private static Expression complement(final Expression expression) {
    if (expression.getKind() == Expression.Kind.NOT) {
      return ((Not) expression).getOperand();
    }
    return new Not(expression);
  }

  static Expression junction(final Expression.Kind kind, final List<Expression> operands) {
    return kind == Expression.Kind.AND ? new And(operands) : new Or(operands);
  }
}
