package com.github.hdlfsm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import com.github.hdlfsm.expression.And;
import com.github.hdlfsm.expression.Expression;
import com.github.hdlfsm.expression.Literal;
import com.github.hdlfsm.expression.NormalForms;
import com.github.hdlfsm.expression.Or;
import com.github.hdlfsm.expression.Symbol;

/**
 * A set that can only contain conditions, with analyses over all of its members.
 */
public final class ConditionSet extends FilteredSet<Condition> {

  public ConditionSet() {
    this(null);
  }

  public ConditionSet(final Iterable<? extends Condition> conditions) {
    super(Condition.class, conditions);
  }

  /**
   * The union of every member's inputs.
   */
  public Set<Symbol> getInputs() {
    final Set<Symbol> inputs = new TreeSet<>();
    for (final Condition condition : this) {
      inputs.addAll(condition.getInputs());
    }
    return Collections.unmodifiableSet(inputs);
  }

  public List<Expression> getExpressions() {
    final List<Expression> expressions = new ArrayList<>(size());
    for (final Condition condition : this) {
      expressions.add(condition.getExpression());
    }
    return expressions;
  }

  /**
   * Whether no combination of inputs makes two members true at once. Vacuously true for fewer than
   * two members.
   */
  public boolean isExclusive() {
    final List<Expression> expressions = getExpressions();
    for (int i = 0; i < expressions.size(); i++) {
      for (int j = i + 1; j < expressions.size(); j++) {
        final Expression both = new And(Arrays.asList(expressions.get(i), expressions.get(j)));
        if (!Literal.FALSE.equals(NormalForms.toDnf(both))) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Whether every combination of inputs makes at least one member true. An empty set is not
   * exhaustive.
   */
  public boolean isExhaustive() {
    // two false operands keep the OR at two or more operands
    final List<Expression> operands = new ArrayList<>();
    operands.add(Literal.FALSE);
    operands.add(Literal.FALSE);
    operands.addAll(getExpressions());
    return Literal.TRUE.equals(NormalForms.toCnf(new Or(operands)));
  }
}
