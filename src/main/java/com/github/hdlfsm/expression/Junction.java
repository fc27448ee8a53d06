package com.github.hdlfsm.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Common base of the n-ary {@link And} and {@link Or} nodes. Operands keep their given order and
 * there are always at least two of them.
 */
public abstract class Junction extends Expression {
  private final List<Expression> operands;

  Junction(final List<? extends Expression> operands) {
    if (operands == null || operands.size() < 2) {
      throw new IllegalArgumentException(
          getClass().getSimpleName() + " needs at least two operands, got " + operands);
    }
    final List<Expression> copy = new ArrayList<>(operands.size());
    for (final Expression operand : operands) {
      if (operand == null) {
        throw new IllegalArgumentException(getClass().getSimpleName() + " operand cannot be null");
      }
      copy.add(operand);
    }
    this.operands = Collections.unmodifiableList(copy);
  }

  public List<Expression> getOperands() {
    return operands;
  }

  abstract String operatorSymbol();

  @Override
  void collectSymbols(final Set<Symbol> symbols) {
    for (final Expression operand : operands) {
      operand.collectSymbols(symbols);
    }
  }

  @Override
  public int hashCode() {
    return 31 * getKind().hashCode() + operands.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || getClass() != obj.getClass()) {
      return false;
    }
    return operands.equals(((Junction) obj).operands);
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder();
    for (final Expression operand : operands) {
      if (builder.length() > 0) {
        builder.append(' ').append(operatorSymbol()).append(' ');
      }
      builder.append(operand.render(getKind().getPrecedence()));
    }
    return builder.toString();
  }
}
