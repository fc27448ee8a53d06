package com.github.hdlfsm.expression;

import java.util.Objects;
import java.util.Set;

public final class Not extends Expression {
  private final Expression operand;

  public Not(final Expression operand) {
    this.operand = Objects.requireNonNull(operand, "operand");
  }

  public Expression getOperand() {
    return operand;
  }

  @Override
  public Kind getKind() {
    return Kind.NOT;
  }

  @Override
  void collectSymbols(final Set<Symbol> symbols) {
    operand.collectSymbols(symbols);
  }

  @Override
  public int hashCode() {
    return 31 * Kind.NOT.hashCode() + operand.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Not)) {
      return false;
    }
    return operand.equals(((Not) obj).operand);
  }

  @Override
  public String toString() {
    return "!" + operand.render(Kind.NOT.getPrecedence());
  }
}
