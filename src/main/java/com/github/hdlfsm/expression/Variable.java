package com.github.hdlfsm.expression;

import java.util.Objects;
import java.util.Set;

public final class Variable extends Expression {
  private final Symbol symbol;

  public Variable(final Symbol symbol) {
    this.symbol = Objects.requireNonNull(symbol, "symbol");
  }

  public Symbol getSymbol() {
    return symbol;
  }

  public String getName() {
    return symbol.getName();
  }

  @Override
  public Kind getKind() {
    return Kind.VARIABLE;
  }

  @Override
  void collectSymbols(final Set<Symbol> symbols) {
    symbols.add(symbol);
  }

  @Override
  public int hashCode() {
    return 31 * Kind.VARIABLE.hashCode() + symbol.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Variable)) {
      return false;
    }
    return symbol.equals(((Variable) obj).symbol);
  }

  @Override
  public String toString() {
    return symbol.getName();
  }
}
