package com.github.hdlfsm.expression;

import java.util.Set;

/**
 * The constants true and false.
 */
public final class Literal extends Expression {
  public static final Literal TRUE = new Literal(true);
  public static final Literal FALSE = new Literal(false);

  private final boolean value;

  private Literal(final boolean value) {
    this.value = value;
  }

  public static Literal of(final boolean value) {
    return value ? TRUE : FALSE;
  }

  public boolean getValue() {
    return value;
  }

  public Literal negate() {
    return of(!value);
  }

  @Override
  public Kind getKind() {
    return Kind.LITERAL;
  }

  @Override
  void collectSymbols(final Set<Symbol> symbols) {}

  @Override
  public int hashCode() {
    return Boolean.hashCode(value);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Literal)) {
      return false;
    }
    return value == ((Literal) obj).value;
  }

  @Override
  public String toString() {
    return value ? "true" : "false";
  }
}
