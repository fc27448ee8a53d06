package com.github.hdlfsm.expression;

import com.github.hdlfsm.FsmException;
import com.github.hdlfsm.HdlIdentifier;

/**
 * A variable name appearing inside an expression. Symbols are plain values: two symbols with the
 * same name are equal and interchangeable, and share one interned name string. No registry of
 * symbols is kept.
 */
public final class Symbol implements Comparable<Symbol> {
  private final String name;

  private Symbol(final String name) {
    this.name = name;
  }

  public static Symbol of(final String name) throws FsmException {
    return new Symbol(HdlIdentifier.check(name, "Symbol").intern());
  }

  public String getName() {
    return name;
  }

  @Override
  public int compareTo(final Symbol other) {
    return name.compareTo(other.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Symbol)) {
      return false;
    }
    return name.equals(((Symbol) obj).name);
  }

  @Override
  public String toString() {
    return name;
  }
}
