package com.github.hdlfsm.expression;

import java.util.List;

public final class Or extends Junction {

  public Or(final List<? extends Expression> operands) {
    super(operands);
  }

  @Override
  public Kind getKind() {
    return Kind.OR;
  }

  @Override
  String operatorSymbol() {
    return "|";
  }
}
