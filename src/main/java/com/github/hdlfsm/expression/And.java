package com.github.hdlfsm.expression;

import java.util.List;

public final class And extends Junction {

  public And(final List<? extends Expression> operands) {
    super(operands);
  }

  @Override
  public Kind getKind() {
    return Kind.AND;
  }

  @Override
  String operatorSymbol() {
    return "&";
  }
}
