package com.github.hdlfsm;

import com.github.hdlfsm.FsmException.Code;

/**
 * Coercion of loosely typed bit values, as typed into an editor or passed as substitution
 * bindings, to 0 or 1. Accepted values are 0, "0", false, 1, "1" and true.
 */
public final class BitValues {

  private BitValues() {}

  public static int coerce(final Object value) throws FsmException {
    if (value instanceof Boolean) {
      return ((Boolean) value) ? 1 : 0;
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      final long number = ((Number) value).longValue();
      if (number == 0L || number == 1L) {
        return (int) number;
      }
    } else if ("0".equals(value)) {
      return 0;
    } else if ("1".equals(value)) {
      return 1;
    }
    throw new FsmException(Code.INVALID_VALUE,
        "Value " + describe(value) + " not in supported values 0, \"0\", false, 1, \"1\", true");
  }

  public static boolean coerceToBoolean(final Object value) throws FsmException {
    return coerce(value) == 1;
  }

  private static String describe(final Object value) {
    if (value instanceof String) {
      return "\"" + value + "\"";
    }
    return String.valueOf(value);
  }
}
