package com.github.hdlfsm;

import com.github.hdlfsm.FsmException.Code;

/**
 * Checks for hardware-description identifiers: the first character is a letter and every other
 * character is a letter, a digit or an underscore.
 */
public final class HdlIdentifier {

  private HdlIdentifier() {}

  public static boolean isValid(final String candidate) {
    if (candidate == null || candidate.isEmpty() || !isLetter(candidate.charAt(0))) {
      return false;
    }
    for (int i = 1; i < candidate.length(); i++) {
      final char c = candidate.charAt(i);
      if (!isLetter(c) && !isDigit(c) && c != '_') {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the candidate untouched when it is a valid identifier, fails otherwise. The role names
   * what the identifier is used for in the error message, eg. "State name" or "Entity name".
   */
  public static String check(final String candidate, final String role) throws FsmException {
    if (!isValid(candidate)) {
      throw new FsmException(Code.INVALID_IDENTIFIER,
          String.format("%s '%s' is not a valid identifier", role, candidate));
    }
    return candidate;
  }

  // ascii only, hdl tools reject anything else
  private static boolean isLetter(final char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isDigit(final char c) {
    return c >= '0' && c <= '9';
  }
}
