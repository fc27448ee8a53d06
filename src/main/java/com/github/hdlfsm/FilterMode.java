package com.github.hdlfsm;

import java.util.Locale;

import com.github.hdlfsm.FsmException.Code;

/**
 * How {@link TransitionSet#fromStates(State, State, FilterMode)} combines its source and
 * destination filters.
 */
public enum FilterMode {
  // transitions matching both the source and the destination
  AND,
  // transitions matching either the source or the destination
  OR;

  /**
   * Only the exact lower-case spellings "and" and "or" are accepted.
   */
  public static FilterMode of(final String mode) throws FsmException {
    for (final FilterMode candidate : values()) {
      if (candidate.name().toLowerCase(Locale.ROOT).equals(mode)) {
        return candidate;
      }
    }
    throw new FsmException(Code.INVALID_FILTER_MODE,
        "Mode must be \"and\" or \"or\", got \"" + mode + "\"");
  }
}
