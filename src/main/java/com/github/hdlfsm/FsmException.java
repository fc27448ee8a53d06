package com.github.hdlfsm;

/**
 * Unified single exception that's thrown by the fsm model, the condition algebra and the hdl
 * hand-off. The code enum encapsulates the various error conditions so callers (typically an editor
 * front-end) can decide how to report them without matching on exception types.
 */
public final class FsmException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public FsmException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public FsmException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public FsmException(final Code code, final String message, final Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    EXPRESSION_SYNTAX("Boolean expression could not be parsed"),
    // 2.
    CONDITION_EXPRESSION("Condition could not be created from its expression"),
    // 3.
    CONDITION_CONVERSION("Condition could not be lowered to a relational expression"),
    // 4.
    INVALID_VALUE("Value is not one of 0, \"0\", false, 1, \"1\", true"),
    // 5.
    INVALID_FILTER_MODE("Transition filter mode must be \"and\" or \"or\""),
    // 6.
    INVALID_IDENTIFIER(
        "Identifier must start with a letter and contain only letters, digits or underscores"),
    // 7.
    INVALID_STATE("Null state or condition is invalid"),
    // 8.
    UNREACHABLE_STATE("State is not the destination of any transition"),
    // 9.
    UNEXITABLE_STATE("State is not the source of any transition"),
    // 10.
    INVALID_STATES("States are not uniquely named or do not share the same outputs"),
    // 11.
    INVALID_STATE_NAME("State name cannot be null or empty"),
    // 12.
    INVALID_OUTPUT_NAME("Output name cannot be null or empty"),
    // 13.
    MISSING_DEFAULT_STATE("Finite state machine has no registered default state"),
    // 14.
    INVALID_GENERATION_CONFIG("Generation configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
