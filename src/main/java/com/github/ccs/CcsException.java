package com.github.ccs;

/**
 * Unified single exception that's thrown and handled by this engine. The idea is to use the code
 * enum to encapsulate various error/exception conditions. That said, stack traces, where available
 * and desired, are not meant to be kept from users.
 */
public final class CcsException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public CcsException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public CcsException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public CcsException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    UNDEFINED_PROCESS("Reference to a process name that is not defined in the environment"),
    // 2.
    OVERLAPPING_PROCESS("Process name is defined more than once"),
    // 3.
    UNGUARDED_RECURSION("Process definition reaches itself without an intervening action prefix"),
    // 4.
    ANONYMOUS_PROCESS_REFERENCE("The anonymous process name _ cannot be referenced"),
    // 5.
    SYNTAX_ERROR("Specification could not be parsed"),
    // 6.
    UNKNOWN_STATE("Process is not a state of the transition system"),
    // 7.
    STATE_SPACE_TOO_LARGE("State pair space exceeds what a relation can index"),
    // 8.
    MALFORMED_GRAPH("Graph description is malformed"),
    // 9.
    INVALID_ENGINE_CONFIG("Engine configuration is invalid"),
    // 10.
    INTERRUPTED("Engine was interrupted"),
    // 11.
    UNKNOWN_FAILURE("Engine failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
