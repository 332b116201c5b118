package partialspan.trace.core;

/** Thrown when a {@link PartialSpanProcessor} is built with an out of range setting. */
public class InvalidProcessorArgumentException extends IllegalArgumentException {
  private final String argumentName;

  public InvalidProcessorArgumentException(String argumentName, String message) {
    super(argumentName + ": " + message);
    this.argumentName = argumentName;
  }

  /** @return the name of the rejected argument */
  public String getArgumentName() {
    return argumentName;
  }
}
