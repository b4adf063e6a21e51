package representation.core;

/**
 * Raised when arguments fall outside the defined domain: malformed partitions or sizes that do not
 * balance.
 */
public final class InvalidInputException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public InvalidInputException(String message) {
    super(message);
  }
}
