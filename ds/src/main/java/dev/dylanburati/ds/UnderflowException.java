package dev.dylanburati.ds;

import java.util.NoSuchElementException;

/**
 * Thrown when a value is read or removed from an empty structure.
 */
public class UnderflowException extends NoSuchElementException {
  private static final long serialVersionUID = 1L;

  public UnderflowException() {
    super("structure is empty");
  }

  public UnderflowException(String message) {
    super(message);
  }
}
