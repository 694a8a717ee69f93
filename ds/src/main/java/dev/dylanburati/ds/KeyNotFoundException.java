package dev.dylanburati.ds;

import java.util.NoSuchElementException;

/**
 * Thrown by {@link OrderedMap#get(Object)} and {@link OrderedMap#remove(Object)}
 * when the key is absent and no default was given.
 */
public class KeyNotFoundException extends NoSuchElementException {
  private static final long serialVersionUID = 1L;

  public KeyNotFoundException(Object key) {
    super("key not found: " + key);
  }
}
