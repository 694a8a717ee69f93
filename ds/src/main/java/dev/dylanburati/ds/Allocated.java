package dev.dylanburati.ds;

/**
 * A structure whose backing buffer can be pre-sized. The capacity is an
 * allocation hint, not a bound: adding past it always succeeds.
 */
public interface Allocated {
  /**
   * Returns the current capacity, which is never less than the size.
   */
  int capacity();

  /**
   * Ensures that enough memory is allocated for {@code capacity} elements.
   * Capacity stays the same if the value is less than or equal to the current
   * capacity.
   *
   * @throws IllegalArgumentException if {@code capacity} is negative
   */
  void allocate(int capacity);
}
