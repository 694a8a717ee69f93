package dev.dylanburati.ds;

/**
 * Decides the allocated capacity of a backing buffer relative to its element
 * count. Growth happens once the required size exceeds the capacity; shrinking
 * happens once the size drops below a quarter of the capacity, so alternating
 * pushes and pops near either boundary don't reallocate every time.
 */
public final class CapacityPolicy {
  private final int minimum;
  // 0 for power-of-two growth
  private final double factor;

  private CapacityPolicy(int minimum, double factor) {
    this.minimum = minimum;
    this.factor = factor;
  }

  /**
   * Capacities are powers of two, and at least {@code minimum}.
   */
  public static CapacityPolicy squared(int minimum) {
    if (minimum < 1 || Integer.bitCount(minimum) != 1) {
      throw new IllegalArgumentException("expected power of two minimum");
    }
    return new CapacityPolicy(minimum, 0);
  }

  /**
   * Capacities grow by {@code factor} of the previous capacity, or to the
   * required size if that is larger.
   */
  public static CapacityPolicy multiplicative(int minimum, double factor) {
    if (minimum < 1) {
      throw new IllegalArgumentException("expected positive minimum");
    }
    if (!(factor > 1.0)) {
      throw new IllegalArgumentException("expected growth factor > 1");
    }
    return new CapacityPolicy(minimum, factor);
  }

  public int minimum() {
    return this.minimum;
  }

  public boolean isSquared() {
    return this.factor == 0;
  }

  /** Capacity of a new structure asked to hold {@code requested} elements. */
  public int initial(int requested) {
    if (requested < 0) {
      throw new IllegalArgumentException("expected non-negative capacity");
    }
    return this.allocate(this.minimum, requested);
  }

  /** Capacity needed to hold {@code required} elements; never less than {@code capacity}. */
  public int grow(int capacity, int required) {
    if (required <= capacity) {
      return capacity;
    }
    if (this.isSquared()) {
      return Math.max(this.minimum, nextPowerOfTwo(required));
    }
    long scaled = (long) Math.floor(capacity * this.factor);
    return (int) Math.min(Integer.MAX_VALUE - 8, Math.max(required, scaled));
  }

  /** Capacity after a removal left {@code size} elements. */
  public int shrink(int capacity, int size) {
    if (size < capacity / 4) {
      return Math.max(this.minimum, capacity / 2);
    }
    return capacity;
  }

  /** Capacity after the user asked for room for {@code requested} elements. */
  public int allocate(int capacity, int requested) {
    if (requested < 0) {
      throw new IllegalArgumentException("expected non-negative capacity");
    }
    int wanted = this.isSquared() ? nextPowerOfTwo(requested) : requested;
    return Math.max(capacity, Math.max(this.minimum, wanted));
  }

  static int nextPowerOfTwo(int n) {
    if (n <= 1) {
      return 1;
    }
    if (n > (1 << 30)) {
      throw new IllegalArgumentException("capacity too large");
    }
    return 1 << (32 - Integer.numberOfLeadingZeros(n - 1));
  }
}
