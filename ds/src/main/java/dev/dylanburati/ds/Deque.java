package dev.dylanburati.ds;

import java.util.function.Function;

/**
 * Double-ended sequence. Capacity is always a power of two, at least 8.
 */
public final class Deque<E> extends AbstractSequence<E, Deque<E>> {
  static final CapacityPolicy POLICY = CapacityPolicy.squared(8);

  public Deque() {
    this(0);
  }

  public Deque(int initialCapacity) {
    super(POLICY, initialCapacity);
  }

  public Deque(Iterable<? extends E> values) {
    this(0);
    this.pushAll(values);
  }

  private Deque(Object[] buffer, int size) {
    super(POLICY, buffer, size);
  }

  @SafeVarargs
  public static <E> Deque<E> of(E... values) {
    Deque<E> result = new Deque<>(values.length);
    result.push(values);
    return result;
  }

  @Override
  protected Deque<E> rebuild(Object[] buffer, int size) {
    return new Deque<>(buffer, size);
  }

  @Override
  public <R> Deque<R> map(Function<? super E, ? extends R> callback) {
    return new Deque<>(this.mappedValues(callback), this.size());
  }
}
