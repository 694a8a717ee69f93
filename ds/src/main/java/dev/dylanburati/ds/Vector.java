package dev.dylanburati.ds;

import java.util.function.Function;

/**
 * Sequence whose capacity grows by half of the previous capacity each time it
 * fills up, starting at 10.
 */
public final class Vector<E> extends AbstractSequence<E, Vector<E>> {
  static final CapacityPolicy POLICY = CapacityPolicy.multiplicative(10, 1.5);

  public Vector() {
    this(0);
  }

  public Vector(int initialCapacity) {
    super(POLICY, initialCapacity);
  }

  public Vector(Iterable<? extends E> values) {
    this(0);
    this.pushAll(values);
  }

  private Vector(Object[] buffer, int size) {
    super(POLICY, buffer, size);
  }

  @SafeVarargs
  public static <E> Vector<E> of(E... values) {
    Vector<E> result = new Vector<>(values.length);
    result.push(values);
    return result;
  }

  @Override
  protected Vector<E> rebuild(Object[] buffer, int size) {
    return new Vector<>(buffer, size);
  }

  @Override
  public <R> Vector<R> map(Function<? super E, ? extends R> callback) {
    return new Vector<>(this.mappedValues(callback), this.size());
  }
}
