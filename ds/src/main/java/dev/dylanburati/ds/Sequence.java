package dev.dylanburati.ds;

import java.util.Comparator;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Values arranged in a single, linear dimension, indexed {@code [0, size)}.
 *
 * In addition to the {@link List} operations, sequences can be used as stacks
 * ({@link #push}, {@link #pop}) or queues ({@link #push}, {@link #shift}), and
 * be added to at the front ({@link #unshift}).
 */
public interface Sequence<E> extends List<E>, Allocated {
  /**
   * @throws UnderflowException if the sequence is empty
   */
  E first();

  /**
   * @throws UnderflowException if the sequence is empty
   */
  E last();

  @SuppressWarnings("unchecked")
  void push(E... values);

  /**
   * @throws IllegalArgumentException if {@code values} is null
   */
  void pushAll(Iterable<? extends E> values);

  /**
   * Removes and returns the last value.
   *
   * @throws UnderflowException if the sequence is empty
   */
  E pop();

  /**
   * Adds values to the front of the sequence, keeping their order.
   */
  @SuppressWarnings("unchecked")
  void unshift(E... values);

  /**
   * Removes and returns the first value.
   *
   * @throws UnderflowException if the sequence is empty
   */
  E shift();

  /**
   * Inserts values at {@code index}, moving the values after it to the right.
   *
   * @throws IndexOutOfBoundsException if the index is not in {@code [0, size]}
   */
  @SuppressWarnings("unchecked")
  void insert(int index, E... values);

  /**
   * Rotates the sequence left by {@code rotations}, which is the same as that
   * many {@link #shift} and {@link #push} pairs. Negative values rotate right.
   */
  void rotate(int rotations);

  /**
   * Returns the values from {@code offset} to the end. A negative offset
   * starts that far from the end.
   */
  Sequence<E> slice(int offset);

  /**
   * Returns up to {@code length} values starting at {@code offset}. A negative
   * length stops that many values from the end.
   */
  Sequence<E> slice(int offset, int length);

  /**
   * Stable sort in place. A null comparator sorts by natural ordering.
   */
  @Override
  void sort(Comparator<? super E> comparator);

  Sequence<E> sorted(Comparator<? super E> comparator);

  void reverse();

  Sequence<E> reversed();

  void apply(UnaryOperator<E> callback);

  Sequence<E> filter(Predicate<? super E> predicate);

  <R> Sequence<R> map(Function<? super E, ? extends R> callback);

  <R> R reduce(BiFunction<R, ? super E, R> callback, R initial);

  Sequence<E> merge(Iterable<? extends E> values);

  /**
   * Returns the index of the value, or -1 if it could not be found.
   */
  int find(Object value);

  /**
   * Returns true if at least one value was given and all of them are present.
   */
  boolean containsAll(Object... values);

  String join();

  String join(String glue);

  /**
   * Sum of all values, which must be {@link Number}s. Returns a {@code Long}
   * if every value is integral, otherwise a {@code Double}.
   *
   * @throws IllegalArgumentException if a value is not a number
   */
  Number sum();

  Sequence<E> copy();
}
