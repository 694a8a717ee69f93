package dev.dylanburati.ds;

import java.util.AbstractSet;
import java.util.Comparator;
import java.util.Iterator;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * Set of unique values which iterates in insertion order, backed by an
 * {@link OrderedMap} whose values are unused.
 */
public class OrderedSet<E> extends AbstractSet<E> implements Allocated {
  private final OrderedMap<E, Boolean> inner;

  public OrderedSet() {
    this(0);
  }

  public OrderedSet(int initialCapacity) {
    this(initialCapacity, DefaultHasher.instance());
  }

  public OrderedSet(int initialCapacity, final Hasher hasher) {
    this.inner = new OrderedMap<>(initialCapacity, hasher);
  }

  public OrderedSet(Iterable<? extends E> values) {
    this(0);
    this.addAll(values);
  }

  private OrderedSet(final OrderedMap<E, Boolean> inner) {
    this.inner = inner;
  }

  @SafeVarargs
  public static <E> OrderedSet<E> of(E... values) {
    OrderedSet<E> result = new OrderedSet<>(values.length);
    for (E v : values) {
      result.add(v);
    }
    return result;
  }

  @Override
  public int size() {
    return inner.size();
  }

  @Override
  public boolean isEmpty() {
    return inner.isEmpty();
  }

  @Override
  public int capacity() {
    return inner.capacity();
  }

  @Override
  public void allocate(int capacity) {
    inner.allocate(capacity);
  }

  @Override
  public void clear() {
    inner.clear();
  }

  @Override
  public boolean contains(Object o) {
    return inner.hasKey(o);
  }

  /**
   * Returns true if at least one value was given and all of them are present.
   */
  public boolean containsAll(Object... values) {
    return inner.containsKeys(values);
  }

  /**
   * Adds the value at the end, unless it is already present.
   */
  @Override
  public boolean add(E value) {
    if (inner.hasKey(value)) {
      return false;
    }
    inner.put(value, Boolean.TRUE);
    return true;
  }

  /**
   * Adds each value which is not already present, in the given order.
   *
   * @return true if any value was added
   */
  @SafeVarargs
  public final boolean add(E... values) {
    boolean changed = false;
    for (E v : values) {
      changed |= this.add(v);
    }
    return changed;
  }

  /**
   * @throws IllegalArgumentException if {@code values} is null
   */
  public void addAll(Iterable<? extends E> values) {
    if (values == null) {
      throw new IllegalArgumentException("expected iterable values");
    }
    for (E v : values) {
      this.add(v);
    }
  }

  @Override
  public boolean remove(Object o) {
    return inner.remove(o, null) != null;
  }

  /**
   * @return true if any value was removed
   */
  public boolean remove(Object... values) {
    boolean changed = false;
    for (Object v : values) {
      changed |= this.remove(v);
    }
    return changed;
  }

  /**
   * @throws UnderflowException if the set is empty
   */
  public E first() {
    return inner.first().getKey();
  }

  /**
   * @throws UnderflowException if the set is empty
   */
  public E last() {
    return inner.last().getKey();
  }

  /**
   * Returns the value at {@code position} in iteration order.
   *
   * @throws IndexOutOfBoundsException if the position is not in {@code [0, size)}
   */
  public E get(int position) {
    return inner.keyAt(position);
  }

  /**
   * Returns the values of this set which are not in {@code other}.
   */
  public OrderedSet<E> diff(OrderedSet<?> other) {
    return new OrderedSet<>(inner.diff(other.inner));
  }

  /**
   * Returns the values of this set which are also in {@code other}.
   */
  public OrderedSet<E> intersect(OrderedSet<?> other) {
    return new OrderedSet<>(inner.intersect(other.inner));
  }

  /**
   * Returns this set's values followed by the values of {@code other} which
   * are not in this set.
   */
  public OrderedSet<E> union(OrderedSet<? extends E> other) {
    return new OrderedSet<>(inner.union(other.inner));
  }

  /**
   * Returns the values in exactly one of the two sets, this set's first.
   */
  public OrderedSet<E> xor(OrderedSet<? extends E> other) {
    return new OrderedSet<>(inner.xor(other.inner));
  }

  public OrderedSet<E> filter(Predicate<? super E> predicate) {
    Objects.requireNonNull(predicate);
    return new OrderedSet<>(inner.filter((k, _v) -> predicate.test(k)));
  }

  public <R> R reduce(BiFunction<R, ? super E, R> callback, R initial) {
    Objects.requireNonNull(callback);
    return inner.reduce((carry, pair) -> callback.apply(carry, pair.getKey()), initial);
  }

  public String join() {
    return this.join("");
  }

  public String join(String glue) {
    StringJoiner joiner = new StringJoiner(glue == null ? "" : glue);
    for (E v : this) {
      joiner.add(String.valueOf(v));
    }
    return joiner.toString();
  }

  public void reverse() {
    inner.reverse();
  }

  public OrderedSet<E> reversed() {
    return new OrderedSet<>(inner.reversed());
  }

  public OrderedSet<E> slice(int offset) {
    return new OrderedSet<>(inner.slice(offset));
  }

  /**
   * Returns up to {@code length} values starting at {@code offset}. A negative
   * offset starts that far from the end, and a negative length stops that many
   * values from the end.
   */
  public OrderedSet<E> slice(int offset, int length) {
    return new OrderedSet<>(inner.slice(offset, length));
  }

  /**
   * Sorts in place. A null comparator sorts by natural ordering.
   */
  public void sort(Comparator<? super E> comparator) {
    inner.ksort(comparator);
  }

  public OrderedSet<E> sorted(Comparator<? super E> comparator) {
    return new OrderedSet<>(inner.ksorted(comparator));
  }

  public Number sum() {
    return this.toList().sum();
  }

  public OrderedSet<E> copy() {
    return new OrderedSet<>(inner.copy());
  }

  public Vector<E> toList() {
    Vector<E> result = new Vector<>(inner.size());
    for (E v : this) {
      result.push(v);
    }
    return result;
  }

  /**
   * Iterates in insertion order. The iterator supports removal.
   */
  @Override
  public Iterator<E> iterator() {
    return new OrderedMap.KeyIterator<>(inner);
  }
}
