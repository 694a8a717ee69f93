package dev.dylanburati.ds;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * First-in, first-out collection backed by a {@link Deque}.
 *
 * <p><b>Iteration is destructive</b>: each step of {@link #iterator()} pops
 * the front value. Use {@link #toList()} to read the values without removing
 * them.
 */
public class Queue<E> implements Iterable<E>, Allocated {
  private final Deque<E> inner;

  public Queue() {
    this.inner = new Deque<>();
  }

  public Queue(int initialCapacity) {
    this.inner = new Deque<>(initialCapacity);
  }

  public Queue(Iterable<? extends E> values) {
    this.inner = new Deque<>(values);
  }

  private Queue(final Deque<E> inner) {
    this.inner = inner;
  }

  public int size() {
    return inner.size();
  }

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

  public void clear() {
    inner.clear();
  }

  @SafeVarargs
  public final void push(E... values) {
    inner.push(values);
  }

  /**
   * @throws IllegalArgumentException if {@code values} is null
   */
  public void pushAll(Iterable<? extends E> values) {
    inner.pushAll(values);
  }

  /**
   * Removes and returns the front value.
   *
   * @throws UnderflowException if the queue is empty
   */
  public E pop() {
    return inner.shift();
  }

  /**
   * @throws UnderflowException if the queue is empty
   */
  public E peek() {
    return inner.first();
  }

  public Queue<E> copy() {
    return new Queue<>(inner.copy());
  }

  /**
   * Returns the values in the order they would be popped, front first.
   */
  public Deque<E> toList() {
    return inner.copy();
  }

  /**
   * Returns the values in the order they would be popped.
   */
  public Object[] toArray() {
    return inner.toArray();
  }

  @Override
  public Iterator<E> iterator() {
    return new Iterator<E>() {
      @Override
      public boolean hasNext() {
        return !inner.isEmpty();
      }

      @Override
      public E next() {
        if (inner.isEmpty()) {
          throw new NoSuchElementException();
        }
        return inner.shift();
      }
    };
  }

  @Override
  public String toString() {
    return inner.toString();
  }
}
