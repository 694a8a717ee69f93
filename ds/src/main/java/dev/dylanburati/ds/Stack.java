package dev.dylanburati.ds;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Last-in, first-out collection backed by a {@link Vector}.
 *
 * <p><b>Iteration is destructive</b>: each step of {@link #iterator()} pops
 * the top value. Use {@link #toList()} to read the values without removing
 * them.
 */
public class Stack<E> implements Iterable<E>, Allocated {
  private final Vector<E> inner;

  public Stack() {
    this.inner = new Vector<>();
  }

  public Stack(int initialCapacity) {
    this.inner = new Vector<>(initialCapacity);
  }

  /**
   * Pushes the values in order, so the last one ends up on top.
   */
  public Stack(Iterable<? extends E> values) {
    this.inner = new Vector<>(values);
  }

  private Stack(final Vector<E> inner) {
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
   * @throws UnderflowException if the stack is empty
   */
  public E pop() {
    return inner.pop();
  }

  /**
   * @throws UnderflowException if the stack is empty
   */
  public E peek() {
    return inner.last();
  }

  public Stack<E> copy() {
    return new Stack<>(inner.copy());
  }

  /**
   * Returns the values in the order they would be popped, top first.
   */
  public Vector<E> toList() {
    return inner.reversed();
  }

  /**
   * Returns the values in the order they would be popped.
   */
  public Object[] toArray() {
    return this.toList().toArray();
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
        return inner.pop();
      }
    };
  }

  @Override
  public String toString() {
    return this.toList().toString();
  }
}
