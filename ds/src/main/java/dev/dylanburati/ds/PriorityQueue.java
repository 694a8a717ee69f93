package dev.dylanburati.ds;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Binary max-heap of values with integer priorities. Values with equal
 * priority are popped in the order they were pushed.
 *
 * <p><b>Iteration is destructive</b>: each step of {@link #iterator()} pops
 * the value with the highest priority, so iterating to the end leaves the
 * queue empty. Use {@link #toList()} to read the values in priority order
 * without removing them.
 */
public class PriorityQueue<E> implements Iterable<E>, Allocated {
  static final CapacityPolicy POLICY = CapacityPolicy.squared(8);

  // INVARIANT 0: values.length == priorities.length == stamps.length == capacity
  // INVARIANT 1: for every i in [1, size), node i does not rank above node (i - 1) / 2
  private Object[] values;
  private int[] priorities;
  private long[] stamps;
  private int size;
  private long stamp;

  public PriorityQueue() {
    this(0);
  }

  public PriorityQueue(int initialCapacity) {
    int cap = POLICY.initial(initialCapacity);
    this.values = new Object[cap];
    this.priorities = new int[cap];
    this.stamps = new long[cap];
    this.size = 0;
    this.stamp = 0;
  }

  private PriorityQueue(final PriorityQueue<E> src) {
    // copy constructor, the stamp is kept so ties still resolve in push order
    this.values = src.values.clone();
    this.priorities = src.priorities.clone();
    this.stamps = src.stamps.clone();
    this.size = src.size;
    this.stamp = src.stamp;
  }

  @SuppressWarnings("unchecked")
  private static <E> E castUnsafe(Object v) {
    return (E) v;
  }

  public int size() {
    return this.size;
  }

  public boolean isEmpty() {
    return this.size == 0;
  }

  @Override
  public int capacity() {
    return this.values.length;
  }

  @Override
  public void allocate(int capacity) {
    int cap = POLICY.allocate(this.values.length, capacity);
    if (cap != this.values.length) {
      this.setCapacity(cap);
    }
  }

  public void clear() {
    int cap = POLICY.minimum();
    this.values = new Object[cap];
    this.priorities = new int[cap];
    this.stamps = new long[cap];
    this.size = 0;
    this.stamp = 0;
  }

  /**
   * Creates a copy with separate storage. Values are shared.
   */
  public PriorityQueue<E> copy() {
    return new PriorityQueue<>(this);
  }

  /**
   * Returns the value with the highest priority without removing it.
   *
   * @throws UnderflowException if the queue is empty
   */
  public E peek() {
    if (this.size == 0) {
      throw new UnderflowException();
    }
    return castUnsafe(this.values[0]);
  }

  public void push(E value, int priority) {
    int cap = POLICY.grow(this.values.length, this.size + 1);
    if (cap != this.values.length) {
      this.setCapacity(cap);
    }
    int leaf = this.size++;
    this.values[leaf] = value;
    this.priorities[leaf] = priority;
    this.stamps[leaf] = this.stamp++;
    this.siftUp(leaf);
  }

  /**
   * Removes and returns the value with the highest priority.
   *
   * @throws UnderflowException if the queue is empty
   */
  public E pop() {
    if (this.size == 0) {
      throw new UnderflowException();
    }
    E result = castUnsafe(this.values[0]);
    int last = --this.size;
    this.values[0] = this.values[last];
    this.priorities[0] = this.priorities[last];
    this.stamps[0] = this.stamps[last];
    this.values[last] = null;
    this.siftDown(0);

    int cap = POLICY.shrink(this.values.length, this.size);
    if (cap != this.values.length) {
      this.setCapacity(cap);
    }
    return result;
  }

  /**
   * Returns the values in the order they would be popped, leaving the queue
   * unchanged.
   */
  public Vector<E> toList() {
    PriorityQueue<E> drained = this.copy();
    Vector<E> result = new Vector<>(this.size);
    while (!drained.isEmpty()) {
      result.push(drained.pop());
    }
    return result;
  }

  /**
   * Returns the values in the order they would be popped.
   */
  public Object[] toArray() {
    return this.toList().toArray();
  }

  /**
   * Pops values until the queue is empty. See the class documentation.
   */
  @Override
  public Iterator<E> iterator() {
    return new Iterator<E>() {
      @Override
      public boolean hasNext() {
        return !PriorityQueue.this.isEmpty();
      }

      @Override
      public E next() {
        if (PriorityQueue.this.isEmpty()) {
          throw new NoSuchElementException();
        }
        return PriorityQueue.this.pop();
      }
    };
  }

  @Override
  public String toString() {
    return this.toList().toString();
  }

  /**
   * Positive if node a ranks above node b: higher priority first, then
   * earlier stamp.
   */
  private int compare(int a, int b) {
    int c = Integer.compare(this.priorities[a], this.priorities[b]);
    if (c != 0) {
      return c;
    }
    return Long.compare(this.stamps[b], this.stamps[a]);
  }

  private void siftUp(int leaf) {
    while (leaf > 0) {
      int parent = (leaf - 1) >>> 1;
      if (this.compare(leaf, parent) < 0) {
        return;
      }
      this.swap(leaf, parent);
      leaf = parent;
    }
  }

  private void siftDown(int node) {
    while (true) {
      int left = (node << 1) + 1;
      if (left >= this.size) {
        return;
      }
      int right = left + 1;
      int largest = left;
      if (right < this.size && this.compare(right, left) > 0) {
        largest = right;
      }
      if (this.compare(largest, node) <= 0) {
        return;
      }
      this.swap(node, largest);
      node = largest;
    }
  }

  private void swap(int a, int b) {
    Object value = this.values[a];
    this.values[a] = this.values[b];
    this.values[b] = value;

    int priority = this.priorities[a];
    this.priorities[a] = this.priorities[b];
    this.priorities[b] = priority;

    long s = this.stamps[a];
    this.stamps[a] = this.stamps[b];
    this.stamps[b] = s;
  }

  private void setCapacity(int cap) {
    Object[] nextValues = new Object[cap];
    int[] nextPriorities = new int[cap];
    long[] nextStamps = new long[cap];
    System.arraycopy(this.values, 0, nextValues, 0, this.size);
    System.arraycopy(this.priorities, 0, nextPriorities, 0, this.size);
    System.arraycopy(this.stamps, 0, nextStamps, 0, this.size);
    this.values = nextValues;
    this.priorities = nextPriorities;
    this.stamps = nextStamps;
  }
}
