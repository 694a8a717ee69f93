package dev.dylanburati.ds;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.Objects;
import java.util.RandomAccess;
import java.util.StringJoiner;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Sequence backed by a ring buffer whose length is the capacity reported to
 * the user. Additions and removals at either end are amortized O(1);
 * positional insertion and removal move whichever side of the index is
 * shorter.
 *
 * @param <S> the concrete sequence type, returned from copying operations
 */
public abstract class AbstractSequence<E, S extends AbstractSequence<E, S>> extends AbstractList<E>
    implements Sequence<E>, RandomAccess {
  private final CapacityPolicy policy;
  // INVARIANT 0: buffer.length is a capacity produced by policy
  // INVARIANT 1: 0 <= size <= buffer.length, 0 <= head < buffer.length
  // INVARIANT 2: slots outside of the logical range are null
  private Object[] buffer;
  private int head;
  private int size;

  protected AbstractSequence(final CapacityPolicy policy, int initialCapacity) {
    this.policy = Objects.requireNonNull(policy);
    this.buffer = new Object[policy.initial(initialCapacity)];
    this.head = 0;
    this.size = 0;
  }

  /**
   * Takes ownership of {@code buffer}, whose first {@code size} slots hold the
   * values. The buffer length must be a capacity produced by {@code policy}.
   */
  protected AbstractSequence(final CapacityPolicy policy, Object[] buffer, int size) {
    this.policy = Objects.requireNonNull(policy);
    if (size < 0 || size > buffer.length || buffer.length < policy.minimum()) {
      throw new IllegalArgumentException("buffer does not fit size");
    }
    this.buffer = buffer;
    this.head = 0;
    this.size = size;
  }

  /**
   * Creates a sequence of the concrete type from a buffer built by this one.
   */
  protected abstract S rebuild(Object[] buffer, int size);

  @SuppressWarnings("unchecked")
  private static <E> E castUnsafe(Object v) {
    return (E) v;
  }

  private int physical(int index) {
    int p = this.head + index;
    return p < this.buffer.length ? p : p - this.buffer.length;
  }

  private void checkRange(int index) {
    if (index < 0 || index >= this.size) {
      throw new IndexOutOfBoundsException("index " + index + " out of range [0, " + this.size + ")");
    }
  }

  private void ensureCapacity(int required) {
    int cap = this.policy.grow(this.buffer.length, required);
    if (cap != this.buffer.length) {
      this.setCapacity(cap);
    }
  }

  // called after every removal
  private void maybeShrink() {
    int cap = this.policy.shrink(this.buffer.length, this.size);
    if (cap != this.buffer.length) {
      this.setCapacity(cap);
    }
  }

  private void setCapacity(int cap) {
    this.buffer = this.copyValues(cap);
    this.head = 0;
  }

  // values in logical order, in a new array of the given length
  private Object[] copyValues(int length) {
    Object[] dst = new Object[length];
    int firstPart = Math.min(this.size, this.buffer.length - this.head);
    System.arraycopy(this.buffer, this.head, dst, 0, firstPart);
    System.arraycopy(this.buffer, 0, dst, firstPart, this.size - firstPart);
    return dst;
  }

  private S rebuildFrom(Object[] values, int count) {
    Object[] dst = new Object[this.policy.initial(count)];
    System.arraycopy(values, 0, dst, 0, count);
    return this.rebuild(dst, count);
  }

  @Override
  public int size() {
    return this.size;
  }

  @Override
  public boolean isEmpty() {
    return this.size == 0;
  }

  @Override
  public int capacity() {
    return this.buffer.length;
  }

  @Override
  public void allocate(int capacity) {
    int cap = this.policy.allocate(this.buffer.length, capacity);
    if (cap != this.buffer.length) {
      this.setCapacity(cap);
    }
  }

  @Override
  public void clear() {
    this.buffer = new Object[this.policy.minimum()];
    this.head = 0;
    this.size = 0;
    this.modCount++;
  }

  @Override
  public E get(int index) {
    this.checkRange(index);
    return castUnsafe(this.buffer[this.physical(index)]);
  }

  @Override
  public E set(int index, E value) {
    this.checkRange(index);
    int p = this.physical(index);
    E prev = castUnsafe(this.buffer[p]);
    this.buffer[p] = value;
    return prev;
  }

  @Override
  public E first() {
    if (this.size == 0) {
      throw new UnderflowException();
    }
    return castUnsafe(this.buffer[this.head]);
  }

  @Override
  public E last() {
    if (this.size == 0) {
      throw new UnderflowException();
    }
    return castUnsafe(this.buffer[this.physical(this.size - 1)]);
  }

  @Override
  public boolean add(E value) {
    this.pushImpl(new Object[]{value}, 1);
    return true;
  }

  @Override
  public void add(int index, E value) {
    this.insertImpl(index, new Object[]{value}, 1);
  }

  @Override
  public boolean addAll(Collection<? extends E> values) {
    Object[] arr = values.toArray();
    this.pushImpl(arr, arr.length);
    return arr.length > 0;
  }

  @SafeVarargs
  @Override
  public final void push(E... values) {
    this.pushImpl(values, values.length);
  }

  @Override
  public void pushAll(Iterable<? extends E> values) {
    if (values == null) {
      throw new IllegalArgumentException("expected iterable values");
    }
    if (values instanceof Collection<?>) {
      Object[] arr = ((Collection<?>) values).toArray();
      this.pushImpl(arr, arr.length);
      return;
    }
    for (E v : values) {
      this.pushImpl(new Object[]{v}, 1);
    }
  }

  private void pushImpl(Object[] values, int count) {
    if (count == 0) {
      return;
    }
    this.ensureCapacity(this.size + count);
    for (int i = 0; i < count; i++) {
      this.buffer[this.physical(this.size)] = values[i];
      this.size++;
    }
    this.modCount++;
  }

  @Override
  public E pop() {
    if (this.size == 0) {
      throw new UnderflowException();
    }
    int p = this.physical(this.size - 1);
    E value = castUnsafe(this.buffer[p]);
    this.buffer[p] = null;
    this.size--;
    this.modCount++;
    this.maybeShrink();
    return value;
  }

  @SafeVarargs
  @Override
  public final void unshift(E... values) {
    if (values.length == 0) {
      return;
    }
    this.ensureCapacity(this.size + values.length);
    for (int i = values.length - 1; i >= 0; i--) {
      this.head = this.head == 0 ? this.buffer.length - 1 : this.head - 1;
      this.buffer[this.head] = values[i];
      this.size++;
    }
    this.modCount++;
  }

  @Override
  public E shift() {
    if (this.size == 0) {
      throw new UnderflowException();
    }
    E value = castUnsafe(this.buffer[this.head]);
    this.buffer[this.head] = null;
    this.head = this.physical(1);
    this.size--;
    if (this.size == 0) {
      this.head = 0;
    }
    this.modCount++;
    this.maybeShrink();
    return value;
  }

  @SafeVarargs
  @Override
  public final void insert(int index, E... values) {
    this.insertImpl(index, values, values.length);
  }

  private void insertImpl(int index, Object[] values, int count) {
    if (index < 0 || index > this.size) {
      throw new IndexOutOfBoundsException("index " + index + " out of range [0, " + this.size + "]");
    }
    if (count == 0) {
      return;
    }
    this.ensureCapacity(this.size + count);
    int len = this.buffer.length;
    if (index < this.size / 2) {
      // move the leading values left
      int newHead = this.head - count;
      if (newHead < 0) {
        newHead += len;
      }
      for (int i = 0; i < index; i++) {
        int dst = newHead + i;
        this.buffer[dst < len ? dst : dst - len] = this.buffer[this.physical(i)];
      }
      this.head = newHead;
    } else {
      // move the trailing values right
      for (int i = this.size - 1; i >= index; i--) {
        this.buffer[this.physical(i + count)] = this.buffer[this.physical(i)];
      }
    }
    for (int i = 0; i < count; i++) {
      this.buffer[this.physical(index + i)] = values[i];
    }
    this.size += count;
    this.modCount++;
  }

  @Override
  public E remove(int index) {
    this.checkRange(index);
    E value = castUnsafe(this.buffer[this.physical(index)]);
    if (index < this.size / 2) {
      for (int i = index; i > 0; i--) {
        this.buffer[this.physical(i)] = this.buffer[this.physical(i - 1)];
      }
      this.buffer[this.head] = null;
      this.head = this.physical(1);
    } else {
      for (int i = index; i < this.size - 1; i++) {
        this.buffer[this.physical(i)] = this.buffer[this.physical(i + 1)];
      }
      this.buffer[this.physical(this.size - 1)] = null;
    }
    this.size--;
    if (this.size == 0) {
      this.head = 0;
    }
    this.modCount++;
    this.maybeShrink();
    return value;
  }

  @Override
  public void rotate(int rotations) {
    if (this.size < 2) {
      return;
    }
    int r = Math.floorMod(rotations, this.size);
    if (r > 0) {
      this.reverseRange(0, r);
      this.reverseRange(r, this.size);
      this.reverseRange(0, this.size);
    }
  }

  // reverses logical indices [from, to)
  private void reverseRange(int from, int to) {
    for (int a = from, b = to - 1; a < b; a++, b--) {
      int pa = this.physical(a);
      int pb = this.physical(b);
      Object tmp = this.buffer[pa];
      this.buffer[pa] = this.buffer[pb];
      this.buffer[pb] = tmp;
    }
  }

  @Override
  public void reverse() {
    this.reverseRange(0, this.size);
  }

  @Override
  public S reversed() {
    S result = this.copy();
    result.reverse();
    return result;
  }

  @Override
  public void sort(Comparator<? super E> comparator) {
    Object[] values = this.copyValues(this.buffer.length);
    Comparator<Object> c = castUnsafe(comparator);
    // stable for both natural and comparator ordering
    Arrays.sort(values, 0, this.size, c);
    this.buffer = values;
    this.head = 0;
    this.modCount++;
  }

  @Override
  public S sorted(Comparator<? super E> comparator) {
    S result = this.copy();
    result.sort(comparator);
    return result;
  }

  @Override
  public S slice(int offset) {
    return this.slice(offset, this.size);
  }

  @Override
  public S slice(int offset, int length) {
    int start = offset < 0 ? Math.max(0, this.size + offset) : Math.min(offset, this.size);
    int end;
    if (length < 0) {
      end = this.size + length;
    } else {
      end = (int) Math.min((long) start + length, this.size);
    }
    int count = Math.max(0, end - start);
    Object[] dst = new Object[this.policy.initial(count)];
    for (int i = 0; i < count; i++) {
      dst[i] = this.buffer[this.physical(start + i)];
    }
    return this.rebuild(dst, count);
  }

  @Override
  public void apply(UnaryOperator<E> callback) {
    Objects.requireNonNull(callback);
    for (int i = 0; i < this.size; i++) {
      int p = this.physical(i);
      this.buffer[p] = callback.apply(castUnsafe(this.buffer[p]));
    }
  }

  @Override
  public S filter(Predicate<? super E> predicate) {
    Objects.requireNonNull(predicate);
    Object[] kept = new Object[this.size];
    int count = 0;
    for (int i = 0; i < this.size; i++) {
      Object v = this.buffer[this.physical(i)];
      if (predicate.test(castUnsafe(v))) {
        kept[count++] = v;
      }
    }
    return this.rebuildFrom(kept, count);
  }

  /**
   * Applies {@code callback} to each value, returning a new buffer sized for
   * this sequence's policy.
   */
  protected Object[] mappedValues(Function<? super E, ?> callback) {
    Objects.requireNonNull(callback);
    Object[] dst = new Object[this.policy.initial(this.size)];
    for (int i = 0; i < this.size; i++) {
      dst[i] = callback.apply(castUnsafe(this.buffer[this.physical(i)]));
    }
    return dst;
  }

  @Override
  public <R> R reduce(BiFunction<R, ? super E, R> callback, R initial) {
    Objects.requireNonNull(callback);
    R carry = initial;
    for (int i = 0; i < this.size; i++) {
      carry = callback.apply(carry, castUnsafe(this.buffer[this.physical(i)]));
    }
    return carry;
  }

  @Override
  public S merge(Iterable<? extends E> values) {
    S merged = this.copy();
    merged.pushAll(values);
    return merged;
  }

  @Override
  public int find(Object value) {
    return this.indexOf(value);
  }

  @Override
  public boolean containsAll(Object... values) {
    if (values.length == 0) {
      return false;
    }
    for (Object v : values) {
      if (this.indexOf(v) < 0) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int indexOf(Object value) {
    for (int i = 0; i < this.size; i++) {
      if (Objects.equals(value, this.buffer[this.physical(i)])) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public String join() {
    return this.join("");
  }

  @Override
  public String join(String glue) {
    StringJoiner joiner = new StringJoiner(glue == null ? "" : glue);
    for (int i = 0; i < this.size; i++) {
      joiner.add(String.valueOf(this.buffer[this.physical(i)]));
    }
    return joiner.toString();
  }

  @Override
  public Number sum() {
    long integral = 0;
    double real = 0;
    boolean isIntegral = true;
    for (int i = 0; i < this.size; i++) {
      Object v = this.buffer[this.physical(i)];
      if (!(v instanceof Number)) {
        throw new IllegalArgumentException("not a number: " + v);
      }
      Number n = (Number) v;
      if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
        integral += n.longValue();
      } else {
        isIntegral = false;
        real += n.doubleValue();
      }
    }
    if (isIntegral) {
      return integral;
    }
    return real + integral;
  }

  @Override
  public S copy() {
    return this.rebuild(this.copyValues(this.buffer.length), this.size);
  }

  @Override
  public Object[] toArray() {
    return this.copyValues(this.size);
  }
}
