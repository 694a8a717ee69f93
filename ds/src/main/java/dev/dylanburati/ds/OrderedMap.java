package dev.dylanburati.ds;

import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Hash map which iterates in insertion order.
 *
 * Entries are stored in parallel arrays in the order they were inserted, and
 * an open-addressed {@code int[]} index maps each key's hash to its entry
 * position. Putting an existing key replaces its value without moving it;
 * removing a key leaves a gap in the entry arrays, so the order of the other
 * entries is kept and removal is O(1) on average. Gaps are reclaimed whenever
 * the entry arrays fill up or the capacity changes.
 *
 * Key equality and hashing are delegated to a {@link Hasher}. With the
 * default hasher, {@link Hashable} keys are compared with their own
 * {@code equals} and placed using {@link Hashable#hash()}; other keys use
 * {@link Objects#equals} and {@link Objects#hashCode}.
 *
 * Iterators fail with {@link ConcurrentModificationException} if the storage
 * was reorganized after they were created (by growth, shrinking, sorting, or
 * reversal). Removing through an iterator only reorganizes the storage once
 * that iterator is exhausted, when the capacity is shrunk to fit.
 */
public class OrderedMap<K, V> implements Iterable<Pair<K, V>>, Allocated {
  static final CapacityPolicy POLICY = CapacityPolicy.squared(8);
  private static final Object DELETED = new Object();
  private static final int EMPTY = 0;
  private static final int TOMBSTONE = -1;

  private final Hasher hasher;
  private int capacity;
  // INVARIANT 0: capacity is produced by POLICY, and size <= capacity
  // INVARIANT 1: keys.length == values.length == hashes.length == 2 * capacity
  // INVARIANT 2: index.length == 2 * keys.length
  private Object[] keys;
  private Object[] values;
  private int[] hashes;
  private int[] index;

  // INVARIANT 3:
  //  3A: positions >= used hold no entry; positions < used hold a live entry or DELETED
  //  3B: size == count [p | p < used, keys[p] != DELETED]
  //  3C: each live position p is stored exactly once in index, as p + 1; no DELETED position is
  //  3D: count [s | s in index, s != EMPTY] <= used, so the index is at most half full
  //  3E: if size > 0, start is the first live position and tail - 1 the last;
  //      otherwise start == tail. Both are in [0, used]
  private int used;
  private int size;
  private int start;
  private int tail;
  private int rehashCount;

  public OrderedMap() {
    this(0);
  }

  public OrderedMap(int initialCapacity) {
    this(initialCapacity, DefaultHasher.instance());
  }

  public OrderedMap(int initialCapacity, final Hasher hasher) {
    this.hasher = Objects.requireNonNull(hasher);
    this.capacity = POLICY.initial(initialCapacity);
    this.resetStorage();
  }

  public OrderedMap(Map<? extends K, ? extends V> values) {
    this(values.size());
    this.putAll(values);
  }

  private OrderedMap(final OrderedMap<K, V> src) {
    // copy constructor, storage is duplicated as-is
    this.hasher = src.hasher;
    this.capacity = src.capacity;
    this.keys = src.keys.clone();
    this.values = src.values.clone();
    this.hashes = src.hashes.clone();
    this.index = src.index.clone();
    this.used = src.used;
    this.size = src.size;
    this.start = src.start;
    this.tail = src.tail;
  }

  private void resetStorage() {
    int len = 2 * this.capacity;
    // INVARIANT 1, 2 upheld
    this.keys = new Object[len];
    this.values = new Object[len];
    this.hashes = new int[len];
    this.index = new int[2 * len];
    // INVARIANT 3 upheld, index is all zeroes
    this.used = 0;
    this.size = 0;
    this.start = 0;
    this.tail = 0;
  }

  @SuppressWarnings("unchecked")
  private static <T> T castUnsafe(Object v) {
    return (T) v;
  }

  @SuppressWarnings("unchecked")
  private static int compareNatural(Object a, Object b) {
    return ((Comparable<Object>) a).compareTo(b);
  }

  private int hashOf(Object key) {
    int h = this.hasher.hash(key);
    return h ^ (h >>> 16);
  }

  public Hasher hasher() {
    return this.hasher;
  }

  public int size() {
    return this.size;
  }

  public boolean isEmpty() {
    return this.size == 0;
  }

  @Override
  public int capacity() {
    return this.capacity;
  }

  @Override
  public void allocate(int capacity) {
    int cap = POLICY.allocate(this.capacity, capacity);
    if (cap != this.capacity) {
      this.setCapacity(cap);
    }
  }

  public void clear() {
    this.capacity = POLICY.minimum();
    this.resetStorage();
    this.rehashCount++;
  }

  public boolean hasKey(Object key) {
    return this.readIndex(this.hashOf(key), key) >= 0;
  }

  /**
   * Returns true if at least one key was given and all of them are present.
   */
  public boolean containsKeys(Object... keys) {
    if (keys.length == 0) {
      return false;
    }
    for (Object key : keys) {
      if (!this.hasKey(key)) {
        return false;
      }
    }
    return true;
  }

  public boolean hasValue(Object value) {
    for (int p = this.start; p < this.tail; p++) {
      if (this.keys[p] != DELETED && Objects.equals(this.values[p], value)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns true if at least one value was given and all of them are present.
   */
  public boolean containsValues(Object... values) {
    if (values.length == 0) {
      return false;
    }
    for (Object value : values) {
      if (!this.hasValue(value)) {
        return false;
      }
    }
    return true;
  }

  /**
   * @throws KeyNotFoundException if the key is not present
   */
  public V get(Object key) {
    int slot = this.readIndex(this.hashOf(key), key);
    if (slot < 0) {
      throw new KeyNotFoundException(key);
    }
    return castUnsafe(this.values[this.index[slot] - 1]);
  }

  /**
   * Returns the value for the key, or {@code defaultValue} (which may be null)
   * if it is not present.
   */
  public V get(Object key, V defaultValue) {
    int slot = this.readIndex(this.hashOf(key), key);
    if (slot < 0) {
      return defaultValue;
    }
    return castUnsafe(this.values[this.index[slot] - 1]);
  }

  /**
   * Associates the key with the value. An existing key keeps its position.
   */
  public void put(K key, V value) {
    this.putImpl(key, value);
  }

  // returns the previous value, or null
  private V putImpl(K key, V value) {
    int hash = this.hashOf(key);
    int slot = this.readIndex(hash, key);
    if (slot >= 0) {
      int pos = this.index[slot] - 1;
      V prev = castUnsafe(this.values[pos]);
      this.values[pos] = value;
      return prev;
    }
    this.insertBySlot(-slot - 1, hash, key, value);
    return null;
  }

  public void putAll(OrderedMap<? extends K, ? extends V> other) {
    for (int p = other.start; p < other.tail; p++) {
      if (other.keys[p] != DELETED) {
        this.put(castUnsafe(other.keys[p]), castUnsafe(other.values[p]));
      }
    }
  }

  public void putAll(Map<? extends K, ? extends V> other) {
    for (Map.Entry<? extends K, ? extends V> e : other.entrySet()) {
      this.put(e.getKey(), e.getValue());
    }
  }

  /**
   * Replaces the value for an existing key with the result of {@code function}.
   *
   * @return the new value
   * @throws KeyNotFoundException if the key is not present
   */
  public V update(Object key, Function<? super V, ? extends V> function) {
    Objects.requireNonNull(function);
    int slot = this.readIndex(this.hashOf(key), key);
    if (slot < 0) {
      throw new KeyNotFoundException(key);
    }
    int pos = this.index[slot] - 1;
    V result = function.apply(castUnsafe(this.values[pos]));
    this.values[pos] = result;
    return result;
  }

  /**
   * Replaces every value with the result of {@code function}, in order.
   */
  public void apply(BiFunction<? super K, ? super V, ? extends V> function) {
    Objects.requireNonNull(function);
    for (int p = this.start; p < this.tail; p++) {
      if (this.keys[p] != DELETED) {
        this.values[p] = function.apply(castUnsafe(this.keys[p]), castUnsafe(this.values[p]));
      }
    }
  }

  /**
   * Removes the key and returns its value.
   *
   * @throws KeyNotFoundException if the key is not present
   */
  public V remove(Object key) {
    int slot = this.readIndex(this.hashOf(key), key);
    if (slot < 0) {
      throw new KeyNotFoundException(key);
    }
    return this.removeBySlot(slot, true);
  }

  /**
   * Removes the key and returns its value, or {@code defaultValue} (which may
   * be null) if it is not present.
   */
  public V remove(Object key, V defaultValue) {
    int slot = this.readIndex(this.hashOf(key), key);
    if (slot < 0) {
      return defaultValue;
    }
    return this.removeBySlot(slot, true);
  }

  public void removeAll(Iterable<?> keys) {
    for (Object key : keys) {
      this.remove(key, null);
    }
  }

  /**
   * @throws UnderflowException if the map is empty
   */
  public Pair<K, V> first() {
    if (this.size == 0) {
      throw new UnderflowException();
    }
    return this.pairAt(this.start);
  }

  /**
   * @throws UnderflowException if the map is empty
   */
  public Pair<K, V> last() {
    if (this.size == 0) {
      throw new UnderflowException();
    }
    return this.pairAt(this.tail - 1);
  }

  /**
   * Returns a copy of the pair at {@code position} in iteration order.
   *
   * @throws IndexOutOfBoundsException if the position is not in {@code [0, size)}
   */
  public Pair<K, V> skip(int position) {
    return this.pairAt(this.positionOf(position));
  }

  /* package-private */ K keyAt(int position) {
    return castUnsafe(this.keys[this.positionOf(position)]);
  }

  private Pair<K, V> pairAt(int pos) {
    return new Pair<>(castUnsafe(this.keys[pos]), castUnsafe(this.values[pos]));
  }

  // entry position of the n-th live entry
  private int positionOf(int ordinal) {
    if (ordinal < 0 || ordinal >= this.size) {
      throw new IndexOutOfBoundsException("position " + ordinal + " out of range [0, " + this.size + ")");
    }
    if (this.tail - this.start == this.size) {
      return this.start + ordinal;
    }
    if (ordinal >= this.size / 2) {
      int remaining = this.size - 1 - ordinal;
      for (int p = this.tail - 1; ; p--) {
        if (this.keys[p] != DELETED && remaining-- == 0) {
          return p;
        }
      }
    }
    int remaining = ordinal;
    for (int p = this.start; ; p++) {
      if (this.keys[p] != DELETED && remaining-- == 0) {
        return p;
      }
    }
  }

  /**
   * Returns a new map with this map's entries followed by the other map's,
   * where entries of the other map replace values of equal keys in place.
   */
  public OrderedMap<K, V> merge(OrderedMap<? extends K, ? extends V> other) {
    OrderedMap<K, V> merged = this.copy();
    merged.putAll(other);
    return merged;
  }

  public OrderedMap<K, V> merge(Map<? extends K, ? extends V> other) {
    OrderedMap<K, V> merged = this.copy();
    merged.putAll(other);
    return merged;
  }

  public OrderedMap<K, V> union(OrderedMap<? extends K, ? extends V> other) {
    return this.merge(other);
  }

  /**
   * Returns the entries of this map whose keys are also in {@code other}.
   */
  public OrderedMap<K, V> intersect(OrderedMap<?, ?> other) {
    return this.filter((k, v) -> other.hasKey(k));
  }

  /**
   * Returns the entries of this map whose keys are not in {@code other}.
   */
  public OrderedMap<K, V> diff(OrderedMap<?, ?> other) {
    return this.filter((k, v) -> !other.hasKey(k));
  }

  /**
   * Returns the entries whose keys are in exactly one of the two maps, this
   * map's first.
   */
  public OrderedMap<K, V> xor(OrderedMap<? extends K, ? extends V> other) {
    OrderedMap<K, V> result = new OrderedMap<>(0, this.hasher);
    for (int p = this.start; p < this.tail; p++) {
      if (this.keys[p] != DELETED && !other.hasKey(this.keys[p])) {
        result.put(castUnsafe(this.keys[p]), castUnsafe(this.values[p]));
      }
    }
    for (int p = other.start; p < other.tail; p++) {
      if (other.keys[p] != DELETED && !this.hasKey(other.keys[p])) {
        result.put(castUnsafe(other.keys[p]), castUnsafe(other.values[p]));
      }
    }
    return result;
  }

  public OrderedMap<K, V> filter(BiPredicate<? super K, ? super V> predicate) {
    Objects.requireNonNull(predicate);
    OrderedMap<K, V> result = new OrderedMap<>(0, this.hasher);
    for (int p = this.start; p < this.tail; p++) {
      if (this.keys[p] != DELETED) {
        K k = castUnsafe(this.keys[p]);
        V v = castUnsafe(this.values[p]);
        if (predicate.test(k, v)) {
          result.put(k, v);
        }
      }
    }
    return result;
  }

  public <R> OrderedMap<K, R> map(BiFunction<? super K, ? super V, ? extends R> function) {
    Objects.requireNonNull(function);
    OrderedMap<K, R> result = new OrderedMap<>(this.size, this.hasher);
    for (int p = this.start; p < this.tail; p++) {
      if (this.keys[p] != DELETED) {
        K k = castUnsafe(this.keys[p]);
        result.put(k, function.apply(k, castUnsafe(this.values[p])));
      }
    }
    return result;
  }

  public <R> R reduce(BiFunction<R, ? super Pair<K, V>, R> callback, R initial) {
    Objects.requireNonNull(callback);
    R carry = initial;
    for (int p = this.start; p < this.tail; p++) {
      if (this.keys[p] != DELETED) {
        carry = callback.apply(carry, this.pairAt(p));
      }
    }
    return carry;
  }

  public void forEach(BiConsumer<? super K, ? super V> action) {
    Objects.requireNonNull(action);
    for (int p = this.start; p < this.tail; p++) {
      if (this.keys[p] != DELETED) {
        action.accept(castUnsafe(this.keys[p]), castUnsafe(this.values[p]));
      }
    }
  }

  /**
   * Sorts the entries by value, in place. A null comparator sorts by natural
   * ordering. Entries with equal values keep their relative order.
   */
  public void sort(Comparator<? super V> comparator) {
    Comparator<Object> c = comparator == null ? OrderedMap::compareNatural : castUnsafe(comparator);
    this.reorder((a, b) -> c.compare(this.values[a], this.values[b]));
  }

  /**
   * Sorts the entries by key, in place. A null comparator sorts by natural
   * ordering.
   */
  public void ksort(Comparator<? super K> comparator) {
    Comparator<Object> c = comparator == null ? OrderedMap::compareNatural : castUnsafe(comparator);
    this.reorder((a, b) -> c.compare(this.keys[a], this.keys[b]));
  }

  public OrderedMap<K, V> sorted(Comparator<? super V> comparator) {
    OrderedMap<K, V> result = this.copy();
    result.sort(comparator);
    return result;
  }

  public OrderedMap<K, V> ksorted(Comparator<? super K> comparator) {
    OrderedMap<K, V> result = this.copy();
    result.ksort(comparator);
    return result;
  }

  public void reverse() {
    this.reorder((a, b) -> Integer.compare(b, a));
  }

  public OrderedMap<K, V> reversed() {
    OrderedMap<K, V> result = this.copy();
    result.reverse();
    return result;
  }

  public OrderedMap<K, V> slice(int offset) {
    return this.slice(offset, this.size);
  }

  /**
   * Returns up to {@code length} entries starting at {@code offset}. A negative
   * offset starts that far from the end, and a negative length stops that many
   * entries from the end.
   */
  public OrderedMap<K, V> slice(int offset, int length) {
    int from = offset < 0 ? Math.max(0, this.size + offset) : Math.min(offset, this.size);
    int to;
    if (length < 0) {
      to = this.size + length;
    } else {
      to = (int) Math.min((long) from + length, this.size);
    }
    OrderedMap<K, V> result = new OrderedMap<>(Math.max(0, to - from), this.hasher);
    int ordinal = 0;
    for (int p = this.start; p < this.tail && ordinal < to; p++) {
      if (this.keys[p] != DELETED) {
        if (ordinal >= from) {
          result.put(castUnsafe(this.keys[p]), castUnsafe(this.values[p]));
        }
        ordinal++;
      }
    }
    return result;
  }

  public OrderedSet<K> keys() {
    OrderedSet<K> result = new OrderedSet<>(this.size, this.hasher);
    for (int p = this.start; p < this.tail; p++) {
      if (this.keys[p] != DELETED) {
        result.add(OrderedMap.<K>castUnsafe(this.keys[p]));
      }
    }
    return result;
  }

  public Vector<V> values() {
    Vector<V> result = new Vector<>(this.size);
    for (int p = this.start; p < this.tail; p++) {
      if (this.keys[p] != DELETED) {
        V v = castUnsafe(this.values[p]);
        result.push(v);
      }
    }
    return result;
  }

  /**
   * Returns copies of all pairs, in order.
   */
  public Vector<Pair<K, V>> pairs() {
    Vector<Pair<K, V>> result = new Vector<>(this.size);
    for (int p = this.start; p < this.tail; p++) {
      if (this.keys[p] != DELETED) {
        result.push(this.pairAt(p));
      }
    }
    return result;
  }

  public Number sum() {
    return this.values().sum();
  }

  /**
   * Creates a copy with separate storage. Keys and values are shared.
   */
  public OrderedMap<K, V> copy() {
    return new OrderedMap<>(this);
  }

  /**
   * Returns a snapshot of this map's entries, in order.
   */
  public LinkedHashMap<K, V> toJavaMap() {
    LinkedHashMap<K, V> result = new LinkedHashMap<>();
    this.forEach((k, v) -> result.put(k, v));
    return result;
  }

  /**
   * Returns a live {@link Map} view. Lookups on the view return null for
   * missing keys, as {@code java.util} maps do.
   */
  public Map<K, V> asJavaMap() {
    return new JavaMapView<>(this);
  }

  /**
   * Iterates over copies of the pairs, in order.
   */
  @Override
  public Iterator<Pair<K, V>> iterator() {
    return new PairIterator<>(this);
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof OrderedMap<?, ?>)) {
      return false;
    }
    OrderedMap<?, ?> other = (OrderedMap<?, ?>) o;
    if (other.size != this.size) {
      return false;
    }
    for (int p = other.start; p < other.tail; p++) {
      if (other.keys[p] == DELETED) {
        continue;
      }
      int slot = this.readIndex(this.hashOf(other.keys[p]), other.keys[p]);
      if (slot < 0 || !Objects.equals(this.values[this.index[slot] - 1], other.values[p])) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int h = 0;
    for (int p = this.start; p < this.tail; p++) {
      if (this.keys[p] != DELETED) {
        h += this.hasher.hash(this.keys[p]) ^ Objects.hashCode(this.values[p]);
      }
    }
    return h;
  }

  @Override
  public String toString() {
    StringBuilder bldr = new StringBuilder("{");
    for (int p = this.start; p < this.tail; p++) {
      if (this.keys[p] != DELETED) {
        if (bldr.length() > 1) {
          bldr.append(", ");
        }
        bldr.append(this.keys[p]).append('=').append(this.values[p]);
      }
    }
    return bldr.append('}').toString();
  }

  /**
   * Attempts to find the index slot whose entry has a key equal to the given
   * one, using a triangular probe starting from the hash.
   *
   * Returns:
   * <ul>
   * <li> {@code slot} when key found
   * <li> {@code -slot - 1} when an empty slot is found; the slot refers to the
   *   first tombstone found if any, otherwise the empty slot
   * </ul>
   */
  private int readIndex(int hash, Object key) {
    int mask = this.index.length - 1;
    int h = hash & mask;
    int distance = 1;
    int firstTombstone = -1;
    while (this.index[h] != EMPTY) {
      if (this.index[h] == TOMBSTONE) {
        firstTombstone = firstTombstone < 0 ? h : firstTombstone;
      } else {
        int pos = this.index[h] - 1;
        if (this.hashes[pos] == hash && this.hasher.keysAreEqual(this.keys[pos], key)) {
          return h;
        }
      }
      h = (h + distance) & mask;
      distance++;
    }
    if (firstTombstone >= 0) {
      return -firstTombstone - 1;
    }
    return -h - 1;
  }

  /** Index of first empty slot in the probe sequence, for tables with no tombstones */
  private static int insertionIndex(int[] index, int hash) {
    int mask = index.length - 1;
    int h = hash & mask;
    int distance = 1;
    while (index[h] != EMPTY) {
      h = (h + distance) & mask;
      distance++;
    }
    return h;
  }

  /**
   * {@code slot} is not guaranteed to be the real insertion slot, as it is
   * recalculated if the storage is reorganized first.
   */
  private void insertBySlot(int slot, int hash, Object key, Object value) {
    if (this.size + 1 > this.capacity) {
      this.setCapacity(POLICY.grow(this.capacity, this.size + 1));
      slot = insertionIndex(this.index, hash);
    } else if (this.used == this.keys.length) {
      // at least `capacity` positions are DELETED
      this.setCapacity(this.capacity);
      slot = insertionIndex(this.index, hash);
    }
    int pos = this.used++;
    this.keys[pos] = key;
    this.values[pos] = value;
    this.hashes[pos] = hash;
    // INVARIANT 3C, 3D upheld: the slot was EMPTY or TOMBSTONE, and used grew by one
    this.index[slot] = pos + 1;
    if (this.size == 0) {
      this.start = pos;
    }
    this.size++;
    this.tail = this.used;
  }

  /** INVARIANT 3 upheld WHEN index[slot] refers to a live position */
  private V removeBySlot(int slot, boolean shouldShrink) {
    int pos = this.index[slot] - 1;
    V result = castUnsafe(this.values[pos]);
    this.index[slot] = TOMBSTONE;
    this.keys[pos] = DELETED;
    this.values[pos] = null;
    this.hashes[pos] = 0;
    this.size--;
    while (this.start < this.tail && this.keys[this.start] == DELETED) {
      this.start++;
    }
    while (this.tail > this.start && this.keys[this.tail - 1] == DELETED) {
      this.tail--;
    }
    if (shouldShrink) {
      int cap = POLICY.shrink(this.capacity, this.size);
      if (cap != this.capacity) {
        this.setCapacity(cap);
      }
    }
    return result;
  }

  // used by iterators, which know the position but not the slot
  private void removeByPosition(int pos) {
    int mask = this.index.length - 1;
    int h = this.hashes[pos] & mask;
    int distance = 1;
    while (this.index[h] != pos + 1) {
      h = (h + distance) & mask;
      distance++;
    }
    this.removeBySlot(h, false);
  }

  // shrinks as many times as the removals since the last check would have
  private void shrinkToFit() {
    int cap = this.capacity;
    int next = POLICY.shrink(cap, this.size);
    while (next != cap) {
      cap = next;
      next = POLICY.shrink(cap, this.size);
    }
    if (cap != this.capacity) {
      this.setCapacity(cap);
    }
  }

  private void setCapacity(int cap) {
    int len = 2 * cap;
    Object[] nextKeys = new Object[len];
    Object[] nextValues = new Object[len];
    int[] nextHashes = new int[len];
    int[] nextIndex = new int[2 * len];
    int dst = 0;
    for (int src = this.start; src < this.tail; src++) {
      if (this.keys[src] != DELETED) {
        nextKeys[dst] = this.keys[src];
        nextValues[dst] = this.values[src];
        nextHashes[dst] = this.hashes[src];
        nextIndex[insertionIndex(nextIndex, nextHashes[dst])] = dst + 1;
        dst++;
      }
    }
    this.capacity = cap;
    this.keys = nextKeys;
    this.values = nextValues;
    this.hashes = nextHashes;
    this.index = nextIndex;
    // INVARIANT 3 upheld: positions [0, size) are live, no tombstones
    this.used = dst;
    this.start = 0;
    this.tail = dst;
    this.rehashCount++;
  }

  /**
   * Packs the live entries, then permutes them with a stable sort on their
   * positions.
   */
  private void reorder(Comparator<Integer> positionOrder) {
    this.setCapacity(this.capacity);
    Integer[] order = new Integer[this.size];
    for (int i = 0; i < this.size; i++) {
      order[i] = i;
    }
    Arrays.sort(order, positionOrder);
    Object[] sortedKeys = new Object[this.keys.length];
    Object[] sortedValues = new Object[this.values.length];
    int[] sortedHashes = new int[this.hashes.length];
    Arrays.fill(this.index, EMPTY);
    for (int i = 0; i < this.size; i++) {
      int src = order[i];
      sortedKeys[i] = this.keys[src];
      sortedValues[i] = this.values[src];
      sortedHashes[i] = this.hashes[src];
      this.index[insertionIndex(this.index, sortedHashes[i])] = i + 1;
    }
    this.keys = sortedKeys;
    this.values = sortedValues;
    this.hashes = sortedHashes;
  }

  // start of section adapted from
  // https://github.com/apache/commons-collections/blob/master/src/main/java/org/apache/commons/collections4/map/AbstractHashedMap.java

  protected static abstract class PositionIterator<K, V> {
    protected final OrderedMap<K, V> owner;
    private int rehashCount;
    private int position;
    // a removal is waiting for the shrink check
    private boolean removed;
    private boolean lastRemoved;

    protected PositionIterator(final OrderedMap<K, V> owner) {
      this.owner = owner;
      this.rehashCount = owner.rehashCount;
      this.position = -1;
      this.removed = false;
      this.lastRemoved = false;
    }

    // entries appended since the iterator was created are also visited
    private final int findPosition() {
      if (this.rehashCount != owner.rehashCount) {
        throw new ConcurrentModificationException();
      }
      for (int p = Math.max(this.position + 1, owner.start); p < owner.tail; p++) {
        if (owner.keys[p] != DELETED) {
          return p;
        }
      }
      if (this.removed) {
        // capacity is shrunk to fit after the last entry, if this iterator removed any
        this.removed = false;
        owner.shrinkToFit();
        // the last live entry is the last one returned, unless that was removed
        this.rehashCount = owner.rehashCount;
        this.position = owner.tail - 1;
      }
      return -1;
    }

    public final boolean hasNext() {
      return this.findPosition() != -1;
    }

    public final void remove() {
      if (this.rehashCount != owner.rehashCount) {
        throw new ConcurrentModificationException();
      }
      if (this.position < 0 || this.lastRemoved || owner.keys[this.position] == DELETED) {
        throw new IllegalStateException();
      }
      owner.removeByPosition(this.position);
      this.removed = true;
      this.lastRemoved = true;
    }

    protected int advance() {
      int next = this.findPosition();
      if (next < 0) {
        throw new NoSuchElementException();
      }
      this.position = next;
      this.lastRemoved = false;
      return next;
    }
  }

  protected static class PairIterator<K, V> extends PositionIterator<K, V> implements Iterator<Pair<K, V>> {
    protected PairIterator(final OrderedMap<K, V> owner) {
      super(owner);
    }
    public final Pair<K, V> next() {
      return owner.pairAt(this.advance());
    }
  }

  protected static class KeyIterator<K, V> extends PositionIterator<K, V> implements Iterator<K> {
    protected KeyIterator(final OrderedMap<K, V> owner) {
      super(owner);
    }
    public final K next() {
      return castUnsafe(owner.keys[this.advance()]);
    }
  }

  protected static class ValueIterator<K, V> extends PositionIterator<K, V> implements Iterator<V> {
    protected ValueIterator(final OrderedMap<K, V> owner) {
      super(owner);
    }
    public final V next() {
      return castUnsafe(owner.values[this.advance()]);
    }
  }

  protected static class EntryIterator<K, V> extends PositionIterator<K, V> implements Iterator<Map.Entry<K, V>> {
    protected EntryIterator(final OrderedMap<K, V> owner) {
      super(owner);
    }
    public final Map.Entry<K, V> next() {
      return new Node<>(owner, this.advance());
    }
  }

  /** Entry which writes through to the map, following its key across reorganizations. */
  protected static class Node<K, V> implements Map.Entry<K, V> {
    protected final OrderedMap<K, V> owner;
    protected final K key;
    private int position;
    private int rehashCount;

    protected Node(final OrderedMap<K, V> owner, int position) {
      this.owner = owner;
      this.key = castUnsafe(owner.keys[position]);
      this.position = position;
      this.rehashCount = owner.rehashCount;
    }

    private int getPosition() {
      if (this.rehashCount == owner.rehashCount && owner.keys[this.position] != DELETED) {
        return this.position;
      }
      int slot = owner.readIndex(owner.hashOf(this.key), this.key);
      if (slot < 0) {
        throw new IllegalStateException("Entry no longer in map");
      }
      this.position = owner.index[slot] - 1;
      this.rehashCount = owner.rehashCount;
      return this.position;
    }

    @Override
    public K getKey() {
      return this.key;
    }

    @Override
    public V getValue() {
      return castUnsafe(owner.values[this.getPosition()]);
    }

    @Override
    public V setValue(V value) {
      int pos = this.getPosition();
      V prev = castUnsafe(owner.values[pos]);
      owner.values[pos] = value;
      return prev;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      return Objects.equals(this.getKey(), e.getKey()) && Objects.equals(this.getValue(), e.getValue());
    }

    @Override
    public int hashCode() {
      return Objects.hashCode(this.key) ^ Objects.hashCode(this.getValue());
    }

    @Override
    public String toString() {
      return this.key + "=" + this.getValue();
    }
  }

  protected static class JavaMapView<K, V> extends AbstractMap<K, V> {
    private final OrderedMap<K, V> owner;

    protected JavaMapView(final OrderedMap<K, V> owner) {
      this.owner = owner;
    }

    @Override
    public int size() {
      return owner.size;
    }

    @Override
    public boolean isEmpty() {
      return owner.isEmpty();
    }

    @Override
    public boolean containsKey(Object key) {
      return owner.hasKey(key);
    }

    @Override
    public boolean containsValue(Object value) {
      return owner.hasValue(value);
    }

    @Override
    public V get(Object key) {
      return owner.get(key, null);
    }

    @Override
    public V getOrDefault(Object key, V defaultValue) {
      return owner.get(key, defaultValue);
    }

    @Override
    public V put(K key, V value) {
      return owner.putImpl(key, value);
    }

    @Override
    public V remove(Object key) {
      return owner.remove(key, null);
    }

    @Override
    public void clear() {
      owner.clear();
    }

    @Override
    public Set<K> keySet() {
      return new KeySet<>(owner);
    }

    @Override
    public Collection<V> values() {
      return new Values<>(owner);
    }

    @Override
    public Set<Map.Entry<K, V>> entrySet() {
      return new EntrySet<>(owner);
    }
  }

  protected static class KeySet<K> extends AbstractSet<K> {
    private final OrderedMap<K, ?> owner;
    protected KeySet(final OrderedMap<K, ?> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size;
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<K> iterator() {
      return new KeyIterator<>(owner);
    }
    public final boolean contains(Object o) {
      return owner.hasKey(o);
    }
    public final boolean remove(Object key) {
      int slot = owner.readIndex(owner.hashOf(key), key);
      if (slot < 0) {
        return false;
      }
      owner.removeBySlot(slot, true);
      return true;
    }

    public final void forEach(Consumer<? super K> action) {
      Objects.requireNonNull(action);
      owner.forEach((k, _v) -> action.accept(k));
    }
  }

  protected static class Values<V> extends AbstractCollection<V> {
    private final OrderedMap<?, V> owner;
    protected Values(final OrderedMap<?, V> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size;
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<V> iterator() {
      return new ValueIterator<>(owner);
    }
    public final boolean contains(Object o) {
      return owner.hasValue(o);
    }

    public final void forEach(Consumer<? super V> action) {
      Objects.requireNonNull(action);
      owner.forEach((_k, v) -> action.accept(v));
    }
  }

  protected static class EntrySet<K, V> extends AbstractSet<Map.Entry<K, V>> {
    private final OrderedMap<K, V> owner;
    protected EntrySet(final OrderedMap<K, V> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size;
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<Map.Entry<K, V>> iterator() {
      return new EntryIterator<>(owner);
    }

    public final boolean contains(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      int slot = owner.readIndex(owner.hashOf(e.getKey()), e.getKey());
      return slot >= 0 && Objects.equals(owner.values[owner.index[slot] - 1], e.getValue());
    }
    public final boolean remove(Object o) {
      if (!this.contains(o)) {
        return false;
      }
      Object key = ((Map.Entry<?, ?>) o).getKey();
      owner.removeBySlot(owner.readIndex(owner.hashOf(key), key), true);
      return true;
    }
  }

  // end section adapted from
  // https://github.com/apache/commons-collections/blob/master/src/main/java/org/apache/commons/collections4/map/AbstractHashedMap.java
}
