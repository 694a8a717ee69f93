package dev.dylanburati.ds;

import java.util.Map;
import java.util.Objects;

/**
 * A key and an associated value. Pairs returned from {@link OrderedMap} are
 * copies; changing them does not affect the map.
 */
public class Pair<K, V> implements Map.Entry<K, V> {
  private K key;
  private V value;

  public Pair(K key, V value) {
    this.key = key;
    this.value = value;
  }

  @Override
  public K getKey() {
    return this.key;
  }

  @Override
  public V getValue() {
    return this.value;
  }

  public void setKey(K key) {
    this.key = key;
  }

  @Override
  public V setValue(V value) {
    V prev = this.value;
    this.value = value;
    return prev;
  }

  public Pair<K, V> copy() {
    return new Pair<>(this.key, this.value);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Map.Entry<?, ?>)) {
      return false;
    }
    Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
    return Objects.equals(this.key, e.getKey()) && Objects.equals(this.value, e.getValue());
  }

  // same as Map.Entry#hashCode
  @Override
  public int hashCode() {
    return Objects.hashCode(this.key) ^ Objects.hashCode(this.value);
  }

  @Override
  public String toString() {
    return this.key + "=" + this.value;
  }
}
