package dev.dylanburati.ds;

/**
 * Computes hashes and decides key equality for insertion to ordered maps.
 * The rules of {@link Object#hashCode} also apply here.
 */
public interface Hasher {
  int hash(Object key);
  boolean keysAreEqual(Object a, Object b);
}
