package dev.dylanburati.ds;

/**
 * Keys which define their own equality and the hash used for bucket placement
 * in {@link OrderedMap} and {@link OrderedSet}. The rules of
 * {@link Object#hashCode} apply to {@link #hash()}: keys which are equal must
 * return the same hash.
 */
public interface Hashable {
  int hash();

  /**
   * Only consulted when both keys are {@code Hashable}.
   */
  @Override
  boolean equals(Object obj);
}
