package dev.dylanburati.ds;

import java.util.Objects;

/* package-private */ class DefaultHasher implements Hasher {
  private static DefaultHasher instance = null;

  private DefaultHasher() {}

  static DefaultHasher instance() {
    if (instance == null) {
      instance = new DefaultHasher();
    }
    return instance;
  }

  @Override
  public int hash(Object key) {
    if (key instanceof Hashable) {
      return ((Hashable) key).hash();
    }
    return Objects.hashCode(key);
  }

  @Override
  public boolean keysAreEqual(Object a, Object b) {
    if (a instanceof Hashable) {
      return b instanceof Hashable && a.equals(b);
    }
    if (b instanceof Hashable) {
      return false;
    }
    return Objects.equals(a, b);
  }
}
