package dev.dylanburati.ds;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Helpers {
  public static <T> List<T> reversed(List<T> original) {
    List<T> result = new ArrayList<>(original);
    Collections.reverse(result);
    return result;
  }

  public static List<Integer> range(int from, int to) {
    List<Integer> result = new ArrayList<>();
    for (int i = from; i < to; i++) {
      result.add(i);
    }
    return result;
  }

  public static <T> List<T> listOf(Iterable<T> values) {
    List<T> result = new ArrayList<>();
    for (T v : values) {
      result.add(v);
    }
    return result;
  }

  /** Key with a constant hash, so every instance collides. */
  public static final class Collider implements Hashable {
    private final String name;

    public Collider(String name) {
      this.name = name;
    }

    @Override
    public int hash() {
      return 7;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Collider && ((Collider) o).name.equals(this.name);
    }

    @Override
    public int hashCode() {
      return this.name.hashCode();
    }

    @Override
    public String toString() {
      return "Collider(" + this.name + ")";
    }
  }
}
