package dev.dylanburati.ds;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import static dev.dylanburati.ds.Helpers.*;

class OrderedSetTest {
  @Test void testAddKeepsFirstPosition() {
    OrderedSet<String> s = new OrderedSet<>();
    assertTrue(s.add("b"));
    assertTrue(s.add("a"));
    assertFalse(s.add("b"));
    assertEquals(2, s.size());
    assertEquals(List.of("b", "a"), listOf(s));
    assertEquals(Set.of("a", "b"), s);
  }

  @Test void testRemove() {
    OrderedSet<String> s = OrderedSet.of("a", "b", "c");
    assertTrue(s.remove("b"));
    assertFalse(s.remove("b"));
    assertEquals(List.of("a", "c"), s.toList());
    s.add("b");
    assertEquals(List.of("a", "c", "b"), s.toList());
  }

  @Test void testAddAndRemoveMany() {
    OrderedSet<String> s = new OrderedSet<>();
    assertTrue(s.add("c", "a", "c", "b"));
    assertEquals(List.of("c", "a", "b"), s.toList());
    assertFalse(s.add("a", "b"));
    assertFalse(s.add());
    assertTrue(s.remove("a", "z"));
    assertFalse(s.remove("z", "y"));
    assertFalse(s.remove());
    assertEquals(List.of("c", "b"), s.toList());
  }

  @Test void testAddAll() {
    OrderedSet<Integer> s = new OrderedSet<>(range(0, 5));
    s.addAll(List.of(3, 4, 5, 6));
    assertEquals(range(0, 7), s.toList());
    assertThrows(IllegalArgumentException.class, () -> s.addAll((Iterable<Integer>) null));
  }

  @Test void testContains() {
    OrderedSet<String> s = OrderedSet.of("a", "b");
    assertTrue(s.contains("a"));
    assertFalse(s.contains("z"));
    assertTrue(s.containsAll("a", "b"));
    assertFalse(s.containsAll("a", "z"));
    assertFalse(s.containsAll());
    assertTrue(s.containsAll(List.of("b")));
  }

  @Test void testPositionalAccess() {
    OrderedSet<String> s = new OrderedSet<>();
    assertThrows(UnderflowException.class, s::first);
    assertThrows(UnderflowException.class, s::last);
    s.addAll(List.of("a", "b", "c", "d"));
    s.remove("a");
    assertEquals("b", s.first());
    assertEquals("d", s.last());
    assertEquals("c", s.get(1));
    assertThrows(IndexOutOfBoundsException.class, () -> s.get(3));
  }

  @Test void testSetOperations() {
    OrderedSet<Integer> a = OrderedSet.of(1, 2, 3);
    OrderedSet<Integer> b = OrderedSet.of(3, 4);
    assertEquals(List.of(1, 2, 4), a.xor(b).toList());
    assertEquals(List.of(3), a.intersect(b).toList());
    assertEquals(List.of(1, 2), a.diff(b).toList());
    assertEquals(List.of(1, 2, 3, 4), a.union(b).toList());
    assertEquals(List.of(3, 4, 1, 2), b.union(a).toList());
    assertEquals(List.of(1, 2, 3), a.toList());
  }

  @Test void testSortAndReverse() {
    OrderedSet<String> s = OrderedSet.of("c", "a", "b");
    assertEquals(List.of("a", "b", "c"), s.sorted(null).toList());
    assertEquals(List.of("b", "a", "c"), s.reversed().toList());
    s.sort(Comparator.reverseOrder());
    assertEquals(List.of("c", "b", "a"), s.toList());
    s.reverse();
    assertEquals(List.of("a", "b", "c"), s.toList());
    assertTrue(s.contains("b"));
  }

  @Test void testSlice() {
    OrderedSet<Integer> s = new OrderedSet<>(range(0, 10));
    assertEquals(List.of(2, 3, 4), s.slice(2, 3).toList());
    assertEquals(List.of(8, 9), s.slice(-2).toList());
    assertEquals(range(1, 9), s.slice(1, -1).toList());
  }

  @Test void testFunctional() {
    OrderedSet<Integer> s = new OrderedSet<>(range(1, 7));
    assertEquals(List.of(2, 4, 6), s.filter(i -> i % 2 == 0).toList());
    assertEquals(Integer.valueOf(21), s.reduce((carry, i) -> carry + i, 0));
    assertEquals(Long.valueOf(21), s.sum());
    assertEquals("1-2-3-4-5-6", s.join("-"));
    assertEquals("123456", s.join());
  }

  @Test void testCopyIsIndependent() {
    OrderedSet<String> s = OrderedSet.of("a", "b");
    OrderedSet<String> copy = s.copy();
    copy.add("c");
    copy.remove("a");
    assertEquals(List.of("a", "b"), s.toList());
    assertEquals(List.of("b", "c"), copy.toList());
  }

  @Test void testIteratorRemove() {
    OrderedSet<Integer> s = new OrderedSet<>(range(0, 20));
    for (Iterator<Integer> it = s.iterator(); it.hasNext(); ) {
      if (it.next() % 4 != 0) {
        it.remove();
      }
    }
    assertEquals(List.of(0, 4, 8, 12, 16), s.toList());
  }

  @Test void testRemoveIfShrinks() {
    OrderedSet<Integer> s = new OrderedSet<>(range(0, 1000));
    assertEquals(1024, s.capacity());
    assertTrue(s.removeIf(v -> v % 100 != 0));
    assertEquals(List.of(0, 100, 200, 300, 400, 500, 600, 700, 800, 900), s.toList());
    assertEquals(32, s.capacity());
    assertTrue(s.removeIf(v -> true));
    assertTrue(s.isEmpty());
    assertEquals(8, s.capacity());
  }

  @Test void testCapacity() {
    OrderedSet<Integer> s = new OrderedSet<>();
    assertEquals(8, s.capacity());
    s.addAll(range(0, 9));
    assertEquals(16, s.capacity());
    s.allocate(40);
    assertEquals(64, s.capacity());
    s.clear();
    assertTrue(s.isEmpty());
    assertEquals(8, s.capacity());
  }

  @Test void testCollidingValues() {
    OrderedSet<Collider> s = new OrderedSet<>();
    for (int i = 0; i < 20; i++) {
      s.add(new Collider(Integer.toString(i)));
    }
    assertFalse(s.add(new Collider("5")));
    assertTrue(s.remove(new Collider("5")));
    assertEquals(19, s.size());
    assertEquals(new Collider("19"), s.last());
  }
}
