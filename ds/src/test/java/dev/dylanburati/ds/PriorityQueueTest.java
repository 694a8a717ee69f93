package dev.dylanburati.ds;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static dev.dylanburati.ds.Helpers.*;

class PriorityQueueTest {
  @Test void testEqualPrioritiesPopInPushOrder() {
    PriorityQueue<String> pq = new PriorityQueue<>();
    pq.push("x", 5);
    pq.push("y", 10);
    pq.push("z", 5);
    assertEquals("y", pq.peek());
    assertEquals("y", pq.pop());
    assertEquals("x", pq.pop());
    assertEquals("z", pq.pop());
    assertTrue(pq.isEmpty());
  }

  @Test void testEmptyUnderflow() {
    PriorityQueue<String> pq = new PriorityQueue<>();
    assertThrows(UnderflowException.class, pq::pop);
    assertThrows(UnderflowException.class, pq::peek);
  }

  @Test void testManyValues() {
    PriorityQueue<Integer> pq = new PriorityQueue<>();
    for (int i = 0; i < 100; i++) {
      pq.push(i, i % 3);
    }
    assertEquals(100, pq.size());

    List<Integer> expected = new ArrayList<>();
    for (int priority = 2; priority >= 0; priority--) {
      for (int i = 0; i < 100; i++) {
        if (i % 3 == priority) {
          expected.add(i);
        }
      }
    }
    List<Integer> popped = new ArrayList<>();
    while (!pq.isEmpty()) {
      popped.add(pq.pop());
      assertTrue(pq.capacity() >= Math.max(8, pq.size()));
    }
    assertEquals(expected, popped);
  }

  @Test void testNegativePriorities() {
    PriorityQueue<String> pq = new PriorityQueue<>();
    pq.push("low", Integer.MIN_VALUE);
    pq.push("mid", -1);
    pq.push("high", Integer.MAX_VALUE);
    assertEquals(List.of("high", "mid", "low"), pq.toList());
  }

  @Test void testToListIsNotDestructive() {
    PriorityQueue<String> pq = new PriorityQueue<>();
    pq.push("a", 1);
    pq.push("b", 3);
    pq.push("c", 2);
    assertEquals(List.of("b", "c", "a"), pq.toList());
    assertEquals(3, pq.size());
    assertEquals("[b, c, a]", pq.toString());
    assertEquals("b", pq.pop());
  }

  @Test void testIterationIsDestructive() {
    PriorityQueue<String> pq = new PriorityQueue<>();
    pq.push("a", 1);
    pq.push("b", 3);
    pq.push("c", 2);
    assertEquals(List.of("b", "c", "a"), listOf(pq));
    assertTrue(pq.isEmpty());
    assertThrows(NoSuchElementException.class, () -> pq.iterator().next());
  }

  @Test void testCopyKeepsPushOrder() {
    PriorityQueue<String> pq = new PriorityQueue<>();
    pq.push("a", 1);
    pq.push("b", 1);
    PriorityQueue<String> copy = pq.copy();
    copy.push("c", 1);
    assertEquals(List.of("a", "b", "c"), copy.toList());
    assertEquals(List.of("a", "b"), pq.toList());
  }

  @Test void testCapacity() {
    PriorityQueue<Integer> pq = new PriorityQueue<>();
    assertEquals(8, pq.capacity());
    for (int i = 0; i < 9; i++) {
      pq.push(i, i);
    }
    assertEquals(16, pq.capacity());
    while (pq.size() > 4) {
      pq.pop();
      assertEquals(16, pq.capacity());
    }
    pq.pop();
    assertEquals(8, pq.capacity());

    pq.allocate(100);
    assertEquals(128, pq.capacity());
    assertEquals(List.of(2, 1, 0), pq.toList());
  }

  @Test void testClear() {
    PriorityQueue<String> pq = new PriorityQueue<>(100);
    assertEquals(128, pq.capacity());
    pq.push("a", 1);
    pq.clear();
    assertTrue(pq.isEmpty());
    assertEquals(8, pq.capacity());
    pq.push("b", 1);
    pq.push("c", 1);
    assertEquals("b", pq.pop());
  }

  @Test void testToArray() {
    PriorityQueue<String> pq = new PriorityQueue<>();
    pq.push("a", 1);
    pq.push("b", 2);
    assertArrayEquals(new Object[]{"b", "a"}, pq.toArray());
    assertEquals(2, pq.size());
  }
}
