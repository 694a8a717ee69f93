package dev.dylanburati.ds;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import static dev.dylanburati.ds.Helpers.*;

class DequeTest {
  // 5..12 stored with the head in the middle of the buffer
  private static Deque<Integer> wrapped() {
    Deque<Integer> d = new Deque<>();
    for (int i = 1; i <= 6; i++) {
      d.push(i);
    }
    for (int i = 0; i < 4; i++) {
      d.shift();
    }
    for (int i = 7; i <= 12; i++) {
      d.push(i);
    }
    return d;
  }

  @Test void testCapacityIsPowerOfTwo() {
    Deque<Integer> d = new Deque<>();
    assertEquals(8, d.capacity());
    assertEquals(16, new Deque<Integer>(9).capacity());
    d.pushAll(range(0, 9));
    assertEquals(16, d.capacity());
    d.allocate(17);
    assertEquals(32, d.capacity());
  }

  @Test void testWrapAround() {
    Deque<Integer> d = wrapped();
    assertEquals(8, d.capacity());
    assertEquals(range(5, 13), d);
    assertEquals(5, d.first());
    assertEquals(12, d.last());

    d.unshift(4);
    assertEquals(16, d.capacity());
    assertEquals(range(4, 13), d);
  }

  @Test void testInsertAndRemoveWrapped() {
    Deque<Integer> d = wrapped();
    d.pop();
    d.pop();
    assertEquals(List.of(5, 6, 7, 8, 9, 10), d);

    d.insert(1, 100);
    assertEquals(List.of(5, 100, 6, 7, 8, 9, 10), d);
    d.insert(5, 200);
    assertEquals(List.of(5, 100, 6, 7, 8, 200, 9, 10), d);
    assertEquals(8, d.capacity());

    assertEquals(100, d.remove(1));
    assertEquals(List.of(5, 6, 7, 8, 200, 9, 10), d);
    assertEquals(200, d.remove(4));
    assertEquals(List.of(5, 6, 7, 8, 9, 10), d);
  }

  @Test void testRotateWrapped() {
    Deque<Integer> d = wrapped();
    d.pop();
    d.pop();
    d.rotate(3);
    assertEquals(List.of(8, 9, 10, 5, 6, 7), d);
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 2, 7, 8, 9, 31})
  void testRotateRoundTrip(int size) {
    Deque<Integer> d = new Deque<>(range(0, size));
    for (int r = -2 * size - 3; r <= 2 * size + 3; r++) {
      Deque<Integer> copy = d.copy();
      copy.rotate(r);
      copy.rotate(-r);
      assertEquals(range(0, size), copy);
    }
    d.rotate(size);
    assertEquals(range(0, size), d);
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 7, 8, 100})
  void testUnshiftShiftSymmetry(int size) {
    Deque<Integer> d = new Deque<>(range(0, size));
    d.unshift(-1);
    assertEquals(-1, d.shift());
    assertEquals(range(0, size), d);
    assertTrue(d.capacity() >= d.size());
  }

  @Test void testShrinksWhenDrained() {
    Deque<Integer> d = new Deque<>(range(0, 64));
    assertEquals(64, d.capacity());
    while (d.size() > 16) {
      d.shift();
    }
    assertEquals(64, d.capacity());
    d.shift();
    assertEquals(32, d.capacity());
    assertEquals(range(49, 64), d);
    while (!d.isEmpty()) {
      d.pop();
    }
    assertEquals(8, d.capacity());
  }

  @Test void testSortWrapped() {
    Deque<Integer> d = wrapped();
    d.reverse();
    assertEquals(reversed(range(5, 13)), d);
    d.sort(null);
    assertEquals(range(5, 13), d);
  }

  @Test void testMapKeepsType() {
    Deque<Integer> d = wrapped();
    Deque<String> strings = d.map(Object::toString);
    assertEquals("5,6,7,8,9,10,11,12", strings.join(","));
    assertEquals(8, strings.capacity());
  }
}
