package dev.dylanburati.ds;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

class PairTest {
  @Test void testEqualsMapEntry() {
    Pair<String, Integer> p = new Pair<>("a", 1);
    assertEquals(Map.entry("a", 1), p);
    assertEquals(Map.entry("a", 1).hashCode(), p.hashCode());
    assertNotEquals(new Pair<>("a", 2), p);
    assertEquals("a=1", p.toString());
  }

  @Test void testCopyIsIndependent() {
    Pair<String, Integer> p = new Pair<>("a", 1);
    Pair<String, Integer> copy = p.copy();
    copy.setKey("b");
    assertEquals(1, copy.setValue(2));
    assertEquals(new Pair<>("a", 1), p);
    assertEquals(new Pair<>("b", 2), copy);
  }

  @Test void testNulls() {
    Pair<String, String> p = new Pair<>(null, null);
    assertEquals(new Pair<>(null, null), p);
    assertEquals(0, p.hashCode());
  }
}
