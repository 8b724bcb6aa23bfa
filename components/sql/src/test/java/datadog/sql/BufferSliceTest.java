package datadog.sql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class BufferSliceTest {
  @Test
  void testLength() {
    assertEquals(3, new BufferSlice(2, 5).length());
    assertEquals(0, new BufferSlice(4, 4).length());
    assertEquals(0, new BufferSlice(5, 2).length(), "Inverted slices are empty");
  }

  @Test
  void testIsWithin() {
    assertTrue(new BufferSlice(0, 10).isWithin(10));
    assertTrue(new BufferSlice(10, 10).isWithin(10));
    assertFalse(new BufferSlice(0, 11).isWithin(10));
    assertFalse(new BufferSlice(-1, 2).isWithin(10));
    assertFalse(new BufferSlice(5, 2).isWithin(10));
  }

  @Test
  void testEquality() {
    assertEquals(new BufferSlice(1, 2), new BufferSlice(1, 2));
    assertEquals(new BufferSlice(1, 2).hashCode(), new BufferSlice(1, 2).hashCode());
    assertNotEquals(new BufferSlice(1, 2), new BufferSlice(1, 3));
    assertEquals("[1, 2)", new BufferSlice(1, 2).toString());
  }
}
