package io.github.panghy.pdbbridge.pixel;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link Rectangle}.
 */
public class RectangleTest {

  @Test
  public void testEdgesSaturate() {
    Rectangle wide = new Rectangle(5, 10, Integer.MAX_VALUE, Integer.MAX_VALUE);
    assertEquals(Integer.MAX_VALUE, wide.right());
    assertEquals(Integer.MAX_VALUE, wide.bottom());
    assertEquals(9, new Rectangle(2, 3, 7, 1).right());
  }

  @Test
  public void testHugeRectangleIsClipped() {
    Rectangle drawable = new Rectangle(0, 0, 8, 8);
    assertEquals(new Rectangle(5, 0, 3, 4),
        new Rectangle(5, 0, Integer.MAX_VALUE, 4).intersect(drawable));
    assertEquals(new Rectangle(5, 0, 3, 4),
        drawable.intersect(new Rectangle(5, 0, Integer.MAX_VALUE, 4)));
    assertEquals(drawable,
        new Rectangle(-100, -100, Integer.MAX_VALUE, Integer.MAX_VALUE).intersect(drawable));
  }

  @Test
  public void testContainsDoesNotWrap() {
    Rectangle drawable = new Rectangle(0, 0, 8, 8);
    assertFalse(drawable.contains(new Rectangle(5, 0, Integer.MAX_VALUE, 4)));
    assertTrue(drawable.contains(new Rectangle(5, 0, 3, 4)));
  }

  @Test
  public void testNoOverlapIsEmpty() {
    Rectangle result = new Rectangle(20, 20, 4, 4).intersect(new Rectangle(0, 0, 8, 8));
    assertTrue(result.isEmpty());
    assertEquals(20, result.x());
  }

  @Test
  public void testNegativeSizeRejected() {
    assertThatThrownBy(() -> new Rectangle(0, 0, -1, 2)).isInstanceOf(IllegalArgumentException.class);
  }
}
