package io.github.panghy.pdbbridge.pixel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link InMemoryPixelStore}.
 */
public class InMemoryPixelStoreTest {

  private InMemoryPixelStore store;
  private int drawable;

  @BeforeEach
  public void setUp() {
    store = new InMemoryPixelStore(4);
    drawable = store.createDrawable(10, 6, 1);
  }

  @Test
  public void testAttachUnknownDrawable() {
    assertThat(store.attach(12345)).isEmpty();
  }

  @Test
  public void testTilesFollowTheGrid() {
    DrawableBuffer source = store.attach(drawable).orElseThrow();
    DrawableBuffer target = store.attach(drawable).orElseThrow();
    Rectangle bounds = new Rectangle(2, 1, 7, 5);
    RegionIterator iterator = store.iterate(
        store.regionInit(source, bounds, false),
        store.regionInit(target, bounds, true));

    List<Rectangle> tiles = new ArrayList<>();
    do {
      tiles.add(iterator.source().getBounds());
    } while (iterator.next());

    // Columns split at x=4 and x=8, rows at y=4.
    assertEquals(List.of(
        new Rectangle(2, 1, 2, 3), new Rectangle(4, 1, 4, 3), new Rectangle(8, 1, 1, 3),
        new Rectangle(2, 4, 2, 2), new Rectangle(4, 4, 4, 2), new Rectangle(8, 4, 1, 2)), tiles);
    assertTrue(iterator.isFinished());
    assertNull(iterator.source());
    assertFalse(iterator.next());
  }

  @Test
  public void testEmptyRegionHasNoIterator() {
    DrawableBuffer buffer = store.attach(drawable).orElseThrow();
    PixelRegion empty = store.regionInit(buffer, new Rectangle(0, 0, 0, 3), false);
    assertNull(store.iterate(empty, empty));
  }

  @Test
  public void testWritesReachDrawableOnlyAfterMerge() {
    DrawableBuffer source = store.attach(drawable).orElseThrow();
    DrawableBuffer target = store.attach(drawable).orElseThrow();
    Rectangle bounds = new Rectangle(0, 0, 2, 2);
    RegionIterator iterator = store.iterate(
        store.regionInit(source, bounds, false),
        store.regionInit(target, bounds, true));

    iterator.target().write(new byte[]{9, 9, 9, 9}, 4);
    assertFalse(iterator.next());
    assertEquals(0, store.getPixels(drawable)[0]);
    assertTrue(store.hasShadow(drawable));

    store.mergeShadow(drawable);
    byte[] pixels = store.getPixels(drawable);
    assertEquals(9, pixels[0]);
    assertEquals(9, pixels[1]);
    assertEquals(9, pixels[10]);
    assertEquals(9, pixels[11]);
    assertEquals(0, pixels[2]);
    assertFalse(store.hasShadow(drawable));
  }

  @Test
  public void testSourceTileReadsPixels() {
    byte[] pixels = new byte[60];
    for (int i = 0; i < pixels.length; i++) {
      pixels[i] = (byte) i;
    }
    store.setPixels(drawable, pixels);
    DrawableBuffer buffer = store.attach(drawable).orElseThrow();
    Rectangle bounds = new Rectangle(4, 4, 2, 2);
    PixelRegion region = store.regionInit(buffer, bounds, false);
    RegionIterator iterator = store.iterate(region, region);

    Tile tile = iterator.source();
    assertEquals(2, tile.getRowStride());
    assertThat(tile.getData()).containsExactly(44, 45, 54, 55);
  }

  @Test
  public void testAttachCountAndDetach() {
    DrawableBuffer buffer = store.attach(drawable).orElseThrow();
    assertEquals(1, store.getAttachCount(drawable));
    store.detach(buffer);
    assertEquals(0, store.getAttachCount(drawable));
    assertThatThrownBy(() -> store.detach(buffer)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void testRegionMustLieInsideDrawable() {
    DrawableBuffer buffer = store.attach(drawable).orElseThrow();
    assertThatThrownBy(() -> store.regionInit(buffer, new Rectangle(8, 0, 4, 4), false))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void testDirtyAndFlushAreRecorded() {
    store.markDirty(drawable, new Rectangle(1, 1, 2, 2));
    store.flushDisplay();
    assertEquals(List.of(new Rectangle(1, 1, 2, 2)), store.getDirtyRegions(drawable));
    assertEquals(1, store.getFlushCount());
  }

  @Test
  public void testRectangleIntersection() {
    Rectangle a = new Rectangle(0, 0, 10, 10);
    assertEquals(new Rectangle(5, 5, 5, 5), a.intersect(new Rectangle(5, 5, 20, 20)));
    assertTrue(a.intersect(new Rectangle(10, 0, 5, 5)).isEmpty());
    assertTrue(a.contains(new Rectangle(2, 2, 8, 8)));
    assertFalse(a.contains(new Rectangle(2, 2, 9, 8)));
    assertThatThrownBy(() -> new Rectangle(0, 0, -1, 1)).isInstanceOf(IllegalArgumentException.class);
  }
}
