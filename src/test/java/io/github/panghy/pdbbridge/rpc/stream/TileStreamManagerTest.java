package io.github.panghy.pdbbridge.rpc.stream;

import io.github.panghy.pdbbridge.pixel.InMemoryPixelStore;
import io.github.panghy.pdbbridge.pixel.Rectangle;
import io.github.panghy.pdbbridge.rpc.error.BridgeException.ErrorCode;
import io.github.panghy.pdbbridge.rpc.error.InvalidArgumentException;
import io.github.panghy.pdbbridge.rpc.error.SizeMismatchException;
import io.github.panghy.pdbbridge.rpc.error.TileStreamException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link TileStreamManager}.
 */
public class TileStreamManagerTest {

  private InMemoryPixelStore pixels;
  private int drawable;

  @BeforeEach
  public void setUp() {
    // 8x8 drawable on a 4-pixel grid: four tiles of 4x4.
    pixels = new InMemoryPixelStore(4);
    drawable = pixels.createDrawable(8, 8, 1);
    byte[] gradient = new byte[64];
    for (int i = 0; i < gradient.length; i++) {
      gradient[i] = (byte) i;
    }
    pixels.setPixels(drawable, gradient);
  }

  @Test
  public void testPoolExhaustionAndLowestSlotReuse() {
    TileStreamManager manager = new TileStreamManager(pixels, 2);
    assertEquals(0, manager.create(drawable));
    assertEquals(1, manager.create(drawable));

    assertThatThrownBy(() -> manager.create(drawable))
        .isInstanceOf(TileStreamException.class)
        .satisfies(thrown ->
            assertThat(((TileStreamException) thrown).getErrorCode()).isEqualTo(ErrorCode.POOL_EXHAUSTED));

    manager.close(0);
    assertFalse(manager.isValid(0));
    assertEquals(0, manager.create(drawable));
    assertEquals(2, manager.getOpenCount());
  }

  @Test
  public void testEveryTileVisitedWithOneFewerAdvances() {
    TileStreamManager manager = new TileStreamManager(pixels);
    int handle = manager.create(drawable);

    int visited = 1;
    int advances = 0;
    assertEquals(0, manager.get(handle).index());
    while (manager.advance(handle)) {
      advances++;
      visited++;
      assertEquals(advances, manager.get(handle).index());
    }

    assertEquals(4, visited);
    assertEquals(3, advances);
    assertThatThrownBy(() -> manager.get(handle))
        .isInstanceOf(TileStreamException.class)
        .satisfies(thrown ->
            assertThat(((TileStreamException) thrown).getErrorCode()).isEqualTo(ErrorCode.NO_MORE_TILES));
    assertFalse(manager.advance(handle));
    assertTrue(manager.isValid(handle));
  }

  @Test
  public void testGetReturnsSourceTile() {
    TileStreamManager manager = new TileStreamManager(pixels);
    int handle = manager.create(drawable);
    manager.advance(handle);

    TileView tile = manager.get(handle);
    assertEquals(4, tile.x());
    assertEquals(0, tile.y());
    assertEquals(4, tile.width());
    assertEquals(4, tile.rowStride());
    assertEquals(1, tile.bytesPerPixel());
    assertEquals(16, tile.size());
    assertArrayEquals(new byte[]{4, 5, 6, 7, 12, 13, 14, 15, 20, 21, 22, 23, 28, 29, 30, 31}, tile.data());
  }

  @Test
  public void testCloseCommitsPendingUpdate() {
    TileStreamManager manager = new TileStreamManager(pixels);
    int handle = manager.create(drawable);
    byte[] marker = new byte[16];
    Arrays.fill(marker, (byte) 0x7F);

    manager.update(handle, 16, marker);
    manager.close(handle);

    byte[] result = pixels.getPixels(drawable);
    for (int y = 0; y < 8; y++) {
      for (int x = 0; x < 8; x++) {
        int expected = x < 4 && y < 4 ? 0x7F : y * 8 + x;
        assertEquals((byte) expected, result[y * 8 + x], "pixel " + x + "," + y);
      }
    }
    assertFalse(manager.isValid(handle));
    assertEquals(List.of(new Rectangle(0, 0, 8, 8)), pixels.getDirtyRegions(drawable));
    assertEquals(1, pixels.getFlushCount());
    assertEquals(0, pixels.getAttachCount(drawable));
  }

  @Test
  public void testShortUpdateLeavesTileUnchanged() {
    TileStreamManager manager = new TileStreamManager(pixels);
    long before = checksum(pixels.getPixels(drawable));
    int handle = manager.create(drawable);

    assertThatThrownBy(() -> manager.update(handle, 15, new byte[15]))
        .isInstanceOf(SizeMismatchException.class)
        .hasMessage("Sizes don't match: 15 != 16");
    assertThatThrownBy(() -> manager.update(handle, 16, new byte[10]))
        .isInstanceOf(SizeMismatchException.class)
        .isInstanceOf(InvalidArgumentException.class);
    manager.close(handle);

    assertEquals(before, checksum(pixels.getPixels(drawable)));
  }

  @Test
  public void testRectangleStreamIsClipped() {
    TileStreamManager manager = new TileStreamManager(pixels);
    int handle = manager.create(drawable, 6, 6, 10, 10);

    TileView tile = manager.get(handle);
    assertEquals(6, tile.x());
    assertEquals(6, tile.y());
    assertEquals(2, tile.width());
    assertEquals(2, tile.height());
    assertEquals(4, tile.size());
    assertFalse(manager.advance(handle));
  }

  @Test
  public void testOversizedRectangleIsClipped() {
    TileStreamManager manager = new TileStreamManager(pixels);
    int handle = manager.create(drawable, 5, 0, Integer.MAX_VALUE, 4);

    TileView tile = manager.get(handle);
    assertEquals(5, tile.x());
    assertEquals(0, tile.y());
    assertEquals(3, tile.width());
    assertEquals(4, tile.height());
    assertFalse(manager.advance(handle));
    manager.close(handle);

    assertEquals(List.of(new Rectangle(5, 0, 3, 4)), pixels.getDirtyRegions(drawable));
  }

  @Test
  public void testRectangleStreamCommitsOnlyItsRectangle() {
    TileStreamManager manager = new TileStreamManager(pixels);
    int handle = manager.create(drawable, new Rectangle(2, 2, 4, 1));
    manager.update(handle, 2, new byte[]{-1, -1});
    manager.advance(handle);
    manager.update(handle, 2, new byte[]{-2, -2});
    manager.close(handle);

    byte[] result = pixels.getPixels(drawable);
    assertArrayEquals(new byte[]{16, 17, -1, -1, -2, -2, 22, 23}, Arrays.copyOfRange(result, 16, 24));
    assertEquals((byte) 15, result[15]);
    assertEquals((byte) 24, result[24]);
    assertEquals(List.of(new Rectangle(2, 2, 4, 1)), pixels.getDirtyRegions(drawable));
  }

  @Test
  public void testFailedCreateDoesNotTakeASlot() {
    TileStreamManager manager = new TileStreamManager(pixels, 1);

    assertThatThrownBy(() -> manager.create(999))
        .isInstanceOf(TileStreamException.class)
        .satisfies(thrown ->
            assertThat(((TileStreamException) thrown).getErrorCode()).isEqualTo(ErrorCode.INVALID_DRAWABLE));
    assertThatThrownBy(() -> manager.create(drawable, new Rectangle(20, 20, 4, 4)))
        .isInstanceOf(InvalidArgumentException.class);
    assertThatThrownBy(() -> manager.create(drawable, 0, 0, -1, 4))
        .isInstanceOf(InvalidArgumentException.class);

    assertEquals(0, manager.getOpenCount());
    assertEquals(0, pixels.getAttachCount(drawable));
    assertEquals(0, manager.create(drawable));
  }

  @Test
  public void testInvalidHandles() {
    TileStreamManager manager = new TileStreamManager(pixels);
    assertFalse(manager.isValid(-1));
    assertFalse(manager.isValid(16));
    assertFalse(manager.isValid(3));

    assertThatThrownBy(() -> manager.get(3))
        .isInstanceOf(TileStreamException.class)
        .hasMessageContaining("Invalid tile stream");
    assertThatThrownBy(() -> manager.advance(3)).isInstanceOf(TileStreamException.class);
    assertThatThrownBy(() -> manager.update(3, 16, new byte[16])).isInstanceOf(TileStreamException.class);

    manager.close(3);
    manager.close(-5);
    assertEquals(0, pixels.getFlushCount());
  }

  @Test
  public void testCloseAll() {
    TileStreamManager manager = new TileStreamManager(pixels);
    manager.create(drawable);
    manager.create(drawable, 0, 0, 2, 2);
    manager.closeAll();

    assertEquals(0, manager.getOpenCount());
    assertEquals(2, pixels.getFlushCount());
    assertEquals(0, pixels.getAttachCount(drawable));
  }

  @Test
  public void testCapacityMustBePositive() {
    assertThatThrownBy(() -> new TileStreamManager(pixels, 0)).isInstanceOf(IllegalArgumentException.class);
  }

  private static long checksum(byte[] data) {
    long sum = 0;
    for (int i = 0; i < data.length; i++) {
      sum = sum * 31 + (data[i] & 0xFF);
    }
    return sum;
  }
}
