package io.github.panghy.pdbbridge.rpc.stream;

import io.github.panghy.pdbbridge.pixel.DrawableBuffer;
import io.github.panghy.pdbbridge.pixel.Rectangle;
import io.github.panghy.pdbbridge.pixel.RegionIterator;
import io.github.panghy.pdbbridge.pixel.Tile;

/**
 * One open cursor over a rectangle of a drawable. Reads come from the drawable
 * itself, writes go to the drawable's shadow and only show up once the stream is
 * closed.
 *
 * <p>The target tile always starts out as a copy of the source tile, so tiles
 * the caller never touches are written back unchanged.</p>
 */
final class TileStream {

  private final int drawableId;
  private final Rectangle bounds;
  private final DrawableBuffer source;
  private final DrawableBuffer target;
  private final RegionIterator iterator;
  private int tileIndex;

  TileStream(int drawableId, Rectangle bounds, DrawableBuffer source, DrawableBuffer target,
             RegionIterator iterator) {
    this.drawableId = drawableId;
    this.bounds = bounds;
    this.source = source;
    this.target = target;
    this.iterator = iterator;
    prime();
  }

  int getDrawableId() {
    return drawableId;
  }

  Rectangle getBounds() {
    return bounds;
  }

  DrawableBuffer getSource() {
    return source;
  }

  DrawableBuffer getTarget() {
    return target;
  }

  int getTileIndex() {
    return tileIndex;
  }

  boolean hasTile() {
    return iterator != null && !iterator.isFinished();
  }

  Tile sourceTile() {
    return iterator.source();
  }

  Tile targetTile() {
    return iterator.target();
  }

  /**
   * Stores the current target tile and moves to the next one.
   *
   * @return true if the stream now sits on a tile
   */
  boolean advance() {
    if (!hasTile()) {
      return false;
    }
    boolean more = iterator.next();
    tileIndex++;
    prime();
    return more;
  }

  private void prime() {
    if (hasTile()) {
      Tile from = iterator.source();
      iterator.target().write(from.getData(), from.getSize());
    }
  }

  @Override
  public String toString() {
    return "TileStream{" +
        "drawableId=" + drawableId +
        ", bounds=" + bounds +
        ", tileIndex=" + tileIndex +
        '}';
  }
}
