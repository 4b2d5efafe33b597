package io.github.panghy.pdbbridge.rpc.error;

/**
 * Failure of a tile-stream operation. The error code tells which one:
 * {@link ErrorCode#POOL_EXHAUSTED}, {@link ErrorCode#INVALID_HANDLE},
 * {@link ErrorCode#INVALID_DRAWABLE} or {@link ErrorCode#NO_MORE_TILES}.
 *
 * <p>A failed operation leaves the stream as it was; the caller still owns the
 * handle and must close it.</p>
 */
public class TileStreamException extends BridgeException {

  private final int handle;

  private TileStreamException(ErrorCode errorCode, int handle, String message) {
    super(errorCode, message);
    this.handle = handle;
  }

  /**
   * Creates the exception for a full handle pool.
   *
   * @param capacity The pool capacity
   * @return The exception
   */
  public static TileStreamException poolExhausted(int capacity) {
    return new TileStreamException(ErrorCode.POOL_EXHAUSTED, -1,
        "No free tile stream; all " + capacity + " handles are in use");
  }

  /**
   * Creates the exception for a handle that names no live stream.
   *
   * @param handle The handle
   * @return The exception
   */
  public static TileStreamException invalidHandle(int handle) {
    return new TileStreamException(ErrorCode.INVALID_HANDLE, handle,
        "Invalid tile stream: " + handle);
  }

  /**
   * Creates the exception for a drawable that is not live.
   *
   * @param drawableId The drawable reference
   * @return The exception
   */
  public static TileStreamException invalidDrawable(int drawableId) {
    return new TileStreamException(ErrorCode.INVALID_DRAWABLE, -1,
        "Invalid drawable: " + drawableId);
  }

  /**
   * Creates the exception for a stream advanced past its last tile.
   *
   * @param handle The handle
   * @return The exception
   */
  public static TileStreamException noMoreTiles(int handle) {
    return new TileStreamException(ErrorCode.NO_MORE_TILES, handle,
        "No more tiles in stream " + handle);
  }

  /**
   * Gets the handle involved, or -1 when the failure happened before one existed.
   *
   * @return The handle
   */
  public int getHandle() {
    return handle;
  }
}
