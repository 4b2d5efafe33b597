package io.github.panghy.pdbbridge.pdb.procedures;

import io.github.panghy.pdbbridge.pdb.CallStatus;
import io.github.panghy.pdbbridge.pdb.Param;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link ByteTestProcedures}.
 */
public class ByteTestProceduresTest {

  @Test
  public void testBytesGet() {
    List<Param> result = ByteTestProcedures.bytesGet(ByteTestProcedures.BYTES_GET, List.of());

    assertEquals(Param.status(CallStatus.SUCCESS), result.get(0));
    assertEquals(Param.int32(12), result.get(1));
    byte[] bytes = ((Param.Int8ArrayParam) result.get(2)).values();
    assertEquals(12, bytes.length);
    assertEquals((byte) 255, bytes[6]);
  }

  @Test
  public void testBytesPutSumsUnsigned() {
    List<Param> result = ByteTestProcedures.bytesPut(ByteTestProcedures.BYTES_PUT,
        List.of(Param.int32(3), new Param.Int8ArrayParam(new byte[]{1, (byte) 200, (byte) 255})));
    assertEquals(Param.int32(456), result.get(1));
  }

  @Test
  public void testBytesPutStopsAtCount() {
    List<Param> result = ByteTestProcedures.bytesPut(ByteTestProcedures.BYTES_PUT,
        List.of(Param.int32(2), new Param.Int8ArrayParam(new byte[]{10, 20, 30})));
    assertEquals(Param.int32(30), result.get(1));
  }

  @Test
  public void testSampleIsACopy() {
    int[] sample = ByteTestProcedures.sample();
    sample[0] = -1;
    assertArrayEquals(new int[]{11, 4, 127, 0, 14, 0, 255, 11, 5, 6, 0, 7}, ByteTestProcedures.sample());
  }
}
