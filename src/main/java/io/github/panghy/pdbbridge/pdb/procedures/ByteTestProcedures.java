package io.github.panghy.pdbbridge.pdb.procedures;

import io.github.panghy.pdbbridge.pdb.InMemoryProcedureRegistry;
import io.github.panghy.pdbbridge.pdb.Param;
import io.github.panghy.pdbbridge.pdb.ParamDef;
import io.github.panghy.pdbbridge.pdb.ParamType;
import io.github.panghy.pdbbridge.pdb.Procedure;
import io.github.panghy.pdbbridge.pdb.ProcedureInfo;
import io.github.panghy.pdbbridge.pdb.Signature;

import java.util.List;

/**
 * Two procedures for checking that byte arrays survive the trip across the bus
 * in both directions.
 */
public final class ByteTestProcedures {

  public static final String BYTES_GET = "test-bytes-get";
  public static final String BYTES_PUT = "test-bytes-put";

  private static final int[] SAMPLE = {11, 4, 127, 0, 14, 0, 255, 11, 5, 6, 0, 7};

  private ByteTestProcedures() {
  }

  public static void installAll(InMemoryProcedureRegistry registry) {
    registry.install(new ProcedureInfo(BYTES_GET, "Return a fixed array of bytes", "Glimmer Labs",
        Signature.empty(),
        Signature.of(
            new ParamDef(ParamType.INT32, "nbytes", "The number of bytes"),
            new ParamDef(ParamType.INT8ARRAY, "bytes", "The bytes"))),
        ByteTestProcedures::bytesGet);
    registry.install(new ProcedureInfo(BYTES_PUT, "Sum an array of bytes", "Glimmer Labs",
        Signature.of(
            new ParamDef(ParamType.INT32, "nbytes", "The number of bytes"),
            new ParamDef(ParamType.INT8ARRAY, "bytes", "The bytes")),
        Signature.of(new ParamDef(ParamType.INT32, "sum", "A sum of the bytes"))),
        ByteTestProcedures::bytesPut);
  }

  /**
   * Gets the bytes {@code test-bytes-get} returns, as unsigned values.
   *
   * @return A copy of the sample
   */
  public static int[] sample() {
    return SAMPLE.clone();
  }

  static List<Param> bytesGet(String name, List<Param> params) {
    byte[] data = new byte[SAMPLE.length];
    for (int i = 0; i < SAMPLE.length; i++) {
      data[i] = (byte) SAMPLE[i];
    }
    return Procedure.success(Param.int32(data.length), new Param.Int8ArrayParam(data));
  }

  // Bytes are summed as unsigned values.
  static List<Param> bytesPut(String name, List<Param> params) {
    int count = ((Param.IntParam) params.get(0)).value();
    byte[] data = ((Param.Int8ArrayParam) params.get(1)).values();
    int sum = 0;
    for (int i = 0; i < count && i < data.length; i++) {
      sum += data[i] & 0xFF;
    }
    return Procedure.success(Param.int32(sum));
  }
}
