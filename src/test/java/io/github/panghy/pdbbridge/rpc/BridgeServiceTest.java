package io.github.panghy.pdbbridge.rpc;

import io.github.panghy.pdbbridge.pdb.InMemoryProcedureRegistry;
import io.github.panghy.pdbbridge.pdb.procedures.ColorProcedures;
import io.github.panghy.pdbbridge.pixel.InMemoryPixelStore;
import io.github.panghy.pdbbridge.rpc.dispatch.PdbCallDispatcher;
import io.github.panghy.pdbbridge.rpc.error.BridgeException.ErrorCategory;
import io.github.panghy.pdbbridge.rpc.error.InvalidArgumentException;
import io.github.panghy.pdbbridge.rpc.error.TypeMismatchException;
import io.github.panghy.pdbbridge.rpc.serialization.WireType;
import io.github.panghy.pdbbridge.rpc.serialization.WireValue;
import io.github.panghy.pdbbridge.rpc.stream.TileStreamManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link BridgeService}.
 */
public class BridgeServiceTest {

  private InMemoryPixelStore pixels;
  private TileStreamManager tileStreams;
  private AtomicInteger quits;
  private BridgeService service;

  @BeforeEach
  public void setUp() {
    InMemoryProcedureRegistry registry = new InMemoryProcedureRegistry();
    ColorProcedures.installAll(registry);
    pixels = new InMemoryPixelStore(4);
    tileStreams = new TileStreamManager(pixels, 4);
    quits = new AtomicInteger();
    service = new BridgeService(BridgeConfiguration.defaultConfig(), new PdbCallDispatcher(registry), tileStreams,
        quits::incrementAndGet);
  }

  @Test
  public void testAbout() {
    RecordingInvocation call = new RecordingInvocation("ggimp_about");
    service.handle(call);

    assertEquals(List.of(WireValue.string(BridgeConfiguration.DEFAULT_ABOUT_MESSAGE)), call.values);
    assertNull(call.errorCategory);
  }

  @Test
  public void testRgbRedMasksToOneChannel() {
    assertEquals(List.of(WireValue.int32(0x12)), service.invoke("ggimp_rgb_red", List.of(WireValue.int32(0x123456))));
    assertEquals(List.of(WireValue.int32(0xFF)), service.invoke("ggimp_rgb_red", List.of(WireValue.int32(-1))));
  }

  @Test
  public void testRegistryProcedureIsDispatched() {
    List<WireValue> result = service.invoke("ggimp_irgb_new",
        List.of(WireValue.int32(1), WireValue.int32(2), WireValue.int32(3)));
    assertEquals(List.of(WireValue.int32(0x010203)), result);
  }

  @Test
  public void testUnknownMethodIsArgumentError() {
    RecordingInvocation call = new RecordingInvocation("no_such_thing");
    service.handle(call);

    assertEquals(ErrorCategory.ARGUMENT, call.errorCategory);
    assertEquals("Invalid method: 'no_such_thing'", call.errorMessage);
    assertNull(call.values);
  }

  @Test
  public void testBuiltInArgumentChecks() {
    assertThatThrownBy(() -> service.invoke("ggimp_rgb_red", List.of()))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessage("ggimp_rgb_red expects 1 parameter, received 0");
    assertThatThrownBy(() -> service.invoke("rectangle_new_tile_stream", List.of(WireValue.int32(1))))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessage("rectangle_new_tile_stream expects 5 parameters, received 1");
    assertThatThrownBy(() -> service.invoke("tile_stream_get", List.of(WireValue.string("0"))))
        .isInstanceOf(TypeMismatchException.class)
        .satisfies(thrown -> {
          TypeMismatchException e = (TypeMismatchException) thrown;
          assertThat(e.getExpected()).isEqualTo(WireType.INT32);
          assertThat(e.getActual()).isEqualTo(WireType.STRING);
        });
  }

  @Test
  public void testFailedCallRepliesWithCategory() {
    RecordingInvocation call = new RecordingInvocation("tile_stream_get", WireValue.int32(7));
    service.handle(call);

    assertEquals(ErrorCategory.ARGUMENT, call.errorCategory);
    assertThat(call.errorMessage).contains("Invalid tile stream");

    RecordingInvocation parse = new RecordingInvocation("ggimp_rgb_parse", WireValue.string("not a color"));
    service.handle(parse);
    assertEquals(ErrorCategory.GENERAL, parse.errorCategory);
    assertEquals("call to ggimp-rgb-parse failed with invalid inputs", parse.errorMessage);
  }

  @Test
  public void testUnexpectedFailureBecomesGeneralError() {
    PdbCallDispatcher dispatcher = mock(PdbCallDispatcher.class);
    when(dispatcher.dispatch(anyString(), any())).thenThrow(new IllegalStateException("boom"));
    BridgeService failing = new BridgeService(BridgeConfiguration.defaultConfig(), dispatcher, tileStreams,
        quits::incrementAndGet);

    RecordingInvocation call = new RecordingInvocation("anything");
    failing.handle(call);

    assertEquals(ErrorCategory.GENERAL, call.errorCategory);
    assertEquals("call to anything failed: boom", call.errorMessage);
    verify(dispatcher).dispatch("anything", List.of());
  }

  @Test
  public void testTileOperations() {
    int drawable = pixels.createDrawable(8, 4, 1);
    int handle = service.invoke("drawable_new_tile_stream", List.of(WireValue.int32(drawable))).get(0).asInt32();
    assertEquals(List.of(WireValue.bool(true)), service.invoke("tile_stream_is_valid", List.of(WireValue.int32(handle))));

    List<WireValue> tile = service.invoke("tile_stream_get", List.of(WireValue.int32(handle)));
    assertEquals(8, tile.size());
    assertEquals(0, tile.get(0).asInt32());
    assertEquals(4, tile.get(2).asInt32());
    assertEquals(4, tile.get(4).asInt32());
    assertEquals(0, tile.get(6).asInt32());
    assertEquals(16, tile.get(7).asByteArray().length);

    byte[] ones = new byte[16];
    Arrays.fill(ones, (byte) 1);
    assertEquals(List.of(), service.invoke("tile_update",
        List.of(WireValue.int32(handle), WireValue.int32(16), WireValue.byteArray(ones))));
    assertEquals(List.of(WireValue.bool(true)), service.invoke("tile_stream_advance", List.of(WireValue.int32(handle))));
    assertEquals(1, service.invoke("tile_stream_get", List.of(WireValue.int32(handle))).get(6).asInt32());
    assertEquals(List.of(WireValue.bool(false)), service.invoke("tile_stream_advance", List.of(WireValue.int32(handle))));

    service.invoke("tile_stream_close", List.of(WireValue.int32(handle)));
    assertEquals(List.of(WireValue.bool(false)), service.invoke("tile_stream_is_valid", List.of(WireValue.int32(handle))));
    assertEquals(1, pixels.getPixels(drawable)[0]);
    assertEquals(0, pixels.getPixels(drawable)[4]);
  }

  @Test
  public void testRectangleStream() {
    int drawable = pixels.createDrawable(8, 8, 3);
    List<WireValue> args = List.of(WireValue.int32(drawable), WireValue.int32(1), WireValue.int32(1),
        WireValue.int32(2), WireValue.int32(2));
    int handle = service.invoke("rectangle_new_tile_stream", args).get(0).asInt32();

    List<WireValue> tile = service.invoke("tile_stream_get", List.of(WireValue.int32(handle)));
    assertEquals(1, tile.get(0).asInt32());
    assertEquals(1, tile.get(1).asInt32());
    assertEquals(6, tile.get(4).asInt32());
    assertEquals(3, tile.get(5).asInt32());
    assertEquals(12, tile.get(7).asByteArray().length);
  }

  @Test
  public void testQuitRunsAfterReply() {
    RecordingInvocation call = new RecordingInvocation("ggimp_quit") {
      @Override
      public void returnValues(List<WireValue> values) {
        assertEquals(0, quits.get());
        super.returnValues(values);
      }
    };
    service.handle(call);

    assertEquals(List.of(), call.values);
    assertEquals(1, quits.get());
  }

  @Test
  public void testFailedQuitDoesNotQuit() {
    RecordingInvocation call = new RecordingInvocation("ggimp_quit", WireValue.int32(1));
    service.handle(call);

    assertEquals(ErrorCategory.ARGUMENT, call.errorCategory);
    assertEquals(0, quits.get());
  }

  @Test
  public void testDescribeBuiltIns() {
    InterfaceInfo builtIns = service.describeBuiltIns();
    assertEquals(BridgeConfiguration.DEFAULT_ADDITIONAL_INTERFACE, builtIns.name());
    assertEquals(service.getBuiltInNames().size(), builtIns.methods().size());
    assertEquals("ggimp_about", service.getBuiltInNames().get(0));

    MethodInfo get = builtIns.method("tile_stream_get").orElseThrow();
    assertEquals("i", get.inSignature());
    assertEquals("iiiiiiiay", get.outSignature());
    assertEquals("iiay", builtIns.method("tile_update").orElseThrow().inSignature());

    assertTrue(service.isBuiltIn("ggimp_quit"));
    assertFalse(service.isBuiltIn("ggimp_irgb_new"));
  }

  private static class RecordingInvocation implements BusInvocation {
    private final String member;
    private final List<WireValue> args;
    List<WireValue> values;
    ErrorCategory errorCategory;
    String errorMessage;

    RecordingInvocation(String member, WireValue... args) {
      this.member = member;
      this.args = List.of(args);
    }

    @Override
    public String getInterfaceName() {
      return BridgeConfiguration.DEFAULT_PDB_INTERFACE;
    }

    @Override
    public String getMember() {
      return member;
    }

    @Override
    public List<WireValue> getArgs() {
      return args;
    }

    @Override
    public void returnValues(List<WireValue> values) {
      this.values = values;
    }

    @Override
    public void returnError(ErrorCategory category, String message) {
      this.errorCategory = category;
      this.errorMessage = message;
    }
  }
}
