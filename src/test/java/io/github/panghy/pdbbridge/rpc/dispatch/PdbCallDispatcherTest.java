package io.github.panghy.pdbbridge.rpc.dispatch;

import io.github.panghy.pdbbridge.pdb.CallStatus;
import io.github.panghy.pdbbridge.pdb.InMemoryProcedureRegistry;
import io.github.panghy.pdbbridge.pdb.Param;
import io.github.panghy.pdbbridge.pdb.ParamDef;
import io.github.panghy.pdbbridge.pdb.ParamType;
import io.github.panghy.pdbbridge.pdb.Procedure;
import io.github.panghy.pdbbridge.pdb.ProcedureInfo;
import io.github.panghy.pdbbridge.pdb.ProcedureRegistry;
import io.github.panghy.pdbbridge.pdb.Signature;
import io.github.panghy.pdbbridge.rpc.error.CallFailedException;
import io.github.panghy.pdbbridge.rpc.error.EncodeFailedException;
import io.github.panghy.pdbbridge.rpc.error.InvalidArgumentException;
import io.github.panghy.pdbbridge.rpc.error.TypeMismatchException;
import io.github.panghy.pdbbridge.rpc.error.UnknownProcedureException;
import io.github.panghy.pdbbridge.rpc.serialization.ParamCodec;
import io.github.panghy.pdbbridge.rpc.serialization.WireValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link PdbCallDispatcher}.
 */
public class PdbCallDispatcherTest {

  private static final ProcedureInfo ADD_ONE = ProcedureInfo.of("add-one",
      Signature.of(ParamDef.of(ParamType.INT32, "x")),
      Signature.of(ParamDef.of(ParamType.INT32, "y")));

  private InMemoryProcedureRegistry registry;
  private ParamCodec codec;
  private PdbCallDispatcher dispatcher;

  @BeforeEach
  public void setUp() {
    registry = new InMemoryProcedureRegistry();
    registry.install(ADD_ONE, (name, params) ->
        Procedure.success(Param.int32(((Param.IntParam) params.get(0)).value() + 1)));
    codec = spy(new ParamCodec());
    dispatcher = new PdbCallDispatcher(registry, codec);
  }

  @Test
  public void testAddOne() {
    List<WireValue> result = dispatcher.dispatch("add_one", List.of(WireValue.int32(41)));
    assertEquals(List.of(WireValue.int32(42)), result);
  }

  @Test
  public void testStringArgumentRejected() {
    assertThatThrownBy(() -> dispatcher.dispatch("add_one", List.of(WireValue.string("x"))))
        .isInstanceOf(TypeMismatchException.class)
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessageContaining("parameter 0");
  }

  @Test
  public void testArgumentCountErrorNamesMethod() {
    assertThatThrownBy(() -> dispatcher.dispatch("add_one", List.of()))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessage("add_one expects 1 parameter, received 0");
  }

  @Test
  public void testUnknownMethod() {
    assertThatThrownBy(() -> dispatcher.dispatch("subtract_one", List.of(WireValue.int32(1))))
        .isInstanceOf(UnknownProcedureException.class)
        .hasMessage("Invalid method: 'subtract_one'");
  }

  @Test
  public void testExecutionErrorSkipsEncoding() {
    registry.install(ADD_ONE, (name, params) -> Procedure.failure(CallStatus.EXECUTION_ERROR));

    assertThatThrownBy(() -> dispatcher.dispatch("add_one", List.of(WireValue.int32(41))))
        .isInstanceOf(CallFailedException.class)
        .hasMessage("call to add-one failed with an execution error")
        .satisfies(thrown ->
            assertThat(((CallFailedException) thrown).getStatus()).isEqualTo(CallStatus.EXECUTION_ERROR));
    verify(codec, never()).encodeAll(any(), any());
  }

  @Test
  public void testThrowingProcedureReportsExecutionError() {
    registry.install(ADD_ONE, (name, params) -> {
      throw new IllegalStateException("plug-in crashed");
    });

    assertThatThrownBy(() -> dispatcher.dispatch("add_one", List.of(WireValue.int32(41))))
        .isInstanceOf(CallFailedException.class)
        .hasMessageContaining("execution error");
  }

  @Test
  public void testCancelledCall() {
    registry.install(ADD_ONE, (name, params) -> Procedure.failure(CallStatus.CANCEL));

    assertThatThrownBy(() -> dispatcher.dispatch("add_one", List.of(WireValue.int32(41))))
        .isInstanceOf(CallFailedException.class)
        .hasMessage("call to add-one failed because it was canceled");
  }

  @Test
  public void testRegistryReturnsNothing() {
    ProcedureRegistry empty = mock(ProcedureRegistry.class);
    when(empty.lookup("add-one")).thenReturn(Optional.of(ADD_ONE));
    when(empty.invoke(any(), any())).thenReturn(Optional.empty());

    assertThatThrownBy(() -> new PdbCallDispatcher(empty).dispatch("add_one", List.of(WireValue.int32(1))))
        .isInstanceOf(CallFailedException.class)
        .hasMessage("call to add-one failed for an unknown reason");
  }

  @Test
  public void testUnencodableResult() {
    ProcedureInfo info = ProcedureInfo.of("get-region", Signature.empty(),
        Signature.of(ParamDef.of(ParamType.REGION, "region")));
    registry.install(info, (name, params) ->
        Procedure.success(new Param.OpaqueParam(ParamType.REGION, new Object())));

    assertThatThrownBy(() -> dispatcher.dispatch("get_region", List.of()))
        .isInstanceOf(EncodeFailedException.class);
  }

  @Test
  public void testDecodeFailureNeverInvokes() {
    ProcedureRegistry mocked = mock(ProcedureRegistry.class);
    when(mocked.lookup("add-one")).thenReturn(Optional.of(ADD_ONE));

    assertThatThrownBy(() -> new PdbCallDispatcher(mocked).dispatch("add_one", List.of()))
        .isInstanceOf(InvalidArgumentException.class);
    verify(mocked, never()).invoke(any(), any());
  }
}
