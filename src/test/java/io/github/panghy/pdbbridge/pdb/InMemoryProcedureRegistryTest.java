package io.github.panghy.pdbbridge.pdb;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link InMemoryProcedureRegistry}.
 */
public class InMemoryProcedureRegistryTest {

  private static final ProcedureInfo DOUBLE_IT = ProcedureInfo.of("test-double-it",
      Signature.of(ParamDef.of(ParamType.INT32, "x")),
      Signature.of(ParamDef.of(ParamType.INT32, "y")));

  private InMemoryProcedureRegistry registry;

  @BeforeEach
  public void setUp() {
    registry = new InMemoryProcedureRegistry();
    registry.install(DOUBLE_IT,
        (name, params) -> Procedure.success(Param.int32(((Param.IntParam) params.get(0)).value() * 2)));
  }

  @Test
  public void testLookupAndEnumerate() {
    assertEquals(Optional.of(DOUBLE_IT), registry.lookup("test-double-it"));
    assertEquals(Optional.empty(), registry.lookup("test_double_it"));
    assertEquals(List.of("test-double-it"), registry.enumerateAll());
  }

  @Test
  public void testInvoke() {
    Optional<List<Param>> result = registry.invoke(DOUBLE_IT, List.of(Param.int32(21)));
    assertEquals(Optional.of(List.of(Param.status(CallStatus.SUCCESS), Param.int32(42))), result);
  }

  @Test
  public void testThrowingProcedureIsExecutionError() {
    ProcedureInfo broken = ProcedureInfo.of("test-broken", Signature.empty(), Signature.empty());
    registry.install(broken, (name, params) -> {
      throw new IllegalStateException("broken");
    });

    assertEquals(Optional.of(List.of(Param.status(CallStatus.EXECUTION_ERROR))),
        registry.invoke(broken, List.of()));
  }

  @Test
  public void testEmptyResultIsNoResult() {
    ProcedureInfo silent = ProcedureInfo.of("test-silent", Signature.empty(), Signature.empty());
    registry.install(silent, (name, params) -> List.of());

    assertFalse(registry.invoke(silent, List.of()).isPresent());
  }

  @Test
  public void testUninstall() {
    assertTrue(registry.uninstall("test-double-it"));
    assertFalse(registry.uninstall("test-double-it"));
    assertFalse(registry.invoke(DOUBLE_IT, List.of(Param.int32(1))).isPresent());
    assertTrue(registry.enumerateAll().isEmpty());
  }

  @Test
  public void testInstallReplaces() {
    registry.install(DOUBLE_IT, (name, params) -> Procedure.failure(CallStatus.CANCEL));
    assertEquals(1, registry.enumerateAll().size());
    assertEquals(Optional.of(List.of(Param.status(CallStatus.CANCEL))),
        registry.invoke(DOUBLE_IT, List.of(Param.int32(1))));
  }
}
