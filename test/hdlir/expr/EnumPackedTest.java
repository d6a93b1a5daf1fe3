package hdlir.expr;

import hdlir.IRContext;
import hdlir.except.InternalException;
import hdlir.except.UserException;
import hdlir.except.VarException;
import hdlir.expr.Port.PortDirection;
import hdlir.generator.Generator;
import hdlir.stmt.AssignStmt;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EnumPackedTest {
  IRContext context;
  Generator top;
  EnumType state;

  @BeforeEach
  void setUp() {
    context = new IRContext();
    top = context.generator("top");
    Map<String, Long> values = new LinkedHashMap<>();
    values.put("IDLE", 0L);
    values.put("RUN", 1L);
    values.put("DONE", 2L);
    state = top.enumType("state_t", values, 2);
  }

  @Test
  void testEnumValues() {
    EnumConst run = state.getEnum("RUN");
    Assertions.assertEquals(1, run.getValue());
    Assertions.assertEquals("RUN", run.toString());
    Assertions.assertTrue(run.isEnum());
    Assertions.assertSame(state, run.getEnumType());
    Assertions.assertThrows(UserException.class, () -> state.getEnum("HALT"));
    Assertions.assertThrows(UserException.class, () -> top.enumType("out_t", Map.of("BIG", 4L), 2));
  }

  @Test
  void testEnumAssignment() {
    EnumVar current = top.enumVar("current", state);
    Assertions.assertEquals(2, current.getWidth());
    AssignStmt stmt = current.assign(state.getEnum("DONE"));
    Assertions.assertTrue(current.getSinks().contains(stmt));

    EnumType other = top.enumType("mode_t", Map.of("A", 0L), 2);
    Assertions.assertThrows(VarException.class, () -> current.assign(other.getEnum("A")));
    Var plain = top.var("plain", 2);
    Assertions.assertThrows(VarException.class, () -> current.assign(plain));
    Assertions.assertTrue(plain.getSources().isEmpty());

    // plain signals accept enum values
    Assertions.assertSame(plain, plain.assign(current).getLeft());

    EnumPort port = top.enumPort(PortDirection.Out, "state_out", state);
    port.assign(current);
    Assertions.assertThrows(VarException.class, () -> port.assign(plain));
  }

  @Test
  void testPackedStruct() {
    PackedStruct struct = new PackedStruct("packet_t", List.of(new PackedStruct.Attribute("valid", 1, false),
                                                               new PackedStruct.Attribute("data", 8, false),
                                                               new PackedStruct.Attribute("offset", 4, true)));
    Assertions.assertEquals(13, struct.getWidth());
    VarPackedStruct packet = top.packedVar("packet", struct);
    Assertions.assertEquals(13, packet.getWidth());
    Assertions.assertTrue(packet.isPacked());

    PackedSlice data = packet.member("data");
    Assertions.assertEquals(8, data.getWidth());
    Assertions.assertEquals(1, data.getVarLow());
    Assertions.assertEquals(8, data.getVarHigh());
    Assertions.assertFalse(data.isSigned());
    Assertions.assertSame(data, packet.member("data"));
    Assertions.assertEquals("packet.data", data.toString());

    PackedSlice offset = packet.member("offset");
    Assertions.assertTrue(offset.isSigned());
    Assertions.assertEquals(9, offset.getVarLow());
    Assertions.assertThrows(InternalException.class, () -> packet.member("missing"));

    AssignStmt stmt = data.assign(top.var("byte_in", 8));
    Assertions.assertTrue(packet.getSinks().contains(stmt));
  }

  @Test
  void testPackedPort() {
    PackedStruct struct = new PackedStruct("req_t", List.of(new PackedStruct.Attribute("addr", 16, false)));
    PortPackedStruct req = top.packedPort(PortDirection.In, "req", struct);
    Assertions.assertEquals(16, req.member("addr").getWidth());
    Assertions.assertEquals(VarType.PortIO, req.getType());
    Assertions.assertThrows(UserException.class, () -> req.setIsPacked(false));
  }

  @Test
  void testPackedStructValidation() {
    Assertions.assertThrows(UserException.class,
                            () -> new PackedStruct("bad_t", List.of(new PackedStruct.Attribute("x", 1, false), new PackedStruct.Attribute("x", 2, false))));
    Assertions.assertThrows(UserException.class, () -> new PackedStruct("empty_t", List.of()));
    Assertions.assertThrows(UserException.class, () -> new PackedStruct("zero_t", List.of(new PackedStruct.Attribute("x", 0, false))));
  }
}
