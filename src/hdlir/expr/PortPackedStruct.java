package hdlir.expr;

import hdlir.except.UserException;
import hdlir.generator.Generator;
import java.util.List;

public class PortPackedStruct extends Port implements PackedVar {
  private final PackedStruct struct;

  public PortPackedStruct(Generator generator, PortDirection direction, String name, PackedStruct struct) {
    super(generator, direction, name, struct.getWidth(), List.of(1), PortType.Data, false);
    this.struct = struct;
    this.isPacked = true;
  }

  @Override
  public PackedStruct getPackedStruct() {
    return struct;
  }

  @Override
  public PackedSlice member(String memberName) {
    return (PackedSlice)slices.computeIfAbsent(memberName, key -> new PackedSlice(this, memberName));
  }

  @Override
  public void setIsPacked(boolean isPacked) {
    if (!isPacked)
      throw new UserException(String.format("Unable to set packed struct port %s unpacked", name));
  }
}
