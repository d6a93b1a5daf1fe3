package hdlir.expr;

import hdlir.except.UserException;
import hdlir.generator.Generator;
import java.util.List;

public class VarPackedStruct extends Var implements PackedVar {
  private final PackedStruct struct;

  public VarPackedStruct(Generator generator, String name, PackedStruct struct) {
    super(generator, name, struct.getWidth(), List.of(1), false);
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
      throw new UserException(String.format("Unable to set packed struct %s unpacked", name));
  }
}
