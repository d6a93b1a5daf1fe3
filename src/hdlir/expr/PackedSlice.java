package hdlir.expr;

import hdlir.except.InternalException;

/** Named member of a packed struct signal, rendered as {@code parent.member}. */
public class PackedSlice extends VarSlice {
  private final String memberName;

  PackedSlice(Var parent, String memberName) {
    super(parent, 0, 0);
    this.memberName = memberName;
    PackedStruct struct = ((PackedVar)parent).getPackedStruct();
    int offset = 0;
    PackedStruct.Attribute member = null;
    for (PackedStruct.Attribute attribute : struct.getAttributes()) {
      if (attribute.name().equals(memberName)) {
        member = attribute;
        break;
      }
      offset += attribute.width();
    }
    if (member == null)
      throw new InternalException(String.format("%s does not exist in %s", memberName, struct.getStructName()));
    low = offset;
    high = offset + member.width() - 1;
    varLow = low;
    varHigh = high;
    varWidth = member.width();
    isSigned = member.isSigned();
  }

  public String getMemberName() { return memberName; }

  @Override
  public VarSlice sliceVar(Var newParent) {
    if (!(newParent instanceof PackedVar))
      throw new InternalException(String.format("%s is not a packed struct signal", newParent.handleName()));
    return ((PackedVar)newParent).member(memberName);
  }

  @Override
  public String toString() {
    return parentString() + "." + memberName;
  }
}
