package hdlir.expr;

import java.util.Set;

/** A signal whose bits are laid out by a {@link PackedStruct}. */
public interface PackedVar {
  PackedStruct getPackedStruct();

  /** Projection onto one struct member; memoized per member name. */
  PackedSlice member(String memberName);

  default Set<String> memberNames() { return getPackedStruct().memberNames(); }
}
