package hdlir.expr;

import hdlir.except.UserException;
import hdlir.except.VarException;
import hdlir.generator.Generator;
import hdlir.util.SystemVerilogKeywords;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Enumerated type: named constants of a common width. */
public class EnumType {
  private final String name;
  private final int width;
  private final Map<String, EnumConst> values = new LinkedHashMap<>();

  public EnumType(Generator generator, String name, Map<String, Long> values, int width) {
    if (!SystemVerilogKeywords.isValidVariableName(name))
      throw new UserException(String.format("%s is a SystemVerilog keyword", name));
    this.name = name;
    this.width = width;
    for (var entry : values.entrySet())
      this.values.put(entry.getKey(), new EnumConst(generator, entry.getValue(), width, this, entry.getKey()));
  }

  public String getName() { return name; }
  public int getWidth() { return width; }
  public Map<String, EnumConst> getValues() { return Collections.unmodifiableMap(values); }

  /** @throws UserException if {@code valueName} is not a member */
  public EnumConst getEnum(String valueName) {
    EnumConst result = values.get(valueName);
    if (result == null)
      throw new UserException(String.format("Cannot find %s in %s", valueName, name));
    return result;
  }

  /** Checks that {@code source} carries this enum type before it is assigned to {@code sink}. */
  void checkAssignable(Var sink, Var source) {
    if (!source.isEnum())
      throw new VarException(String.format("Cannot assign non-enum %s to enum %s", source, sink), sink, source);
    if (!source.getEnumType().getName().equals(name))
      throw new VarException(String.format("Cannot assign enum type %s to %s (%s)", source.getEnumType().getName(), sink, name), sink, source);
  }

  @Override
  public String toString() {
    return name;
  }
}
