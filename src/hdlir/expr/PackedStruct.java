package hdlir.expr;

import hdlir.except.UserException;
import hdlir.util.SystemVerilogKeywords;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Struct type: named members packed from least significant bit upwards in declaration order. */
public class PackedStruct {
  public record Attribute(String name, int width, boolean isSigned) {}

  private final String structName;
  private final List<Attribute> attributes;

  public PackedStruct(String structName, List<Attribute> attributes) {
    if (!SystemVerilogKeywords.isValidVariableName(structName))
      throw new UserException(String.format("%s is a SystemVerilog keyword", structName));
    if (attributes.isEmpty())
      throw new UserException(String.format("Struct %s has no members", structName));
    Set<String> names = new LinkedHashSet<>();
    for (Attribute attribute : attributes) {
      if (!names.add(attribute.name()))
        throw new UserException(String.format("%s is declared twice in struct %s", attribute.name(), structName));
      if (attribute.width() <= 0)
        throw new UserException(String.format("%s.%s has non-positive width %d", structName, attribute.name(), attribute.width()));
      if (!SystemVerilogKeywords.isValidVariableName(attribute.name()))
        throw new UserException(String.format("%s is a SystemVerilog keyword", attribute.name()));
    }
    this.structName = structName;
    this.attributes = List.copyOf(attributes);
  }

  public String getStructName() { return structName; }
  public List<Attribute> getAttributes() { return attributes; }
  public int getWidth() { return attributes.stream().mapToInt(Attribute::width).sum(); }

  public Set<String> memberNames() {
    Set<String> names = new LinkedHashSet<>();
    attributes.forEach(attribute -> names.add(attribute.name()));
    return Collections.unmodifiableSet(names);
  }
}
