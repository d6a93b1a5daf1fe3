package hdlir.expr;

import hdlir.generator.Generator;

public class EnumConst extends Const {
  private final EnumType enumType;
  private final String enumName;

  EnumConst(Generator generator, long value, int width, EnumType enumType, String enumName) {
    super(generator, value, width, false);
    this.enumType = enumType;
    this.enumName = enumName;
  }

  public String getEnumName() { return enumName; }

  @Override
  public boolean isEnum() {
    return true;
  }

  @Override
  public EnumType getEnumType() {
    return enumType;
  }

  @Override
  public String toString() {
    return enumName;
  }
}
