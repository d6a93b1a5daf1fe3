package hdlir.expr;

import hdlir.generator.Generator;
import java.util.List;

public class EnumVar extends Var {
  private final EnumType enumType;

  public EnumVar(Generator generator, String name, EnumType enumType) {
    super(generator, name, enumType.getWidth(), List.of(1), false);
    this.enumType = enumType;
  }

  @Override
  public boolean isEnum() {
    return true;
  }

  @Override
  public EnumType getEnumType() {
    return enumType;
  }

  @Override
  public void checkAssignable(Var source) {
    checkSinkKind(source);
    enumType.checkAssignable(this, source);
  }
}
