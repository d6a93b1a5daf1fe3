package hdlir.expr;

public enum ExprOp {
  // unary
  UInvert("~", true),
  UMinus("-", true),
  UPlus("+", true),
  UOr("|", true),
  UAnd("&", true),
  UXor("^", true),
  UNot("!", true),

  // binary
  Add("+", false),
  Minus("-", false),
  Multiply("*", false),
  Divide("/", false),
  Mod("%", false),
  LogicalShiftRight(">>", false),
  SignedShiftRight(">>>", false),
  ShiftLeft("<<", false),
  Or("|", false),
  And("&", false),
  Xor("^", false),
  LessThan("<", false),
  GreaterThan(">", false),
  LessEqThan("<=", false),
  GreaterEqThan(">=", false),
  Eq("==", false),
  Neq("!=", false),

  // structural
  Conditional("?", false),
  Concat(",", false),
  Extend("'", true);

  private final String symbol;
  private final boolean unary;

  private ExprOp(String symbol, boolean unary) {
    this.symbol = symbol;
    this.unary = unary;
  }

  public String getSymbol() { return symbol; }
  public boolean isUnary() { return unary; }

  public boolean isRelational() {
    switch (this) {
    case LessThan:
    case GreaterThan:
    case LessEqThan:
    case GreaterEqThan:
    case Eq:
    case Neq:
      return true;
    default:
      return false;
    }
  }

  public boolean isReduction() {
    switch (this) {
    case UOr:
    case UAnd:
    case UXor:
    case UNot:
      return true;
    default:
      return false;
    }
  }
}
