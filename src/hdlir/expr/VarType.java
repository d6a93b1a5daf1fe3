package hdlir.expr;

/** Kind tag of a signal node. */
public enum VarType { Base, PortIO, Expression, ConstValue, Parameter, Slice, BaseCasted, FunctionCall }
