package hdlir.ir;

public enum IRNodeKind { GeneratorKind, VarKind, StmtKind }
