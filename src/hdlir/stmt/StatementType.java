package hdlir.stmt;

public enum StatementType { If, Switch, Assign, Block, ModuleInstantiation, FunctionalCall, Return }
