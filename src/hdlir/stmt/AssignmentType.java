package hdlir.stmt;

/** Blocking or non-blocking; undefined until the enclosing block decides. */
public enum AssignmentType { Blocking, NonBlocking, Undefined }
