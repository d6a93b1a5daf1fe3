package hdlir.except;

/** Invalid user input, e.g. a reserved identifier or a literal that does not fit its width. */
public class UserException extends IRException {
  private static final long serialVersionUID = 1L;

  public UserException(String message) { super(message); }
}
