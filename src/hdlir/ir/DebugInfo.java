package hdlir.ir;

import java.lang.StackWalker.StackFrame;
import java.security.CodeSource;
import java.util.Objects;
import java.util.Optional;

/** Captures the first caller location outside of this library's own classes. */
public final class DebugInfo {
  private static final StackWalker walker = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);
  private static final String libraryLocation = locationOf(IRNode.class);

  private DebugInfo() {}

  public static Optional<DebugLocation> capture() {
    return walker.walk(frames -> frames.filter(frame -> !isLibraryFrame(frame)).findFirst())
        .filter(frame -> frame.getFileName() != null)
        .map(frame -> new DebugLocation(frame.getFileName(), frame.getLineNumber()));
  }

  private static boolean isLibraryFrame(StackFrame frame) {
    Class<?> cls = frame.getDeclaringClass();
    // test classes share the package names but are loaded from a different code source
    return cls.getName().startsWith("hdlir.") && Objects.equals(locationOf(cls), libraryLocation);
  }

  private static String locationOf(Class<?> cls) {
    CodeSource source = cls.getProtectionDomain().getCodeSource();
    if (source == null || source.getLocation() == null)
      return null;
    return source.getLocation().toString();
  }
}
