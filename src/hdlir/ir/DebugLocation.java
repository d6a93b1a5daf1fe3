package hdlir.ir;

/** Source file and line a node was created or modified at. */
public record DebugLocation(String filename, int lineNumber) {
  @Override
  public String toString() {
    return filename + ":" + lineNumber;
  }
}
