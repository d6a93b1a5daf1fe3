package hdlir.ir;

import hdlir.IRContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Common base of every node in the IR graph: scopes, signals and statements.
 * Nodes are identified by object identity; {@link #getInstanceID()} gives a stable, unique number for printing.
 */
public abstract class IRNode {
  private static final AtomicLong instanceCounter = new AtomicLong(0);

  private final long instanceID;
  private final IRNodeKind irNodeKind;
  private final List<DebugLocation> debugLocations = new ArrayList<>();

  protected IRNode(IRNodeKind irNodeKind) {
    this.instanceID = instanceCounter.incrementAndGet();
    this.irNodeKind = irNodeKind;
  }

  public long getInstanceID() { return instanceID; }
  public IRNodeKind getIRNodeKind() { return irNodeKind; }

  /** Logical parent: owning scope for signals and scopes, enclosing block or scope for statements. May be null. */
  public abstract IRNode parent();

  public int childCount() { return 0; }
  public IRNode getChild(int index) { throw new IndexOutOfBoundsException(index); }

  public abstract void accept(IRVisitor visitor);

  /** The session this node belongs to, if it can be resolved from its scope. */
  public abstract Optional<IRContext> context();

  public List<DebugLocation> getDebugLocations() { return Collections.unmodifiableList(debugLocations); }

  public void addDebugLocation(DebugLocation location) { debugLocations.add(location); }
}
