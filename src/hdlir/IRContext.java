package hdlir;

import hdlir.expr.Const;
import hdlir.expr.FunctionCallVar;
import hdlir.expr.Var;
import hdlir.generator.Generator;
import hdlir.stmt.FunctionStmtBlock;
import hdlir.ui.IRConfig;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A construction session. Owns the shared constant scope, the registry of constants created through it and the configuration.
 * Nodes are plain Java objects; closing the context releases the registries and rejects further construction.
 */
public class IRContext implements AutoCloseable {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final IRConfig config;
  private final Generator constScope;
  private final Set<Const> constants = new LinkedHashSet<>();
  private final List<Generator> generators = new ArrayList<>();
  private boolean closed = false;

  public IRContext() { this(new IRConfig()); }

  public IRContext(IRConfig config) {
    this.config = config;
    this.constScope = new Generator(this, "");
  }

  public IRConfig getConfig() { return config; }

  /** The scope constants and detached function calls live in. */
  public Generator getConstScope() { return constScope; }

  public boolean isConstScope(Generator generator) { return generator == constScope; }

  /** Creates a new top-level scope. Debug capture follows {@link IRConfig#debug}. */
  public Generator generator(String name) {
    checkOpen();
    Generator generator = new Generator(this, name);
    generator.setDebug(config.debug);
    generators.add(generator);
    logger.debug("Created generator {}", name);
    return generator;
  }

  /**
   * Creates a constant in the constant scope.
   * @throws hdlir.except.UserException if {@code value} does not fit {@code width} bits with the given signedness
   */
  public Const constant(long value, int width, boolean isSigned) {
    checkOpen();
    Const result = new Const(constScope, value, width, isSigned);
    constants.add(result);
    return result;
  }

  /**
   * Creates a call not yet bound to a generator. It moves to the generator of the first assignment that reads it,
   * which registers the function there if needed.
   */
  public FunctionCallVar call(FunctionStmtBlock func, Map<String, Var> args) {
    checkOpen();
    return new FunctionCallVar(constScope, func, args, true);
  }

  public Set<Const> getConstants() { return Collections.unmodifiableSet(constants); }

  public List<Generator> getGenerators() { return Collections.unmodifiableList(generators); }

  public boolean isClosed() { return closed; }

  @Override
  public void close() {
    if (closed)
      return;
    logger.debug("Closing IR context with {} generator(s) and {} constant(s)", generators.size(), constants.size());
    constants.clear();
    generators.clear();
    closed = true;
  }

  private void checkOpen() {
    if (closed)
      throw new IllegalStateException("IR context is closed");
  }
}
