package hdlir.expr;

import hdlir.except.UserException;
import hdlir.generator.Generator;
import hdlir.util.SystemVerilogKeywords;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Named constant that can drive the width of signals and the value of chained parameters.
 * Starts out with value 0.
 */
public class Param extends Const {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final String parameterName;
  private final Set<Var> paramVars = new LinkedHashSet<>();
  private final Set<Param> chainedParams = new LinkedHashSet<>();
  private Param parentParam = null;

  public Param(Generator generator, String parameterName, int width, boolean isSigned) {
    super(generator, 0, width, isSigned);
    if (!SystemVerilogKeywords.isValidVariableName(parameterName))
      throw new UserException(String.format("%s is a SystemVerilog keyword", parameterName));
    this.parameterName = parameterName;
    this.name = parameterName;
    this.type = VarType.Parameter;
  }

  public String getParameterName() { return parameterName; }
  public Set<Var> getParamVars() { return Collections.unmodifiableSet(paramVars); }
  public Set<Param> getChainedParams() { return Collections.unmodifiableSet(chainedParams); }
  public Param getParentParam() { return parentParam; }

  void addParamVar(Var var) { paramVars.add(var); }

  /**
   * Sets the value and propagates it to every parametrized signal and every chained parameter.
   * Nothing is changed if any parameter in the chain rejects the value.
   * @throws UserException if the value does not fit, or is not a valid width while signals depend on the chain
   */
  @Override
  public void setValue(long newValue) {
    List<Param> chain = chain();
    for (Param param : chain)
      param.checkValue(newValue);
    for (Param param : chain)
      param.applyValue(newValue);
  }

  /**
   * Makes this parameter follow {@code parent}: it takes the parent's current value now and every later one.
   * @throws UserException if this would create a cycle or the parent's value is not acceptable here
   */
  public void setValue(Param parent) {
    for (Param param = parent; param != null; param = param.parentParam) {
      if (param == this)
        throw new UserException(String.format("Chaining %s to %s creates a cycle", parameterName, parent.getParameterName()));
    }
    for (Param param : chain())
      param.checkValue(parent.getValue());
    if (parentParam != null)
      parentParam.chainedParams.remove(this);
    parentParam = parent;
    parent.chainedParams.add(this);
    setValue(parent.getValue());
  }

  /** This parameter followed by every parameter chained to it, breadth first. */
  private List<Param> chain() {
    List<Param> result = new ArrayList<>();
    Set<Param> seen = new LinkedHashSet<>();
    Deque<Param> pending = new ArrayDeque<>();
    pending.add(this);
    while (!pending.isEmpty()) {
      Param param = pending.poll();
      if (!seen.add(param))
        continue;
      result.add(param);
      pending.addAll(param.chainedParams);
    }
    return result;
  }

  private void checkValue(long newValue) {
    checkRange(newValue, getWidth(), isSigned);
    if (newValue <= 0 && !paramVars.isEmpty())
      throw new UserException(String.format("%s is used for parametrizing variable width, thus cannot be non-positive (%d)", parameterName,
                                            newValue));
    if (newValue > Integer.MAX_VALUE && !paramVars.isEmpty())
      throw new UserException(String.format("%s is used for parametrizing variable width, %d exceeds the largest width (%d)", parameterName,
                                            newValue, Integer.MAX_VALUE));
  }

  private void applyValue(long newValue) {
    value = newValue;
    for (Var var : paramVars)
      var.varWidth = (int)newValue;
    if (generator != null)
      generator.captureDebug(this);
    logger.debug("Set parameter {} to {}, {} dependent signal(s)", parameterName, newValue, paramVars.size());
  }

  @Override
  public String toString() {
    return parameterName;
  }
}
