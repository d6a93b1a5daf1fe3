package hdlir.expr;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Renders expression trees with an explicit stack. Non-expression leaves are rendered by the given function. */
final class ExprRenderer {
  private record Frame(Var node, boolean top, boolean expanded) {}

  private ExprRenderer() {}

  static String render(Expr root, Function<Var, String> leaf) {
    Deque<Frame> todo = new ArrayDeque<>();
    Deque<String> done = new ArrayDeque<>();
    todo.push(new Frame(root, true, false));
    while (!todo.isEmpty()) {
      Frame frame = todo.pop();
      if (!(frame.node() instanceof Expr)) {
        done.push(leaf.apply(frame.node()));
        continue;
      }
      Expr expr = (Expr)frame.node();
      List<Var> operands = expr.operands();
      if (!frame.expanded()) {
        todo.push(new Frame(expr, frame.top(), true));
        for (int i = operands.size() - 1; i >= 0; --i)
          todo.push(new Frame(operands.get(i), isTopLevel(expr, operands.get(i)), false));
        continue;
      }
      String[] parts = new String[operands.size()];
      for (int i = operands.size() - 1; i >= 0; --i)
        parts[i] = done.pop();
      done.push(format(expr, frame.top(), parts));
    }
    return done.pop();
  }

  /** Operands of a generic operator need parentheses unless they use the same operator. */
  private static boolean isTopLevel(Expr parent, Var child) {
    switch (parent.getOp()) {
    case Concat:
    case Extend:
    case Conditional:
      return true;
    default:
      return child instanceof Expr && ((Expr)child).getOp() == parent.getOp();
    }
  }

  private static String format(Expr expr, boolean top, String[] parts) {
    String result;
    switch (expr.getOp()) {
    case Concat:
      return Stream.of(parts).collect(Collectors.joining(", ", "{", "}"));
    case Extend:
      return String.format("%d'(%s)", expr.getWidth(), parts[0]);
    case Conditional:
      result = String.format("%s ? %s: %s", parts[0], parts[1], parts[2]);
      break;
    default:
      if (parts.length == 1)
        result = expr.getOp().getSymbol() + parts[0];
      else
        result = parts[0] + " " + expr.getOp().getSymbol() + " " + parts[1];
      break;
    }
    return top ? result : "(" + result + ")";
  }
}
