package io.intellixity.dslite.query;

/**
 * {@code <type> JOIN <target> ON <on.left> <on.op> <on.right>}.
 * <p>
 * {@code on} may be null here; the join lowering rejects it before any SQL is built.
 */
public record JoinSpec(JoinType type, String target, On on) {
  public JoinSpec {
    type = (type == null) ? JoinType.LEFT : type;
  }

  public static JoinSpec left(String target, String left, String right) {
    return new JoinSpec(JoinType.LEFT, target, new On(left, right, null));
  }

  public static JoinSpec inner(String target, String left, String right) {
    return new JoinSpec(JoinType.INNER, target, new On(left, right, null));
  }

  public record On(String left, String right, String op) {
    public On {
      op = (op == null || op.isBlank()) ? "=" : op.trim();
    }
  }
}
