package com.zenlib.simplify;

import com.zenlib.expression.Expr;
import java.util.List;
import java.util.function.Function;

/**
 * Outcome of running the rules of one node: either its simplified form, or expressions that have to be simplified
 * before the simplified form can be built from their results.
 */
record RewriteStep(Expr<?> result, List<Expr<?>> inputs, Function<List<Expr<?>>, Expr<?>> finish) {

  static RewriteStep done(Expr<?> result) {
    return new RewriteStep(result, List.of(), null);
  }

  /** Simplifies {@code inputs} first, then builds the result from their simplified forms, in the same order. */
  static RewriteStep after(List<Expr<?>> inputs, Function<List<Expr<?>>, Expr<?>> finish) {
    return new RewriteStep(null, List.copyOf(inputs), finish);
  }

  boolean deferred() {
    return finish != null;
  }
}
