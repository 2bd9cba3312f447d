package com.zenlib.simplify;

import com.carrotsearch.hppc.LongHashSet;
import com.carrotsearch.hppc.LongObjectHashMap;
import com.zenlib.ContractViolationException;
import com.zenlib.expression.Expr;
import com.zenlib.util.Contract;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Results of one simplification pass, keyed by the id of the node that was simplified.
 * <p>
 * Each node is rewritten at most once per cache, so a subexpression shared by many parents is simplified once and all
 * parents get the same simplified instance. Every result is also stored as its own simplification.
 * <p>
 * A node whose rules wait on other expressions stays pending until {@link #complete} is called for it. Needing a
 * pending node again before then means its result depends on itself.
 */
@NotThreadSafe
public final class RewriteCache {

  private final LongObjectHashMap<Expr<?>> results = new LongObjectHashMap<>();
  private final LongHashSet pending = new LongHashSet();

  /** Returns the simplified form of {@code node} or {@code null} if it has not been computed yet. */
  @SuppressWarnings("unchecked")
  public <T> Expr<T> get(Expr<T> node) {
    return (Expr<T>) results.get(node.id());
  }

  public boolean contains(Expr<?> node) {
    return results.containsKey(node.id());
  }

  /**
   * Checks that {@code node} is not waiting on other expressions.
   *
   * @throws ContractViolationException if {@code node} is pending, which happens when a list match builds an
   *                                    expression that contains the match being simplified
   */
  public void checkNotPending(Expr<?> node) {
    if (pending.contains(node.id())) {
      throw new ContractViolationException("expression depends on itself while being simplified: " + node);
    }
  }

  /** Marks {@code node} as waiting on the results of other expressions. */
  public void suspend(Expr<?> node) {
    if (contains(node) || !pending.add(node.id())) {
      throw Contract.unreachable("%s suspended twice", node);
    }
  }

  /** Stores {@code result} as the simplified form of {@code node} and of itself. */
  public void complete(Expr<?> node, Expr<?> result) {
    pending.remove(node.id());
    results.put(node.id(), result);
    if (!results.containsKey(result.id()) && !pending.contains(result.id())) {
      results.put(result.id(), result);
    }
  }

  /** Number of cached entries, including results stored as their own simplification. */
  public int size() {
    return results.size();
  }
}
