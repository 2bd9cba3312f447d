package com.zenlib.simplify;

import com.google.common.collect.EnumMultiset;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;
import com.zenlib.stats.ProcessTime;
import com.zenlib.util.Format;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Counters collected by one {@link Simplifier}.
 */
@NotThreadSafe
public final class SimplifierStats {

  private long rewrites = 0;
  private long cacheHits = 0;
  private final Multiset<Rule> rules = EnumMultiset.create(Rule.class);
  private ProcessTime elapsed = null;

  void rewrite() {
    rewrites++;
  }

  void cacheHit() {
    cacheHits++;
  }

  void fired(Rule rule) {
    rules.add(rule);
  }

  void elapsed(ProcessTime time) {
    this.elapsed = time;
  }

  /** Number of distinct nodes the rule sets ran on. */
  public long rewrites() {
    return rewrites;
  }

  /** Number of times a node was reached again after it had already been simplified. */
  public long cacheHits() {
    return cacheHits;
  }

  /** Number of times {@code rule} fired. */
  public int count(Rule rule) {
    return rules.count(rule);
  }

  /** Time the pass took, empty until it finished. */
  public Optional<ProcessTime> elapsed() {
    return Optional.ofNullable(elapsed);
  }

  /** Rules with the number of times each fired. */
  public ImmutableMultiset<Rule> rules() {
    return ImmutableMultiset.copyOf(rules);
  }

  @Override
  public String toString() {
    Format format = Format.defaultInstance();
    String ruleSummary = Multisets.copyHighestCountFirst(rules).entrySet().stream()
      .map(e -> e.getElement().name().toLowerCase(Locale.ROOT) + "=" + format.numeric(e.getCount()))
      .collect(Collectors.joining(" "));
    return "rewrote " + format.numeric(rewrites) + " nodes, " + format.numeric(cacheHits) + " cache hits" +
      (elapsed == null ? "" : " in " + elapsed) +
      (ruleSummary.isEmpty() ? "" : " rules: " + ruleSummary);
  }
}
