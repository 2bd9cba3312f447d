package com.zenlib.expression.intern;

import com.google.common.collect.MapMaker;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide table that maps an {@link InternKey} to the single live node built for it.
 * <p>
 * Values are held weakly: once no expression references a node its entry disappears, which never affects live
 * entries. A later request for the same key builds a fresh node.
 *
 * @param <V> node class stored in the table
 */
@ThreadSafe
public final class InternTable<V> {

  private static final Logger LOGGER = LoggerFactory.getLogger(InternTable.class);

  private final String name;
  private final ConcurrentMap<InternKey, V> table = new MapMaker().weakValues().makeMap();
  private final AtomicLong created = new AtomicLong();

  InternTable(String name) {
    this.name = name;
  }

  /**
   * Returns the node stored for {@code key}, calling {@code constructor} to build and store one if there is none.
   * <p>
   * When threads race on the same key each may call {@code constructor}, but only one result is stored and returned
   * to all of them.
   */
  public Interned<V> getOrCreate(InternKey key, Supplier<? extends V> constructor) {
    V existing = table.get(key);
    if (existing != null) {
      return new Interned<>(false, existing);
    }
    V fresh = constructor.get();
    V raced = table.putIfAbsent(key, fresh);
    if (raced != null) {
      return new Interned<>(false, raced);
    }
    long count = created.incrementAndGet();
    if (count >= 1024 && Long.bitCount(count) == 1) {
      LOGGER.debug("{} table has created {} nodes, {} live", name, count, table.size());
    }
    return new Interned<>(true, fresh);
  }

  /** Returns a node already stored for {@code key} or {@code null} without creating one. */
  public V get(InternKey key) {
    return table.get(key);
  }

  public String name() {
    return name;
  }

  /** Number of live entries, approximate while the garbage collector reclaims unreachable nodes. */
  public int size() {
    return table.size();
  }

  /** Total number of nodes this table has created. */
  public long created() {
    return created.get();
  }

  @Override
  public String toString() {
    return "InternTable{" + name + ", size=" + size() + ", created=" + created() + "}";
  }
}
