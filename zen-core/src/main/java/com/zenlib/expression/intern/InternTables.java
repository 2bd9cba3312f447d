package com.zenlib.expression.intern;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of the intern tables that node classes create when they are loaded.
 */
public final class InternTables {

  private static final List<InternTable<?>> TABLES = new CopyOnWriteArrayList<>();

  private InternTables() {}

  /** Creates and registers a new table named {@code name}. */
  public static <V> InternTable<V> create(String name) {
    InternTable<V> table = new InternTable<>(name);
    TABLES.add(table);
    return table;
  }

  /** Returns the number of live entries in each registered table, by table name. */
  public static Map<String, Integer> sizes() {
    Map<String, Integer> result = new TreeMap<>();
    for (InternTable<?> table : TABLES) {
      result.merge(table.name(), table.size(), Integer::sum);
    }
    return result;
  }

  /** Returns the total number of live interned nodes. */
  public static long size() {
    long total = 0;
    for (InternTable<?> table : TABLES) {
      total += table.size();
    }
    return total;
  }
}
