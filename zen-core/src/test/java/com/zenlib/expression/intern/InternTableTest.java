package com.zenlib.expression.intern;

import static com.zenlib.expression.Zen.*;
import static org.junit.jupiter.api.Assertions.*;

import com.zenlib.expression.Expr;
import com.zenlib.expression.ExprKind;
import com.zenlib.type.ExprType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class InternTableTest {

  private final Expr<Boolean> a = symbolic(ExprType.BOOL, "a");
  private final Expr<Boolean> b = symbolic(ExprType.BOOL, "b");

  @Test
  void testGetOrCreate() {
    InternTable<String> table = new InternTable<>("test");
    InternKey key = InternKey.ofChildren(ExprKind.AND, a, b);
    Interned<String> first = table.getOrCreate(key, () -> new String("first"));
    Interned<String> second = table.getOrCreate(InternKey.ofChildren(ExprKind.AND, a, b), () -> "second");
    assertTrue(first.isNew());
    assertFalse(second.isNew());
    assertSame(first.instance(), second.instance());
    assertSame(first.instance(), table.get(key));
    assertEquals(1, table.created());
    assertEquals(1, table.size());
  }

  @Test
  void testKeysCompareEveryPart() {
    InternKey key = InternKey.of(ExprKind.GET_FIELD, "x", a);
    assertEquals(key, InternKey.of(ExprKind.GET_FIELD, "x", a));
    assertEquals(key.hashCode(), InternKey.of(ExprKind.GET_FIELD, "x", a).hashCode());
    assertNotEquals(key, InternKey.of(ExprKind.GET_FIELD, "y", a));
    assertNotEquals(key, InternKey.of(ExprKind.WITH_FIELD, "x", a));
    assertNotEquals(key, InternKey.of(ExprKind.GET_FIELD, "x", b));
    assertNotEquals(InternKey.ofChildren(ExprKind.AND, a, b), InternKey.ofChildren(ExprKind.AND, b, a));
    assertNotEquals(InternKey.ofChildren(ExprKind.AND, a), InternKey.ofChildren(ExprKind.AND, a, a));
  }

  @Test
  void testMissingKey() {
    InternTable<String> table = new InternTable<>("test");
    assertNull(table.get(InternKey.ofChildren(ExprKind.NOT, a)));
    assertEquals(0, table.created());
  }

  @Test
  void testRegisteredTables() {
    Expr<Boolean> node = not(a);
    assertTrue(InternTables.sizes().get("not") >= 1);
    assertTrue(InternTables.size() >= 1);
    assertNotNull(node);
  }

  @Test
  @Timeout(30)
  void testConcurrentCreationReturnsOneInstance() throws Exception {
    InternTable<Object> table = new InternTable<>("concurrent");
    int threads = 8;
    int keys = 1_000;
    List<Expr<Boolean>> leaves = new ArrayList<>();
    for (int i = 0; i < keys; i++) {
      leaves.add(symbolic(ExprType.BOOL, "v" + i));
    }
    AtomicInteger constructed = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<List<Object>>> results = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        results.add(executor.submit(() -> {
          start.await();
          List<Object> instances = new ArrayList<>();
          for (Expr<Boolean> leaf : leaves) {
            instances.add(table.getOrCreate(InternKey.ofChildren(ExprKind.NOT, leaf), () -> {
              constructed.incrementAndGet();
              return new Object();
            }).instance());
          }
          return instances;
        }));
      }
      start.countDown();
      List<Object> expected = results.get(0).get();
      for (Future<List<Object>> result : results) {
        List<Object> actual = result.get();
        for (int i = 0; i < keys; i++) {
          assertSame(expected.get(i), actual.get(i));
        }
      }
      Set<Object> distinct = new HashSet<>(expected);
      assertEquals(keys, distinct.size());
      assertEquals(keys, table.created());
      assertTrue(constructed.get() >= keys);
    } finally {
      executor.shutdown();
      assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    }
  }

  @Test
  @Timeout(30)
  void testConcurrentFactoriesAgree() throws Exception {
    int threads = 8;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<List<Expr<Boolean>>>> results = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        results.add(executor.submit(() -> {
          List<Expr<Boolean>> built = new ArrayList<>();
          for (int i = 0; i < 500; i++) {
            built.add(or(and(a, b), eq(constant(ExprType.INT32, i), constant(ExprType.INT32, i + 1))));
          }
          return built;
        }));
      }
      List<Expr<Boolean>> expected = results.get(0).get();
      for (Future<List<Expr<Boolean>>> result : results) {
        List<Expr<Boolean>> actual = result.get();
        for (int i = 0; i < expected.size(); i++) {
          assertSame(expected.get(i), actual.get(i));
        }
      }
    } finally {
      executor.shutdown();
      assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    }
  }
}
