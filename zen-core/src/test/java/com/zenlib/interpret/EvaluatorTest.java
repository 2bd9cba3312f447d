package com.zenlib.interpret;

import static com.zenlib.TestUtils.*;
import static com.zenlib.expression.Zen.*;
import static org.junit.jupiter.api.Assertions.*;

import com.zenlib.ContractViolationException;
import com.zenlib.expression.Expr;
import com.zenlib.expression.VariableExpr;
import com.zenlib.type.ExprType;
import com.zenlib.type.ObjectValue;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class EvaluatorTest {

  private final VariableExpr<Boolean> a = symbolic(ExprType.BOOL, "a");
  private final VariableExpr<Long> x = symbolic(ExprType.INT8, "x");
  private final VariableExpr<List<Long>> l = symbolic(ExprType.INT8.list(), "l");
  private final VariableExpr<ObjectValue> p = symbolic(POINT, "p");

  @Test
  void testUnboundVariablesUseDefaults() {
    assertEquals(false, evaluate(a));
    assertEquals(0L, evaluate(x));
    assertEquals(List.of(), evaluate(l));
    assertEquals(ObjectValue.of(POINT, Map.of("x", 0L, "y", 0L)), evaluate(p));
    assertEquals("", evaluate(symbolic(ExprType.STRING, "s")));
    assertEquals(BigInteger.ZERO, evaluate(symbolic(ExprType.BIG_INTEGER, "n")));
  }

  @Test
  void testBoundVariables() {
    Environment environment = Environment.empty().with(a, true).with(x, -3L);
    assertEquals(true, evaluate(a, environment));
    assertEquals(-3L, evaluate(x, environment));
    assertTrue(environment.isBound(a));
    assertFalse(Environment.empty().isBound(a));
  }

  @Test
  void testVariablesAreMatchedByInstance() {
    VariableExpr<Long> other = symbolic(ExprType.INT8, "x");
    Environment environment = Environment.empty().with(x, 5);
    assertEquals(5L, evaluate(x, environment));
    assertEquals(0L, evaluate(other, environment));
  }

  @Test
  void testRejectsValuesOfTheWrongType() {
    assertThrows(ContractViolationException.class, () -> Environment.empty().with(x, 300L));
    assertThrows(ContractViolationException.class, () -> Environment.empty().with(x, "1"));
    assertThrows(ContractViolationException.class, () -> Environment.empty().with(a, 1));
  }

  @Test
  void testBooleanLogic() {
    Environment environment = Environment.empty().with(a, true);
    assertEquals(false, evaluate(not(a), environment));
    assertEquals(true, evaluate(and(a, TRUE), environment));
    assertEquals(false, evaluate(and(a, FALSE), environment));
    assertEquals(true, evaluate(or(FALSE, a), environment));
    assertEquals(true, evaluate(implies(FALSE, a)));
    assertEquals(10L, evaluate(ite(a, int8(10), int8(20)), environment));
  }

  @Test
  void testWrappingArithmetic() {
    Environment environment = Environment.empty().with(x, 127L);
    assertEquals(-128L, evaluate(plus(x, int8(1)), environment));
    assertEquals(-2L, evaluate(multiply(x, int8(2)), environment));
    assertEquals(0L, evaluate(bitwiseAnd(x, int8(-128)), environment));
    assertEquals(-128L, evaluate(bitwiseNot(x), environment));
    assertEquals(255L, evaluate(plus(constant(ExprType.UINT8, 254), constant(ExprType.UINT8, 1))));
    assertEquals(true, evaluate(lt(constant(ExprType.UINT8, 1), constant(ExprType.UINT8, 200))));
  }

  @Test
  void testObjects() {
    Environment environment = Environment.empty().with(x, 4L);
    Expr<ObjectValue> point = createObject(POINT, "x", x, "y", int8(2));
    assertEquals(ObjectValue.of(POINT, Map.of("x", 4L, "y", 2L)), evaluate(point, environment));
    assertEquals(9L, evaluate(getField(withField(point, "y", int8(9)), "y", ExprType.INT8), environment));
    assertEquals(4L, evaluate(getField(withField(point, "y", int8(9)), "x", ExprType.INT8), environment));
  }

  @Test
  void testLists() {
    Environment environment = Environment.empty().with(l, List.of(1L, 2L, 3L));
    assertEquals(6L, evaluate(match(l, int8(0), SUM_LIST), environment));
    assertEquals(1L, evaluate(match(l, int8(0), HEAD), environment));
    assertEquals(-1L, evaluate(match(l, int8(-1), HEAD)));
    assertEquals(List.of(0L, 1L, 2L, 3L), evaluate(cons(int8(0), l), environment));
    assertEquals(true, evaluate(eq(listOf(ExprType.INT8, int8(1)), cons(int8(1), emptyList(ExprType.INT8)))));
  }

  @Test
  void testAdapters() {
    Environment environment = Environment.empty().with(x, -5L);
    Expr<String> text = adapt(ExprType.STRING, x, value -> "v" + value);
    assertEquals("v-5", evaluate(text, environment));
    Expr<Long> length = adaptAll(ExprType.INT32, x, List.<Function<Long, Long>>of(WIDEN, value -> value * 1000));
    assertEquals(-5000L, evaluate(length, environment));
  }

  @Test
  void testLiftedValuesEvaluateToThemselves() {
    ObjectValue point = ObjectValue.of(POINT, Map.of("x", 1L, "y", -1L));
    assertEquals(point, evaluate(lift(POINT, point)));
    assertEquals(List.of(5L, 6L), evaluate(lift(ExprType.INT8.list(), List.of(5L, 6L))));
    assertEquals("s", evaluate(lift(ExprType.STRING, "s")));
  }

  @Test
  void testSharedNodesAreEvaluatedOnce() {
    int[] calls = {0};
    Expr<Long> counted = adapt(ExprType.INT8, x, (Long value) -> {
      calls[0]++;
      return value;
    });
    Expr<Long> expr = plus(counted, plus(counted, counted));
    assertEquals(0L, new Evaluator(Environment.empty()).evaluate(expr));
    assertEquals(1, calls[0]);
  }

  @Test
  void testDeepExpressions() {
    Expr<Long> sum = int8(0);
    for (int i = 0; i < 100_000; i++) {
      sum = plus(sum, int8(1));
    }
    assertEquals((long) (byte) 100_000, evaluate(sum));
  }

  private static final class Sum {

    static final BiFunction<Expr<Long>, Expr<List<Long>>, Expr<Long>> INT32 =
      (head, tail) -> plus(head, match(tail, int32(0), Sum.INT32));
  }

  private static final class Loops {

    static final BiFunction<Expr<Long>, Expr<List<Long>>, Expr<Long>> SELF =
      (head, tail) -> match(cons(head, tail), int8(0), Loops.SELF);
  }

  @Test
  void testLongListMatchOverConsChain() {
    int length = 20_000;
    Expr<Long>[] elements = IntStream.range(0, length).mapToObj(n -> int32(n)).toArray(Expr[]::new);
    Expr<Long> expr = match(listOf(ExprType.INT32, elements), int32(0), Sum.INT32);
    assertEquals((long) length * (length - 1) / 2, evaluate(expr));
  }

  @Test
  void testLongListMatchOverVariable() {
    int length = 20_000;
    VariableExpr<List<Long>> list = symbolic(ExprType.INT32.list(), "list");
    List<Long> values = new ArrayList<>();
    for (long n = 0; n < length; n++) {
      values.add(n);
    }
    Environment environment = Environment.empty().with(list, values);
    assertEquals((long) length * (length - 1) / 2, evaluate(match(list, int32(0), Sum.INT32), environment));
    List<Long> expected = new ArrayList<>(values);
    expected.add(0, -1L);
    assertEquals(expected, evaluate(cons(int32(-1), list), environment));
  }

  @Test
  void testSelfDependentMatchFails() {
    Expr<Long> expr = match(listOf(ExprType.INT8, int8(1)), int8(0), Loops.SELF);
    assertThrows(ContractViolationException.class, () -> evaluate(expr));
    assertEquals(0L, evaluate(match(emptyList(ExprType.INT8), int8(0), Loops.SELF)));
  }
}
