package com.zenlib.simplify;

import static com.zenlib.TestUtils.*;
import static com.zenlib.expression.Zen.*;
import static org.junit.jupiter.api.Assertions.*;

import com.zenlib.ContractViolationException;
import com.zenlib.TestUtils;
import com.zenlib.config.ZenConfig;
import com.zenlib.expression.ConstantExpr;
import com.zenlib.expression.Expr;
import com.zenlib.expression.IfExpr;
import com.zenlib.expression.ListMatchExpr;
import com.zenlib.expression.NotExpr;
import com.zenlib.expression.VariableExpr;
import com.zenlib.interpret.Environment;
import com.zenlib.type.ExprType;
import com.zenlib.type.ObjectType;
import com.zenlib.type.ObjectValue;
import java.math.BigInteger;
import java.util.List;
import java.util.function.BiFunction;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SimplifierTest {

  private static final ObjectType OBJECT = ObjectType.builder("Object")
    .field("F1", ExprType.INT32)
    .field("F2", ExprType.BOOL)
    .build();

  private final VariableExpr<Boolean> x = symbolic(ExprType.BOOL, "x");
  private final VariableExpr<Boolean> y = symbolic(ExprType.BOOL, "y");
  private final VariableExpr<Long> i = symbolic(ExprType.INT32, "i");
  private final VariableExpr<Long> j = symbolic(ExprType.INT32, "j");
  private final VariableExpr<ObjectValue> o = symbolic(OBJECT, "o");
  private final VariableExpr<Long> i8 = symbolic(ExprType.INT8, "b");

  private static <T> Expr<T> simplifyOnce(Expr<T> expr) {
    return new Simplifier().simplify(expr);
  }

  private static void assertSimplifiesTo(Expr<?> expected, Expr<?> input) {
    Expr<?> result = simplifyOnce(input);
    assertSame(expected, result);
    assertSame(result, simplifyOnce(result));
  }

  @Test
  void testLeavesAreUnchanged() {
    assertSimplifiesTo(x, x);
    assertSimplifiesTo(TRUE, TRUE);
    assertSimplifiesTo(int32(7), int32(7));
    assertSimplifiesTo(emptyList(ExprType.INT8), emptyList(ExprType.INT8));
  }

  @Test
  void testAndIdentities() {
    assertSimplifiesTo(x, and(TRUE, x));
    assertSimplifiesTo(x, and(x, TRUE));
    assertSimplifiesTo(FALSE, and(FALSE, x));
    assertSimplifiesTo(FALSE, and(x, FALSE));
    assertSimplifiesTo(x, and(x, x));
  }

  @Test
  void testOrIdentities() {
    assertSimplifiesTo(TRUE, or(TRUE, x));
    assertSimplifiesTo(TRUE, or(x, TRUE));
    assertSimplifiesTo(x, or(FALSE, x));
    assertSimplifiesTo(x, or(x, FALSE));
    assertSimplifiesTo(x, or(x, x));
  }

  @Test
  void testNot() {
    assertSimplifiesTo(FALSE, not(TRUE));
    assertSimplifiesTo(TRUE, not(FALSE));
    assertSimplifiesTo(x, not(not(x)));
    assertSimplifiesTo(not(x), not(not(not(x))));
  }

  @Test
  void testEmptyAndOr() {
    assertSame(TRUE, and());
    assertSame(FALSE, or());
    assertSimplifiesTo(x, and(x, TRUE, x));
    assertSimplifiesTo(y, or(FALSE, y, FALSE));
  }

  @Test
  void testCommutativeOperandsAreOrderedById() {
    Expr<Boolean> expected = and(x, y);
    assertSimplifiesTo(expected, and(y, x));
    assertSimplifiesTo(expected, and(x, y));
    assertSimplifiesTo(or(x, y), or(y, x));
    assertSimplifiesTo(eq(i, j), eq(j, i));
    assertSimplifiesTo(plus(i, j), plus(j, i));
    assertSimplifiesTo(multiply(i, j), multiply(j, i));
    assertSimplifiesTo(max(i, j), max(j, i));
    assertSimplifiesTo(bitwiseXor(i, j), bitwiseXor(j, i));
  }

  @Test
  void testNonCommutativeOperandsKeepTheirOrder() {
    assertSimplifiesTo(minus(j, i), minus(j, i));
    assertSimplifiesTo(leq(j, i), leq(j, i));
  }

  @Test
  void testConditionalCollapse() {
    assertSimplifiesTo(i, ite(TRUE, i, j));
    assertSimplifiesTo(j, ite(FALSE, i, j));
    assertSimplifiesTo(i, ite(x, i, i));
    assertSimplifiesTo(i, ite(not(not(TRUE)), i, j));
    assertSimplifiesTo(i, ite(x, plus(i, int32(0)), i));
  }

  @Test
  void testConditionalKeepsStructurallyEqualDistinctBranches() {
    VariableExpr<Long> first = symbolic(ExprType.INT32, "v");
    VariableExpr<Long> second = symbolic(ExprType.INT32, "v");
    Expr<Long> result = simplifyOnce(ite(x, first, second));
    assertInstanceOf(IfExpr.class, result);
    IfExpr<Long> conditional = (IfExpr<Long>) result;
    assertSame(first, conditional.trueCase());
    assertSame(second, conditional.falseCase());
    assertTrue(Expr.structurallyEquals(conditional.trueCase(), conditional.falseCase()));
  }

  @Test
  void testComparisonsFold() {
    assertSimplifiesTo(TRUE, eq(int32(3), int32(3)));
    assertSimplifiesTo(FALSE, eq(int32(3), int32(4)));
    assertSimplifiesTo(TRUE, eq(constant("abc"), constant("abc")));
    assertSimplifiesTo(FALSE, eq(constant("abc"), constant("abd")));
    assertSimplifiesTo(TRUE, leq(int32(-1), int32(0)));
    assertSimplifiesTo(FALSE, leq(constant(ExprType.UINT32, 0xFFFFFFFFL), constant(ExprType.UINT32, 0)));
    assertSimplifiesTo(TRUE, geq(constant(ExprType.UINT64, -1L), constant(ExprType.UINT64, 1L)));
    assertSimplifiesTo(TRUE, lt(constant(BigInteger.ONE), constant(BigInteger.TEN)));
    assertSimplifiesTo(FALSE, gt(constant(BigInteger.ONE), constant(BigInteger.TEN)));
  }

  @Test
  void testArithmeticIdentities() {
    Expr<Long> zero = int32(0);
    Expr<Long> one = int32(1);
    assertSimplifiesTo(i, plus(i, zero));
    assertSimplifiesTo(i, plus(zero, i));
    assertSimplifiesTo(i, minus(i, zero));
    assertSimplifiesTo(minus(zero, i), minus(zero, i));
    assertSimplifiesTo(zero, multiply(i, zero));
    assertSimplifiesTo(zero, multiply(zero, i));
    assertSimplifiesTo(i, multiply(i, one));
    assertSimplifiesTo(i, multiply(one, i));
  }

  @Test
  void testBigIntegerFolding() {
    BigInteger big = BigInteger.TWO.pow(100);
    assertSimplifiesTo(constant(big.add(BigInteger.ONE)), plus(constant(big), constant(BigInteger.ONE)));
    assertSimplifiesTo(constant(big.multiply(big)), multiply(constant(big), constant(big)));
    assertSimplifiesTo(constant(BigInteger.ONE), min(constant(big), constant(BigInteger.ONE)));
    VariableExpr<BigInteger> n = symbolic(ExprType.BIG_INTEGER, "n");
    assertSimplifiesTo(n, plus(n, constant(BigInteger.ZERO)));
  }

  @Test
  void testGetCreate() {
    Expr<ObjectValue> created = createObject(OBJECT, "F1", plus(i, int32(0)), "F2", and(x, TRUE));
    assertSimplifiesTo(i, getField(created, "F1"));
    assertSimplifiesTo(x, getField(created, "F2"));
  }

  @Test
  void testGetWithSameField() {
    assertSimplifiesTo(j, getField(withField(o, "F1", j), "F1"));
    assertSimplifiesTo(j, getField(withField(withField(o, "F1", i), "F1", j), "F1"));
  }

  @Test
  void testGetWithOtherFieldPassesThrough() {
    assertSimplifiesTo(getField(o, "F1"), getField(withField(o, "F2", TRUE), "F1"));
    assertSimplifiesTo(i, getField(withField(withField(o, "F1", i), "F2", x), "F1"));
    Expr<ObjectValue> created = createObject(OBJECT, "F1", i, "F2", y);
    assertSimplifiesTo(i, getField(withField(created, "F2", x), "F1"));
  }

  @Test
  void testGetOverConditional() {
    Expr<ObjectValue> host = ite(x, withField(o, "F1", i), withField(o, "F1", j));
    Expr<Long> result = simplifyOnce(getField(host, "F1"));
    assertSame(ite(x, i, j), result);
    assertSimplifiesTo(i, getField(ite(x, withField(o, "F1", i), createObject(OBJECT, "F1", i, "F2", y)), "F1"));
  }

  @Test
  void testWithFieldRebuildsOverSimplifiedChildren() {
    assertSimplifiesTo(withField(o, "F1", i), withField(o, "F1", plus(int32(0), i)));
    Expr<ObjectValue> created = simplifyOnce(createObject(OBJECT, "F2", not(not(x)), "F1", i));
    assertSame(createObject(OBJECT, "F1", i, "F2", x), created);
  }

  @Test
  void testListMatchOverKnownLists() {
    Expr<List<Long>> list = listOf(ExprType.INT8, int8(1), int8(2), int8(3));
    assertSimplifiesTo(int8(6), match(list, int8(0), SUM_LIST));
    assertSimplifiesTo(int8(1), match(list, int8(0), HEAD));
    assertSimplifiesTo(int8(9), match(emptyList(ExprType.INT8), plus(int8(4), int8(5)), HEAD));
  }

  @Test
  void testListMatchOverSymbolicTail() {
    VariableExpr<List<Long>> tail = symbolic(ExprType.INT8.list(), "tail");
    VariableExpr<Long> head = symbolic(ExprType.INT8, "head");
    Expr<Long> result = simplifyOnce(match(cons(head, tail), int8(0), SUM_LIST));
    assertSame(plus(head, match(tail, int8(0), SUM_LIST)), result);
  }

  @Test
  void testResidualMatchSimplifiesEmptyCase() {
    VariableExpr<List<Long>> list = symbolic(ExprType.INT8.list(), "list");
    Expr<Long> result = simplifyOnce(match(list, plus(int8(1), int8(1)), HEAD));
    assertInstanceOf(ListMatchExpr.class, result);
    assertSame(int8(2), ((ListMatchExpr<?, ?>) result).emptyCase());
  }

  @Test
  void testMatchOverConditional() {
    Expr<List<Long>> list = ite(x, listOf(ExprType.INT8, int8(5)), emptyList(ExprType.INT8));
    assertSimplifiesTo(ite(x, int8(5), int8(0)), match(list, int8(0), HEAD));
    assertSimplifiesTo(int8(5), match(ite(x, listOf(ExprType.INT8, int8(5)), listOf(ExprType.INT8, int8(5), int8(6))),
      int8(0), HEAD));
  }

  private static final class Loops {

    static final BiFunction<Expr<Long>, Expr<List<Long>>, Expr<Long>> SELF =
      (head, tail) -> match(cons(head, tail), int8(0), Loops.SELF);
  }

  @Test
  void testSelfDependentMatchFails() {
    Expr<Long> expr = match(listOf(ExprType.INT8, int8(1)), int8(0), Loops.SELF);
    assertThrows(ContractViolationException.class, () -> simplifyOnce(expr));
  }

  @Test
  void testAdapterFusion() {
    assertSimplifiesTo(i8, adapt(ExprType.INT8, adapt(ExprType.INT16, i8, WIDEN), NARROW));
  }

  @Test
  void testAdapterFusionIsSingleHop() {
    Expr<Long> wide = adapt(ExprType.INT16, i8, WIDEN);
    Expr<Long> widest = adapt(ExprType.INT32, wide, WIDEN);
    Expr<Long> back = adapt(ExprType.INT8, widest, NARROW);
    assertSimplifiesTo(back, back);
    assertSimplifiesTo(wide, adapt(ExprType.INT16, adapt(ExprType.INT32, wide, WIDEN), WIDEN));
  }

  @Test
  void testAdapterOverConditional() {
    Expr<Long> conditional = ite(x, adapt(ExprType.INT16, i8, WIDEN), constant(ExprType.INT16, 3));
    Expr<Long> result = simplifyOnce(adapt(ExprType.INT8, conditional, NARROW));
    assertSame(ite(x, i8, adapt(ExprType.INT8, constant(ExprType.INT16, 3), NARROW)), result);
  }

  @Test
  void testIfDistributionCollapsesEqualBranches() {
    Expr<ObjectValue> host = ite(x, withField(o, "F2", y), withField(o, "F2", TRUE));
    assertSimplifiesTo(getField(o, "F1"), getField(host, "F1"));
  }

  @Test
  void testScenarioFoldsToConstant() {
    Expr<ObjectValue> object = createObject(OBJECT, "F1", int32(1), "F2", FALSE);
    Expr<Long> expr = ite(and(TRUE, FALSE), getField(withField(object, "F1", int32(2)), "F1"), int32(99));
    Expr<Long> result = simplify(expr);
    assertSame(int32(99), result);
    assertEquals(99L, ((ConstantExpr<Long>) result).value());
  }

  @Test
  void testScenarioDoubleNegation() {
    Expr<Boolean> expr = not(not(and(x, TRUE)));
    assertSame(simplify(x), simplify(expr));
    assertSame(x, simplify(expr));
  }

  @Test
  void testSharedSubexpressionsStayShared() {
    Expr<Boolean> shared = and(or(y, FALSE), x);
    Expr<Boolean> expr = ite(eq(i, j), shared, not(shared));
    Simplifier simplifier = new Simplifier();
    Expr<Boolean> result = simplifier.simplify(expr);
    assertInstanceOf(IfExpr.class, result);
    IfExpr<Boolean> conditional = (IfExpr<Boolean>) result;
    NotExpr negated = assertInstanceOf(NotExpr.class, conditional.falseCase());
    assertSame(conditional.trueCase(), negated.expr());
    assertSame(and(x, y), conditional.trueCase());
    assertTrue(simplifier.stats().cacheHits() > 0);
  }

  @Test
  void testEachNodeIsRewrittenOnce() {
    Expr<Long> shared = plus(i, j);
    Expr<Long> expr = plus(shared, plus(shared, shared));
    Simplifier simplifier = new Simplifier();
    simplifier.simplify(expr);
    // i, j, shared, plus(shared, shared), expr
    assertEquals(5, simplifier.stats().rewrites());
    simplifier.simplify(expr);
    assertEquals(5, simplifier.stats().rewrites());
  }

  @Test
  void testRoundTripThroughSimplifiedResults() {
    Expr<Boolean> expr = or(and(y, x), and(x, eq(plus(j, i), int32(0))));
    Expr<Boolean> once = simplify(expr);
    Expr<Boolean> twice = simplify(once);
    assertSame(once, twice);
    assertStructurallyEquals(once, twice);
  }

  @Test
  void testStats() {
    Simplifier simplifier = new Simplifier();
    simplifier.simplify(and(not(not(x)), or(TRUE, y)));
    SimplifierStats stats = simplifier.stats();
    assertEquals(1, stats.count(Rule.NOT_NOT));
    assertEquals(1, stats.count(Rule.OR_CONSTANT));
    assertEquals(1, stats.count(Rule.AND_CONSTANT));
    assertEquals(0, stats.count(Rule.IF_CONSTANT));
    assertEquals(3, stats.rules().size());
    assertTrue(stats.elapsed().isEmpty());
    assertTrue(stats.toString().contains("not_not=1"), stats.toString());
  }

  @Test
  void testRunWithDefaults() {
    Expr<Boolean> result = Simplifier.run(and(x, TRUE), ZenConfig.defaults());
    assertSame(x, result);
  }

  @ParameterizedTest
  @ValueSource(ints = {10, 1_000, 100_000})
  void testDeepWithFieldChain(int depth) {
    Expr<ObjectValue> host = createObject(OBJECT, "F1", int32(-1), "F2", x);
    for (int n = 0; n < depth; n++) {
      host = withField(host, "F1", int32(n));
    }
    assertSimplifiesTo(int32(depth - 1), getField(host, "F1"));
    assertSimplifiesTo(x, getField(host, "F2"));
  }

  @ParameterizedTest
  @ValueSource(ints = {10, 100_000})
  void testDeepConsList(int length) {
    Expr<Long>[] elements = IntStream.range(0, length).mapToObj(n -> int8(n % 7)).toArray(Expr[]::new);
    Expr<List<Long>> list = listOf(ExprType.INT8, elements);
    assertSame(list, simplifyOnce(list));
    assertSimplifiesTo(int8(0), match(list, int8(-1), HEAD));
  }

  @Test
  void testDeepBooleanChain() {
    Expr<Boolean> chain = x;
    for (int n = 0; n < 100_000; n++) {
      chain = and(chain, n % 2 == 0 ? TRUE : not(not(x)));
    }
    assertSimplifiesTo(x, chain);
  }

  @Test
  void testListUnrollingOnLargeStack() {
    int length = 20_000;
    Expr<Long>[] elements = IntStream.range(0, length).mapToObj(n -> int32(n)).toArray(Expr[]::new);
    Expr<Long> expr = match(listOf(ExprType.INT32, elements), int32(0), Sum.INT32);
    Expr<Long> result = simplify(expr, ZenConfig.defaults().withLargeStack(true));
    assertSame(int32((long) length * (length - 1) / 2), result);
  }

  @Test
  void testListUnrollingOnDefaultStack() {
    int length = 20_000;
    Expr<Long>[] elements = IntStream.range(0, length).mapToObj(n -> int32(n)).toArray(Expr[]::new);
    Expr<Long> expr = match(listOf(ExprType.INT32, elements), int32(0), Sum.INT32);
    ZenConfig config = ZenConfig.defaults();
    assertFalse(config.largeStack());
    assertSame(int32((long) length * (length - 1) / 2), simplify(expr, config));
  }

  @Test
  void testDeepConditionalWithFieldChain() {
    int depth = 20_000;
    Expr<ObjectValue> host = o;
    for (int n = 0; n < depth; n++) {
      host = ite(symbolic(ExprType.BOOL, "g" + n), withField(host, "F1", int32(n)), host);
    }
    Simplifier simplifier = new Simplifier();
    assertSame(getField(o, "F2"), simplifier.simplify(getField(host, "F2")));
    assertEquals(2 * depth - 1, simplifier.stats().count(Rule.GET_IF));
    assertSame(getField(o, "F2"), simplify(getField(host, "F2"), ZenConfig.defaults()));
  }

  private static final class Sum {

    static final BiFunction<Expr<Long>, Expr<List<Long>>, Expr<Long>> INT32 =
      (head, tail) -> plus(head, match(tail, TestUtils.int32(0), Sum.INT32));
  }

  @Test
  void testErrorsOnLargeStackKeepTheirType() {
    Expr<Long> expr = match(listOf(ExprType.INT8, int8(1)), int8(0), Loops.SELF);
    ZenConfig config = ZenConfig.defaults().withLargeStack(true);
    assertThrows(ContractViolationException.class, () -> simplify(expr, config));
  }

  @TestFactory
  Stream<DynamicTest> testRandomExpressions() {
    return IntStream.range(0, 200).mapToObj(seed -> DynamicTest.dynamicTest("seed " + seed, () -> {
      RandomExprs random = new RandomExprs(seed);
      Expr<?> expr = seed % 2 == 0 ? random.bool(6) : random.int8(6);
      Expr<?> once = simplifyOnce(expr);
      Expr<?> twice = simplifyOnce(once);
      assertSame(once, twice);
      for (int n = 0; n < 5; n++) {
        Environment environment = random.randomEnvironment();
        assertEquals(evaluate(expr, environment), evaluate(once, environment),
          () -> expr + " simplified to " + once + " under " + environment);
      }
    }));
  }
}
