package com.zenlib.interpret;

import com.zenlib.expression.ArithExpr;
import com.zenlib.expression.BitwiseExpr;
import com.zenlib.expression.CompareExpr;
import com.zenlib.type.ExprType;
import com.zenlib.type.IntType;
import com.zenlib.util.Contract;
import java.math.BigInteger;

/**
 * Concrete semantics of the arithmetic, bitwise and comparison operators, shared by evaluation and constant folding.
 * <p>
 * Fixed-width results are normalized to the width and signedness of their operands.
 */
public final class Operations {

  private Operations() {}

  /** Applies {@code op} to two values of {@code type}. */
  @SuppressWarnings("unchecked")
  public static <T> T arith(ArithExpr.Op op, ExprType<T> type, T a, T b) {
    if (type instanceof IntType intType) {
      long x = (Long) a;
      long y = (Long) b;
      long result = switch (op) {
        case SUM -> x + y;
        case DIFFERENCE -> x - y;
        case PRODUCT -> x * y;
        case MIN -> intType.compare(x, y) <= 0 ? x : y;
        case MAX -> intType.compare(x, y) >= 0 ? x : y;
      };
      return (T) Long.valueOf(intType.normalize(result));
    } else if (a instanceof BigInteger x && b instanceof BigInteger y) {
      BigInteger result = switch (op) {
        case SUM -> x.add(y);
        case DIFFERENCE -> x.subtract(y);
        case PRODUCT -> x.multiply(y);
        case MIN -> x.min(y);
        case MAX -> x.max(y);
      };
      return (T) result;
    }
    throw Contract.unreachable("%s on %s", op, type);
  }

  public static long bitwise(BitwiseExpr.Op op, IntType type, long a, long b) {
    long result = switch (op) {
      case AND -> a & b;
      case OR -> a | b;
      case XOR -> a ^ b;
    };
    return type.normalize(result);
  }

  public static long bitwiseNot(IntType type, long value) {
    return type.normalize(~value);
  }

  /** Returns the result of comparing two values of {@code type} with {@code op}. */
  public static <T> boolean compare(CompareExpr.Op op, ExprType<T> type, T a, T b) {
    int comparison;
    if (type instanceof IntType intType) {
      comparison = intType.compare((Long) a, (Long) b);
    } else if (a instanceof BigInteger x && b instanceof BigInteger y) {
      comparison = x.compareTo(y);
    } else {
      throw Contract.unreachable("%s on %s", op, type);
    }
    return switch (op) {
      case LEQ -> comparison <= 0;
      case GEQ -> comparison >= 0;
    };
  }
}
