package com.zenlib.expression;

import com.zenlib.type.IntType;
import com.zenlib.util.Format;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Renders expressions as text like {@code If(And(x, Not(y)), 1, 2)}.
 * <p>
 * Shared subexpressions are printed every time they are referenced, output is cut off after a maximum length.
 */
final class ExprFormatter implements ExprVisitor<Void, List<Object>> {

  static final int MAX_LENGTH = 10_000;
  private static final ExprFormatter INSTANCE = new ExprFormatter();

  private ExprFormatter() {}

  static String format(Expr<?> expr) {
    return format(expr, MAX_LENGTH);
  }

  /** Renders {@code expr}, truncated with {@code ...} after {@code maxLength} characters. */
  static String format(Expr<?> expr, int maxLength) {
    StringBuilder result = new StringBuilder();
    Deque<Object> work = new ArrayDeque<>();
    work.push(expr);
    while (!work.isEmpty()) {
      if (result.length() > maxLength) {
        result.setLength(maxLength);
        return result.append("...").toString();
      }
      Object next = work.pop();
      if (next instanceof Expr<?> node) {
        List<Object> parts = node.accept(INSTANCE, null);
        for (int i = parts.size() - 1; i >= 0; i--) {
          work.push(parts.get(i));
        }
      } else {
        result.append(next);
      }
    }
    return result.toString();
  }

  private static List<Object> call(String name, Object... args) {
    List<Object> parts = new ArrayList<>(args.length * 2 + 2);
    parts.add(name + "(");
    for (int i = 0; i < args.length; i++) {
      if (i > 0) {
        parts.add(", ");
      }
      parts.add(args[i]);
    }
    parts.add(")");
    return parts;
  }

  @Override
  public <T> List<Object> visitConstant(ConstantExpr<T> expr, Void parameter) {
    Object value = expr.value();
    String text;
    if (value instanceof String string) {
      text = Format.quote(string);
    } else if (expr.type() instanceof IntType intType) {
      text = intType.format((Long) value);
    } else {
      text = String.valueOf(value);
    }
    return List.of(text);
  }

  @Override
  public <T> List<Object> visitVariable(VariableExpr<T> expr, Void parameter) {
    return List.of(expr.name());
  }

  @Override
  public List<Object> visitNot(NotExpr expr, Void parameter) {
    return call("Not", expr.expr());
  }

  @Override
  public List<Object> visitAnd(AndExpr expr, Void parameter) {
    return call("And", expr.left(), expr.right());
  }

  @Override
  public List<Object> visitOr(OrExpr expr, Void parameter) {
    return call("Or", expr.left(), expr.right());
  }

  @Override
  public <T> List<Object> visitIf(IfExpr<T> expr, Void parameter) {
    return call("If", expr.guard(), expr.trueCase(), expr.falseCase());
  }

  @Override
  public <T> List<Object> visitEq(EqExpr<T> expr, Void parameter) {
    return call("Equal", expr.left(), expr.right());
  }

  @Override
  public <T> List<Object> visitCompare(CompareExpr<T> expr, Void parameter) {
    return call(expr.op().label(), expr.left(), expr.right());
  }

  @Override
  public <T> List<Object> visitArith(ArithExpr<T> expr, Void parameter) {
    return call(expr.op().label(), expr.left(), expr.right());
  }

  @Override
  public List<Object> visitBitwise(BitwiseExpr expr, Void parameter) {
    return call(expr.op().label(), expr.left(), expr.right());
  }

  @Override
  public List<Object> visitBitwiseNot(BitwiseNotExpr expr, Void parameter) {
    return call("BitwiseNot", expr.expr());
  }

  @Override
  public List<Object> visitCreateObject(CreateObjectExpr expr, Void parameter) {
    List<Object> parts = new ArrayList<>();
    parts.add(expr.objectType().name() + "(");
    boolean first = true;
    for (var field : expr.fields().entrySet()) {
      parts.add((first ? "" : ", ") + field.getKey() + "=");
      parts.add(field.getValue());
      first = false;
    }
    parts.add(")");
    return parts;
  }

  @Override
  public <T> List<Object> visitGetField(GetFieldExpr<T> expr, Void parameter) {
    return call("GetField", expr.host(), expr.field());
  }

  @Override
  public <F> List<Object> visitWithField(WithFieldExpr<F> expr, Void parameter) {
    return call("WithField", expr.host(), expr.field(), expr.value());
  }

  @Override
  public <E> List<Object> visitListEmpty(ListEmptyExpr<E> expr, Void parameter) {
    return List.of("[]");
  }

  @Override
  public <E> List<Object> visitListCons(ListConsExpr<E> expr, Void parameter) {
    return call("Cons", expr.head(), expr.tail());
  }

  @Override
  public <E, T> List<Object> visitListMatch(ListMatchExpr<E, T> expr, Void parameter) {
    return call("Match", expr.list(), expr.emptyCase(), "<cons case>");
  }

  @Override
  public <T, F> List<Object> visitAdapter(AdapterExpr<T, F> expr, Void parameter) {
    return call("Adapt<" + expr.type().name() + ">", expr.expr());
  }
}
