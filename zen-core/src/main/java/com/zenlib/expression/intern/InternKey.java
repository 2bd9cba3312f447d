package com.zenlib.expression.intern;

import com.zenlib.expression.Expr;
import com.zenlib.expression.ExprKind;
import com.zenlib.util.Hashing;
import java.util.Arrays;
import java.util.Objects;

/**
 * Composite key of an interned expression: its kind, a kind-specific discriminator (operator, field name, constant
 * value, converter list...) and the ids of its children.
 * <p>
 * Two keys are equal only if all three parts are exactly equal, the hash only picks a bucket.
 */
public final class InternKey {

  private final ExprKind kind;
  private final Object discriminator;
  private final long[] childIds;
  private final int hash;

  private InternKey(ExprKind kind, Object discriminator, long[] childIds) {
    this.kind = kind;
    this.discriminator = discriminator;
    this.childIds = childIds;
    int h = Hashing.fnv1a32(Hashing.FNV1_32_INIT, kind.ordinal());
    h = Hashing.fnv1a32(h, Objects.hashCode(discriminator));
    for (long id : childIds) {
      h = Hashing.fnv1a32(h, id);
    }
    this.hash = h;
  }

  /** Returns a key for a node of {@code kind} over {@code children} with no other payload. */
  public static InternKey ofChildren(ExprKind kind, Expr<?>... children) {
    return of(kind, null, children);
  }

  /** Returns a key for a node of {@code kind} with a {@code discriminator} payload over {@code children}. */
  public static InternKey of(ExprKind kind, Object discriminator, Expr<?>... children) {
    long[] ids = new long[children.length];
    for (int i = 0; i < children.length; i++) {
      ids[i] = children[i].id();
    }
    return new InternKey(kind, discriminator, ids);
  }

  public ExprKind kind() {
    return kind;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof InternKey other &&
      hash == other.hash &&
      kind == other.kind &&
      Arrays.equals(childIds, other.childIds) &&
      Objects.equals(discriminator, other.discriminator));
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return "InternKey{" + kind + ", " + discriminator + ", " + Arrays.toString(childIds) + "}";
  }
}
