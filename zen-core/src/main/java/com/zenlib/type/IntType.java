package com.zenlib.type;

import com.zenlib.ContractViolationException;

/**
 * A fixed-width two's complement integer type of 8, 16, 32 or 64 bits.
 * <p>
 * Values of every width are carried as {@link Long}. Signed values are sign-extended and unsigned values
 * zero-extended, except for {@code uint64} which stores the raw 64-bit pattern and is compared as unsigned.
 * {@link #normalize(long)} implements wrap-around for all arithmetic on this type.
 */
public record IntType(String name, int bits, boolean signed) implements ExprType<Long> {

  public IntType {
    if (bits != 8 && bits != 16 && bits != 32 && bits != 64) {
      throw new ContractViolationException("unsupported integer width: " + bits);
    }
  }

  /** Truncates {@code value} to this width and extends it back to 64 bits according to signedness. */
  public long normalize(long value) {
    if (bits == Long.SIZE) {
      return value;
    }
    int shift = Long.SIZE - bits;
    return signed ? (value << shift) >> shift : value & ((1L << bits) - 1);
  }

  /** Compares two normalized values of this type. */
  public int compare(long a, long b) {
    return signed ? Long.compare(a, b) : Long.compareUnsigned(a, b);
  }

  public long minValue() {
    return signed ? normalize(1L << (bits - 1)) : 0L;
  }

  public long maxValue() {
    return signed ? normalize((1L << (bits - 1)) - 1) : normalize(-1L);
  }

  /** Renders a normalized value, printing {@code uint64} values as unsigned. */
  public String format(long value) {
    return signed ? Long.toString(value) : Long.toUnsignedString(value);
  }

  @Override
  public Long defaultValue() {
    return 0L;
  }

  @Override
  public Long checkValue(Object value) {
    if (!(value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte)) {
      throw new ContractViolationException("expected a %s value but got %s".formatted(name, value));
    }
    long raw = ((Number) value).longValue();
    if (normalize(raw) != raw) {
      throw new ContractViolationException("%d is out of range for %s".formatted(raw, name));
    }
    return raw;
  }

  @Override
  public boolean isArithmetic() {
    return true;
  }

  @Override
  public boolean isFixedWidth() {
    return true;
  }

  @Override
  public String toString() {
    return name;
  }
}
