package com.zenlib.type;

import com.zenlib.ContractViolationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A finite immutable list whose elements all have {@link #elementType()}. */
public record ListType<E>(ExprType<E> elementType) implements ExprType<List<E>> {

  public ListType {
    if (elementType == null) {
      throw new ContractViolationException("list element type must not be null");
    }
  }

  @Override
  public String name() {
    return "list<" + elementType.name() + ">";
  }

  @Override
  public List<E> defaultValue() {
    return List.of();
  }

  @Override
  public List<E> checkValue(Object value) {
    if (!(value instanceof List<?> list)) {
      throw new ContractViolationException("expected a %s value but got %s".formatted(name(), value));
    }
    List<E> result = new ArrayList<>(list.size());
    for (Object element : list) {
      result.add(elementType.checkValue(element));
    }
    return Collections.unmodifiableList(result);
  }

  @Override
  public String toString() {
    return name();
  }
}
