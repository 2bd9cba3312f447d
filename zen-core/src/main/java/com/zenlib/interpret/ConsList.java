package com.zenlib.interpret;

import java.util.AbstractList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import javax.annotation.concurrent.Immutable;

/**
 * Immutable list value of a cons cell that shares its tail with the value of the tail expression.
 */
@Immutable
final class ConsList<E> extends AbstractList<E> {

  private final E head;
  private final List<E> tail;
  private final int size;

  ConsList(E head, List<E> tail) {
    this.head = head;
    this.tail = tail;
    this.size = tail.size() + 1;
  }

  List<E> tail() {
    return tail;
  }

  @Override
  public E get(int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("index " + index + " out of bounds for length " + size);
    }
    List<E> list = this;
    while (list instanceof ConsList<E> cons) {
      if (index == 0) {
        return cons.head;
      }
      index--;
      list = cons.tail;
    }
    return list.get(index);
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public Iterator<E> iterator() {
    return new Iterator<>() {
      private List<E> rest = ConsList.this;
      private Iterator<E> plain = null;

      @Override
      public boolean hasNext() {
        return plain == null ? !rest.isEmpty() : plain.hasNext();
      }

      @Override
      public E next() {
        if (plain != null) {
          return plain.next();
        }
        if (rest instanceof ConsList<E> cons) {
          rest = cons.tail;
          return cons.head;
        }
        plain = rest.iterator();
        if (!plain.hasNext()) {
          throw new NoSuchElementException();
        }
        return plain.next();
      }
    };
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof List<?> other) || other.size() != size) {
      return false;
    }
    Iterator<?> others = other.iterator();
    for (E element : this) {
      if (!Objects.equals(element, others.next())) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return super.hashCode();
  }
}
