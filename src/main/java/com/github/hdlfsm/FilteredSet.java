package com.github.hdlfsm;

import java.util.AbstractSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A set of entity instances that only accepts elements of one type. Membership is by identity, not
 * by {@code equals}: two structurally identical conditions, or two states that happen to share a
 * name, are still distinct members. Iteration follows insertion order.
 *
 * Adding or discarding anything that isn't of the element type fails with a
 * {@link ClassCastException}. Not safe for concurrent mutation.
 */
public abstract class FilteredSet<E> extends AbstractSet<E> {
  private final Class<E> elementType;
  private final Map<Identity, E> elements = new LinkedHashMap<>();

  protected FilteredSet(final Class<E> elementType, final Iterable<? extends E> initial) {
    this.elementType = elementType;
    if (initial != null) {
      for (final E element : initial) {
        add(element);
      }
    }
  }

  @Override
  public boolean add(final E element) {
    final E filtered = filter(element);
    return elements.put(new Identity(filtered), filtered) == null;
  }

  /**
   * Remove the element if present. Unlike {@link #remove(Object)}, elements of the wrong type are
   * rejected rather than ignored.
   */
  public boolean discard(final Object element) {
    return elements.remove(new Identity(filter(element))) != null;
  }

  @Override
  public boolean remove(final Object element) {
    return element != null && elements.remove(new Identity(element)) != null;
  }

  @Override
  public boolean contains(final Object element) {
    return element != null && elements.containsKey(new Identity(element));
  }

  @Override
  public Iterator<E> iterator() {
    return elements.values().iterator();
  }

  @Override
  public int size() {
    return elements.size();
  }

  private E filter(final Object value) {
    if (value == null) {
      throw new NullPointerException(
          "Null is not a valid " + elementType.getSimpleName() + " element");
    }
    if (!elementType.isInstance(value)) {
      throw new ClassCastException("Element " + value + " is not of type: "
          + elementType.getSimpleName());
    }
    return elementType.cast(value);
  }

  private static final class Identity {
    private final Object reference;

    private Identity(final Object reference) {
      this.reference = reference;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(reference);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Identity && ((Identity) obj).reference == reference;
    }
  }
}
