package com.codeheadsystems.tokenvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Insertion-ordered, duplicate-free set of strings used for the mutable membership fields of a
 * {@link Client} (scopes and tenant access).
 * <p>
 * Adding a value that is already present and removing a value that is absent are both no-ops.
 * Removal keeps the relative order of the remaining values. Serialized as a plain JSON array.
 * <p>
 * Not thread-safe; a client record is owned by one caller at a time and stores keep copies.
 */
public final class OrderedStringSet {

  private final LinkedHashSet<String> values;

  /**
   * Instantiates a new empty set.
   */
  public OrderedStringSet() {
    this.values = new LinkedHashSet<>();
  }

  private OrderedStringSet(final LinkedHashSet<String> values) {
    this.values = values;
  }

  /**
   * Creates a set from the given values, dropping nulls and duplicates.
   *
   * @param values the values, may be null
   * @return the ordered string set
   */
  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static OrderedStringSet of(final Collection<String> values) {
    OrderedStringSet set = new OrderedStringSet();
    if (values != null) {
      values.forEach(set::addOne);
    }
    return set;
  }

  /**
   * Creates a set from the given values, dropping nulls and duplicates.
   *
   * @param values the values
   * @return the ordered string set
   */
  public static OrderedStringSet of(final String... values) {
    OrderedStringSet set = new OrderedStringSet();
    set.add(values);
    return set;
  }

  /**
   * Adds each value that is not already present, in argument order.
   *
   * @param toAdd the values to add
   * @return true if the set changed
   */
  public boolean add(final String... toAdd) {
    boolean changed = false;
    if (toAdd != null) {
      for (String value : toAdd) {
        changed |= addOne(value);
      }
    }
    return changed;
  }

  /**
   * Removes each value that is present.
   *
   * @param toRemove the values to remove
   * @return true if the set changed
   */
  public boolean remove(final String... toRemove) {
    boolean changed = false;
    if (toRemove != null) {
      for (String value : toRemove) {
        changed |= values.remove(value);
      }
    }
    return changed;
  }

  public boolean contains(final String value) {
    return values.contains(value);
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  /**
   * Immutable snapshot of the values in insertion order.
   *
   * @return the list
   */
  @JsonValue
  public List<String> asList() {
    return List.copyOf(values);
  }

  /**
   * Independent copy of this set.
   *
   * @return the copy
   */
  public OrderedStringSet copy() {
    return new OrderedStringSet(new LinkedHashSet<>(values));
  }

  private boolean addOne(final String value) {
    return value != null && values.add(value);
  }

  // Positional equality: two sets with the same members in a different order are not equal.
  @Override
  public boolean equals(final Object o) {
    return o instanceof OrderedStringSet other && asList().equals(other.asList());
  }

  @Override
  public int hashCode() {
    return asList().hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
