package io.tsadaash.periodicity.model;

import java.util.Comparator;
import java.util.List;

/** Immutable sorted copies for the collection-valued record components. */
final class SortedLists {
  private SortedLists() {}

  /**
   * Returns a sorted, immutable copy of a list. Null elements sort first and are kept, so the
   * validator can report them instead of construction failing.
   *
   * @param values the values, or null for an empty list
   * @return the sorted copy
   */
  static <T extends Comparable<? super T>> List<T> copyOf(List<T> values) {
    if (values == null) {
      return List.of();
    }
    return values.stream().sorted(Comparator.nullsFirst(Comparator.<T>naturalOrder())).toList();
  }
}
