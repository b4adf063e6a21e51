package representation.model;

import com.google.common.collect.Comparators;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import representation.core.InvalidInputException;

/**
 * Weakly decreasing sequence of positive integers, read as the row lengths of a Young diagram.
 *
 * <p>Instances are validated on construction, so every {@code Partition} has positive parts in
 * non-increasing order and no trailing zeros. The empty partition is the diagram of size 0.
 */
public record Partition(List<Integer> parts) {
  private static final Partition EMPTY = new Partition(List.of());

  public Partition {
    Objects.requireNonNull(parts, "parts");
    parts = List.copyOf(parts);
    for (int part : parts) {
      if (part < 1) {
        throw new InvalidInputException("Partition parts must be positive: " + parts);
      }
    }
    if (!Comparators.isInOrder(parts, Comparator.reverseOrder())) {
      throw new InvalidInputException("Partition parts must be weakly decreasing: " + parts);
    }
  }

  public static Partition empty() {
    return EMPTY;
  }

  public static Partition of(int... parts) {
    return new Partition(Ints.asList(parts));
  }

  public static Partition of(List<Integer> parts) {
    return new Partition(parts);
  }

  /** Sorts the given row lengths descending and drops zero rows. */
  public static Partition normalize(List<Integer> rows) {
    Objects.requireNonNull(rows, "rows");
    List<Integer> kept = new ArrayList<>(rows.size());
    for (int row : rows) {
      if (row < 0) {
        throw new InvalidInputException("Row lengths must be non-negative: " + rows);
      }
      if (row > 0) {
        kept.add(row);
      }
    }
    kept.sort(Comparator.reverseOrder());
    return new Partition(kept);
  }

  /** Number of rows. */
  public int length() {
    return parts.size();
  }

  /** Row length at {@code index}, 0 for rows beyond the diagram. */
  public int part(int index) {
    return index < parts.size() ? parts.get(index) : 0;
  }

  /** Total number of cells. */
  public int size() {
    int total = 0;
    for (int part : parts) {
      total += part;
    }
    return total;
  }

  public int largestPart() {
    return part(0);
  }

  public boolean isEmpty() {
    return parts.isEmpty();
  }

  /** True when every part equals 1, which includes the empty partition. */
  public boolean isAllOnes() {
    for (int part : parts) {
      if (part != 1) {
        return false;
      }
    }
    return true;
  }

  /** Partition without its first (largest) part. */
  public Partition tail() {
    return parts.isEmpty() ? EMPTY : new Partition(parts.subList(1, parts.size()));
  }

  /** Row-wise containment of this diagram in {@code outer}. */
  public boolean fitsInside(Partition outer) {
    Objects.requireNonNull(outer, "outer");
    for (int index = 0; index < parts.size(); index++) {
      if (index >= outer.length() || parts.get(index) > outer.part(index)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Transposed diagram. For each column {@code c} the bottom-most row at least {@code c} long is
   * found by scanning upward; its 1-indexed position is the column length.
   */
  public Partition conjugate() {
    if (parts.isEmpty()) {
      return EMPTY;
    }
    List<Integer> columns = new ArrayList<>(largestPart());
    int cursor = parts.size() - 1;
    for (int column = 1; column <= largestPart(); column++) {
      while (parts.get(cursor) < column) {
        cursor--;
      }
      columns.add(cursor + 1);
    }
    return new Partition(columns);
  }

  public int[] toArray() {
    return Ints.toArray(parts);
  }

  @Override
  public String toString() {
    return parts.toString();
  }
}
