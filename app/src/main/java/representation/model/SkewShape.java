package representation.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import representation.core.InvalidInputException;

/** The cells of {@code outer} that are not cells of {@code inner}. */
public record SkewShape(Partition outer, Partition inner) {

  public SkewShape {
    Objects.requireNonNull(outer, "outer");
    Objects.requireNonNull(inner, "inner");
    if (!inner.fitsInside(outer)) {
      throw new InvalidInputException(inner + " does not fit inside " + outer);
    }
  }

  public int cellCount() {
    return outer.size() - inner.size();
  }

  /** True when the 1-indexed cell lies in the skew shape. */
  public boolean contains(int row, int column) {
    if (row < 1 || row > outer.length()) {
      return false;
    }
    return column > inner.part(row - 1) && column <= outer.part(row - 1);
  }

  /** Cells in lattice-word reading order: rows top to bottom, each row right to left. */
  public List<Cell> readingOrder() {
    List<Cell> cells = new ArrayList<>(cellCount());
    for (int row = 0; row < outer.length(); row++) {
      int offset = inner.part(row);
      for (int column = outer.part(row); column > offset; column--) {
        cells.add(new Cell(row + 1, column));
      }
    }
    return cells;
  }

  @Override
  public String toString() {
    return outer + "/" + inner;
  }
}
