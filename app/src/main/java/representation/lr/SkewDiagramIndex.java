package representation.lr;

import java.util.List;
import java.util.Objects;
import representation.model.Cell;
import representation.model.SkewShape;

/**
 * Two-way mapping between lattice-word positions and the cells of a skew shape.
 *
 * <p>Position {@code k} is the {@code k}-th cell in reading order. The reverse lookup is computed
 * from the first position of each row, since a row's cells are numbered right to left.
 */
public final class SkewDiagramIndex {
  private final SkewShape shape;
  private final List<Cell> cells;
  private final int[] rowStart;

  public SkewDiagramIndex(SkewShape shape) {
    this.shape = Objects.requireNonNull(shape, "shape");
    this.cells = List.copyOf(shape.readingOrder());
    int rows = shape.outer().length();
    this.rowStart = new int[rows];
    int position = 0;
    for (int row = 0; row < rows; row++) {
      rowStart[row] = position;
      position += shape.outer().part(row) - shape.inner().part(row);
    }
  }

  public SkewShape shape() {
    return shape;
  }

  public int size() {
    return cells.size();
  }

  public Cell cellAt(int position) {
    return cells.get(position);
  }

  public List<Cell> cells() {
    return cells;
  }

  /** Word position of the 1-indexed cell, or -1 when it is not in the skew shape. */
  public int positionOf(int row, int column) {
    if (!shape.contains(row, column)) {
      return -1;
    }
    return rowStart[row - 1] + shape.outer().part(row - 1) - column;
  }

  public int positionOf(Cell cell) {
    return positionOf(cell.row(), cell.column());
  }
}
