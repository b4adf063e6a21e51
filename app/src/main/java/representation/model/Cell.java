package representation.model;

/** A diagram cell addressed by 1-indexed row and column. */
public record Cell(int row, int column) {

  public Cell {
    if (row < 1 || column < 1) {
      throw new IllegalArgumentException("Cell coordinates are 1-indexed: " + row + "," + column);
    }
  }

  @Override
  public String toString() {
    return "(" + row + "," + column + ")";
  }
}
