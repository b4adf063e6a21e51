package representation.character;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import representation.model.Partition;

/**
 * The rim of a Young diagram, traced from the bottom-left cell to the top-right cell.
 *
 * <p>A non-empty partition with {@code r} rows and largest part {@code c} has exactly {@code r + c
 * - 1} rim cells. Every rim hook is a contiguous run of them.
 */
public final class BorderStrip {
  private final List<StripCell> cells;

  private BorderStrip(List<StripCell> cells) {
    this.cells = List.copyOf(cells);
  }

  public static BorderStrip of(Partition partition) {
    Objects.requireNonNull(partition, "partition");
    if (partition.isEmpty()) {
      return new BorderStrip(List.of());
    }
    int length = partition.length() + partition.largestPart() - 1;
    List<StripCell> cells = new ArrayList<>(length);
    int column = 0;
    int row = partition.length() - 1;
    for (int i = 0; i < length; i++) {
      cells.add(new StripCell(column, row));
      // Go up once the current row ends at this column, otherwise go right.
      if (partition.part(row) == column + 1) {
        row--;
      } else {
        column++;
      }
    }
    return new BorderStrip(cells);
  }

  public List<StripCell> cells() {
    return cells;
  }

  public int length() {
    return cells.size();
  }

  /**
   * Rim hooks of {@code size} cells. A window is skipped when the rim cell just before it shares
   * its start column, or the rim cell just after it shares its end row: removing it would leave a
   * cell hanging off the diagram.
   */
  public List<RimHook> hooks(int size) {
    if (size < 1) {
      throw new IllegalArgumentException("hook size must be >= 1");
    }
    List<RimHook> hooks = new ArrayList<>();
    for (int i = 0; i + size <= cells.size(); i++) {
      StripCell start = cells.get(i);
      StripCell end = cells.get(i + size - 1);
      if (i > 0 && cells.get(i - 1).column() == start.column()) {
        continue;
      }
      if (i + size < cells.size() && cells.get(i + size).row() == end.row()) {
        continue;
      }
      hooks.add(new RimHook(cells.subList(i, i + size)));
    }
    return hooks;
  }
}
