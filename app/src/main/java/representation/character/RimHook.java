package representation.character;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import representation.model.Partition;

/** A contiguous run of rim cells that can be removed to leave a smaller partition. */
public record RimHook(List<StripCell> cells) {

  public RimHook {
    cells = List.copyOf(Objects.requireNonNull(cells, "cells"));
    if (cells.isEmpty()) {
      throw new IllegalArgumentException("A rim hook has at least one cell");
    }
  }

  public StripCell start() {
    return cells.get(0);
  }

  public StripCell end() {
    return cells.get(cells.size() - 1);
  }

  public int size() {
    return cells.size();
  }

  /** Number of rows spanned minus one. */
  public int height() {
    return start().row() - end().row();
  }

  /** Sign the hook contributes to the Murnaghan-Nakayama sum. */
  public int sign() {
    return height() % 2 == 1 ? -1 : 1;
  }

  /** The partition left after taking this hook's cells off their rows. */
  public Partition removeFrom(Partition partition) {
    List<Integer> rows = new ArrayList<>(partition.parts());
    for (StripCell cell : cells) {
      if (cell.row() >= rows.size()) {
        throw new IllegalArgumentException("Hook cell " + cell + " lies outside " + partition);
      }
      rows.set(cell.row(), rows.get(cell.row()) - 1);
    }
    return Partition.normalize(rows);
  }
}
