package representation.lr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import representation.model.Cell;

/**
 * A completed Littlewood-Richardson filling: letter {@code k} (0-indexed) sits in {@code
 * cells.get(k)}.
 */
public record LatticeWord(List<Integer> letters, List<Cell> cells) {

  public LatticeWord {
    letters = List.copyOf(Objects.requireNonNull(letters, "letters"));
    cells = List.copyOf(Objects.requireNonNull(cells, "cells"));
    if (letters.size() != cells.size()) {
      throw new IllegalArgumentException(
          "letters and cells differ in length: " + letters.size() + " vs " + cells.size());
    }
  }

  static LatticeWord capture(int[] word, SkewDiagramIndex index) {
    List<Integer> letters = new ArrayList<>(word.length);
    for (int letter : word) {
      letters.add(letter);
    }
    return new LatticeWord(letters, index.cells());
  }

  public int length() {
    return letters.size();
  }

  /** Letter written in {@code cell}, or -1 when the cell is not part of the filling. */
  public int letterAt(Cell cell) {
    int position = cells.indexOf(cell);
    return position < 0 ? -1 : letters.get(position);
  }

  /** Number of occurrences of each letter. */
  public int[] content() {
    int max = -1;
    for (int letter : letters) {
      max = Math.max(max, letter);
    }
    int[] content = new int[max + 1];
    for (int letter : letters) {
      content[letter]++;
    }
    return content;
  }

  @Override
  public String toString() {
    return letters.toString();
  }
}
