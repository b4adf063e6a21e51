package representation.lr;

import java.util.Objects;
import java.util.function.Consumer;
import representation.model.Cell;
import representation.model.Partition;

/**
 * Depth-first search over the lattice words of a skew shape with a fixed content.
 *
 * <p>The partial word and the running letter counts are shared across the recursion; each
 * candidate is placed, counted, searched below and then taken back before the next sibling.
 */
final class LatticeWordSearch {
  private final SkewDiagramIndex index;
  private final int[] weight;
  private final int[] word;
  private final int[] weightCount;
  private final Consumer<LatticeWord> visitor;
  private final int limit;
  private long reported;

  LatticeWordSearch(
      SkewDiagramIndex index, Partition content, Consumer<LatticeWord> visitor, int limit) {
    this.index = Objects.requireNonNull(index, "index");
    Objects.requireNonNull(content, "content");
    if (content.size() != index.size()) {
      throw new IllegalArgumentException(
          "content " + content + " does not fill " + index.size() + " cells");
    }
    this.weight = content.toArray();
    this.word = new int[index.size()];
    this.weightCount = new int[weight.length];
    this.visitor = visitor;
    this.limit = Math.max(0, limit);
  }

  LatticeWordSearch(SkewDiagramIndex index, Partition content) {
    this(index, content, null, 0);
  }

  /** Number of lattice words completed from the empty prefix. */
  long run() {
    return fill(0);
  }

  private long fill(int location) {
    if (location >= word.length) {
      if (visitor != null) {
        visitor.accept(LatticeWord.capture(word, index));
      }
      reported++;
      return 1;
    }
    Cell cell = index.cellAt(location);
    int upperBound = weight.length - 1;
    int right = index.positionOf(cell.row(), cell.column() + 1);
    if (right >= 0) {
      upperBound = word[right];
    }
    int lowerBound = 0;
    int above = index.positionOf(cell.row() - 1, cell.column());
    if (above >= 0) {
      lowerBound = word[above] + 1;
    }

    long count = 0;
    for (int candidate = lowerBound; candidate <= upperBound; candidate++) {
      if (weightCount[candidate] == weight[candidate]) {
        continue;
      }
      if (candidate > 0 && weightCount[candidate] == weightCount[candidate - 1]) {
        continue;
      }
      word[location] = candidate;
      weightCount[candidate]++;
      count += fill(location + 1);
      weightCount[candidate]--;
      if (limitReached()) {
        break;
      }
    }
    return count;
  }

  private boolean limitReached() {
    return limit > 0 && reported >= limit;
  }
}
