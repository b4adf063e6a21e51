package representation.lr;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import representation.core.ComputationOptions;
import representation.core.InvalidInputException;
import representation.model.Partition;
import representation.model.SkewShape;
import representation.util.Timing;

/**
 * Littlewood-Richardson coefficients {@code c^{p3}_{p1,p2}}, counted as the semistandard fillings
 * of the skew shape {@code p3/p2} with content {@code p1} whose reading word is a lattice word.
 */
public final class LittlewoodRichardson {
  private static final Logger LOG = LoggerFactory.getLogger(LittlewoodRichardson.class);

  private final ComputationOptions options;

  public LittlewoodRichardson() {
    this(ComputationOptions.defaults());
  }

  public LittlewoodRichardson(ComputationOptions options) {
    this.options = ComputationOptions.normalize(options);
  }

  public ComputationOptions options() {
    return options;
  }

  /**
   * Returns {@code c^{p3}_{p1,p2}}.
   *
   * @throws InvalidInputException if {@code |p1| + |p2| != |p3|}
   */
  public long coefficient(Partition p1, Partition p2, Partition p3) {
    Timing timing = Timing.start();
    SearchPlan plan = plan(p1, p2, p3);
    if (plan == null) {
      return 0L;
    }
    long count = new LatticeWordSearch(plan.index(), plan.content()).run();
    long elapsed = timing.elapsedMillis();
    if (options.isSlow(elapsed)) {
      LOG.info("c^{}_{},{} = {} took {} ms", p3, p1, p2, count, elapsed);
    } else {
      LOG.debug(
          "c^{}_{},{} = {} (shape {}, content {}, {} us)",
          p3,
          p1,
          p2,
          count,
          plan.index().shape(),
          plan.content(),
          timing.elapsedMicros());
    }
    return count;
  }

  /**
   * Collects the lattice words counted by {@link #coefficient}, up to the configured tableau limit.
   * The words fill {@code p3/p2}, or {@code p3/p1} when the weights were swapped.
   */
  public List<LatticeWord> tableaux(Partition p1, Partition p2, Partition p3) {
    List<LatticeWord> words = new ArrayList<>();
    forEachTableau(p1, p2, p3, words::add);
    return words;
  }

  public void forEachTableau(
      Partition p1, Partition p2, Partition p3, Consumer<LatticeWord> visitor) {
    Objects.requireNonNull(visitor, "visitor");
    SearchPlan plan = plan(p1, p2, p3);
    if (plan == null) {
      return;
    }
    new LatticeWordSearch(plan.index(), plan.content(), visitor, options.tableauLimit()).run();
  }

  /** Validates the triple and fixes the shape and content to search, or null when infeasible. */
  private SearchPlan plan(Partition p1, Partition p2, Partition p3) {
    Objects.requireNonNull(p1, "p1");
    Objects.requireNonNull(p2, "p2");
    Objects.requireNonNull(p3, "p3");
    if (p1.size() + p2.size() != p3.size()) {
      throw new InvalidInputException(
          "Sizes do not balance: |" + p1 + "| + |" + p2 + "| != |" + p3 + "|");
    }
    // Containment is checked on the caller's roles, before any swap.
    if (!p1.fitsInside(p3) || !p2.fitsInside(p3)) {
      LOG.trace("{} or {} does not fit inside {}", p1, p2, p3);
      return null;
    }
    Partition content = p1;
    Partition inner = p2;
    if (options.swapSmallerWeight() && p2.size() < p1.size()) {
      content = p2;
      inner = p1;
    }
    return new SearchPlan(new SkewDiagramIndex(new SkewShape(p3, inner)), content);
  }

  private record SearchPlan(SkewDiagramIndex index, Partition content) {}
}
