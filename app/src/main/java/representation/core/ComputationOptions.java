package representation.core;

/**
 * Tuning knobs for the Littlewood-Richardson enumerator and the character evaluator.
 *
 * @param swapSmallerWeight search lattice words over the smaller of the two weights
 * @param tableauLimit maximum number of tableaux collected by a listing call, 0 for no limit
 * @param slowQueryMillis evaluations slower than this are logged at INFO, 0 disables
 */
public record ComputationOptions(
    boolean swapSmallerWeight, int tableauLimit, long slowQueryMillis) {

  public static ComputationOptions defaults() {
    return new ComputationOptions(true, 0, 0L);
  }

  public static ComputationOptions normalize(ComputationOptions options) {
    if (options == null) {
      return defaults();
    }
    int tableauLimit = Math.max(0, options.tableauLimit());
    long slowQueryMillis = Math.max(0L, options.slowQueryMillis());
    return new ComputationOptions(options.swapSmallerWeight(), tableauLimit, slowQueryMillis);
  }

  public boolean isSlow(long elapsedMillis) {
    return slowQueryMillis > 0 && elapsedMillis >= slowQueryMillis;
  }
}
