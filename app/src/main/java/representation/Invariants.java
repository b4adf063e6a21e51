package representation;

import java.math.BigInteger;
import java.util.List;
import representation.character.CharacterCache;
import representation.character.CharacterEvaluator;
import representation.lr.LittlewoodRichardson;
import representation.model.Partition;

/**
 * Static entry points for the two invariants.
 *
 * <p>Character values share {@link CharacterCache#shared()} for the lifetime of the process.
 */
public final class Invariants {
  private static final LittlewoodRichardson LITTLEWOOD_RICHARDSON = new LittlewoodRichardson();
  private static final CharacterEvaluator CHARACTERS =
      new CharacterEvaluator(CharacterCache.shared());

  private Invariants() {}

  /** Littlewood-Richardson coefficient {@code c^{p3}_{p1,p2}}. */
  public static long lrCoefficient(Partition p1, Partition p2, Partition p3) {
    return LITTLEWOOD_RICHARDSON.coefficient(p1, p2, p3);
  }

  public static long lrCoefficient(List<Integer> p1, List<Integer> p2, List<Integer> p3) {
    return lrCoefficient(Partition.of(p1), Partition.of(p2), Partition.of(p3));
  }

  /** Symmetric-group character {@code chi^partition} on the class with the given cycle type. */
  public static BigInteger characterValue(Partition partition, Partition cycleType) {
    return CHARACTERS.value(partition, cycleType);
  }

  public static BigInteger characterValue(List<Integer> partition, List<Integer> cycleType) {
    return characterValue(Partition.of(partition), Partition.of(cycleType));
  }
}
