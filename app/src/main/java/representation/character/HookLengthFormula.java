package representation.character;

import com.google.common.math.BigIntegerMath;
import java.math.BigInteger;
import java.util.Objects;
import representation.model.Partition;

/** Dimension of the irreducible representation of a partition, by the hook-length formula. */
public final class HookLengthFormula {
  private HookLengthFormula() {}

  /** {@code n!} divided by the product of all hook lengths of the diagram. */
  public static BigInteger dimension(Partition partition) {
    Objects.requireNonNull(partition, "partition");
    Partition dual = partition.conjugate();
    BigInteger product = BigInteger.ONE;
    for (int i = 0; i < partition.length(); i++) {
      for (int j = 0; j < partition.part(i); j++) {
        product = product.multiply(BigInteger.valueOf(hook(partition, dual, i, j)));
      }
    }
    return BigIntegerMath.factorial(partition.size()).divide(product);
  }

  /** Hook length of the 0-indexed cell {@code (i, j)}. */
  public static int hook(Partition partition, Partition dual, int i, int j) {
    return partition.part(i) - j + dual.part(j) - i - 1;
  }
}
