package representation.character;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import representation.core.ComputationOptions;
import representation.core.InvalidInputException;
import representation.model.Partition;
import representation.util.Timing;

/**
 * Irreducible characters of the symmetric group by the Murnaghan-Nakayama rule.
 *
 * <p>{@code chi^lambda_mu} is expanded by removing every rim hook of size {@code mu[0]} from
 * {@code lambda} and evaluating the rest of the cycle type on what remains, with sign {@code
 * (-1)^height}. The recursion stops at the identity class, where the value is the dimension given
 * by {@link HookLengthFormula}. All intermediate values go through a {@link CharacterCache}.
 */
public final class CharacterEvaluator {
  private static final Logger LOG = LoggerFactory.getLogger(CharacterEvaluator.class);

  private final CharacterCache cache;
  private final ComputationOptions options;

  public CharacterEvaluator() {
    this(CharacterCache.shared(), ComputationOptions.defaults());
  }

  public CharacterEvaluator(CharacterCache cache) {
    this(cache, ComputationOptions.defaults());
  }

  public CharacterEvaluator(CharacterCache cache, ComputationOptions options) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.options = ComputationOptions.normalize(options);
  }

  public CharacterCache cache() {
    return cache;
  }

  /**
   * Character of the irreducible representation {@code partition} on the class {@code cycleType}.
   *
   * @throws InvalidInputException if the two partitions have different sizes
   */
  public BigInteger value(Partition partition, Partition cycleType) {
    Objects.requireNonNull(partition, "partition");
    Objects.requireNonNull(cycleType, "cycleType");
    if (partition.size() != cycleType.size()) {
      throw new InvalidInputException(
          "Partition " + partition + " and cycle type " + cycleType + " differ in size");
    }
    Timing timing = Timing.start();
    BigInteger value = evaluate(partition, cycleType);
    long elapsed = timing.elapsedMillis();
    if (options.isSlow(elapsed)) {
      LOG.info(
          "chi^{}_{} = {} took {} ms ({} cached values)",
          partition,
          cycleType,
          value,
          elapsed,
          cache.size());
    } else {
      LOG.debug("chi^{}_{} = {} ({})", partition, cycleType, value, cache.stats());
    }
    return value;
  }

  /** Dimension of the irreducible representation, i.e. its character at the identity. */
  public BigInteger dimension(Partition partition) {
    Objects.requireNonNull(partition, "partition");
    return value(partition, identityClass(partition.size()));
  }

  private BigInteger evaluate(Partition partition, Partition cycleType) {
    CharacterKey key = new CharacterKey(partition, cycleType);
    BigInteger cached = cache.get(key);
    if (cached != null) {
      return cached;
    }
    if (cycleType.isAllOnes()) {
      return cache.put(key, HookLengthFormula.dimension(partition));
    }

    Partition rest = cycleType.tail();
    BigInteger value = BigInteger.ZERO;
    for (RimHook hook : BorderStrip.of(partition).hooks(cycleType.largestPart())) {
      BigInteger term = evaluate(hook.removeFrom(partition), rest);
      value = hook.sign() < 0 ? value.subtract(term) : value.add(term);
    }
    return cache.put(key, value);
  }

  static Partition identityClass(int n) {
    int[] ones = new int[n];
    Arrays.fill(ones, 1);
    return Partition.of(ones);
  }
}
