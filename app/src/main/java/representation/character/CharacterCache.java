package representation.character;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import representation.cache.CacheStats;
import representation.model.Partition;

/**
 * Memo table of character values keyed by {@link CharacterKey}.
 *
 * <p>Starts out holding only {@code chi^[]_[] = 1}, grows monotonically and is never evicted. The
 * {@linkplain #shared() shared} instance lives for the whole process; {@link #clear()} restores the
 * seed and exists for test isolation. Character values are deterministic, so two threads racing on
 * the same key store the same value and the first one wins.
 */
public final class CharacterCache {
  private static final CharacterKey SEED_KEY =
      new CharacterKey(Partition.empty(), Partition.empty());
  private static final CharacterCache SHARED = new CharacterCache();

  private final Map<CharacterKey, BigInteger> values = new ConcurrentHashMap<>();
  private final CacheStats stats;

  public CharacterCache() {
    this(new CacheStats());
  }

  public CharacterCache(CacheStats stats) {
    this.stats = Objects.requireNonNull(stats, "stats");
    values.put(SEED_KEY, BigInteger.ONE);
  }

  public static CharacterCache shared() {
    return SHARED;
  }

  /** Cached value for the key, or null; counts a hit or a miss. */
  public BigInteger get(CharacterKey key) {
    BigInteger cached = values.get(Objects.requireNonNull(key, "key"));
    if (cached != null) {
      stats.recordHit();
    } else {
      stats.recordMiss();
    }
    return cached;
  }

  /** Stores the value unless one is already present, and returns the stored value. */
  public BigInteger put(CharacterKey key, BigInteger value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    BigInteger previous = values.putIfAbsent(key, value);
    return previous != null ? previous : value;
  }

  /** Pre-seeds a known value without touching the statistics. */
  public void seed(Partition partition, Partition cycleType, BigInteger value) {
    put(new CharacterKey(partition, cycleType), value);
  }

  public boolean contains(CharacterKey key) {
    return values.containsKey(key);
  }

  public int size() {
    return values.size();
  }

  public CacheStats stats() {
    return stats;
  }

  /** Drops every entry except the base case and zeroes the statistics. */
  public void clear() {
    values.clear();
    values.put(SEED_KEY, BigInteger.ONE);
    stats.reset();
  }
}
