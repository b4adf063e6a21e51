package representation.character;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import representation.cache.CacheStats;
import representation.model.Partition;

final class CharacterCacheTest {

  @Test
  void seededWithTheTrivialGroup() {
    CharacterCache cache = new CharacterCache();

    assertEquals(1, cache.size());
    assertEquals(
        BigInteger.ONE, cache.get(new CharacterKey(Partition.empty(), Partition.empty())));
  }

  @Test
  void repeatedQueriesHitTheCache() {
    CacheStats stats = new CacheStats();
    CharacterEvaluator evaluator = new CharacterEvaluator(new CharacterCache(stats));
    Partition lambda = Partition.of(4, 2, 1);
    Partition mu = Partition.of(3, 2, 2);

    BigInteger first = evaluator.value(lambda, mu);
    long missesAfterFirst = stats.misses();
    BigInteger second = evaluator.value(lambda, mu);

    assertEquals(first, second);
    assertTrue(missesAfterFirst > 0, "Initial population should record cache misses");
    assertEquals(missesAfterFirst, stats.misses(), "Repeated lookup should not miss");
    assertTrue(stats.hits() > 0, "Repeated lookup should hit cache");
  }

  @Test
  void unrelatedQueriesDoNotContaminateEachOther() {
    CharacterEvaluator fresh = new CharacterEvaluator(new CharacterCache());
    CharacterEvaluator warmed = new CharacterEvaluator(new CharacterCache());
    Partition lambda = Partition.of(3, 3);
    Partition mu = Partition.of(2, 2, 1, 1);

    warmed.value(Partition.of(6), Partition.of(3, 3));
    warmed.value(Partition.of(2, 2, 2), Partition.of(4, 1, 1));
    warmed.value(Partition.of(4, 1, 1), Partition.of(2, 2, 1, 1));

    assertEquals(fresh.value(lambda, mu), warmed.value(lambda, mu));
  }

  @Test
  void preSeededValuesAreReturned() {
    CharacterCache cache = new CharacterCache();
    cache.seed(Partition.of(2), Partition.of(2), BigInteger.valueOf(7));

    CharacterEvaluator evaluator = new CharacterEvaluator(cache);

    assertEquals(BigInteger.valueOf(7), evaluator.value(Partition.of(2), Partition.of(2)));
  }

  @Test
  void firstStoredValueWins() {
    CharacterCache cache = new CharacterCache();
    CharacterKey key = new CharacterKey(Partition.of(1), Partition.of(1));

    assertEquals(BigInteger.ONE, cache.put(key, BigInteger.ONE));
    assertEquals(BigInteger.ONE, cache.put(key, BigInteger.TEN));
  }

  @Test
  void clearRestoresTheSeed() {
    CharacterCache cache = new CharacterCache();
    new CharacterEvaluator(cache).value(Partition.of(3, 2), Partition.of(2, 2, 1));
    assertTrue(cache.size() > 1);

    cache.clear();

    assertEquals(1, cache.size());
    assertEquals(0, cache.stats().lookups());
    assertTrue(cache.contains(new CharacterKey(Partition.empty(), Partition.empty())));
  }
}
