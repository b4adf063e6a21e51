package representation.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

final class CacheStatsTest {

  @Test
  void countsHitsAndMisses() {
    CacheStats stats = new CacheStats();
    stats.recordMiss();
    stats.recordHit();
    stats.recordHit();
    stats.recordHit();

    assertEquals(3, stats.hits());
    assertEquals(1, stats.misses());
    assertEquals(4, stats.lookups());
    assertEquals(0.75, stats.hitRate(), 1e-9);
  }

  @Test
  void snapshotIsDetachedFromLaterUpdates() {
    CacheStats stats = new CacheStats();
    stats.recordMiss();
    CacheStats snapshot = stats.snapshot();
    stats.recordHit();
    stats.reset();

    assertEquals(1, snapshot.misses());
    assertEquals(0, snapshot.hits());
    assertEquals(0, stats.lookups());
    assertEquals(0.0, stats.hitRate());
  }
}
