package representation.cache;

import java.util.concurrent.atomic.AtomicLong;

/** Hit/miss counters for a memoization table. */
public final class CacheStats {
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();

  public CacheStats() {}

  private CacheStats(long hits, long misses) {
    this.hits.set(hits);
    this.misses.set(misses);
  }

  public static CacheStats of(long hits, long misses) {
    return new CacheStats(hits, misses);
  }

  public void recordHit() {
    hits.incrementAndGet();
  }

  public void recordMiss() {
    misses.incrementAndGet();
  }

  public long hits() {
    return hits.get();
  }

  public long misses() {
    return misses.get();
  }

  public long lookups() {
    return hits() + misses();
  }

  public double hitRate() {
    long total = lookups();
    return total == 0 ? 0.0 : hits() / (double) total;
  }

  public void reset() {
    hits.set(0);
    misses.set(0);
  }

  public CacheStats snapshot() {
    return CacheStats.of(hits(), misses());
  }

  @Override
  public String toString() {
    return "CacheStats[hits=" + hits() + ", misses=" + misses() + "]";
  }
}
