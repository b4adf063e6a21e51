package representation.character;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import representation.model.Partition;

final class RimHookTest {

  @Test
  void verticalHookHasOddHeight() {
    RimHook hook = new RimHook(List.of(new StripCell(0, 2), new StripCell(0, 1)));

    assertEquals(1, hook.height());
    assertEquals(-1, hook.sign());
    assertEquals(Partition.of(2), hook.removeFrom(Partition.of(2, 1, 1)));
  }

  @Test
  void removalSpanningRowsLeavesAPartition() {
    RimHook hook =
        new RimHook(List.of(new StripCell(1, 1), new StripCell(1, 0), new StripCell(2, 0)));

    assertEquals(1, hook.height());
    assertEquals(-1, hook.sign());
    assertEquals(Partition.of(1, 1), hook.removeFrom(Partition.of(3, 2)));
  }

  @Test
  void rejectsEmptyHook() {
    assertThrows(IllegalArgumentException.class, () -> new RimHook(List.of()));
  }
}
