package representation.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import representation.core.InvalidInputException;

final class SkewShapeTest {

  @Test
  void readingOrderGoesRightToLeftTopToBottom() {
    SkewShape shape = new SkewShape(Partition.of(3, 2, 1), Partition.of(1, 1));

    assertEquals(4, shape.cellCount());
    assertEquals(
        List.of(new Cell(1, 3), new Cell(1, 2), new Cell(2, 2), new Cell(3, 1)),
        shape.readingOrder());
  }

  @Test
  void containsOnlySkewCells() {
    SkewShape shape = new SkewShape(Partition.of(3, 2), Partition.of(1));

    assertTrue(shape.contains(1, 2));
    assertTrue(shape.contains(2, 1));
    assertFalse(shape.contains(1, 1), "Inner cell is removed");
    assertFalse(shape.contains(0, 1));
    assertFalse(shape.contains(3, 1));
    assertFalse(shape.contains(2, 3));
  }

  @Test
  void innerMustFitInsideOuter() {
    assertThrows(
        InvalidInputException.class, () -> new SkewShape(Partition.of(2), Partition.of(1, 1)));
  }
}
