package representation.character;

import java.util.Objects;
import representation.model.Partition;

/** Cache key: an irreducible representation label and a conjugacy class. */
public record CharacterKey(Partition partition, Partition cycleType) {

  public CharacterKey {
    Objects.requireNonNull(partition, "partition");
    Objects.requireNonNull(cycleType, "cycleType");
  }

  @Override
  public String toString() {
    return "chi^" + partition + "_" + cycleType;
  }
}
