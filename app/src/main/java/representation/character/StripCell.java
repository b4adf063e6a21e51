package representation.character;

/** Border cell at 0-indexed {@code column} and {@code row}, rows counted from the top. */
public record StripCell(int column, int row) {}
