package max.enoch.engine.common;

public record Piece(Army army, PieceKind kind) {
    public String displayName() {
        return army.displayName() + " " + kind.displayName();
    }

    // Blue and Red pieces print upper case, Black and Yellow lower case
    public char symbol() {
        return army == Army.BLUE || army == Army.RED
                ? kind.letter
                : Character.toLowerCase(kind.letter);
    }
}
