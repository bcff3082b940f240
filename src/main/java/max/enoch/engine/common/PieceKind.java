package max.enoch.engine.common;

public enum PieceKind {
    KING(6, 'K', "King"),
    QUEEN(5, 'Q', "Queen"),
    BISHOP(3, 'B', "Bishop"),
    KNIGHT(2, 'N', "Knight"),
    ROOK(4, 'R', "Rook"),
    PAWN(1, 'P', "Pawn");

    // Code 0 is reserved for "no piece" in packed moves
    public static final byte NONE_CODE = 0;
    public static final PieceKind[] VALUES = PieceKind.values();
    public static final int COUNT = VALUES.length;

    private static final PieceKind[] FROM_CODE = new PieceKind[7];
    static {
        for(PieceKind kind : VALUES) {
            FROM_CODE[kind.code] = kind;
        }
    }

    public final byte code;
    public final char letter;
    private final String displayName;

    PieceKind(int code, char letter, String displayName) {
        this.code = (byte) code;
        this.letter = letter;
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isMajor() {
        return this == QUEEN || this == BISHOP || this == KNIGHT || this == ROOK;
    }

    /**
     * Returns the kind for a packed code, or {@code null} for {@link #NONE_CODE}.
     *
     * @throws IllegalArgumentException if no kind uses the code
     */
    public static PieceKind fromCode(int code) {
        if(code < 0 || code >= FROM_CODE.length) {
            throw new IllegalArgumentException("Unknown piece code " + code);
        }
        return FROM_CODE[code];
    }

    public static byte codeOf(PieceKind kind) {
        return kind == null ? NONE_CODE : kind.code;
    }

    public static PieceKind fromLetter(char letter) {
        return switch (letter) {
            case 'k', 'K' -> KING;
            case 'q', 'Q' -> QUEEN;
            case 'b', 'B' -> BISHOP;
            case 'n', 'N' -> KNIGHT;
            case 'r', 'R' -> ROOK;
            case 'p', 'P' -> PAWN;
            default -> throw new IllegalArgumentException("Unknown piece letter " + letter);
        };
    }
}
