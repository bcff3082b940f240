package max.enoch.engine.movegen;

import max.enoch.engine.common.PieceKind;
import max.enoch.engine.utils.SquareUtils;

/**
 * Readable form of a packed move. Hot paths keep the packed {@code int} and use the static accessors below:
 * bits 0-5 destination, 6-11 origin, 12-14 moving piece code, 15-17 captured piece code (0 when none).
 */
public record Move(int startPosition, int endPosition, PieceKind piece, PieceKind captured) {
    private static final int SQUARE_MASK = 0b111111;
    private static final int CODE_MASK = 0b111;

    public static int asBytes(final int startPosition, final int endPosition, final byte pieceType) {
        return (pieceType << 12) | (startPosition << 6) | endPosition;
    }

    public static int asBytes(final int startPosition, final int endPosition,
                              final byte pieceType, final byte capturedType) {
        return (capturedType << 15) | asBytes(startPosition, endPosition, pieceType);
    }

    public static Move fromBytes(final int bytes) {
        return new Move(getStartPosition(bytes), getEndPosition(bytes),
                PieceKind.fromCode(getPieceType(bytes)), PieceKind.fromCode(getCapturedType(bytes)));
    }

    public static int getStartPosition(final int bytes) {
        return (bytes >> 6) & SQUARE_MASK;
    }

    public static int getEndPosition(final int bytes) {
        return bytes & SQUARE_MASK;
    }

    public static byte getPieceType(final int bytes) {
        return (byte) ((bytes >> 12) & CODE_MASK);
    }

    public static byte getCapturedType(final int bytes) {
        return (byte) ((bytes >> 15) & CODE_MASK);
    }

    public static boolean isCapture(final int bytes) {
        return getCapturedType(bytes) != PieceKind.NONE_CODE;
    }

    public int toBytes() {
        return asBytes(startPosition, endPosition, PieceKind.codeOf(piece), PieceKind.codeOf(captured));
    }

    @Override
    public String toString() {
        return SquareUtils.toNotation(startPosition) + SquareUtils.toNotation(endPosition);
    }
}
