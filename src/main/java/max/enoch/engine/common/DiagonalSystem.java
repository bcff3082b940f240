package max.enoch.engine.common;

import max.enoch.engine.movegen.utils.BitBoardUtils;

/**
 * The two diagonal colourings of the board. A Bishop and a Queen may only capture each other when they share one.
 */
public enum DiagonalSystem {
    ARIES, CANCER;

    public static DiagonalSystem of(int square) {
        return (BitBoardUtils.ARIES_DIAGONALS >>> square & 1L) != 0 ? ARIES : CANCER;
    }

    public static boolean sameSystem(int square, int otherSquare) {
        return of(square) == of(otherSquare);
    }
}
