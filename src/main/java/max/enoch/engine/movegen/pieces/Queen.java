package max.enoch.engine.movegen.pieces;

import max.enoch.engine.common.DiagonalSystem;
import max.enoch.engine.movegen.utils.BitBoardUtils;

// The Enochian queen does not slide: it leaps exactly two squares in any of the eight directions, over anything
public final class Queen {
    public static final long[] QUEEN_LEAPS_BB = new long[64];

    private static final int[][] QUEEN_LEAPS = {
            {0, 2}, {2, 2}, {2, 0}, {2, -2}, {0, -2}, {-2, -2}, {-2, 0}, {-2, 2}
    };

    static {
        for(int i = 0; i < 64; i++) {
            QUEEN_LEAPS_BB[i] = Knight.generateStepMovesAt(i, QUEEN_LEAPS);
        }
    }

    private Queen() {}

    public static void warmUp() {
        // To init the caches
    }

    /**
     * @param foreignBishopsBB bishops of every army but the moving one
     * @param foreignQueensBB queens of every army but the moving one
     */
    public static long getPseudoLegalMovesBB(int positionIndex, long ownOccupiedSquaresBB,
                                             long foreignBishopsBB, long foreignQueensBB) {
        long otherSystemBB = DiagonalSystem.of(positionIndex) == DiagonalSystem.ARIES
                ? BitBoardUtils.CANCER_DIAGONALS
                : BitBoardUtils.ARIES_DIAGONALS;
        return QUEEN_LEAPS_BB[positionIndex]
                & ~ownOccupiedSquaresBB
                & ~foreignQueensBB
                & ~(foreignBishopsBB & otherSystemBB);
    }

    public static long getAttackBB(int positionIndex) {
        return QUEEN_LEAPS_BB[positionIndex];
    }
}
