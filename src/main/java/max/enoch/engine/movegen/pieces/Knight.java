package max.enoch.engine.movegen.pieces;

import max.enoch.engine.utils.SquareUtils;

public final class Knight {
    public static final long[] KNIGHT_MOVES_BB = new long[64];

    private static final int[][] KNIGHT_STEPS = {
            {1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}
    };

    static {
        generateKnightMovesBB();
    }

    private Knight() {}

    public static void warmUp() {
        // To init the caches
    }

    public static long getPseudoLegalMovesBB(int positionIndex, long ownOccupiedSquaresBB) {
        return KNIGHT_MOVES_BB[positionIndex] & ~ownOccupiedSquaresBB;
    }

    public static long getAttackBB(int positionIndex) {
        return KNIGHT_MOVES_BB[positionIndex];
    }

    private static void generateKnightMovesBB() {
        for(int i = 0; i < 64; i++) {
            KNIGHT_MOVES_BB[i] = generateStepMovesAt(i, KNIGHT_STEPS);
        }
    }

    // Shared with the King: a set of (file, rank) offsets, dropped when they leave the board
    static long generateStepMovesAt(int positionIndex, int[][] steps) {
        int file = SquareUtils.fileOf(positionIndex);
        int rank = SquareUtils.rankOf(positionIndex);
        long movesBB = 0;
        for(int[] step : steps) {
            int targetFile = file + step[0];
            int targetRank = rank + step[1];
            if(targetFile >= 0 && targetFile < 8 && targetRank >= 0 && targetRank < 8) {
                movesBB |= 1L << SquareUtils.square(targetFile, targetRank);
            }
        }
        return movesBB;
    }
}
