package max.enoch.engine.movegen.pieces;

// No castling in this variant, the king only ever steps to one of its neighbours
public final class King {
    public static final long[] KING_MOVES_BB = new long[64];

    private static final int[][] KING_STEPS = {
            {0, 1}, {1, 1}, {1, 0}, {1, -1}, {0, -1}, {-1, -1}, {-1, 0}, {-1, 1}
    };

    static {
        for(int i = 0; i < 64; i++) {
            KING_MOVES_BB[i] = Knight.generateStepMovesAt(i, KING_STEPS);
        }
    }

    private King() {}

    public static void warmUp() {
        // To init the caches
    }

    public static long getPseudoLegalMovesBB(int positionIndex, long ownOccupiedSquaresBB) {
        return KING_MOVES_BB[positionIndex] & ~ownOccupiedSquaresBB;
    }

    public static long getAttackBB(int positionIndex) {
        return KING_MOVES_BB[positionIndex];
    }
}
