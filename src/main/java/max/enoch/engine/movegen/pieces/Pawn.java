package max.enoch.engine.movegen.pieces;

import max.enoch.engine.common.Army;
import max.enoch.engine.movegen.utils.BitBoardUtils;

public final class Pawn {
    // Indexed by army ordinal then square
    public static final long[][] PAWN_NON_ATTACKING_MOVES_BB = new long[Army.COUNT][64];
    public static final long[][] PAWN_ATTACKING_MOVES_BB = new long[Army.COUNT][64];

    static {
        generatePawnMovesLookUp();
    }

    private Pawn() {}

    public static void warmUp() {
        // To init the caches
    }

    /**
     * One square forward onto an empty square, or one of the two forward diagonals when a foreign piece stands there.
     * No double step and no en passant.
     */
    public static PawnMoves getPseudoLegalMoves(int positionIndex, Army army, long occupiedSquaresBB,
                                                long foreignOccupiedSquaresBB) {
        long quietBB = PAWN_NON_ATTACKING_MOVES_BB[army.ordinal()][positionIndex] & ~occupiedSquaresBB;
        long attackBB = PAWN_ATTACKING_MOVES_BB[army.ordinal()][positionIndex] & foreignOccupiedSquaresBB;
        return new PawnMoves(quietBB, attackBB);
    }

    public static long getAttackBB(int positionIndex, Army army) {
        return PAWN_ATTACKING_MOVES_BB[army.ordinal()][positionIndex];
    }

    public static BitBoardUtils.Direction forward(Army army) {
        return switch (army) {
            case BLUE -> BitBoardUtils.Direction.NORTH;
            case RED -> BitBoardUtils.Direction.SOUTH;
            case BLACK -> BitBoardUtils.Direction.EAST;
            case YELLOW -> BitBoardUtils.Direction.WEST;
        };
    }

    private static BitBoardUtils.Direction[] forwardDiagonals(Army army) {
        return switch (army) {
            case BLUE -> new BitBoardUtils.Direction[]{BitBoardUtils.Direction.NORTHEAST, BitBoardUtils.Direction.NORTHWEST};
            case RED -> new BitBoardUtils.Direction[]{BitBoardUtils.Direction.SOUTHEAST, BitBoardUtils.Direction.SOUTHWEST};
            case BLACK -> new BitBoardUtils.Direction[]{BitBoardUtils.Direction.NORTHEAST, BitBoardUtils.Direction.SOUTHEAST};
            case YELLOW -> new BitBoardUtils.Direction[]{BitBoardUtils.Direction.NORTHWEST, BitBoardUtils.Direction.SOUTHWEST};
        };
    }

    private static void generatePawnMovesLookUp() {
        for(Army army : Army.VALUES) {
            BitBoardUtils.Direction forward = forward(army);
            BitBoardUtils.Direction[] diagonals = forwardDiagonals(army);
            for(int i = 0; i < 64; i++) {
                long pawnBB = 1L << i;
                PAWN_NON_ATTACKING_MOVES_BB[army.ordinal()][i] = BitBoardUtils.shift(pawnBB, forward);
                PAWN_ATTACKING_MOVES_BB[army.ordinal()][i] = BitBoardUtils.shift(pawnBB, diagonals[0])
                        | BitBoardUtils.shift(pawnBB, diagonals[1]);
            }
        }
    }
}
