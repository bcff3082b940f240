package max.enoch.engine.movegen.pieces;

import max.enoch.engine.movegen.utils.BitBoardUtils;
import max.enoch.engine.movegen.utils.RayUtils;

public final class Rook {

    private Rook() {}

    public static void warmUp() {
        RayUtils.warmUp();
    }

    /**
     * Slides along the four orthogonal rays. Each ray stops on the first piece met, which is included only when it
     * does not belong to the moving army.
     */
    public static long getPseudoLegalMovesBB(int positionIndex, long ownOccupiedSquaresBB, long occupiedSquaresBB) {
        long movesBB = 0;
        for(BitBoardUtils.Direction direction : BitBoardUtils.ORTHOGONAL_DIRECTIONS) {
            long ray = RayUtils.ray(positionIndex, direction);
            int blocker = RayUtils.findBlocker(ray, occupiedSquaresBB, direction);
            movesBB |= RayUtils.freeSquaresBeforeBlocker(ray, blocker, direction);
            if(blocker >= 0 && (ownOccupiedSquaresBB & (1L << blocker)) == 0) {
                movesBB |= 1L << blocker;
            }
        }
        return movesBB;
    }
}
