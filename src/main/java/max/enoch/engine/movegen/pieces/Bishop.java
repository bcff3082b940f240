package max.enoch.engine.movegen.pieces;

import max.enoch.engine.common.DiagonalSystem;
import max.enoch.engine.movegen.utils.BitBoardUtils;
import max.enoch.engine.movegen.utils.RayUtils;

public final class Bishop {

    private Bishop() {}

    public static void warmUp() {
        RayUtils.warmUp();
    }

    /**
     * Slides along the four diagonal rays and stops on the first piece met. That piece is captured unless it belongs
     * to the moving army, is a foreign Bishop, or is a foreign Queen standing on the other diagonal system.
     *
     * @param foreignBishopsBB bishops of every army but the moving one
     * @param foreignQueensBB queens of every army but the moving one
     */
    public static long getPseudoLegalMovesBB(int positionIndex, long ownOccupiedSquaresBB, long occupiedSquaresBB,
                                             long foreignBishopsBB, long foreignQueensBB) {
        long movesBB = 0;
        for(BitBoardUtils.Direction direction : BitBoardUtils.DIAGONAL_DIRECTIONS) {
            long ray = RayUtils.ray(positionIndex, direction);
            int blocker = RayUtils.findBlocker(ray, occupiedSquaresBB, direction);
            movesBB |= RayUtils.freeSquaresBeforeBlocker(ray, blocker, direction);
            if(blocker >= 0 && canCapture(positionIndex, blocker, ownOccupiedSquaresBB, foreignBishopsBB, foreignQueensBB)) {
                movesBB |= 1L << blocker;
            }
        }
        return movesBB;
    }

    private static boolean canCapture(int positionIndex, int target, long ownOccupiedSquaresBB,
                                      long foreignBishopsBB, long foreignQueensBB) {
        long targetBB = 1L << target;
        if((ownOccupiedSquaresBB & targetBB) != 0 || (foreignBishopsBB & targetBB) != 0) {
            return false;
        }
        if((foreignQueensBB & targetBB) != 0) {
            return DiagonalSystem.sameSystem(positionIndex, target);
        }
        return true;
    }
}
