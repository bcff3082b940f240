package max.enoch.engine.movegen.utils;

import max.enoch.engine.utils.BitUtils;

/**
 * Precomputed sliding rays, indexed by origin square then by {@link BitBoardUtils.Direction} ordinal.
 * Filled once when the class is loaded and never written again.
 */
public final class RayUtils {
    public static final long[][] RAYS = new long[64][8];
    public static final long[] ROOK_RAYS_BB = new long[64];
    public static final long[] BISHOP_RAYS_BB = new long[64];
    public static final long[] QUEEN_RAYS_BB = new long[64];

    static {
        for(int sq = 0; sq < 64; sq++) {
            for(BitBoardUtils.Direction direction : BitBoardUtils.Direction.values()) {
                RAYS[sq][direction.ordinal()] = BitBoardUtils.generateRay(sq, direction);
            }
            for(BitBoardUtils.Direction direction : BitBoardUtils.ORTHOGONAL_DIRECTIONS) {
                ROOK_RAYS_BB[sq] |= RAYS[sq][direction.ordinal()];
            }
            for(BitBoardUtils.Direction direction : BitBoardUtils.DIAGONAL_DIRECTIONS) {
                BISHOP_RAYS_BB[sq] |= RAYS[sq][direction.ordinal()];
            }
            QUEEN_RAYS_BB[sq] = ROOK_RAYS_BB[sq] | BISHOP_RAYS_BB[sq];
        }
    }

    private RayUtils() {}

    public static void warmUp() {
        // To init the tables
    }

    public static long ray(int positionIndex, BitBoardUtils.Direction direction) {
        return RAYS[positionIndex][direction.ordinal()];
    }

    /**
     * @return the square of the first occupied square met along the ray, or -1 if the ray is free
     */
    public static int findBlocker(long ray, long occupiedBB, BitBoardUtils.Direction direction) {
        long blockersBB = ray & occupiedBB;
        if(blockersBB == 0) {
            return -1;
        }
        return direction.increasing
                ? BitUtils.bitScanForward(blockersBB)
                : BitUtils.bitScanBackward(blockersBB);
    }

    /**
     * Squares strictly between the origin and the blocker along the ray (the whole ray when there is no blocker).
     */
    public static long freeSquaresBeforeBlocker(long ray, int blocker, BitBoardUtils.Direction direction) {
        if(blocker < 0) {
            return ray;
        }
        long cut = direction.increasing
                ? (1L << blocker) - 1                 // everything below the blocker
                : ~((1L << blocker) | ((1L << blocker) - 1)); // everything above the blocker
        return ray & cut;
    }
}
