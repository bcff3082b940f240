package max.enoch.engine.movegen.utils;

public final class BitBoardUtils {

    /**
     * Direction of travel on the board. "Increasing" directions move towards higher square indices, so the nearest
     * square along such a ray is its least significant bit ; the others find it with the most significant bit.
     */
    public enum Direction {
        NORTH(true), NORTHEAST(true), EAST(true), SOUTHEAST(false),
        SOUTH(false), SOUTHWEST(false), WEST(false), NORTHWEST(true);

        public final boolean increasing;

        Direction(boolean increasing) {
            this.increasing = increasing;
        }
    }

    public static final Direction[] ORTHOGONAL_DIRECTIONS = {
            Direction.NORTH, Direction.EAST, Direction.SOUTH, Direction.WEST
    };
    public static final Direction[] DIAGONAL_DIRECTIONS = {
            Direction.NORTHEAST, Direction.SOUTHEAST, Direction.SOUTHWEST, Direction.NORTHWEST
    };

    /**
     * The "Aries" diagonal system, i.e. the light squares of a regular chessboard.
     */
    public static final long ARIES_DIAGONALS = 0x55AA55AA55AA55AAL;
    /**
     * The "Cancer" diagonal system, i.e. the dark squares of a regular chessboard.
     */
    public static final long CANCER_DIAGONALS = 0xAA55AA55AA55AA55L;

    /**
     * The bitboards representing the ranks on a chessboard. Bitboard at index 0
     * identifies the 1st rank on a board, bitboard at index 1 the 2nd rank, etc.
     */
    public static final long[] RANK_BB = { 0x00000000000000FFL, 0x000000000000FF00L, 0x0000000000FF0000L, 0x00000000FF000000L,
            0x000000FF00000000L, 0x0000FF0000000000L, 0x00FF000000000000L, 0xFF00000000000000L };
    /**
     * The bitboards representing the files on a chessboard. Bitboard at index 0
     * identifies the A file, bitboard at index 1 the B file, etc.
     */
    public static final long[] FILE_BB = { 0x0101010101010101L, 0x0202020202020202L, 0x0404040404040404L, 0x0808080808080808L,
            0x1010101010101010L, 0x2020202020202020L, 0x4040404040404040L, 0x8080808080808080L };

    public static final long RANK_1 = RANK_BB[0];
    public static final long RANK_8 = RANK_BB[7];
    public static final long FILE_A = FILE_BB[0];
    public static final long FILE_H = FILE_BB[7];

    private BitBoardUtils() {}

    public static long shift(long bitboard, Direction direction) {
        return switch (direction) {
            case NORTH -> bitboard << 8;
            case SOUTH -> bitboard >>> 8;
            case EAST -> (bitboard & ~FILE_H) << 1;
            case WEST -> (bitboard & ~FILE_A) >>> 1;
            case NORTHEAST -> (bitboard & ~FILE_H) << 9;
            case NORTHWEST -> (bitboard & ~FILE_A) << 7;
            case SOUTHEAST -> (bitboard & ~FILE_H) >>> 7;
            case SOUTHWEST -> (bitboard & ~FILE_A) >>> 9;
        };
    }

    // Full ray from (excluded) positionIndex to the edge of the board, ignoring any occupancy
    public static long generateRay(int positionIndex, Direction direction) {
        long ray = 0L;
        long sqBB = shift(1L << positionIndex, direction);
        while (sqBB != 0) {
            ray |= sqBB;
            sqBB = shift(sqBB, direction);
        }
        return ray;
    }
}
