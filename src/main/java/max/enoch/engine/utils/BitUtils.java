package max.enoch.engine.utils;

public final class BitUtils {

    private BitUtils() {}

    /**
     * Returns the index of the first (<i>rightmost</i>) bit set to 1 in the bitboard provided in input. The bit is the
     * Least Significant 1-bit (LS1B).
     *
     * @param bb the bitboard for which the LS1B is to be returned
     * @return the index of the first bit set to 1, or 64 if the bitboard is empty
     */
    public static int bitScanForward(long bb) {
        return Long.numberOfTrailingZeros(bb);
    }

    /**
     * Returns the index of the last (<i>leftmost</i>) bit set to 1, the Most Significant 1-bit (MS1B).
     *
     * @param bb the bitboard for which the MS1B is to be returned
     * @return the index of the last bit set to 1, or -1 if the bitboard is empty
     */
    public static int bitScanBackward(long bb) {
        return 63 - Long.numberOfLeadingZeros(bb);
    }

    public static boolean isSet(long bb, int positionIndex) {
        return (bb & (1L << positionIndex)) != 0;
    }

    public static int bitCount(long bb) {
        return Long.bitCount(bb);
    }
}
