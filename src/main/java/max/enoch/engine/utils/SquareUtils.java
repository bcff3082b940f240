package max.enoch.engine.utils;

// Squares are 0..63 with a1 = 0, h1 = 7, a8 = 56
public final class SquareUtils {
    public static final int NO_SQUARE = -1;

    private SquareUtils() {}

    public static int square(int file, int rank) {
        if(file < 0 || file > 7 || rank < 0 || rank > 7) {
            throw new IllegalArgumentException("File and rank must be in [0,7], got " + file + "," + rank);
        }
        return rank * 8 + file;
    }

    public static int fileOf(int square) {
        return square & 7;
    }

    public static int rankOf(int square) {
        return square >>> 3;
    }

    public static boolean isOnBoard(int square) {
        return square >= 0 && square < 64;
    }

    public static int checkSquare(int square) {
        if(!isOnBoard(square)) {
            throw new IllegalArgumentException("Square index out of board: " + square);
        }
        return square;
    }

    public static int fromNotation(String notation) {
        if(notation == null || notation.length() != 2) {
            throw new IllegalArgumentException("Cannot parse square " + notation);
        }
        int file = Character.toLowerCase(notation.charAt(0)) - 'a';
        int rank = notation.charAt(1) - '1';
        return square(file, rank);
    }

    public static String toNotation(int square) {
        checkSquare(square);
        return String.valueOf((char) ('a' + fileOf(square))) + (rankOf(square) + 1);
    }
}
