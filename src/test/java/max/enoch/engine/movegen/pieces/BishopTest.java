package max.enoch.engine.movegen.pieces;

import max.enoch.engine.common.Army;
import max.enoch.engine.common.PieceKind;
import max.enoch.engine.game.board.Board;
import max.enoch.engine.movegen.MoveGenerator;
import org.junit.jupiter.api.Test;

import static max.enoch.engine.utils.SquareUtils.fromNotation;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class BishopTest {

    private static long bb(String... squares) {
        long bb = 0;
        for(String square : squares) {
            bb |= 1L << fromNotation(square);
        }
        return bb;
    }

    private static long bishopMoves(Board board) {
        return MoveGenerator.getPseudoLegalMovesBB(board, Army.BLUE, PieceKind.BISHOP, fromNotation("d4"));
    }

    private static Board boardWithBishopOnD4() {
        Board board = Board.empty();
        board.placePiece(Army.BLUE, PieceKind.BISHOP, fromNotation("d4"));
        return board;
    }

    @Test
    public void bishopSlidesOnAnEmptyBoard() {
        assertEquals(13, Long.bitCount(bishopMoves(boardWithBishopOnD4())));
    }

    @Test
    public void bishopCannotCaptureAForeignBishop() {
        // Given
        Board board = boardWithBishopOnD4();
        board.placePiece(Army.RED, PieceKind.BISHOP, fromNotation("f6"));

        // When
        long moves = bishopMoves(board);

        // then
        assert (moves & bb("e5")) != 0;
        assert (moves & bb("f6", "g7", "h8")) == 0;
    }

    @Test
    public void bishopCapturesAQueenOnItsOwnDiagonalSystem() {
        // Given
        Board board = boardWithBishopOnD4();
        board.placePiece(Army.RED, PieceKind.QUEEN, fromNotation("f6"));

        // When
        long moves = bishopMoves(board);

        // then
        assert (moves & bb("e5", "f6")) == bb("e5", "f6");
        assert (moves & bb("g7")) == 0;
    }

    @Test
    public void bishopIsBlockedByOwnPiecesAndCapturesOtherForeignPieces() {
        // Given
        Board board = boardWithBishopOnD4();
        board.placePiece(Army.BLUE, PieceKind.PAWN, fromNotation("e5"));
        board.placePiece(Army.YELLOW, PieceKind.KNIGHT, fromNotation("c3"));

        // When
        long moves = bishopMoves(board);

        // then
        assertEquals(bb("c3", "e3", "f2", "g1", "c5", "b6", "a7"), moves);
    }
}
