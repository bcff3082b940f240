package max.enoch.engine.game.board;

import max.enoch.engine.common.Army;
import max.enoch.engine.common.Piece;
import max.enoch.engine.common.PieceKind;
import max.enoch.engine.common.PlayerId;
import max.enoch.engine.common.Team;
import max.enoch.engine.game.StartingPositions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

import static max.enoch.engine.utils.SquareUtils.fromNotation;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BoardTest {

    private static void assertDerivedStateConsistent(Board board) {
        long seen = 0;
        for(Army army : Army.VALUES) {
            long armyBB = 0;
            for(PieceKind kind : PieceKind.VALUES) {
                long kindBB = board.pieces(army, kind);
                assertEquals(0L, seen & kindBB, "two pieces share a square");
                seen |= kindBB;
                armyBB |= kindBB;
            }
            assertEquals(armyBB, board.occupancyByArmy[army.ordinal()]);
        }
        assertEquals(board.occupancyByTeam[Team.AIR.ordinal()] | board.occupancyByTeam[Team.EARTH.ordinal()],
                board.allOccupancy);
        assertEquals(seen, board.allOccupancy);
        assertEquals(~board.allOccupancy, board.free);
    }

    @Test
    public void emptyBoardIsFree() {
        Board board = Board.empty();

        assertEquals(0L, board.allOccupancy);
        assertEquals(~0L, board.free);
        assertTrue(board.pieceAt(fromNotation("e4")).isEmpty());
    }

    @Test
    public void mutatorsKeepDerivedStateConsistent() {
        // Given
        Board board = Board.empty();

        // When
        board.placePiece(Army.BLUE, PieceKind.KING, fromNotation("e1"));
        board.placePiece(Army.BLACK, PieceKind.ROOK, fromNotation("a6"));
        board.placePiece(Army.RED, PieceKind.QUEEN, fromNotation("c8"));
        board.placePiece(Army.YELLOW, PieceKind.PAWN, fromNotation("g4"));
        assertDerivedStateConsistent(board);
        board.movePiece(Army.BLUE, PieceKind.KING, fromNotation("e1"), fromNotation("e2"));
        assertDerivedStateConsistent(board);
        board.removePiece(Army.RED, PieceKind.QUEEN, fromNotation("c8"));
        assertDerivedStateConsistent(board);
        Optional<Piece> cleared = board.clearSquare(fromNotation("g4"));

        // then
        assertDerivedStateConsistent(board);
        assertEquals(Optional.of(new Piece(Army.YELLOW, PieceKind.PAWN)), cleared);
        assertEquals(Optional.of(new Piece(Army.BLUE, PieceKind.KING)), board.pieceAt(fromNotation("e2")));
        assertEquals(2, Long.bitCount(board.allOccupancy));
        assertEquals(board.occupancyByArmy[Army.BLUE.ordinal()] | board.occupancyByArmy[Army.BLACK.ordinal()],
                board.occupancyByTeam[Team.AIR.ordinal()]);
    }

    @Test
    public void placingOnAnOccupiedSquareIsRefused() {
        // Given
        Board board = Board.empty();
        board.placePiece(Army.BLUE, PieceKind.KING, fromNotation("e1"));

        // then
        assertThrows(IllegalArgumentException.class,
                () -> board.placePiece(Army.RED, PieceKind.QUEEN, fromNotation("e1")));
        assertThrows(IllegalArgumentException.class,
                () -> board.movePiece(Army.BLUE, PieceKind.QUEEN, fromNotation("d1"), fromNotation("d2")));
        assertDerivedStateConsistent(board);
    }

    @Test
    public void startingPositionIsConsistent() {
        Board board = StartingPositions.TABLET_OF_FIRE.toBoard();

        assertDerivedStateConsistent(board);
        assertEquals(40, Long.bitCount(board.allOccupancy));
        assertEquals(fromNotation("e1"), board.kingSquare(Army.BLUE));
        assertEquals(fromNotation("a5"), board.kingSquare(Army.BLACK));
        assertEquals(fromNotation("e8"), board.kingSquare(Army.RED));
        assertEquals(fromNotation("h5"), board.kingSquare(Army.YELLOW));
        assertEquals(5, board.pieceCounts(Army.RED).get(PieceKind.PAWN));
        assertEquals(1, board.pieceCounts(Army.RED).get(PieceKind.QUEEN));
        assertEquals(10, board.squaresOf(Army.YELLOW).size());
    }

    @Test
    public void demotionTurnsTheFirstPieceOfAKindIntoAPawn() {
        // Given
        Board board = Board.empty();
        board.placePiece(Army.BLUE, PieceKind.KNIGHT, fromNotation("g1"));
        board.placePiece(Army.BLUE, PieceKind.KNIGHT, fromNotation("b1"));

        // When
        OptionalInt demoted = board.demotePieceToPawn(Army.BLUE, PieceKind.KNIGHT);

        // then
        assertEquals(OptionalInt.of(fromNotation("b1")), demoted);
        assertEquals(Optional.of(new Piece(Army.BLUE, PieceKind.PAWN)), board.pieceAt(fromNotation("b1")));
        assertEquals(Optional.of(new Piece(Army.BLUE, PieceKind.KNIGHT)), board.pieceAt(fromNotation("g1")));
        assertDerivedStateConsistent(board);
    }

    @Test
    public void demotionOfAbsentKindOrPawnDoesNothing() {
        Board board = Board.empty();
        board.placePiece(Army.BLUE, PieceKind.PAWN, fromNotation("e2"));

        assertTrue(board.demotePieceToPawn(Army.BLUE, PieceKind.ROOK).isEmpty());
        assertTrue(board.demotePieceToPawn(Army.BLUE, PieceKind.PAWN).isEmpty());
        assertEquals(1, Long.bitCount(board.allOccupancy));
    }

    @Test
    public void thronesBelongToTheirArmy() {
        Board board = Board.empty();

        assertEquals(Optional.of(Army.BLUE), board.throneOwner(fromNotation("d1")));
        assertEquals(Optional.of(Army.BLACK), board.throneOwner(fromNotation("a4")));
        assertEquals(Optional.of(Army.RED), board.throneOwner(fromNotation("e8")));
        assertEquals(Optional.of(Army.YELLOW), board.throneOwner(fromNotation("h5")));
        assertTrue(board.throneOwner(fromNotation("e4")).isEmpty());
        assertEquals(-1, board.kingSquare(Army.BLUE));
    }

    @Test
    public void copyIsIndependent() {
        // Given
        Board board = StartingPositions.TABLET_OF_FIRE.toBoard();

        // When
        Board copy = board.copy();
        copy.clearSquare(fromNotation("e2"));
        copy.setFrozen(Army.RED, true);
        copy.setController(Army.BLACK, PlayerId.PLAYER_TWO);

        // then
        assertNotEquals(copy.allOccupancy, board.allOccupancy);
        assertTrue(board.pieceAt(fromNotation("e2")).isPresent());
        assertFalse(board.isFrozen(Army.RED));
        assertEquals(PlayerId.PLAYER_ONE, board.controllerFor(Army.BLACK));
    }

    @Test
    public void asciiRowsShowEveryArmy() {
        // When
        List<String> rows = StartingPositions.TABLET_OF_FIRE.toBoard().asciiRows();

        // then
        assertEquals(8, rows.size());
        assertEquals("8 . N Q B K R . .", rows.get(0));
        assertEquals("5 k p . . . . p k", rows.get(3));
        assertEquals("2 n p P P P P P .", rows.get(6));
        assertEquals("1 . . R B K Q N .", rows.get(7));
    }

    @Test
    public void promotionZonesFaceEachArmy() {
        Board board = Board.empty();

        assertTrue(board.isInPromotionZone(Army.BLUE, fromNotation("a8")));
        assertTrue(board.isInPromotionZone(Army.RED, fromNotation("h1")));
        assertTrue(board.isInPromotionZone(Army.BLACK, fromNotation("h4")));
        assertTrue(board.isInPromotionZone(Army.YELLOW, fromNotation("a4")));
        assertFalse(board.isInPromotionZone(Army.BLUE, fromNotation("a1")));
    }
}
