package max.enoch.engine.movegen;

import max.enoch.engine.common.PieceKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MoveTest {

    @ParameterizedTest
    @ValueSource(bytes = {0, 1, 2, 3, 4, 5, 6})
    public void testPieceTypeEncoding(byte pieceType) {
        // When
        int move = Move.asBytes(63, 63, pieceType, (byte) 6);

        // then
        assert Move.getPieceType(move) == pieceType;
    }

    @ParameterizedTest
    @ValueSource(bytes = {0, 1, 2, 3, 4, 5, 6})
    public void testCapturedTypeEncoding(byte capturedType) {
        // When
        int move = Move.asBytes(63, 63, PieceKind.KING.code, capturedType);

        // then
        assert Move.getCapturedType(move) == capturedType;
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 7, 8, 27, 56, 63})
    public void testSquaresEncoding(int square) {
        // When
        int fromMove = Move.asBytes(square, 0, PieceKind.QUEEN.code);
        int toMove = Move.asBytes(0, square, PieceKind.QUEEN.code);

        // then
        assert Move.getStartPosition(fromMove) == square;
        assert Move.getEndPosition(fromMove) == 0;
        assert Move.getEndPosition(toMove) == square;
        assert Move.getStartPosition(toMove) == 0;
    }

    @Test
    public void readableMoveMatchesPackedOne() {
        // Given
        int packed = Move.asBytes(12, 20, PieceKind.PAWN.code);

        // When
        Move move = Move.fromBytes(packed);

        // then
        assertEquals(12, move.startPosition());
        assertEquals(20, move.endPosition());
        assertEquals(PieceKind.PAWN, move.piece());
        assertNull(move.captured());
        assertFalse(Move.isCapture(packed));
        assertEquals(packed, move.toBytes());
        assertEquals("e2e3", move.toString());
    }

    @Test
    public void captureIsFlagged() {
        int packed = Move.asBytes(5, 23, PieceKind.QUEEN.code, PieceKind.ROOK.code);

        assertTrue(Move.isCapture(packed));
        assertEquals(PieceKind.ROOK, Move.fromBytes(packed).captured());
    }

    @Test
    public void unknownPieceCodeIsRejected() {
        // Given code 7 fits in the three bits but belongs to no kind
        int packed = Move.asBytes(12, 20, (byte) 7);

        // then
        assertThrows(IllegalArgumentException.class, () -> Move.fromBytes(packed));
        assertThrows(IllegalArgumentException.class, () -> PieceKind.fromCode(-1));
        assertNull(PieceKind.fromCode(PieceKind.NONE_CODE));
    }
}
