package max.enoch.engine.movegen.utils;

import max.enoch.engine.common.Army;
import max.enoch.engine.common.Piece;
import max.enoch.engine.common.PieceKind;
import max.enoch.engine.common.Team;
import max.enoch.engine.game.board.Board;
import max.enoch.engine.movegen.MoveGenerator;
import max.enoch.engine.utils.BitUtils;

import java.util.Optional;

/**
 * Attack and check detection. Nothing is cached: every query regenerates the attacker's moves from the board.
 */
public final class CheckUtils {

    private CheckUtils() {}

    public static boolean isSquareAttackedByArmy(Board board, int square, Army attacker) {
        // A frozen army threatens nothing
        if(board.isFrozen(attacker)) {
            return false;
        }
        long squareBB = 1L << square;
        for(PieceKind kind : PieceKind.VALUES) {
            long piecesBB = board.pieces(attacker, kind);
            while(piecesBB != 0) {
                int from = BitUtils.bitScanForward(piecesBB);
                piecesBB &= piecesBB - 1;
                if((MoveGenerator.getAttackBB(board, attacker, kind, from) & squareBB) != 0) {
                    return true;
                }
            }
        }
        return false;
    }

    public static boolean isSquareAttackedByTeam(Board board, int square, Team team) {
        for(Army army : team.armies()) {
            if(isSquareAttackedByArmy(board, square, army)) {
                return true;
            }
        }
        return false;
    }

    // Only the opposing team gives check, allies never do
    public static boolean isKingInCheck(Board board, Army army, int kingSquare) {
        if(kingSquare < 0) {
            return false;
        }
        return isSquareAttackedByTeam(board, kingSquare, army.team().opponent());
    }

    /**
     * Plays the move on a scratch copy of the board and tells whether the mover's king is attacked afterwards.
     * Capturing a king freezes its army on the copy, so that army no longer gives check.
     */
    public static boolean wouldKingBeInCheck(Board board, Army army, int from, int to) {
        Board scratch = board.copy();
        Optional<Piece> moving = scratch.pieceAt(from);
        if(moving.isEmpty()) {
            throw new IllegalArgumentException("No piece to move on square " + from);
        }
        Optional<Piece> captured = scratch.clearSquare(to);
        if(captured.isPresent() && captured.get().kind() == PieceKind.KING) {
            scratch.setFrozen(captured.get().army(), true);
        }
        scratch.movePiece(army, moving.get().kind(), from, to);
        return isKingInCheck(scratch, army, scratch.kingSquare(army));
    }
}
