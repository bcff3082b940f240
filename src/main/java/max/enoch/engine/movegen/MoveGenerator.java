package max.enoch.engine.movegen;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.enoch.engine.common.Army;
import max.enoch.engine.common.Piece;
import max.enoch.engine.common.PieceKind;
import max.enoch.engine.game.board.Board;
import max.enoch.engine.movegen.pieces.Bishop;
import max.enoch.engine.movegen.pieces.King;
import max.enoch.engine.movegen.pieces.Knight;
import max.enoch.engine.movegen.pieces.Pawn;
import max.enoch.engine.movegen.pieces.Queen;
import max.enoch.engine.movegen.pieces.Rook;
import max.enoch.engine.movegen.utils.CheckUtils;
import max.enoch.engine.utils.BitUtils;

import java.util.Optional;

public final class MoveGenerator {
    private static boolean WARMED_UP = false;
    static {
        warmUp();
    }

    private MoveGenerator() {}

    public static void warmUp() {
        if(WARMED_UP) {
            return;
        }
        Pawn.warmUp();
        Knight.warmUp();
        King.warmUp();
        Queen.warmUp();
        Rook.warmUp();
        Bishop.warmUp();
        WARMED_UP = true;
    }

    /**
     * Destinations of the piece standing on {@code positionIndex}, own pieces excluded but without any king safety
     * check.
     */
    public static long getPseudoLegalMovesBB(Board board, Army army, PieceKind kind, int positionIndex) {
        long ownBB = board.occupancyByArmy[army.ordinal()];
        return switch (kind) {
            case KING -> King.getPseudoLegalMovesBB(positionIndex, ownBB);
            case KNIGHT -> Knight.getPseudoLegalMovesBB(positionIndex, ownBB);
            case ROOK -> Rook.getPseudoLegalMovesBB(positionIndex, ownBB, board.allOccupancy);
            case BISHOP -> Bishop.getPseudoLegalMovesBB(positionIndex, ownBB, board.allOccupancy,
                    board.foreignPieces(army, PieceKind.BISHOP), board.foreignPieces(army, PieceKind.QUEEN));
            case QUEEN -> Queen.getPseudoLegalMovesBB(positionIndex, ownBB,
                    board.foreignPieces(army, PieceKind.BISHOP), board.foreignPieces(army, PieceKind.QUEEN));
            case PAWN -> Pawn.getPseudoLegalMoves(positionIndex, army, board.allOccupancy,
                    board.allOccupancy & ~ownBB).allBB();
        };
    }

    /**
     * Squares the piece threatens. Same as its pseudo-legal moves, except for pawns whose two forward diagonals are
     * threatened whether or not something stands there.
     */
    public static long getAttackBB(Board board, Army army, PieceKind kind, int positionIndex) {
        if(kind == PieceKind.PAWN) {
            return Pawn.getAttackBB(positionIndex, army);
        }
        return getPseudoLegalMovesBB(board, army, kind, positionIndex);
    }

    /**
     * Legal moves of the army as packed ints (see {@link Move}). Frozen armies have none. When the king is in check
     * and can step out of it, only king moves are returned.
     */
    public static IntArrayList generateLegalMoves(Board board, Army army) {
        IntArrayList moves = new IntArrayList();
        if(board.isFrozen(army)) {
            return moves;
        }
        for(PieceKind kind : PieceKind.VALUES) {
            long piecesBB = board.pieces(army, kind);
            while(piecesBB != 0) {
                int from = BitUtils.bitScanForward(piecesBB);
                piecesBB &= piecesBB - 1;
                addLegalMoves(board, army, kind, from, moves);
            }
        }
        return applyForcedKingMove(board, army, moves);
    }

    /**
     * Legal moves of the piece standing on {@code square}, with the forced king move rule of its army applied.
     */
    public static IntArrayList generateLegalMovesFrom(Board board, int square) {
        Optional<Piece> piece = board.pieceAt(square);
        if(piece.isEmpty()) {
            return new IntArrayList();
        }
        Army army = piece.get().army();
        IntArrayList armyMoves = generateLegalMoves(board, army);
        IntArrayList moves = new IntArrayList();
        for(int i = 0; i < armyMoves.size(); i++) {
            int move = armyMoves.getInt(i);
            if(Move.getStartPosition(move) == square) {
                moves.add(move);
            }
        }
        return moves;
    }

    // Legal king moves only, ignoring the forced king move rule
    public static IntArrayList generateLegalKingMoves(Board board, Army army) {
        IntArrayList moves = new IntArrayList();
        int kingSquare = board.kingSquare(army);
        if(board.isFrozen(army) || kingSquare < 0) {
            return moves;
        }
        addLegalMoves(board, army, PieceKind.KING, kingSquare, moves);
        return moves;
    }

    private static void addLegalMoves(Board board, Army army, PieceKind kind, int from, IntArrayList moves) {
        long destinationsBB = getPseudoLegalMovesBB(board, army, kind, from);
        while(destinationsBB != 0) {
            int to = BitUtils.bitScanForward(destinationsBB);
            destinationsBB &= destinationsBB - 1;
            if(!CheckUtils.wouldKingBeInCheck(board, army, from, to)) {
                byte capturedCode = board.pieceAt(to)
                        .map(captured -> captured.kind().code)
                        .orElse(PieceKind.NONE_CODE);
                moves.add(Move.asBytes(from, to, kind.code, capturedCode));
            }
        }
    }

    private static IntArrayList applyForcedKingMove(Board board, Army army, IntArrayList moves) {
        if(!CheckUtils.isKingInCheck(board, army, board.kingSquare(army))) {
            return moves;
        }
        IntArrayList kingMoves = new IntArrayList();
        for(int i = 0; i < moves.size(); i++) {
            int move = moves.getInt(i);
            if(Move.getPieceType(move) == PieceKind.KING.code) {
                kingMoves.add(move);
            }
        }
        return kingMoves.isEmpty() ? moves : kingMoves;
    }
}
