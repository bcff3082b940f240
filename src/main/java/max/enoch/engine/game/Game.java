package max.enoch.engine.game;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.enoch.engine.common.Army;
import max.enoch.engine.common.Piece;
import max.enoch.engine.common.PieceKind;
import max.enoch.engine.common.PlayerId;
import max.enoch.engine.common.Team;
import max.enoch.engine.game.board.ArmyState;
import max.enoch.engine.game.board.Board;
import max.enoch.engine.game.snapshot.ArmySnapshot;
import max.enoch.engine.game.snapshot.GameSnapshot;
import max.enoch.engine.movegen.Move;
import max.enoch.engine.movegen.MoveGenerator;
import max.enoch.engine.movegen.utils.CheckUtils;
import max.enoch.engine.utils.SquareUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A four-army game: the board, the turn order and the per-army flags. {@link #applyMove} is the only way a move
 * changes the position; a rejected move throws {@link IllegalMoveException} and leaves the game untouched.
 * <p>
 * Not thread-safe.
 */
public class Game {
    private static final Logger log = LoggerFactory.getLogger(Game.class);

    private static final List<PieceKind> PRIVILEGED_PROMOTION_TARGETS =
            List.of(PieceKind.QUEEN, PieceKind.ROOK, PieceKind.BISHOP, PieceKind.KNIGHT);

    public static void warmUp() {
        MoveGenerator.warmUp();
    }

    private final Board board;
    private final GameConfig config;
    private final GameState state;
    // Set after loading a snapshot until refreshDerivedState() is called
    private boolean stale;

    private Game(Board board, GameConfig config, GameState state, boolean stale) {
        this.board = board;
        this.config = config;
        this.state = state;
        this.stale = stale;
    }

    public static Game newGame() {
        return fromStartingPosition(StartingPositions.TABLET_OF_FIRE);
    }

    public static Game fromStartingPosition(StartingPosition position) {
        log.debug("Setting up starting position {}", position.name());
        return withConfig(position.toBoard(), position.toConfig());
    }

    public static Game withConfig(Board board, GameConfig config) {
        for(Army army : Army.VALUES) {
            board.setController(army, config.controllerFor(army));
        }
        board.refreshOccupancy();
        Game game = new Game(board, config, new GameState(), false);
        game.state.syncWithBoard(board);
        game.updateStalemateStatus();
        if(!game.canMove(game.currentArmy())) {
            game.advanceToNextArmy();
        }
        return game;
    }

    /**
     * Rebuilds a game from its authoritative fields. The returned game is stale: call {@link #refreshDerivedState()}
     * before anything else.
     *
     * @throws IllegalArgumentException if the snapshot is structurally inconsistent
     */
    public static Game fromSnapshot(GameSnapshot snapshot) {
        ArmySnapshot[] byArmy = new ArmySnapshot[Army.COUNT];
        for(ArmySnapshot armySnapshot : snapshot.armies()) {
            if(byArmy[armySnapshot.army().ordinal()] != null) {
                throw new IllegalArgumentException("Snapshot lists " + armySnapshot.army() + " twice");
            }
            byArmy[armySnapshot.army().ordinal()] = armySnapshot;
        }
        ArmyState[] armyStates = new ArmyState[Army.COUNT];
        long[] promotionZones = new long[Army.COUNT];
        GameConfig config = new GameConfig.Builder()
                .turnOrder(snapshot.turnOrder())
                .controllers(snapshot.controllers())
                .build();
        for(Army army : Army.VALUES) {
            ArmySnapshot armySnapshot = byArmy[army.ordinal()];
            if(armySnapshot == null) {
                throw new IllegalArgumentException("Snapshot has no entry for " + army);
            }
            armyStates[army.ordinal()] = new ArmyState(army, armySnapshot.throneSquare(),
                    armySnapshot.secondThroneSquare(), armySnapshot.controller(), armySnapshot.frozen());
            promotionZones[army.ordinal()] = armySnapshot.promotionZone();
        }

        Board board = new Board(armyStates, promotionZones);
        long seenBB = 0;
        for(Army army : Army.VALUES) {
            long[] pieces = byArmy[army.ordinal()].pieces();
            for(PieceKind kind : PieceKind.VALUES) {
                long kindBB = pieces[kind.ordinal()];
                if((seenBB & kindBB) != 0) {
                    throw new IllegalArgumentException("Snapshot has overlapping pieces for " + army + " " + kind);
                }
                seenBB |= kindBB;
                board.byArmyKind[army.ordinal()][kind.ordinal()] = kindBB;
            }
        }

        GameState state = new GameState();
        state.setCurrentTurnIndex(snapshot.currentTurnIndex());
        for(Army army : Army.VALUES) {
            state.setStalemated(army, byArmy[army.ordinal()].stalemated());
        }
        return new Game(board, config, state, true);
    }

    public void refreshDerivedState() {
        board.refreshOccupancy();
        state.syncWithBoard(board);
        stale = false;
        log.debug("Derived state refreshed, {} to move", currentArmy().displayName());
    }

    public GameSnapshot snapshot() {
        checkFresh();
        List<ArmySnapshot> armies = new ArrayList<>(Army.COUNT);
        for(Army army : Army.VALUES) {
            ArmyState armyState = board.armyState(army);
            armies.add(new ArmySnapshot(army, board.byArmyKind[army.ordinal()], armyState.throneSquare(),
                    armyState.secondThroneSquare(), armyState.controller(), armyState.frozen(),
                    state.isStalemated(army), board.promotionZones[army.ordinal()]));
        }
        return new GameSnapshot(GameSnapshot.CURRENT_VERSION, config.turnOrder(), config.controllers(),
                state.currentTurnIndex(), armies);
    }

    public boolean isStale() {
        return stale;
    }

    // ***** Queries *****

    public Board board() {
        return board;
    }

    public GameConfig config() {
        return config;
    }

    public Army currentArmy() {
        return config.armyAt(state.currentTurnIndex());
    }

    public IntArrayList legalMoves(Army army) {
        checkFresh();
        if(!canMove(army)) {
            return new IntArrayList();
        }
        return MoveGenerator.generateLegalMoves(board, army);
    }

    /**
     * Legal moves of whatever piece stands on the square, empty when the square is empty or its army cannot move.
     */
    public IntArrayList legalMovesFrom(int square) {
        checkFresh();
        Optional<Piece> piece = board.pieceAt(square);
        if(piece.isEmpty() || !canMove(piece.get().army())) {
            return new IntArrayList();
        }
        return MoveGenerator.generateLegalMovesFrom(board, square);
    }

    public boolean isFrozen(Army army) {
        checkFresh();
        return state.isFrozen(army);
    }

    public boolean isStalemated(Army army) {
        checkFresh();
        return state.isStalemated(army);
    }

    public OptionalInt kingSquare(Army army) {
        checkFresh();
        return state.kingSquare(army);
    }

    public boolean kingInCheck(Army army) {
        checkFresh();
        return CheckUtils.isKingInCheck(board, army, state.kingSquare(army).orElse(SquareUtils.NO_SQUARE));
    }

    /**
     * True when the king is in check and has at least one legal move: only king moves are then allowed.
     */
    public boolean mustMoveKing(Army army) {
        return kingInCheck(army) && !state.isFrozen(army)
                && !MoveGenerator.generateLegalKingMoves(board, army).isEmpty();
    }

    public ArmyStatus status(Army army) {
        checkFresh();
        return new ArmyStatus(army, state.isFrozen(army), state.isStalemated(army), kingInCheck(army),
                board.controllerFor(army), state.kingSquare(army));
    }

    public PlayerId controllerFor(Army army) {
        checkFresh();
        return board.controllerFor(army);
    }

    public Map<PieceKind, Integer> pieceCounts(Army army) {
        checkFresh();
        return board.pieceCounts(army);
    }

    public Optional<Team> winningTeam() {
        checkFresh();
        int airKings = state.kingsAlive(Team.AIR);
        int earthKings = state.kingsAlive(Team.EARTH);
        if(earthKings == 0 && airKings > 0) {
            return Optional.of(Team.AIR);
        }
        if(airKings == 0 && earthKings > 0) {
            return Optional.of(Team.EARTH);
        }
        return Optional.empty();
    }

    // No king left at all, or two kings facing none
    public boolean isDraw() {
        checkFresh();
        int airKings = state.kingsAlive(Team.AIR);
        int earthKings = state.kingsAlive(Team.EARTH);
        return (airKings == 0 && earthKings == 0)
                || (airKings == 0 && earthKings == 2)
                || (earthKings == 0 && airKings == 2);
    }

    public boolean isOver() {
        return winningTeam().isPresent() || isDraw();
    }

    /**
     * A pawn is privileged when its army is down to its king, its pawns and at most one other piece.
     */
    public boolean isPrivilegedPawn(Army army) {
        Map<PieceKind, Integer> counts = pieceCounts(army);
        if(counts.get(PieceKind.KING) == 0 || counts.get(PieceKind.PAWN) == 0) {
            return false;
        }
        int majors = 0;
        for(PieceKind kind : PieceKind.VALUES) {
            if(kind.isMajor()) {
                majors += counts.get(kind);
            }
        }
        return majors <= 1;
    }

    public List<PieceKind> promotionTargets(Army army) {
        return isPrivilegedPawn(army) ? PRIVILEGED_PROMOTION_TARGETS : List.of(PieceKind.QUEEN);
    }

    public boolean canPromoteAt(Army army, int square) {
        return board.isInPromotionZone(army, SquareUtils.checkSquare(square));
    }

    public List<String> asciiRows() {
        checkFresh();
        return board.asciiRows();
    }

    // ***** Moves *****

    /**
     * Dry run of {@link #applyMove}: the reason the move would be rejected, or empty if it would be accepted.
     */
    public Optional<MoveError> validateMove(Army army, int from, int to, PieceKind promotion) {
        checkFresh();
        IllegalMoveException rejection = findRejection(army, from, to, promotion);
        return rejection == null ? Optional.empty() : Optional.of(rejection.getError());
    }

    /**
     * Plays a move for the army.
     *
     * @param promotion requested promotion kind, {@code null} for the default (Queen). Ignored when the move does not
     *                  promote.
     * @return a confirmation such as "Blue moved Pawn from e2 to e3"
     * @throws IllegalMoveException if the move is rejected
     */
    public String applyMove(Army army, int from, int to, PieceKind promotion) {
        checkFresh();
        IllegalMoveException rejection = findRejection(army, from, to, promotion);
        if(rejection != null) {
            log.debug("Rejected {} move {} -> {}: {}", army.displayName(), SquareUtils.toNotation(from),
                    SquareUtils.toNotation(to), rejection.getMessage());
            throw rejection;
        }

        PieceKind kind = board.pieceAt(from).orElseThrow().kind();
        // Decided before anything moves, a capture never changes the mover's own counts anyway
        PieceKind promotionTarget = kind == PieceKind.PAWN && canPromoteAt(army, to)
                ? resolvePromotionTarget(army, promotion)
                : null;

        StringBuilder confirmation = new StringBuilder()
                .append(army.displayName()).append(" moved ").append(kind.displayName())
                .append(" from ").append(SquareUtils.toNotation(from))
                .append(" to ").append(SquareUtils.toNotation(to));

        Optional<Piece> captured = board.pieceAt(to);
        if(captured.isPresent()) {
            Piece victim = captured.get();
            if(victim.kind() == PieceKind.KING) {
                takeKing(victim.army());
            } else {
                board.removePiece(victim.army(), victim.kind(), to);
            }
            confirmation.append(" capturing ").append(victim.displayName());
        }

        board.movePiece(army, kind, from, to);
        if(kind == PieceKind.KING) {
            state.setKingSquare(army, to);
            seizeThroneAt(army, to);
        }
        if(promotionTarget != null) {
            promotePawn(army, to, promotionTarget);
            confirmation.append(" promoting to ").append(promotionTarget.displayName());
        }

        state.syncWithBoard(board);
        updateStalemateStatus();
        advanceToNextArmy();

        String text = confirmation.toString();
        log.info(text);
        if(isOver()) {
            log.info("Game over: {}", winningTeam().map(team -> team.displayName() + " wins").orElse("draw"));
        }
        return text;
    }

    public String applyMove(Army army, String from, String to) {
        return applyMove(army, SquareUtils.fromNotation(from), SquareUtils.fromNotation(to), null);
    }

    private IllegalMoveException findRejection(Army army, int from, int to, PieceKind promotion) {
        SquareUtils.checkSquare(from);
        SquareUtils.checkSquare(to);
        if(isOver()) {
            return new IllegalMoveException(MoveError.GAME_OVER, "The game is over");
        }
        if(state.isFrozen(army)) {
            return new IllegalMoveException(MoveError.ARMY_FROZEN, army.displayName() + " is frozen");
        }
        if(army != currentArmy()) {
            return new IllegalMoveException(MoveError.WRONG_TURN, "It is not " + army.displayName() + "'s turn");
        }
        Optional<Piece> piece = board.pieceAt(from);
        if(piece.isEmpty()) {
            return new IllegalMoveException(MoveError.NO_PIECE_AT_SOURCE,
                    "No piece on " + SquareUtils.toNotation(from));
        }
        if(piece.get().army() != army) {
            return new IllegalMoveException(MoveError.FOREIGN_PIECE,
                    SquareUtils.toNotation(from) + " holds a " + piece.get().displayName());
        }
        Optional<Piece> target = board.pieceAt(to);
        if(target.isPresent() && target.get().army() == army) {
            return new IllegalMoveException(MoveError.SELF_CAPTURE, "Cannot capture own piece");
        }
        PieceKind kind = piece.get().kind();
        if(kind != PieceKind.KING && mustMoveKing(army)) {
            return new IllegalMoveException(MoveError.KING_MUST_MOVE, "King must move while in check");
        }
        if(!containsMove(legalMoves(army), from, to)) {
            return new IllegalMoveException(MoveError.ILLEGAL_DESTINATION,
                    kind.displayName() + " cannot go from " + SquareUtils.toNotation(from)
                            + " to " + SquareUtils.toNotation(to));
        }
        if(kind == PieceKind.PAWN && canPromoteAt(army, to)
                && (promotion == PieceKind.PAWN || promotion == PieceKind.KING)) {
            return new IllegalMoveException(MoveError.INVALID_PROMOTION_TARGET,
                    "Cannot promote to " + promotion.displayName());
        }
        return null;
    }

    private static boolean containsMove(IntArrayList moves, int from, int to) {
        for(int i = 0; i < moves.size(); i++) {
            int move = moves.getInt(i);
            if(Move.getStartPosition(move) == from && Move.getEndPosition(move) == to) {
                return true;
            }
        }
        return false;
    }

    private PieceKind resolvePromotionTarget(Army army, PieceKind requested) {
        PieceKind target = requested == null ? PieceKind.QUEEN : requested;
        if(target != PieceKind.QUEEN && !isPrivilegedPawn(army)) {
            log.debug("{} pawn is not privileged, promoting to Queen instead of {}", army.displayName(), target.displayName());
            return PieceKind.QUEEN;
        }
        return target;
    }

    private void promotePawn(Army army, int square, PieceKind target) {
        // A privileged pawn frees the slot first: the piece already holding it goes back to being a pawn
        if(isPrivilegedPawn(army) && board.pieces(army, target) != 0) {
            OptionalInt demoted = board.demotePieceToPawn(army, target);
            demoted.ifPresent(sq -> log.debug("{} {} on {} demoted to Pawn", army.displayName(), target.displayName(),
                    SquareUtils.toNotation(sq)));
        }
        board.removePiece(army, PieceKind.PAWN, square);
        board.placePiece(army, target, square);
        log.debug("{} pawn promoted to {} on {}", army.displayName(), target.displayName(), SquareUtils.toNotation(square));
    }

    private void seizeThroneAt(Army army, int square) {
        Optional<Army> owner = board.throneOwner(square);
        if(owner.isEmpty() || !army.isAllyOf(owner.get())) {
            return;
        }
        Army ally = owner.get();
        board.setController(ally, board.controllerFor(army));
        setFrozen(ally, false);
        log.info("{} king seized the {} throne on {}", army.displayName(), ally.displayName(), SquareUtils.toNotation(square));
    }

    // ***** Administrative operations *****

    /**
     * Removes the army's king from the board and freezes the army.
     */
    public void captureKing(Army army) {
        checkFresh();
        takeKing(army);
        updateStalemateStatus();
        if(!canMove(currentArmy())) {
            advanceToNextArmy();
        }
    }

    /**
     * Puts a captured king back on the army's first throne square, clearing whatever stands there, and unfreezes the
     * army.
     *
     * @throws IllegalStateException if the army still has its king
     */
    public void restoreKingToThrone(Army army) {
        checkFresh();
        if(state.kingSquare(army).isPresent()) {
            throw new IllegalStateException(army.displayName() + " king has not been captured");
        }
        int throne = board.armyState(army).throneSquare();
        Optional<Piece> removed = board.clearSquare(throne);
        removed.ifPresent(piece -> log.debug("{} removed from {} to restore the {} king", piece.displayName(),
                SquareUtils.toNotation(throne), army.displayName()));
        if(removed.isPresent() && removed.get().kind() == PieceKind.KING) {
            setFrozen(removed.get().army(), true);
        }
        board.placePiece(army, PieceKind.KING, throne);
        setFrozen(army, false);
        state.syncWithBoard(board);
        updateStalemateStatus();
        log.info("{} king restored on {}", army.displayName(), SquareUtils.toNotation(throne));
    }

    /**
     * Both kings must have been captured. Each is restored on its first throne square and both armies are unfrozen.
     *
     * @return false, leaving the game untouched, if either king is still on the board
     */
    public boolean exchangePrisoners(Army army, Army otherArmy) {
        checkFresh();
        if(army == otherArmy || state.kingSquare(army).isPresent() || state.kingSquare(otherArmy).isPresent()) {
            log.debug("Cannot exchange prisoners between {} and {}", army.displayName(), otherArmy.displayName());
            return false;
        }
        restoreKingToThrone(army);
        restoreKingToThrone(otherArmy);
        log.info("{} and {} exchanged prisoners", army.displayName(), otherArmy.displayName());
        return true;
    }

    /**
     * Moves the turn to the next army able to play, going at most once around the turn order.
     */
    public void advanceToNextArmy() {
        checkFresh();
        for(int i = 0; i < Army.COUNT; i++) {
            state.advanceTurn();
            if(canMove(currentArmy())) {
                return;
            }
        }
        log.debug("No army can move, turn stays with {}", currentArmy().displayName());
    }

    // ***** Internals *****

    private boolean canMove(Army army) {
        return !state.isFrozen(army) && !state.isStalemated(army);
    }

    private void takeKing(Army army) {
        OptionalInt square = state.kingSquare(army);
        square.ifPresent(board::clearSquare);
        setFrozen(army, true);
        state.clearKingSquare(army);
        log.info("{} king captured, {} is frozen", army.displayName(), army.displayName());
    }

    private void setFrozen(Army army, boolean frozen) {
        board.setFrozen(army, frozen);
        state.setFrozen(army, frozen);
    }

    // A frozen army is never stalemated; any other army is as soon as it has no legal move, even when in check.
    // The older rule kept a checked army out of stalemate, which left the turn stuck on an army that cannot play.
    private void updateStalemateStatus() {
        for(Army army : Army.VALUES) {
            boolean stalemated = !state.isFrozen(army) && MoveGenerator.generateLegalMoves(board, army).isEmpty();
            if(stalemated != state.isStalemated(army)) {
                log.debug("{} stalemated: {}", army.displayName(), stalemated);
            }
            state.setStalemated(army, stalemated);
        }
    }

    private void checkFresh() {
        if(stale) {
            throw new IllegalStateException("Derived state is stale, call refreshDerivedState() first");
        }
    }
}
