package max.enoch.engine.game.snapshot;

import max.enoch.engine.common.Army;
import max.enoch.engine.common.PieceKind;
import max.enoch.engine.common.PlayerId;
import max.enoch.engine.game.Game;
import max.enoch.engine.game.StartingPosition;
import max.enoch.engine.game.StartingPositions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GameSnapshotCodecTest {

    private static Game playedGame() {
        Game game = Game.newGame();
        game.applyMove(Army.BLUE, "e2", "e3");
        game.applyMove(Army.RED, "d7", "d6");
        game.captureKing(Army.YELLOW);
        return game;
    }

    @Test
    public void snapshotSurvivesAJsonRoundTrip() {
        // Given
        Game game = playedGame();
        String json = GameSnapshotCodec.toJson(game.snapshot());

        // When
        Game loaded = Game.fromSnapshot(GameSnapshotCodec.fromJson(json));
        loaded.refreshDerivedState();

        // then
        assertEquals(json, GameSnapshotCodec.toJson(loaded.snapshot()));
        assertEquals(game.asciiRows(), loaded.asciiRows());
        assertEquals(game.currentArmy(), loaded.currentArmy());
        assertTrue(loaded.isFrozen(Army.YELLOW));
        assertTrue(loaded.kingSquare(Army.YELLOW).isEmpty());
        assertEquals(game.kingSquare(Army.BLUE), loaded.kingSquare(Army.BLUE));
        assertEquals(game.legalMoves(Army.BLACK), loaded.legalMoves(Army.BLACK));
    }

    @Test
    public void loadedGameIsStaleUntilRefreshed() {
        // Given
        Game loaded = Game.fromSnapshot(playedGame().snapshot());

        // then
        assertTrue(loaded.isStale());
        assertThrows(IllegalStateException.class, () -> loaded.legalMoves(Army.BLACK));
        assertThrows(IllegalStateException.class, () -> loaded.applyMove(Army.BLACK, "b4", "c4"));
        assertThrows(IllegalStateException.class, loaded::snapshot);

        // When
        loaded.refreshDerivedState();

        // then
        assertFalse(loaded.isStale());
        assertEquals(Army.BLACK, loaded.currentArmy());
        assertEquals("Black moved Pawn from b4 to c4", loaded.applyMove(Army.BLACK, "b4", "c4"));
    }

    @Test
    public void snapshotCarriesAuthoritativeFieldsOnly() {
        // When
        GameSnapshot snapshot = playedGame().snapshot();
        String json = GameSnapshotCodec.toJson(snapshot);

        // then
        assertEquals(GameSnapshot.CURRENT_VERSION, snapshot.version());
        assertEquals(Army.COUNT, snapshot.armies().size());
        assertFalse(json.contains("occupancy"));
        assertFalse(json.contains("kingSquare"));
        assertTrue(json.contains("\"controller\":\"PLAYER_ONE\""));
    }

    @Test
    public void configuredControllersSurviveAThroneSeizure() {
        // Given Black starts with the second player and the Blue king takes its throne
        StartingPosition position = StartingPositions.builder("throne", "Blue king next to the Black throne")
                .controller(Army.BLACK, PlayerId.PLAYER_TWO)
                .pieces(Army.BLUE, "Kb4")
                .pieces(Army.RED, "Ke8")
                .pieces(Army.BLACK, "Kh1 Pc2")
                .pieces(Army.YELLOW, "Kh5")
                .build();
        Game game = Game.fromStartingPosition(position);
        game.captureKing(Army.BLACK);
        game.applyMove(Army.BLUE, "b4", "a4");

        // When
        Game loaded = Game.fromSnapshot(GameSnapshotCodec.fromJson(GameSnapshotCodec.toJson(game.snapshot())));
        loaded.refreshDerivedState();

        // then
        assertEquals(PlayerId.PLAYER_ONE, loaded.controllerFor(Army.BLACK));
        assertEquals(PlayerId.PLAYER_TWO, loaded.config().controllerFor(Army.BLACK));
        assertEquals(game.config().controllers(), loaded.config().controllers());
    }

    @Test
    public void malformedJsonIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> GameSnapshotCodec.fromJson("{not json"));
        assertThrows(IllegalArgumentException.class, () -> GameSnapshotCodec.fromJson("{\"version\":42}"));
    }

    @Test
    public void overlappingPiecesAreRejected() {
        // Given
        GameSnapshot snapshot = Game.newGame().snapshot();
        List<ArmySnapshot> armies = new ArrayList<>(snapshot.armies());
        ArmySnapshot blue = armies.get(Army.BLUE.ordinal());
        long[] pieces = blue.pieces();
        // Blue pawns on every square of the second rank, one of them on top of the Black knight
        pieces[PieceKind.PAWN.ordinal()] = 0xFF00L;
        armies.set(Army.BLUE.ordinal(), new ArmySnapshot(Army.BLUE, pieces, blue.throneSquare(),
                blue.secondThroneSquare(), PlayerId.PLAYER_ONE, false, false, blue.promotionZone()));
        GameSnapshot corrupted = new GameSnapshot(snapshot.version(), snapshot.turnOrder(), snapshot.controllers(),
                snapshot.currentTurnIndex(), armies);

        // then
        assertThrows(IllegalArgumentException.class, () -> Game.fromSnapshot(corrupted));
    }
}
