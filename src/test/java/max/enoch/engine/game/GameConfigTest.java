package max.enoch.engine.game;

import max.enoch.engine.common.Army;
import max.enoch.engine.common.PlayerId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class GameConfigTest {

    @Test
    public void defaultsAlternateTheTeams() {
        GameConfig config = GameConfig.defaults();

        assertEquals(List.of(Army.BLUE, Army.RED, Army.BLACK, Army.YELLOW), config.turnOrder());
        assertEquals(PlayerId.PLAYER_ONE, config.controllerFor(Army.BLUE));
        assertEquals(PlayerId.PLAYER_ONE, config.controllerFor(Army.BLACK));
        assertEquals(PlayerId.PLAYER_TWO, config.controllerFor(Army.RED));
        assertEquals(PlayerId.PLAYER_TWO, config.controllerFor(Army.YELLOW));
    }

    @Test
    public void builderOverridesDefaults() {
        GameConfig config = new GameConfig.Builder()
                .turnOrder(Army.YELLOW, Army.BLACK, Army.RED, Army.BLUE)
                .controller(Army.BLACK, PlayerId.PLAYER_TWO)
                .build();

        assertEquals(Army.YELLOW, config.armyAt(0));
        assertEquals(PlayerId.PLAYER_TWO, config.controllerFor(Army.BLACK));
    }

    @Test
    public void turnOrderMustBeAPermutation() {
        assertThrows(IllegalArgumentException.class,
                () -> new GameConfig.Builder().turnOrder(Army.BLUE, Army.BLUE, Army.RED, Army.YELLOW).build());
        assertThrows(IllegalArgumentException.class,
                () -> new GameConfig.Builder().turnOrder(Army.BLUE, Army.RED).build());
    }

    @Test
    public void gameStartsWithTheFirstArmyOfTheTurnOrder() {
        GameConfig config = new GameConfig.Builder()
                .turnOrder(Army.RED, Army.BLUE, Army.YELLOW, Army.BLACK)
                .build();

        Game game = Game.withConfig(StartingPositions.TABLET_OF_FIRE.toBoard(), config);

        assertEquals(Army.RED, game.currentArmy());
    }
}
