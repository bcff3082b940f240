package max.enoch.engine.game;

import max.enoch.engine.common.Army;
import max.enoch.engine.common.PlayerId;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class GameConfig {
    public static final List<Army> DEFAULT_TURN_ORDER = List.of(Army.BLUE, Army.RED, Army.BLACK, Army.YELLOW);

    private final List<Army> turnOrder;
    private final Map<Army, PlayerId> controllers;

    private GameConfig(Builder b) {
        turnOrder = List.copyOf(b.turnOrder);
        controllers = Collections.unmodifiableMap(new EnumMap<>(b.controllers));
    }

    public static GameConfig defaults() {
        return new Builder().build();
    }

    public List<Army> turnOrder() {
        return turnOrder;
    }

    public Army armyAt(int turnIndex) {
        return turnOrder.get(turnIndex);
    }

    public PlayerId controllerFor(Army army) {
        return controllers.get(army);
    }

    public Map<Army, PlayerId> controllers() {
        return controllers;
    }

    public static void checkTurnOrder(List<Army> turnOrder) {
        if(turnOrder == null || turnOrder.size() != Army.COUNT) {
            throw new IllegalArgumentException("Turn order must list the " + Army.COUNT + " armies, got " + turnOrder);
        }
        Set<Army> seen = EnumSet.noneOf(Army.class);
        for(Army army : turnOrder) {
            if(army == null || !seen.add(army)) {
                throw new IllegalArgumentException("Turn order is not a permutation of the armies: " + turnOrder);
            }
        }
    }

    public static class Builder {
        private List<Army> turnOrder = DEFAULT_TURN_ORDER;
        private final Map<Army, PlayerId> controllers = new EnumMap<>(Army.class);

        public Builder() {
            controllers.put(Army.BLUE, PlayerId.PLAYER_ONE);
            controllers.put(Army.BLACK, PlayerId.PLAYER_ONE);
            controllers.put(Army.RED, PlayerId.PLAYER_TWO);
            controllers.put(Army.YELLOW, PlayerId.PLAYER_TWO);
        }

        public Builder turnOrder(List<Army> v){turnOrder=v;return this;}
        public Builder turnOrder(Army... v){turnOrder=Arrays.asList(v);return this;}
        public Builder controller(Army army, PlayerId v){controllers.put(army, v);return this;}
        public Builder controllers(Map<Army, PlayerId> v){controllers.putAll(v);return this;}

        public GameConfig build() {
            checkTurnOrder(turnOrder);
            for(Army army : Army.VALUES) {
                if(controllers.get(army) == null) {
                    throw new IllegalArgumentException("No controller for " + army);
                }
            }
            return new GameConfig(this);
        }
    }
}
