package max.enoch.engine.game;

import max.enoch.engine.common.Army;
import max.enoch.engine.common.PlayerId;

import java.util.OptionalInt;

public record ArmyStatus(Army army, boolean frozen, boolean stalemated, boolean inCheck,
                         PlayerId controller, OptionalInt kingSquare) {
    public boolean canMove() {
        return !frozen && !stalemated;
    }
}
