package max.enoch.engine.game.board;

import max.enoch.engine.common.Army;
import max.enoch.engine.common.PlayerId;
import max.enoch.engine.utils.SquareUtils;

/**
 * Per-army metadata carried by the board: the two throne squares, the player currently controlling the army and
 * whether the army is frozen (its king was captured).
 */
public record ArmyState(Army army, int throneSquare, int secondThroneSquare, PlayerId controller, boolean frozen) {

    public ArmyState {
        if(army == null || controller == null) {
            throw new IllegalArgumentException("Army and controller are mandatory");
        }
        SquareUtils.checkSquare(throneSquare);
        SquareUtils.checkSquare(secondThroneSquare);
    }

    public static ArmyState defaultFor(Army army) {
        return switch (army) {
            case BLUE -> new ArmyState(army, SquareUtils.fromNotation("d1"), SquareUtils.fromNotation("e1"), PlayerId.PLAYER_ONE, false);
            case BLACK -> new ArmyState(army, SquareUtils.fromNotation("a4"), SquareUtils.fromNotation("a5"), PlayerId.PLAYER_ONE, false);
            case RED -> new ArmyState(army, SquareUtils.fromNotation("d8"), SquareUtils.fromNotation("e8"), PlayerId.PLAYER_TWO, false);
            case YELLOW -> new ArmyState(army, SquareUtils.fromNotation("h4"), SquareUtils.fromNotation("h5"), PlayerId.PLAYER_TWO, false);
        };
    }

    public boolean isThrone(int square) {
        return throneSquare == square || secondThroneSquare == square;
    }

    public ArmyState withController(PlayerId newController) {
        return new ArmyState(army, throneSquare, secondThroneSquare, newController, frozen);
    }

    public ArmyState withFrozen(boolean newFrozen) {
        return new ArmyState(army, throneSquare, secondThroneSquare, controller, newFrozen);
    }
}
