package max.enoch.engine.game;

import max.enoch.engine.common.Army;
import max.enoch.engine.common.Team;
import max.enoch.engine.game.board.Board;
import max.enoch.engine.utils.SquareUtils;

import java.util.Arrays;
import java.util.OptionalInt;

// Turn pointer plus per-army flags. Frozen flags and king squares mirror the board and are rebuilt by syncWithBoard
public final class GameState {
    private int currentTurnIndex = 0;
    private final boolean[] frozen = new boolean[Army.COUNT];
    private final int[] kingSquares = new int[Army.COUNT];
    private final boolean[] stalemated = new boolean[Army.COUNT];

    public GameState() {
        Arrays.fill(kingSquares, SquareUtils.NO_SQUARE);
    }

    public void syncWithBoard(Board board) {
        for(Army army : Army.VALUES) {
            frozen[army.ordinal()] = board.isFrozen(army);
            kingSquares[army.ordinal()] = board.kingSquare(army);
        }
    }

    public int currentTurnIndex() {
        return currentTurnIndex;
    }

    public void setCurrentTurnIndex(int currentTurnIndex) {
        if(currentTurnIndex < 0 || currentTurnIndex >= Army.COUNT) {
            throw new IllegalArgumentException("Turn index out of range: " + currentTurnIndex);
        }
        this.currentTurnIndex = currentTurnIndex;
    }

    public void advanceTurn() {
        currentTurnIndex = (currentTurnIndex + 1) % Army.COUNT;
    }

    public boolean isFrozen(Army army) {
        return frozen[army.ordinal()];
    }

    public void setFrozen(Army army, boolean isFrozen) {
        frozen[army.ordinal()] = isFrozen;
    }

    public OptionalInt kingSquare(Army army) {
        int square = kingSquares[army.ordinal()];
        return square == SquareUtils.NO_SQUARE ? OptionalInt.empty() : OptionalInt.of(square);
    }

    public void setKingSquare(Army army, int square) {
        kingSquares[army.ordinal()] = square;
    }

    public void clearKingSquare(Army army) {
        kingSquares[army.ordinal()] = SquareUtils.NO_SQUARE;
    }

    public boolean isStalemated(Army army) {
        return stalemated[army.ordinal()];
    }

    public void setStalemated(Army army, boolean isStalemated) {
        stalemated[army.ordinal()] = isStalemated;
    }

    public int kingsAlive(Team team) {
        int kings = 0;
        for(Army army : team.armies()) {
            if(kingSquares[army.ordinal()] != SquareUtils.NO_SQUARE) {
                kings++;
            }
        }
        return kings;
    }
}
