package max.enoch.engine.game;

/**
 * Thrown when a submitted move is rejected. The game is left exactly as it was before the call.
 */
public class IllegalMoveException extends RuntimeException {
    private final MoveError error;

    public IllegalMoveException(MoveError error, String message) {
        super(message);
        this.error = error;
    }

    public MoveError getError() {
        return error;
    }
}
