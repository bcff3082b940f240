package max.enoch.engine.game;

public enum MoveError {
    WRONG_TURN,
    ARMY_FROZEN,
    NO_PIECE_AT_SOURCE,
    FOREIGN_PIECE,
    ILLEGAL_DESTINATION,
    SELF_CAPTURE,
    INVALID_PROMOTION_TARGET,
    KING_MUST_MOVE,
    GAME_OVER
}
