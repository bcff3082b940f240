package max.enoch.engine.common;

// The controlling side an army answers to. Throne seizure can hand an army over to its ally's player.
public enum PlayerId {
    PLAYER_ONE, PLAYER_TWO
}
