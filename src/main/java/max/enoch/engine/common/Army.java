package max.enoch.engine.common;

// Ordinal is used as the array index everywhere (byArmyKind, occupancy, state flags)
public enum Army {
    BLUE, BLACK, RED, YELLOW;

    public static final Army[] VALUES = Army.values();
    public static final int COUNT = VALUES.length;

    public Team team() {
        return switch (this) {
            case BLUE, BLACK -> Team.AIR;
            case RED, YELLOW -> Team.EARTH;
        };
    }

    public boolean isAllyOf(Army other) {
        return this != other && team() == other.team();
    }

    public String displayName() {
        return switch (this) {
            case BLUE -> "Blue";
            case BLACK -> "Black";
            case RED -> "Red";
            case YELLOW -> "Yellow";
        };
    }
}
