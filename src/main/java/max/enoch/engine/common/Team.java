package max.enoch.engine.common;

public enum Team {
    AIR, EARTH;

    public static final Team[] VALUES = Team.values();

    public Army[] armies() {
        return this == AIR
                ? new Army[]{Army.BLUE, Army.BLACK}
                : new Army[]{Army.RED, Army.YELLOW};
    }

    public Team opponent() {
        if(this == AIR) {
            return EARTH;
        } else {
            return AIR;
        }
    }

    public String displayName() {
        return this == AIR ? "Air" : "Earth";
    }
}
