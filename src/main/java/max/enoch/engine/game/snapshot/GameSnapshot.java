package max.enoch.engine.game.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import max.enoch.engine.common.Army;
import max.enoch.engine.common.PlayerId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Flat copy of the authoritative game fields. Occupancy aggregates and king squares are not part of it; they are
 * rebuilt after loading.
 * <p>
 * {@code controllers} are the configured ones, each army's current controller lives in its {@link ArmySnapshot}.
 */
public record GameSnapshot(int version, List<Army> turnOrder, Map<Army, PlayerId> controllers,
                           int currentTurnIndex, List<ArmySnapshot> armies) {
    public static final int CURRENT_VERSION = 1;

    @JsonCreator
    public GameSnapshot(@JsonProperty("version") int version,
                        @JsonProperty("turnOrder") List<Army> turnOrder,
                        @JsonProperty("controllers") Map<Army, PlayerId> controllers,
                        @JsonProperty("currentTurnIndex") int currentTurnIndex,
                        @JsonProperty("armies") List<ArmySnapshot> armies) {
        if(version != CURRENT_VERSION) {
            throw new IllegalArgumentException("Unsupported snapshot version " + version);
        }
        if(turnOrder == null || armies == null) {
            throw new IllegalArgumentException("Snapshot needs a turn order and armies");
        }
        if(controllers == null || !controllers.keySet().containsAll(List.of(Army.VALUES))) {
            throw new IllegalArgumentException("Snapshot needs a configured controller for every army");
        }
        this.version = version;
        this.turnOrder = List.copyOf(turnOrder);
        this.controllers = Collections.unmodifiableMap(new EnumMap<>(controllers));
        this.currentTurnIndex = currentTurnIndex;
        this.armies = List.copyOf(armies);
    }
}
