package max.enoch.engine.game.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

// JSON form of a GameSnapshot
public final class GameSnapshotCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GameSnapshotCodec() {}

    public static String toJson(GameSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize game snapshot", e);
        }
    }

    /**
     * @throws IllegalArgumentException if the text is not a valid snapshot
     */
    public static GameSnapshot fromJson(String json) {
        try {
            return MAPPER.readValue(json, GameSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed game snapshot: " + e.getOriginalMessage(), e);
        }
    }
}
