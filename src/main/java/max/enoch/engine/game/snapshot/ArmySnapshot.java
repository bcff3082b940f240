package max.enoch.engine.game.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import max.enoch.engine.common.Army;
import max.enoch.engine.common.PieceKind;
import max.enoch.engine.common.PlayerId;

import java.util.Arrays;

/**
 * Authoritative per-army fields. {@code pieces} holds one bitboard per {@link PieceKind}, in declaration order.
 */
public record ArmySnapshot(Army army, long[] pieces, int throneSquare, int secondThroneSquare,
                           PlayerId controller, boolean frozen, boolean stalemated, long promotionZone) {

    @JsonCreator
    public ArmySnapshot(@JsonProperty("army") Army army,
                        @JsonProperty("pieces") long[] pieces,
                        @JsonProperty("throneSquare") int throneSquare,
                        @JsonProperty("secondThroneSquare") int secondThroneSquare,
                        @JsonProperty("controller") PlayerId controller,
                        @JsonProperty("frozen") boolean frozen,
                        @JsonProperty("stalemated") boolean stalemated,
                        @JsonProperty("promotionZone") long promotionZone) {
        if(army == null || controller == null) {
            throw new IllegalArgumentException("Army snapshot needs an army and a controller");
        }
        if(pieces == null || pieces.length != PieceKind.COUNT) {
            throw new IllegalArgumentException(army + ": expected " + PieceKind.COUNT + " piece bitboards");
        }
        this.army = army;
        this.pieces = pieces.clone();
        this.throneSquare = throneSquare;
        this.secondThroneSquare = secondThroneSquare;
        this.controller = controller;
        this.frozen = frozen;
        this.stalemated = stalemated;
        this.promotionZone = promotionZone;
    }

    @Override
    public long[] pieces() {
        return pieces.clone();
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof ArmySnapshot other)) return false;
        return army == other.army && Arrays.equals(pieces, other.pieces)
                && throneSquare == other.throneSquare && secondThroneSquare == other.secondThroneSquare
                && controller == other.controller && frozen == other.frozen
                && stalemated == other.stalemated && promotionZone == other.promotionZone;
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(pieces) + army.hashCode();
    }
}
