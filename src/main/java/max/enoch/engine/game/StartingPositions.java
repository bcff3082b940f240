package max.enoch.engine.game;

import max.enoch.engine.common.Army;
import max.enoch.engine.common.PieceKind;
import max.enoch.engine.common.PlayerId;
import max.enoch.engine.game.board.ArmyState;
import max.enoch.engine.game.board.Board;
import max.enoch.engine.utils.SquareUtils;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class StartingPositions {

    public static final StartingPosition TABLET_OF_FIRE = builder("Tablet of Fire",
            "Each army lines up on its own edge, kings next to their thrones")
            .pieces(Army.BLUE, "Rc1 Bd1 Ke1 Qf1 Ng1 Pc2 Pd2 Pe2 Pf2 Pg2")
            .pieces(Army.RED, "Nb8 Qc8 Bd8 Ke8 Rf8 Pb7 Pc7 Pd7 Pe7 Pf7")
            .pieces(Army.BLACK, "Na2 Qa3 Ba4 Ka5 Ra6 Pb2 Pb3 Pb4 Pb5 Pb6")
            .pieces(Army.YELLOW, "Rh3 Bh4 Kh5 Qh6 Nh7 Pg3 Pg4 Pg5 Pg6 Pg7")
            .build();

    private StartingPositions() {}

    /**
     * A builder pre-filled with the default turn order, controllers, thrones and promotion zones, and no pieces.
     */
    public static Builder builder(String name, String description) {
        return new Builder(name, description);
    }

    public static class Builder {
        private final String name;
        private final String description;
        private List<Army> turnOrder = GameConfig.DEFAULT_TURN_ORDER;
        private final Map<Army, PlayerId> controllers = new EnumMap<>(Army.class);
        private final Map<Army, List<Integer>> thrones = new EnumMap<>(Army.class);
        private final Map<Army, Long> promotionZones = new EnumMap<>(Army.class);
        private final List<StartingPosition.Placement> placements = new ArrayList<>();

        private Builder(String name, String description) {
            this.name = name;
            this.description = description;
            for(Army army : Army.VALUES) {
                ArmyState defaults = ArmyState.defaultFor(army);
                controllers.put(army, defaults.controller());
                thrones.put(army, List.of(defaults.throneSquare(), defaults.secondThroneSquare()));
                promotionZones.put(army, Board.defaultPromotionZone(army));
            }
        }

        public Builder turnOrder(Army... v){turnOrder=List.of(v);return this;}
        public Builder controller(Army army, PlayerId v){controllers.put(army, v);return this;}
        public Builder thrones(Army army, String first, String second){
            thrones.put(army, List.of(SquareUtils.fromNotation(first), SquareUtils.fromNotation(second)));
            return this;
        }
        public Builder promotionZone(Army army, long v){promotionZones.put(army, v);return this;}

        public Builder piece(Army army, PieceKind kind, String square) {
            placements.add(new StartingPosition.Placement(army, kind, SquareUtils.fromNotation(square)));
            return this;
        }

        // Space separated "Ke1" style tokens: piece letter then square
        public Builder pieces(Army army, String pieces) {
            for(String token : pieces.trim().split("\\s+")) {
                if(token.length() != 3) {
                    throw new IllegalArgumentException("Cannot parse piece placement " + token);
                }
                piece(army, PieceKind.fromLetter(token.charAt(0)), token.substring(1));
            }
            return this;
        }

        public StartingPosition build() {
            return new StartingPosition(name, description, turnOrder, controllers, thrones, promotionZones, placements);
        }
    }
}
