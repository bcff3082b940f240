package max.enoch.engine.game;

import max.enoch.engine.common.Army;
import max.enoch.engine.common.PieceKind;
import max.enoch.engine.common.PlayerId;
import max.enoch.engine.game.board.ArmyState;
import max.enoch.engine.game.board.Board;
import max.enoch.engine.utils.SquareUtils;

import java.util.List;
import java.util.Map;

/**
 * Declarative description of an initial array: turn order, controllers, thrones, promotion zones and pieces.
 * Only structural consistency is checked (permutation of the armies, on-board squares, no two pieces on a square).
 */
public record StartingPosition(String name, String description, List<Army> turnOrder,
                               Map<Army, PlayerId> controllers, Map<Army, List<Integer>> thrones,
                               Map<Army, Long> promotionZones, List<Placement> placements) {

    public record Placement(Army army, PieceKind kind, int square) {
        public Placement {
            if(army == null || kind == null) {
                throw new IllegalArgumentException("Placement needs an army and a kind");
            }
            SquareUtils.checkSquare(square);
        }
    }

    public StartingPosition {
        GameConfig.checkTurnOrder(turnOrder);
        turnOrder = List.copyOf(turnOrder);
        controllers = Map.copyOf(controllers);
        thrones = Map.copyOf(thrones);
        promotionZones = Map.copyOf(promotionZones);
        placements = List.copyOf(placements);
        for(Army army : Army.VALUES) {
            if(!controllers.containsKey(army) || !promotionZones.containsKey(army)) {
                throw new IllegalArgumentException(name + ": missing controller or promotion zone for " + army);
            }
            List<Integer> armyThrones = thrones.get(army);
            if(armyThrones == null || armyThrones.size() != 2) {
                throw new IllegalArgumentException(name + ": " + army + " needs exactly two throne squares");
            }
            armyThrones.forEach(SquareUtils::checkSquare);
        }
        long occupiedBB = 0;
        for(Placement placement : placements) {
            long squareBB = 1L << placement.square();
            if((occupiedBB & squareBB) != 0) {
                throw new IllegalArgumentException(name + ": two pieces on " + SquareUtils.toNotation(placement.square()));
            }
            occupiedBB |= squareBB;
        }
    }

    public Board toBoard() {
        ArmyState[] states = new ArmyState[Army.COUNT];
        long[] zones = new long[Army.COUNT];
        for(Army army : Army.VALUES) {
            List<Integer> armyThrones = thrones.get(army);
            states[army.ordinal()] = new ArmyState(army, armyThrones.get(0), armyThrones.get(1),
                    controllers.get(army), false);
            zones[army.ordinal()] = promotionZones.get(army);
        }
        Board board = new Board(states, zones);
        for(Placement placement : placements) {
            board.placePiece(placement.army(), placement.kind(), placement.square());
        }
        return board;
    }

    public GameConfig toConfig() {
        return new GameConfig.Builder()
                .turnOrder(turnOrder)
                .controllers(controllers)
                .build();
    }
}
