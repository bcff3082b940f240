package max.enoch.engine.game.board;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.enoch.engine.common.Army;
import max.enoch.engine.common.Piece;
import max.enoch.engine.common.PieceKind;
import max.enoch.engine.common.PlayerId;
import max.enoch.engine.common.Team;
import max.enoch.engine.movegen.utils.BitBoardUtils;
import max.enoch.engine.utils.BitUtils;
import max.enoch.engine.utils.SquareUtils;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Bitboard representation of the four armies. {@link #byArmyKind} is the only authoritative piece data, every other
 * bitboard is derived from it by {@link #refreshOccupancy()}, which each single-piece mutator calls before returning.
 */
public class Board {
    // [army ordinal][piece kind ordinal]
    public final long[][] byArmyKind;

    public final long[] occupancyByArmy = new long[Army.COUNT];
    public final long[] occupancyByTeam = new long[Team.VALUES.length];
    public long allOccupancy = 0;
    public long free = ~0L;

    public final long[] promotionZones;
    private final ArmyState[] armyStates;

    public Board(ArmyState[] armyStates, long[] promotionZones) {
        if(armyStates == null || armyStates.length != Army.COUNT) {
            throw new IllegalArgumentException("Expected one army state per army");
        }
        if(promotionZones == null || promotionZones.length != Army.COUNT) {
            throw new IllegalArgumentException("Expected one promotion zone per army");
        }
        for(Army army : Army.VALUES) {
            if(armyStates[army.ordinal()] == null || armyStates[army.ordinal()].army() != army) {
                throw new IllegalArgumentException("Army state at index " + army.ordinal() + " must describe " + army);
            }
        }
        this.byArmyKind = new long[Army.COUNT][PieceKind.COUNT];
        this.armyStates = armyStates.clone();
        this.promotionZones = promotionZones.clone();
    }

    private Board(Board other) {
        this.byArmyKind = new long[Army.COUNT][];
        for(int i = 0; i < Army.COUNT; i++) {
            this.byArmyKind[i] = other.byArmyKind[i].clone();
        }
        System.arraycopy(other.occupancyByArmy, 0, this.occupancyByArmy, 0, Army.COUNT);
        System.arraycopy(other.occupancyByTeam, 0, this.occupancyByTeam, 0, occupancyByTeam.length);
        this.allOccupancy = other.allOccupancy;
        this.free = other.free;
        // ArmyState is immutable, a shallow copy is enough
        this.armyStates = other.armyStates.clone();
        this.promotionZones = other.promotionZones.clone();
    }

    /**
     * An empty board with the default thrones, controllers and promotion zones.
     */
    public static Board empty() {
        ArmyState[] states = new ArmyState[Army.COUNT];
        long[] zones = new long[Army.COUNT];
        for(Army army : Army.VALUES) {
            states[army.ordinal()] = ArmyState.defaultFor(army);
            zones[army.ordinal()] = defaultPromotionZone(army);
        }
        return new Board(states, zones);
    }

    // The edge facing each army's starting edge
    public static long defaultPromotionZone(Army army) {
        return switch (army) {
            case BLUE -> BitBoardUtils.RANK_8;
            case RED -> BitBoardUtils.RANK_1;
            case BLACK -> BitBoardUtils.FILE_H;
            case YELLOW -> BitBoardUtils.FILE_A;
        };
    }

    public Board copy() {
        return new Board(this);
    }

    public void refreshOccupancy() {
        occupancyByTeam[0] = 0;
        occupancyByTeam[1] = 0;
        for(Army army : Army.VALUES) {
            long armyBB = 0;
            for(long kindBB : byArmyKind[army.ordinal()]) {
                armyBB |= kindBB;
            }
            occupancyByArmy[army.ordinal()] = armyBB;
            occupancyByTeam[army.team().ordinal()] |= armyBB;
        }
        allOccupancy = occupancyByTeam[0] | occupancyByTeam[1];
        free = ~allOccupancy;
    }

    public long pieces(Army army, PieceKind kind) {
        return byArmyKind[army.ordinal()][kind.ordinal()];
    }

    // Same kind, every army but the given one
    public long foreignPieces(Army army, PieceKind kind) {
        long piecesBB = 0;
        for(Army other : Army.VALUES) {
            if(other != army) {
                piecesBB |= byArmyKind[other.ordinal()][kind.ordinal()];
            }
        }
        return piecesBB;
    }

    public Optional<Piece> pieceAt(int square) {
        SquareUtils.checkSquare(square);
        long squareBB = 1L << square;
        if((allOccupancy & squareBB) == 0) {
            return Optional.empty();
        }
        for(Army army : Army.VALUES) {
            if((occupancyByArmy[army.ordinal()] & squareBB) == 0) {
                continue;
            }
            for(PieceKind kind : PieceKind.VALUES) {
                if((byArmyKind[army.ordinal()][kind.ordinal()] & squareBB) != 0) {
                    return Optional.of(new Piece(army, kind));
                }
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty(int square) {
        return (allOccupancy & (1L << SquareUtils.checkSquare(square))) == 0;
    }

    public void placePiece(Army army, PieceKind kind, int square) {
        if(!isEmpty(square)) {
            throw new IllegalArgumentException("Square " + SquareUtils.toNotation(square) + " is already occupied");
        }
        byArmyKind[army.ordinal()][kind.ordinal()] |= 1L << square;
        refreshOccupancy();
    }

    public boolean removePiece(Army army, PieceKind kind, int square) {
        long squareBB = 1L << SquareUtils.checkSquare(square);
        if((byArmyKind[army.ordinal()][kind.ordinal()] & squareBB) == 0) {
            return false;
        }
        byArmyKind[army.ordinal()][kind.ordinal()] &= ~squareBB;
        refreshOccupancy();
        return true;
    }

    public void movePiece(Army army, PieceKind kind, int from, int to) {
        long fromBB = 1L << SquareUtils.checkSquare(from);
        long toBB = 1L << SquareUtils.checkSquare(to);
        if((byArmyKind[army.ordinal()][kind.ordinal()] & fromBB) == 0) {
            throw new IllegalArgumentException("No " + army.displayName() + " " + kind.displayName()
                    + " on " + SquareUtils.toNotation(from));
        }
        if(from != to && (allOccupancy & toBB) != 0) {
            throw new IllegalArgumentException("Square " + SquareUtils.toNotation(to) + " is already occupied");
        }
        byArmyKind[army.ordinal()][kind.ordinal()] ^= fromBB | toBB;
        refreshOccupancy();
    }

    /**
     * Removes whatever stands on the square.
     *
     * @return the removed piece, if any
     */
    public Optional<Piece> clearSquare(int square) {
        Optional<Piece> piece = pieceAt(square);
        piece.ifPresent(p -> removePiece(p.army(), p.kind(), square));
        return piece;
    }

    /**
     * Turns the first piece of the given kind (lowest square) into a pawn of the same army, in place.
     *
     * @return the affected square, or empty if the army has no such piece or the kind is already Pawn
     */
    public OptionalInt demotePieceToPawn(Army army, PieceKind kind) {
        long kindBB = byArmyKind[army.ordinal()][kind.ordinal()];
        if(kind == PieceKind.PAWN || kindBB == 0) {
            return OptionalInt.empty();
        }
        int square = BitUtils.bitScanForward(kindBB);
        long squareBB = 1L << square;
        byArmyKind[army.ordinal()][kind.ordinal()] &= ~squareBB;
        byArmyKind[army.ordinal()][PieceKind.PAWN.ordinal()] |= squareBB;
        refreshOccupancy();
        return OptionalInt.of(square);
    }

    /**
     * @return the square of the army's king, or {@link SquareUtils#NO_SQUARE} when it has none
     */
    public int kingSquare(Army army) {
        long kingBB = byArmyKind[army.ordinal()][PieceKind.KING.ordinal()];
        return kingBB == 0 ? SquareUtils.NO_SQUARE : BitUtils.bitScanForward(kingBB);
    }

    public Optional<Army> throneOwner(int square) {
        for(ArmyState armyState : armyStates) {
            if(armyState.isThrone(square)) {
                return Optional.of(armyState.army());
            }
        }
        return Optional.empty();
    }

    public Map<PieceKind, Integer> pieceCounts(Army army) {
        Map<PieceKind, Integer> counts = new EnumMap<>(PieceKind.class);
        for(PieceKind kind : PieceKind.VALUES) {
            counts.put(kind, BitUtils.bitCount(byArmyKind[army.ordinal()][kind.ordinal()]));
        }
        return counts;
    }

    public IntArrayList squaresOf(Army army) {
        IntArrayList squares = new IntArrayList();
        long armyBB = occupancyByArmy[army.ordinal()];
        while(armyBB != 0) {
            squares.add(BitUtils.bitScanForward(armyBB));
            armyBB &= armyBB - 1;
        }
        return squares;
    }

    public ArmyState armyState(Army army) {
        return armyStates[army.ordinal()];
    }

    public PlayerId controllerFor(Army army) {
        return armyStates[army.ordinal()].controller();
    }

    public void setController(Army army, PlayerId controller) {
        armyStates[army.ordinal()] = armyStates[army.ordinal()].withController(controller);
    }

    public boolean isFrozen(Army army) {
        return armyStates[army.ordinal()].frozen();
    }

    public void setFrozen(Army army, boolean frozen) {
        armyStates[army.ordinal()] = armyStates[army.ordinal()].withFrozen(frozen);
    }

    public boolean isInPromotionZone(Army army, int square) {
        return BitUtils.isSet(promotionZones[army.ordinal()], square);
    }

    /**
     * Eight rows, rank 8 first, e.g. {@code "8 . . . R K . . ."}.
     */
    public List<String> asciiRows() {
        List<String> rows = new ArrayList<>(8);
        for(int rank = 7; rank >= 0; rank--) {
            StringBuilder row = new StringBuilder().append(rank + 1);
            for(int file = 0; file < 8; file++) {
                int square = SquareUtils.square(file, rank);
                row.append(' ').append(pieceAt(square).map(Piece::symbol).orElse('.'));
            }
            rows.add(row.toString());
        }
        return rows;
    }

    @Override
    public String toString() {
        return String.join("\n", asciiRows());
    }
}
