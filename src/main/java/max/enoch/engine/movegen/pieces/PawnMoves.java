package max.enoch.engine.movegen.pieces;

// Pawns move and capture on disjoint geometries, so both masks are kept apart
public record PawnMoves(long quietBB, long attackBB) {
    public long allBB() {
        return quietBB | attackBB;
    }
}
