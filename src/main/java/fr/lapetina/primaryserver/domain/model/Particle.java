package fr.lapetina.primaryserver.domain.model;

/**
 * A primary particle as produced by a generator.
 * Momentum and energy in GeV, vertex in cm.
 */
public record Particle(
        int pdg,
        double px,
        double py,
        double pz,
        double energy,
        double vx,
        double vy,
        double vz
) {

    /**
     * Creates a particle produced at the origin.
     */
    public static Particle atOrigin(int pdg, double px, double py, double pz, double energy) {
        return new Particle(pdg, px, py, pz, energy, 0, 0, 0);
    }

    public double momentum() {
        return Math.sqrt(px * px + py * py + pz * pz);
    }
}
