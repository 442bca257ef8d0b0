package fr.lapetina.primaryserver.domain.generator;

import fr.lapetina.primaryserver.domain.model.Particle;
import fr.lapetina.primaryserver.domain.model.RunConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Particle gun: a fixed number of particles of one species with momentum
 * magnitude uniform in {@code [pMin, pMax]} and isotropic direction.
 *
 * Options: {@code multiplicity} (default 100), {@code pdg} (default 211),
 * {@code pMin} and {@code pMax} in GeV (defaults 0.1 and 10).
 */
public final class BoxGenerator extends AbstractGenerator {

    public static final String NAME = "boxgen";

    private static final Map<Integer, Double> MASSES = Map.of(
            22, 0.0,
            11, 0.000510999,
            13, 0.105658,
            211, 0.139570,
            321, 0.493677,
            2212, 0.938272,
            2112, 0.939565
    );

    private int multiplicity;
    private int pdg;
    private double pMin;
    private double pMax;
    private double mass;

    public BoxGenerator(RunConfig config) {
        super(NAME, config);
    }

    @Override
    protected void doInit() {
        multiplicity = intOption("multiplicity", 100);
        pdg = intOption("pdg", 211);
        pMin = doubleOption("pMin", 0.1);
        pMax = doubleOption("pMax", 10.0);
        if (multiplicity < 0) {
            throw new GenerationException("Multiplicity must not be negative: " + multiplicity);
        }
        if (pMin < 0 || pMax < pMin) {
            throw new GenerationException("Invalid momentum range [" + pMin + ", " + pMax + "]");
        }
        mass = MASSES.getOrDefault(Math.abs(pdg), 0.0);
    }

    @Override
    public List<Particle> generateParticles(Random random) {
        List<Particle> particles = new ArrayList<>(multiplicity);
        for (int i = 0; i < multiplicity; i++) {
            double p = pMin + (pMax - pMin) * random.nextDouble();
            double cosTheta = 2 * random.nextDouble() - 1;
            double sinTheta = Math.sqrt(1 - cosTheta * cosTheta);
            double phi = 2 * Math.PI * random.nextDouble();
            double px = p * sinTheta * Math.cos(phi);
            double py = p * sinTheta * Math.sin(phi);
            double pz = p * cosTheta;
            double energy = Math.sqrt(p * p + mass * mass);
            particles.add(Particle.atOrigin(pdg, px, py, pz, energy));
        }
        return particles;
    }

    @Override
    public Map<String, String> headerInfo() {
        Map<String, String> info = super.headerInfo();
        info.put("pdg", Integer.toString(pdg));
        info.put("multiplicity", Integer.toString(multiplicity));
        return info;
    }
}
