package fr.lapetina.primaryserver.domain.generator;

import fr.lapetina.primaryserver.domain.model.Particle;
import fr.lapetina.primaryserver.domain.model.RunConfig;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads whitespace separated kinematics.
 *
 * <pre>
 * # event 1
 * 211  0.1 0.2 1.5 1.52
 * -211 0.3 0.1 2.0 2.03 0.0 0.0 0.5
 * # event 2
 * </pre>
 *
 * Every line starting with {@code #} opens a new, possibly empty, event.
 * Particle lines are {@code pdg px py pz e [vx vy vz]}.
 */
public final class TextKinematicsGenerator extends ExternalKinematicsGenerator {

    public static final String NAME = "extkin";

    private boolean headerConsumed;
    private int lineNumber;

    public TextKinematicsGenerator(RunConfig config) {
        super(NAME, config);
    }

    @Override
    protected Optional<List<Particle>> readEvent(BufferedReader reader) throws IOException {
        String line;
        if (!headerConsumed) {
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.startsWith("#")) {
                    break;
                }
                if (!line.isBlank()) {
                    throw new GenerationException("Particle outside of an event at line " + lineNumber);
                }
            }
            if (line == null) {
                return Optional.empty();
            }
        }

        List<Particle> particles = new ArrayList<>();
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.startsWith("#")) {
                headerConsumed = true;
                return Optional.of(particles);
            }
            if (!line.isBlank()) {
                particles.add(parseParticle(line));
            }
        }
        headerConsumed = false;
        return Optional.of(particles);
    }

    private Particle parseParticle(String line) {
        String[] fields = line.trim().split("\\s+");
        if (fields.length != 5 && fields.length != 8) {
            throw new GenerationException("Expected 5 or 8 fields at line " + lineNumber + ", got " + fields.length);
        }
        try {
            int pdg = Integer.parseInt(fields[0]);
            double px = Double.parseDouble(fields[1]);
            double py = Double.parseDouble(fields[2]);
            double pz = Double.parseDouble(fields[3]);
            double energy = Double.parseDouble(fields[4]);
            if (fields.length == 5) {
                return Particle.atOrigin(pdg, px, py, pz, energy);
            }
            return new Particle(pdg, px, py, pz, energy,
                    Double.parseDouble(fields[5]),
                    Double.parseDouble(fields[6]),
                    Double.parseDouble(fields[7]));
        } catch (NumberFormatException e) {
            throw new GenerationException("Malformed particle at line " + lineNumber + ": " + line, e);
        }
    }
}
