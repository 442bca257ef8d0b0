package fr.lapetina.primaryserver.domain.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.primaryserver.domain.model.Particle;
import fr.lapetina.primaryserver.domain.model.RunConfig;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Reads JSON lines kinematics, one event per line:
 * {@code {"particles":[{"pdg":211,"px":0.1,"py":0.2,"pz":1.5,"energy":1.52}]}}.
 * Blank lines are skipped.
 */
public final class JsonKinematicsGenerator extends ExternalKinematicsGenerator {

    public static final String NAME = "extkinO2";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public JsonKinematicsGenerator(RunConfig config) {
        super(NAME, config);
    }

    record KinematicsEvent(List<Particle> particles) {
        KinematicsEvent {
            particles = particles != null ? List.copyOf(particles) : List.of();
        }
    }

    @Override
    protected Optional<List<Particle>> readEvent(BufferedReader reader) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            try {
                return Optional.of(objectMapper.readValue(line, KinematicsEvent.class).particles());
            } catch (JsonProcessingException e) {
                throw new GenerationException("Malformed kinematics event: " + e.getOriginalMessage(), e);
            }
        }
        return Optional.empty();
    }
}
