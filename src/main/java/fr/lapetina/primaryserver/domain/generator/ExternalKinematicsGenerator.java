package fr.lapetina.primaryserver.domain.generator;

import fr.lapetina.primaryserver.domain.model.Particle;
import fr.lapetina.primaryserver.domain.model.RunConfig;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Replays events read sequentially from a kinematics file.
 *
 * Never cached by the coordinator: the file behind it may change between
 * generation cycles, and opening it again is cheap.
 */
public abstract class ExternalKinematicsGenerator extends AbstractGenerator {

    private BufferedReader reader;
    private Path source;
    private int eventsRead;

    protected ExternalKinematicsGenerator(String name, RunConfig config) {
        super(name, config);
    }

    @Override
    protected void doInit() {
        if (config.extKinFile() == null || config.extKinFile().isBlank()) {
            throw new GenerationException("Generator " + getName() + " requires an external kinematics file");
        }
        source = Path.of(config.extKinFile());
        try {
            reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new GenerationException("Cannot open external kinematics file: " + source, e);
        }
    }

    @Override
    public List<Particle> generateParticles(Random random) {
        try {
            Optional<List<Particle>> event = readEvent(reader);
            if (event.isEmpty()) {
                throw new GenerationException("External kinematics file exhausted after "
                        + eventsRead + " events: " + source);
            }
            eventsRead++;
            return event.get();
        } catch (IOException | UncheckedIOException e) {
            throw new GenerationException("Failed to read event " + (eventsRead + 1) + " from " + source, e);
        }
    }

    /**
     * Reads the next event, or returns empty at end of input.
     */
    protected abstract Optional<List<Particle>> readEvent(BufferedReader reader) throws IOException;

    @Override
    public Map<String, String> headerInfo() {
        Map<String, String> info = super.headerInfo();
        info.put("source", String.valueOf(source));
        info.put("sourceEvent", Integer.toString(eventsRead));
        return info;
    }

    @Override
    public void close() {
        if (reader != null) {
            try {
                reader.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to close " + source, e);
            }
        }
    }
}
