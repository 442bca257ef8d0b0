package fr.lapetina.primaryserver.domain.generator;

import fr.lapetina.primaryserver.domain.model.RunConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Base class handling embedding and option parsing.
 */
public abstract class AbstractGenerator implements Generator {

    private final String name;
    protected final RunConfig config;
    private String embeddingSource;
    private boolean initialized;

    protected AbstractGenerator(String name, RunConfig config) {
        this.name = name;
        this.config = config;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void embedInto(String source) {
        this.embeddingSource = source;
    }

    @Override
    public final void init() {
        if (initialized) {
            return;
        }
        if (embeddingSource != null && !Files.isReadable(Path.of(embeddingSource))) {
            throw new GenerationException("Cannot embed into unreadable source: " + embeddingSource);
        }
        doInit();
        initialized = true;
    }

    /**
     * Generator specific setup, run once.
     */
    protected abstract void doInit();

    @Override
    public Map<String, String> headerInfo() {
        Map<String, String> info = new HashMap<>();
        if (embeddingSource != null) {
            info.put("embeddedInto", embeddingSource);
        }
        return info;
    }

    protected int intOption(String key, int fallback) {
        String value = config.option(key, null);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new GenerationException("Invalid integer for generator option '" + key + "': " + value, e);
        }
    }

    protected double doubleOption(String key, double fallback) {
        String value = config.option(key, null);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new GenerationException("Invalid number for generator option '" + key + "': " + value, e);
        }
    }
}
