package fr.lapetina.primaryserver.domain.generator;

import fr.lapetina.primaryserver.domain.model.RunConfig;

import java.util.Locale;
import java.util.Map;

/**
 * Cache key of a generator instance: the name plus every configuration
 * value that changes what the generator produces.
 */
public record GeneratorKey(
        String name,
        String trigger,
        String embedIntoFile,
        Map<String, String> options
) {
    public GeneratorKey {
        name = name.toLowerCase(Locale.ROOT);
        options = options != null ? Map.copyOf(options) : Map.of();
    }

    public static GeneratorKey of(RunConfig config) {
        return new GeneratorKey(
                config.generator(),
                config.trigger(),
                config.embedIntoFile(),
                config.generatorOptions()
        );
    }
}
