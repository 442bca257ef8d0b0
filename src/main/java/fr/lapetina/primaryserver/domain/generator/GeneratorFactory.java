package fr.lapetina.primaryserver.domain.generator;

import fr.lapetina.primaryserver.domain.model.RunConfig;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Registry of generator constructors, looked up by case-insensitive name.
 */
public final class GeneratorFactory {

    private static final Map<String, Function<RunConfig, Generator>> REGISTRY = new ConcurrentHashMap<>();

    private static final Set<String> UNCACHEABLE = Set.of(
            TextKinematicsGenerator.NAME.toLowerCase(Locale.ROOT),
            JsonKinematicsGenerator.NAME.toLowerCase(Locale.ROOT)
    );

    static {
        register(BoxGenerator.NAME, BoxGenerator::new);
        register(TextKinematicsGenerator.NAME, TextKinematicsGenerator::new);
        register(JsonKinematicsGenerator.NAME, JsonKinematicsGenerator::new);
    }

    private GeneratorFactory() {
        // Utility class
    }

    /**
     * Registers a generator.
     *
     * @param name        name used in run configurations
     * @param constructor builds an uninitialized instance for a configuration
     */
    public static void register(String name, Function<RunConfig, Generator> constructor) {
        REGISTRY.put(name.toLowerCase(Locale.ROOT), constructor);
    }

    /**
     * Creates an uninitialized generator for the configuration's generator name.
     *
     * @return the generator, or empty if the name is not registered
     */
    public static Optional<Generator> create(RunConfig config) {
        Function<RunConfig, Generator> constructor = REGISTRY.get(config.generator().toLowerCase(Locale.ROOT));
        if (constructor == null) {
            return Optional.empty();
        }
        return Optional.of(constructor.apply(config));
    }

    public static boolean isRegistered(String name) {
        return REGISTRY.containsKey(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Whether instances of this generator may be reused across generation cycles.
     */
    public static boolean isCacheable(String name) {
        return !UNCACHEABLE.contains(name.toLowerCase(Locale.ROOT));
    }

    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
