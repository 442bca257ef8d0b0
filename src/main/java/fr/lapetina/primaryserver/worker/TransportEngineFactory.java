package fr.lapetina.primaryserver.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry of transport engines, looked up by the run configuration's {@code mcEngine}.
 */
public final class TransportEngineFactory {

    private static final Logger log = LoggerFactory.getLogger(TransportEngineFactory.class);

    private static final Map<String, Supplier<TransportEngine>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register(AccountingTransportEngine.NAME, AccountingTransportEngine::new);
    }

    private TransportEngineFactory() {
        // Utility class
    }

    public static void register(String name, Supplier<TransportEngine> supplier) {
        REGISTRY.put(name.toLowerCase(), supplier);
    }

    public static Optional<TransportEngine> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<TransportEngine> supplier = REGISTRY.get(name.toLowerCase());
        return supplier == null ? Optional.empty() : Optional.of(supplier.get());
    }

    /**
     * Creates the named engine, falling back to the accounting engine.
     */
    public static TransportEngine createOrDefault(String name) {
        return create(name).orElseGet(() -> {
            log.warn("Unknown transport engine '{}', using {}", name, AccountingTransportEngine.NAME);
            return new AccountingTransportEngine();
        });
    }

    public static Iterable<String> getRegisteredNames() {
        return REGISTRY.keySet();
    }
}
