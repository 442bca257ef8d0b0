package fr.lapetina.primaryserver.domain.generator;

import fr.lapetina.primaryserver.domain.model.Particle;

import java.util.List;

/**
 * Event filter applied after generation.
 *
 * Expressions: empty or {@code none} accepts every event,
 * {@code min-primaries:N} and {@code max-primaries:N} filter on the
 * number of primaries.
 */
@FunctionalInterface
public interface Trigger {

    Trigger ACCEPT_ALL = particles -> true;

    boolean accept(List<Particle> particles);

    /**
     * Parses a trigger expression.
     *
     * @throws GenerationException if the expression is not understood
     */
    static Trigger parse(String expression) {
        if (expression == null || expression.isBlank() || expression.trim().equalsIgnoreCase("none")) {
            return ACCEPT_ALL;
        }
        String trimmed = expression.trim();
        int colon = trimmed.indexOf(':');
        if (colon < 0) {
            throw new GenerationException("Unknown trigger: " + expression);
        }
        String kind = trimmed.substring(0, colon).toLowerCase();
        int bound;
        try {
            bound = Integer.parseInt(trimmed.substring(colon + 1).trim());
        } catch (NumberFormatException e) {
            throw new GenerationException("Invalid trigger bound: " + expression, e);
        }
        return switch (kind) {
            case "min-primaries" -> particles -> particles.size() >= bound;
            case "max-primaries" -> particles -> particles.size() <= bound;
            default -> throw new GenerationException("Unknown trigger: " + expression);
        };
    }
}
