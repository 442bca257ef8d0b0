package fr.lapetina.primaryserver.domain.model;

/**
 * Control input received while the server idles as a service.
 * Either a stop command or the parameters of a new generation cycle;
 * null fields keep the current value.
 */
public record ReconfigRequest(
        boolean stop,
        String generator,
        String trigger,
        Long startSeed,
        Integer nEvents,
        Integer chunkSize,
        String extKinFile,
        String embedIntoFile,
        String configFile
) {

    public static ReconfigRequest stopRequest() {
        return new ReconfigRequest(true, null, null, null, null, null, null, null, null);
    }

    /**
     * Applies the overrides of this request on top of the given base configuration.
     */
    public RunConfig applyTo(RunConfig base) {
        RunConfig.Builder builder = base.toBuilder();
        if (generator != null) {
            builder.generator(generator);
        }
        if (trigger != null) {
            builder.trigger(trigger);
        }
        if (startSeed != null) {
            builder.seed(startSeed);
        }
        if (nEvents != null) {
            builder.nEvents(nEvents);
        }
        if (chunkSize != null) {
            builder.chunkSize(chunkSize);
        }
        if (extKinFile != null) {
            builder.extKinFile(extKinFile);
        }
        if (embedIntoFile != null) {
            builder.embedIntoFile(embedIntoFile);
        }
        return builder.build();
    }
}
