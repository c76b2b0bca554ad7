package ai.twinscript;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Creates the watch service for watch mode.
 *
 * <p>The implementation comes from the system property {@code twinscript.watchservice.impl} when set, otherwise from
 * {@link TranspilerConfig#watchImplementation()}: {@code native}, {@code polling}, or {@code auto} (native, falling
 * back to polling if the native watcher cannot be created).
 */
public class WatchServiceFactory {
    private static final Logger logger = LogManager.getLogger(WatchServiceFactory.class);

    static final String WATCH_SERVICE_IMPL_PROPERTY = "twinscript.watchservice.impl";

    public static IWatchService create(Path root, TranspilerConfig config, List<IWatchService.Listener> listeners) {
        return createInternal(
                root,
                config,
                listeners,
                getImplementationPreference(System.getProperty(WATCH_SERVICE_IMPL_PROPERTY), config));
    }

    /** Package-private for testing. */
    static String getImplementationPreference(@Nullable String systemProperty, TranspilerConfig config) {
        var preference = systemProperty != null && !systemProperty.isBlank()
                ? systemProperty
                : config.watchImplementation();
        return preference.strip().toLowerCase(Locale.ROOT);
    }

    /** Package-private for testing. */
    static IWatchService createInternal(
            Path root, TranspilerConfig config, List<IWatchService.Listener> listeners, String implementation) {
        switch (implementation) {
            case "polling" -> {
                logger.info("Using polling watch service (forced by configuration)");
                return polling(root, config, listeners);
            }
            case "native" -> {
                logger.info("Using native watch service (forced by configuration)");
                return createNativeWithFallback(root, config, listeners);
            }
            case "auto" -> {
                return createNativeWithFallback(root, config, listeners);
            }
            default -> {
                logger.warn("Unknown watch implementation '{}', using auto", implementation);
                return createNativeWithFallback(root, config, listeners);
            }
        }
    }

    private static IWatchService createNativeWithFallback(
            Path root, TranspilerConfig config, List<IWatchService.Listener> listeners) {
        try {
            return new NativeSourceWatchService(root, config.excludedDirectories(), config.debounceMillis(), listeners);
        } catch (Exception e) {
            logger.error("Failed to create native watch service, falling back to polling", e);
            return polling(root, config, listeners);
        }
    }

    private static IWatchService polling(Path root, TranspilerConfig config, List<IWatchService.Listener> listeners) {
        return new PollingSourceWatchService(root, config.excludedDirectories(), config.debounceMillis(), listeners);
    }
}
