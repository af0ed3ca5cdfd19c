package ai.keynav.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resolves the global configuration directory.
 *
 * <p>Windows: %APPDATA%/Keynav (fallback ~/AppData/Roaming/Keynav); macOS: ~/Library/Application Support/Keynav;
 * Linux: $XDG_CONFIG_HOME/Keynav (fallback ~/.config/Keynav).
 */
public final class KeynavConfigPaths {
    private static final Logger logger = LogManager.getLogger(KeynavConfigPaths.class);

    static final String APP_DIR = "Keynav";

    /** System property that, when set, replaces the platform directory. */
    public static final String CONFIG_DIR_PROPERTY = "keynav.config.dir";

    private KeynavConfigPaths() {}

    public static Path getGlobalConfigDir() {
        return getGlobalConfigDir(Optional.ofNullable(System.getProperty(CONFIG_DIR_PROPERTY)));
    }

    static Path getGlobalConfigDir(Optional<String> configDirOverride) {
        return configDirOverride
                .filter(s -> !s.isBlank())
                .flatMap(override -> {
                    try {
                        return Optional.of(Path.of(override));
                    } catch (Exception e) {
                        logger.warn("Invalid override for config dir='{}': {}", override, e.getMessage());
                        return Optional.empty();
                    }
                })
                .orElseGet(KeynavConfigPaths::platformConfigDir);
    }

    private static Path platformConfigDir() {
        var os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        var home = System.getProperty("user.home");
        if (os.contains("win")) {
            var appData = System.getenv("APPDATA");
            Path base = (appData != null && !appData.isBlank())
                    ? Path.of(appData)
                    : Path.of(home, "AppData", "Roaming");
            return base.resolve(APP_DIR);
        }
        if (os.contains("mac")) {
            return Path.of(home, "Library", "Application Support", APP_DIR);
        }
        var xdg = System.getenv("XDG_CONFIG_HOME");
        Path base = (xdg != null && !xdg.isBlank()) ? Path.of(xdg) : Path.of(home, ".config");
        return base.resolve(APP_DIR);
    }
}
