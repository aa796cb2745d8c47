package io.seventytwo.blocks.config;

import java.nio.file.Path;
import org.jetbrains.annotations.Nullable;

/** Locations of the settings file and the default data directory. */
public final class ConfigPaths {
    public static final String CONFIG_DIR_PROPERTY = "blocks.config.dir";
    static final String APP_DIR_NAME = "seventytwo-blocks";
    static final String SETTINGS_FILE_NAME = "blocktimer.properties";

    private ConfigPaths() {}

    /**
     * {@code -Dblocks.config.dir} if set, else {@code $XDG_CONFIG_HOME/seventytwo-blocks}, else
     * {@code ~/.config/seventytwo-blocks}.
     */
    public static Path globalConfigDir() {
        return resolveConfigDir(
                System.getProperty(CONFIG_DIR_PROPERTY),
                System.getenv("XDG_CONFIG_HOME"),
                System.getProperty("user.home"));
    }

    static Path resolveConfigDir(@Nullable String override, @Nullable String xdgConfigHome, String userHome) {
        if (override != null && !override.isBlank()) {
            return Path.of(override.trim());
        }
        if (xdgConfigHome != null && !xdgConfigHome.isBlank()) {
            return Path.of(xdgConfigHome.trim()).resolve(APP_DIR_NAME);
        }
        return Path.of(userHome).resolve(".config").resolve(APP_DIR_NAME);
    }

    public static Path settingsFile() {
        return globalConfigDir().resolve(SETTINGS_FILE_NAME);
    }

    public static Path defaultDataDir() {
        return globalConfigDir().resolve("data");
    }
}
