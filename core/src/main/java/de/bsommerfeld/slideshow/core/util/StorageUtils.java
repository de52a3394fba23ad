package de.bsommerfeld.slideshow.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves OS-specific application data directories following each platform's
 * native conventions. Paths are absolute but <strong>not</strong> created.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_DATA_HOME/{appName}} (fallback:
 * {@code ~/.local/share})</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "slideshow-machine";

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(System.getProperty("user.home"), "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData != null) {
                return Paths.get(appData, appName);
            }
            return Paths.get(System.getProperty("user.home"), "AppData", "Roaming", appName);
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        if (xdgData != null && !xdgData.isEmpty()) {
            return Paths.get(xdgData, appName);
        }
        return Paths.get(System.getProperty("user.home"), ".local", "share", appName);
    }

    /** {@code {appDataDir}/logs}. */
    public static Path getLogsDir(String appName) {
        return getAppDataDir(appName).resolve("logs");
    }

    /** Default SQLite file used when neither {@code --db} nor the config names one. */
    public static Path getDefaultDatabasePath() {
        return getAppDataDir(APP_NAME).resolve(APP_NAME + ".db");
    }

    /** Default location of {@code config.toml}. */
    public static Path getDefaultConfigPath() {
        return getAppDataDir(APP_NAME).resolve("config.toml");
    }
}
