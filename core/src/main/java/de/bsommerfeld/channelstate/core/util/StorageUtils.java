package de.bsommerfeld.channelstate.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves the per-user data directory in which the connection database is
 * kept. Paths are absolute but the directories are <strong>not</strong>
 * created here.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}}, falling back to
 * {@code ~/AppData/Roaming}</li>
 * <li><strong>Linux and others</strong>: {@code $XDG_DATA_HOME/{appName}},
 * falling back to {@code ~/.local/share}</li>
 * </ul>
 */
public final class StorageUtils {

    private StorageUtils() {
    }

    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        String home = System.getProperty("user.home");

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(home, "Library", "Application Support", appName).toAbsolutePath();
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            Path base = isBlank(appData) ? Paths.get(home, "AppData", "Roaming") : Paths.get(appData);
            return base.resolve(appName).toAbsolutePath();
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        Path base = isBlank(xdgData) ? Paths.get(home, ".local", "share") : Paths.get(xdgData);
        return base.resolve(appName).toAbsolutePath();
    }

    /**
     * Returns {@code {appDataDir}/{fileName}}, the default location of a
     * database file owned by the application.
     */
    public static Path getDataFile(String appName, String fileName) {
        return getAppDataDir(appName).resolve(fileName);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
