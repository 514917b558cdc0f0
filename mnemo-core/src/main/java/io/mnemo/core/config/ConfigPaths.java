package io.mnemo.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path home() {
        return Path.of(System.getProperty("user.home"), ".mnemo");
    }

    public static Path defaultConfigPath() {
        return home().resolve("config.json");
    }

    public static Path resolve(String rawPath, Path baseDirectory) {
        if (rawPath == null || rawPath.isBlank()) {
            return baseDirectory;
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        Path path = Path.of(rawPath);
        return path.isAbsolute() ? path : baseDirectory.resolve(path);
    }
}
