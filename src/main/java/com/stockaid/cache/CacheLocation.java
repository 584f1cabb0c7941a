package com.stockaid.cache;

import lombok.EqualsAndHashCode;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Where cache files for a provider or API live: either a usable directory or disabled.
 * Decided once at registration and never re-checked.
 */
@EqualsAndHashCode
public final class CacheLocation {

    private static final CacheLocation DISABLED = new CacheLocation(null);

    private final Path directory;

    private CacheLocation(Path directory) {
        this.directory = directory;
    }

    public static CacheLocation disabled() {
        return DISABLED;
    }

    public static CacheLocation enabled(Path directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        return new CacheLocation(directory);
    }

    public boolean isEnabled() {
        return directory != null;
    }

    public Optional<Path> directory() {
        return Optional.ofNullable(directory);
    }

    @Override
    public String toString() {
        return directory == null ? "CacheLocation[disabled]" : "CacheLocation[" + directory + "]";
    }
}
