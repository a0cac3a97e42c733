package com.vaultsearch.vault;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Function;

public final class NotePaths {
    private NotePaths() {
    }

    public static String toPosix(String path) {
        return path.replace('\\', '/');
    }

    public static String normalize(String path) {
        String posix = toPosix(path.strip());
        while (posix.startsWith("./")) {
            posix = posix.substring(2);
        }
        return posix;
    }

    /**
     * Finds the entry whose path equals {@code wanted}, falling back to the
     * first entry where one path is a directory-aligned suffix of the other
     * (an absolute file-system path against a vault-relative one).
     */
    public static <T> Optional<T> find(Collection<T> entries, Function<T, String> pathOf, String wanted) {
        if (wanted == null || wanted.isBlank()) {
            return Optional.empty();
        }
        String target = normalize(wanted);
        for (T entry : entries) {
            if (pathOf.apply(entry).equals(target)) {
                return Optional.of(entry);
            }
        }
        for (T entry : entries) {
            String candidate = pathOf.apply(entry);
            if (target.endsWith("/" + candidate) || candidate.endsWith("/" + target)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }
}
