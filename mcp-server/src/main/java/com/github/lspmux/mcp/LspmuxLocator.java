package com.github.lspmux.mcp;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Locates the lspmux binary: {@code $CARGO_HOME/bin/lspmux} first, then {@code PATH}.
 */
final class LspmuxLocator {
    private static final Logger LOG = Logger.getLogger(LspmuxLocator.class.getName());

    static final String BINARY = "lspmux";
    static final String HOME = "HOME";
    static final String CARGO_HOME = "CARGO_HOME";
    static final String PATH = "PATH";

    private LspmuxLocator() {}

    /**
     * @return the first existing candidate, else the cargo location so the spawn error names it
     */
    @NotNull
    static String locate(@NotNull Map<String, String> env) {
        String cargoBinary = cargoHome(env) + "/bin/" + BINARY;
        if (isExecutable(cargoBinary)) return cargoBinary;

        String fromPath = searchPath(env.get(PATH));
        if (fromPath != null) {
            LOG.fine(() -> "lspmux not in cargo home, using " + fromPath);
            return fromPath;
        }
        LOG.warning("lspmux not found in " + cargoBinary + " or on PATH");
        return cargoBinary;
    }

    static String cargoHome(Map<String, String> env) {
        String cargoHome = ServerConfig.value(env, CARGO_HOME);
        return cargoHome != null ? cargoHome : env.getOrDefault(HOME, "") + "/.cargo";
    }

    @Nullable
    static String searchPath(@Nullable String path) {
        if (path == null || path.isBlank()) return null;
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isEmpty()) continue;
            String candidate = dir + File.separator + BINARY;
            if (isExecutable(candidate)) return candidate;
        }
        return null;
    }

    private static boolean isExecutable(String candidate) {
        try {
            Path p = Path.of(candidate);
            return Files.isRegularFile(p) && Files.isExecutable(p);
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
