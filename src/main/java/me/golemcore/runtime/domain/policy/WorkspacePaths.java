package me.golemcore.runtime.domain.policy;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolution of tool-supplied paths against the workspace root.
 */
@Slf4j
public final class WorkspacePaths {

    private WorkspacePaths() {
    }

    /**
     * Resolves a path lexically: relative paths against the root, then
     * normalized. Empty when the result is outside the root or the path is
     * malformed. Touches no files.
     */
    public static Optional<Path> resolveLogical(Path workspaceRoot, String rawPath) {
        if (workspaceRoot == null || rawPath == null || rawPath.isBlank()) {
            return Optional.empty();
        }
        try {
            Path root = workspaceRoot.toAbsolutePath().normalize();
            Path resolved = root.resolve(rawPath).normalize();
            if (!resolved.startsWith(root)) {
                return Optional.empty();
            }
            return Optional.of(resolved);
        } catch (InvalidPathException e) {
            log.debug("[Policy] Invalid path '{}': {}", rawPath, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Like {@link #resolveLogical(Path, String)}, and additionally follows
     * symlinks of existing paths so a link inside the workspace cannot point
     * outside of it. Used by filesystem tools right before I/O.
     */
    public static Optional<Path> resolveReal(Path workspaceRoot, String rawPath) {
        Optional<Path> logical = resolveLogical(workspaceRoot, rawPath);
        if (logical.isEmpty()) {
            return logical;
        }
        Path resolved = logical.get();
        try {
            Path existing = resolved;
            while (existing != null && !Files.exists(existing)) {
                existing = existing.getParent();
            }
            if (existing == null) {
                return Optional.empty();
            }
            Path realRoot = workspaceRoot.toAbsolutePath().normalize().toRealPath();
            Path realExisting = existing.toRealPath();
            if (!realExisting.startsWith(realRoot)) {
                log.warn("[Policy] Symlink escape blocked: {} -> {}", resolved, realExisting);
                return Optional.empty();
            }
            return Optional.of(resolved);
        } catch (IOException e) {
            log.debug("[Policy] Cannot resolve real path for '{}': {}", rawPath, e.getMessage());
            return Optional.empty();
        }
    }
}
