package com.specscout.common.safety;

import com.specscout.common.exception.SafetyViolationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects spec files modified while an analysis run was in progress.
 *
 * <p>Take a {@link #snapshot} before analysis and call {@link #verifyUnchanged()} afterwards.
 * Files that do not exist at snapshot time are not monitored.
 */
public final class SpecFileMutationGuard {

    private record FileState(long size, String sha256) {}

    private final Map<Path, FileState> monitored;

    private SpecFileMutationGuard(Map<Path, FileState> monitored) {
        this.monitored = monitored;
    }

    public static SpecFileMutationGuard snapshot(Collection<Path> specFiles) {
        Map<Path, FileState> states = new LinkedHashMap<>();
        for (Path path : specFiles) {
            if (Files.isRegularFile(path)) {
                states.put(path, stateOf(path));
            }
        }
        return new SpecFileMutationGuard(states);
    }

    public int monitoredCount() {
        return monitored.size();
    }

    public List<String> modifiedFiles() {
        List<String> modified = new ArrayList<>();
        monitored.forEach((path, original) -> {
            if (!Files.isRegularFile(path) || !original.equals(stateOf(path))) {
                modified.add(path.toString());
            }
        });
        return modified;
    }

    /** @throws SafetyViolationException when any monitored file changed or disappeared */
    public void verifyUnchanged() {
        List<String> modified = modifiedFiles();
        if (!modified.isEmpty()) {
            throw new SafetyViolationException(modified);
        }
    }

    private static FileState stateOf(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] buffer = new byte[8192];
            long size = 0;
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
                size += read;
            }
            return new FileState(size, HexFormat.of().formatHex(digest.digest()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read spec file " + path, e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
