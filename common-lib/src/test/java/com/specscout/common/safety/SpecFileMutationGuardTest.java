package com.specscout.common.safety;

import com.specscout.common.exception.SafetyViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpecFileMutationGuardTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("unchanged files pass verification")
    void unchanged() throws Exception {
        Path spec = Files.writeString(root.resolve("user_spec.rb"), "it { }\n");
        SpecFileMutationGuard guard = SpecFileMutationGuard.snapshot(List.of(spec));

        assertEquals(1, guard.monitoredCount());
        assertDoesNotThrow(guard::verifyUnchanged);
    }

    @Test
    @DisplayName("modified file raises SafetyViolationException naming it")
    void modified() throws Exception {
        Path spec = Files.writeString(root.resolve("user_spec.rb"), "it { }\n");
        SpecFileMutationGuard guard = SpecFileMutationGuard.snapshot(List.of(spec));
        Files.writeString(spec, "it { build_stubbed(:user) }\n");

        SafetyViolationException e = assertThrows(SafetyViolationException.class, guard::verifyUnchanged);
        assertEquals(List.of(spec.toString()), e.getModifiedFiles());
    }

    @Test
    @DisplayName("deleted file counts as modified")
    void deleted() throws Exception {
        Path spec = Files.writeString(root.resolve("user_spec.rb"), "it { }\n");
        SpecFileMutationGuard guard = SpecFileMutationGuard.snapshot(List.of(spec));
        Files.delete(spec);

        assertEquals(List.of(spec.toString()), guard.modifiedFiles());
    }

    @Test
    @DisplayName("missing files are not monitored")
    void missingIgnored() {
        SpecFileMutationGuard guard = SpecFileMutationGuard.snapshot(List.of(root.resolve("absent_spec.rb")));
        assertEquals(0, guard.monitoredCount());
        assertDoesNotThrow(guard::verifyUnchanged);
    }
}
