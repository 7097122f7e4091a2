package com.e2eq.l10n.util;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.stream.Stream;

import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AtomicFilesTest {

    @TempDir
    Path dir;

    @Test
    void createsParentsAndWritesContent() throws IOException {
        Path target = dir.resolve("a/b/c.xml");

        AtomicFiles.writeString(target, "héllo\n");

        assertEquals("héllo\n", Files.readString(target, StandardCharsets.UTF_8));
    }

    @Test
    void replacesExistingFileAndLeavesNoTemporaryFiles() throws IOException {
        Path target = dir.resolve("c.xml");
        Files.writeString(target, "old");

        AtomicFiles.writeString(target, "new");

        assertEquals("new", Files.readString(target));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count(), "only the target file should remain");
        }
    }

    @Test
    void keepsPermissionsOfTheReplacedFile() throws IOException {
        Assumptions.assumeTrue(Files.getFileAttributeView(dir, PosixFileAttributeView.class) != null);
        Path target = dir.resolve("d.xml");
        Files.writeString(target, "old");
        Set<PosixFilePermission> groupWritable = PosixFilePermissions.fromString("rw-rw-r--");
        Files.setPosixFilePermissions(target, groupWritable);

        AtomicFiles.writeString(target, "new");

        assertEquals(groupWritable, Files.getPosixFilePermissions(target));
    }

    @Test
    void newFilesAreReadableByOthers() throws IOException {
        Assumptions.assumeTrue(Files.getFileAttributeView(dir, PosixFileAttributeView.class) != null);
        Path target = dir.resolve("e.xml");

        AtomicFiles.writeString(target, "new");

        assertEquals(AtomicFiles.NEW_FILE_PERMISSIONS, Files.getPosixFilePermissions(target));
    }
}
