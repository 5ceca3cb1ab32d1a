package com.rivalapex.adexport.manager.filesystem;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalFileSystemManagerTest {

    private LocalFileSystemManager manager;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        manager = new LocalFileSystemManager();
    }

    @Test
    void ensureDirectory_createsNestedDirectories() throws IOException {
        Path dir = tempDir.resolve("a").resolve("b");

        manager.ensureDirectory(dir);

        assertThat(Files.isDirectory(dir)).isTrue();
    }

    @Test
    void deleteQuietly_returnsFalseForMissingFileAndNull() {
        assertThat(manager.deleteQuietly(tempDir.resolve("missing.csv"))).isFalse();
        assertThat(manager.deleteQuietly(null)).isFalse();
    }

    @Test
    void deleteQuietly_removesExistingFile() throws IOException {
        Path file = Files.write(tempDir.resolve("x.csv"), "a".getBytes());

        assertThat(manager.deleteQuietly(file)).isTrue();
        assertThat(Files.exists(file)).isFalse();
    }

    @Test
    void scanFiles_matchesGlobInDirectoryOnly() throws IOException {
        Files.write(tempDir.resolve("impressions_pub_1.csv.tmp"), "a".getBytes());
        Files.write(tempDir.resolve("impressions_pub_1.csv"), "a".getBytes());
        Files.createDirectories(tempDir.resolve("sub"));
        Files.write(tempDir.resolve("sub").resolve("nested.tmp"), "a".getBytes());

        List<Path> tmpFiles = manager.scanFiles(tempDir, "*.tmp");

        assertThat(tmpFiles).extracting(p -> p.getFileName().toString())
            .containsExactly("impressions_pub_1.csv.tmp");
    }

    @Test
    void scanFiles_missingDirectoryReturnsEmpty() throws IOException {
        assertThat(manager.scanFiles(tempDir.resolve("none"), "*")).isEmpty();
    }
}
