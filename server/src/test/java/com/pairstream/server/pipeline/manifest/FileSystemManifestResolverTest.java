package com.pairstream.server.pipeline.manifest;

import com.pairstream.server.pipeline.sample.SampleDescriptor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class FileSystemManifestResolverTest {

    @TempDir
    Path tempDir;

    private void touch(Path p) throws IOException {
        Files.createDirectories(p.getParent());
        Files.write(p, new byte[]{0});
    }

    @Test
    public void testWalksRecursivelyFiltersAndSorts() throws Exception {
        touch(tempDir.resolve("b/002.png"));
        touch(tempDir.resolve("a/010.png"));
        touch(tempDir.resolve("a/001.png"));
        touch(tempDir.resolve("a/notes.txt"));
        touch(tempDir.resolve("c/frame.bmp"));

        List<SampleDescriptor> result = new FileSystemManifestResolver(tempDir, ".png").resolve();

        List<String> paths = new ArrayList<>();
        for (SampleDescriptor d : result) {
            paths.add(d.getSourcePath());
            Assertions.assertFalse(d.hasCropRegions());
        }
        Assertions.assertEquals(List.of(
                tempDir.resolve("a/001.png").toAbsolutePath().normalize().toString(),
                tempDir.resolve("a/010.png").toAbsolutePath().normalize().toString(),
                tempDir.resolve("b/002.png").toAbsolutePath().normalize().toString()), paths);
    }

    @Test
    public void testMultipleFiltersAndRoots() throws Exception {
        touch(tempDir.resolve("r1/x.png"));
        touch(tempDir.resolve("r2/y.bmp"));
        touch(tempDir.resolve("r2/z.txt"));

        FileSystemManifestResolver resolver = new FileSystemManifestResolver(
                List.of(tempDir.resolve("r2"), tempDir.resolve("r1")), List.of(".png", ".bmp"));
        List<SampleDescriptor> result = resolver.resolve();
        Assertions.assertEquals(2, result.size());
        Assertions.assertTrue(result.get(0).getSourcePath().endsWith("x.png"));
        Assertions.assertTrue(result.get(1).getSourcePath().endsWith("y.bmp"));
    }

    @Test
    public void testRepeatedResolutionIsStable() throws Exception {
        for (int i = 0; i < 5; i++) {
            touch(tempDir.resolve("img" + i + ".png"));
        }
        FileSystemManifestResolver resolver = new FileSystemManifestResolver(tempDir, ".png");
        Assertions.assertEquals(resolver.resolve(), resolver.resolve());
    }

    @Test
    public void testEmptyDirectoryYieldsEmptyManifest() throws Exception {
        Assertions.assertTrue(new FileSystemManifestResolver(tempDir, ".png").resolve().isEmpty());
    }

    @Test
    public void testMissingRootFails() {
        FileSystemManifestResolver resolver = new FileSystemManifestResolver(tempDir.resolve("nope"), ".png");
        Assertions.assertThrows(ManifestException.class, resolver::resolve);
    }
}
