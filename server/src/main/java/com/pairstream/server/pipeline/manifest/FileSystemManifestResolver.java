package com.pairstream.server.pipeline.manifest;

import com.pairstream.server.pipeline.sample.SampleDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Walks one or more dataset roots and keeps every file whose name contains one of the type
 * filters (e.g. ".png"). Every file yields a split-derivation descriptor.
 */
public class FileSystemManifestResolver implements ManifestResolver {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemManifestResolver.class);

    private final List<Path> roots;
    private final List<String> typeFilters;

    public FileSystemManifestResolver(List<Path> roots, List<String> typeFilters) {
        if (roots == null || roots.isEmpty()) {
            throw new IllegalArgumentException("At least one dataset root is required");
        }
        this.roots = List.copyOf(roots);
        this.typeFilters = typeFilters != null ? List.copyOf(typeFilters) : Collections.emptyList();
    }

    public FileSystemManifestResolver(Path root, String... typeFilters) {
        this(List.of(root), List.of(typeFilters));
    }

    @Override
    public List<SampleDescriptor> resolve() throws ManifestException {
        List<String> paths = new ArrayList<>();
        for (Path root : roots) {
            if (!Files.isDirectory(root)) {
                throw new ManifestException("Dataset root does not exist or is not a directory: " + root);
            }
            try {
                Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && matches(file.getFileName().toString())) {
                            paths.add(file.toAbsolutePath().normalize().toString());
                        }
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (IOException e) {
                throw new ManifestException("Failed to walk dataset root " + root, e);
            }
        }

        Collections.sort(paths);
        List<SampleDescriptor> descriptors = new ArrayList<>(paths.size());
        for (String p : paths) {
            descriptors.add(SampleDescriptor.ofPath(p));
        }
        logger.info("Found {} files under {}", descriptors.size(), roots);
        return descriptors;
    }

    private boolean matches(String fileName) {
        if (typeFilters.isEmpty()) {
            return true;
        }
        for (String type : typeFilters) {
            if (fileName.contains(type)) {
                return true;
            }
        }
        return false;
    }
}
