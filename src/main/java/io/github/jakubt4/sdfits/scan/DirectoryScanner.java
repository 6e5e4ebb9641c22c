package io.github.jakubt4.sdfits.scan;

import io.github.jakubt4.sdfits.reader.FileKind;
import io.github.jakubt4.sdfits.reader.RecordReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Resolves a directory path or glob pattern to the scan directories below it.
 *
 * <p>Glob characters ({@code * ? [ {}) are expanded here, so a quoted pattern such as
 * {@code '../Data/scan[12]'} selects both {@code scan1} and {@code scan2}. Every selected
 * directory is searched recursively; each directory that directly contains spectrum, noise,
 * metadata or output files becomes one {@link ScanDirectory}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DirectoryScanner {

    private static final String GLOB_CHARACTERS = "*?[{";

    private final RecordReader recordReader;

    /**
     * @param pattern directory path or glob
     * @return scan directories in path order
     * @throws IllegalStateException if the pattern's base directory does not exist or cannot
     *                               be read
     */
    public List<ScanDirectory> scan(final String pattern) {
        final var roots = resolveRoots(pattern);
        if (roots.isEmpty()) {
            log.warn("No directory matches [{}]", pattern);
        }

        final var directories = new TreeSet<Path>();
        for (final var root : roots) {
            try (Stream<Path> tree = Files.walk(root)) {
                tree.filter(Files::isDirectory).forEach(directories::add);
            } catch (final IOException | UncheckedIOException e) {
                throw new IllegalStateException("Cannot read directory tree " + root, e);
            }
        }

        final var scans = new ArrayList<ScanDirectory>();
        for (final var directory : directories) {
            final var scan = classify(directory);
            if (!scan.spectrumFiles().isEmpty() || !scan.noiseFiles().isEmpty()
                    || !scan.metadataFiles().isEmpty() || scan.hasExistingOutput()) {
                scans.add(scan);
            }
        }
        log.info("Found {} scan director{} under [{}]", scans.size(), scans.size() == 1 ? "y" : "ies", pattern);
        return scans;
    }

    List<Path> resolveRoots(final String pattern) {
        final var path = Path.of(pattern);
        var base = path.getRoot();
        var firstGlob = -1;
        for (var i = 0; i < path.getNameCount(); i++) {
            final var element = path.getName(i);
            if (hasGlob(element.toString())) {
                firstGlob = i;
                break;
            }
            base = base == null ? element : base.resolve(element);
        }

        if (firstGlob < 0) {
            if (!Files.isDirectory(path) || !Files.isReadable(path)) {
                throw new IllegalStateException("Not a readable directory: " + path);
            }
            return List.of(path);
        }

        final var walkBase = base == null ? Path.of("") : base;
        if (!Files.isDirectory(walkBase.toAbsolutePath())) {
            throw new IllegalStateException("Not a readable directory: " + walkBase.toAbsolutePath());
        }
        final var matcher = FileSystems.getDefault().getPathMatcher("glob:" + path);
        final var depth = path.getNameCount() - firstGlob;
        try (Stream<Path> candidates = Files.walk(walkBase, depth)) {
            return candidates
                    .filter(Files::isDirectory)
                    .filter(matcher::matches)
                    .sorted()
                    .toList();
        } catch (final IOException | UncheckedIOException e) {
            throw new IllegalStateException("Cannot expand pattern " + pattern, e);
        }
    }

    private ScanDirectory classify(final Path directory) {
        final var files = new EnumMap<FileKind, List<Path>>(FileKind.class);
        for (final var kind : FileKind.values()) {
            files.put(kind, new ArrayList<>());
        }
        try (Stream<Path> entries = Files.list(directory)) {
            entries.filter(Files::isRegularFile)
                    .sorted()
                    .forEach(file -> files.get(recordReader.classify(file)).add(file));
        } catch (final IOException | UncheckedIOException e) {
            throw new IllegalStateException("Cannot list directory " + directory, e);
        }
        return new ScanDirectory(directory,
                files.get(FileKind.SPECTRUM),
                files.get(FileKind.NOISE),
                files.get(FileKind.METADATA),
                files.get(FileKind.OUTPUT));
    }

    private static boolean hasGlob(final String element) {
        return element.chars().anyMatch(c -> GLOB_CHARACTERS.indexOf(c) >= 0);
    }
}
