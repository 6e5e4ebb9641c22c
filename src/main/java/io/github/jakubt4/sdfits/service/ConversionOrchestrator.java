package io.github.jakubt4.sdfits.service;

import io.github.jakubt4.sdfits.scan.DirectoryScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;

/**
 * Runs the conversion over every scan directory selected by a path or glob.
 *
 * <p>Directories are processed one after another. A failure is contained to its directory:
 * it is logged, reported as {@link ConversionStatus#FAILED} and the next directory proceeds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversionOrchestrator {

    private final DirectoryScanner scanner;
    private final ConversionPipeline pipeline;

    /**
     * @param pattern  directory path or glob
     * @param override rebuild directories that already hold an artifact
     * @return one result per scan directory, in path order
     * @throws IllegalStateException if the pattern's base directory cannot be read
     */
    public List<ConversionResult> run(final String pattern, final boolean override) {
        final var results = new ArrayList<ConversionResult>();
        for (final var scan : scanner.scan(pattern)) {
            try {
                results.add(pipeline.convert(scan, override));
            } catch (final RuntimeException e) {
                log.error("[{}] conversion failed: {}", scan.directory(), e.getMessage(), e);
                results.add(ConversionResult.failed(scan.directory(), e.getMessage()));
            }
        }
        summarize(pattern, results);
        return results;
    }

    private static void summarize(final String pattern, final List<ConversionResult> results) {
        final var counts = new EnumMap<ConversionStatus, Integer>(ConversionStatus.class);
        for (final var status : ConversionStatus.values()) {
            counts.put(status, 0);
        }
        results.forEach(result -> counts.merge(result.status(), 1, Integer::sum));
        log.info("[{}] {} director{}: {}", pattern, results.size(), results.size() == 1 ? "y" : "ies", counts);
    }
}
