package io.github.jakubt4.sdfits.runner;

import io.github.jakubt4.sdfits.config.SdfitsProperties;
import io.github.jakubt4.sdfits.service.ConversionOrchestrator;
import io.github.jakubt4.sdfits.service.ConversionResult;
import io.github.jakubt4.sdfits.service.ConversionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line entry: {@code sdfits '<dir-or-glob>' [--override]}.
 *
 * <p>Quote the glob so the program, not the shell, expands it. Several paths are accepted,
 * which also covers a shell that expanded the glob anyway. The exit code is 1 when any
 * directory failed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversionCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String OVERRIDE_OPTION = "override";
    static final String USAGE = "usage: sdfits '<scan-dir-or-glob>' [--override]  e.g. sdfits '../Data/scan[12]'";

    private final ConversionOrchestrator orchestrator;
    private final SdfitsProperties properties;

    private final List<ConversionResult> results = new ArrayList<>();
    private int exitCode;

    @Override
    public void run(final ApplicationArguments args) {
        final var targets = args.getNonOptionArgs();
        if (targets.isEmpty()) {
            log.info(USAGE);
            return;
        }

        final var override = args.containsOption(OVERRIDE_OPTION) || properties.output().override();
        if (override) {
            log.info("Override enabled, existing outputs will be rebuilt");
        }
        for (final var target : targets) {
            results.addAll(orchestrator.run(target, override));
        }

        final var failed = results.stream().filter(result -> result.status() == ConversionStatus.FAILED).count();
        if (failed > 0) {
            log.error("{} of {} directories failed", failed, results.size());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    public List<ConversionResult> getResults() {
        return List.copyOf(results);
    }
}
