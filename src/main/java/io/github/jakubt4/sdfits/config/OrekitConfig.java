package io.github.jakubt4.sdfits.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.orekit.data.ClasspathCrawler;
import org.orekit.data.DataContext;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bootstraps the Orekit astrodynamics library by registering the {@code UTC-TAI.history}
 * leap-second file with Orekit's {@link DataContext}.
 *
 * <p>Must initialize before any Orekit API call. Other beans that depend on Orekit
 * should inject this configuration to guarantee ordering. No Earth orientation files are
 * shipped, so Orekit runs with zero EOP corrections (UT1 = UTC, no polar motion).
 */
@Slf4j
@Configuration
public class OrekitConfig {

    static final String LEAP_SECONDS = "UTC-TAI.history";

    private static final AtomicBoolean REGISTERED = new AtomicBoolean();

    /**
     * Adds the classpath leap-second file to Orekit's
     * {@link org.orekit.data.DataProvidersManager}. Later contexts in the same JVM reuse it.
     *
     * @throws IllegalStateException if the file is not found on the classpath
     */
    @PostConstruct
    public void init() {
        final var classLoader = OrekitConfig.class.getClassLoader();
        if (classLoader.getResource(LEAP_SECONDS) == null) {
            throw new IllegalStateException(LEAP_SECONDS + " not found on classpath");
        }
        if (REGISTERED.compareAndSet(false, true)) {
            DataContext.getDefault().getDataProvidersManager().addProvider(new ClasspathCrawler(classLoader, LEAP_SECONDS));
            log.info("Orekit data loaded from classpath:{}", LEAP_SECONDS);
        }
    }
}
