package org.neuralchilli.chadoxml;

import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.neuralchilli.chadoxml.cache.CacheConsistencyException;
import org.neuralchilli.chadoxml.cache.ObjectCache;
import org.neuralchilli.chadoxml.service.ConversionPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Command line entry point: {@code chadoxml <input.yaml> [output.xml]}.
 * Without an output path the document goes to standard output.
 */
@QuarkusMain
public class ChadoXmlMain implements QuarkusApplication {

    private static final Logger log = LoggerFactory.getLogger(ChadoXmlMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @Inject
    ObjectCache cache;

    @Inject
    ConversionPipeline pipeline;

    @Override
    public int run(String... args) {
        if (args.length < 1 || args.length > 2) {
            log.error("Usage: chadoxml <experiment.yaml> [output.xml]");
            return EXIT_USAGE;
        }

        Path input = Path.of(args[0]);
        Path output = args.length == 2 ? Path.of(args[1]) : null;

        cache.init();
        try {
            return pipeline.convert(input, output) ? EXIT_OK : EXIT_FAILED;
        } catch (CacheConsistencyException e) {
            log.error("✗ Object cache is inconsistent: {}", e.getMessage(), e);
            return EXIT_FAILED;
        } finally {
            cache.destroy();
        }
    }
}
