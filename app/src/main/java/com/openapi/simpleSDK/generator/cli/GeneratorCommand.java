package com.openapi.simpleSDK.generator.cli;

import com.openapi.simpleSDK.generator.ApiAnalyzer;
import com.openapi.simpleSDK.generator.LoadedSpec;
import com.openapi.simpleSDK.generator.SpecLoader;
import com.openapi.simpleSDK.generator.SpecResult;
import com.openapi.simpleSDK.generator.resolver.ReferenceResolver;
import com.openapi.simpleSDK.http.DocumentFetcher;
import com.openapi.simpleSDK.http.HttpDocumentCache;
import com.openapi.simpleSDK.http.exceptions.SdkGenException;
import com.openapi.simpleSDK.http.retry.RetryPolicy;
import picocli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

@CommandLine.Command(
    name = "sdkgen-analyze",
    description = "Analyze an OpenAPI 3.x document into the resolved SDK intermediate representation",
    mixinStandardHelpOptions = true,
    version = "1.0.0-SNAPSHOT"
)
public class GeneratorCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(GeneratorCommand.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(
        index = "0",
        description = "Path or URL of the OpenAPI document (JSON or YAML)"
    )
    private String source;

    @CommandLine.Option(
        names = {"-c", "--cache-dir"},
        description = "Cache directory for remote documents (default: ${DEFAULT-VALUE})",
        defaultValue = "${sys:user.home}/.sdkgen/cache"
    )
    private Path cacheDir;

    @CommandLine.Option(
        names = {"-t", "--timeout"},
        description = "Remote fetch timeout in seconds (default: ${DEFAULT-VALUE})",
        defaultValue = "30"
    )
    private long timeoutSeconds;

    @CommandLine.Option(
        names = {"-r", "--retries"},
        description = "Attempts per remote fetch, 1 disables retries (default: ${DEFAULT-VALUE})",
        defaultValue = "1"
    )
    private int attempts;

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "SUMMARY"
    )
    private OutputFormat format;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write JSON output to this file instead of standard output"
    )
    private Path output;

    @CommandLine.Option(
        names = "--list-references",
        description = "Also list every reference found in the document"
    )
    private boolean listReferences;

    @CommandLine.Option(
        names = "--refresh",
        description = "Download a remote source again instead of using the cache"
    )
    private boolean refresh;

    @Override
    public Integer call() {
        if (attempts < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--retries must be at least 1");
        }
        if (timeoutSeconds < 1) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--timeout must be at least 1 second");
        }

        logger.debug("Source: {}, cache: {}, timeout: {}s, attempts: {}", source, cacheDir, timeoutSeconds, attempts);

        try {
            HttpDocumentCache cache = new HttpDocumentCache(cacheDir, Duration.ofSeconds(timeoutSeconds), RetryPolicy.ofAttempts(attempts));
            DocumentFetcher topLevelFetcher = refresh ? url -> cache.fetch(url, true) : cache;

            LoadedSpec loaded = new SpecLoader(topLevelFetcher).load(source);
            SpecResult result = new ApiAnalyzer(new ReferenceResolver(cache)).analyze(loaded);

            SpecResultPrinter printer = new SpecResultPrinter();
            if (listReferences) {
                printer.printReferences(result.references());
            }
            if (format == OutputFormat.JSON) {
                if (output != null) {
                    printer.writeJson(result, output);
                } else {
                    System.out.println(printer.toJson(result));
                }
            } else {
                printer.printSummary(result);
            }
            return 0;

        } catch (SdkGenException e) {
            logger.error("Analysis of {} failed: {}", source, e.getMessage());
            logger.debug("Failure details", e);
            return 1;
        } catch (IOException e) {
            logger.error("Could not write output", e);
            return 1;
        }
    }
}
