package com.openapi.simpleSDK.generator;

import com.openapi.simpleSDK.generator.cli.GeneratorCommand;
import picocli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        logger.debug("Starting OpenAPI SDK analyzer");

        CommandLine cmd = new CommandLine(new GeneratorCommand());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        int exitCode = cmd.execute(args);

        logger.debug("Analyzer completed with exit code: {}", exitCode);
        System.exit(exitCode);
    }
}
