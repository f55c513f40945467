package com.openapi.simpleSDK.generator.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class GeneratorCommandTest {

    @TempDir
    Path tempDir;

    private Path cacheDir;

    @BeforeEach
    void setUp() throws IOException {
        cacheDir = tempDir.resolve("cache");
        copySpec("petstore.yaml");
        copySpec("swagger2.json");
    }

    private void copySpec(String name) throws IOException {
        try (InputStream is = getClass().getResourceAsStream("/specs/" + name)) {
            if (is == null) {
                throw new IOException("Test spec not found: " + name);
            }
            Files.copy(is, tempDir.resolve(name));
        }
    }

    private CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new GeneratorCommand());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        cmd.setErr(new PrintWriter(new StringWriter()));
        return cmd;
    }

    @Test
    void writesJsonResult() throws Exception {
        Path output = tempDir.resolve("out/result.json");

        int exitCode = commandLine().execute(tempDir.resolve("petstore.yaml").toString(),
            "-c", cacheDir.toString(), "-f", "json", "-o", output.toString(), "--list-references");

        assertThat(exitCode).isZero();
        JsonNode written = new ObjectMapper().readTree(output.toFile());
        assertThat(written.path("metadata").path("title").asText()).isEqualTo("Petstore");
        assertThat(written.path("resources")).hasSize(4);
        assertThat(written.path("namespaces").get(0).path("name").asText()).isEqualTo("v1");
        assertThat(Files.exists(cacheDir)).isFalse();
    }

    @Test
    void summaryIsTheDefaultFormat() {
        int exitCode = commandLine().execute(tempDir.resolve("petstore.yaml").toString(), "-c", cacheDir.toString());

        assertThat(exitCode).isZero();
    }

    @Test
    void structuralErrorExitsWithOne() {
        int exitCode = commandLine().execute(tempDir.resolve("swagger2.json").toString(), "-c", cacheDir.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void missingSourceExitsWithOne() {
        int exitCode = commandLine().execute(tempDir.resolve("absent.yaml").toString(), "-c", cacheDir.toString());

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void invalidOptionsAreUsageErrors() {
        String source = tempDir.resolve("petstore.yaml").toString();

        assertThat(commandLine().execute(source, "--retries", "0")).isEqualTo(2);
        assertThat(commandLine().execute(source, "--timeout", "0")).isEqualTo(2);
        assertThat(commandLine().execute(source, "-f", "xml")).isEqualTo(2);
        assertThat(commandLine().execute()).isEqualTo(2);
    }
}
