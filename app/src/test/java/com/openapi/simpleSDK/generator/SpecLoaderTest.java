package com.openapi.simpleSDK.generator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openapi.simpleSDK.http.DocumentFetcher;
import com.openapi.simpleSDK.http.exceptions.DocumentNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpecLoaderTest {

    @TempDir
    Path tempDir;

    @Mock
    private DocumentFetcher remoteFetcher;

    @Test
    void loadsYamlFileWithItsDirectoryAsBase() throws Exception {
        Path file = tempDir.resolve("api.yaml");
        Files.writeString(file, "openapi: 3.0.0\ninfo:\n  title: T\n  version: '1'\n");

        LoadedSpec loaded = new SpecLoader(remoteFetcher).load(file.toString());

        assertThat(loaded.document().path("info").path("title").asText()).isEqualTo("T");
        assertThat(loaded.baseDirectory()).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(loaded.source()).isEqualTo(file.toString());
        verifyNoInteractions(remoteFetcher);
    }

    @Test
    void loadsUrlThroughFetcherWithWorkingDirectoryAsBase() throws Exception {
        JsonNode document = new ObjectMapper().readTree("{\"openapi\": \"3.0.0\"}");
        when(remoteFetcher.fetch("https://example.com/openapi.json")).thenReturn(document);

        LoadedSpec loaded = new SpecLoader(remoteFetcher).load("https://example.com/openapi.json");

        assertThat(loaded.document()).isSameAs(document);
        assertThat(loaded.baseDirectory()).isEqualTo(Paths.get("").toAbsolutePath());
    }

    @Test
    void missingFileIsNotFound() {
        String missing = tempDir.resolve("missing.json").toString();

        assertThatThrownBy(() -> new SpecLoader(remoteFetcher).load(missing))
            .isInstanceOf(DocumentNotFoundException.class);
    }
}
