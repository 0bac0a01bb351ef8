package com.platform.scaffold.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class OpenApiExporterTest {

    @Test
    void writesDocumentWithEveryRouteGroup(@TempDir Path dir) throws Exception {
        Path output = dir.resolve("docs").resolve("openapi.json");

        int paths = OpenApiExporter.export(output);

        assertTrue(Files.exists(output));
        String document = Files.readString(output);
        assertTrue(document.contains("\"openapi\""));
        assertTrue(document.contains("/healthcheck"));
        assertTrue(document.contains("/v1/protected/data"));
        assertTrue(document.contains("/v1/users/{user_id}"));
        assertTrue(paths >= 6, "expected all route groups, got " + paths);
    }
}
