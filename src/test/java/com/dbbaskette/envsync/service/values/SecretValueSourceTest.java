package com.dbbaskette.envsync.service.values;

import com.dbbaskette.envsync.error.ValuesSourceException;
import com.dbbaskette.envsync.model.ProjectRepo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SecretValueSourceTest {

    private final SecretValueSource source = new SecretValueSource();

    @TempDir
    Path tempDir;

    @Test
    void loadsProjectValuesFile() throws IOException {
        Path env = tempDir.resolve(".env");
        Files.writeString(env, "DATABASE_URL=postgres://a\n");
        ProjectRepo project = new ProjectRepo("demo", "acme", "demo-app");
        project.setValuesFile(env.toString());

        Map<String, String> values = source.load(project);

        assertEquals(Map.of("DATABASE_URL", "postgres://a"), values);
    }

    @Test
    void missingFileFails() {
        assertThrows(ValuesSourceException.class, () -> source.load(tempDir.resolve("absent.env")));
    }

    @Test
    void projectWithoutValuesFileFails() {
        ProjectRepo project = new ProjectRepo("demo", "acme", "demo-app");
        assertThrows(ValuesSourceException.class, () -> source.load(project));
    }
}
