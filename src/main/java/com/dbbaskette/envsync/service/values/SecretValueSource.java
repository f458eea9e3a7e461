package com.dbbaskette.envsync.service.values;

import com.dbbaskette.envsync.error.ValuesSourceException;
import com.dbbaskette.envsync.model.ProjectRepo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads the name/value pairs to distribute from a dotenv file. Values are never logged.
 */
@Service
public class SecretValueSource {

    private static final Logger log = LoggerFactory.getLogger(SecretValueSource.class);

    public Map<String, String> load(ProjectRepo project) {
        if (project.getValuesFile() == null || project.getValuesFile().isBlank()) {
            throw new ValuesSourceException("Project " + project.getProjectId()
                    + " has no values file configured and the request supplied no values");
        }
        return load(Path.of(project.getValuesFile()));
    }

    public Map<String, String> load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ValuesSourceException("Values file not found: " + file);
        }
        try {
            Map<String, String> values = DotenvParser.parse(Files.readAllLines(file, StandardCharsets.UTF_8));
            log.info("Loaded {} secret names from {}", values.size(), file);
            return values;
        } catch (IOException e) {
            throw new ValuesSourceException("Failed to read values file " + file, e);
        }
    }
}
