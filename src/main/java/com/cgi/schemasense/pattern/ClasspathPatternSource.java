package com.cgi.schemasense.pattern;

import com.cgi.schemasense.config.ClassificationProperties;
import com.cgi.schemasense.exception.PatternLoadException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Reads pattern records from a JSON array on the classpath.
 */
@Slf4j
@Component
public class ClasspathPatternSource implements PatternSource {
    private final String resourcePath;
    private final ObjectMapper objectMapper;

    @Autowired
    public ClasspathPatternSource(ClassificationProperties properties, ObjectMapper objectMapper) {
        this(properties.getMatching().getPatternResource(), objectMapper);
    }

    public ClasspathPatternSource(String resourcePath, ObjectMapper objectMapper) {
        this.resourcePath = resourcePath;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<PatternRecord> loadRecords() {
        ClassPathResource resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            throw new PatternLoadException("Pattern resource not found: " + resourcePath);
        }
        try (InputStream in = resource.getInputStream()) {
            List<PatternRecord> records = objectMapper.readValue(in, new TypeReference<List<PatternRecord>>() {});
            log.info("Read {} pattern records from {}", records.size(), resourcePath);
            return records;
        } catch (IOException e) {
            throw new PatternLoadException("Unable to read pattern resource " + resourcePath, e);
        }
    }
}
