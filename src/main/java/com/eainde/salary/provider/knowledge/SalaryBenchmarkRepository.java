package com.eainde.salary.provider.knowledge;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Read-only benchmark store seeded from a JSON array on the classpath.
 */
@Log4j2
public class SalaryBenchmarkRepository {

    private final List<SalaryBenchmark> benchmarks;

    public SalaryBenchmarkRepository(List<SalaryBenchmark> benchmarks) {
        this.benchmarks = List.copyOf(benchmarks);
    }

    /**
     * Loads the seed file. A missing resource yields an empty store, so the
     * knowledge branch degrades to "no data" instead of stopping the service.
     *
     * @throws IllegalStateException when the resource exists but is not valid benchmark JSON
     */
    public static SalaryBenchmarkRepository fromClasspath(ObjectMapper objectMapper, String resourcePath) {
        ClassPathResource resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            log.warn("Benchmark seed {} not found, knowledge store is empty", resourcePath);
            return new SalaryBenchmarkRepository(List.of());
        }
        try (InputStream in = resource.getInputStream()) {
            List<SalaryBenchmark> loaded = objectMapper.readValue(in, new TypeReference<List<SalaryBenchmark>>() { });
            log.info("Loaded {} salary benchmarks from {}", loaded.size(), resourcePath);
            return new SalaryBenchmarkRepository(loaded);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read benchmark seed " + resourcePath, e);
        }
    }

    public List<SalaryBenchmark> findAll() {
        return benchmarks;
    }

    public int count() {
        return benchmarks.size();
    }
}
