package com.railplan;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

public class SchedulerConfigTest {

    @Test
    public void loadsShippedDefaults () {
        SchedulerConfig config = SchedulerConfig.defaults();
        Assertions.assertEquals(5, config.delayIncrementMinutes());
        Assertions.assertEquals(15, config.maxIterations());
        Assertions.assertEquals(60, config.populationSize());
        Assertions.assertEquals(0.15, config.oracleMinConfidence(), 1e-9);
        Assertions.assertEquals("", config.oracleEndpoint());
    }

    @Test
    public void replacedValuesAreParsed () {
        SchedulerConfig config = TestConfig.config("max-iterations", "3", "parallel-detection", "yes");
        Assertions.assertEquals(3, config.maxIterations());
        Assertions.assertTrue(config.parallelDetection());
    }

    @Test
    public void missingAndMalformedKeysAreAllReported () {
        Properties properties = ConfigBase.propsFromResource(SchedulerConfig.DEFAULT_RESOURCE);
        properties.remove("elite-count");
        properties.setProperty("mutation-rate", "often");
        ScheduleException e = Assertions.assertThrows(ScheduleException.class, () -> new SchedulerConfig(properties));
        Assertions.assertEquals(ScheduleException.Type.CONFIGURATION, e.type);
        Assertions.assertTrue(e.getMessage().contains("elite-count"));
        Assertions.assertTrue(e.getMessage().contains("mutation-rate"));
    }

    @Test
    public void loadsFromFile (@TempDir Path dir) throws IOException {
        Properties properties = ConfigBase.propsFromResource(SchedulerConfig.DEFAULT_RESOURCE);
        properties.setProperty("delay-increment-minutes", "2");
        Path file = dir.resolve("scheduler.properties");
        try (Writer writer = Files.newBufferedWriter(file)) {
            properties.store(writer, null);
        }
        Assertions.assertEquals(2, SchedulerConfig.fromFile(file.toString()).delayIncrementMinutes());
    }

    @Test
    public void missingFileIsAConfigurationError () {
        ScheduleException e = Assertions.assertThrows(ScheduleException.class,
                () -> SchedulerConfig.fromFile("does-not-exist.properties"));
        Assertions.assertEquals(ScheduleException.Type.CONFIGURATION, e.type);
    }

}
