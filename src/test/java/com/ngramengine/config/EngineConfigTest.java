package com.ngramengine.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class EngineConfigTest {

    @Test
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertNotNull(config);
        assertEquals(Path.of("./ngram-index"), config.getIndexDir());
        assertEquals(Constants.DEFAULT_GRAM_LENGTH, config.getGramLength());
        assertEquals(Constants.DEFAULT_QUERY_LIMIT, config.getQueryLimit());
        assertEquals(Constants.BALANCED_WEIGHT, config.getWeight());
    }

    @Test
    void testSetters() {
        EngineConfig config = new EngineConfig();
        Path newIndexDir = Path.of("./custom-index");

        config.setIndexDir(newIndexDir);
        config.setGramLength(2);
        config.setQueryLimit(50);
        config.setWeight(0.8);

        assertEquals(newIndexDir, config.getIndexDir());
        assertEquals(2, config.getGramLength());
        assertEquals(50, config.getQueryLimit());
        assertEquals(0.8, config.getWeight());
    }
}
