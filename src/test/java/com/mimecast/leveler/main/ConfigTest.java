package com.mimecast.leveler.main;

import com.mimecast.leveler.config.LevelerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

@Execution(ExecutionMode.SAME_THREAD)
class ConfigTest {

    @AfterEach
    void tearDown() {
        Config.setLeveler(new LevelerConfig());
    }

    @Test
    void testDefaultIsEmpty() {
        assertNotNull(Config.getLeveler());
    }

    @Test
    void testInitLeveler() throws IOException {
        Config.initLeveler("src/test/resources/leveler-test.json5");

        assertEquals(2, Config.getLeveler().getQueues().size());
        assertEquals(4, Config.getLeveler().getProcessor().getMaxConcurrentMessages());
    }

    @Test
    void testInitLevelerMissingFile() {
        assertThrows(IOException.class, () -> Config.initLeveler("src/test/resources/missing.json5"));
    }
}
