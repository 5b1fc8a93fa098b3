package io.github.eutro.exnorm.test;

import io.github.eutro.exnorm.conf.NormalizerConfig;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class NormalizerConfigTest {
    @Test
    void defaults() {
        NormalizerConfig config = NormalizerConfig.DEFAULT;
        assertNull(config.getProjectModule());
        assertTrue(config.isReserved("socket"));
        assertTrue(config.isReserved("assigns"));
        assertFalse(config.isReserved("user"));
        assertTrue(config.getTempPrefixes().isEmpty());
        assertEquals("value", config.getAlternativeNames().get(0));
        assertTrue(config.getAppLocalModules().contains("Repo"));
    }

    @Test
    void builderCopies() {
        NormalizerConfig base = NormalizerConfig.builder()
                .setProjectModule("MyApp")
                .addTempPrefix("__t")
                .build();
        NormalizerConfig derived = base.toBuilder()
                .addReservedName("conn2")
                .setAlternativeNames(Arrays.asList("row", "record"))
                .build();
        assertEquals("MyApp", derived.getProjectModule());
        assertEquals(Arrays.asList("__t"), derived.getTempPrefixes());
        assertTrue(derived.isReserved("conn2"));
        assertFalse(base.isReserved("conn2"));
        assertEquals(Arrays.asList("row", "record"), derived.getAlternativeNames());
        assertEquals(NormalizerConfig.DEFAULT_ALTERNATIVE_NAMES, base.getAlternativeNames());
        assertThrows(UnsupportedOperationException.class, () -> base.getTempPrefixes().add("x"));
    }

    @Test
    void rejectsEmptyPrefix() {
        assertThrows(IllegalArgumentException.class, () -> NormalizerConfig.builder().addTempPrefix(""));
    }
}
