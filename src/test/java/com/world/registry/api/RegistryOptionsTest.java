package com.world.registry.api;

import com.world.registry.cache.CacheConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RegistryOptionsTest {

    @Test
    @DisplayName("Defaults are unscoped with minimum lengths of three")
    void defaults() {
        RegistryOptions options = RegistryOptions.defaults();

        assertNull(options.getActiveOn());
        assertEquals(3, options.getMinTokenLength());
        assertEquals(3, options.getMinStemLength());
        assertFalse(options.isParallelSourceParsing());
        assertTrue(options.getCacheConfig().enabled());
    }

    @Test
    @DisplayName("Minimum stem length is applied to the inflection rules")
    void minStemLengthApplied() {
        RegistryOptions options = RegistryOptions.builder().minStemLength(4).build();
        assertEquals(4, options.getInflectionRules().getMinStemLength());
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> RegistryOptions.builder().minTokenLength(0).build());
        assertThrows(IllegalArgumentException.class, () -> RegistryOptions.builder().minStemLength(-1).build());
        assertThrows(NullPointerException.class, () -> RegistryOptions.builder().cacheConfig(null).build());
        assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 10, true));
    }
}
