package com.fleet.resolution.health;

import com.fleet.resolution.cache.CacheStats;
import com.fleet.resolution.cache.ResourceCache;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InventoryCacheHealthCheckTest {

    @Mock
    private ResourceCache<Object> cache;

    private HealthStatus check(CacheStats stats, boolean enabled) {
        when(cache.getStats()).thenReturn(stats);
        return new InventoryCacheHealthCheck(cache, enabled).check();
    }

    @Test
    @DisplayName("Should be UP before the first load")
    void testNotLoaded() {
        HealthStatus status = check(CacheStats.empty(), true);
        assertTrue(status.isUp());
        assertEquals("inventory not loaded yet", status.message());
    }

    @Test
    @DisplayName("Should be UP after a successful load")
    void testLoaded() {
        HealthStatus status = check(new CacheStats(5, 1, 1, 0, 1, false), true);
        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals(1L, status.details().get("loadSuccessCount"));
    }

    @Test
    @DisplayName("Should be DEGRADED when the last refresh failed and a snapshot is still held")
    void testDegraded() {
        HealthStatus status = check(new CacheStats(5, 2, 1, 1, 1, true), true);
        assertEquals(HealthStatus.Status.DEGRADED, status.status());
    }

    @Test
    @DisplayName("Should be DOWN when no load has ever succeeded")
    void testDown() {
        HealthStatus status = check(new CacheStats(0, 2, 0, 2, 0, true), true);
        assertEquals(HealthStatus.Status.DOWN, status.status());
    }

    @Test
    @DisplayName("Should be DOWN when the last refresh failed after the snapshot expired")
    void testDownAfterExpiry() {
        HealthStatus status = check(new CacheStats(5, 2, 1, 1, 0, true), true);
        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertEquals("no inventory snapshot available", status.message());
    }

    @Test
    @DisplayName("Should report UP when caching is disabled")
    void testDisabled() {
        HealthStatus status = check(new CacheStats(0, 2, 0, 2, 0, true), false);
        assertEquals(HealthStatus.Status.UP, status.status());
        assertEquals("cache disabled", status.message());
        assertEquals("scaleset-inventory", new InventoryCacheHealthCheck(cache, false).getName());
    }

    @Test
    @DisplayName("Details should be immutable and withDetail should copy")
    void testDetailsImmutable() {
        HealthStatus base = HealthStatus.of(HealthStatus.Status.UP, "OK");
        HealthStatus extended = base.withDetail("k", "v");
        assertTrue(base.details().isEmpty());
        assertEquals("v", extended.details().get("k"));
        assertThrows(UnsupportedOperationException.class, () -> extended.details().put("x", "y"));
    }
}
