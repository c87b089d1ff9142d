package com.fleet.resolution.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InventorySnapshotTest {

    private static final String PREFIX = "/subscriptions/sub/resourceGroups/rg/providers/Microsoft.Compute/virtualMachineScaleSets/";

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Should keep only flexible scale sets with an ID")
        void testFiltersIneligible() {
            InventorySnapshot.Builder builder = InventorySnapshot.builder();
            assertTrue(builder.add(ScaleSet.flexible(PREFIX + "flex")));
            assertFalse(builder.add(ScaleSet.uniform(PREFIX + "uniform")));
            assertFalse(builder.add(new ScaleSet(PREFIX + "unknown", null)));
            assertFalse(builder.add(ScaleSet.flexible(null)));
            assertFalse(builder.add(ScaleSet.flexible("")));
            assertFalse(builder.add(null));

            InventorySnapshot snapshot = builder.build();
            assertEquals(1, snapshot.size());
            assertTrue(snapshot.contains(PREFIX + "flex"));
        }

        @Test
        @DisplayName("Every entry should be keyed by its own ID")
        void testKeyedById() {
            InventorySnapshot.Builder builder = InventorySnapshot.builder();
            builder.add(ScaleSet.flexible(PREFIX + "a"));
            builder.add(ScaleSet.flexible(PREFIX + "b"));
            InventorySnapshot snapshot = builder.build();

            for (ScaleSet scaleSet : snapshot.scaleSets()) {
                assertEquals(Optional.of(scaleSet), snapshot.findById(scaleSet.id()));
            }
        }

        @Test
        @DisplayName("Built snapshot should not change when the builder is reused")
        void testImmutable() {
            InventorySnapshot.Builder builder = InventorySnapshot.builder();
            builder.add(ScaleSet.flexible(PREFIX + "a"));
            InventorySnapshot first = builder.loadedAt(Instant.EPOCH).build();
            builder.add(ScaleSet.flexible(PREFIX + "b"));

            assertEquals(1, first.size());
            assertEquals(Instant.EPOCH, first.getLoadedAt());
            assertThrows(UnsupportedOperationException.class,
                    () -> first.scaleSets().clear());
        }
    }

    @Nested
    @DisplayName("findByShortName")
    class FindByShortNameTests {

        @Test
        @DisplayName("Should match the last ID segment ignoring case")
        void testCaseInsensitive() {
            InventorySnapshot.Builder builder = InventorySnapshot.builder();
            builder.add(ScaleSet.flexible(PREFIX + "Pool-A"));
            InventorySnapshot snapshot = builder.build();

            assertEquals(PREFIX + "Pool-A", snapshot.findByShortName("pool-a").orElseThrow().id());
            assertTrue(snapshot.findByShortName("pool").isEmpty());
        }

        @Test
        @DisplayName("Should return the first match in iteration order")
        void testFirstMatchWins() {
            InventorySnapshot.Builder builder = InventorySnapshot.builder();
            builder.add(ScaleSet.flexible("/subscriptions/sub/resourceGroups/rg1/providers/x/pool"));
            builder.add(ScaleSet.flexible("/subscriptions/sub/resourceGroups/rg2/providers/x/pool"));
            InventorySnapshot snapshot = builder.build();

            assertEquals("/subscriptions/sub/resourceGroups/rg1/providers/x/pool",
                    snapshot.findByShortName("POOL").orElseThrow().id());
        }

        @Test
        @DisplayName("Should find nothing in an empty snapshot")
        void testEmpty() {
            assertTrue(InventorySnapshot.empty().findByShortName("any").isEmpty());
            assertTrue(InventorySnapshot.empty().isEmpty());
        }
    }

    @Nested
    @DisplayName("ResourceIds")
    class ResourceIdsTests {

        @Test
        @DisplayName("Should extract the last segment")
        void testLastSegment() {
            assertEquals(Optional.of("ss-a"), ResourceIds.lastSegment(PREFIX + "ss-a"));
            assertEquals(Optional.of("plain"), ResourceIds.lastSegment("plain"));
        }

        @Test
        @DisplayName("Should return empty for malformed IDs")
        void testMalformed() {
            for (String id : List.of("", "  ", "/a/b/")) {
                assertTrue(ResourceIds.lastSegment(id).isEmpty(), id);
            }
            assertTrue(ResourceIds.lastSegment(null).isEmpty());
        }
    }

    @Nested
    @DisplayName("VirtualMachine")
    class VirtualMachineTests {

        @Test
        @DisplayName("Node name should be the lower-cased computer name")
        void testNodeName() {
            VirtualMachine vm = new VirtualMachine("vm-1", "AKS-Pool-0001", PREFIX + "pool");
            assertEquals(Optional.of("aks-pool-0001"), vm.nodeName());
            assertEquals(Optional.of(PREFIX + "pool"), vm.scaleSet());
        }

        @Test
        @DisplayName("Missing fields should yield empty optionals")
        void testMissingFields() {
            VirtualMachine vm = new VirtualMachine("vm-1", null, "");
            assertTrue(vm.nodeName().isEmpty());
            assertTrue(vm.scaleSet().isEmpty());
        }
    }
}
