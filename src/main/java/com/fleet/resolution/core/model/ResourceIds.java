package com.fleet.resolution.core.model;

import java.util.Optional;

/**
 * Helpers for slash-separated cloud resource IDs such as
 * {@code /subscriptions/sub/resourceGroups/rg/providers/Microsoft.Compute/virtualMachineScaleSets/ss-a}.
 */
public final class ResourceIds {

    private ResourceIds() {
    }

    /**
     * Returns the segment after the last {@code '/'}, or empty when the ID is
     * null, blank or ends with a separator.
     */
    public static Optional<String> lastSegment(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            return Optional.empty();
        }
        int idx = resourceId.lastIndexOf('/');
        String segment = idx < 0 ? resourceId : resourceId.substring(idx + 1);
        return segment.isEmpty() ? Optional.empty() : Optional.of(segment);
    }
}
