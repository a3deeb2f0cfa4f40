package com.example.rls.registry;

import java.util.List;

/**
 * Policy names of one table grouped by decision type, in evaluation order.
 */
public record PolicyListing(
        List<String> allows,
        List<String> denies,
        List<String> filters,
        List<String> validates
) {
    public PolicyListing {
        allows = List.copyOf(allows);
        denies = List.copyOf(denies);
        filters = List.copyOf(filters);
        validates = List.copyOf(validates);
    }
}
