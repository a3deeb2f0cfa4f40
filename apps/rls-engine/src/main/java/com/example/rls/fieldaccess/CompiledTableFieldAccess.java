package com.example.rls.fieldaccess;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public record CompiledTableFieldAccess(
        String table,
        FieldAccessDefault defaultAccess,
        Set<String> skipFor,
        Map<String, CompiledFieldAccess> fields
) {
    public Optional<CompiledFieldAccess> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public boolean isSkippedFor(Collection<String> roles) {
        return roles != null && roles.stream().anyMatch(skipFor::contains);
    }
}
