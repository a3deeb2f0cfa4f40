package com.example.rls.policy;

import com.example.rls.context.Operation;
import com.example.rls.context.PolicyEvaluationContext;
import com.example.rls.exception.ConfigurationException;
import com.example.rls.exception.RlsErrorCode;
import lombok.Builder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ready-made {@link ReusablePolicy} bundles for multi-tenancy, ownership,
 * soft deletes, status workflows and admin access.
 */
public final class PolicyPatterns {

    static final int TENANT_FILTER_PRIORITY = 1000;
    static final int SOFT_DELETE_FILTER_PRIORITY = 900;
    static final int ADMIN_PRIORITY = 500;
    static final int NO_DELETE_PRIORITY = 150;
    static final int STATUS_DENY_PRIORITY = 100;

    private PolicyPatterns() {
        // Utility class
    }

    // ----------------------------------------------------------------------
    // Tenant isolation
    // ----------------------------------------------------------------------

    /**
     * @param tenantColumn       column holding the tenant id, {@code tenant_id} by default
     * @param validateOnMutation also check the tenant of create and update payloads (default true)
     */
    @Builder
    public record TenantIsolation(String tenantColumn, Boolean validateOnMutation) {
        public TenantIsolation {
            tenantColumn = tenantColumn != null ? tenantColumn : "tenant_id";
            validateOnMutation = validateOnMutation != null ? validateOnMutation : Boolean.TRUE;
        }
    }

    public static ReusablePolicy tenantIsolation() {
        return tenantIsolation(TenantIsolation.builder().build());
    }

    /**
     * Filters reads to the caller's tenant. With mutation validation, a
     * created row must carry the caller's tenant and an update may only
     * set the tenant column to the caller's own tenant.
     */
    public static ReusablePolicy tenantIsolation(TenantIsolation options) {
        String column = options.tenantColumn();
        ReusablePolicy.ReusablePolicyBuilder bundle = ReusablePolicy.builder()
                .name("tenantIsolation")
                .description("Filter by " + column + " for multi-tenancy")
                .tag("multi-tenant")
                .tag("isolation")
                // singletonMap: a caller without a tenant only sees rows without one
                .policy(Policies.filter(Operation.READ,
                        ctx -> Collections.singletonMap(column, ctx.auth().tenantId()),
                        PolicyOptions.named("tenant-isolation-filter", TENANT_FILTER_PRIORITY)));

        if (options.validateOnMutation()) {
            bundle.policy(Policies.validate(Operation.CREATE,
                            ctx -> Objects.equals(ctx.dataValue(column), ctx.auth().tenantId()),
                            PolicyOptions.named("tenant-isolation-validate-create")))
                    .policy(Policies.validate(Operation.UPDATE,
                            ctx -> !hasDataKey(ctx, column)
                                    || Objects.equals(ctx.dataValue(column), ctx.auth().tenantId()),
                            PolicyOptions.named("tenant-isolation-validate-update")));
        }
        return bundle.build();
    }

    // ----------------------------------------------------------------------
    // Ownership
    // ----------------------------------------------------------------------

    /**
     * @param ownerColumn column holding the owner's user id, {@code owner_id} by default
     * @param operations  operations an owner may perform, READ, UPDATE and DELETE by default
     * @param canDelete   when false, owners lose DELETE and deletes are denied outright
     */
    @Builder
    public record Ownership(String ownerColumn, Set<Operation> operations, Boolean canDelete) {
        public Ownership {
            ownerColumn = ownerColumn != null ? ownerColumn : "owner_id";
            operations = operations != null && !operations.isEmpty()
                    ? Set.copyOf(operations)
                    : Set.of(Operation.READ, Operation.UPDATE, Operation.DELETE);
            canDelete = canDelete != null ? canDelete : Boolean.TRUE;
        }
    }

    public static ReusablePolicy ownership() {
        return ownership(Ownership.builder().build());
    }

    public static ReusablePolicy ownership(Ownership options) {
        String column = options.ownerColumn();
        Set<Operation> ownerOperations = EnumSet.copyOf(options.operations());
        if (!options.canDelete()) {
            ownerOperations.remove(Operation.DELETE);
        }

        ReusablePolicy.ReusablePolicyBuilder bundle = ReusablePolicy.builder()
                .name("ownership")
                .description("Owner access via " + column)
                .tag("ownership");
        if (!ownerOperations.isEmpty()) {
            bundle.policy(Policies.allow(ownerOperations, ctx -> isOwner(ctx, column),
                    PolicyOptions.named("ownership-allow")));
        }
        if (!options.canDelete() && options.operations().contains(Operation.DELETE)) {
            bundle.policy(Policies.deny(Operation.DELETE,
                    PolicyOptions.named("ownership-no-delete", NO_DELETE_PRIORITY)));
        }
        return bundle.build();
    }

    // ----------------------------------------------------------------------
    // Soft delete
    // ----------------------------------------------------------------------

    /**
     * @param deletedColumn     timestamp column set on soft delete, {@code deleted_at} by default
     * @param filterOnRead      hide soft-deleted rows from reads (default true)
     * @param preventHardDelete deny DELETE outright (default true)
     */
    @Builder
    public record SoftDelete(String deletedColumn, Boolean filterOnRead, Boolean preventHardDelete) {
        public SoftDelete {
            deletedColumn = deletedColumn != null ? deletedColumn : "deleted_at";
            filterOnRead = filterOnRead != null ? filterOnRead : Boolean.TRUE;
            preventHardDelete = preventHardDelete != null ? preventHardDelete : Boolean.TRUE;
        }
    }

    public static ReusablePolicy softDelete() {
        return softDelete(SoftDelete.builder().build());
    }

    public static ReusablePolicy softDelete(SoftDelete options) {
        String column = options.deletedColumn();
        ReusablePolicy.ReusablePolicyBuilder bundle = ReusablePolicy.builder()
                .name("softDelete")
                .description("Soft delete via " + column)
                .tag("soft-delete");
        if (options.filterOnRead()) {
            bundle.policy(Policies.filter(Operation.READ,
                    ctx -> Collections.singletonMap(column, null),
                    PolicyOptions.named("soft-delete-filter", SOFT_DELETE_FILTER_PRIORITY)));
        }
        if (options.preventHardDelete()) {
            bundle.policy(Policies.deny(Operation.DELETE,
                    PolicyOptions.named("soft-delete-no-hard-delete", NO_DELETE_PRIORITY)));
        }
        return bundle.build();
    }

    // ----------------------------------------------------------------------
    // Status workflow
    // ----------------------------------------------------------------------

    /**
     * Empty status sets contribute no policy.
     *
     * @param statusColumn      column holding the row status, {@code status} by default
     * @param publicStatuses    statuses anyone may read
     * @param editableStatuses  the only statuses in which a row may be updated
     * @param deletableStatuses the only statuses in which a row may be deleted
     */
    @Builder
    public record StatusAccess(
            String statusColumn,
            Set<String> publicStatuses,
            Set<String> editableStatuses,
            Set<String> deletableStatuses
    ) {
        public StatusAccess {
            statusColumn = statusColumn != null ? statusColumn : "status";
            publicStatuses = publicStatuses != null ? Set.copyOf(publicStatuses) : Set.of();
            editableStatuses = editableStatuses != null ? Set.copyOf(editableStatuses) : Set.of();
            deletableStatuses = deletableStatuses != null ? Set.copyOf(deletableStatuses) : Set.of();
        }
    }

    public static ReusablePolicy statusAccess(StatusAccess options) {
        String column = options.statusColumn();
        ReusablePolicy.ReusablePolicyBuilder bundle = ReusablePolicy.builder()
                .name("statusAccess")
                .description("Status-based access via " + column)
                .tag("status");
        if (!options.publicStatuses().isEmpty()) {
            bundle.policy(Policies.allow(Operation.READ,
                    ctx -> hasStatus(ctx, column, options.publicStatuses()),
                    PolicyOptions.named("status-public-read")));
        }
        if (!options.editableStatuses().isEmpty()) {
            bundle.policy(Policies.deny(Operation.UPDATE,
                    ctx -> !hasStatus(ctx, column, options.editableStatuses()),
                    PolicyOptions.named("status-restrict-update", STATUS_DENY_PRIORITY)));
        }
        if (!options.deletableStatuses().isEmpty()) {
            bundle.policy(Policies.deny(Operation.DELETE,
                    ctx -> !hasStatus(ctx, column, options.deletableStatuses()),
                    PolicyOptions.named("status-restrict-delete", STATUS_DENY_PRIORITY)));
        }
        return bundle.build();
    }

    // ----------------------------------------------------------------------
    // Admin
    // ----------------------------------------------------------------------

    /**
     * Allows every operation to callers holding one of {@code roles}. Unlike
     * {@code skipFor}, higher-priority deny policies still apply.
     */
    public static ReusablePolicy admin(Collection<String> roles) {
        if (roles == null || roles.isEmpty()) {
            throw new ConfigurationException("Admin policy needs at least one role", RlsErrorCode.RLS_POLICY_INVALID);
        }
        List<String> adminRoles = new ArrayList<>(new LinkedHashSet<>(roles));
        return ReusablePolicy.builder()
                .name("adminBypass")
                .description("Admin access for roles: " + String.join(", ", adminRoles))
                .tag("admin")
                .policy(Policies.allow(Operation.ALL, ctx -> ctx.auth().hasAnyRole(adminRoles),
                        PolicyOptions.named("admin-bypass", ADMIN_PRIORITY)))
                .build();
    }

    // ----------------------------------------------------------------------
    // helpers
    // ----------------------------------------------------------------------

    // Compared as strings so numeric ids match their textual form.
    private static boolean isOwner(PolicyEvaluationContext ctx, String ownerColumn) {
        Object owner = ctx.rowValue(ownerColumn);
        return owner != null && Objects.equals(String.valueOf(owner), String.valueOf(ctx.auth().userId()));
    }

    private static boolean hasStatus(PolicyEvaluationContext ctx, String column, Set<String> statuses) {
        Object status = ctx.rowValue(column);
        return status != null && statuses.contains(String.valueOf(status));
    }

    private static boolean hasDataKey(PolicyEvaluationContext ctx, String column) {
        return ctx.data() != null && ctx.data().containsKey(column);
    }
}
