package com.brigade.vacuum.core.model;

/**
 * What happened to one resource while deleting a build.
 *
 * @param kind   worker or record
 * @param name   resource name
 * @param status deleted, skipped or failed
 * @param detail human readable reason; empty for plain deletions
 */
public record ResourceOutcome(
    ResourceKind kind,
    String name,
    Status status,
    String detail
) {
    public enum Status { DELETED, SKIPPED, FAILED }

    public static ResourceOutcome deleted(ResourceKind kind, String name) {
        return new ResourceOutcome(kind, name, Status.DELETED, "");
    }

    public static ResourceOutcome skipped(ResourceKind kind, String name, String reason) {
        return new ResourceOutcome(kind, name, Status.SKIPPED, reason);
    }

    public static ResourceOutcome failed(ResourceKind kind, String name, String error) {
        return new ResourceOutcome(kind, name, Status.FAILED, error);
    }
}
