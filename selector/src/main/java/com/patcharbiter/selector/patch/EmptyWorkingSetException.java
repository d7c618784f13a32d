package com.patcharbiter.selector.patch;

/**
 * Thrown when every candidate of a group has an empty diff, leaving nothing
 * to choose from.
 */
public class EmptyWorkingSetException extends RuntimeException {

    public EmptyWorkingSetException(String instanceId, int groupId) {
        super("Group " + groupId + " of " + instanceId + " has no non-empty candidate patch");
    }
}
