package com.questrail.expectations.manifest;

/**
 * Summary of what one {@link TestNode#coalesce()} call changed.
 *
 * @param updated number of stored entries whose value was rewritten
 * @param removed number of stored entries dropped
 * @param added   number of entries written from unplaced evidence
 */
public record CoalesceOutcome(int updated, int removed, int added)
{
    public static final CoalesceOutcome UNCHANGED = new CoalesceOutcome(0, 0, 0);

    public boolean changed() {
        return updated > 0 || removed > 0 || added > 0;
    }
}
