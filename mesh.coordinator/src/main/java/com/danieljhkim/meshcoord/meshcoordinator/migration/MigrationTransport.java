package com.danieljhkim.meshcoord.meshcoordinator.migration;

/**
 * Data plane used by the migrator. Implementations signal failure with unchecked exceptions, typically
 * {@link com.danieljhkim.meshcoord.meshcommon.exception.NetworkException}.
 */
public interface MigrationTransport {

    /**
     * Reserves room for the allocation on the target.
     */
    void prepare(MigrationPlan plan);

    /**
     * Copies the allocation's data to the target.
     *
     * @return bytes transferred
     */
    long transfer(MigrationPlan plan);

    /**
     * Checks that the target copy is complete and consistent.
     */
    void verify(MigrationPlan plan);

    /**
     * Makes the target copy the live one. Called after placement has moved.
     */
    void activate(MigrationPlan plan);
}
