package com.piggyboss.vault.services;

import com.piggyboss.vault.pojos.VaultRecords;

/**
 * Durable home of the vault's deposits, positions, aggregates, plans, reward pool and event log.
 *
 * <p>Every commit bumps a version number. A commit names the version it was computed against
 * and is rejected with {@link StoreException.Reason#CONFLICT} if anyone committed in between,
 * so two writers can never silently overwrite each other.</p>
 */
public interface VaultStore {

    /**
     * @return the version of the latest commit, 0 while nothing has been stored
     */
    long currentVersion() throws StoreException;

    /**
     * @return every stored record, or null while nothing has been stored
     */
    VaultRecords load() throws StoreException;

    /**
     * Upsert {@code changes} atomically. Deposits, positions, users and plans replace the stored
     * record with the same key; events are appended.
     *
     * @return the new version
     */
    long commit(long expectedVersion, VaultRecords changes) throws StoreException;
}
