package com.piggyboss.vault.services;

import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.piggyboss.vault.pojos.Deposit;
import com.piggyboss.vault.pojos.SavingsPlan;
import com.piggyboss.vault.pojos.UserAggregate;
import com.piggyboss.vault.pojos.VaultEvent;
import com.piggyboss.vault.pojos.VaultRecords;
import com.piggyboss.vault.pojos.YieldPosition;

import java.util.List;
import java.util.concurrent.ExecutionException;

/**
 * {@link VaultStore} on Firestore.
 *
 * <pre>
 * vault/state                     version, counters, multipliers, pause flag, reward pool
 * vault_plans/{planId}            plan terms and explicit multiplier
 * vault_deposits/{depositId}      deposit, including the plan terms it was opened with
 * vault_positions/{positionId}    accrual state
 * vault_users/{userId}            per-user aggregate
 * vault_events/{sequence}         audit trail, zero-padded ids
 * </pre>
 *
 * Commits run in one Firestore transaction that first checks {@code vault/state.version}.
 */
public class FirestoreVaultStore implements VaultStore {

    static final String STATE_COLLECTION = "vault";
    static final String STATE_DOCUMENT = "state";
    static final String PLANS = "vault_plans";
    static final String DEPOSITS = "vault_deposits";
    static final String POSITIONS = "vault_positions";
    static final String USERS = "vault_users";
    static final String EVENTS = "vault_events";

    private final Firestore db;

    public FirestoreVaultStore(Firestore db) {
        this.db = db;
    }

    @Override
    public long currentVersion() throws StoreException {
        try {
            DocumentSnapshot state = stateRef().get().get();
            return state.exists() ? versionOf(state) : 0L;
        } catch (ExecutionException e) {
            throw unavailable("read vault version", e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw unavailable("read vault version", e);
        }
    }

    @Override
    public VaultRecords load() throws StoreException {
        try {
            DocumentSnapshot state = stateRef().get().get();
            if (!state.exists()) {
                return null;
            }
            VaultRecords records = new VaultRecords();
            VaultDocuments.controlsInto(state.getData(), records);

            for (QueryDocumentSnapshot doc : documents(PLANS)) {
                SavingsPlan plan = VaultDocuments.planFromMap(doc.getData());
                records.getPlans().add(plan);
                Integer multiplier = VaultDocuments.multiplierFromMap(doc.getData());
                if (multiplier != null) {
                    records.getPlanMultipliers().put(plan.getPlanId(), multiplier);
                }
            }
            for (QueryDocumentSnapshot doc : documents(DEPOSITS)) {
                records.getDeposits().add(VaultDocuments.depositFromMap(doc.getData()));
            }
            for (QueryDocumentSnapshot doc : documents(POSITIONS)) {
                records.getPositions().add(VaultDocuments.positionFromMap(doc.getData()));
            }
            for (QueryDocumentSnapshot doc : documents(USERS)) {
                records.getUsers().add(VaultDocuments.userFromMap(doc.getData()));
            }
            for (QueryDocumentSnapshot doc : db.collection(EVENTS).orderBy("sequence").get().get().getDocuments()) {
                records.getEvents().add(VaultDocuments.eventFromMap(doc.getData()));
            }
            return records;
        } catch (ExecutionException e) {
            throw unavailable("load vault records", e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw unavailable("load vault records", e);
        }
    }

    @Override
    public long commit(long expectedVersion, VaultRecords changes) throws StoreException {
        try {
            return db.runTransaction(transaction -> {
                // All reads before any write
                DocumentSnapshot state = transaction.get(stateRef()).get();
                long stored = state.exists() ? versionOf(state) : 0L;
                if (stored != expectedVersion) {
                    throw new StoreException(StoreException.Reason.CONFLICT,
                            "Expected version " + expectedVersion + " but store is at " + stored);
                }

                for (SavingsPlan plan : changes.getPlans()) {
                    transaction.set(db.collection(PLANS).document(String.valueOf(plan.getPlanId())),
                            VaultDocuments.planToMap(plan, changes.getPlanMultipliers().get(plan.getPlanId())));
                }
                for (Deposit deposit : changes.getDeposits()) {
                    transaction.set(db.collection(DEPOSITS).document(String.valueOf(deposit.getId())),
                            VaultDocuments.depositToMap(deposit));
                }
                for (YieldPosition position : changes.getPositions()) {
                    transaction.set(db.collection(POSITIONS).document(String.valueOf(position.getId())),
                            VaultDocuments.positionToMap(position));
                }
                for (UserAggregate aggregate : changes.getUsers()) {
                    transaction.set(db.collection(USERS).document(aggregate.getUser()),
                            VaultDocuments.userToMap(aggregate));
                }
                for (VaultEvent event : changes.getEvents()) {
                    transaction.set(db.collection(EVENTS).document(VaultDocuments.eventId(event.getSequence())),
                            VaultDocuments.eventToMap(event));
                }
                transaction.set(stateRef(), VaultDocuments.controlsToMap(changes, stored + 1));
                return stored + 1;
            }).get();
        } catch (ExecutionException e) {
            StoreException rejected = findCause(e, StoreException.class);
            if (rejected != null) {
                throw rejected;
            }
            throw unavailable("commit vault records", e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw unavailable("commit vault records", e);
        }
    }

    private DocumentReference stateRef() {
        return db.collection(STATE_COLLECTION).document(STATE_DOCUMENT);
    }

    private List<QueryDocumentSnapshot> documents(String collection) throws ExecutionException, InterruptedException {
        return db.collection(collection).get().get().getDocuments();
    }

    private static long versionOf(DocumentSnapshot state) {
        Long version = state.getLong("version");
        return version != null ? version : 0L;
    }

    private static StoreException unavailable(String action, Throwable cause) {
        LoggingService.error("firestore_" + action.replace(' ', '_') + "_failed", cause);
        return new StoreException(StoreException.Reason.UNAVAILABLE, "Failed to " + action, cause);
    }

    /** First cause of type {@code type} in the chain of {@code error}, or null. */
    static <T extends Throwable> T findCause(Throwable error, Class<T> type) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (type.isInstance(cause)) {
                return type.cast(cause);
            }
        }
        return null;
    }
}
