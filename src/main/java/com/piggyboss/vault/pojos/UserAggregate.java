package com.piggyboss.vault.pojos;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-user counters updated alongside every deposit mutation.
 * Purely additive bookkeeping; the deposit log stays authoritative.
 */
public class UserAggregate {
    private String user;
    private BigInteger totalDeposited = BigInteger.ZERO;
    private BigInteger totalEarned = BigInteger.ZERO;
    private BigInteger totalWithdrawn = BigInteger.ZERO;
    private long transactionCount;
    private long lastActivity;
    private Integer preferredPlan;
    private final Map<Integer, Integer> planUsage = new LinkedHashMap<>();
    private final Set<String> awardedCategories = new LinkedHashSet<>();
    private final List<Long> depositIds = new ArrayList<>();

    public UserAggregate(String user) {
        this.user = user;
    }

    public UserAggregate(UserAggregate other) {
        this.user = other.user;
        this.totalDeposited = other.totalDeposited;
        this.totalEarned = other.totalEarned;
        this.totalWithdrawn = other.totalWithdrawn;
        this.transactionCount = other.transactionCount;
        this.lastActivity = other.lastActivity;
        this.preferredPlan = other.preferredPlan;
        this.planUsage.putAll(other.planUsage);
        this.awardedCategories.addAll(other.awardedCategories);
        this.depositIds.addAll(other.depositIds);
    }

    /**
     * Rebuild an aggregate from stored counters.
     */
    public static UserAggregate restore(String user, BigInteger totalDeposited, BigInteger totalEarned,
                                        BigInteger totalWithdrawn, long transactionCount, long lastActivity,
                                        Integer preferredPlan, Map<Integer, Integer> planUsage,
                                        Collection<String> awardedCategories, Collection<Long> depositIds) {
        UserAggregate aggregate = new UserAggregate(user);
        aggregate.totalDeposited = totalDeposited;
        aggregate.totalEarned = totalEarned;
        aggregate.totalWithdrawn = totalWithdrawn;
        aggregate.transactionCount = transactionCount;
        aggregate.lastActivity = lastActivity;
        aggregate.preferredPlan = preferredPlan;
        aggregate.planUsage.putAll(planUsage);
        aggregate.awardedCategories.addAll(awardedCategories);
        aggregate.depositIds.addAll(depositIds);
        return aggregate;
    }

    public String getUser() { return user; }
    public BigInteger getTotalDeposited() { return totalDeposited; }
    public BigInteger getTotalEarned() { return totalEarned; }
    public BigInteger getTotalWithdrawn() { return totalWithdrawn; }
    public long getTransactionCount() { return transactionCount; }
    public long getLastActivity() { return lastActivity; }
    public Integer getPreferredPlan() { return preferredPlan; }

    public Map<Integer, Integer> getPlanUsage() {
        return Collections.unmodifiableMap(planUsage);
    }

    public Set<String> getAwardedCategories() {
        return Collections.unmodifiableSet(awardedCategories);
    }

    public List<Long> getDepositIds() {
        return Collections.unmodifiableList(depositIds);
    }

    public void recordDeposit(long depositId, int planId, BigInteger amount, long now) {
        depositIds.add(depositId);
        totalDeposited = totalDeposited.add(amount);
        int uses = planUsage.merge(planId, 1, Integer::sum);
        // Ties go to the most recent plan
        if (preferredPlan == null || uses >= planUsage.getOrDefault(preferredPlan, 0)) {
            preferredPlan = planId;
        }
        touch(now);
    }

    public void recordWithdrawal(BigInteger payout, BigInteger earned, long now) {
        totalWithdrawn = totalWithdrawn.add(payout);
        totalEarned = totalEarned.add(earned);
        touch(now);
    }

    /**
     * Undo one {@link #recordWithdrawal} whose payout was rolled back. Last activity is left as is.
     */
    public void revertWithdrawal(BigInteger payout, BigInteger earned) {
        totalWithdrawn = totalWithdrawn.subtract(payout);
        totalEarned = totalEarned.subtract(earned);
        transactionCount--;
    }

    public boolean hasAwarded(String category) {
        return awardedCategories.contains(category);
    }

    public void markAwarded(String category) {
        awardedCategories.add(category);
    }

    private void touch(long now) {
        transactionCount++;
        lastActivity = Math.max(lastActivity, now);
    }
}
