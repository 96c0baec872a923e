package com.piggyboss.vault.services;

/**
 * Achievement side channel: mints a badge when a user reaches a reward category.
 * Fire-and-forget; the vault ignores the outcome and never fails because of it.
 */
public interface RewardNotifier {

    void notify(String user, String categoryKey);
}
