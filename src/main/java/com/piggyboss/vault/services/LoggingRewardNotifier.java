package com.piggyboss.vault.services;

import java.util.Map;

/**
 * {@link RewardNotifier} that only records the milestone in the structured log,
 * where the badge minting job picks it up.
 */
public class LoggingRewardNotifier implements RewardNotifier {

    @Override
    public void notify(String user, String categoryKey) {
        LoggingService.info("reward_milestone_reached", Map.of("user", user, "category", categoryKey));
    }
}
