package com.example.messaging.shared.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Read-only view of a poll. The sum of option tallies always equals the number of voters.
 */
@Value
@Builder(toBuilder = true)
public class Poll {
    String id;
    String messageId;
    String conversationId;
    String question;
    List<PollOption> options;
    Set<String> voterIds;
    Set<String> failedVoterIds;
    boolean closed;

    public long totalVotes() {
        return options.stream().mapToLong(PollOption::getTally).sum();
    }
}
