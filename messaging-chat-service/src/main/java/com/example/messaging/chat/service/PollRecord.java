package com.example.messaging.chat.service;

import com.example.messaging.shared.model.Poll;
import com.example.messaging.shared.model.PollOption;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable poll state. Guarded by its own monitor so a snapshot always sees tallies and
 * voters from the same point in time.
 */
final class PollRecord {

    final String id;
    final String messageId;
    final String conversationId;
    final String question;
    final List<String> optionTexts;

    private final long[] tallies;
    private final Map<String, Integer> votes = new LinkedHashMap<>();   // voter -> option index
    private final Set<String> unconfirmedVoters = new LinkedHashSet<>();
    private final Set<String> failedVoters = new LinkedHashSet<>();
    private boolean closed;

    PollRecord(String id, String messageId, String conversationId, String question, List<String> optionTexts) {
        this.id = id;
        this.messageId = messageId;
        this.conversationId = conversationId;
        this.question = question;
        this.optionTexts = List.copyOf(optionTexts);
        this.tallies = new long[optionTexts.size()];
    }

    synchronized boolean isClosed() {
        return closed;
    }

    synchronized void close() {
        closed = true;
    }

    synchronized boolean hasVoted(String voterId) {
        return votes.containsKey(voterId);
    }

    int optionCount() {
        return tallies.length;
    }

    synchronized void addVote(String voterId, int optionIndex, boolean confirmed) {
        votes.put(voterId, optionIndex);
        tallies[optionIndex]++;
        failedVoters.remove(voterId);
        if (!confirmed) {
            unconfirmedVoters.add(voterId);
        }
    }

    synchronized boolean confirm(String voterId) {
        return unconfirmedVoters.remove(voterId);
    }

    /**
     * Undoes an unconfirmed vote. Confirmed votes are never rolled back.
     */
    synchronized boolean rollback(String voterId) {
        if (!unconfirmedVoters.remove(voterId)) {
            return false;
        }
        Integer optionIndex = votes.remove(voterId);
        tallies[optionIndex]--;
        failedVoters.add(voterId);
        return true;
    }

    synchronized long[] recount() {
        long[] counts = new long[tallies.length];
        for (int optionIndex : votes.values()) {
            counts[optionIndex]++;
        }
        return counts;
    }

    synchronized long[] tallies() {
        return tallies.clone();
    }

    synchronized Poll snapshot() {
        List<PollOption> options = new ArrayList<>(tallies.length);
        for (int i = 0; i < tallies.length; i++) {
            options.add(new PollOption(optionTexts.get(i), tallies[i]));
        }
        return Poll.builder()
                .id(id)
                .messageId(messageId)
                .conversationId(conversationId)
                .question(question)
                .options(List.copyOf(options))
                .voterIds(Set.copyOf(votes.keySet()))
                .failedVoterIds(Set.copyOf(failedVoters))
                .closed(closed)
                .build();
    }
}
