package com.example.messaging.chat.service;

import com.example.messaging.shared.config.AppProperties;
import com.example.messaging.shared.exception.AlreadyVotedException;
import com.example.messaging.shared.exception.InvalidInputException;
import com.example.messaging.shared.exception.InvalidOptionException;
import com.example.messaging.shared.exception.PollClosedException;
import com.example.messaging.shared.exception.ResourceNotFoundException;
import com.example.messaging.shared.model.Poll;
import com.example.messaging.shared.model.PollOption;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Poll lifecycle over an immutable option set: create, vote, tally, close.
 * <p>
 * A vote increments one tally and records the voter in a single step, so the sum of tallies
 * always equals the number of voters. Local votes stay unconfirmed until the backing service
 * acknowledges them and are rolled back if it does not.
 * <p>
 * A discarded poll is forgotten and never registered again.
 */
@Component
@Slf4j
public class PollEngine {

    private final Map<String, PollRecord> polls = new ConcurrentHashMap<>();
    private final Cache<String, Boolean> discardedPolls;
    private final int minOptions;
    private final int maxOptions;

    public PollEngine(AppProperties appProperties) {
        this.minOptions = appProperties.getPoll().getMinOptions();
        this.maxOptions = appProperties.getPoll().getMaxOptions();
        this.discardedPolls = Caffeine.newBuilder()
                .maximumSize(appProperties.getReconciliation().getRetiredIdMaxSize())
                .build();
    }

    public void validateDefinition(String question, List<String> options) {
        if (question == null || question.isBlank()) {
            throw new InvalidInputException("Poll question must not be empty");
        }
        if (options == null || options.size() < minOptions) {
            throw new InvalidInputException("A poll needs at least " + minOptions + " options");
        }
        if (options.size() > maxOptions) {
            throw new InvalidInputException("A poll may have at most " + maxOptions + " options");
        }
        for (int i = 0; i < options.size(); i++) {
            String option = options.get(i);
            if (option == null || option.isBlank()) {
                throw new InvalidInputException("Poll option " + (i + 1) + " must not be empty");
            }
        }
    }

    public Poll create(String pollId, String messageId, String conversationId, String question, List<String> options) {
        validateDefinition(question, options);
        List<String> optionTexts = options.stream().map(String::trim).toList();
        PollRecord record = new PollRecord(pollId, messageId, conversationId, question.trim(), optionTexts);
        if (polls.putIfAbsent(pollId, record) != null) {
            throw new IllegalStateException("Poll " + pollId + " already exists");
        }
        log.info("Poll {} created in conversation {} with {} options", pollId, conversationId, optionTexts.size());
        return record.snapshot();
    }

    /**
     * Registers a poll first seen through the backing service, votes included.
     * A poll that is already known keeps its local state. A discarded poll, or a snapshot whose
     * tallies do not add up to its voters, is refused.
     */
    public Optional<Poll> registerRemote(Poll remote) {
        if (isDiscarded(remote.getId())) {
            log.debug("Poll {} was discarded locally, snapshot ignored", remote.getId());
            return Optional.empty();
        }
        PollRecord existing = polls.get(remote.getId());
        if (existing != null) {
            return Optional.of(existing.snapshot());
        }
        String problem = inconsistency(remote);
        if (problem != null) {
            log.warn("Refusing snapshot of poll {}: {}", remote.getId(), problem);
            return Optional.empty();
        }
        PollRecord record = polls.computeIfAbsent(remote.getId(), id -> {
            PollRecord created = new PollRecord(id, remote.getMessageId(), remote.getConversationId(), remote.getQuestion(),
                    remote.getOptions().stream().map(PollOption::getText).toList());
            // The snapshot carries totals only; any assignment of voters to options matching them recounts the same
            int optionIndex = 0;
            long remaining = remote.getOptions().get(0).getTally();
            Set<String> voterIds = remote.getVoterIds() == null ? Set.of() : remote.getVoterIds();
            for (String voterId : voterIds) {
                while (remaining == 0) {
                    optionIndex++;
                    remaining = remote.getOptions().get(optionIndex).getTally();
                }
                created.addVote(voterId, optionIndex, true);
                remaining--;
            }
            if (remote.isClosed()) {
                created.close();
            }
            return created;
        });
        return Optional.of(record.snapshot());
    }

    /**
     * Records a local vote, unconfirmed until {@link #confirmVote} or {@link #rollbackVote}.
     * Checks run in order: closed, already voted, option range.
     */
    public Poll recordVote(String pollId, String voterId, int optionIndex) {
        if (voterId == null || voterId.isBlank()) {
            throw new InvalidInputException("Voter id must not be empty");
        }
        PollRecord record = require(pollId);
        synchronized (record) {
            if (record.isClosed()) {
                throw new PollClosedException("Poll " + pollId + " is closed");
            }
            if (record.hasVoted(voterId)) {
                throw new AlreadyVotedException("Participant " + voterId + " already voted on poll " + pollId);
            }
            if (optionIndex < 0 || optionIndex >= record.optionCount()) {
                throw new InvalidOptionException("Option " + optionIndex + " does not exist on poll " + pollId
                        + " (" + record.optionCount() + " options)");
            }
            record.addVote(voterId, optionIndex, false);
            return record.snapshot();
        }
    }

    public void confirmVote(String pollId, String voterId) {
        PollRecord record = polls.get(pollId);
        if (record != null && record.confirm(voterId)) {
            log.debug("Vote of {} on poll {} confirmed", voterId, pollId);
        }
    }

    /**
     * @return true if an unconfirmed vote was removed
     */
    public boolean rollbackVote(String pollId, String voterId) {
        PollRecord record = polls.get(pollId);
        return record != null && record.rollback(voterId);
    }

    /**
     * Applies a vote reported by the backing service.
     *
     * @return true if the tally changed
     */
    public boolean applyRemoteVote(String pollId, String voterId, int optionIndex) {
        PollRecord record = require(pollId);
        synchronized (record) {
            if (record.hasVoted(voterId)) {
                // Echo of our own vote, or a duplicate delivery
                record.confirm(voterId);
                return false;
            }
            if (record.isClosed()) {
                log.warn("Ignoring remote vote of {} on closed poll {}", voterId, pollId);
                return false;
            }
            if (optionIndex < 0 || optionIndex >= record.optionCount()) {
                log.warn("Ignoring remote vote of {} on poll {} for unknown option {}", voterId, pollId, optionIndex);
                return false;
            }
            record.addVote(voterId, optionIndex, true);
            return true;
        }
    }

    public Poll close(String pollId) {
        PollRecord record = require(pollId);
        synchronized (record) {
            if (!record.isClosed()) {
                record.close();
                log.info("Poll {} closed", pollId);
            }
            return record.snapshot();
        }
    }

    public Poll snapshot(String pollId) {
        return require(pollId).snapshot();
    }

    /**
     * Forgets a poll whose hosting message was discarded. Later votes and lookups fail with not found.
     */
    public void discard(String pollId) {
        discardedPolls.put(pollId, Boolean.TRUE);
        if (polls.remove(pollId) != null) {
            log.info("Poll {} discarded", pollId);
        }
    }

    public boolean isDiscarded(String pollId) {
        return discardedPolls.getIfPresent(pollId) != null;
    }

    public boolean isKnown(String pollId) {
        return polls.containsKey(pollId);
    }

    public String conversationOf(String pollId) {
        return require(pollId).conversationId;
    }

    /**
     * Recounts the votes of a poll and compares with the incremental tallies.
     *
     * @throws IllegalStateException if they diverge
     */
    public void verifyTally(String pollId) {
        PollRecord record = require(pollId);
        synchronized (record) {
            long[] tallies = record.tallies();
            long[] recount = record.recount();
            if (!Arrays.equals(tallies, recount)) {
                throw new IllegalStateException("Tally of poll " + pollId + " is " + Arrays.toString(tallies)
                        + " but a recount gives " + Arrays.toString(recount));
            }
        }
    }

    private static String inconsistency(Poll remote) {
        if (remote.getOptions() == null || remote.getOptions().isEmpty()) {
            return "no options";
        }
        long total = 0;
        for (PollOption option : remote.getOptions()) {
            if (option.getTally() < 0) {
                return "negative tally on option '" + option.getText() + "'";
            }
            total += option.getTally();
        }
        int voters = remote.getVoterIds() == null ? 0 : remote.getVoterIds().size();
        if (total != voters) {
            return "tallies sum to " + total + " but " + voters + " participants voted";
        }
        return null;
    }

    private PollRecord require(String pollId) {
        PollRecord record = polls.get(pollId);
        if (record == null) {
            throw new ResourceNotFoundException("Poll not found: " + pollId);
        }
        return record;
    }
}
