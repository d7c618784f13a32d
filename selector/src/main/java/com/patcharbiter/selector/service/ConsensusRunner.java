package com.patcharbiter.selector.service;

import com.patcharbiter.selector.agent.EpisodeResult;
import com.patcharbiter.selector.config.SelectorProperties;
import com.patcharbiter.selector.model.CandidatePatch;
import com.patcharbiter.selector.model.VotingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Majority voting over repeated selection episodes.
 *
 * Episodes run strictly one after another. Voting stops as soon as one
 * candidate holds more than half of the planned rounds. The winner is the
 * candidate with the most votes; on a tie, the one that reached its final
 * count first. Its patch text is taken from the first episode that chose it.
 */
@Component
public class ConsensusRunner {

    private static final Logger log = LoggerFactory.getLogger(ConsensusRunner.class);

    /** Runs the episode of one 1-based round. */
    @FunctionalInterface
    public interface EpisodeRunner {
        EpisodeResult run(int round);
    }

    public record Consensus(CandidatePatch chosen, String patchText, List<VotingRecord> votes) {}

    private final boolean majorityVoting;

    public ConsensusRunner(SelectorProperties properties) {
        this.majorityVoting = properties.majorityVoting();
    }

    public Consensus decide(int rounds, EpisodeRunner episodes) {
        if (rounds <= 0) {
            throw new IllegalArgumentException("rounds must be positive: " + rounds);
        }
        if (!majorityVoting) {
            EpisodeResult only = episodes.run(1);
            VotingRecord vote = new VotingRecord(1, only.chosen().id(), only.chosen().rawDiff());
            return new Consensus(only.chosen(), only.chosen().rawDiff(), List.of(vote));
        }

        List<VotingRecord>          votes  = new ArrayList<>();
        Map<Integer, CandidatePatch> byId  = new HashMap<>();
        Map<Integer, Integer>       counts = new LinkedHashMap<>();

        for (int round = 1; round <= rounds; round++) {
            CandidatePatch chosen = episodes.run(round).chosen();
            votes.add(new VotingRecord(round, chosen.id(), chosen.rawDiff()));
            byId.putIfAbsent(chosen.id(), chosen);
            int count = counts.merge(chosen.id(), 1, Integer::sum);
            log.info("Round {}/{} voted for candidate {} ({} votes)", round, rounds, chosen.id(), count);
            if (count * 2 > rounds) {
                break;
            }
        }

        int winner = winner(votes);
        String patchText = votes.stream()
                .filter(v -> v.chosenId() == winner)
                .findFirst()
                .map(VotingRecord::patchText)
                .orElseThrow();
        log.info("Voting finished after {} rounds: {} -> candidate {}",
                votes.size(), votes.stream().map(VotingRecord::chosenId).toList(), winner);
        return new Consensus(byId.get(winner), patchText, List.copyOf(votes));
    }

    // Most votes; ties go to the id whose last vote came earliest.
    static int winner(List<VotingRecord> votes) {
        Map<Integer, Integer> counts    = new HashMap<>();
        Map<Integer, Integer> lastRound = new HashMap<>();
        for (VotingRecord vote : votes) {
            counts.merge(vote.chosenId(), 1, Integer::sum);
            lastRound.put(vote.chosenId(), vote.round());
        }
        int best = -1;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            int id = entry.getKey();
            if (best < 0
                    || entry.getValue() > counts.get(best)
                    || (entry.getValue().equals(counts.get(best)) && lastRound.get(id) < lastRound.get(best))) {
                best = id;
            }
        }
        return best;
    }
}
