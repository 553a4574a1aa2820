package com.demo.triage.service;

import com.demo.triage.config.MatcherProperties;
import com.demo.triage.domain.Issue;
import com.demo.triage.domain.MatchDecision;
import com.demo.triage.domain.Message;
import com.demo.triage.domain.VectorMath;
import com.demo.triage.exception.IssueIntegrityException;
import com.demo.triage.infrastructure.IssueStore;
import com.demo.triage.infrastructure.MatchLock;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Assigns a classified, relevant message to the most similar issue or opens a new one.
 *
 * <p>The whole read-candidates, score, create-or-append sequence runs under the
 * {@link MatchLock}, and so does the post-commit callback. Two messages about a new
 * topic therefore cannot both create an issue, two attaches to one issue cannot lose
 * a centroid update, and callbacks observe decisions in commit order.
 */
@Service
@Slf4j
public class IssueMatcher {

    private final IssueStore issueStore;
    private final MatchLock matchLock;
    private final MatcherProperties properties;
    private final IssueTextDeriver textDeriver;
    private final Clock clock;

    public IssueMatcher(IssueStore issueStore,
                        MatchLock matchLock,
                        MatcherProperties properties,
                        IssueTextDeriver textDeriver,
                        Clock clock) {
        this.issueStore = issueStore;
        this.matchLock = matchLock;
        this.properties = properties;
        this.textDeriver = textDeriver;
        this.clock = clock;
    }

    /**
     * Matches and commits.
     *
     * @param afterCommit runs inside the lock once the decision is durably stored
     */
    public MatchDecision match(Message message, Consumer<MatchDecision> afterCommit) {
        requireMatchable(message);

        return matchLock.execute(() -> {
            boolean includeResolved = properties.getResolvedPolicy() == MatcherProperties.ResolvedPolicy.REOPEN;
            List<Issue> candidates = issueStore.listMatchCandidates(includeResolved);
            Optional<ScoredIssue> best = selectBest(message.getEmbedding(), candidates, properties.getTieEpsilon());

            MatchDecision decision;
            if (best.isPresent() && best.get().getSimilarity() >= properties.getSimilarityThreshold()) {
                decision = attach(message, best.get());
            } else {
                decision = create(message, best.map(ScoredIssue::getSimilarity).orElse(Double.NaN));
            }

            afterCommit.accept(decision);
            return decision;
        });
    }

    /**
     * Highest similarity wins; ties within {@code epsilon} go to the most recently
     * updated issue, then to the lowest id.
     */
    static Optional<ScoredIssue> selectBest(double[] embedding, List<Issue> candidates, double epsilon) {
        ScoredIssue best = null;
        for (Issue candidate : candidates) {
            if (candidate.getDimension() != embedding.length) {
                throw new IssueIntegrityException("Issue " + candidate.getId() + " has dimension "
                        + candidate.getDimension() + ", message embedding has " + embedding.length);
            }
            ScoredIssue scored = new ScoredIssue(candidate,
                    VectorMath.cosine(embedding, candidate.getRepresentativeEmbedding()));
            if (best == null || beats(scored, best, epsilon)) {
                best = scored;
            }
        }
        return Optional.ofNullable(best);
    }

    private static boolean beats(ScoredIssue challenger, ScoredIssue incumbent, double epsilon) {
        double delta = challenger.getSimilarity() - incumbent.getSimilarity();
        if (Math.abs(delta) > epsilon) {
            return delta > 0;
        }
        return RECENCY.compare(challenger.getIssue(), incumbent.getIssue()) < 0;
    }

    private static final Comparator<Issue> RECENCY = Comparator
            .comparing(Issue::getUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(Issue::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private MatchDecision create(Message message, double bestSimilarity) {
        Instant now = clock.instant();
        Issue issue = Issue.seed(message, textDeriver.title(message), textDeriver.summary(message), now);
        Issue saved = issueStore.createIssue(issue, message);

        log.info("Created issue: issueId={}, messageId={}, classification={}, bestSimilarity={}",
                saved.getId(), message.getId(), saved.getClassification(), format(bestSimilarity));

        return MatchDecision.builder()
                .outcome(MatchDecision.Outcome.CREATED)
                .issue(saved)
                .message(message)
                .similarity(bestSimilarity)
                .build();
    }

    private MatchDecision attach(Message message, ScoredIssue target) {
        Instant now = clock.instant();
        Issue issue = target.getIssue();
        boolean reopening = !issue.isOpen();

        issue.absorb(message, now);
        boolean retitled = issue.offerDescription(
                textDeriver.title(message), textDeriver.summary(message), message.getConfidence());
        if (reopening) {
            issue.reopen(now);
        }
        Issue saved = issueStore.appendMessageToIssue(issue, message);

        log.info("Attached message: issueId={}, messageId={}, similarity={}, members={}, retitled={}, reopened={}",
                saved.getId(), message.getId(), format(target.getSimilarity()),
                saved.getMemberCount(), retitled, reopening);

        return MatchDecision.builder()
                .outcome(reopening ? MatchDecision.Outcome.REOPENED : MatchDecision.Outcome.ATTACHED)
                .issue(saved)
                .message(message)
                .similarity(target.getSimilarity())
                .build();
    }

    private static void requireMatchable(Message message) {
        if (message.getId() == null) {
            throw new IllegalArgumentException("Message must be stored before matching");
        }
        if (message.getText() == null || message.getClassification() == null
                || message.getConfidence() == null || message.getEmbedding() == null) {
            throw new IllegalArgumentException("Message " + message.getId()
                    + " is not classified and embedded");
        }
        if (!Boolean.TRUE.equals(message.getRelevant())) {
            throw new IllegalArgumentException("Message " + message.getId() + " is not relevant");
        }
        if (message.getIssueId() != null) {
            throw new IssueIntegrityException("Message " + message.getId()
                    + " already belongs to issue " + message.getIssueId());
        }
    }

    private static String format(double similarity) {
        return Double.isNaN(similarity) ? "none" : String.format("%.3f", similarity);
    }

    @Value
    static class ScoredIssue {
        Issue issue;
        double similarity;
    }
}
