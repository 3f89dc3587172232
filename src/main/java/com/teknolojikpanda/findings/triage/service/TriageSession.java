package com.teknolojikpanda.findings.triage.service;

import com.teknolojikpanda.findings.synth.api.DecisionProvider;
import com.teknolojikpanda.findings.synth.api.TriageCanceledException;
import com.teknolojikpanda.findings.synth.api.TriageListener;
import com.teknolojikpanda.findings.synth.model.Finding;
import com.teknolojikpanda.findings.synth.model.FindingEdit;
import com.teknolojikpanda.findings.synth.model.FindingPresentation;
import com.teknolojikpanda.findings.synth.model.TriageDecision;
import com.teknolojikpanda.findings.synth.model.TriageOutcome;
import com.teknolojikpanda.findings.synth.model.TriageResponse;
import com.teknolojikpanda.findings.triage.util.LogContext;
import com.teknolojikpanda.findings.triage.util.LogEvent;
import com.teknolojikpanda.findings.triage.util.LogSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Walks the sorted queue one finding at a time and records exactly one terminal decision per
 * finding.
 * <p>
 * Each finding is presented, then accepted, skipped or edited. An edit substitutes the modified
 * finding and presents it again; accepting it afterwards records {@link TriageOutcome#EDITED},
 * skipping it discards the edits. Cancellation is honoured between findings only: either through
 * {@link #cancel()} or a {@link TriageCanceledException} from the decision provider, which
 * abandons the finding being decided without recording anything for it. A cancelled session
 * keeps its cursor and decisions and continues where it stopped when {@link #run()} is called
 * again.
 * <p>
 * Not thread-safe apart from {@link #cancel()}, which may be called from any thread.
 */
public class TriageSession {

    private static final Logger log = LoggerFactory.getLogger(TriageSession.class);

    private final String sessionId;
    private final List<Finding> queue;
    private final DecisionProvider provider;
    private final Clock clock;
    private final List<TriageListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, TriageDecision> decisions = new LinkedHashMap<>();
    private final Map<String, Finding> taskFindings = new LinkedHashMap<>();
    private final Map<TriageOutcome, Integer> counts = new EnumMap<>(TriageOutcome.class);
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    private volatile TriageSessionStatus status = TriageSessionStatus.NOT_STARTED;
    private int cursor;
    private Instant startTime;
    private Instant endTime;

    public TriageSession(@Nonnull List<Finding> queue, @Nonnull DecisionProvider provider) {
        this(UUID.randomUUID().toString(), queue, provider, Clock.systemUTC());
    }

    public TriageSession(@Nonnull String sessionId,
                         @Nonnull List<Finding> queue,
                         @Nonnull DecisionProvider provider,
                         @Nonnull Clock clock) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.queue = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(queue, "queue")));
        this.provider = Objects.requireNonNull(provider, "provider");
        this.clock = Objects.requireNonNull(clock, "clock");
        for (TriageOutcome outcome : TriageOutcome.values()) {
            counts.put(outcome, 0);
        }
    }

    public void addListener(@Nonnull TriageListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Requests cancellation. Takes effect before the next finding is presented.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    /**
     * Runs until the queue is exhausted or the session is cancelled. An unexpected failure while
     * deciding a finding, for example a listener that cannot persist it, leaves the session
     * {@code CANCELLED} at that finding and is rethrown; calling {@code run()} again resumes there.
     *
     * @return {@link TriageSessionStatus#COMPLETED} or {@link TriageSessionStatus#CANCELLED}
     */
    @Nonnull
    public TriageSessionStatus run() {
        if (status == TriageSessionStatus.COMPLETED) {
            return status;
        }
        cancelRequested.set(false);
        if (startTime == null) {
            startTime = clock.instant();
        }
        endTime = null;
        status = TriageSessionStatus.IN_PROGRESS;
        try (LogContext ignored = LogContext.forSession(sessionId)) {
            LogSupport.info(log, LogEvent.TRIAGE_STARTED, null,
                    "queued", queue.size(),
                    "cursor", cursor);
            while (cursor < queue.size()) {
                if (cancelRequested.get()) {
                    return cancelled("Cancellation requested");
                }
                Finding finding = queue.get(cursor);
                try {
                    decide(finding);
                } catch (TriageCanceledException e) {
                    return cancelled(e.getMessage());
                } catch (RuntimeException e) {
                    aborted(finding, e);
                    throw e;
                }
                cursor++;
            }
            status = TriageSessionStatus.COMPLETED;
            endTime = clock.instant();
            LogSupport.info(log, LogEvent.TRIAGE_COMPLETED, null,
                    "accepted", counts.get(TriageOutcome.ACCEPTED),
                    "edited", counts.get(TriageOutcome.EDITED),
                    "skipped", counts.get(TriageOutcome.SKIPPED));
            return status;
        }
    }

    private void decide(Finding original) {
        Finding presented = original;
        boolean edited = false;
        while (true) {
            FindingPresentation presentation = new FindingPresentation(presented, cursor + 1, queue.size());
            for (TriageListener listener : listeners) {
                listener.onPresented(presentation);
            }
            TriageResponse response = Objects.requireNonNull(provider.decide(presentation),
                    "decision provider returned null for " + presented.getId());
            switch (response.getAction()) {
                case ACCEPT:
                    record(edited ? TriageDecision.edited(presented) : TriageDecision.accepted(presented.getId()), presented);
                    return;
                case SKIP:
                    record(TriageDecision.skipped(original.getId()), original);
                    return;
                case EDIT:
                    FindingEdit edit = Objects.requireNonNull(response.getEdit(), "edit");
                    Finding after = edit.applyTo(presented);
                    if (!after.equals(presented)) {
                        edited = true;
                        for (TriageListener listener : listeners) {
                            listener.onEdited(presented, after);
                        }
                    }
                    presented = after;
                    break;
                default:
                    throw new IllegalStateException("Unsupported triage action " + response.getAction());
            }
        }
    }

    /**
     * Listeners run before the decision is committed. If one throws, nothing is recorded and the
     * finding is presented again on the next {@link #run()}.
     */
    private void record(TriageDecision decision, Finding finding) {
        for (TriageListener listener : listeners) {
            listener.onDecided(decision, finding);
        }
        decisions.put(decision.getFindingId(), decision);
        counts.merge(decision.getOutcome(), 1, Integer::sum);
        if (decision.getOutcome().createsTask()) {
            taskFindings.put(finding.getId(), finding);
        }
        log.debug("Finding {} decided: {}", decision.getFindingId(), decision.getOutcome());
    }

    private void aborted(Finding finding, RuntimeException error) {
        status = TriageSessionStatus.CANCELLED;
        endTime = clock.instant();
        LogSupport.error(log, LogEvent.TRIAGE_ABORTED, "Triage stopped; the finding stays undecided", error,
                "finding", finding.getId(),
                "decided", decisions.size(),
                "undecided", queue.size() - cursor);
    }

    private TriageSessionStatus cancelled(@Nullable String reason) {
        status = TriageSessionStatus.CANCELLED;
        endTime = clock.instant();
        LogSupport.info(log, LogEvent.TRIAGE_CANCELLED, reason,
                "decided", decisions.size(),
                "undecided", queue.size() - cursor);
        return status;
    }

    @Nonnull
    public String getSessionId() {
        return sessionId;
    }

    @Nonnull
    public TriageSessionStatus getStatus() {
        return status;
    }

    /**
     * Index of the next finding to decide.
     */
    public int getCursor() {
        return cursor;
    }

    @Nonnull
    public List<Finding> getQueue() {
        return queue;
    }

    public boolean isComplete() {
        return status == TriageSessionStatus.COMPLETED;
    }

    public int getCount(@Nonnull TriageOutcome outcome) {
        return counts.get(outcome);
    }

    @Nonnull
    public Map<TriageOutcome, Integer> getCounts() {
        return Collections.unmodifiableMap(new EnumMap<>(counts));
    }

    @Nonnull
    public List<TriageDecision> getDecisions() {
        return new ArrayList<>(decisions.values());
    }

    @Nullable
    public TriageDecision getDecision(@Nonnull String findingId) {
        return decisions.get(findingId);
    }

    /**
     * Findings still waiting for a decision, in queue order.
     */
    @Nonnull
    public List<Finding> getUndecided() {
        return new ArrayList<>(queue.subList(cursor, queue.size()));
    }

    /**
     * Accepted and edited findings in decision order, edited ones in their final form.
     */
    @Nonnull
    public List<Finding> getTaskFindings() {
        return new ArrayList<>(taskFindings.values());
    }

    @Nullable
    public Instant getStartTime() {
        return startTime;
    }

    @Nullable
    public Instant getEndTime() {
        return endTime;
    }
}
