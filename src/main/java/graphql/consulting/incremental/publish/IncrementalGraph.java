package graphql.consulting.incremental.publish;

import graphql.GraphQLError;
import graphql.Internal;
import graphql.consulting.incremental.LocatedError;
import graphql.consulting.incremental.result.PendingResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Tracks the deferred fragments and streams of one request: which are announced, which are about
 * to be announced and which completed results wait to be published.
 * <p>
 * All methods synchronize on the graph. Completions of incremental work are handed over through
 * the given executor, so they are queued after the task that registered them.
 */
@Internal
public class IncrementalGraph {

    private static final Logger log = LoggerFactory.getLogger(IncrementalGraph.class);

    private final Executor executor;
    private final Set<SubsequentResultRecord> pending = new LinkedHashSet<>();
    private Set<SubsequentResultRecord> newPending = new LinkedHashSet<>();
    private final Deque<IncrementalDataRecordResult> completedResultQueue = new ArrayDeque<>();
    private int nextId;
    private Sinks.Empty<Void> signal;

    public IncrementalGraph(Executor executor) {
        this.executor = executor;
    }

    public synchronized void addIncrementalDataRecords(List<IncrementalDataRecord> incrementalDataRecords) {
        for (IncrementalDataRecord incrementalDataRecord : incrementalDataRecords) {
            if (incrementalDataRecord instanceof DeferredGroupedFieldSetRecord) {
                addDeferredGroupedFieldSetRecord((DeferredGroupedFieldSetRecord) incrementalDataRecord);
            } else {
                addStreamItemsRecord((StreamItemsRecord) incrementalDataRecord);
            }
        }
        if (log.isDebugEnabled() && !incrementalDataRecords.isEmpty()) {
            log.debug("registered {} incremental data records", incrementalDataRecords.size());
        }
    }

    private void addDeferredGroupedFieldSetRecord(DeferredGroupedFieldSetRecord record) {
        for (DeferredFragmentRecord deferredFragmentRecord : record.getDeferredFragmentRecords()) {
            deferredFragmentRecord.incrementExpectedReconcilableResults();
            addDeferredFragmentRecord(deferredFragmentRecord);
        }
        record.getResult().whenCompleteAsync((result, throwable) -> {
            if (throwable != null) {
                result = new NonReconcilableDeferredGroupedFieldSetResult(record.getDeferredFragmentRecords(),
                        Collections.emptyList(), toErrors(throwable));
            }
            enqueueCompletedDeferredGroupedFieldSet(result);
        }, executor);
    }

    private void addStreamItemsRecord(StreamItemsRecord record) {
        StreamRecord streamRecord = record.getStreamRecord();
        if (streamRecord.getId() == null) {
            newPending.add(streamRecord);
        }
        record.getResult().whenCompleteAsync((result, throwable) -> {
            if (throwable != null) {
                result = new NonReconcilableStreamItemsResult(streamRecord, toErrors(throwable));
            }
            enqueueCompletedStreamItems(result);
        }, executor);
    }

    private void addDeferredFragmentRecord(DeferredFragmentRecord deferredFragmentRecord) {
        DeferredFragmentRecord parent = deferredFragmentRecord.getParent();
        if (parent == null) {
            if (deferredFragmentRecord.getId() == null) {
                newPending.add(deferredFragmentRecord);
            }
            return;
        }
        if (parent.getChildren().contains(deferredFragmentRecord)) {
            return;
        }
        parent.getChildren().add(deferredFragmentRecord);
        addDeferredFragmentRecord(parent);
    }

    /**
     * Replaces fragments that expect no results of their own by their nearest descendants that do.
     */
    public synchronized void pruneEmpty() {
        Set<SubsequentResultRecord> maybeEmptyNewPending = newPending;
        newPending = new LinkedHashSet<>();
        for (SubsequentResultRecord node : maybeEmptyNewPending) {
            if (node instanceof DeferredFragmentRecord) {
                addNonEmptyNewPending((DeferredFragmentRecord) node);
            } else {
                newPending.add(node);
            }
        }
    }

    private void addNonEmptyNewPending(DeferredFragmentRecord deferredFragmentRecord) {
        if (deferredFragmentRecord.getExpectedReconcilableResults() > 0) {
            newPending.add(deferredFragmentRecord);
            return;
        }
        for (DeferredFragmentRecord child : deferredFragmentRecord.getChildren()) {
            addNonEmptyNewPending(child);
        }
    }

    synchronized void enqueueCompletedDeferredGroupedFieldSet(DeferredGroupedFieldSetResult result) {
        boolean hasPendingParent = false;
        for (DeferredFragmentRecord deferredFragmentRecord : result.getDeferredFragmentRecords()) {
            if (deferredFragmentRecord.getId() != null) {
                hasPendingParent = true;
            }
            deferredFragmentRecord.getResults().add(result);
        }
        if (hasPendingParent) {
            completedResultQueue.add(result);
            trigger();
        }
    }

    synchronized void enqueueCompletedStreamItems(StreamItemsResult result) {
        completedResultQueue.add(result);
        trigger();
    }

    /**
     * Queues the already completed results of a fragment that was just released to the client.
     */
    synchronized void enqueueResultsOf(DeferredFragmentRecord deferredFragmentRecord) {
        completedResultQueue.addAll(deferredFragmentRecord.getResults());
    }

    synchronized void addNewPending(SubsequentResultRecord record) {
        newPending.add(record);
    }

    synchronized boolean removePending(SubsequentResultRecord record) {
        return pending.remove(record);
    }

    synchronized boolean isPending(SubsequentResultRecord record) {
        return pending.contains(record);
    }

    public synchronized boolean hasPending() {
        return !pending.isEmpty();
    }

    synchronized IncrementalDataRecordResult pollCompleted() {
        return completedResultQueue.poll();
    }

    /**
     * Assigns ids to the records about to be announced and moves them to pending.
     */
    public synchronized List<PendingResult> pendingSourcesToResults() {
        List<PendingResult> pendingResults = new ArrayList<>();
        for (SubsequentResultRecord pendingSource : newPending) {
            String id = String.valueOf(nextId++);
            pendingSource.setId(id);
            pending.add(pendingSource);
            pendingResults.add(new PendingResult(id, pendingSource.getPathList(), pendingSource.getLabel()));
            log.debug("pending id {} assigned to {}", id, pendingSource);
        }
        newPending.clear();
        return pendingResults;
    }

    /**
     * Completes once a completed result is queued, immediately if one already is.
     */
    synchronized Mono<Void> completedResultQueued() {
        if (!completedResultQueue.isEmpty()) {
            return Mono.empty();
        }
        if (signal == null) {
            signal = Sinks.empty();
        }
        return signal.asMono();
    }

    private void trigger() {
        Sinks.Empty<Void> current = signal;
        signal = null;
        if (current != null) {
            current.tryEmitEmpty();
        }
    }

    private static List<GraphQLError> toErrors(Throwable throwable) {
        List<GraphQLError> errors = new ArrayList<>();
        errors.add(LocatedError.locate(throwable, Collections.emptyList(), null));
        return errors;
    }
}
