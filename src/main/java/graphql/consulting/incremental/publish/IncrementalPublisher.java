package graphql.consulting.incremental.publish;

import graphql.GraphQLError;
import graphql.Internal;
import graphql.consulting.incremental.result.CompletedResult;
import graphql.consulting.incremental.result.IncrementalDeferResult;
import graphql.consulting.incremental.result.IncrementalExecutionResult;
import graphql.consulting.incremental.result.IncrementalResult;
import graphql.consulting.incremental.result.IncrementalStreamResult;
import graphql.consulting.incremental.result.PendingResult;
import graphql.consulting.incremental.result.SubsequentIncrementalExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the incremental data records of one request into the initial result and the sequence of
 * subsequent payloads, releasing deferred fragments only once all of their results are in.
 */
@Internal
public class IncrementalPublisher {

    private static final Logger log = LoggerFactory.getLogger(IncrementalPublisher.class);

    private final IncrementalGraph graph;
    private final Scheduler scheduler;
    private final Set<CancellableStreamRecord> cancellableStreams;

    // only touched while holding the graph's lock
    private final List<PendingResult> pending = new ArrayList<>();
    private final List<IncrementalResult> incremental = new ArrayList<>();
    private final List<CompletedResult> completed = new ArrayList<>();
    private volatile boolean done;

    public IncrementalPublisher(Scheduler scheduler, Set<CancellableStreamRecord> cancellableStreams) {
        this.scheduler = scheduler;
        this.graph = new IncrementalGraph(scheduler::schedule);
        this.cancellableStreams = cancellableStreams;
    }

    public IncrementalExecutionResult buildResponse(Map<String, Object> data,
                                                    List<GraphQLError> errors,
                                                    List<IncrementalDataRecord> incrementalDataRecords) {
        List<PendingResult> pendingResults;
        synchronized (graph) {
            graph.addIncrementalDataRecords(incrementalDataRecords);
            graph.pruneEmpty();
            pendingResults = graph.pendingSourcesToResults();
        }
        return new IncrementalExecutionResult(data, errors, pendingResults, true, subscribe());
    }

    /**
     * The cleanup is subscribed on the caller's thread, so a cancel arriving before the first
     * payload task ran still returns the streams.
     */
    private Flux<SubsequentIncrementalExecutionResult> subscribe() {
        return Flux.usingWhen(Mono.just(this),
                publisher -> Mono.defer(this::nextPayload).repeat(() -> !done).subscribeOn(scheduler),
                publisher -> returnStreamIterators(),
                (publisher, error) -> returnStreamIterators(),
                publisher -> returnStreamIterators());
    }

    private Mono<SubsequentIncrementalExecutionResult> nextPayload() {
        List<Mono<Void>> earlyReturns = new ArrayList<>();
        SubsequentIncrementalExecutionResult payload;
        synchronized (graph) {
            IncrementalDataRecordResult completedResult;
            while ((completedResult = graph.pollCompleted()) != null) {
                if (completedResult instanceof DeferredGroupedFieldSetResult) {
                    handleCompletedDeferredGroupedFieldSet((DeferredGroupedFieldSetResult) completedResult);
                } else {
                    handleCompletedStreamItems((StreamItemsResult) completedResult, earlyReturns);
                }
                pending.addAll(graph.pendingSourcesToResults());
            }

            if (incremental.isEmpty() && completed.isEmpty()) {
                return graph.completedResultQueued()
                        .publishOn(scheduler)
                        .then(Mono.defer(this::nextPayload));
            }

            boolean hasNext = graph.hasPending();
            done = !hasNext;
            payload = new SubsequentIncrementalExecutionResult(hasNext, pending, incremental, completed);
            pending.clear();
            incremental.clear();
            completed.clear();
        }
        if (earlyReturns.isEmpty()) {
            return Mono.just(payload);
        }
        return Mono.when(earlyReturns).thenReturn(payload);
    }

    private void handleCompletedDeferredGroupedFieldSet(DeferredGroupedFieldSetResult result) {
        if (result instanceof NonReconcilableDeferredGroupedFieldSetResult) {
            List<GraphQLError> errors = ((NonReconcilableDeferredGroupedFieldSetResult) result).getErrors();
            for (DeferredFragmentRecord deferredFragmentRecord : result.getDeferredFragmentRecords()) {
                String id = deferredFragmentRecord.getId();
                if (id != null && graph.removePending(deferredFragmentRecord)) {
                    completed.add(new CompletedResult(id, errors));
                }
            }
            return;
        }

        ReconcilableDeferredGroupedFieldSetResult reconcilableResult = (ReconcilableDeferredGroupedFieldSetResult) result;
        // a result shared with a fragment released later is queued again
        if (!reconcilableResult.isHandled()) {
            reconcilableResult.markHandled();
            for (DeferredFragmentRecord deferredFragmentRecord : result.getDeferredFragmentRecords()) {
                deferredFragmentRecord.getReconcilableResults().add(reconcilableResult);
            }
            graph.addIncrementalDataRecords(reconcilableResult.getIncrementalDataRecords());
        }

        for (DeferredFragmentRecord deferredFragmentRecord : result.getDeferredFragmentRecords()) {
            String id = deferredFragmentRecord.getId();
            if (id == null || !graph.isPending(deferredFragmentRecord)) {
                continue;
            }
            List<ReconcilableDeferredGroupedFieldSetResult> reconcilableResults = deferredFragmentRecord.getReconcilableResults();
            if (deferredFragmentRecord.getExpectedReconcilableResults() != reconcilableResults.size()) {
                continue;
            }
            for (ReconcilableDeferredGroupedFieldSetResult reconcilable : reconcilableResults) {
                if (reconcilable.isSent()) {
                    continue;
                }
                reconcilable.markSent();
                incremental.add(toIncrementalDeferResult(id, deferredFragmentRecord, reconcilable));
            }
            completed.add(new CompletedResult(id));
            graph.removePending(deferredFragmentRecord);
            for (DeferredFragmentRecord child : deferredFragmentRecord.getChildren()) {
                graph.addNewPending(child);
                graph.enqueueResultsOf(child);
            }
        }
        graph.pruneEmpty();
    }

    /**
     * Publishes under the deepest released fragment the result belongs to, so the sub path stays
     * as short as possible.
     */
    private IncrementalDeferResult toIncrementalDeferResult(String initialId,
                                                            DeferredFragmentRecord initialRecord,
                                                            ReconcilableDeferredGroupedFieldSetResult result) {
        int maxLength = initialRecord.getPathList().size();
        String bestId = initialId;
        for (DeferredFragmentRecord deferredFragmentRecord : result.getDeferredFragmentRecords()) {
            if (deferredFragmentRecord == initialRecord || deferredFragmentRecord.getId() == null) {
                continue;
            }
            int length = deferredFragmentRecord.getPathList().size();
            if (length > maxLength) {
                maxLength = length;
                bestId = deferredFragmentRecord.getId();
            }
        }
        List<Object> path = result.getPath();
        List<Object> subPath = path.size() > maxLength ? new ArrayList<>(path.subList(maxLength, path.size())) : null;
        return new IncrementalDeferResult(bestId, subPath, result.getData(), result.getErrors());
    }

    private void handleCompletedStreamItems(StreamItemsResult result, List<Mono<Void>> earlyReturns) {
        StreamRecord streamRecord = result.getStreamRecord();
        String id = streamRecord.getId();
        if (id == null) {
            return;
        }
        if (result instanceof NonReconcilableStreamItemsResult) {
            completed.add(new CompletedResult(id, ((NonReconcilableStreamItemsResult) result).getErrors()));
            graph.removePending(streamRecord);
            if (streamRecord instanceof CancellableStreamRecord) {
                cancellableStreams.remove(streamRecord);
                earlyReturns.add(earlyReturn((CancellableStreamRecord) streamRecord));
            }
        } else if (result instanceof TerminatingStreamItemsResult) {
            completed.add(new CompletedResult(id));
            graph.removePending(streamRecord);
            if (streamRecord instanceof CancellableStreamRecord) {
                cancellableStreams.remove(streamRecord);
            }
        } else {
            ReconcilableStreamItemsResult reconcilableResult = (ReconcilableStreamItemsResult) result;
            addStreamItems(id, reconcilableResult);
            if (!reconcilableResult.getIncrementalDataRecords().isEmpty()) {
                graph.addIncrementalDataRecords(reconcilableResult.getIncrementalDataRecords());
                graph.pruneEmpty();
            }
        }
    }

    /**
     * Consecutive items of the same stream within one payload are published as one entry.
     */
    private void addStreamItems(String id, ReconcilableStreamItemsResult result) {
        if (!incremental.isEmpty()) {
            IncrementalResult last = incremental.get(incremental.size() - 1);
            if (last instanceof IncrementalStreamResult && last.getId().equals(id)) {
                List<Object> items = new ArrayList<>(((IncrementalStreamResult) last).getItems());
                items.addAll(result.getItems());
                List<GraphQLError> errors = null;
                if (last.getErrors() != null || result.getErrors() != null) {
                    errors = new ArrayList<>();
                    if (last.getErrors() != null) {
                        errors.addAll(last.getErrors());
                    }
                    if (result.getErrors() != null) {
                        errors.addAll(result.getErrors());
                    }
                }
                incremental.set(incremental.size() - 1, new IncrementalStreamResult(id, items, errors));
                return;
            }
        }
        incremental.add(new IncrementalStreamResult(id, result.getItems(), result.getErrors()));
    }

    private Mono<Void> returnStreamIterators() {
        List<Mono<Void>> earlyReturns = new ArrayList<>();
        for (CancellableStreamRecord streamRecord : cancellableStreams) {
            earlyReturns.add(earlyReturn(streamRecord));
        }
        cancellableStreams.clear();
        if (earlyReturns.isEmpty()) {
            return Mono.empty();
        }
        log.debug("returning {} unfinished streams", earlyReturns.size());
        return Mono.when(earlyReturns);
    }

    private Mono<Void> earlyReturn(CancellableStreamRecord streamRecord) {
        return streamRecord.earlyReturn()
                .onErrorResume(throwable -> {
                    log.warn("early return of stream {} failed", streamRecord, throwable);
                    return Mono.empty();
                });
    }
}
