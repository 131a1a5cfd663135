package com.hailmary.pipeline;

import com.hailmary.checkpoint.CheckpointStore;
import com.hailmary.config.SourceConfig;
import com.hailmary.elasticsearch.IndexWriter;
import com.hailmary.exception.FailureClassifier;
import com.hailmary.exception.SyncConfigurationException;
import com.hailmary.exception.SyncException;
import com.hailmary.exception.TransientSyncException;
import com.hailmary.model.BulkLoadResult;
import com.hailmary.model.ExtractionCursor;
import com.hailmary.model.IndexDocument;
import com.hailmary.model.SourceRecord;
import com.hailmary.source.RelationalStore;
import com.hailmary.transform.DocumentTransformer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Generic extract-transform-load loop for one data source.
 *
 * <p>Every source runs the same engine; what differs is its {@link SourceConfig}
 * (relation, tracking column, index) and its {@link DocumentTransformer}.</p>
 *
 * <h3>One cycle</h3>
 * <ol>
 *   <li>Read the checkpoint and position a keyset cursor strictly after it.</li>
 *   <li>Extract one page ordered by {@code (tracking column, primary key)}.</li>
 *   <li>Transform every row, then bulk-upsert the page into the source's own index.</li>
 *   <li>Advance the checkpoint to the value {@link CheckpointPolicy} considers safe.</li>
 *   <li>If the page was full, continue with the next page in the same cycle.</li>
 * </ol>
 *
 * <p>{@link #runCycle()} is a plain blocking call.  Cycles of one pipeline never overlap,
 * and {@link #resetCheckpoint()} waits for an in-flight cycle, so the pipeline is the only
 * writer of its checkpoint.  Nothing is thrown out of a cycle: failures are classified,
 * counted in the {@link PipelineContext} and retried on the next cycle from the last
 * committed checkpoint.</p>
 */
@Slf4j
public class SyncPipeline {

    /** Bulk rejections caused by the index mapping rather than by load. */
    private static final Set<String> MAPPING_REJECTIONS = Set.of(
            "mapper_parsing_exception", "document_parsing_exception",
            "strict_dynamic_mapping_exception", "illegal_argument_exception");

    private final SourceConfig source;
    private final RelationalStore store;
    private final DocumentTransformer transformer;
    private final IndexWriter indexWriter;
    private final CheckpointStore checkpointStore;
    private final BackoffPolicy backoff;
    private final PipelineContext context;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile boolean prepared;

    public SyncPipeline(SourceConfig source,
                        RelationalStore store,
                        DocumentTransformer transformer,
                        IndexWriter indexWriter,
                        CheckpointStore checkpointStore,
                        BackoffPolicy backoff,
                        Clock clock) {
        this.source = source;
        this.store = store;
        this.transformer = transformer;
        this.indexWriter = indexWriter;
        this.checkpointStore = checkpointStore;
        this.backoff = backoff;
        this.context = new PipelineContext(source, clock);
        this.context.checkpointRead(checkpointStore.get(source.getName()));
    }

    public String getName() {
        return source.getName();
    }

    public SourceConfig getSource() {
        return source;
    }

    public PipelineStatus status() {
        return context.snapshot();
    }

    /**
     * Runs one cycle, draining the backlog page by page until a short page is read,
     * a page is partially rejected, a stage fails, or a stop is requested.
     */
    public CycleResult runCycle() {
        cycleLock.lock();
        try {
            return doRunCycle();
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleResult doRunCycle() {
        String name = source.getName();
        int rowsExtracted = 0;
        int documentsLoaded = 0;
        Instant checkpoint = Instant.EPOCH;
        ExtractionCursor cursor = null;

        if (stopRequested.get()) {
            return new CycleResult(CycleResult.Outcome.ABORTED, 0, 0, context.snapshot().getLastCheckpoint());
        }

        try {
            prepare();

            context.transition(PipelineState.POLLING);
            checkpoint = checkpointStore.get(name);
            context.checkpointRead(checkpoint);
            cursor = ExtractionCursor.after(checkpoint);

            while (true) {
                if (stopRequested.get()) {
                    log.info("[{}] Stop requested, abandoning cycle at checkpoint {}", name, checkpoint);
                    context.transition(PipelineState.STOPPED);
                    return new CycleResult(CycleResult.Outcome.ABORTED, rowsExtracted, documentsLoaded, checkpoint);
                }

                context.transition(PipelineState.EXTRACTING);
                List<SourceRecord> page = store.fetchPage(source, cursor, source.getBatchSize());
                rowsExtracted += page.size();

                if (page.isEmpty()) {
                    // the previous full page ended exactly at the end of the backlog
                    if (cursor.hasPrimaryKey()) {
                        checkpoint = advance(checkpoint, cursor.getTrackingValue());
                    }
                    break;
                }
                boolean pageExhausted = page.size() < source.getBatchSize();
                log.debug("[{}] Extracted {} rows after {} (tracking {} .. {})", name, page.size(), cursor,
                        page.get(0).getTrackingValue(), page.get(page.size() - 1).getTrackingValue());

                context.transition(PipelineState.TRANSFORMING);
                List<IndexDocument> documents = transform(page);

                if (stopRequested.get()) {
                    log.info("[{}] Stop requested before load, checkpoint stays at {}", name, checkpoint);
                    context.transition(PipelineState.STOPPED);
                    return new CycleResult(CycleResult.Outcome.ABORTED, rowsExtracted, documentsLoaded, checkpoint);
                }

                context.transition(PipelineState.LOADING);
                BulkLoadResult result = indexWriter.bulkUpsert(source.getIndex(), documents);
                context.documentsLoaded(result.getAcceptedIds().size(), result.getFailures().size());
                documentsLoaded += result.getAcceptedIds().size();

                context.transition(PipelineState.ADVANCING);
                Optional<Instant> safeValue = CheckpointPolicy.safeAdvanceValue(page, result, pageExhausted);
                if (safeValue.isPresent()) {
                    checkpoint = advance(checkpoint, safeValue.get());
                }

                if (!result.isComplete()) {
                    SyncException failure = rejectionFailure(result, page);
                    context.cycleFailed(failure);
                    log.error("[{}] {} (page {} .. {}, checkpoint now {})", name, failure.getMessage(),
                            page.get(0).getTrackingValue(), page.get(page.size() - 1).getTrackingValue(), checkpoint);
                    return new CycleResult(CycleResult.Outcome.PARTIAL, rowsExtracted, documentsLoaded, checkpoint);
                }

                if (pageExhausted) {
                    break;
                }
                cursor = ExtractionCursor.after(page.get(page.size() - 1));
            }

            context.cycleSucceeded();
            if (rowsExtracted > 0) {
                log.info("[{}] Cycle synced {} rows into index '{}', checkpoint {}",
                        name, rowsExtracted, source.getIndex(), checkpoint);
            }
            return new CycleResult(CycleResult.Outcome.SUCCESS, rowsExtracted, documentsLoaded, checkpoint);

        } catch (IOException | RuntimeException e) {
            SyncException failure = FailureClassifier.classify(name, stageName(), e);
            context.cycleFailed(failure);
            log.error("[{}] Cycle failed ({}) after checkpoint {} at cursor {}: {}", name,
                    failure.isTransient() ? "transient" : "configuration", checkpoint, cursor,
                    failure.getMessage(), e);
            return new CycleResult(CycleResult.Outcome.FAILED, rowsExtracted, documentsLoaded, checkpoint);
        }
    }

    /**
     * Validates the source schema and creates the destination index, once per pipeline
     * lifetime (again after a reset).
     */
    private void prepare() throws IOException {
        if (prepared) {
            return;
        }
        SourceSchemaValidator.validate(source, store);
        indexWriter.ensureIndex(source.getIndex());
        prepared = true;
        log.info("[{}] Validated relation '{}' (tracking column '{}'), index '{}' ready",
                source.getName(), source.getRelation(), source.getTrackingColumn(), source.getIndex());
    }

    private List<IndexDocument> transform(List<SourceRecord> page) {
        List<IndexDocument> documents = new ArrayList<>(page.size());
        for (SourceRecord record : page) {
            IndexDocument document = transformer.transform(record);
            if (document == null || !record.getDocumentId().equals(document.getDocumentId())) {
                throw new SyncConfigurationException(source.getName(), "Transformer "
                        + transformer.getClass().getSimpleName() + " must keep document id '"
                        + record.getDocumentId() + "'");
            }
            documents.add(document);
        }
        return documents;
    }

    private Instant advance(Instant current, Instant candidate) {
        if (!candidate.isAfter(current)) {
            return current;
        }
        if (checkpointStore.advance(source.getName(), candidate)) {
            context.checkpointAdvanced(candidate);
            log.info("[{}] Checkpoint advanced {} -> {}", source.getName(), current, candidate);
            return candidate;
        }
        return current;
    }

    private SyncException rejectionFailure(BulkLoadResult result, List<SourceRecord> page) {
        Map.Entry<String, String> first = result.getFailures().entrySet().iterator().next();
        String message = "Index '" + source.getIndex() + "' rejected " + result.getFailures().size()
                + " of " + page.size() + " documents, first " + first.getKey() + ": " + first.getValue();
        boolean schemaProblem = result.getFailures().values().stream().anyMatch(SyncPipeline::isMappingRejection);
        return schemaProblem
                ? new SyncConfigurationException(source.getName(), message)
                : new TransientSyncException(source.getName(), message, null);
    }

    private static boolean isMappingRejection(String reason) {
        return MAPPING_REJECTIONS.stream().anyMatch(reason::startsWith);
    }

    private String stageName() {
        return context.getState().name().toLowerCase();
    }

    /**
     * Records a failure that escaped {@link #runCycle()}, typically an {@link Error} such as
     * a {@code NoClassDefFoundError} from a transformer, so it is counted and reported like
     * any failed cycle.  Errors are flagged as configuration problems.
     */
    public CycleResult cycleEscaped(Throwable failure) {
        SyncException classified = failure instanceof Error
                ? new SyncConfigurationException(source.getName(), stageName() + " failed for source '"
                        + source.getName() + "': " + failure, failure)
                : FailureClassifier.classify(source.getName(), stageName(), failure);
        context.cycleFailed(classified);
        return new CycleResult(CycleResult.Outcome.FAILED, 0, 0, context.snapshot().getLastCheckpoint());
    }

    /**
     * Delay before the next cycle: the poll interval after success, backoff otherwise
     * (also when the cycle produced no result).
     */
    public long nextDelayMs(CycleResult result) {
        if (result != null && result.isSuccess()) {
            return source.getPollIntervalMs();
        }
        return backoff.delayMs(Math.max(1, context.getConsecutiveFailures()));
    }

    /**
     * Moves the checkpoint back to epoch so the next cycle re-extracts the whole source.
     * Blocks until an in-flight cycle has finished.
     */
    public void resetCheckpoint() {
        cycleLock.lock();
        try {
            checkpointStore.reset(source.getName());
            context.checkpointAdvanced(Instant.EPOCH);
            prepared = false;
            log.info("[{}] Checkpoint reset to epoch; next cycle resyncs '{}' in full",
                    source.getName(), source.getRelation());
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Asks the running cycle to abort at its next stage boundary.  An aborted cycle never
     * advances past its last committed page.
     */
    public void requestStop() {
        stopRequested.set(true);
    }

    /** Clears a previous stop request so the pipeline can be scheduled again. */
    public void clearStop() {
        stopRequested.set(false);
        if (context.getState() == PipelineState.STOPPED) {
            context.transition(PipelineState.IDLE);
        }
    }

    public void markStopped() {
        context.transition(PipelineState.STOPPED);
    }
}
