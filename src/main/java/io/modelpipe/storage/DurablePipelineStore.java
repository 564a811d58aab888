package io.modelpipe.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.modelpipe.config.PipelineConfig;
import io.modelpipe.observability.AuditLogger;
import io.modelpipe.pipeline.AbstractPipelineStore;
import io.modelpipe.pipeline.PipelineOperations;
import io.modelpipe.pipeline.PipelineState;
import io.modelpipe.pipeline.StateCodec;
import io.modelpipe.util.Hashing;
import io.modelpipe.util.Jsons;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Store backed by one SQLite state document per scope. Each mutation runs against the latest document and
 * commits with a compare-and-set on its revision (the SHA-256 of the document); a lost race reloads and
 * re-runs the mutation, so at most one claimant wins a job even across processes sharing the database file.
 * Only the first load of an instance rebuilds the event log; later reloads keep the stored history.
 */
public final class DurablePipelineStore extends AbstractPipelineStore {
    private final StateDocumentRepository documents;
    private final Clock clock;
    private final String scope;
    private final int casRetryLimit;
    private Snapshot cached;
    private boolean historyLoaded;

    public DurablePipelineStore(Database database, Clock clock, AuditLogger auditLogger) {
        super(auditLogger);
        this.documents = new StateDocumentRepository(database);
        this.clock = clock;
        this.scope = database.config().scope();
        this.casRetryLimit = database.config().casRetryLimit();
    }

    public static DurablePipelineStore open(PipelineConfig config) {
        Database database = new Database(config);
        database.init();
        return new DurablePipelineStore(database, Clock.systemUTC(), new AuditLogger(config.auditLogFile()));
    }

    @Override
    protected synchronized <T> T mutate(Function<PipelineOperations, T> mutation) {
        for (int attempt = 1; attempt <= casRetryLimit; attempt++) {
            Snapshot current = load();
            try {
                T value = mutation.apply(current.operations());
                String json = Jsons.toCompactJson(StateCodec.serialize(current.operations().state()));
                String nextRevision = Hashing.sha256Hex(json);
                if (nextRevision.equals(current.revision())
                        || documents.saveIfRevision(scope, current.revision(), nextRevision,
                        StateCodec.DOCUMENT_VERSION, json, clock.millis())) {
                    cached = new Snapshot(nextRevision, current.operations());
                    return value;
                }
                cached = null;
            } catch (RuntimeException e) {
                cached = null;
                throw e;
            }
        }
        throw new StoreConflictException(scope, casRetryLimit);
    }

    @Override
    protected synchronized <T> T read(Function<PipelineOperations, T> reader) {
        Snapshot current = load();
        cached = current;
        return reader.apply(current.operations());
    }

    private Snapshot load() {
        String storedRevision = documents.loadRevision(scope);
        if (cached != null && Objects.equals(cached.revision(), storedRevision)) {
            return cached;
        }
        if (storedRevision == null) {
            historyLoaded = true;
            return new Snapshot(null, new PipelineOperations(new PipelineState(), clock));
        }
        StateDocumentRepository.StateRecord record = documents.load(scope);
        if (record == null) {
            return new Snapshot(null, new PipelineOperations(new PipelineState(), clock));
        }
        StateCodec.Decoded decoded = StateCodec.decode(parseDocument(record.stateJson()), historyLoaded);
        historyLoaded = true;
        if (decoded == null) {
            audit("state.repaired", "system", "state:" + scope, "discarded", null, null,
                    Map.of("reason", "unreadable or unsupported state document"));
            return new Snapshot(record.revision(), new PipelineOperations(new PipelineState(), clock));
        }
        if (decoded.repairs() > 0) {
            audit("state.repaired", "system", "state:" + scope, "repaired", null, null,
                    Map.of("repairs", decoded.repairs()));
        }
        return new Snapshot(record.revision(), new PipelineOperations(decoded.state(), clock));
    }

    private static JsonNode parseDocument(String json) {
        try {
            return Jsons.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            // Unparseable documents are treated like unsupported versions.
            return null;
        }
    }

    private record Snapshot(String revision, PipelineOperations operations) {
    }
}
