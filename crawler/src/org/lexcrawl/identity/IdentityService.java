package org.lexcrawl.identity;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedEpochGenerator;
import org.jdbi.v3.core.statement.UnableToExecuteStatementException;
import org.lexcrawl.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Assigns global ids and canonical names to documents, deduplicating by source URL.
 * <p>
 * The dedup lookup, the sequence allocation and the document insert run in one transaction. The database is
 * reached through a single pooled connection so concurrent callers are serialized and two callers racing on the
 * same source URL can never both allocate.
 * <p>
 * Each instance owns a cache of source URL to global id for the current run. Entries are only added after the
 * enclosing transaction has committed.
 */
public class IdentityService {
    private static final Logger log = LoggerFactory.getLogger(IdentityService.class);
    private final Database db;
    private final Map<String, String> committed;
    private final TimeBasedEpochGenerator uuidGenerator = Generators.timeBasedEpochGenerator();
    private final SubjectClassifier subjectClassifier = new SubjectClassifier();
    private final DocumentNamer namer = new DocumentNamer();
    private final Clock clock;

    public IdentityService(Database db, Clock clock) {
        this(db, clock, new ConcurrentHashMap<>());
    }

    public IdentityService(Database db, Clock clock, Map<String, String> runCache) {
        this.db = db;
        this.clock = clock;
        this.committed = runCache;
    }

    /**
     * Looks up or assigns the identity of a document in its own transaction.
     */
    public Assignment assignOrLookup(DocumentDraft draft) {
        Assignment assignment = db.inTransaction(txn -> assignOrLookup(txn, draft));
        remember(assignment);
        return assignment;
    }

    /**
     * Looks up or assigns the identity of a document within the caller's transaction. The caller must pass the
     * result to {@link #remember(Assignment)} once the transaction has committed.
     *
     * @throws IdentityViolationException if the allocated global id already exists
     */
    public Assignment assignOrLookup(Database txn, DocumentDraft draft) {
        String cached = committed.get(draft.sourceUrl());
        if (cached != null) return new Assignment(draft.sourceUrl(), cached, false);

        String existing = txn.documents().findGlobalId(draft.sourceUrl());
        if (existing != null) return new Assignment(draft.sourceUrl(), existing, false);

        int year = draft.year() == null ? 0 : draft.year();
        long sequence = txn.sequences().allocate(draft.countryCode(), draft.category(), year);
        var globalId = new GlobalId(draft.countryCode(), draft.category(), year, sequence);

        String titleShort = draft.titleShort() != null ? draft.titleShort() : namer.shortTitle(draft.titleFull());
        SubjectCode subject = draft.subject() != null ? draft.subject()
                : subjectClassifier.classify(draft.titleFull(), draft.body());
        Instant now = clock.instant();
        var document = new Document(0, globalId.toString(), uuidGenerator.generate(), draft.countryCode(),
                draft.category(), draft.year(), sequence, draft.titleFull(), titleShort, subject.name(),
                draft.sourceUrl(), draft.sourceId(), draft.rawContentRef(), draft.parsedFields(),
                namer.filename(globalId, titleShort, subject), namer.folder(globalId, draft.court()),
                draft.pdfUrl(), false, draft.proxyId(), now, now);
        try {
            txn.documents().insert(document);
        } catch (UnableToExecuteStatementException e) {
            if (e.getMessage() != null && e.getMessage().contains("documents.global_id")) {
                throw new IdentityViolationException("Global id " + globalId + " allocated twice", e);
            }
            throw e;
        }
        log.atDebug().addKeyValue("globalId", globalId).addKeyValue("url", draft.sourceUrl())
                .log("Assigned identity");
        return new Assignment(draft.sourceUrl(), globalId.toString(), true);
    }

    public void remember(Assignment assignment) {
        committed.put(assignment.sourceUrl(), assignment.globalId());
    }

    public DocumentNamer namer() {
        return namer;
    }
}
