package com.enrichreview.backend.review;

import java.util.Map;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import com.enrichreview.backend.review.ReviewDtos.DocumentView;
import com.enrichreview.backend.review.ReviewDtos.EditingView;
import com.enrichreview.backend.review.ReviewDtos.FieldView;
import com.enrichreview.backend.review.ReviewDtos.ReviewSummary;
import com.enrichreview.backend.review.ReviewDtos.ReviewUpdatedEvent;
import com.enrichreview.backend.sse.SseHub;
import com.enrichreview.engine.core.diff.DiffTreeJson;
import com.enrichreview.engine.core.path.FieldPath;
import com.enrichreview.engine.core.path.JsonPath;
import com.enrichreview.engine.core.pipeline.DocumentPair;
import com.enrichreview.engine.core.pipeline.DocumentPairSource;
import com.enrichreview.engine.core.pipeline.UpstreamFetchException;
import com.enrichreview.engine.core.session.ExportNotReadyException;
import com.enrichreview.engine.core.session.ReviewSession;
import com.enrichreview.engine.core.validation.ValidationDecision;
import com.enrichreview.engine.model.pipeline.EnrichmentRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/**
 * In-memory review sessions. Actions on one session are serialized by locking
 * on the session; every change is announced as {@code REVIEW_UPDATED}.
 */
@Service
public class ReviewSessionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionService.class);

    private final Map<UUID, ReviewSession> sessions = new ConcurrentHashMap<>();

    private final DocumentPairSource pairs;
    private final SseHub hub;
    private final ObjectMapper om;

    public ReviewSessionService(DocumentPairSource pairs, SseHub hub, ObjectMapper om) {
        this.pairs = pairs;
        this.hub = hub;
        this.om = om;
    }

    // ---- lifecycle ----

    public ReviewSummary createFromUrl(String url) {
        DocumentPair pair = fetch(url);
        return register(UUID.randomUUID(), ReviewSession.open(pair));
    }

    public ReviewSummary createFromPair(JsonNode original, JsonNode enriched) {
        if (enriched == null || enriched.isNull()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "enriched is required");
        }
        return register(UUID.randomUUID(), ReviewSession.open(new DocumentPair(original, enriched)));
    }

    /**
     * Replaces the session with a fresh one built from a newly fetched pair.
     * A failed fetch leaves the current session as it was; a session deleted
     * while the fetch was in flight stays deleted.
     */
    public ReviewSummary reload(UUID id, String url) {
        get(id);
        DocumentPair pair = fetch(url);
        ReviewSession fresh = ReviewSession.open(pair);
        if (sessions.replace(id, fresh) == null) throw notFound(id);
        return opened(id, fresh);
    }

    public void delete(UUID id) {
        if (sessions.remove(id) == null) throw notFound(id);
        log.info("review {} closed", id);
    }

    public ReviewSummary summary(UUID id) {
        return read(id, s -> summarize(id, s));
    }

    // ---- decisions ----

    public ReviewSummary decide(UUID id, ValidationDecision decision) {
        if (decision == null || decision.decisionType() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "decisionType must be APPROVE or DECLINE");
        }
        if (decision.fieldPath() == null || decision.fieldPath().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "fieldPath is required");
        }
        return update(id, s -> s.decide(decision));
    }

    public ReviewSummary approveAll(UUID id, String fieldPath) {
        FieldPath path = requirePath(fieldPath);
        return update(id, s -> {
            int n = s.approveAll(path);
            log.debug("review {}: approved {} field(s) under {}", id, n, path);
        });
    }

    public ReviewSummary resetValidation(UUID id) {
        return update(id, ReviewSession::resetValidation);
    }

    // ---- editing ----

    public ReviewSummary startEdit(UUID id, String fieldPath) {
        FieldPath path = requirePath(fieldPath);
        return update(id, s -> s.startEdit(path));
    }

    public ReviewSummary updateEdit(UUID id, String text) {
        return update(id, s -> {
            if (s.editingCursor().isEmpty()) {
                throw new ResponseStatusException(HttpStatus.CONFLICT, "no edit in progress");
            }
            s.updateEdit(text);
        });
    }

    public ReviewSummary commitEdit(UUID id) {
        return update(id, s -> {
            if (!s.commitEdit()) throw new ResponseStatusException(HttpStatus.CONFLICT, "no edit in progress");
        });
    }

    public ReviewSummary cancelEdit(UUID id) {
        return update(id, ReviewSession::cancelEdit);
    }

    public ReviewSummary removeField(UUID id, String fieldPath) {
        FieldPath path = requirePath(fieldPath);
        return update(id, s -> s.removeField(path));
    }

    // ---- queries ----

    public FieldView field(UUID id, String fieldPath) {
        FieldPath path = requirePath(fieldPath);
        return read(id, s -> new FieldView(
                path.key(),
                JsonPath.get(s.enrichedDoc(), path).orElse(null),
                s.getDiffKind(path),
                s.getOriginalValue(path).orElse(null),
                s.getValidationState(path),
                s.getEffectiveState(path)
        ));
    }

    public DocumentView generate(UUID id) {
        return read(id, s -> {
            var pending = s.collectPendingFields();
            return new DocumentView(id, s.generate(), pending, pending.isEmpty());
        });
    }

    public DocumentView export(UUID id) {
        return read(id, s -> {
            try {
                return new DocumentView(id, s.export(), List.of(), true);
            } catch (ExportNotReadyException e) {
                throw new ResponseStatusException(HttpStatus.CONFLICT,
                        e.getMessage() + ": " + String.join(", ", e.pendingFields()), e);
            }
        });
    }

    public ReviewSession get(UUID id) {
        ReviewSession s = sessions.get(id);
        if (s == null) throw notFound(id);
        return s;
    }

    // ---- internals ----

    private DocumentPair fetch(String url) {
        if (url == null || url.isBlank()) throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "url is required");
        try {
            return pairs.fetch(new EnrichmentRequest(url.trim()));
        } catch (UpstreamFetchException e) {
            log.warn("pair fetch from '{}' failed (status {}): {}", pairs.name(), e.upstreamStatus(), e.getMessage());
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY, e.getMessage(), e);
        }
    }

    private ReviewSummary register(UUID id, ReviewSession session) {
        sessions.put(id, session);
        return opened(id, session);
    }

    private ReviewSummary opened(UUID id, ReviewSession session) {
        log.info("review {} opened with {} pending field(s)", id, session.collectPendingFields().size());
        ReviewSummary out = summarize(id, session);
        announce(out);
        return out;
    }

    private <T> T read(UUID id, Function<ReviewSession, T> query) {
        ReviewSession s = get(id);
        synchronized (s) {
            return query.apply(s);
        }
    }

    private ReviewSummary update(UUID id, SessionAction action) {
        ReviewSession s = get(id);
        ReviewSummary out;
        synchronized (s) {
            action.apply(s);
            out = summarize(id, s);
        }
        announce(out);
        return out;
    }

    private ReviewSummary summarize(UUID id, ReviewSession s) {
        var pending = s.collectPendingFields();
        EditingView editing = s.editingCursor()
                .map(c -> new EditingView(c.path().key(), c.text()))
                .orElse(null);
        return new ReviewSummary(
                id,
                s.originalDoc(),
                s.enrichedDoc(),
                DiffTreeJson.write(s.diffTree()),
                s.validation().snapshot(),
                pending,
                pending.isEmpty(),
                editing
        );
    }

    private void announce(ReviewSummary summary) {
        var event = new ReviewUpdatedEvent(summary.id(), summary.pendingFields().size(), summary.exportReady());
        try {
            hub.broadcast(SseHub.REVIEW_UPDATED, om.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            log.warn("could not serialize {} for review {}", SseHub.REVIEW_UPDATED, summary.id(), e);
        }
    }

    private static FieldPath requirePath(String fieldPath) {
        if (fieldPath == null || fieldPath.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "fieldPath is required");
        }
        return FieldPath.parse(fieldPath.trim());
    }

    private static ResponseStatusException notFound(UUID id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "review not found: " + id);
    }

    @FunctionalInterface
    private interface SessionAction {
        void apply(ReviewSession session);
    }
}
