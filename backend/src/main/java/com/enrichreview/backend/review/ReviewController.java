package com.enrichreview.backend.review;

import java.util.UUID;

import com.enrichreview.backend.review.ReviewDtos.CreateReviewRequest;
import com.enrichreview.backend.review.ReviewDtos.DocumentView;
import com.enrichreview.backend.review.ReviewDtos.EditTextRequest;
import com.enrichreview.backend.review.ReviewDtos.FieldRequest;
import com.enrichreview.backend.review.ReviewDtos.FieldView;
import com.enrichreview.backend.review.ReviewDtos.ReloadRequest;
import com.enrichreview.backend.review.ReviewDtos.ReviewSummary;
import com.enrichreview.engine.core.validation.ValidationDecision;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/reviews")
public class ReviewController {

    private final ReviewSessionService service;

    public ReviewController(ReviewSessionService service) {
        this.service = service;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ReviewSummary create(@RequestBody CreateReviewRequest body) {
        if (body == null) throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "body is required");
        if (body.enriched() != null) return service.createFromPair(body.original(), body.enriched());
        return service.createFromUrl(body.url());
    }

    @GetMapping("/{id}")
    public ReviewSummary get(@PathVariable UUID id) {
        return service.summary(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable UUID id) {
        service.delete(id);
    }

    @PostMapping("/{id}/reload")
    public ReviewSummary reload(@PathVariable UUID id, @RequestBody ReloadRequest body) {
        return service.reload(id, body == null ? null : body.url());
    }

    @GetMapping("/{id}/fields")
    public FieldView field(@PathVariable UUID id, @RequestParam("path") String path) {
        return service.field(id, path);
    }

    // ---- decisions ----

    @PostMapping("/{id}/decisions")
    public ReviewSummary decide(@PathVariable UUID id, @RequestBody ValidationDecision decision) {
        return service.decide(id, decision);
    }

    @PostMapping("/{id}/approve-all")
    public ReviewSummary approveAll(@PathVariable UUID id, @RequestBody FieldRequest body) {
        return service.approveAll(id, body == null ? null : body.fieldPath());
    }

    @PostMapping("/{id}/reset")
    public ReviewSummary reset(@PathVariable UUID id) {
        return service.resetValidation(id);
    }

    // ---- editing ----

    @PostMapping("/{id}/edit/start")
    public ReviewSummary startEdit(@PathVariable UUID id, @RequestBody FieldRequest body) {
        return service.startEdit(id, body == null ? null : body.fieldPath());
    }

    @PostMapping("/{id}/edit/update")
    public ReviewSummary updateEdit(@PathVariable UUID id, @RequestBody EditTextRequest body) {
        return service.updateEdit(id, body == null ? null : body.text());
    }

    @PostMapping("/{id}/edit/commit")
    public ReviewSummary commitEdit(@PathVariable UUID id) {
        return service.commitEdit(id);
    }

    @PostMapping("/{id}/edit/cancel")
    public ReviewSummary cancelEdit(@PathVariable UUID id) {
        return service.cancelEdit(id);
    }

    @PostMapping("/{id}/remove")
    public ReviewSummary remove(@PathVariable UUID id, @RequestBody FieldRequest body) {
        return service.removeField(id, body == null ? null : body.fieldPath());
    }

    // ---- output ----

    @GetMapping("/{id}/generate")
    public DocumentView generate(@PathVariable UUID id) {
        return service.generate(id);
    }

    @GetMapping("/{id}/export")
    public DocumentView export(@PathVariable UUID id) {
        return service.export(id);
    }
}
