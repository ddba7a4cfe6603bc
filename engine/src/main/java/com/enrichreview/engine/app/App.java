package com.enrichreview.engine.app;

import java.net.http.HttpClient;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.enrichreview.engine.core.pipeline.DocumentPairSource;
import com.enrichreview.engine.core.pipeline.HttpDocumentPairSource;
import com.enrichreview.engine.core.pipeline.SampleDocumentPairSource;
import com.enrichreview.engine.core.review.StatelessReviewService;
import com.enrichreview.engine.model.pipeline.EnrichmentRequest;
import com.enrichreview.engine.model.review.DiffRequest;
import com.enrichreview.engine.model.review.FieldChangeRequest;
import com.enrichreview.engine.model.review.ReviewRequest;
import com.enrichreview.engine.routing.Router;
import com.fasterxml.jackson.databind.ObjectMapper;

public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static volatile App INSTANCE;

    public final Config config;
    public final ObjectMapper om;
    public final HttpClient http;
    public final DocumentPairSource pairs;
    public final StatelessReviewService review;

    public final Router router;

    private App() {
        this.config = Config.fromEnv();
        this.om = new ObjectMapper();

        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();

        this.pairs = config.useHttpSource()
                ? new HttpDocumentPairSource(http, om, config.pipelineBaseUrl(), config.pipelineTimeout())
                : new SampleDocumentPairSource(om);
        log.info("document pairs from '{}' source", pairs.name());

        this.review = new StatelessReviewService(pairs);

        this.router = new Router()
                .add("GET", "/healthz", (evt, ctx) -> new Healthz(true, pairs.name()))

                // -----------------------
                // diff + validation
                // -----------------------
                .add("POST", "/review/diff", (evt, ctx) ->
                        review.diff(Json.read(om, evt.getBody(), DiffRequest.class)))

                .add("POST", "/review/pending", (evt, ctx) ->
                        review.pending(Json.read(om, evt.getBody(), ReviewRequest.class)))

                // -----------------------
                // merge
                // -----------------------
                .add("POST", "/review/generate", (evt, ctx) ->
                        review.generate(Json.read(om, evt.getBody(), ReviewRequest.class)))

                .add("POST", "/review/export", (evt, ctx) ->
                        review.export(Json.read(om, evt.getBody(), ReviewRequest.class)))

                // -----------------------
                // edits
                // -----------------------
                .add("POST", "/review/edit", (evt, ctx) ->
                        review.edit(Json.read(om, evt.getBody(), FieldChangeRequest.class)))

                .add("POST", "/review/remove", (evt, ctx) ->
                        review.remove(Json.read(om, evt.getBody(), FieldChangeRequest.class)))

                // -----------------------
                // pipeline
                // -----------------------
                .add("POST", "/review/fetch-pair", (evt, ctx) ->
                        review.fetchPair(Json.read(om, evt.getBody(), EnrichmentRequest.class)));
    }

    public static App get() {
        if (INSTANCE == null) {
            synchronized (App.class) {
                if (INSTANCE == null) INSTANCE = new App();
            }
        }
        return INSTANCE;
    }

    public record Healthz(boolean ok, String pairSource) {}

    static final class Json {
        static <T> T read(ObjectMapper om, String body, Class<T> cls) throws Exception {
            if (body == null || body.isBlank()) throw new IllegalArgumentException("empty body");
            return om.readValue(body, cls);
        }
    }
}
