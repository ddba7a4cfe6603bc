package com.enrichreview.backend.sse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class SseHub {

    private static final Logger log = LoggerFactory.getLogger(SseHub.class);

    public static final String REVIEW_UPDATED = "REVIEW_UPDATED";

    private final Set<SseEmitter> emitters = ConcurrentHashMap.newKeySet();

    public SseEmitter connect() {
        SseEmitter emitter = new SseEmitter(0L); // no timeout
        emitters.add(emitter);

        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError((e) -> emitters.remove(emitter));

        try {
            emitter.send(SseEmitter.event()
                    .name("CONNECTED")
                    .data("{\"at\":\"" + Instant.now() + "\"}"));
        } catch (IOException e) {
            log.debug("client went away before hello: {}", e.getMessage());
            emitters.remove(emitter);
        }

        return emitter;
    }

    public void broadcast(String eventName, String jsonPayload) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(eventName).data(jsonPayload));
            } catch (IOException e) {
                emitters.remove(emitter);
            }
        }
    }
}
