package com.example.dococr.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 处理进度推送(SSE)
 */
@Service
@Slf4j
public class ProgressService implements ProgressListener {

    private final CopyOnWriteArrayList<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);
        emitters.add(emitter);

        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError((error) -> emitters.remove(emitter));

        log.debug("新的进度订阅，当前 {} 个", emitters.size());
        return emitter;
    }

    @Override
    public void onProgress(String message) {
        emitters.forEach(emitter -> {
            try {
                emitter.send(SseEmitter.event().name("progress").data(message));
            } catch (IOException e) {
                log.debug("进度推送失败，移除订阅: {}", e.getMessage());
                emitter.complete();
                emitters.remove(emitter);
            }
        });
    }

    public int subscriberCount() {
        return emitters.size();
    }
}
