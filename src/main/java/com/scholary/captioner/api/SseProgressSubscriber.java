package com.scholary.captioner.api;

import com.scholary.captioner.progress.ProgressSnapshot;
import com.scholary.captioner.progress.ProgressSubscriber;
import java.io.IOException;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Sends progress snapshots to one Server-Sent Events client as {@code progress} events. */
public class SseProgressSubscriber implements ProgressSubscriber {

  static final String EVENT_NAME = "progress";

  private final SseEmitter emitter;

  public SseProgressSubscriber(SseEmitter emitter) {
    this.emitter = emitter;
  }

  @Override
  public void onSnapshot(ProgressSnapshot snapshot) throws IOException {
    emitter.send(SseEmitter.event().name(EVENT_NAME).data(snapshot, MediaType.APPLICATION_JSON));
  }
}
