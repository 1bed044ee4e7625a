package com.scholary.captioner.progress;

import java.io.IOException;

/** Receives progress snapshots from the broadcaster. A subscriber that throws is dropped. */
@FunctionalInterface
public interface ProgressSubscriber {

  void onSnapshot(ProgressSnapshot snapshot) throws IOException;
}
