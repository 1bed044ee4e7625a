package com.scholary.captioner.progress;

import com.scholary.captioner.job.WorkerSubstage;

/** What one worker is doing at the time of a snapshot. */
public record WorkerProgress(
    int workerId,
    String device,
    String currentVideo,
    WorkerSubstage substage,
    double substageProgress) {}
