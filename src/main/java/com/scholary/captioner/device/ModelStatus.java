package com.scholary.captioner.device;

import java.util.List;

/** Models currently resident on devices. */
public record ModelStatus(
    boolean loaded, String modelId, String dtype, List<String> devicesLoaded) {

  public ModelStatus {
    devicesLoaded = List.copyOf(devicesLoaded);
  }
}
