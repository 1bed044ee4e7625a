package com.scholary.captioner.device;

import com.scholary.captioner.frames.FrameExtractor;
import com.scholary.captioner.generation.ModelServerClient;
import org.springframework.stereotype.Component;

/** Creates {@link ModelServerDeviceBackend}s sharing one frame extractor and HTTP client. */
@Component
public class ModelServerDeviceBackendFactory implements DeviceBackendFactory {

  private final FrameExtractor frameExtractor;
  private final ModelServerClient modelServerClient;

  public ModelServerDeviceBackendFactory(
      FrameExtractor frameExtractor, ModelServerClient modelServerClient) {
    this.frameExtractor = frameExtractor;
    this.modelServerClient = modelServerClient;
  }

  @Override
  public DeviceBackend create(String device) {
    return new ModelServerDeviceBackend(device, frameExtractor, modelServerClient);
  }
}
