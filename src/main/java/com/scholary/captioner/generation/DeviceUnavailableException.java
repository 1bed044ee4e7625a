package com.scholary.captioner.generation;

/**
 * Exception thrown when the model instance for a device can no longer serve requests.
 *
 * <p>Unlike {@link GenerationException} this is not about one video: every remaining video on
 * that device would fail the same way, so the whole job is stopped.
 */
public class DeviceUnavailableException extends RuntimeException {

  private final String device;

  public DeviceUnavailableException(String device, String message) {
    super(message);
    this.device = device;
  }

  public DeviceUnavailableException(String device, String message, Throwable cause) {
    super(message, cause);
    this.device = device;
  }

  public String getDevice() {
    return device;
  }
}
