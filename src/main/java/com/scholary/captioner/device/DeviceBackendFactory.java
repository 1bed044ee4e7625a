package com.scholary.captioner.device;

/** Creates an unprepared backend for a device name such as {@code cuda:0}. */
@FunctionalInterface
public interface DeviceBackendFactory {

  DeviceBackend create(String device);
}
