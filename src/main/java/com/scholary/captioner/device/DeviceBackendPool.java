package com.scholary.captioner.device;

import com.scholary.captioner.job.GenerationSettings;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Prepared backends that stay loaded between jobs.
 *
 * <p>A backend is resident per device and reused by the next job asking for the same model and
 * dtype. A job leases its backends while it runs; leased backends are never unloaded or replaced.
 * Loads and unloads are serialized; {@link #status()} never waits for them.
 */
@Component
public class DeviceBackendPool {

  private static final Logger LOGGER = LoggerFactory.getLogger(DeviceBackendPool.class);

  private record Resident(DeviceBackend backend, String modelId, String dtype) {
    boolean serves(GenerationSettings settings) {
      return modelId.equals(settings.modelId()) && dtype.equals(settings.dtype());
    }
  }

  private final DeviceBackendFactory backendFactory;
  private final Map<String, Resident> resident = new ConcurrentHashMap<>();
  private final Set<String> leased = ConcurrentHashMap.newKeySet();
  private final Object lock = new Object();

  public DeviceBackendPool(DeviceBackendFactory backendFactory) {
    this.backendFactory = backendFactory;
  }

  /**
   * Lease a prepared backend for a device, loading the model unless it is already resident.
   *
   * <p>A resident backend holding another model is unloaded first.
   *
   * @throws com.scholary.captioner.generation.ModelLoadException if the model cannot be loaded
   * @throws ModelsBusyException if the device is already leased
   */
  public DeviceBackend acquire(String device, GenerationSettings settings) {
    synchronized (lock) {
      if (leased.contains(device)) {
        throw new ModelsBusyException("Device " + device + " is in use");
      }

      Resident current = resident.get(device);
      if (current != null && current.serves(settings)) {
        LOGGER.info("Reusing {} already loaded on {}", settings.modelId(), device);
        leased.add(device);
        return current.backend();
      }
      if (current != null) {
        LOGGER.info("Replacing {} on {} with {}", current.modelId(), device, settings.modelId());
        resident.remove(device);
        current.backend().shutdown();
      }

      DeviceBackend backend = backendFactory.create(device);
      backend.prepare(settings);
      resident.put(device, new Resident(backend, settings.modelId(), settings.dtype()));
      leased.add(device);
      return backend;
    }
  }

  /** Return a leased backend. It stays loaded for the next job. */
  public void release(DeviceBackend backend) {
    synchronized (lock) {
      leased.remove(backend.device());
    }
  }

  /** Return a leased backend that should not be reused, and unload it. */
  public void discard(DeviceBackend backend) {
    synchronized (lock) {
      leased.remove(backend.device());
      Resident entry = resident.get(backend.device());
      if (entry != null && entry.backend() == backend) {
        resident.remove(backend.device());
      }
    }
    backend.shutdown();
  }

  /**
   * Make sure every device holds the model, without leasing.
   *
   * @throws com.scholary.captioner.generation.ModelLoadException if a device fails to load
   * @throws ModelsBusyException if any device is leased
   */
  public void preload(List<String> devices, GenerationSettings settings) {
    synchronized (lock) {
      for (String device : devices) {
        release(acquire(device, settings));
      }
    }
  }

  /**
   * Unload every resident model.
   *
   * @throws ModelsBusyException if a job holds any backend
   */
  public void unloadAll() {
    List<DeviceBackend> unloaded = new ArrayList<>();
    synchronized (lock) {
      if (!leased.isEmpty()) {
        throw new ModelsBusyException("Models are in use on " + leased);
      }
      for (Resident entry : resident.values()) {
        unloaded.add(entry.backend());
      }
      resident.clear();
    }
    for (DeviceBackend backend : unloaded) {
      backend.shutdown();
    }
    LOGGER.info("Unloaded models from {} devices", unloaded.size());
  }

  public ModelStatus status() {
    List<String> devices = new ArrayList<>();
    String modelId = null;
    String dtype = null;
    for (Map.Entry<String, Resident> entry : resident.entrySet()) {
      devices.add(entry.getKey());
      modelId = entry.getValue().modelId();
      dtype = entry.getValue().dtype();
    }
    devices.sort(Comparator.naturalOrder());
    return new ModelStatus(!devices.isEmpty(), modelId, dtype, devices);
  }

  @PreDestroy
  public void shutdown() {
    List<Resident> remaining;
    synchronized (lock) {
      remaining = new ArrayList<>(resident.values());
      resident.clear();
      leased.clear();
    }
    for (Resident entry : remaining) {
      entry.backend().shutdown();
    }
  }
}
