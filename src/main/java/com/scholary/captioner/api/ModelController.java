package com.scholary.captioner.api;

import com.scholary.captioner.device.ModelStatus;
import com.scholary.captioner.device.ModelsBusyException;
import com.scholary.captioner.generation.ModelLoadException;
import com.scholary.captioner.service.JobConflictException;
import com.scholary.captioner.service.ProcessingManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Preloading and unloading the caption model between jobs. */
@RestController
@RequestMapping("/api/model")
@Tag(name = "Models", description = "Models resident on the compute devices")
public class ModelController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModelController.class);

  private final ProcessingManager processingManager;

  public ModelController(ProcessingManager processingManager) {
    this.processingManager = processingManager;
  }

  @GetMapping("/status")
  @Operation(summary = "List the devices holding a loaded model")
  public ResponseEntity<ModelStatus> status() {
    return ResponseEntity.ok(processingManager.modelStatus());
  }

  @PostMapping("/load")
  @Operation(
      summary = "Preload the default model",
      description =
          "Loads the default model on every configured device so the next job skips loading. "
              + "Returns 409 while a job is running.")
  public ResponseEntity<ModelStatus> load() {
    try {
      return ResponseEntity.ok(processingManager.loadModels());

    } catch (JobConflictException | ModelsBusyException e) {
      LOGGER.warn("Model load rejected: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.CONFLICT).build();
    } catch (ModelLoadException e) {
      LOGGER.error("Model load failed", e);
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
  }

  @PostMapping("/unload")
  @Operation(
      summary = "Unload every resident model",
      description = "Frees the devices. Returns 409 while a job is running.")
  public ResponseEntity<ModelStatus> unload() {
    try {
      return ResponseEntity.ok(processingManager.unloadModels());

    } catch (JobConflictException | ModelsBusyException e) {
      LOGGER.warn("Model unload rejected: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.CONFLICT).build();
    }
  }
}
