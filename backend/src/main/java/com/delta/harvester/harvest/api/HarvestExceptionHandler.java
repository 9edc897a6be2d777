package com.delta.harvester.harvest.api;

import com.delta.harvester.harvest.persistence.StateDocumentException;
import com.delta.harvester.harvest.service.ActiveHarvestRunException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class HarvestExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(HarvestExceptionHandler.class);

  @ExceptionHandler(ActiveHarvestRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveHarvestRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_harvest_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(StateDocumentException.class)
  public ResponseEntity<Map<String, String>> handleStateDocument(StateDocumentException ex) {
    log.error("Harvest state document unusable", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "state_document", "message", String.valueOf(ex.getMessage())));
  }
}
