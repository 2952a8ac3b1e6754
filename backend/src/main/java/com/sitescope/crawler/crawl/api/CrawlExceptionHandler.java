package com.sitescope.crawler.crawl.api;

import com.sitescope.crawler.crawl.service.SchedulerStateException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(SchedulerStateException.class)
  public ResponseEntity<Map<String, String>> handleSchedulerState(SchedulerStateException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", ex.getCode(), "message", ex.getMessage()));
  }
}
