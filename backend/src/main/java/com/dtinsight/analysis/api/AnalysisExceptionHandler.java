package com.dtinsight.analysis.api;

import com.dtinsight.analysis.engine.AnalysisException;
import java.util.Map;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class AnalysisExceptionHandler {

  @ExceptionHandler(AnalysisException.class)
  public ResponseEntity<Map<String, String>> handleAnalysisFailure(AnalysisException ex) {
    ResponseStatus status = AnnotatedElementUtils.findMergedAnnotation(ex.getClass(), ResponseStatus.class);
    HttpStatus httpStatus = status == null ? HttpStatus.BAD_REQUEST : status.code();
    String message = ex.getMessage() == null ? "" : ex.getMessage();
    return ResponseEntity.status(httpStatus)
        .body(Map.of("error", ex.errorCode(), "message", message));
  }
}
