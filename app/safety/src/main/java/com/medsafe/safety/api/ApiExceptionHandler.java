package com.medsafe.safety.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidAnalysisRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidAnalysis(
      InvalidAnalysisRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("ANALYSIS_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(InvalidReminderRequestException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidReminder(
      InvalidReminderRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("REMINDER_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(InvalidPhoneNumberException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidPhoneNumber(
      InvalidPhoneNumberException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("NOTIFICATION_INVALID_PHONE_NUMBER", ex.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("SAFETY_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ApiErrorResponse> handleUnreadable(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("SAFETY_VALIDATION_ERROR", "malformed request"));
  }

  @ExceptionHandler(ReminderNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleReminderNotFound(ReminderNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("REMINDER_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(NotificationNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleNotificationNotFound(
      NotificationNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("NOTIFICATION_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(NotificationRetryNotAllowedException.class)
  public ResponseEntity<ApiErrorResponse> handleRetryNotAllowed(
      NotificationRetryNotAllowedException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("NOTIFICATION_RETRY_NOT_ALLOWED", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("SAFETY_INTERNAL_ERROR", ex.getMessage()));
  }
}
