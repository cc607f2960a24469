package by.greenmobile.psychrocalc.controller;

import by.greenmobile.psychrocalc.config.RequestIdFilter;
import by.greenmobile.psychrocalc.entity.ErrorResponse;
import by.greenmobile.psychrocalc.service.physics.ConvergenceException;
import by.greenmobile.psychrocalc.service.physics.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Engine failures as JSON: invalid input → 400, solver non-convergence → 422.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> invalidInput(InvalidInputException e) {
        log.warn("Rejected: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, e.getKind().name(), e.getMessage(), null);
    }

    @ExceptionHandler(ConvergenceException.class)
    public ResponseEntity<ErrorResponse> convergence(ConvergenceException e) {
        log.warn("Solver failed: {}", e.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, e.getKind().name(), e.getMessage(), e.getIterations());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> validation(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(ApiExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        log.warn("Validation failed: {}", msg);
        return body(HttpStatus.BAD_REQUEST, "VALIDATION", msg, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable body: {}", e.getMostSpecificCause().getMessage());
        return body(HttpStatus.BAD_REQUEST, "VALIDATION", "Malformed request body", null);
    }

    private static String describe(FieldError fe) {
        return fe.getField() + " " + fe.getDefaultMessage();
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String error, String message, Integer iterations) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(error, message, iterations, MDC.get(RequestIdFilter.MDC_RID)));
    }
}
