package com.library.circulation.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String KIND = "kind";

    @ExceptionHandler(BusinessException.class)
    public ProblemDetail handleBusiness(BusinessException ex) {
        ProblemDetail pd = ProblemDetail.forStatus(statusOf(ex.getKind()));
        pd.setDetail(ex.getMessage());
        pd.setProperty(KIND, ex.getKind());
        return pd;
    }

    @ExceptionHandler(InvariantViolationException.class)
    public ProblemDetail handleInvariantViolation(InvariantViolationException ex) {
        log.error("Invariant violation, transaction rolled back: {}", ex.getMessage(), ex);
        ProblemDetail pd = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
        pd.setDetail("Internal consistency error");
        pd.setProperty(KIND, ex.getKind());
        return pd;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        ProblemDetail pd = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        String errors = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
            .reduce("", (a, b) -> a + "; " + b);
        pd.setDetail("Validation failed:" + errors);
        pd.setProperty(KIND, ErrorKind.VALIDATION_ERROR);
        return pd;
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        ProblemDetail pd = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        pd.setDetail("Malformed value for '" + ex.getName() + "': " + ex.getValue());
        pd.setProperty(KIND, ErrorKind.VALIDATION_ERROR);
        return pd;
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        ProblemDetail pd = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
        pd.setDetail("Malformed request body");
        pd.setProperty(KIND, ErrorKind.VALIDATION_ERROR);
        return pd;
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case OUT_OF_STOCK, ALREADY_RETURNED -> HttpStatus.CONFLICT;
            case EXCEEDS_LOAN_LIMIT, HAS_OVERDUE_LOANS -> HttpStatus.UNPROCESSABLE_ENTITY;
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case INVARIANT_VIOLATION -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
