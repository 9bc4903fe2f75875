package com.worksync.schedule.common.exception;

import com.worksync.schedule.conflicts.exception.ConflictNotFoundException;
import com.worksync.schedule.recurrence.exception.InvalidPatternException;
import com.worksync.schedule.recurrence.exception.RangeTooLargeException;
import com.worksync.schedule.schedules.exception.InvalidScheduleException;
import com.worksync.schedule.schedules.exception.InvalidScopeException;
import com.worksync.schedule.schedules.exception.OccurrenceNotFoundException;
import com.worksync.schedule.schedules.exception.ScheduleEntryNotFoundException;
import com.worksync.schedule.schedules.exception.TransactionFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.TransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * 일정 엔트리 관련 예외 처리
     */
    @ExceptionHandler(ScheduleEntryNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEntryNotFound(ScheduleEntryNotFoundException e) {
        log.error("일정을 찾을 수 없음: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("SCHEDULE_ENTRY_NOT_FOUND", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    @ExceptionHandler(OccurrenceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleOccurrenceNotFound(OccurrenceNotFoundException e) {
        log.error("회차를 찾을 수 없음: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("OCCURRENCE_NOT_FOUND", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    @ExceptionHandler(InvalidScheduleException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSchedule(InvalidScheduleException e) {
        log.error("잘못된 일정 데이터: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("INVALID_SCHEDULE", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    @ExceptionHandler(InvalidScopeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidScope(InvalidScopeException e) {
        log.error("잘못된 수정 범위: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("INVALID_SCOPE", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    @ExceptionHandler(TransactionFailedException.class)
    public ResponseEntity<ErrorResponse> handleTransactionFailed(TransactionFailedException e) {
        log.error("트랜잭션 실패: {}", e.getMessage(), e);
        ErrorResponse errorResponse = new ErrorResponse("TRANSACTION_FAILED", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse);
    }

    /**
     * 커밋 시점 실패 (서비스 밖에서 발생)
     */
    @ExceptionHandler({DataAccessException.class, TransactionException.class})
    public ResponseEntity<ErrorResponse> handleCommitFailure(RuntimeException e) {
        log.error("커밋 실패: {}", e.getMessage(), e);
        ErrorResponse errorResponse = new ErrorResponse("TRANSACTION_FAILED", "변경 사항을 저장하지 못했습니다. 변경 사항은 적용되지 않았습니다.");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(errorResponse);
    }

    /**
     * 반복 규칙 관련 예외 처리
     */
    @ExceptionHandler(InvalidPatternException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPattern(InvalidPatternException e) {
        log.error("잘못된 반복 규칙: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("INVALID_PATTERN", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    @ExceptionHandler(RangeTooLargeException.class)
    public ResponseEntity<ErrorResponse> handleRangeTooLarge(RangeTooLargeException e) {
        log.error("전개 범위 초과: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("RANGE_TOO_LARGE", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 충돌 기록 관련 예외 처리
     */
    @ExceptionHandler(ConflictNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleConflictNotFound(ConflictNotFoundException e) {
        log.error("충돌 기록을 찾을 수 없음: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("CONFLICT_NOT_FOUND", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    /**
     * 테넌트 헤더 누락
     */
    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("필수 헤더 누락: {}", e.getHeaderName());
        ErrorResponse errorResponse = new ErrorResponse("MISSING_HEADER", "필수 헤더가 없습니다: " + e.getHeaderName());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 요청 파라미터/본문 형식 오류
     */
    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("잘못된 요청 형식: {}", e.getMessage());
        ErrorResponse errorResponse = new ErrorResponse("BAD_REQUEST", "요청 형식이 올바르지 않습니다: " + e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 존재하지 않는 리소스/엔드포인트 처리 (404)
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResourceFound(NoResourceFoundException e) {
        log.error("존재하지 않는 리소스: {} {}", e.getHttpMethod(), e.getResourcePath());
        ErrorResponse errorResponse = new ErrorResponse("NOT_FOUND", "요청한 API를 찾을 수 없습니다: " + e.getHttpMethod() + " " + e.getResourcePath());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    /**
     * @Valid 검증 실패 시 처리
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationExceptions(
            MethodArgumentNotValidException ex) {

        Map<String, Object> response = new HashMap<>();
        Map<String, String> errors = new HashMap<>();

        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = ((FieldError) error).getField();
            String errorMessage = error.getDefaultMessage();
            errors.put(fieldName, errorMessage);
        });

        response.put("status", "error");
        response.put("message", "입력값 검증에 실패했습니다");
        response.put("errors", errors);

        log.warn("Validation 실패: {}", errors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    /**
     * 모든 예외 처리 (최종 catch-all)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("예상치 못한 예외 발생: {}", ex.getMessage(), ex);
        ErrorResponse errorResponse = new ErrorResponse("INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다.");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }
}
