package com.hhplus.storefront.presentation.common;

import com.hhplus.storefront.common.exception.BizException;
import com.hhplus.storefront.common.exception.DomainException;
import com.hhplus.storefront.common.exception.ErrorCode;
import com.hhplus.storefront.common.exception.SystemException;
import com.hhplus.storefront.presentation.common.response.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 에러 응답 형식:
 * {
 *   "error_code": "DOMAIN_ORDER_NOT_FOUND",
 *   "error_message": "주문을 찾을 수 없습니다 | Order ID: 7",
 *   "timestamp": "2025-11-07T12:34:56.000Z",
 *   "request_id": "req-abc123def456"
 * }
 *
 * HTTP 상태 코드 매핑:
 * - BizException: ErrorCode에 정의된 상태 (4XX 도메인 규칙, 5XX 시스템)
 * - 400 INVALID_REQUEST: 알 수 없는 주문 상태 문자열, 잘못된 본문/헤더/경로 변수
 * - 503 SYSTEM_STORE_UNAVAILABLE: 저장소 연결 실패
 * - 500 SYSTEM_INTERNAL_SERVER_ERROR: 그 밖의 예외
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String INVALID_REQUEST = "INVALID_REQUEST";

    /**
     * 도메인 규칙 위반 (4XX)
     * 사용자에게 그대로 안내 가능한 복구 가능 오류이므로 WARN으로 남긴다.
     */
    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomainException(DomainException e) {
        logger.warn("[GlobalExceptionHandler] 도메인 예외 - code={}, message={}", e.getErrorCodeValue(), e.getMessage());
        return toResponse(e);
    }

    @ExceptionHandler(SystemException.class)
    public ResponseEntity<ErrorResponse> handleSystemException(SystemException e) {
        logger.error("[GlobalExceptionHandler] 시스템 예외 - code={}", e.getErrorCodeValue(), e);
        return toResponse(e);
    }

    /**
     * 서비스 계층 밖(예: 컨트롤러 진입 전)에서 발생한 저장소 연결 실패
     */
    @ExceptionHandler({DataAccessResourceFailureException.class, CannotCreateTransactionException.class})
    public ResponseEntity<ErrorResponse> handleStoreUnavailable(RuntimeException e) {
        logger.error("[GlobalExceptionHandler] 저장소 연결 실패", e);
        ErrorCode errorCode = ErrorCode.STORE_UNAVAILABLE;
        return ResponseEntity.status(errorCode.getStatusCode())
                .body(ErrorResponse.of(errorCode.getCode(), errorCode.getMessage()));
    }

    /**
     * 잘못된 요청 값 (400)
     * - OrderStatus.fromString: 알 수 없는 상태 문자열
     * - 필수 입력 누락
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(INVALID_REQUEST, e.getMessage()));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(INVALID_REQUEST, "필수 헤더가 없습니다: " + e.getHeaderName()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(INVALID_REQUEST, "요청 형식이 올바르지 않습니다"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        logger.error("[GlobalExceptionHandler] 처리되지 않은 예외", e);
        ErrorCode errorCode = ErrorCode.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(errorCode.getStatusCode())
                .body(ErrorResponse.of(errorCode.getCode(), errorCode.getMessage()));
    }

    private ResponseEntity<ErrorResponse> toResponse(BizException e) {
        return ResponseEntity.status(e.getStatusCode())
                .body(ErrorResponse.of(e.getErrorCodeValue(), e.getMessage()));
    }
}
