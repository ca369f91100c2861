package kr.hhplus.be.staking.infrastructure.web.common;

import kr.hhplus.be.staking.domain.exception.StakingException;
import kr.hhplus.be.staking.domain.payment.BalanceLimitExceededException;
import kr.hhplus.be.staking.domain.payment.InsufficientBalanceException;
import kr.hhplus.be.staking.infrastructure.lock.LockAcquisitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    record ErrorResponse(String code, String message) {}

    // ========== 스테이킹 도메인 예외 ==========
    @ExceptionHandler(StakingException.class)
    ResponseEntity<ErrorResponse> handleStaking(StakingException e) {
        HttpStatus status = switch (e.getCategory()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case STATE_CONFLICT, TIME_WINDOW, ACCOUNTING -> HttpStatus.CONFLICT;
        };
        log.warn("[Staking] 요청 거절 - code: {}, message: {}", e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(e.getErrorCode().name(), e.getMessage()));
    }

    // ========== 지갑 관련 예외 ==========
    @ExceptionHandler(InsufficientBalanceException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleInsufficientBalance(InsufficientBalanceException e) {
        log.warn("[Wallet] 잔액 부족 - walletId: {}, requested: {}, balance: {}",
                e.getWalletId(), e.getRequestedAmount(), e.getCurrentBalance());
        return new ErrorResponse("INSUFFICIENT_BALANCE", e.getMessage());
    }

    @ExceptionHandler(BalanceLimitExceededException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    ErrorResponse handleBalanceLimit(BalanceLimitExceededException e) {
        log.warn("[Wallet] 잔액 한도 초과 - walletId: {}, message: {}", e.getWalletId(), e.getMessage());
        return new ErrorResponse("BALANCE_LIMIT_EXCEEDED", e.getMessage());
    }

    // ========== 락 관련 예외 ==========
    @ExceptionHandler(LockAcquisitionException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    ErrorResponse handleLockAcquisition(LockAcquisitionException e) {
        return new ErrorResponse("LOCK_ACQUISITION_FAILED", e.getMessage());
    }

    // ========== 요청 형식 예외 ==========
    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleInvalidRequest(MethodArgumentNotValidException e) {
        return new ErrorResponse("INVALID_REQUEST", "요청 값이 올바르지 않습니다");
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    ErrorResponse handleMissingHeader(MissingRequestHeaderException e) {
        return new ErrorResponse("MISSING_CALLER", e.getHeaderName() + " 헤더가 필요합니다");
    }

    // ========== 일반 예외 ==========
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    ErrorResponse handleIllegalArgument(IllegalArgumentException e) {
        return new ErrorResponse("INVALID_ARGUMENT", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    ErrorResponse handleGenericException(Exception e) {
        log.error("처리되지 않은 예외", e);
        return new ErrorResponse("INTERNAL_ERROR", "서버 내부 오류가 발생했습니다");
    }
}
