package com.hhplus.storefront.domain.notification;

/**
 * 알림 전달 실패 예외
 * 주문 상태에는 영향을 주지 않으므로 ErrorCode 계층에 포함하지 않는다.
 */
public class NotificationException extends RuntimeException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
