package com.hhplus.storefront.domain.notification;

/**
 * Notifier Interface (Domain Layer - Port)
 *
 * 사용자에게 메시지를 전달하는 외부 메신저 연동 지점.
 * 전달은 best-effort이며 실패는 호출 측(이벤트 리스너)에서 로그로 남기고 무시한다.
 */
public interface Notifier {

    /**
     * @throws NotificationException 전달 실패
     */
    void notify(Long userId, String text);
}
