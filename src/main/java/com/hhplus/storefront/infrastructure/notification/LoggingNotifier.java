package com.hhplus.storefront.infrastructure.notification;

import com.hhplus.storefront.domain.notification.Notifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 로그 기반 Notifier 구현
 * 채팅 전송 계층이 연결되기 전까지 메시지를 로그로 남긴다.
 */
@Component
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notify(Long userId, String text) {
        log.info("[LoggingNotifier] to={} | {}", userId, text);
    }
}
