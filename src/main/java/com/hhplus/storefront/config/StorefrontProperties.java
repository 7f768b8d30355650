package com.hhplus.storefront.config;

import com.hhplus.storefront.domain.order.OrderTransitionPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * storefront.* 설정
 *
 * - operatorIds: 운영자 사용자 ID 허용 목록
 * - transitionPolicy: 운영자 상태 변경 정책 (기본 PERMISSIVE)
 * - currency: 알림 문구에 표시할 통화 코드 (금액은 항상 최소 단위 정수)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "storefront")
public class StorefrontProperties {

    private List<Long> operatorIds = new ArrayList<>();

    private OrderTransitionPolicy transitionPolicy = OrderTransitionPolicy.PERMISSIVE;

    private String currency = "MMK";
}
