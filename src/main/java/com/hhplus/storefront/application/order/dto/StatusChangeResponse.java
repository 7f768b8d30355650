package com.hhplus.storefront.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 운영자 상태 변경 결과
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusChangeResponse {
    private Long orderId;
    private Long userId;
    private String oldStatus;
    private String newStatus;
}
