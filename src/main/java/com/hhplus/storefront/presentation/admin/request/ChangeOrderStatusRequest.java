package com.hhplus.storefront.presentation.admin.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 상태 변경 요청 DTO
 * status는 OrderStatus 이름 (대소문자 무관). 알 수 없는 값은 400 INVALID_REQUEST.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeOrderStatusRequest {
    private String status;
}
