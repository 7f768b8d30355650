package com.hhplus.storefront.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문(체크아웃) 커맨드 - 전송 계층이 수집한 주문자 정보
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutCommand {
    private String customerName;
    private String phone;
    private String address;
    private String note;
}
