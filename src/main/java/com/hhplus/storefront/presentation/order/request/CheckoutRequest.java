package com.hhplus.storefront.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 체크아웃 요청 DTO
 * note가 "-" 이면 메모 없음으로 처리한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutRequest {
    @JsonProperty("customer_name")
    private String customerName;

    private String phone;

    private String address;

    private String note;
}
