package com.hhplus.storefront.presentation.admin.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 상품 단일 필드 수정 요청 DTO
 * field: name | price | description | photo
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateProductFieldRequest {
    private String field;
    private String value;
}
