package com.hhplus.storefront.presentation.admin.mapper;

import com.hhplus.storefront.application.catalog.dto.CreateProductCommand;
import com.hhplus.storefront.domain.order.OrderStatus;
import com.hhplus.storefront.presentation.admin.request.ChangeOrderStatusRequest;
import com.hhplus.storefront.presentation.admin.request.CreateProductRequest;
import com.hhplus.storefront.presentation.admin.response.StatusChangeResponse;
import org.springframework.stereotype.Component;

/**
 * AdminMapper - 운영자 API DTO 변환
 *
 * 상태 문자열은 이 경계에서 OrderStatus로 변환한다 (알 수 없는 값은 서비스까지 가지 않음).
 */
@Component
public class AdminMapper {

    public OrderStatus toOrderStatus(ChangeOrderStatusRequest request) {
        return OrderStatus.fromString(request.getStatus());
    }

    public CreateProductCommand toCreateProductCommand(CreateProductRequest request) {
        return CreateProductCommand.builder()
                .name(request.getName())
                .price(request.getPrice())
                .description(request.getDescription())
                .photoReference(request.getPhotoReference())
                .build();
    }

    public StatusChangeResponse toStatusChangeResponse(
            com.hhplus.storefront.application.order.dto.StatusChangeResponse appResponse) {
        return StatusChangeResponse.builder()
                .orderId(appResponse.getOrderId())
                .userId(appResponse.getUserId())
                .oldStatus(appResponse.getOldStatus())
                .newStatus(appResponse.getNewStatus())
                .build();
    }
}
