package com.hhplus.storefront.presentation.settings.mapper;

import com.hhplus.storefront.application.settings.dto.UpdatePaymentInfoCommand;
import com.hhplus.storefront.presentation.settings.request.UpdatePaymentInfoRequest;
import com.hhplus.storefront.presentation.settings.response.PaymentInfoResponse;
import org.springframework.stereotype.Component;

@Component
public class SettingsMapper {

    public UpdatePaymentInfoCommand toUpdatePaymentInfoCommand(UpdatePaymentInfoRequest request) {
        return UpdatePaymentInfoCommand.builder()
                .methods(request.getMethods())
                .text(request.getText())
                .build();
    }

    public PaymentInfoResponse toPaymentInfoResponse(
            com.hhplus.storefront.application.settings.dto.PaymentInfoResponse appResponse) {
        return PaymentInfoResponse.builder()
                .methods(appResponse.getMethods())
                .text(appResponse.getText())
                .build();
    }
}
