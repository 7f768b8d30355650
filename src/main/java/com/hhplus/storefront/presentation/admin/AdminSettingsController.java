package com.hhplus.storefront.presentation.admin;

import com.hhplus.storefront.application.settings.SettingsService;
import com.hhplus.storefront.presentation.settings.mapper.SettingsMapper;
import com.hhplus.storefront.presentation.settings.request.UpdatePaymentInfoRequest;
import com.hhplus.storefront.presentation.settings.response.PaymentInfoResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * AdminSettingsController - 결제 안내 변경 API (운영자 전용)
 */
@RestController
public class AdminSettingsController {

    private final SettingsService settingsService;
    private final SettingsMapper settingsMapper;

    public AdminSettingsController(SettingsService settingsService, SettingsMapper settingsMapper) {
        this.settingsService = settingsService;
        this.settingsMapper = settingsMapper;
    }

    @PutMapping("/admin/payment-info")
    public ResponseEntity<PaymentInfoResponse> updatePaymentInfo(
            @RequestHeader("X-USER-ID") Long operatorId,
            @RequestBody UpdatePaymentInfoRequest request) {
        var appResponse = settingsService.updatePaymentInfo(operatorId, settingsMapper.toUpdatePaymentInfoCommand(request));
        return ResponseEntity.ok(settingsMapper.toPaymentInfoResponse(appResponse));
    }
}
