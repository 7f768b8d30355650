package com.hhplus.storefront.presentation.settings;

import com.hhplus.storefront.application.settings.SettingsService;
import com.hhplus.storefront.presentation.settings.mapper.SettingsMapper;
import com.hhplus.storefront.presentation.settings.response.PaymentInfoResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * SettingsController - 결제 안내 조회 API (누구나 조회 가능)
 */
@RestController
public class SettingsController {

    private final SettingsService settingsService;
    private final SettingsMapper settingsMapper;

    public SettingsController(SettingsService settingsService, SettingsMapper settingsMapper) {
        this.settingsService = settingsService;
        this.settingsMapper = settingsMapper;
    }

    /**
     * 결제 안내 (GET /api/payment-info)
     */
    @GetMapping("/payment-info")
    public ResponseEntity<PaymentInfoResponse> getPaymentInfo() {
        return ResponseEntity.ok(settingsMapper.toPaymentInfoResponse(settingsService.getPaymentInfo()));
    }
}
