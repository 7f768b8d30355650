package com.hhplus.storefront.application.settings;

import com.hhplus.storefront.application.settings.dto.PaymentInfoResponse;
import com.hhplus.storefront.application.settings.dto.UpdatePaymentInfoCommand;
import com.hhplus.storefront.domain.operator.OperatorIdentity;
import com.hhplus.storefront.domain.settings.InvalidSettingException;
import com.hhplus.storefront.domain.settings.Setting;
import com.hhplus.storefront.domain.settings.SettingKeys;
import com.hhplus.storefront.domain.settings.SettingsRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SettingsService - 키/값 설정 (Application 계층)
 * 결제 안내 문구와 결제 수단 목록만 다루며, 주문 상태 머신은 이 설정을 참조하지 않는다.
 */
@Slf4j
@Service
public class SettingsService {

    private final SettingsRepository settingsRepository;
    private final OperatorIdentity operatorIdentity;

    public SettingsService(SettingsRepository settingsRepository,
                           OperatorIdentity operatorIdentity) {
        this.settingsRepository = settingsRepository;
        this.operatorIdentity = operatorIdentity;
    }

    @Transactional(readOnly = true)
    public String get(String key, String defaultValue) {
        return settingsRepository.findByKey(key)
                .map(Setting::getValue)
                .orElse(defaultValue);
    }

    @Transactional
    public void set(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new InvalidSettingException(String.valueOf(key), "설정 키는 필수입니다");
        }
        String normalized = value == null ? "" : value;
        Setting setting = settingsRepository.findByKey(key)
                .orElseGet(() -> Setting.of(key, normalized));
        setting.changeValue(normalized);
        settingsRepository.save(setting);
    }

    @Transactional(readOnly = true)
    public PaymentInfoResponse getPaymentInfo() {
        String methods = get(SettingKeys.PAYMENT_METHODS, SettingKeys.DEFAULT_PAYMENT_METHODS);
        String text = get(SettingKeys.PAYMENT_TEXT, SettingKeys.DEFAULT_PAYMENT_TEXT);
        return PaymentInfoResponse.builder()
                .methods(splitMethods(methods))
                .text(text)
                .build();
    }

    /**
     * 결제 안내 변경 (운영자 전용)
     * text가 null이면 기존 문구를 유지한다.
     */
    @Transactional
    public PaymentInfoResponse updatePaymentInfo(Long operatorId, UpdatePaymentInfoCommand command) {
        operatorIdentity.requireOperator(operatorId);

        List<String> methods = splitMethods(command.getMethods());
        if (methods.isEmpty()) {
            throw new InvalidSettingException(SettingKeys.PAYMENT_METHODS, "결제 수단은 1개 이상이어야 합니다");
        }
        set(SettingKeys.PAYMENT_METHODS, String.join(",", methods));
        if (command.getText() != null) {
            set(SettingKeys.PAYMENT_TEXT, command.getText());
        }

        log.info("[SettingsService] 결제 안내 변경 - operatorId={}, methods={}", operatorId, methods);
        return getPaymentInfo();
    }

    private static List<String> splitMethods(String methods) {
        if (methods == null) {
            return List.of();
        }
        return Arrays.stream(methods.split(","))
                .map(String::trim)
                .filter(method -> !method.isEmpty())
                .collect(Collectors.toList());
    }
}
