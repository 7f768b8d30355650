package com.hhplus.storefront.infrastructure.operator;

import com.hhplus.storefront.config.StorefrontProperties;
import com.hhplus.storefront.domain.operator.OperatorIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * storefront.operator-ids 허용 목록 기반 OperatorIdentity 구현 (Adapter)
 * 목록은 기동 시 한 번 복사되며 이후 변경되지 않는다.
 */
@Slf4j
@Component
public class ConfiguredOperatorIdentity implements OperatorIdentity {

    private final Set<Long> operatorIds;

    public ConfiguredOperatorIdentity(StorefrontProperties properties) {
        this.operatorIds = properties.getOperatorIds() == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(properties.getOperatorIds()));
        if (operatorIds.isEmpty()) {
            log.warn("[ConfiguredOperatorIdentity] storefront.operator-ids 가 비어 있습니다. 운영자 기능을 사용할 수 없습니다");
        }
    }

    @Override
    public boolean isOperator(Long userId) {
        return userId != null && operatorIds.contains(userId);
    }

    @Override
    public Set<Long> operatorIds() {
        return operatorIds;
    }
}
