package com.fintech.settlement.provider;

import com.fintech.settlement.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Looks up adapters by provider name.
 */
@Component
@Slf4j
public class ProviderAdapterRegistry {

    private final Map<String, PaymentProviderAdapter> adapters;

    public ProviderAdapterRegistry(List<PaymentProviderAdapter> adapters) {
        this.adapters = adapters.stream()
                .collect(Collectors.toUnmodifiableMap(PaymentProviderAdapter::getProviderName, Function.identity()));
        log.info("Registered payment providers: {}", this.adapters.keySet());
    }

    public PaymentProviderAdapter get(String providerName) {
        return find(providerName)
                .orElseThrow(() -> new ResourceNotFoundException("Payment provider", providerName));
    }

    public Set<String> providerNames() {
        return adapters.keySet();
    }

    public Optional<PaymentProviderAdapter> find(String providerName) {
        if (providerName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(adapters.get(providerName.toLowerCase()));
    }
}
