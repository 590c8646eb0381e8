package com.opencalsync.sync.client;

import com.opencalsync.common.dto.BaseResponse;
import com.opencalsync.common.exception.ResourceNotFoundException;
import com.opencalsync.common.exception.ServiceUnavailableException;
import com.opencalsync.sync.client.dto.PropertyResponse;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

@Slf4j
@Component
@RequiredArgsConstructor
public class FeignPropertyDirectory implements PropertyDirectory {

    private final PropertyClient propertyClient;

    @Override
    @CircuitBreaker(name = "property-directory", fallbackMethod = "directoryUnavailable")
    public void requireOwner(Long propertyId, Long userId) {
        PropertyResponse property;
        try {
            BaseResponse<PropertyResponse> response = propertyClient.getProperty(propertyId);
            property = response == null ? null : response.getData();
        } catch (FeignException.NotFound e) {
            property = null;
        }
        if (property == null || !Objects.equals(property.ownerId(), userId)) {
            log.warn("User {} is not the owner of property {}", userId, propertyId);
            throw new ResourceNotFoundException("Property", propertyId);
        }
    }

    /**
     * Circuit-breaker fallback. Ownership failures are passed through untouched.
     */
    private void directoryUnavailable(Long propertyId, Long userId, Throwable t) {
        if (t instanceof ResourceNotFoundException notFound) {
            throw notFound;
        }
        log.error("Property directory unavailable while checking property {}", propertyId, t);
        throw new ServiceUnavailableException("Property directory is temporarily unavailable", t);
    }
}
