package com.opencalsync.sync.client;

import com.opencalsync.common.dto.BaseResponse;
import com.opencalsync.sync.client.dto.PropertyResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

/**
 * Feign client for the property service, used read-only for ownership checks.
 */
@FeignClient(name = "property-service", url = "${calendar-sync.directory.property-service-url}",
        path = "/api/v1/properties")
public interface PropertyClient {

    @GetMapping("/{propertyId}")
    BaseResponse<PropertyResponse> getProperty(@PathVariable("propertyId") Long propertyId);
}
