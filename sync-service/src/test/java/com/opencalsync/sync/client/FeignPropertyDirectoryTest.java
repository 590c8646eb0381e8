package com.opencalsync.sync.client;

import com.opencalsync.common.dto.BaseResponse;
import com.opencalsync.common.exception.ResourceNotFoundException;
import com.opencalsync.sync.client.dto.PropertyResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class FeignPropertyDirectoryTest {

    @Mock
    private PropertyClient propertyClient;

    @InjectMocks
    private FeignPropertyDirectory directory;

    @Test
    @DisplayName("The owner passes the check")
    void requireOwner_owner() {
        given(propertyClient.getProperty(10L))
                .willReturn(BaseResponse.success(new PropertyResponse(10L, 1L, "Beach house", true)));

        assertThatCode(() -> directory.requireOwner(10L, 1L)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Another user's property looks like a missing property")
    void requireOwner_otherUser() {
        given(propertyClient.getProperty(10L))
                .willReturn(BaseResponse.success(new PropertyResponse(10L, 2L, "Beach house", true)));

        assertThatThrownBy(() -> directory.requireOwner(10L, 1L))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("An empty response is treated as not found")
    void requireOwner_emptyResponse() {
        given(propertyClient.getProperty(10L)).willReturn(null);

        assertThatThrownBy(() -> directory.requireOwner(10L, 1L))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
