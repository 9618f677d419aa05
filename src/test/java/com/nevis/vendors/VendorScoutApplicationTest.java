package com.nevis.vendors;

import com.nevis.vendors.infra.Dispatcher;
import com.nevis.vendors.model.ServiceType;
import com.nevis.vendors.repository.BaseIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;

import static org.assertj.core.api.Assertions.assertThat;

class VendorScoutApplicationTest extends BaseIntegrationTest {

    @Autowired
    @Qualifier("embeddingDispatcher")
    private Dispatcher embeddingDispatcher;

    @Autowired
    @Qualifier("placeSearchDispatcher")
    private Dispatcher placeSearchDispatcher;

    @Test
    @DisplayName("Each external service gets its own dispatcher and limiter")
    void shouldWireIndependentDispatchers() {
        assertThat(embeddingDispatcher.service()).isEqualTo(ServiceType.EMBEDDING);
        assertThat(placeSearchDispatcher.service()).isEqualTo(ServiceType.PLACE_SEARCH);
        assertThat(embeddingDispatcher.limiter()).isNotSameAs(placeSearchDispatcher.limiter());
        assertThat(embeddingDispatcher.limiter().capacity()).isEqualTo(10);
    }
}
