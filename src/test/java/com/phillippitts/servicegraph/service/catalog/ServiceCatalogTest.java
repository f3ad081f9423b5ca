package com.phillippitts.servicegraph.service.catalog;

import com.phillippitts.servicegraph.domain.ServiceDescriptor;
import com.phillippitts.servicegraph.exception.UnknownServiceException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceCatalogTest {

    private final ServiceCatalog catalog = ServiceCatalog.of(
            ServiceDescriptor.builder("db").provides("sql").build(),
            ServiceDescriptor.builder("replica").provides("sql", "read-only").build(),
            ServiceDescriptor.builder("app").requires("sql").build()
    );

    @Test
    void shouldKeepRegistrationOrder() {
        assertThat(catalog.names()).containsExactly("db", "replica", "app");
        assertThat(catalog.descriptors()).extracting(ServiceDescriptor::name)
                .containsExactly("db", "replica", "app");
        assertThat(catalog.size()).isEqualTo(3);
    }

    @Test
    void shouldIndexProvidersInRegistrationOrder() {
        assertThat(catalog.providersOf("sql")).containsExactly("db", "replica");
        assertThat(catalog.providersOf("read-only")).containsExactly("replica");
        assertThat(catalog.providersOf("missing")).isEmpty();
        assertThat(catalog.capabilities()).containsExactly("sql", "read-only");
    }

    @Test
    void shouldRejectDuplicateNames() {
        assertThatThrownBy(() -> ServiceCatalog.of(
                ServiceDescriptor.builder("db").build(),
                ServiceDescriptor.builder("db").provides("sql").build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("db");
    }

    @Test
    void shouldThrowUnknownServiceForMissingDescriptor() {
        assertThat(catalog.find("cache")).isEmpty();
        assertThatThrownBy(() -> catalog.descriptor("cache"))
                .isInstanceOf(UnknownServiceException.class)
                .hasMessageContaining("cache");
    }

    @Test
    void overridesReplaceInPlaceAndAppendNewEntries() {
        ServiceCatalog merged = catalog.withOverrides(List.of(
                ServiceDescriptor.builder("replica").provides("read-only").build(),
                ServiceDescriptor.builder("worker").requires("sql").build()));

        assertThat(merged.names()).containsExactly("db", "replica", "app", "worker");
        assertThat(merged.providersOf("sql")).containsExactly("db");
        // base catalog is untouched
        assertThat(catalog.providersOf("sql")).containsExactly("db", "replica");
    }

    @Test
    void registrationOrderSortsUnknownNamesLast() {
        List<String> sorted = List.of("zeta", "app", "alpha", "db").stream()
                .sorted(catalog.registrationOrder())
                .toList();

        assertThat(sorted).containsExactly("db", "app", "alpha", "zeta");
    }
}
