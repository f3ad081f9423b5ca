package com.phillippitts.servicegraph.domain;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServiceDescriptorTest {

    @Test
    void builderKeepsDeclarationOrder() {
        ServiceDescriptor descriptor = ServiceDescriptor.builder("gitea")
                .provides("git-server", "web-app")
                .requires("database")
                .after("postgres", "nginx")
                .build();

        assertThat(descriptor.provides()).containsExactly("git-server", "web-app");
        assertThat(descriptor.after()).containsExactly("postgres", "nginx");
        assertThat(descriptor.conflicts()).isEmpty();
        assertThat(descriptor.optional()).isEmpty();
    }

    @Test
    void setsAreDefensivelyCopied() {
        Set<String> provides = new LinkedHashSet<>(List.of("database"));
        ServiceDescriptor descriptor = new ServiceDescriptor("postgres", provides, null, null, null, null);

        provides.add("cache");

        assertThat(descriptor.provides()).containsExactly("database");
        assertThatThrownBy(() -> descriptor.provides().add("x"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void blankNameIsRejected() {
        assertThatThrownBy(() -> ServiceDescriptor.builder(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
