package com.lawgraph.service.context;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AliasRegistryTest {

    @Test
    void shouldSeeNearestEarlierDefinition_whenTermIsRedefined() {
        AliasRegistry registry = new AliasRegistry();
        registry.define("旧法", "民法", "A", 10);
        registry.define("旧法", "会社法", "B", 100);

        assertThat(registry.lookup("旧法", 50)).get()
                .extracting(AliasRegistry.AliasDefinition::referent).isEqualTo("民法");
        assertThat(registry.lookup("旧法", 150)).get()
                .extracting(AliasRegistry.AliasDefinition::referent).isEqualTo("会社法");
        assertThat(registry.lookup("旧法", 5)).isEmpty();
        assertThat(registry.terms()).containsExactly("旧法");
    }
}
