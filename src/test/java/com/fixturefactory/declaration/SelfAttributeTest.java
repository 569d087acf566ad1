package com.fixturefactory.declaration;

import com.fixturefactory.exception.FactoryConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SelfAttribute path parsing.
 */
class SelfAttributeTest {

    @Test
    void testPlainPath() {
        SelfAttribute attribute = new SelfAttribute("owner.email");

        assertThat(attribute.getDepth()).isZero();
        assertThat(attribute.getAttributePath()).isEqualTo("owner.email");
        assertThat(attribute.hasDefault()).isFalse();
    }

    @Test
    void testLeadingDotsClimbFactories() {
        assertThat(new SelfAttribute(".name").getDepth()).isEqualTo(1);
        assertThat(new SelfAttribute("..name").getDepth()).isEqualTo(2);
        assertThat(new SelfAttribute("...owner.name").getAttributePath()).isEqualTo("owner.name");
    }

    @Test
    void testNullDefaultCountsAsDefault() {
        assertThat(new SelfAttribute("name", null).hasDefault()).isTrue();
    }

    @Test
    void testPathWithoutAttribute() {
        assertThatThrownBy(() -> new SelfAttribute(".."))
                .isInstanceOf(FactoryConfigurationException.class)
                .hasMessageContaining("names no attribute");
    }
}
