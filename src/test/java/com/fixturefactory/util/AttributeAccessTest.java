package com.fixturefactory.util;

import com.fixturefactory.exception.UnknownAttributeException;
import com.fixturefactory.fixtures.Address;
import com.fixturefactory.fixtures.Company;
import com.fixturefactory.fixtures.User;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for dotted-path attribute lookup.
 */
class AttributeAccessTest {

    @Test
    void testBeanGetterWithSnakeCaseName() {
        User user = new User();
        user.setFirstName("Jack");

        assertThat(AttributeAccess.get(user, "first_name")).isEqualTo("Jack");
        assertThat(AttributeAccess.get(user, "active")).isEqualTo(false);
    }

    @Test
    void testRecordAccessor() {
        assertThat(AttributeAccess.get(new Address("1 Main St", "Paris", 75001), "zip_code")).isEqualTo(75001);
    }

    @Test
    void testPathThroughObjectsMapsAndLists() {
        User owner = new User();
        owner.setEmail("owner@example.com");
        Company company = new Company();
        company.setOwner(owner);
        company.setSettings(Map.of("themes", List.of("dark", "light")));

        assertThat(AttributeAccess.getPath(company, "owner.email")).isEqualTo("owner@example.com");
        assertThat(AttributeAccess.getPath(company, "settings.themes.1")).isEqualTo("light");
    }

    @Test
    void testMissingAttribute() {
        assertThatThrownBy(() -> AttributeAccess.getPath(Map.of("a", 1), "b"))
                .isInstanceOfSatisfying(UnknownAttributeException.class,
                        e -> assertThat(e.getAttributeName()).isEqualTo("b"));
        assertThatThrownBy(() -> AttributeAccess.get(List.of(1), "3"))
                .isInstanceOf(UnknownAttributeException.class);
        assertThatThrownBy(() -> AttributeAccess.get(null, "a"))
                .isInstanceOf(UnknownAttributeException.class);
    }

    @Test
    void testIndexBeyondIntRangeIsMissing() {
        assertThatThrownBy(() -> AttributeAccess.getPath(Map.of("items", List.of(1)), "items.99999999999"))
                .isInstanceOfSatisfying(UnknownAttributeException.class,
                        e -> assertThat(e.getAttributeName()).isEqualTo("99999999999"));
        assertThat(AttributeAccess.getPath(List.of(1), "99999999999", "fallback")).isEqualTo("fallback");
    }

    @Test
    void testDefaultOnlyForMissingSegment() {
        AttributeSource failing = name -> {
            throw new UnknownAttributeException("inner", "inner lookup failed");
        };

        assertThat(AttributeAccess.getPath(Map.of("a", 1), "b", "fallback")).isEqualTo("fallback");
        assertThat(AttributeAccess.getPath(Map.of("a", Map.of()), "a.b", null)).isNull();
        assertThatThrownBy(() -> AttributeAccess.getPath(failing, "outer", "fallback"))
                .isInstanceOf(UnknownAttributeException.class)
                .hasMessage("inner lookup failed");
    }
}
