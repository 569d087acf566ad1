package com.fixturefactory.strategy;

import com.fixturefactory.exception.ModelInstantiationException;
import com.fixturefactory.fixtures.Account;
import com.fixturefactory.fixtures.Address;
import com.fixturefactory.fixtures.User;
import com.fixturefactory.util.Kwargs;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ReflectiveInstantiator.
 */
class ReflectiveInstantiatorTest {

    private final ReflectiveInstantiator instantiator = ReflectiveInstantiator.INSTANCE;

    @Test
    void testRecordFromPositionalAndSnakeCaseKeywords() {
        Object address = instantiator.instantiate(Address.class,
                Arguments.of(List.of("1 Main St"), Kwargs.of("city", "Springfield", "zip_code", 12345)));

        assertThat(address).isEqualTo(new Address("1 Main St", "Springfield", 12345));
    }

    @Test
    void testRecordMissingComponentsGetDefaults() {
        Object address = instantiator.instantiate(Address.class, Arguments.of(List.of(), Kwargs.of("city", "Paris")));

        assertThat(address).isEqualTo(new Address(null, "Paris", 0));
    }

    @Test
    void testRecordRejectsUnknownKeyword() {
        assertThatThrownBy(() -> instantiator.instantiate(Address.class, Arguments.of(List.of(), Kwargs.of("country", "FR"))))
                .isInstanceOf(ModelInstantiationException.class)
                .hasMessageContaining("country");
    }

    @Test
    void testMapModel() {
        Object map = instantiator.instantiate(TreeMap.class, Arguments.of(List.of(), Kwargs.of("b", 2, "a", 1)));

        assertThat(map).isInstanceOf(TreeMap.class).isEqualTo(Map.of("a", 1, "b", 2));
    }

    @Test
    void testConstructorMatchedByParameterNames() {
        Account account = (Account) instantiator.instantiate(Account.class,
                Arguments.of(List.of(), Kwargs.of("balance", 50L, "owner", "jack")));

        assertThat(account.getOwner()).isEqualTo("jack");
        assertThat(account.getBalance()).isEqualTo(50L);
    }

    @Test
    void testIncompatibleConstructorArguments() {
        assertThatThrownBy(() -> instantiator.instantiate(Account.class,
                Arguments.of(List.of(), Kwargs.of("owner", "jack", "balance", "lots"))))
                .isInstanceOf(ModelInstantiationException.class)
                .hasMessageContaining(Account.class.getName());
    }

    @Test
    void testBeanThroughSetters() {
        User user = (User) instantiator.instantiate(User.class,
                Arguments.of(List.of(), Kwargs.of("first_name", "Jack", "age", 30, "active", true)));

        assertThat(user.getFirstName()).isEqualTo("Jack");
        assertThat(user.getAge()).isEqualTo(30);
        assertThat(user.isActive()).isTrue();
    }

    @Test
    void testBeanUnknownProperty() {
        assertThatThrownBy(() -> instantiator.instantiate(User.class, Arguments.of(List.of(), Kwargs.of("nickname", "J"))))
                .isInstanceOf(ModelInstantiationException.class)
                .hasMessageContaining("nickname");
    }

    @Test
    void testUncheckedConstructorFailurePropagates() {
        assertThatThrownBy(() -> instantiator.instantiate(Exploding.class, Arguments.of(List.of(), Map.of())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }

    @Test
    void testCheckedConstructorFailureIsWrapped() {
        assertThatThrownBy(() -> instantiator.instantiate(Failing.class, Arguments.of(List.of(), Map.of())))
                .isInstanceOf(ModelInstantiationException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    static class Exploding {
        Exploding() {
            throw new IllegalStateException("boom");
        }
    }

    static class Failing {
        Failing() throws IOException {
            throw new IOException("disk full");
        }
    }
}
