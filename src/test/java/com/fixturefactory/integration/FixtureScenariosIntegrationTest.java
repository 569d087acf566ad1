package com.fixturefactory.integration;

import com.fixturefactory.Factory;
import com.fixturefactory.FactoryRuntime;
import com.fixturefactory.declaration.IteratorDeclaration;
import com.fixturefactory.fixtures.Company;
import com.fixturefactory.fixtures.Membership;
import com.fixturefactory.fixtures.User;
import com.fixturefactory.util.Kwargs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import static com.fixturefactory.declaration.Declarations.*;
import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end scenarios combining sequences, sub-factories, traits, iterators and post-generation.
 */
class FixtureScenariosIntegrationTest {

    private FactoryRuntime runtime;
    private Factory<User> userFactory;

    @BeforeEach
    void setUp() {
        runtime = FactoryRuntime.isolated(2024L);
        userFactory = Factory.define(User.class)
                .runtime(runtime)
                .set("first_name", "John")
                .set("last_name", "Doe")
                .sequence("phone", n -> String.format("123-555-%04d", n))
                .lazy("email", r -> (r.get("first_name") + "." + r.get("last_name") + "@example.com").toLowerCase())
                .build();
    }

    @Test
    void testPhoneSequence() {
        assertThat(userFactory.build().getPhone()).isEqualTo("123-555-0000");
        assertThat(userFactory.build().getPhone()).isEqualTo("123-555-0001");
    }

    @Test
    void testCompanyOwnerOverride() {
        Factory<Company> companyFactory = Factory.define(Company.class)
                .runtime(runtime)
                .set("name", "ACME")
                .set("owner", subFactory(userFactory, Kwargs.of("first_name", "Jack")))
                .build();

        Company withDefault = companyFactory.build();
        Company withOverride = companyFactory.build(Kwargs.of("owner__first_name", "Henry"));

        assertThat(withDefault.getOwner().getFirstName()).isEqualTo("Jack");
        assertThat(withOverride.getOwner().getFirstName()).isEqualTo("Henry");
        assertThat(withOverride.getOwner().getEmail()).isEqualTo("henry.doe@example.com");
    }

    @Test
    void testPrecedenceOfOverridesTraitsAndInheritance() {
        Factory<User> base = userFactory.extend()
                .set("role", "base")
                .build();
        Factory<User> child = base.extend()
                .set("role", "child")
                .trait("staff", Kwargs.of("role", "staff"))
                .build();

        assertThat(base.build().getRole()).isEqualTo("base");
        assertThat(child.build().getRole()).isEqualTo("child");
        assertThat(child.build(Kwargs.of("staff", true)).getRole()).isEqualTo("staff");
        assertThat(child.build(Kwargs.of("staff", true, "role", "caller")).getRole()).isEqualTo("caller");
    }

    @Test
    void testResetSequenceThenGenerate() {
        userFactory.buildBatch(3);

        userFactory.resetSequence(7);

        assertThat(userFactory.build().getPhone()).isEqualTo("123-555-0007");
    }

    @Test
    void testCyclingIterator() {
        Factory<User> factory = userFactory.extend()
                .set("language", iterator(List.of("en", "fr")))
                .build();

        List<String> languages = factory.buildBatch(3).stream()
                .map(User::getLanguage)
                .collect(Collectors.toList());

        assertThat(languages).containsExactly("en", "fr", "en");
    }

    @Test
    void testExhaustedIterator() {
        IteratorDeclaration languages = iterator(List.of("en", "fr"), false, null);
        Factory<User> factory = userFactory.extend().set("language", languages).build();

        factory.buildBatch(2);
        assertThatThrownBy(factory::build).isInstanceOf(NoSuchElementException.class);

        languages.reset();
        assertThat(factory.build().getLanguage()).isEqualTo("en");
    }

    @Test
    void testIteratorIsSharedByChildFactories() {
        Factory<User> parent = userFactory.extend()
                .set("language", iterator(List.of("en", "fr", "de")))
                .build();
        Factory<User> child = parent.extend().set("role", "child").build();

        assertThat(parent.build().getLanguage()).isEqualTo("en");
        assertThat(child.build().getLanguage()).isEqualTo("fr");
        assertThat(parent.build().getLanguage()).isEqualTo("de");
    }

    @Test
    void testRelatedFactorySkippedWhenValueProvided() {
        List<Membership> generated = new ArrayList<>();
        Factory<Membership> memberships = Factory.define(Membership.class)
                .set("level", "gold")
                .afterPostGeneration((instance, create, results) -> generated.add((Membership) instance))
                .build();
        Factory<User> factory = userFactory.extend()
                .set("membership", relatedFactory(memberships, "user"))
                .build();

        User withMembership = factory.build();
        factory.build(Kwargs.of("membership", "provided", "membership__level", "ignored"));

        assertThat(generated).hasSize(1);
        assertThat(generated.get(0).getUser()).isSameAs(withMembership);
    }

    @Test
    void testLaterHookSeesEarlierHook() {
        Factory<User> factory = userFactory.extend()
                .postGeneration("set_role", (user, create, extracted, kwargs) -> ((User) user).setRole("editor"))
                .postGeneration("tag_role", (instance, create, extracted, kwargs) -> {
                    User user = (User) instance;
                    user.addTag("role:" + user.getRole());
                })
                .build();

        assertThat(factory.build().getTags()).containsExactly("role:editor");
    }
}
