package com.fixturefactory;

import com.fixturefactory.builder.Resolver;
import com.fixturefactory.exception.FactoryConfigurationException;
import com.fixturefactory.exception.ModelInstantiationException;
import com.fixturefactory.fixtures.Company;
import com.fixturefactory.fixtures.Ledger;
import com.fixturefactory.fixtures.User;
import com.fixturefactory.strategy.StubObject;
import com.fixturefactory.util.Kwargs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.fixturefactory.declaration.Declarations.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for nested factories: sub-factories, dict and list containers and parent access.
 */
class SubFactoryTest {

    private FactoryRuntime runtime;
    private Factory<User> users;

    @BeforeEach
    void setUp() {
        runtime = FactoryRuntime.isolated(5L);
        users = Factory.define(User.class)
                .runtime(runtime)
                .set("first_name", "Jack")
                .sequence("email", n -> "user" + n + "@example.com")
                .build();
    }

    @Test
    void testNestedOverrideReachesSubFactory() {
        Factory<Company> companies = companies(subFactory(users, Kwargs.of("last_name", "Owner")));

        Company company = companies.build(Kwargs.of("owner__first_name", "Henry"));

        assertThat(company.getOwner().getFirstName()).isEqualTo("Henry");
        assertThat(company.getOwner().getLastName()).isEqualTo("Owner");
        assertThat(company.getName()).isEqualTo("ACME");
    }

    @Test
    void testSubFactoryUsesItsOwnSequence() {
        Factory<Company> companies = Factory.define(Company.class)
                .runtime(runtime)
                .sequence("name", n -> "Company " + n)
                .set("owner", subFactory(users))
                .build();

        users.build();
        Company company = companies.build();

        assertThat(company.getName()).isEqualTo("Company 0");
        assertThat(company.getOwner().getEmail()).isEqualTo("user1@example.com");
    }

    @Test
    void testStrategyPropagatesToSubFactory() {
        Factory<Ledger> ledgers = Factory.define(Ledger.class).set("code", "L").build();
        Factory<Company> companies = companies(subFactory(users)).extend()
                .set("settings", subFactory(ledgers))
                .build();

        Company built = companies.build();
        Company created = companies.create();
        StubObject stub = companies.stub();

        assertThat(((Ledger) built.getSettings()).isSaved()).isFalse();
        assertThat(((Ledger) created.getSettings()).isSaved()).isTrue();
        assertThat(stub.get("owner")).isInstanceOf(StubObject.class);
        assertThat(stub.get("settings")).isInstanceOf(StubObject.class);
    }

    @Test
    void testSubFactoryReadsEnclosingFactory() {
        Factory<User> owners = users.extend()
                .lazy("email", r -> "owner@" + r.getFactoryParent().get("name").toString().toLowerCase() + ".example")
                .set("last_name", selfAttribute("..name"))
                .build();
        Factory<Company> companies = companies(subFactory(owners));

        User owner = companies.build().getOwner();

        assertThat(owner.getEmail()).isEqualTo("owner@acme.example");
        assertThat(owner.getLastName()).isEqualTo("ACME");
    }

    @Test
    void testEnclosingFactoryReadsSubFactoryResult() {
        Factory<Company> companies = companies(subFactory(users)).extend()
                .set("owner_email", selfAttribute("owner.email"))
                .build();

        Company company = companies.build();

        assertThat(company.getOwnerEmail()).isEqualTo(company.getOwner().getEmail());
    }

    @Test
    void testSelfAttributeDefault() {
        Factory<User> factory = users.extend()
                .set("last_name", selfAttribute("nickname", "Anonymous"))
                .build();

        assertThat(factory.build().getLastName()).isEqualTo("Anonymous");
    }

    @Test
    void testSelfAttributeAboveRootFails() {
        Factory<User> factory = users.extend()
                .set("last_name", selfAttribute("..name"))
                .build();

        assertThatThrownBy(factory::build)
                .isInstanceOf(FactoryConfigurationException.class)
                .hasMessageContaining("..name");
    }

    @Test
    void testContainerAttribute() {
        Factory<User> owners = users.extend()
                .set("last_name", containerAttribute((resolver, containers) -> containers.get(0).get("name") + " owner"))
                .build();

        assertThat(companies(subFactory(owners)).build().getOwner().getLastName()).isEqualTo("ACME owner");
        assertThatThrownBy(owners::build).isInstanceOf(FactoryConfigurationException.class);
    }

    @Test
    void testLazySubFactoryReference() {
        Factory<Company> companies = companies(subFactory(() -> users, Map.of()));

        assertThat(companies.build().getOwner().getFirstName()).isEqualTo("Jack");
    }

    @Test
    void testDictResolvesDeclarationsInItsOwnScope() {
        Factory<Company> companies = companies(subFactory(users)).extend()
                .sequence("name", n -> "Company " + n)
                .set("settings", dict(Kwargs.of(
                        "label", selfAttribute("..name"),
                        "slot", sequence(n -> n * 10),
                        "theme", "dark")))
                .build();

        companies.build();
        Company company = companies.build(Kwargs.of("settings__theme", "light"));

        assertThat(company.getSettings()).isEqualTo(Map.of("label", "Company 1", "slot", 10, "theme", "light"));
    }

    @Test
    void testListDeclaration() {
        Factory<Company> companies = companies(subFactory(users)).extend()
                .set("settings", list(List.of("a", lazyFunction(() -> "b"), selfAttribute("..name"))))
                .build();

        assertThat(companies.build().getSettings()).isEqualTo(List.of("a", "b", "ACME"));
        assertThat(companies.build(Kwargs.of("settings__1", "B")).getSettings()).isEqualTo(List.of("a", "B", "ACME"));
    }

    @Test
    void testListOverrideWithOversizedIndex() {
        Factory<Company> companies = companies(subFactory(users)).extend()
                .set("settings", list(List.of("a")))
                .build();

        assertThatThrownBy(() -> companies.build(Kwargs.of("settings__99999999999", "x")))
                .isInstanceOf(ModelInstantiationException.class)
                .hasMessageContaining("99999999999");
    }

    @Test
    void testMaybePicksBranchFromSibling() {
        Factory<User> factory = users.extend()
                .set("active", false)
                .set("role", maybe("active", "member", "visitor"))
                .build();

        assertThat(factory.build().getRole()).isEqualTo("visitor");
        assertThat(factory.build(Kwargs.of("active", true)).getRole()).isEqualTo("member");
    }

    @Test
    void testMaybeWithLazyDecider() {
        Factory<User> factory = users.extend()
                .set("age", 20)
                .set("role", maybe(lazyAttribute((Resolver r) -> (Integer) r.get("age") >= 18), "adult", "minor"))
                .build();

        assertThat(factory.build().getRole()).isEqualTo("adult");
        assertThat(factory.build(Kwargs.of("age", 12)).getRole()).isEqualTo("minor");
    }

    private Factory<Company> companies(Object owner) {
        return Factory.define(Company.class)
                .runtime(runtime)
                .set("name", "ACME")
                .set("owner", owner)
                .build();
    }
}
