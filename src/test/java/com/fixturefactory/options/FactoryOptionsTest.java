package com.fixturefactory.options;

import com.fixturefactory.declaration.Skip;
import com.fixturefactory.exception.AssociatedClassException;
import com.fixturefactory.exception.InvalidDeclarationException;
import com.fixturefactory.fixtures.AdminUser;
import com.fixturefactory.fixtures.Company;
import com.fixturefactory.fixtures.User;
import com.fixturefactory.strategy.Arguments;
import com.fixturefactory.strategy.Strategy;
import com.fixturefactory.strategy.StubObject;
import com.fixturefactory.util.Kwargs;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FactoryOptions inheritance and argument preparation.
 */
class FactoryOptionsTest {

    @Test
    void testUnsetOptionsAreInherited() {
        FactoryOptions parent = FactoryOptions.builder()
                .model(ModelReference.of(User.class))
                .strategy(Strategy.CREATE)
                .exclude(Set.of("password"))
                .build();
        FactoryOptions child = FactoryOptions.builder()
                .parent(parent)
                .inlineArgs(List.of("first_name"))
                .build();

        assertThat(child.getModel()).isSameAs(parent.getModel());
        assertThat(child.getStrategy()).isEqualTo(Strategy.CREATE);
        assertThat(child.getExclude()).containsExactly("password");
        assertThat(child.getInlineArgs()).containsExactly("first_name");
        assertThat(parent.getInlineArgs()).isEmpty();
        assertThat(child.getName()).isEqualTo("UserFactory");
    }

    @Test
    void testDeclarationsMergeParentFirst() {
        FactoryOptions parent = FactoryOptions.builder()
                .model(ModelReference.of(User.class))
                .declarations(Kwargs.of("first_name", "Jack", "last_name", "Doe"))
                .build();
        FactoryOptions child = FactoryOptions.builder()
                .parent(parent)
                .declarations(Kwargs.of("email", "x@example.com", "first_name", "Henry"))
                .build();

        assertThat(child.getPreDeclarations().names()).containsExactly("first_name", "last_name", "email");
        assertThat(child.getDeclarations()).containsEntry("first_name", "Henry");
    }

    @Test
    void testPrepareArguments() {
        FactoryOptions options = FactoryOptions.builder()
                .model(ModelReference.of(User.class))
                .exclude(Set.of("internal"))
                .rename(Map.of("mail", "email"))
                .inlineArgs(List.of("last_name", "first_name"))
                .parameters(Kwargs.of("verbose", false))
                .build();

        Arguments arguments = options.prepareArguments(Kwargs.of(
                "first_name", "Jack", "internal", 1, "verbose", true, "mail", "j@example.com",
                "last_name", "Doe", "role", Skip.SKIP));

        assertThat(arguments.getArgs()).containsExactly("Doe", "Jack");
        assertThat(arguments.getKwargs()).containsExactly(entry("email", "j@example.com"));
    }

    @Test
    void testKwargsAdjusterRunsFirst() {
        FactoryOptions options = FactoryOptions.builder()
                .model(ModelReference.of(User.class))
                .exclude(Set.of("draft"))
                .kwargsAdjuster(kwargs -> {
                    kwargs.put("role", kwargs.remove("draft"));
                    return kwargs;
                })
                .build();

        assertThat(options.prepareArguments(Kwargs.of("draft", "admin")).getKwargs())
                .containsExactly(entry("role", "admin"));
    }

    @Test
    void testMissingInlineArgument() {
        FactoryOptions options = FactoryOptions.builder()
                .model(ModelReference.of(User.class))
                .inlineArgs(List.of("first_name"))
                .build();

        assertThatThrownBy(() -> options.prepareArguments(Kwargs.of("last_name", "Doe")))
                .isInstanceOf(InvalidDeclarationException.class)
                .hasMessageContaining("first_name");
    }

    @Test
    void testCounterSharedWithConcreteSupertypeFactory() {
        FactoryOptions users = FactoryOptions.builder().model(ModelReference.of(User.class)).build();
        FactoryOptions admins = FactoryOptions.builder().parent(users).model(ModelReference.of(AdminUser.class)).build();
        FactoryOptions companies = FactoryOptions.builder().parent(users).model(ModelReference.of(Company.class)).build();

        assertThat(admins.getCounterReference()).isSameAs(users);
        assertThat(admins.isCounterRoot()).isFalse();
        assertThat(companies.isCounterRoot()).isTrue();
    }

    @Test
    void testAbstractParentDoesNotOwnCounter() {
        FactoryOptions base = FactoryOptions.builder().declarations(Kwargs.of("active", true)).build();
        FactoryOptions users = FactoryOptions.builder().parent(base).model(ModelReference.of(User.class)).build();

        assertThat(base.isAbstract()).isTrue();
        assertThat(base.getName()).isEqualTo("AbstractFactory");
        assertThat(users.isAbstract()).isFalse();
        assertThat(users.isCounterRoot()).isTrue();
        assertThatThrownBy(base::ensureConcrete).isInstanceOf(AssociatedClassException.class);
    }

    @Test
    void testStubOnlyFactoryUsesStubObjectModel() {
        FactoryOptions options = FactoryOptions.builder().strategy(Strategy.STUB).build();

        assertThat(options.isAbstract()).isFalse();
        assertThat(options.getModelClass()).isEqualTo(StubObject.class);
    }

    @Test
    void testModelReferenceByName() {
        ModelReference reference = ModelReference.named(User.class.getName());
        ModelReference missing = ModelReference.named("com.example.Missing");

        assertThat(reference.describe()).isEqualTo(User.class.getName());
        assertThat(reference.resolve()).isEqualTo(User.class);
        assertThat(missing.describe()).isEqualTo("com.example.Missing");
        assertThatThrownBy(missing::resolve)
                .isInstanceOf(AssociatedClassException.class)
                .hasMessageContaining("com.example.Missing");
    }
}
