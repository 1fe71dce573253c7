package org.impactengine.api.registry;

import org.impactengine.api.transforms.ITransform;
import org.impactengine.junit.extensions.logging.LogWatchExtension;
import org.impactengine.transforms.PassthroughTransform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class RegistryTest {

    private Registry<ITransform> registry;

    @BeforeEach
    void setUp() {
        registry = new Registry<>("transform", ITransform.class);
    }

    public static class NotATransform {
        public NotATransform() {
        }
    }

    public abstract static class AbstractTransform implements ITransform {
    }

    public static class NoDefaultConstructor extends PassthroughTransform {
        public NoDefaultConstructor(String name) {
        }
    }

    static class PackagePrivateTransform extends PassthroughTransform {
    }

    @Test
    void register_conformingClass_getReturnsFreshInstances() {
        registry.register("passthrough", PassthroughTransform.class);

        ITransform first = registry.get("passthrough");
        ITransform second = registry.get("passthrough");

        assertThat(first).isInstanceOf(PassthroughTransform.class);
        assertNotSame(first, second);
        assertThat(registry.contains("passthrough")).isTrue();
    }

    @Test
    void register_classNotImplementingContract_fails() {
        assertThatThrownBy(() -> registry.register("bad", NotATransform.class))
            .isInstanceOf(ContractViolationException.class)
            .hasMessageContaining("does not implement ITransform");
        assertThat(registry.keys()).isEmpty();
    }

    @Test
    void register_abstractClass_fails() {
        assertThatThrownBy(() -> registry.register("abstract", AbstractTransform.class))
            .isInstanceOf(ContractViolationException.class)
            .hasMessageContaining("not concrete");
    }

    @Test
    void register_withoutNoArgConstructor_fails() {
        assertThrows(ContractViolationException.class, () -> registry.register("ctor", NoDefaultConstructor.class));
    }

    @Test
    void register_nonPublicClass_fails() {
        assertThrows(ContractViolationException.class, () -> registry.register("hidden", PackagePrivateTransform.class));
    }

    @Test
    void register_unknownClassName_fails() {
        assertThatThrownBy(() -> registry.register("missing", "com.example.DoesNotExist"))
            .isInstanceOf(ContractViolationException.class)
            .hasMessageContaining("com.example.DoesNotExist")
            .hasCauseInstanceOf(ClassNotFoundException.class);
    }

    @Test
    void register_byClassName_resolvesClass() {
        registry.register("passthrough", PassthroughTransform.class.getName());
        assertThat(registry.get("passthrough")).isInstanceOf(PassthroughTransform.class);
    }

    @Test
    void register_sameKeyTwice_lastRegistrationWins() {
        registry.register("t", PassthroughTransform.class);
        registry.register("t", TaggingTransform.class);

        assertThat(registry.get("t")).isInstanceOf(TaggingTransform.class);
        assertThat(registry.keys()).containsExactly("t");
    }

    @Test
    void get_unknownKey_listsKnownKeys() {
        registry.register("passthrough", PassthroughTransform.class);
        registry.register("tagging", TaggingTransform.class);

        UnknownKeyException e = assertThrows(UnknownKeyException.class, () -> registry.get("nope"));

        assertThat(e.getKey()).isEqualTo("nope");
        assertThat(e.getKnownKeys()).containsExactly("passthrough", "tagging");
        assertThat(e.getMessage()).contains("Unknown transform 'nope'").contains("passthrough");
    }

    @Test
    void get_onEmptyRegistry_fails() {
        assertThatThrownBy(() -> registry.get("anything")).isInstanceOf(UnknownKeyException.class);
    }

    @Test
    void register_blankKey_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", PassthroughTransform.class));
    }

    public static class TaggingTransform extends PassthroughTransform {
    }
}
