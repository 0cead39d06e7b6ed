package org.dxworks.docframe.transform;

import org.dxworks.docframe.DocframeConfig;
import org.dxworks.docframe.ast.NodeTransformer;
import org.dxworks.docframe.exception.DependencyResolutionException;
import org.dxworks.docframe.exception.ValidationException;
import org.dxworks.docframe.transform.builtin.BuiltinTransforms;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransformRegistryTest {

    private TransformRegistry registry;

    /** Keeps the value it was created with so tests can inspect it. */
    static class ValueTransform extends NodeTransformer {
        final int value;

        ValueTransform(int value) {
            this.value = value;
        }
    }

    private static TransformMetadata.Builder transform(String name) {
        return TransformMetadata.builder(name, parameters -> new NodeTransformer() {
        });
    }

    @BeforeEach
    void setUp() {
        registry = new TransformRegistry();
    }

    @Test
    void chainResolvesDependenciesFirst() {
        registry.register(transform("a").build());
        registry.register(transform("b").dependsOn("a").build());
        registry.register(transform("c").dependsOn("b").build());

        assertEquals(List.of("a", "b", "c"), registry.resolveDependencies(List.of("c")));
    }

    @Test
    void sharedDependencyAppearsOnceAndFirst() {
        registry.register(transform("a").build());
        registry.register(transform("b").dependsOn("a").build());
        registry.register(transform("c").dependsOn("a").build());

        List<String> order = registry.resolveDependencies(List.of("b", "c"));

        assertEquals(List.of("a", "b", "c"), order);
        assertEquals(1, order.stream().filter("a"::equals).count());
    }

    @Test
    void independentTransformsRunByPriorityThenRegistration() {
        registry.register(transform("late").priority(200).build());
        registry.register(transform("second").priority(10).build());
        registry.register(transform("first").priority(10).build());
        registry.register(transform("early").priority(1).build());

        assertEquals(List.of("early", "second", "first", "late"),
                registry.resolveDependencies(List.of("late", "first", "second", "early")));
    }

    @Test
    void dependencyRunsFirstEvenWithAHigherPriority() {
        registry.register(transform("slow").priority(500).build());
        registry.register(transform("fast").priority(1).dependsOn("slow").build());
        registry.register(transform("other").priority(300).build());

        assertEquals(List.of("other", "slow", "fast"), registry.resolveDependencies(List.of("fast", "other")));
    }

    @Test
    void cycleRaisesWithTheCyclePath() {
        registry.register(transform("a").dependsOn("b").build());
        registry.register(transform("b").dependsOn("a").build());

        DependencyResolutionException e = assertThrows(DependencyResolutionException.class,
                () -> registry.resolveDependencies(List.of("a")));
        assertEquals(List.of("a", "b", "a"), e.getTransformNames());
        assertTrue(e.getMessage().contains("a -> b -> a"));
    }

    @Test
    void selfDependencyIsACycle() {
        registry.register(transform("loop").dependsOn("loop").build());

        DependencyResolutionException e = assertThrows(DependencyResolutionException.class,
                () -> registry.resolveDependencies(List.of("loop")));
        assertEquals(List.of("loop", "loop"), e.getTransformNames());
    }

    @Test
    void cycleBehindAnAcyclicPrefixIsReported() {
        registry.register(transform("entry").dependsOn("x").build());
        registry.register(transform("x").dependsOn("y").build());
        registry.register(transform("y").dependsOn("x").build());

        DependencyResolutionException e = assertThrows(DependencyResolutionException.class,
                () -> registry.resolveDependencies(List.of("entry")));
        assertEquals(List.of("x", "y", "x"), e.getTransformNames());
    }

    @Test
    void unknownDependencyFailsBeforeOrdering() {
        registry.register(transform("a").dependsOn("ghost").build());

        DependencyResolutionException e = assertThrows(DependencyResolutionException.class,
                () -> registry.resolveDependencies(List.of("a")));
        assertEquals(List.of("a", "ghost"), e.getTransformNames());
    }

    @Test
    void unknownRequestedTransformFails() {
        assertThrows(DependencyResolutionException.class, () -> registry.resolveDependencies(List.of("nope")));
    }

    @Test
    void requiredIntegerParameterIsValidated() {
        registry.register(TransformMetadata.builder("valued", parameters -> new ValueTransform(parameters.getInt("value")))
                .parameter("value", ParameterSpec.integer(null).required())
                .build());

        ValidationException missing = assertThrows(ValidationException.class, () -> registry.getTransform("valued"));
        assertEquals("value", missing.getParameter());

        NodeTransformer transformer = registry.getTransform("valued", Map.of("value", 20));
        assertEquals(20, assertInstanceOf(ValueTransform.class, transformer).value);
    }

    @Test
    void parametersAreNotCoerced() {
        registry.register(TransformMetadata.builder("valued", parameters -> new ValueTransform(parameters.getInt("value")))
                .parameter("value", ParameterSpec.integer(1))
                .build());

        ValidationException e = assertThrows(ValidationException.class,
                () -> registry.getTransform("valued", Map.of("value", "20")));
        assertEquals("valued", e.getSubject());
        assertEquals(7, ((ValueTransform) registry.getTransform("valued", Map.of("value", 7L))).value);
        assertEquals(1, ((ValueTransform) registry.getTransform("valued")).value);
    }

    @Test
    void unknownParameterIsRejected() {
        registry.register(transform("plain").build());

        ValidationException e = assertThrows(ValidationException.class,
                () -> registry.getTransform("plain", Map.of("colour", "red")));
        assertEquals("colour", e.getParameter());
    }

    @Test
    void choicesAreEnforced() {
        registry.register(transform("mode")
                .parameter("mode", ParameterSpec.string("fast").choices("fast", "slow"))
                .build());

        registry.getTransform("mode", Map.of("mode", "slow"));
        assertThrows(ValidationException.class, () -> registry.getTransform("mode", Map.of("mode", "medium")));
    }

    @Test
    void factoryRejectionBecomesAValidationError() {
        registry.register(TransformMetadata.builder("picky", parameters -> {
            throw new IllegalArgumentException("no");
        }).build());

        assertThrows(ValidationException.class, () -> registry.getTransform("picky"));
    }

    @Test
    void unknownTransformIsAValidationError() {
        assertThrows(ValidationException.class, () -> registry.getTransform("missing"));
    }

    @Test
    void negativePriorityIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> transform("x").priority(-1));
    }

    @Test
    void listsByTag() {
        registry.register(transform("a").tags("cleanup").build());
        registry.register(transform("b").tags("links", "cleanup").build());
        registry.register(transform("c").tags("links").build());

        assertEquals(List.of("a", "b"), registry.listTransforms(Set.of("cleanup")));
        assertEquals(List.of("a", "b", "c"), registry.listTransforms());
    }

    @Test
    void replacingKeepsRegistrationSequence() {
        registry.register(transform("first").build());
        registry.register(transform("second").build());
        registry.register(transform("first").description("again").build());

        assertEquals(List.of("first", "second"), registry.resolveDependencies(List.of("second", "first")));
        assertEquals("again", registry.getMetadata("first").orElseThrow().getDescription());
    }

    @Test
    void unregisterRemoves() {
        registry.register(transform("a").build());

        assertTrue(registry.unregister("a"));
        assertFalse(registry.unregister("a"));
        assertFalse(registry.hasTransform("a"));
    }

    @Test
    void initializeIsIdempotentAndIncludesPlugins() {
        registry.initialize();
        List<String> first = registry.listTransforms();
        registry.initialize();

        assertEquals(first, registry.listTransforms());
        assertTrue(first.containsAll(List.of(BuiltinTransforms.REMOVE_IMAGES, BuiltinTransforms.WORD_COUNT,
                BuiltinTransforms.ADD_HEADING_IDS)));
        assertTrue(first.contains(UppercaseTransformProvider.UPPERCASE));
    }

    @Test
    void configurationDisablesTransforms() {
        TransformRegistry configured = new TransformRegistry(DocframeConfig.with(
                DocframeConfig.DEFAULT_DETECTION_PREFIX_BYTES, Set.of(), Set.of(BuiltinTransforms.WORD_COUNT)));

        configured.initialize();

        assertFalse(configured.hasTransform(BuiltinTransforms.WORD_COUNT));
        assertTrue(configured.hasTransform(BuiltinTransforms.REMOVE_IMAGES));
    }

    @Test
    void discoverySkipsFailingPlugins() {
        assertEquals(1, registry.discoverPlugins());
        assertEquals(List.of(UppercaseTransformProvider.UPPERCASE), registry.listTransforms());
    }

    @Test
    void clearEmptiesTheRegistry() {
        registry.initialize();
        registry.clear();

        assertFalse(registry.isInitialized());
        assertTrue(registry.listTransforms().isEmpty());
    }
}
