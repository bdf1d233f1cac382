package io.incrementaltests.junit;

import io.incrementaltests.core.mapping.ClassToSourceMapper;
import io.incrementaltests.core.model.NodeId;
import org.junit.platform.engine.TestSource;
import org.junit.platform.engine.support.descriptor.MethodSource;
import org.junit.platform.launcher.TestIdentifier;
import org.junit.platform.launcher.TestPlan;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Maps JUnit Platform test identifiers to node ids.
 *
 * <p>The module is the top-level test class's source file under one of the test
 * dirs; nested classes form the scope; the name is the method with its parameter
 * types. Invocations of a test template or factory are not recordable on their
 * own: they fold into the method that declares them.
 */
public final class NodeIds {

    private final ClassToSourceMapper mapper;
    private final String fallbackDir;

    public NodeIds(Path projectDir, List<String> testDirs) {
        this.mapper = new ClassToSourceMapper(projectDir, testDirs);
        this.fallbackDir = testDirs.isEmpty() ? "" : testDirs.get(0);
    }

    /**
     * Returns the node id of a method-level identifier, or empty for engines,
     * classes and invocations nested under another method.
     */
    public Optional<NodeId> recordable(TestPlan plan, TestIdentifier identifier) {
        Optional<MethodSource> source = methodSource(identifier);
        if (source.isEmpty()) {
            return Optional.empty();
        }
        boolean invocation = plan.getParent(identifier)
                .flatMap(NodeIds::methodSource)
                .isPresent();
        return invocation ? Optional.empty() : Optional.of(toNodeId(source.get()));
    }

    public NodeId toNodeId(MethodSource source) {
        String className = source.getClassName();
        String topLevel = ClassToSourceMapper.topLevelClassName(className);
        String module = mapper.sourceFileOf(className)
                .orElseGet(() -> fallback(className));

        int packageEnd = topLevel.lastIndexOf('.');
        String scope = className.substring(packageEnd + 1).replace('$', '.');
        String parameters = source.getMethodParameterTypes() == null ? "" : source.getMethodParameterTypes();
        return NodeId.of(module, scope, methodKey(source.getMethodName(), parameters));
    }

    /** Key {@link DurationMethodOrderer} matches methods by: the node name. */
    static String methodKey(String methodName, String parameterTypes) {
        return methodName + "(" + parameterTypes + ")";
    }

    static Optional<MethodSource> methodSource(TestIdentifier identifier) {
        Optional<TestSource> source = identifier.getSource();
        return source.filter(MethodSource.class::isInstance).map(MethodSource.class::cast);
    }

    private String fallback(String className) {
        String relative = ClassToSourceMapper.relativeSourcePath(className);
        return fallbackDir.isEmpty() ? relative : fallbackDir + "/" + relative;
    }
}
