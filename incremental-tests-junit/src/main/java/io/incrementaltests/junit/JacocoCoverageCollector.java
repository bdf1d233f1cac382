package io.incrementaltests.junit;

import io.incrementaltests.core.mapping.ClassToSourceMapper;
import io.incrementaltests.core.recording.CoverageCollector;
import org.jacoco.agent.rt.IAgent;
import org.jacoco.agent.rt.RT;
import org.jacoco.core.data.ExecutionDataReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Coverage collector backed by the JaCoCo agent running in this JVM
 * ({@code -javaagent:org.jacoco.agent-runtime.jar}).
 *
 * <p>Execution data is reset when a test starts and dumped when it ends; every
 * class with at least one probe hit contributes its source file.
 */
public final class JacocoCoverageCollector implements CoverageCollector {

    private static final Logger log = LoggerFactory.getLogger(JacocoCoverageCollector.class);

    private final IAgent agent;
    private final ClassToSourceMapper mapper;

    JacocoCoverageCollector(IAgent agent, ClassToSourceMapper mapper) {
        this.agent = agent;
        this.mapper = mapper;
    }

    /**
     * Attaches to the running agent. Both source and test dirs are mapped, so a
     * test's own file and its helpers are part of its fingerprint.
     *
     * @throws IllegalStateException if no JaCoCo agent is loaded
     */
    public static JacocoCoverageCollector attach(Path projectDir, List<String> sourceDirs, List<String> testDirs) {
        IAgent agent;
        try {
            agent = RT.getAgent();
        } catch (IllegalStateException e) {
            throw new IllegalStateException("Incremental Tests: the JaCoCo agent is not running in this JVM. "
                    + "Start the tests with -javaagent pointing at org.jacoco.agent-runtime.jar, "
                    + "or disable collection with -Dincrementaltests.noCollect=true.", e);
        }
        List<String> dirs = new ArrayList<>(sourceDirs);
        dirs.addAll(testDirs);
        log.debug("Attached to JaCoCo agent {}", agent.getVersion());
        return new JacocoCoverageCollector(agent, new ClassToSourceMapper(projectDir, dirs));
    }

    @Override
    public void start() {
        agent.reset();
    }

    @Override
    public Set<String> stop() {
        return touchedFiles(agent.getExecutionData(true));
    }

    Set<String> touchedFiles(byte[] executionData) {
        Set<String> files = new TreeSet<>();
        ExecutionDataReader reader = new ExecutionDataReader(new ByteArrayInputStream(executionData));
        reader.setSessionInfoVisitor(info -> { });
        reader.setExecutionDataVisitor(data -> {
            if (data.hasHits()) {
                mapper.sourceFileOf(data.getName()).ifPresent(files::add);
            }
        });
        try {
            reader.read();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read JaCoCo execution data", e);
        }
        log.debug("Coverage touched {} project files", files.size());
        return files;
    }
}
