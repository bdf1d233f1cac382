package io.incrementaltests.core.mapping;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClassToSourceMapperTest {

    @TempDir
    Path tempDir;

    private void touch(String relative) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "// " + relative);
    }

    @Test
    void mapsRootModuleClass() throws IOException {
        touch("src/main/java/com/example/Foo.java");
        ClassToSourceMapper mapper = new ClassToSourceMapper(tempDir, List.of("src/main/java"));

        assertEquals("src/main/java/com/example/Foo.java", mapper.sourceFileOf("com.example.Foo").orElseThrow());
    }

    @Test
    void mapsNestedAndVmNamesToTopLevelFile() throws IOException {
        touch("src/main/java/com/example/Foo.java");
        ClassToSourceMapper mapper = new ClassToSourceMapper(tempDir, List.of("src/main/java"));

        assertEquals("src/main/java/com/example/Foo.java", mapper.sourceFileOf("com/example/Foo$Bar$1").orElseThrow());
        assertEquals("com.example.Foo", ClassToSourceMapper.topLevelClassName("com/example/Foo$Bar"));
        assertEquals("com/example/Foo.java", ClassToSourceMapper.relativeSourcePath("com.example.Foo$Bar"));
    }

    @Test
    void findsClassesInNestedModules() throws IOException {
        touch("services/payment/src/main/java/com/example/pay/Gateway.java");
        touch("api/src/test/java/com/example/api/ApiTest.java");
        ClassToSourceMapper mapper = new ClassToSourceMapper(tempDir, List.of("src/main/java", "src/test/java"));

        assertEquals("services/payment/src/main/java/com/example/pay/Gateway.java",
                mapper.sourceFileOf("com.example.pay.Gateway").orElseThrow());
        assertEquals("api/src/test/java/com/example/api/ApiTest.java",
                mapper.sourceFileOf("com.example.api.ApiTest").orElseThrow());
    }

    @Test
    void ignoresBuildOutputAndUnknownClasses() throws IOException {
        touch("build/src/main/java/com/example/Generated.java");
        ClassToSourceMapper mapper = new ClassToSourceMapper(tempDir, List.of("src/main/java"));

        assertTrue(mapper.sourceFileOf("com.example.Generated").isEmpty());
        assertTrue(mapper.sourceFileOf("java.lang.String").isEmpty());
    }
}
