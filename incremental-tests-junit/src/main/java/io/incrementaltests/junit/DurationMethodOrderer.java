package io.incrementaltests.junit;

import org.junit.jupiter.api.MethodDescriptor;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.MethodOrdererContext;

import java.lang.reflect.Method;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Orders test methods the way the runner computed: fastest first by recorded
 * average duration.
 *
 * <p>The runner hands the order over in the {@value #ORDER_PARAMETER}
 * configuration parameter as {@code |}-separated method keys. Methods missing
 * from it keep their relative position after the listed ones.
 */
public class DurationMethodOrderer implements MethodOrderer {

    public static final String ORDER_PARAMETER = "incrementaltests.methodOrder";

    static final String SEPARATOR = "|";

    @Override
    public void orderMethods(MethodOrdererContext context) {
        Map<String, Integer> rank = rank(context.getConfigurationParameter(ORDER_PARAMETER).orElse(""));
        if (rank.isEmpty()) {
            return;
        }
        context.getMethodDescriptors().sort(Comparator.comparingInt(
                (MethodDescriptor descriptor) -> rank.getOrDefault(key(descriptor.getMethod()), Integer.MAX_VALUE)));
    }

    static String key(Method method) {
        String parameterTypes = Arrays.stream(method.getParameterTypes())
                .map(Class::getName)
                .collect(Collectors.joining(", "));
        return NodeIds.methodKey(method.getName(), parameterTypes);
    }

    static String encode(List<String> methodKeys) {
        return String.join(SEPARATOR, methodKeys);
    }

    private static Map<String, Integer> rank(String encoded) {
        Map<String, Integer> rank = new HashMap<>();
        List<String> keys = Arrays.stream(encoded.split("\\|"))
                .filter(k -> !k.isEmpty())
                .collect(Collectors.toList());
        for (int i = 0; i < keys.size(); i++) {
            rank.putIfAbsent(keys.get(i), i);
        }
        return rank;
    }
}
