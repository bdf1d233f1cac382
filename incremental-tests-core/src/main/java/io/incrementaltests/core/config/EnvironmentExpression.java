package io.incrementaltests.core.config;

import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates the environment expression that names the active data partition.
 *
 * <p>The expression is a literal string in which {@code ${env:NAME}} is replaced
 * by an environment variable and {@code ${sys:name}} by a system property. Unset
 * values resolve to the empty string, so {@code "db-${env:DB_VENDOR}"} yields
 * {@code "db-"} when the variable is missing.
 */
public final class EnvironmentExpression {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{(env|sys):([^}]+)}");

    private final Function<String, String> environment;
    private final Function<String, String> systemProperties;

    public EnvironmentExpression() {
        this(System::getenv, System::getProperty);
    }

    EnvironmentExpression(Function<String, String> environment, Function<String, String> systemProperties) {
        this.environment = environment;
        this.systemProperties = systemProperties;
    }

    static EnvironmentExpression withValues(Map<String, String> env, Map<String, String> sys) {
        return new EnvironmentExpression(env::get, sys::get);
    }

    public String evaluate(String expression) {
        if (expression == null || expression.isEmpty()) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(expression);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(2).trim();
            String value = "env".equals(matcher.group(1))
                    ? environment.apply(name)
                    : systemProperties.apply(name);
            matcher.appendReplacement(result, Matcher.quoteReplacement(value == null ? "" : value));
        }
        matcher.appendTail(result);
        return result.toString().trim();
    }
}
