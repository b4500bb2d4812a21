package io.tasker4j.internal;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Command line template used to spawn a job process.
 *
 * <p>The template is split on whitespace first and placeholders are substituted per token, so a payload
 * containing spaces or quotes stays a single argument. Tokens that render to an empty string are dropped.
 *
 * <p>Placeholders: {@code {javaBin}}, {@code {classpath}}, {@code {rootPath}}, {@code {env}},
 * {@code {taskClass}}, {@code {payload}}.
 */
public final class BootstrapCommand {

    public static final String JAVA_BIN = "javaBin";
    public static final String CLASSPATH = "classpath";
    public static final String ROOT_PATH = "rootPath";
    public static final String ENV = "env";
    public static final String TASK_CLASS = "taskClass";
    public static final String PAYLOAD = "payload";

    public static final String DEFAULT_RECURRING =
            "{javaBin} -cp {classpath} io.tasker4j.internal.JobBootstrap recurring {taskClass} {env}";
    public static final String DEFAULT_ONE_SHOT =
            "{javaBin} -cp {classpath} io.tasker4j.internal.JobBootstrap one-shot {payload} {env}";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z]+)}");

    private final String template;
    private final List<String> tokens;

    private BootstrapCommand(String template, List<String> tokens) {
        this.template = template;
        this.tokens = tokens;
    }

    public static BootstrapCommand parse(String template) {
        Objects.requireNonNull(template, "template must not be null");
        String trimmed = template.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("bootstrap command must not be blank");
        }
        return new BootstrapCommand(trimmed, List.of(trimmed.split("\\s+")));
    }

    public static BootstrapCommand defaultRecurring() {
        return parse(DEFAULT_RECURRING);
    }

    public static BootstrapCommand defaultOneShot() {
        return parse(DEFAULT_ONE_SHOT);
    }

    /**
     * @throws IllegalArgumentException when the template does not mention {@code {placeholder}}
     */
    public BootstrapCommand validate(String placeholder) {
        String marker = "{" + placeholder + "}";
        for (String token : tokens) {
            if (token.contains(marker)) {
                return this;
            }
        }
        throw new IllegalArgumentException("bootstrap command must contain " + marker + ": " + template);
    }

    /**
     * Substitutes placeholders. Unknown placeholders render as empty.
     */
    public List<String> render(Map<String, String> values) {
        Objects.requireNonNull(values, "values must not be null");
        List<String> out = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            Matcher m = PLACEHOLDER.matcher(token);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                String value = values.get(m.group(1));
                m.appendReplacement(sb, Matcher.quoteReplacement(value == null ? "" : value));
            }
            m.appendTail(sb);
            if (sb.length() > 0) {
                out.add(sb.toString());
            }
        }
        return out;
    }

    public String template() {
        return template;
    }

    @Override
    public String toString() {
        return "BootstrapCommand" + Arrays.toString(tokens.toArray());
    }
}
