package io.tasker4j.internal;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BootstrapCommandTest {

    @Test
    void payloadWithSpacesShouldStayOneArgument() {
        BootstrapCommand cmd = BootstrapCommand.parse("php {rootPath}/bin/run  one-shot   {payload} {env}");
        String payload = "{\"taskClass\":\"SendEmail\",\"taskParams\":{\"subject\":\"hello world\"}}";

        List<String> argv = cmd.render(Map.of("rootPath", "/srv/app", "payload", payload, "env", "prod"));

        assertEquals(List.of("php", "/srv/app/bin/run", "one-shot", payload, "prod"), argv);
    }

    @Test
    void emptyPlaceholderShouldDropTheToken() {
        List<String> argv = BootstrapCommand.defaultRecurring().render(Map.of(
                "javaBin", "/jdk/bin/java",
                "classpath", "app.jar",
                "taskClass", "Report",
                "env", ""
        ));

        assertEquals(List.of("/jdk/bin/java", "-cp", "app.jar", "io.tasker4j.internal.JobBootstrap", "recurring", "Report"), argv);
    }

    @Test
    void replacementValuesShouldBeTakenLiterally() {
        List<String> argv = BootstrapCommand.parse("run {payload}").render(Map.of("payload", "$1\\n"));

        assertEquals(List.of("run", "$1\\n"), argv);
    }

    @Test
    void validateShouldRequireThePlaceholder() {
        assertThrows(IllegalArgumentException.class,
                () -> BootstrapCommand.parse("java -jar app.jar recurring").validate(BootstrapCommand.TASK_CLASS));
        BootstrapCommand.defaultOneShot().validate(BootstrapCommand.PAYLOAD);
        assertThrows(IllegalArgumentException.class, () -> BootstrapCommand.parse("   "));
    }
}
