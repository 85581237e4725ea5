package com.keel.migrationrunner.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.keel.migrationrunner.cli.MigrationCommand.Verb;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MigrationCommand")
class MigrationCommandTest {

    @Test
    @DisplayName("spring options alone are not a command")
    void optionsOnly() {
        assertThat(MigrationCommand.isPresent("--spring.profiles.active=prod")).isFalse();
        assertThat(MigrationCommand.isPresent()).isFalse();
        assertThat(MigrationCommand.isPresent("--debug", "migrate")).isTrue();
    }

    @Test
    @DisplayName("a space-separated option value is not a command")
    void optionValues() {
        assertThat(MigrationCommand.isPresent("--spring.profiles.active", "test")).isFalse();
        assertThat(MigrationCommand.isPresent("--server.port", "8081")).isFalse();
        assertThat(MigrationCommand.isPresent("--spring.profiles.active", "prod", "status"))
                .isTrue();
    }

    @Test
    @DisplayName("locates the command at the first verb")
    void locatesCommand() {
        assertThat(MigrationCommand.locate(List.of("prod", "rollback", "002_b")))
                .containsExactly("rollback", "002_b");
        assertThat(MigrationCommand.locate(List.of("test"))).isEmpty();
        assertThat(MigrationCommand.locate(List.of())).isEmpty();
    }

    @Test
    @DisplayName("parses verbs case-insensitively")
    void parsesVerbs() {
        assertThat(MigrationCommand.parse(List.of("MIGRATE")).verb()).isEqualTo(Verb.MIGRATE);
        assertThat(MigrationCommand.parse(List.of("status")).verb()).isEqualTo(Verb.STATUS);

        MigrationCommand rollback =
                MigrationCommand.parse(List.of("rollback", "002_b", "001_a"));
        assertThat(rollback.verb()).isEqualTo(Verb.ROLLBACK);
        assertThat(rollback.arguments()).containsExactly("002_b", "001_a");

        assertThat(MigrationCommand.parse(List.of("new", "add_owner")).arguments())
                .containsExactly("add_owner");
    }

    @Test
    @DisplayName("rejects unknown verbs and wrong argument counts")
    void rejectsUsageErrors() {
        assertThatThrownBy(() -> MigrationCommand.parse(List.of("upgrade")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown command 'upgrade'");
        assertThatThrownBy(() -> MigrationCommand.parse(List.of("rollback")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MigrationCommand.parse(List.of("new")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MigrationCommand.parse(List.of("migrate", "now")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("takes no arguments");
        assertThatThrownBy(() -> MigrationCommand.parse(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
