package com.questhub.engineservice.command;

import com.questhub.engineservice.common.error.UnknownCommandException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandTypeTest {

    @Test
    @DisplayName("命令代码不区分大小写，连字符等同下划线")
    void parsesCodes() {
        assertThat(CommandType.fromCode("move")).isEqualTo(CommandType.MOVE);
        assertThat(CommandType.fromCode("cast-spell")).isEqualTo(CommandType.CAST_SPELL);
        assertThat(CommandType.fromCode(" START_COMBAT ")).isEqualTo(CommandType.START_COMBAT);
        assertThat(CommandType.GENERATE_IMAGE.code()).isEqualTo("generate_image");
    }

    @Test
    @DisplayName("未知或为空的命令代码抛 UnknownCommandException")
    void rejectsUnknown() {
        assertThatThrownBy(() -> CommandType.fromCode("teleport")).isInstanceOf(UnknownCommandException.class);
        assertThatThrownBy(() -> CommandType.fromCode(null)).isInstanceOf(UnknownCommandException.class);
    }
}
