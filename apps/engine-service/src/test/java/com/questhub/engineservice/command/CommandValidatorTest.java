package com.questhub.engineservice.command;

import com.questhub.engineservice.command.impl.MoveCommand;
import com.questhub.engineservice.command.impl.RespawnCommand;
import com.questhub.engineservice.domain.enums.GamePhase;
import com.questhub.engineservice.domain.model.CharacterState;
import com.questhub.engineservice.domain.model.GameState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CommandValidatorTest {

    private final CommandValidator validator = new CommandValidator();

    private static GameState state() {
        GameState s = new GameState();
        s.setCharacter(CharacterState.newCharacter("hero", "勇者"));
        s.setRngSeed(1L);
        return s;
    }

    private static CommandContext ctx(GameState state, Map<String, Object> params) {
        return new CommandContext("s1", "u1", state, params, 0L);
    }

    @Test
    @DisplayName("缺少必需参数时列出原因，不再执行命令特有校验")
    void missingParam() {
        ValidationResult r = validator.validateStructure(new MoveCommand(), ctx(state(), Map.of()));
        assertThat(r.isValid()).isFalse();
        assertThat(r.reasons()).singleElement().asString().contains("direction");
    }

    @Test
    @DisplayName("阶段不符时拒绝")
    void wrongPhase() {
        GameState s = state();
        s.setPhase(GamePhase.COMBAT);
        ValidationResult r = validator.validateStructure(new MoveCommand(), ctx(s, Map.of("direction", "north")));
        assertThat(r.isValid()).isFalse();
        assertThat(r.reasons()).singleElement().asString().contains("COMBAT");
    }

    @Test
    @DisplayName("阵亡角色只能执行不要求存活的命令")
    void deadCharacter() {
        GameState s = state();
        s.getCharacter().setHealth(0);

        assertThat(validator.validateStructure(new MoveCommand(), ctx(s, Map.of("direction", "north"))).isValid()).isFalse();
        assertThat(validator.validateStructure(new RespawnCommand(), ctx(s, Map.of())).isValid()).isTrue();
    }

    @Test
    @DisplayName("命令特有校验：无效方向与距离")
    void commandSpecificValidation() {
        assertThat(validator.validateStructure(new MoveCommand(), ctx(state(), Map.of("direction", "up"))).isValid()).isFalse();
        assertThat(validator.validateStructure(new MoveCommand(),
                ctx(state(), Map.of("direction", "north", "distance", 11))).isValid()).isFalse();
        assertThat(validator.validateStructure(new MoveCommand(),
                ctx(state(), Map.of("direction", "north", "distance", "3"))).isValid()).isTrue();
    }

    @Test
    @DisplayName("资源不足时逐项列出")
    void affordability() {
        CharacterState c = CharacterState.newCharacter("hero", "勇者");
        c.setMana(5);
        CommandCost cost = CommandCost.builder().mana(10).stamina(5).item("elixir", 1).build();

        ValidationResult r = validator.validateAffordable(cost, c);

        assertThat(r.isValid()).isFalse();
        assertThat(r.reasons()).hasSize(2);
        assertThat(r.reasons().get(0)).contains("法力不足").contains("10").contains("5");
        assertThat(r.reasons().get(1)).contains("elixir");
    }

    @Test
    @DisplayName("资源充足时通过")
    void affordable() {
        CharacterState c = CharacterState.newCharacter("hero", "勇者");
        assertThat(validator.validateAffordable(CommandCost.ofStamina(5), c).isValid()).isTrue();
        assertThat(validator.validateAffordable(CommandCost.builder().item("health_potion", 2).build(), c).isValid()).isTrue();
    }
}
