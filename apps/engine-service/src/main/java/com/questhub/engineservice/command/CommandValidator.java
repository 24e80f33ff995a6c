package com.questhub.engineservice.command;

import com.questhub.engineservice.domain.constants.EngineMessages;
import com.questhub.engineservice.domain.model.CharacterState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 通用校验：必需参数、等级、阶段、存活，以及消耗是否负担得起。
 */
@Component
public class CommandValidator {

    /**
     * 结构校验：必需参数 → 等级 → 阶段 → 存活 → 命令特有校验。
     */
    public ValidationResult validateStructure(GameCommand command, CommandContext ctx) {
        CommandDefinition def = command.definition();
        CharacterState character = ctx.character();
        List<String> reasons = new ArrayList<>();

        for (String param : def.getRequiredParams()) {
            if (!ctx.hasParam(param)) {
                reasons.add(EngineMessages.formatMissingParam(param));
            }
        }
        if (character.getLevel() < def.getMinLevel()) {
            reasons.add(EngineMessages.formatLevelTooLow(def.getMinLevel(), character.getLevel()));
        }
        if (!def.getAllowedPhases().isEmpty() && !def.getAllowedPhases().contains(ctx.getState().getPhase())) {
            reasons.add(EngineMessages.formatPhaseNotAllowed(ctx.getState().getPhase().name(), command.type().code()));
        }
        if (def.isRequiresAlive() && !character.isAlive()) {
            reasons.add(EngineMessages.CHARACTER_DEAD);
        }
        // 通用条件不满足时不再跑命令特有校验，避免在缺参数的上下文上报出连带错误
        if (!reasons.isEmpty()) {
            return ValidationResult.of(reasons);
        }
        return command.validate(ctx);
    }

    /**
     * 资源是否足够支付消耗。
     */
    public ValidationResult validateAffordable(CommandCost cost, CharacterState c) {
        List<String> reasons = new ArrayList<>();
        if (c.getMana() < cost.getMana()) {
            reasons.add(EngineMessages.formatInsufficient(EngineMessages.MANA, cost.getMana(), c.getMana()));
        }
        if (c.getStamina() < cost.getStamina()) {
            reasons.add(EngineMessages.formatInsufficient(EngineMessages.STAMINA, cost.getStamina(), c.getStamina()));
        }
        // 生命消耗不能把角色耗死
        if (cost.getHealth() > 0 && c.getHealth() <= cost.getHealth()) {
            reasons.add(EngineMessages.formatInsufficient(EngineMessages.HEALTH, cost.getHealth() + 1, c.getHealth()));
        }
        if (c.getGold() < cost.getGold()) {
            reasons.add(EngineMessages.formatInsufficient(EngineMessages.GOLD, cost.getGold(), c.getGold()));
        }
        for (Map.Entry<String, Integer> item : cost.getItems().entrySet()) {
            int have = c.itemCount(item.getKey());
            if (have < item.getValue()) {
                reasons.add(EngineMessages.formatMissingItem(item.getKey(), item.getValue(), have));
            }
        }
        return ValidationResult.of(reasons);
    }
}
