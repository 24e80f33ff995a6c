package com.questhub.engineservice.command.impl;

import com.questhub.engineservice.command.CommandContext;
import com.questhub.engineservice.command.CommandCost;
import com.questhub.engineservice.command.CommandDefinition;
import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.command.GameCommand;
import com.questhub.engineservice.command.ValidationResult;
import com.questhub.engineservice.domain.constants.EngineMessages;
import com.questhub.engineservice.domain.enums.GamePhase;
import com.questhub.engineservice.domain.enums.LogType;
import com.questhub.engineservice.domain.model.CharacterState;
import com.questhub.engineservice.domain.model.LogEntry;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 使用消耗品。物品本身作为消耗扣除，背包不足时在校验阶段拒绝。
 */
@Component
public class UseItemCommand implements GameCommand {

    /** 可使用的消耗品：物品ID -> 恢复的资源与数值 */
    private static final Map<String, Restore> USABLE = Map.of(
            "health_potion", new Restore(Resource.HEALTH, 50),
            "mana_potion", new Restore(Resource.MANA, 30),
            "stamina_potion", new Restore(Resource.STAMINA, 40)
    );

    private enum Resource { HEALTH, MANA, STAMINA }

    private record Restore(Resource resource, int amount) {
    }

    private static final CommandDefinition DEFINITION = CommandDefinition.builder()
            .displayName("使用物品")
            .description("使用背包中的消耗品")
            .requiredParam("itemId")
            .allowedPhase(GamePhase.EXPLORATION)
            .allowedPhase(GamePhase.REST)
            .build();

    @Override
    public CommandType type() {
        return CommandType.USE_ITEM;
    }

    @Override
    public CommandDefinition definition() {
        return DEFINITION;
    }

    @Override
    public ValidationResult validate(CommandContext ctx) {
        String itemId = ctx.stringParam("itemId");
        if (!USABLE.containsKey(itemId)) {
            return ValidationResult.fail(EngineMessages.formatItemNotUsable(itemId));
        }
        return ValidationResult.ok();
    }

    @Override
    public CommandCost cost(CommandContext ctx) {
        return CommandCost.builder().item(ctx.stringParam("itemId"), 1).build();
    }

    @Override
    public CommandResult execute(CommandContext ctx) {
        String itemId = ctx.stringParam("itemId");
        Restore r = USABLE.get(itemId);
        CharacterState c = ctx.character();
        int gained = switch (r.resource()) {
            case HEALTH -> {
                int v = Math.min(r.amount(), c.getMaxHealth() - c.getHealth());
                c.setHealth(c.getHealth() + v);
                yield v;
            }
            case MANA -> {
                int v = Math.min(r.amount(), c.getMaxMana() - c.getMana());
                c.setMana(c.getMana() + v);
                yield v;
            }
            case STAMINA -> {
                int v = Math.min(r.amount(), c.getMaxStamina() - c.getStamina());
                c.setStamina(c.getStamina() + v);
                yield v;
            }
        };
        String msg = EngineMessages.formatItemUsed(itemId, "+" + gained + " " + r.resource().name().toLowerCase());
        return CommandResult.builder()
                .success(true)
                .message(msg)
                .logEntry(LogEntry.of(LogType.EXPLORATION, c.getId(), msg))
                .build();
    }
}
