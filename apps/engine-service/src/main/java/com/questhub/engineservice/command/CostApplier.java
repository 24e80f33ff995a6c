package com.questhub.engineservice.command;

import com.questhub.engineservice.domain.model.CharacterState;

/**
 * 把消耗从角色（工作副本）上扣除。调用前须已通过 {@link CommandValidator#validateAffordable}。
 */
public final class CostApplier {

    private CostApplier() {
    }

    public static void deduct(CommandCost cost, CharacterState c) {
        c.setMana(c.getMana() - cost.getMana());
        c.setStamina(c.getStamina() - cost.getStamina());
        c.setHealth(c.getHealth() - cost.getHealth());
        c.setGold(c.getGold() - cost.getGold());
        cost.getItems().forEach((itemId, qty) -> {
            int left = c.itemCount(itemId) - qty;
            if (left > 0) {
                c.getInventory().put(itemId, left);
            } else {
                c.getInventory().remove(itemId);
            }
        });
    }
}
