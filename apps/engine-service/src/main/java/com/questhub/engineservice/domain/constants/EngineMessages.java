package com.questhub.engineservice.domain.constants;

import java.util.List;

/**
 * 会话命令引擎的消息常量
 * 统一管理所有用户可见的提示消息与战斗叙述，避免硬编码
 *
 * 使用示例：
 *   throw new ValidationException(EngineMessages.formatInsufficient(EngineMessages.MANA, 10, 5));
 */
public final class EngineMessages {

    private EngineMessages() {
        // 工具类，禁止实例化
    }

    // ========== 通用错误 ==========

    public static final String VALIDATION_FAILED = "命令校验失败：%s";
    public static final String COOLDOWN_ACTIVE = "%s 冷却中，剩余 %d 毫秒";
    public static final String SESSION_BUSY = "会话 %s 正在处理其他操作，请稍后重试";
    public static final String LOCK_NOT_HELD = "会话 %s 的锁不属于当前持有者或已过期";
    public static final String NOTHING_TO_UNDO = "没有可撤销的操作";
    public static final String NOTHING_TO_REDO = "没有可重做的操作";
    public static final String COMMAND_FAILED = "%s 执行失败，请稍后重试";
    public static final String INTERNAL_ERROR = "引擎内部错误";
    public static final String SESSION_NOT_FOUND = "会话不存在：%s";
    public static final String ACCESS_DENIED = "无权操作该会话";
    public static final String SESSION_LIMIT_REACHED = "活跃会话数已达上限（%d），请稍后再试";
    public static final String UNKNOWN_COMMAND = "未知命令类型：%s";

    public static String formatValidationFailed(List<String> reasons) {
        return String.format(VALIDATION_FAILED, String.join("；", reasons));
    }

    public static String formatCooldownActive(String commandType, long remainingMs) {
        return String.format(COOLDOWN_ACTIVE, commandType, remainingMs);
    }

    public static String formatSessionBusy(String sessionId) {
        return String.format(SESSION_BUSY, sessionId);
    }

    public static String formatLockNotHeld(String sessionId) {
        return String.format(LOCK_NOT_HELD, sessionId);
    }

    public static String formatCommandFailed(String commandType) {
        return String.format(COMMAND_FAILED, commandType);
    }

    public static String formatSessionNotFound(String sessionId) {
        return String.format(SESSION_NOT_FOUND, sessionId);
    }

    public static String formatSessionLimit(int max) {
        return String.format(SESSION_LIMIT_REACHED, max);
    }

    public static String formatUnknownCommand(String type) {
        return String.format(UNKNOWN_COMMAND, type);
    }

    // ========== 校验原因 ==========

    /** 资源名称 */
    public static final String MANA = "法力";
    public static final String STAMINA = "体力";
    public static final String HEALTH = "生命";
    public static final String GOLD = "金币";

    public static final String MISSING_PARAM = "缺少必需参数：%s";
    public static final String LEVEL_TOO_LOW = "等级不足：需要 %d 级，当前 %d 级";
    public static final String PHASE_NOT_ALLOWED = "当前阶段（%s）无法执行 %s";
    public static final String INSUFFICIENT = "%s不足：需要 %d，当前 %d";
    public static final String MISSING_ITEM = "物品不足：%s 需要 %d 个，当前 %d 个";
    public static final String CHARACTER_DEAD = "角色已阵亡";
    public static final String ALREADY_IN_COMBAT = "已在战斗中，无法开始新的战斗";
    public static final String NO_ENEMIES = "至少需要指定一个敌人";
    public static final String NOT_IN_COMBAT = "当前不在战斗中";
    public static final String NOT_PLAYER_TURN = "尚未轮到你行动";
    public static final String CANNOT_FLEE = "本场战斗无法逃跑";
    public static final String INVALID_DIRECTION = "无效的方向：%s（可选 north/south/east/west）";
    public static final String INVALID_DISTANCE = "无效的移动距离：%s（范围 1-10）";
    public static final String MOVEMENT_IMPAIRED = "角色被眩晕或定身，无法移动";
    public static final String NOT_DEAD = "角色仍然存活，无需复活";
    public static final String AI_DISABLED = "AI 功能未启用";
    public static final String ITEM_NOT_USABLE = "物品无法使用：%s";
    public static final String UNKNOWN_SPELL = "未知法术：%s";
    public static final String UNKNOWN_TARGET = "目标不存在或已倒下：%s";

    public static String formatMissingParam(String name) {
        return String.format(MISSING_PARAM, name);
    }

    public static String formatLevelTooLow(int required, int actual) {
        return String.format(LEVEL_TOO_LOW, required, actual);
    }

    public static String formatPhaseNotAllowed(String phase, String commandType) {
        return String.format(PHASE_NOT_ALLOWED, phase, commandType);
    }

    public static String formatInsufficient(String resource, int need, int have) {
        return String.format(INSUFFICIENT, resource, need, have);
    }

    public static String formatMissingItem(String itemId, int need, int have) {
        return String.format(MISSING_ITEM, itemId, need, have);
    }

    public static String formatInvalidDirection(Object direction) {
        return String.format(INVALID_DIRECTION, direction);
    }

    public static String formatInvalidDistance(Object distance) {
        return String.format(INVALID_DISTANCE, distance);
    }

    public static String formatItemNotUsable(String itemId) {
        return String.format(ITEM_NOT_USABLE, itemId);
    }

    public static String formatUnknownSpell(String spellId) {
        return String.format(UNKNOWN_SPELL, spellId);
    }

    public static String formatUnknownTarget(String targetId) {
        return String.format(UNKNOWN_TARGET, targetId);
    }

    // ========== 探索叙述 ==========

    public static final String MOVED = "向 %s 移动了 %d 格，到达 (%d, %d)";
    public static final String RESTED = "休息片刻，恢复了 %d 生命、%d 法力、%d 体力";
    public static final String ITEM_USED = "使用了 %s：%s";
    public static final String IMAGE_GENERATED = "场景插画已生成";
    public static final String NARRATIVE_GENERATED = "故事推进了";
    public static final String SESSION_CREATED = "冒险开始了";
    public static final String RESPAWNED = "你重新站了起来（生命 %d），失去了 %d 金币";
    public static final String UNDONE = "已撤销：%s";
    public static final String REDONE = "已重做：%s";

    public static String formatMoved(String direction, int distance, int x, int y) {
        return String.format(MOVED, direction, distance, x, y);
    }

    public static String formatRested(int hp, int mana, int stamina) {
        return String.format(RESTED, hp, mana, stamina);
    }

    public static String formatItemUsed(String itemId, String effect) {
        return String.format(ITEM_USED, itemId, effect);
    }

    public static String formatRespawned(int health, int goldLost) {
        return String.format(RESPAWNED, health, goldLost);
    }

    public static String formatUndone(String commandType) {
        return String.format(UNDONE, commandType);
    }

    public static String formatRedone(String commandType) {
        return String.format(REDONE, commandType);
    }

    // ========== 战斗叙述 ==========

    public static final String COMBAT_STARTED = "战斗开始！行动顺序：%s";
    public static final String AMBUSH_TITLE = "伏击";
    public static final String AMBUSH_NARRATION = "你遭到了伏击！敌人抢先行动。";
    public static final String COMBAT_TITLE = "战斗";
    public static final String ROUND_STARTED = "第 %d 回合开始";
    public static final String ATTACK_HIT = "%s 攻击 %s，造成 %d 点伤害";
    public static final String ATTACK_CRIT = "%s 对 %s 打出暴击，造成 %d 点伤害！";
    public static final String ATTACK_MISS = "%s 攻击 %s，但没有命中";
    public static final String DEFENDING = "%s 摆出防御姿态";
    public static final String FLEE_SUCCESS = "%s 成功逃离了战斗";
    public static final String FLEE_FAILED = "%s 试图逃跑，但失败了";
    public static final String HEALED = "%s 恢复了 %d 点生命";
    public static final String WAITED = "%s 按兵不动";
    public static final String DEFEATED = "%s 倒下了";
    public static final String STATUS_TICK = "%s 受到 %s 影响，生命变化 %d";
    public static final String VICTORY = "战斗胜利！获得 %d 经验、%d 金币";
    public static final String DEFEAT = "你被击败了……";
    public static final String FLED = "你脱离了战斗";

    public static String formatCombatStarted(List<String> order) {
        return String.format(COMBAT_STARTED, String.join(" → ", order));
    }

    public static String formatRoundStarted(int round) {
        return String.format(ROUND_STARTED, round);
    }

    public static String formatAttackHit(String attacker, String target, int damage) {
        return String.format(ATTACK_HIT, attacker, target, damage);
    }

    public static String formatAttackCrit(String attacker, String target, int damage) {
        return String.format(ATTACK_CRIT, attacker, target, damage);
    }

    public static String formatAttackMiss(String attacker, String target) {
        return String.format(ATTACK_MISS, attacker, target);
    }

    public static String formatDefending(String actor) {
        return String.format(DEFENDING, actor);
    }

    public static String formatFleeSuccess(String actor) {
        return String.format(FLEE_SUCCESS, actor);
    }

    public static String formatFleeFailed(String actor) {
        return String.format(FLEE_FAILED, actor);
    }

    public static String formatHealed(String actor, int amount) {
        return String.format(HEALED, actor, amount);
    }

    public static String formatWaited(String actor) {
        return String.format(WAITED, actor);
    }

    public static String formatDefeated(String name) {
        return String.format(DEFEATED, name);
    }

    public static String formatStatusTick(String name, String effect, int delta) {
        return String.format(STATUS_TICK, name, effect, delta);
    }

    public static String formatVictory(int experience, int gold) {
        return String.format(VICTORY, experience, gold);
    }
}
