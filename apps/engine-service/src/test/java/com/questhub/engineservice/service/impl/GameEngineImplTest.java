package com.questhub.engineservice.service.impl;

import com.questhub.engineservice.combat.CombatPhase;
import com.questhub.engineservice.combat.CombatSession;
import com.questhub.engineservice.combat.Combatant;
import com.questhub.engineservice.command.CommandResult;
import com.questhub.engineservice.command.CommandType;
import com.questhub.engineservice.common.error.CommandExecutionException;
import com.questhub.engineservice.common.error.CooldownActiveException;
import com.questhub.engineservice.common.error.EngineErrorCode;
import com.questhub.engineservice.common.error.EngineException;
import com.questhub.engineservice.common.error.LockBusyException;
import com.questhub.engineservice.common.error.NothingToRedoException;
import com.questhub.engineservice.common.error.NothingToUndoException;
import com.questhub.engineservice.common.error.SessionAccessDeniedException;
import com.questhub.engineservice.common.error.SessionLimitReachedException;
import com.questhub.engineservice.common.error.SessionNotFoundException;
import com.questhub.engineservice.common.error.ValidationException;
import com.questhub.engineservice.config.EngineProperties;
import com.questhub.engineservice.domain.enums.GamePhase;
import com.questhub.engineservice.domain.enums.NotificationType;
import com.questhub.engineservice.domain.model.CharacterState;
import com.questhub.engineservice.domain.model.GameSession;
import com.questhub.engineservice.domain.model.GameState;
import com.questhub.engineservice.domain.model.LocationState;
import com.questhub.engineservice.domain.model.Notification;
import com.questhub.engineservice.domain.model.SessionSettings;
import com.questhub.engineservice.service.event.EngineEventListener;
import com.questhub.engineservice.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GameEngineImplTest {

    private static final String USER = "user-1";

    private EngineFixture fx;
    private GameEngineImpl engine;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
        engine = fx.engine;
    }

    private String newSession() {
        SessionSettings settings = new SessionSettings();
        settings.setSeed(20240101L);
        return engine.createSession(USER, "hero", "勇者", settings).getSessionId();
    }

    private GameState stateOf(String sessionId) {
        return engine.getSession(sessionId).getState().copy();
    }

    /** 生命值足够高，战斗测试中不会被敌人击倒 */
    private String sturdyHeroSession() {
        CharacterState hero = CharacterState.newCharacter("hero", "勇者");
        hero.setMaxHealth(100_000);
        hero.setHealth(100_000);
        fx.characterRepository.save(hero);
        return newSession();
    }

    private CommandResult move(String sessionId, String direction) {
        return engine.executeCommand(sessionId, CommandType.MOVE, Map.of("direction", direction), USER);
    }

    @Nested
    @DisplayName("会话生命周期")
    class Lifecycle {

        @Test
        @DisplayName("新建会话使用默认角色并写入仓储")
        void createSession() {
            String id = newSession();

            GameSession s = engine.getSession(id);
            assertThat(s.getUserId()).isEqualTo(USER);
            assertThat(s.getState().getPhase()).isEqualTo(GamePhase.EXPLORATION);
            assertThat(s.getState().getCharacter().getHealth()).isEqualTo(100);
            assertThat(fx.sessionRepository.findById(id)).isPresent();
            assertThat(engine.getUserSessions(USER)).extracting(GameSession::getSessionId).containsExactly(id);
            assertThat(engine.getMetrics().totalSessions()).isEqualTo(1);
        }

        @Test
        @DisplayName("达到会话上限后拒绝新建")
        void sessionLimit() {
            EngineProperties props = new EngineProperties();
            props.setMaxConcurrentSessions(1);
            GameEngineImpl limited = new EngineFixture(props).engine;
            limited.createSession(USER, "a", null, null);

            assertThatThrownBy(() -> limited.createSession(USER, "b", null, null))
                    .isInstanceOf(SessionLimitReachedException.class)
                    .satisfies(e -> assertThat(((EngineException) e).isRetryable()).isTrue());
        }

        @Test
        @DisplayName("只有所属用户可以执行命令")
        void ownerOnly() {
            String id = newSession();
            assertThatThrownBy(() -> engine.executeCommand(id, CommandType.MOVE, Map.of("direction", "north"), "intruder"))
                    .isInstanceOf(SessionAccessDeniedException.class);
            assertThatThrownBy(() -> engine.undoCommand(id, "intruder"))
                    .isInstanceOf(SessionAccessDeniedException.class);
        }

        @Test
        @DisplayName("结束会话后保存角色并删除会话")
        void endSession() {
            String id = newSession();
            move(id, "east");

            engine.endSession(id, USER);

            assertThatThrownBy(() -> engine.getSession(id)).isInstanceOf(SessionNotFoundException.class);
            assertThat(fx.characterRepository.findById("hero"))
                    .hasValueSatisfying(c -> assertThat(c.getStamina()).isLessThan(80));
            assertThat(engine.isSessionLocked(id)).isFalse();
        }
    }

    @Nested
    @DisplayName("命令管线")
    class Pipeline {

        @Test
        @DisplayName("法力不足时施法返回校验错误，状态不变")
        void castHealWithoutMana() {
            CharacterState poor = CharacterState.newCharacter("hero", "勇者");
            poor.setMana(5);
            poor.setHealth(60);
            fx.characterRepository.save(poor);
            String id = newSession();
            GameState before = stateOf(id);
            long version = engine.getSession(id).getVersion();

            assertThatThrownBy(() -> engine.executeCommand(id, CommandType.CAST_SPELL, Map.of("spellId", "heal"), USER))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(e -> assertThat(((ValidationException) e).getReasons())
                            .anySatisfy(r -> assertThat(r).contains("法力不足")));

            assertThat(stateOf(id)).isEqualTo(before);
            assertThat(engine.getSession(id).getVersion()).isEqualTo(version);
            assertThat(engine.isSessionLocked(id)).isFalse();
        }

        @Test
        @DisplayName("探索中施法恢复生命并扣除法力")
        void castHealInExploration() {
            CharacterState hurt = CharacterState.newCharacter("hero", "勇者");
            hurt.setHealth(50);
            fx.characterRepository.save(hurt);
            String id = newSession();

            engine.executeCommand(id, CommandType.CAST_SPELL, Map.of(), USER);

            CharacterState c = engine.getSession(id).getState().getCharacter();
            assertThat(c.getHealth()).isEqualTo(75);
            assertThat(c.getMana()).isEqualTo(40);
        }

        @Test
        @DisplayName("冷却期内重复执行被拒绝，冷却结束后恢复")
        void cooldown() {
            String id = newSession();
            engine.executeCommand(id, CommandType.REST, Map.of(), USER);

            assertThatThrownBy(() -> engine.executeCommand(id, CommandType.REST, Map.of(), USER))
                    .isInstanceOf(CooldownActiveException.class)
                    .satisfies(e -> assertThat(((CooldownActiveException) e).getRemainingMs()).isEqualTo(60_000L));

            fx.clock.advance(Duration.ofSeconds(60));
            assertThat(engine.executeCommand(id, CommandType.REST, Map.of(), USER).isSuccess()).isTrue();
        }

        @Test
        @DisplayName("AI 服务失败包装为 CommandExecutionException，不扣费也不记冷却")
        void aiFailureIsWrapped() {
            String id = newSession();
            when(fx.narrativeService.generateImage(any())).thenThrow(new IllegalStateException("AI_IMAGE_FAILED: timeout"));

            assertThatThrownBy(() -> engine.executeCommand(id, CommandType.GENERATE_IMAGE, Map.of(), USER))
                    .isInstanceOf(CommandExecutionException.class)
                    .hasCauseInstanceOf(IllegalStateException.class)
                    .satisfies(e -> assertThat(((EngineException) e).getCode()).isEqualTo(EngineErrorCode.COMMAND_EXECUTION_ERROR));
            assertThatThrownBy(() -> engine.executeCommand(id, CommandType.GENERATE_IMAGE, Map.of(), USER))
                    .isInstanceOf(CommandExecutionException.class);

            assertThat(engine.getSession(id).getState().getCharacter().getMana()).isEqualTo(50);
            assertThat(engine.getMetrics().failedCommands()).isEqualTo(2);
        }

        @Test
        @DisplayName("AI 生成成功时写入地点状态")
        void imageGenerated() {
            String id = newSession();
            when(fx.narrativeService.generateImage(any())).thenReturn("https://img/1.png");

            CommandResult r = engine.executeCommand(id, CommandType.GENERATE_IMAGE, Map.of(), USER);

            assertThat(r.getExtras()).containsEntry("imageUrl", "https://img/1.png");
            GameState s = engine.getSession(id).getState();
            assertThat(s.getLocation().getLastImageUrl()).isEqualTo("https://img/1.png");
            assertThat(s.getCharacter().getMana()).isEqualTo(45);
        }

        @Test
        @DisplayName("AI 关闭时 AI 命令校验失败")
        void aiDisabled() {
            fx.properties.setAiEnabled(false);
            String id = newSession();
            assertThatThrownBy(() -> engine.executeCommand(id, CommandType.GENERATE_NARRATIVE, Map.of(), USER))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("提交的日志进入有界事件历史")
        void eventHistoryBounded() {
            fx.properties.setMaxEventHistorySize(3);
            String id = newSession();
            for (int i = 0; i < 5; i++) {
                move(id, "north");
            }
            assertThat(engine.getSession(id).getEventHistory()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("会话锁")
    class Locking {

        @Test
        @DisplayName("同一会话并发执行时，后到者立即收到 LockBusy")
        void concurrentCommandsAreExclusive() throws Exception {
            String id = newSession();
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(fx.narrativeService.generateNarrative(any())).thenAnswer(inv -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return "风从北方吹来。";
            });

            CompletableFuture<CommandResult> slow = CompletableFuture.supplyAsync(
                    () -> engine.executeCommand(id, CommandType.GENERATE_NARRATIVE, Map.of(), USER));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(engine.isSessionLocked(id)).isTrue();
            assertThatThrownBy(() -> move(id, "north"))
                    .isInstanceOf(LockBusyException.class)
                    .satisfies(e -> assertThat(((EngineException) e).isRetryable()).isTrue());

            release.countDown();
            assertThat(slow.get(5, TimeUnit.SECONDS).isSuccess()).isTrue();
            assertThat(engine.isSessionLocked(id)).isFalse();
            assertThat(engine.getSession(id).getState().getLocation().getLastNarrative()).isEqualTo("风从北方吹来。");
            assertThat(engine.getMetrics().lockBusyRejections()).isEqualTo(1);
        }

        @Test
        @DisplayName("强制释放后无需等待 TTL 即可执行")
        void forceReleaseUnblocks() {
            String id = newSession();
            fx.lock.acquire(id);
            fx.clock.advance(Duration.ofSeconds(1));
            assertThatThrownBy(() -> move(id, "north")).isInstanceOf(LockBusyException.class);

            assertThat(engine.forceReleaseSessionLock(id)).isTrue();

            assertThat(engine.isSessionLocked(id)).isFalse();
            assertThat(move(id, "north").isSuccess()).isTrue();
        }

        @Test
        @DisplayName("命令失败后锁仍被释放")
        void lockReleasedOnFailure() {
            String id = newSession();
            assertThatThrownBy(() -> move(id, "up")).isInstanceOf(ValidationException.class);
            assertThat(engine.getSessionLockInfo(id)).isEmpty();
        }
    }

    @Nested
    @DisplayName("撤销 / 重做")
    class UndoRedo {

        @Test
        @DisplayName("撤销后重做恢复到完全相同的状态")
        void roundTrip() {
            String id = newSession();
            GameState before = stateOf(id);
            move(id, "north");
            GameState after = stateOf(id);
            assertThat(after).isNotEqualTo(before);

            engine.undoCommand(id, USER);
            assertThat(stateOf(id)).isEqualTo(before);

            engine.redoCommand(id, USER);
            assertThat(stateOf(id)).isEqualTo(after);
        }

        @Test
        @DisplayName("撤销与重做替换状态引用，不修改读者已拿到的状态对象")
        void undoReplacesStateReference() {
            String id = newSession();
            move(id, "north");
            GameState seen = engine.getSession(id).getState();
            GameState snapshot = seen.copy();

            engine.undoCommand(id, USER);
            assertThat(engine.getSession(id).getState()).isNotSameAs(seen);
            assertThat(seen).isEqualTo(snapshot);

            GameState afterUndo = engine.getSession(id).getState();
            GameState afterUndoSnapshot = afterUndo.copy();
            engine.redoCommand(id, USER);
            assertThat(engine.getSession(id).getState()).isNotSameAs(afterUndo).isEqualTo(snapshot);
            assertThat(afterUndo).isEqualTo(afterUndoSnapshot);
        }

        @Test
        @DisplayName("撤销栈超出上限时丢弃最旧的条目")
        void boundedFifo() {
            fx.properties.setMaxUndoStackSize(3);
            String id = newSession();
            List<LocationState> positions = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                move(id, "east");
                positions.add(stateOf(id).getLocation());
            }
            assertThat(engine.getSession(id).getUndoStack()).hasSize(3);

            for (int i = 0; i < 3; i++) {
                engine.undoCommand(id, USER);
            }
            // 最早的两条已被丢弃，只能回到第二次移动之后
            assertThat(stateOf(id).getLocation()).isEqualTo(positions.get(1));
            assertThatThrownBy(() -> engine.undoCommand(id, USER)).isInstanceOf(NothingToUndoException.class);
        }

        @Test
        @DisplayName("新命令提交后重做栈清空")
        void newCommandClearsRedo() {
            String id = newSession();
            move(id, "north");
            engine.undoCommand(id, USER);
            move(id, "south");
            assertThatThrownBy(() -> engine.redoCommand(id, USER)).isInstanceOf(NothingToRedoException.class);
        }

        @Test
        @DisplayName("不可撤销的命令是历史屏障")
        void nonUndoableIsBarrier() {
            String id = newSession();
            move(id, "north");
            engine.executeCommand(id, CommandType.START_COMBAT, Map.of("enemyIds", List.of("enemy_giant_rat")), USER);

            assertThatThrownBy(() -> engine.undoCommand(id, USER)).isInstanceOf(NothingToUndoException.class);
            assertThatThrownBy(() -> engine.redoCommand(id, USER)).isInstanceOf(NothingToRedoException.class);
        }

        @Test
        @DisplayName("空栈撤销")
        void nothingToUndo() {
            String id = newSession();
            assertThatThrownBy(() -> engine.undoCommand(id, USER)).isInstanceOf(NothingToUndoException.class);
        }
    }

    @Nested
    @DisplayName("战斗")
    class Combat {

        @Test
        @DisplayName("开战后战斗中的命令不可撤销，战斗结束后回到探索阶段")
        void fightUntilResolved() {
            String id = newSession();
            CommandResult started = engine.executeCommand(id, CommandType.START_COMBAT,
                    Map.of("enemyIds", "enemy_giant_rat"), USER);
            assertThat(engine.getSession(id).getState().getPhase()).isIn(GamePhase.COMBAT, GamePhase.EXPLORATION);

            // 敌人先攻时可能在开战命令内就逃走
            String outcome = (String) started.getExtras().get("combatOutcome");
            for (int i = 0; i < 30 && engine.getSession(id).getState().getCombat() != null; i++) {
                CommandResult r = engine.executeCommand(id, CommandType.ATTACK, Map.of(), USER);
                assertThatThrownBy(() -> engine.undoCommand(id, USER)).isInstanceOf(NothingToUndoException.class);
                outcome = (String) r.getExtras().get("combatOutcome");
            }

            GameState s = engine.getSession(id).getState();
            assertThat(s.getCombat()).isNull();
            assertThat(s.getPhase()).isEqualTo(GamePhase.EXPLORATION);
            assertThat(outcome).isIn("VICTORY", "DEFEAT", "FLED");
            assertThat(s.getCharacter().getExperience()).isNotNegative();
        }

        @Test
        @DisplayName("战斗中不能移动，也不能重复开战")
        void phaseGuards() {
            String id = newSession();
            engine.executeCommand(id, CommandType.START_COMBAT,
                    Map.of("enemyIds", List.of("enemy_orc_berserker", "enemy_skeleton")), USER);

            assertThatThrownBy(() -> move(id, "north")).isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> engine.executeCommand(id, CommandType.START_COMBAT,
                    Map.of("enemyIds", "enemy_wolf"), USER)).isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("isAmbush=true 时所有敌人排在玩家之前，并发出伏击警告")
        void ambushPutsEnemiesFirst() {
            String id = sturdyHeroSession();

            CommandResult r = engine.executeCommand(id, CommandType.START_COMBAT, Map.of(
                    "enemyIds", List.of("enemy_giant_rat", "enemy_giant_rat", "enemy_giant_rat"),
                    "isAmbush", true,
                    "locationId", "dark_cave"), USER);

            CombatSession combat = engine.getSession(id).getState().getCombat();
            assertThat(combat.isAmbush()).isTrue();
            assertThat(combat.getLocationId()).isEqualTo("dark_cave");
            List<Combatant> order = combat.getCombatants();
            assertThat(order.get(order.size() - 1).isPlayer()).isTrue();
            assertThat(order.subList(0, order.size() - 1)).noneMatch(Combatant::isPlayer);
            assertThat(r.getNotifications()).extracting(Notification::getType).contains(NotificationType.WARNING);
        }

        @Test
        @DisplayName("未指定 locationId 时沿用当前位置")
        void locationDefaultsToCurrent() {
            String id = sturdyHeroSession();
            String here = engine.getSession(id).getState().getLocation().getLocationId();

            engine.executeCommand(id, CommandType.START_COMBAT, Map.of("enemyIds", "enemy_giant_rat"), USER);

            assertThat(engine.getSession(id).getState().getCombat().getLocationId()).isEqualTo(here);
        }

        @Test
        @DisplayName("敌人数量超过十个时，开战后仍能轮到玩家行动")
        void manyEnemiesStillReachPlayer() {
            String id = sturdyHeroSession();
            List<String> wolves = Collections.nCopies(12, "enemy_wolf");

            engine.executeCommand(id, CommandType.START_COMBAT, Map.of("enemyIds", wolves, "isAmbush", true), USER);

            CombatSession combat = engine.getSession(id).getState().getCombat();
            assertThat(combat.getEnemies()).hasSize(12);
            assertThat(combat.getPhase()).isEqualTo(CombatPhase.PLAYER_TURN);
            assertThat(combat.getCurrentCombatant().isPlayer()).isTrue();
            assertThat(engine.executeCommand(id, CommandType.DEFEND, Map.of(), USER).isSuccess()).isTrue();
            assertThat(engine.getSession(id).getState().getCombat().getCurrentCombatant().isPlayer()).isTrue();
        }

        @Test
        @DisplayName("开战缺少敌人列表时校验失败")
        void startCombatNeedsEnemies() {
            String id = newSession();
            assertThatThrownBy(() -> engine.executeCommand(id, CommandType.START_COMBAT, Map.of(), USER))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Test
    @DisplayName("监听器收到成功与失败事件，监听器抛错不影响命令")
    void listeners() {
        EngineEventListener listener = mock(EngineEventListener.class);
        engine.addListener(listener);
        engine.addListener(new EngineEventListener() {
            @Override
            public void onCommandExecuted(String sessionId, CommandType type, CommandResult result) {
                throw new IllegalStateException("listener bug");
            }
        });
        String id = newSession();

        CommandResult r = move(id, "north");
        assertThatThrownBy(() -> move(id, "nowhere")).isInstanceOf(ValidationException.class);

        verify(listener).onCommandExecuted(id, CommandType.MOVE, r);
        verify(listener).onCommandFailed(org.mockito.ArgumentMatchers.eq(id),
                org.mockito.ArgumentMatchers.eq(CommandType.MOVE), any(ValidationException.class));
        assertThat(engine.getMetrics().totalCommandsExecuted()).isEqualTo(1);
        assertThat(engine.getMetrics().errorRate()).isEqualTo(0.5);
    }
}
